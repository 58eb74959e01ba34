/*
 * Copyright 2014 WANdisco
 *
 *  WANdisco licenses this file to you under the Apache License,
 *  version 2.0 (the "License"); you may not use this file except in compliance
 *  with the License. You may obtain a copy of the License at:
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 *  WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 *  License for the specific language governing permissions and limitations
 *  under the License.
 */

package lanscout.net;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * In memory stand-in for the SSDP socket.  Tests read what the engine sent and push responses
 * for it to receive, and can break either direction.
 */
public class FakeSsdpSocket implements SsdpSocket {
  private final BlockingQueue<String> sent = new LinkedBlockingQueue<>();
  private final BlockingQueue<byte[]> inbound = new LinkedBlockingQueue<>();

  private volatile boolean sendBroken;
  private volatile boolean receiveBroken;
  private volatile boolean closed;

  @Override
  public void send(String message, InetSocketAddress recipient) throws IOException {
    if (closed) {
      throw new IOException("socket closed");
    }
    if (sendBroken) {
      throw new IOException("network is unreachable");
    }
    sent.add(message);
  }

  @Override
  public int receive(ByteBuffer buffer, long timeoutMillis) throws IOException {
    if (closed) {
      throw new IOException("socket closed");
    }
    if (receiveBroken) {
      throw new IOException("connection refused");
    }

    byte[] datagram;
    try {
      datagram = inbound.poll(timeoutMillis, TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException(e);
    }

    buffer.clear();
    if (datagram == null) {
      buffer.flip();
      return 0;
    }
    buffer.put(datagram);
    buffer.flip();
    return datagram.length;
  }

  @Override
  public void close() {
    closed = true;
  }

  public void respond(String response) {
    inbound.add(response.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * @return the next message the engine sent, or null if none was sent within the timeout
   */
  public String nextSent(long timeout, TimeUnit unit) throws InterruptedException {
    return sent.poll(timeout, unit);
  }

  public void clearSent() {
    sent.clear();
  }

  public void breakSend() {
    sendBroken = true;
  }

  public void breakReceive() {
    receiveBroken = true;
  }

  public boolean isClosed() {
    return closed;
  }
}
