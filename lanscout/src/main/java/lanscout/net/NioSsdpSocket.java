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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.StandardProtocolFamily;
import java.net.StandardSocketOptions;
import java.nio.ByteBuffer;
import java.nio.channels.DatagramChannel;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.charset.StandardCharsets;

/**
 * {@link SsdpSocket} on a non-blocking NIO datagram channel.  Reads poll a selector so the
 * listener can wake up periodically and check whether it should still be running.
 */
public class NioSsdpSocket implements SsdpSocket {
  private static final Logger LOG = LoggerFactory.getLogger(NioSsdpSocket.class);

  private final DatagramChannel channel;
  private final Selector selector;

  private NioSsdpSocket(DatagramChannel channel, Selector selector) {
    this.channel = channel;
    this.selector = selector;
  }

  public static NioSsdpSocket open(int bindPort) throws IOException {
    DatagramChannel channel = DatagramChannel.open(StandardProtocolFamily.INET);
    Selector selector = null;
    try {
      channel.setOption(StandardSocketOptions.SO_REUSEADDR, true);
      channel.bind(new InetSocketAddress(bindPort));
      channel.configureBlocking(false);

      selector = Selector.open();
      channel.register(selector, SelectionKey.OP_READ);
    } catch (IOException | RuntimeException e) {
      if (selector != null) {
        selector.close();
      }
      channel.close();
      throw e;
    }

    LOG.info("SSDP socket on {} ready", channel.getLocalAddress());
    return new NioSsdpSocket(channel, selector);
  }

  public int getLocalPort() throws IOException {
    return ((InetSocketAddress) channel.getLocalAddress()).getPort();
  }

  @Override
  public void send(String message, InetSocketAddress recipient) throws IOException {
    ByteBuffer data = ByteBuffer.wrap(message.getBytes(StandardCharsets.UTF_8));
    int sent = channel.send(data, recipient);
    if (sent == 0) {
      // no room in the send buffer; datagrams get lost anyway, the next beacon covers it
      LOG.warn("Send buffer full, dropped {} byte datagram to {}", data.remaining(), recipient);
    }
  }

  @Override
  public int receive(ByteBuffer buffer, long timeoutMillis) throws IOException {
    int numKeys = selector.select(timeoutMillis);
    selector.selectedKeys().clear();
    if (numKeys == 0) {
      return 0;
    }

    buffer.clear();
    SocketAddress sender = channel.receive(buffer);
    if (sender == null) {
      LOG.debug("read key for empty read");
      return 0;
    }
    buffer.flip();
    LOG.trace("read {} bytes from {}", buffer.remaining(), sender);
    return buffer.remaining();
  }

  @Override
  public void close() throws IOException {
    try {
      selector.close();
    } finally {
      channel.close();
    }
  }
}
