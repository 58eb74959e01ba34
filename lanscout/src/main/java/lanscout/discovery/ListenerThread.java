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

package lanscout.discovery;

import lanscout.LanScoutConstants;
import lanscout.net.SsdpSocket;
import lanscout.util.LoopThread;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Optional;

/**
 * Reads responses off the shared socket and hands parsed devices to the engine.  The read
 * times out regularly so a stop is noticed without closing the socket under us.
 */
class ListenerThread extends LoopThread {
  private static final Logger LOG = LoggerFactory.getLogger(ListenerThread.class);

  private final DiscoveryEngine engine;
  private final SsdpSocket socket;
  private final SsdpResponseParser parser;
  private final long readTimeoutMillis;
  private final ByteBuffer buffer = ByteBuffer.allocate(LanScoutConstants.MAX_DATAGRAM_SIZE);

  ListenerThread(DiscoveryEngine engine, SsdpSocket socket, SsdpResponseParser parser, long readTimeoutMillis) {
    super("ssdpListen");
    this.engine = engine;
    this.socket = socket;
    this.parser = parser;
    this.readTimeoutMillis = readTimeoutMillis;
  }

  @Override
  public void run() {
    notifyStarted();

    try {
      while (engine.shouldListenerRun(this)) {
        int received;
        try {
          received = socket.receive(buffer, readTimeoutMillis);
        } catch (IOException e) {
          LOG.error("Error reading SSDP responses, exiting the listen thread", e);
          engine.listenerFailed(this);
          break;
        }

        if (received == 0) {
          continue;
        }

        Optional<DiscoveredDevice> device =
            parser.parse(buffer.array(), buffer.arrayOffset() + buffer.position(), received);
        if (!device.isPresent()) {
          LOG.warn("Unable to parse SSDP response of {} bytes", received);
          continue;
        }

        engine.deliver(device.get());
      }
    } catch (Throwable t) {
      engine.listenerFailed(this);
      notifyCrashed(t);
      return;
    }

    LOG.debug("SSDP listen thread exiting");
    notifyStopped();
  }
}
