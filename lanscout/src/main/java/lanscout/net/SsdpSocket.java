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

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;

/**
 * The datagram socket shared by every search of an engine.  One thread sends and one thread
 * receives; close is only called once both have stopped.
 */
public interface SsdpSocket extends Closeable {

  void send(String message, InetSocketAddress recipient) throws IOException;

  /**
   * Wait up to {@code timeoutMillis} for a datagram and read it into {@code buffer}, which is
   * cleared first and flipped for reading afterwards.
   *
   * @return the number of bytes read, 0 if nothing arrived in time
   * @throws IOException if the socket is broken
   */
  int receive(ByteBuffer buffer, long timeoutMillis) throws IOException;
}
