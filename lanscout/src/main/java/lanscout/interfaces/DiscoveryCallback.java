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

package lanscout.interfaces;

import lanscout.discovery.DiscoveredDevice;

/**
 * Receives devices found by a search started with
 * {@link lanscout.discovery.DiscoveryEngine#startDiscovery}.  Invoked from a callback pool
 * thread, never from the network loops, once per newly seen device address.
 */
public interface DiscoveryCallback {

  void deviceDiscovered(DiscoveredDevice device);
}
