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

import java.util.Optional;

/**
 * Maps an IP address on the local segment to the hardware (MAC) address of the host
 * that owns it.
 */
public interface HardwareAddressResolver {

  /**
   * @return the MAC address, formatted as found, or empty if the address is not known
   */
  Optional<String> lookup(String ipAddress);
}
