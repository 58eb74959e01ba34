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

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;

import java.util.List;
import java.util.Optional;

/**
 * MAC address helpers.  ARP tables on some platforms drop leading zeros, so
 * {@code 0:e:8f:e9:93:f9} and {@code 00:0E:8F:E9:93:F9} are the same address; compare the
 * bytes, not the strings.
 */
public class MacAddresses {
  public static final int MAC_ADDRESS_LENGTH = 6;

  private static final Splitter OCTET_SPLITTER = Splitter.onPattern("[:-]");
  private static final CharMatcher HEX_DIGITS = CharMatcher.anyOf("0123456789abcdefABCDEF");

  private MacAddresses() {
  }

  /**
   * Parse {@code 00:0e:8f:e9:93:f9}, {@code 0:e:8f:e9:93:f9}, {@code 00-0e-...} or
   * {@code 000e8fe993f9}.
   *
   * @return the six address bytes, or empty if {@code macAddress} isn't a MAC address
   */
  public static Optional<byte[]> toBytes(String macAddress) {
    if (macAddress == null) {
      return Optional.empty();
    }
    String trimmed = macAddress.trim();
    if (trimmed.isEmpty()) {
      return Optional.empty();
    }

    byte[] bytes = new byte[MAC_ADDRESS_LENGTH];
    if (trimmed.indexOf(':') < 0 && trimmed.indexOf('-') < 0) {
      if (trimmed.length() != MAC_ADDRESS_LENGTH * 2) {
        return Optional.empty();
      }
      for (int i = 0; i < MAC_ADDRESS_LENGTH; i++) {
        Optional<Byte> octet = parseOctet(trimmed.substring(i * 2, i * 2 + 2));
        if (!octet.isPresent()) {
          return Optional.empty();
        }
        bytes[i] = octet.get();
      }
      return Optional.of(bytes);
    }

    List<String> octets = OCTET_SPLITTER.splitToList(trimmed);
    if (octets.size() != MAC_ADDRESS_LENGTH) {
      return Optional.empty();
    }
    for (int i = 0; i < MAC_ADDRESS_LENGTH; i++) {
      Optional<Byte> octet = parseOctet(octets.get(i));
      if (!octet.isPresent()) {
        return Optional.empty();
      }
      bytes[i] = octet.get();
    }
    return Optional.of(bytes);
  }

  private static Optional<Byte> parseOctet(String octet) {
    if (octet.isEmpty() || octet.length() > 2 || !HEX_DIGITS.matchesAllOf(octet)) {
      return Optional.empty();
    }
    try {
      return Optional.of((byte) Integer.parseInt(octet, 16));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }
}
