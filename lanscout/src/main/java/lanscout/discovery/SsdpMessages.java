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

import java.net.InetSocketAddress;
import java.util.Locale;

/**
 * Request framings sent by the beacon thread.
 */
public class SsdpMessages {
  private static final String M_SEARCH_FORMAT =
      "M-SEARCH * HTTP/1.1\r\n" +
          "HOST: %s:%d\r\n" +
          "ST: %s\r\n" +
          "MAN: \"ssdp:discover\"\r\n" +
          "MX: %d\r\n" +
          "\r\n";

  private static final String VENDOR_DISCOVER_FORMAT =
      "TYPE: WM-DISCOVER\r\n" +
          "VERSION: 1.0\r\n" +
          "\r\n" +
          "services: %s\r\n" +
          "\r\n";

  private SsdpMessages() {
  }

  public static String searchRequest(InetSocketAddress group, String searchTarget) {
    return String.format(Locale.ROOT, M_SEARCH_FORMAT, group.getHostString(), group.getPort(), searchTarget,
        LanScoutConstants.M_SEARCH_MAX_WAIT_SECONDS);
  }

  public static String vendorDiscoverRequest(String serviceName) {
    return String.format(Locale.ROOT, VENDOR_DISCOVER_FORMAT, serviceName);
  }

  public static String requestFor(SearchCategory category, InetSocketAddress group, String target) {
    switch (category) {
      case STANDARD:
        return searchRequest(group, target);
      case VENDOR:
        return vendorDiscoverRequest(target);
      default:
        throw new IllegalArgumentException("no framing for " + category);
    }
  }
}
