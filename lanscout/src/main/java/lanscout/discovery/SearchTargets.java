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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.Locale;
import java.util.Optional;

/**
 * The fixed table of what goes on the wire for each searchable {@link DeviceType}, and the
 * reverse lookup used to classify responses by their ST/NT header.
 */
public class SearchTargets {
  public static final String OPENHOME_CAMERA_ST = "urn:schemas-upnp-org:device:OpenHome Camera:1";
  public static final String WIRELESS_NETWORK_CAMERA_ST = "urn:schemas-upnp-org:device:Wireless Network Camera:1";
  public static final String WIFI_ST = "urn:schemas-upnp-org:device:InternetGatewayDevice:1";
  public static final String ROUTER_ST = "urn:schemas-upnp-org:service:WANIPConnection:1";
  public static final String PHILIPS_HUE_ST = "libhue:idl";
  public static final String SONOS_ST = "urn:smartspeaker-audio:service:SpeakerGroup:1";

  // vendor service names end in a wildcard
  public static final String RTCOA_SERVICE_NAME = "com.rtcoa.tstat*";

  private static final ImmutableMap<DeviceType, SearchTargets> SEARCHABLE =
      ImmutableMap.<DeviceType, SearchTargets>builder()
          .put(DeviceType.CAMERA, new SearchTargets(SearchCategory.STANDARD,
              ImmutableList.of(OPENHOME_CAMERA_ST, WIRELESS_NETWORK_CAMERA_ST)))
          .put(DeviceType.PHILIPS_HUE, new SearchTargets(SearchCategory.STANDARD,
              ImmutableList.of(PHILIPS_HUE_ST)))
          .put(DeviceType.RTCOA, new SearchTargets(SearchCategory.VENDOR,
              ImmutableList.of(RTCOA_SERVICE_NAME)))
          .put(DeviceType.SONOS, new SearchTargets(SearchCategory.STANDARD,
              ImmutableList.of(SONOS_ST)))
          .build();

  // keys are lower case, lookups are case insensitive
  private static final ImmutableMap<String, DeviceType> CLASSIFICATION =
      ImmutableMap.<String, DeviceType>builder()
          .put(lowerCase(WIFI_ST), DeviceType.WIFI)
          .put(lowerCase(ROUTER_ST), DeviceType.ROUTER)
          .put(lowerCase(SONOS_ST), DeviceType.SONOS)
          .put(lowerCase(WIRELESS_NETWORK_CAMERA_ST), DeviceType.CAMERA)
          .put(lowerCase(OPENHOME_CAMERA_ST), DeviceType.CAMERA)
          .build();

  private final SearchCategory category;
  private final ImmutableList<String> targets;

  private SearchTargets(SearchCategory category, ImmutableList<String> targets) {
    this.category = category;
    this.targets = targets;
  }

  /**
   * @return the targets to broadcast for {@code type}, or empty if the type can't be searched for
   */
  public static Optional<SearchTargets> forType(DeviceType type) {
    return Optional.ofNullable(SEARCHABLE.get(type));
  }

  /**
   * Exact, case insensitive match of a response's search target against the known standard
   * targets.
   */
  public static DeviceType classify(String searchTarget) {
    if (searchTarget == null) {
      return DeviceType.UNKNOWN;
    }
    DeviceType type = CLASSIFICATION.get(lowerCase(searchTarget));
    return type == null ? DeviceType.UNKNOWN : type;
  }

  public SearchCategory getCategory() {
    return category;
  }

  public ImmutableList<String> getTargets() {
    return targets;
  }

  private static String lowerCase(String s) {
    return s.toLowerCase(Locale.ROOT);
  }

  @Override
  public String toString() {
    return "SearchTargets{" +
        "category=" + category +
        ", targets=" + targets +
        '}';
  }
}
