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

import com.google.common.base.Splitter;
import com.google.common.net.HostAndPort;
import lanscout.interfaces.HardwareAddressResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Turns the text of one discovery response into a {@link DiscoveredDevice}.
 * <p>
 * A response looks something like:
 * <pre>
 *   HTTP/1.1 200 OK
 *   CACHE-CONTROL: max-age=1800
 *   LOCATION: http://172.16.12.151:6789/device.xml
 *   SERVER: Linux/2.4.19-pl1029 UPnP/1.0 Intel UPnP SDK/1.0
 *   ST: urn:schemas-upnp-org:device:Wireless Network Camera:1
 *   USN: uuid:upnp-Linksys_Wireless Network Camera-0021297e5a85::urn:...
 * </pre>
 * Vendor framed notifies carry {@code TYPE: WM-NOTIFY}, {@code SERVICE:} and {@code URL:}
 * lines instead.  All we need is the address and enough headers to classify the device;
 * everything else is ignored.
 */
public class SsdpResponseParser {
  private static final Logger LOG = LoggerFactory.getLogger(SsdpResponseParser.class);

  static final int DEFAULT_HTTP_PORT = 80;
  static final int DEFAULT_HTTPS_PORT = 443;

  // a known bridge vendor doesn't echo the ST it was asked for, but always says this in its banner
  static final String BRIDGE_BANNER_MARKER = "IpBridge";

  private static final String VENDOR_NOTIFY_MARKER = "TYPE: WM-NOTIFY";
  private static final String HTTP_SCHEME = "http://";
  private static final String HTTPS_SCHEME = "https://";

  private static final Splitter LINE_SPLITTER = Splitter.on('\n').omitEmptyStrings();

  private final HardwareAddressResolver addressResolver;

  public SsdpResponseParser(HardwareAddressResolver addressResolver) {
    this.addressResolver = addressResolver;
  }

  public Optional<DiscoveredDevice> parse(byte[] data, int offset, int length) {
    return parse(new String(data, offset, length, StandardCharsets.UTF_8));
  }

  /**
   * @return the device, or empty if no host address could be taken from the response
   */
  public Optional<DiscoveredDevice> parse(String response) {
    LOG.trace("{}", response);

    DiscoveredDevice.Builder builder = DiscoveredDevice.newBuilder();
    String searchTarget = null;
    String url = null;
    String server = null;
    boolean vendorNotify = false;

    for (String line : LINE_SPLITTER.split(response)) {
      if (startsWithIgnoreCase(line, "ST:") || startsWithIgnoreCase(line, "NT:")) {
        searchTarget = restOfLine(line, 3);
        builder.setSearchTarget(searchTarget);
      } else if (startsWithIgnoreCase(line, "USN:")) {
        builder.setUniqueServiceName(restOfLine(line, 4));
      } else if (startsWithIgnoreCase(line, "LOCATION:")) {
        url = restOfLine(line, 9);
      } else if (startsWithIgnoreCase(line, "URL:")) {
        url = restOfLine(line, 4);
      } else if (startsWithIgnoreCase(line, "SERVER:")) {
        server = restOfLine(line, 7);
        builder.setServer(server);
      } else if (startsWithIgnoreCase(line, "SERVICE:")) {
        builder.setVendorServiceName(restOfLine(line, 8));
      } else if (startsWithIgnoreCase(line, VENDOR_NOTIFY_MARKER)) {
        vendorNotify = true;
      }
    }

    builder.setType(classify(searchTarget, server, vendorNotify));

    if (url == null) {
      LOG.warn("Failed to get ip address for discovered device, response has no location");
      return Optional.empty();
    }
    builder.setUrl(url);

    Optional<HostAndPort> hostAndPort = parseLocation(url);
    if (!hostAndPort.isPresent()) {
      LOG.warn("Failed to get ip address for discovered device from location {}", url);
      return Optional.empty();
    }

    String ipAddress = hostAndPort.get().getHost();
    builder.setIpAddress(ipAddress)
        .setPort(hostAndPort.get().getPort());

    Optional<String> macAddress = addressResolver.lookup(ipAddress);
    if (macAddress.isPresent()) {
      builder.setMacAddress(macAddress.get());
    } else {
      LOG.debug("No mac address known for {}", ipAddress);
    }

    return Optional.of(builder.build());
  }

  static DeviceType classify(String searchTarget, String server, boolean vendorNotify) {
    DeviceType type = SearchTargets.classify(searchTarget);
    if (type != DeviceType.UNKNOWN) {
      return type;
    }
    if (server != null && server.contains(BRIDGE_BANNER_MARKER)) {
      return DeviceType.PHILIPS_HUE;
    }
    if (vendorNotify) {
      // the only vendor framed search so far is the thermostat
      return DeviceType.RTCOA;
    }
    return DeviceType.UNKNOWN;
  }

  /**
   * Pull the host and port out of a LOCATION/URL value.  Handles {@code host:port/path},
   * {@code host/path} and a bare {@code host}, with or without an http(s) scheme.  Without a
   * port the scheme's default is used, 80 when there is no scheme.
   */
  static Optional<HostAndPort> parseLocation(String url) {
    String rest = url.trim();
    int defaultPort = DEFAULT_HTTP_PORT;
    if (startsWithIgnoreCase(rest, HTTP_SCHEME)) {
      rest = rest.substring(HTTP_SCHEME.length());
    } else if (startsWithIgnoreCase(rest, HTTPS_SCHEME)) {
      rest = rest.substring(HTTPS_SCHEME.length());
      defaultPort = DEFAULT_HTTPS_PORT;
    }

    int pathStart = rest.indexOf('/');
    String authority = pathStart >= 0 ? rest.substring(0, pathStart) : rest;

    String host = authority;
    int port = defaultPort;
    int portStart = authority.indexOf(':');
    if (portStart >= 0) {
      host = authority.substring(0, portStart);
      String portText = authority.substring(portStart + 1);
      if (!portText.isEmpty()) {
        try {
          port = Integer.parseInt(portText);
        } catch (NumberFormatException e) {
          return Optional.empty();
        }
      }
    }

    if (host.isEmpty()) {
      return Optional.empty();
    }

    try {
      return Optional.of(HostAndPort.fromParts(host, port));
    } catch (IllegalArgumentException e) {
      LOG.debug("Unusable host/port {} {}", host, port, e);
      return Optional.empty();
    }
  }

  private static boolean startsWithIgnoreCase(String line, String prefix) {
    return line.regionMatches(true, 0, prefix, 0, prefix.length());
  }

  private static String restOfLine(String line, int start) {
    return line.substring(start).trim();
  }
}
