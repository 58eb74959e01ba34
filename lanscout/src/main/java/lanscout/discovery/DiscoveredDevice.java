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

import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Strings.isNullOrEmpty;
import static com.google.common.base.Strings.nullToEmpty;

/**
 * A device as described by one discovery response.  Immutable, so the listener hands the same
 * instance to every callback that should see it.
 * <p>
 * The header values are the raw text from the response and are null when the response
 * didn't carry that header.  The IP address is always present; the MAC address is an empty
 * string when it couldn't be resolved.
 */
public class DiscoveredDevice {
  private final String ipAddress;
  private final String macAddress;
  private final int port;
  private final String searchTarget;
  private final String uniqueServiceName;
  private final String url;
  private final String server;
  private final String vendorServiceName;
  private final DeviceType type;

  private DiscoveredDevice(Builder builder) {
    this.ipAddress = builder.ipAddress;
    this.macAddress = nullToEmpty(builder.macAddress);
    this.port = builder.port;
    this.searchTarget = builder.searchTarget;
    this.uniqueServiceName = builder.uniqueServiceName;
    this.url = builder.url;
    this.server = builder.server;
    this.vendorServiceName = builder.vendorServiceName;
    this.type = builder.type;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public String getIpAddress() {
    return ipAddress;
  }

  public String getMacAddress() {
    return macAddress;
  }

  public int getPort() {
    return port;
  }

  /** ST (or NT) header. */
  public String getSearchTarget() {
    return searchTarget;
  }

  /** USN header. */
  public String getUniqueServiceName() {
    return uniqueServiceName;
  }

  /** LOCATION (or URL) header. */
  public String getUrl() {
    return url;
  }

  /** SERVER header. */
  public String getServer() {
    return server;
  }

  /** SERVICE header of a vendor framed response. */
  public String getVendorServiceName() {
    return vendorServiceName;
  }

  public DeviceType getType() {
    return type;
  }

  @Override
  public String toString() {
    return "DiscoveredDevice{" +
        "ipAddress=" + ipAddress +
        ", macAddress=" + macAddress +
        ", port=" + port +
        ", type=" + type +
        ", searchTarget=" + searchTarget +
        ", uniqueServiceName=" + uniqueServiceName +
        ", url=" + url +
        ", server=" + server +
        ", vendorServiceName=" + vendorServiceName +
        '}';
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    DiscoveredDevice that = (DiscoveredDevice) o;

    return port == that.port
        && type == that.type
        && ipAddress.equals(that.ipAddress)
        && macAddress.equals(that.macAddress)
        && Objects.equals(searchTarget, that.searchTarget)
        && Objects.equals(uniqueServiceName, that.uniqueServiceName)
        && Objects.equals(url, that.url)
        && Objects.equals(server, that.server)
        && Objects.equals(vendorServiceName, that.vendorServiceName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(ipAddress, macAddress, port, type, searchTarget, uniqueServiceName, url, server,
        vendorServiceName);
  }

  public static class Builder {
    private String ipAddress;
    private String macAddress;
    private int port;
    private String searchTarget;
    private String uniqueServiceName;
    private String url;
    private String server;
    private String vendorServiceName;
    private DeviceType type = DeviceType.UNKNOWN;

    private Builder() {
    }

    public Builder setIpAddress(String ipAddress) {
      this.ipAddress = ipAddress;
      return this;
    }

    public Builder setMacAddress(String macAddress) {
      this.macAddress = macAddress;
      return this;
    }

    public Builder setPort(int port) {
      this.port = port;
      return this;
    }

    public Builder setSearchTarget(String searchTarget) {
      this.searchTarget = searchTarget;
      return this;
    }

    public Builder setUniqueServiceName(String uniqueServiceName) {
      this.uniqueServiceName = uniqueServiceName;
      return this;
    }

    public Builder setUrl(String url) {
      this.url = url;
      return this;
    }

    public Builder setServer(String server) {
      this.server = server;
      return this;
    }

    public Builder setVendorServiceName(String vendorServiceName) {
      this.vendorServiceName = vendorServiceName;
      return this;
    }

    public Builder setType(DeviceType type) {
      this.type = type;
      return this;
    }

    public DiscoveredDevice build() {
      checkArgument(!isNullOrEmpty(ipAddress), "a discovered device needs an ip address");
      return new DiscoveredDevice(this);
    }
  }
}
