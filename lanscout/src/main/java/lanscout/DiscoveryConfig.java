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

package lanscout;

import java.net.InetSocketAddress;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Tunables of a {@link lanscout.discovery.DiscoveryEngine}.  The defaults are the SSDP
 * well-known group and port, a 5 second beacon and a 1 second read poll.
 * <p>
 * Use system properties for overrides so we don't end up writing a config file
 * parser; see {@link #fromSystemProperties()}.
 */
public class DiscoveryConfig {
  private final String multicastAddress;
  private final int port;
  private final int bindPort;
  private final long beaconIntervalMillis;
  private final long readTimeoutMillis;
  private final int callbackPoolMinSize;
  private final int callbackPoolMaxSize;
  private final int callbackPoolQueueSize;

  private DiscoveryConfig(Builder builder) {
    this.multicastAddress = builder.multicastAddress;
    this.port = builder.port;
    this.bindPort = builder.bindPort;
    this.beaconIntervalMillis = builder.beaconIntervalMillis;
    this.readTimeoutMillis = builder.readTimeoutMillis;
    this.callbackPoolMinSize = builder.callbackPoolMinSize;
    this.callbackPoolMaxSize = builder.callbackPoolMaxSize;
    this.callbackPoolQueueSize = builder.callbackPoolQueueSize;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static DiscoveryConfig defaults() {
    return newBuilder().build();
  }

  public static DiscoveryConfig fromSystemProperties() {
    Builder builder = newBuilder();
    if (System.getProperties().containsKey(LanScoutConstants.MULTICAST_ADDRESS_PROPERTY_NAME)) {
      builder.setMulticastAddress(System.getProperty(LanScoutConstants.MULTICAST_ADDRESS_PROPERTY_NAME));
    }
    if (System.getProperties().containsKey(LanScoutConstants.PORT_PROPERTY_NAME)) {
      builder.setPort(Integer.parseInt(System.getProperty(LanScoutConstants.PORT_PROPERTY_NAME)));
    }
    if (System.getProperties().containsKey(LanScoutConstants.BIND_PORT_PROPERTY_NAME)) {
      builder.setBindPort(Integer.parseInt(System.getProperty(LanScoutConstants.BIND_PORT_PROPERTY_NAME)));
    }
    if (System.getProperties().containsKey(LanScoutConstants.BEACON_INTERVAL_PROPERTY_NAME)) {
      builder.setBeaconIntervalMillis(
          Long.parseLong(System.getProperty(LanScoutConstants.BEACON_INTERVAL_PROPERTY_NAME)));
    }
    if (System.getProperties().containsKey(LanScoutConstants.READ_TIMEOUT_PROPERTY_NAME)) {
      builder.setReadTimeoutMillis(
          Long.parseLong(System.getProperty(LanScoutConstants.READ_TIMEOUT_PROPERTY_NAME)));
    }
    if (System.getProperties().containsKey(LanScoutConstants.CALLBACK_POOL_MIN_PROPERTY_NAME)) {
      builder.setCallbackPoolMinSize(
          Integer.parseInt(System.getProperty(LanScoutConstants.CALLBACK_POOL_MIN_PROPERTY_NAME)));
    }
    if (System.getProperties().containsKey(LanScoutConstants.CALLBACK_POOL_MAX_PROPERTY_NAME)) {
      builder.setCallbackPoolMaxSize(
          Integer.parseInt(System.getProperty(LanScoutConstants.CALLBACK_POOL_MAX_PROPERTY_NAME)));
    }
    if (System.getProperties().containsKey(LanScoutConstants.CALLBACK_POOL_QUEUE_PROPERTY_NAME)) {
      builder.setCallbackPoolQueueSize(
          Integer.parseInt(System.getProperty(LanScoutConstants.CALLBACK_POOL_QUEUE_PROPERTY_NAME)));
    }
    return builder.build();
  }

  public String getMulticastAddress() {
    return multicastAddress;
  }

  public int getPort() {
    return port;
  }

  /** Local port the shared socket binds to; 0 picks an ephemeral port. */
  public int getBindPort() {
    return bindPort;
  }

  public long getBeaconIntervalMillis() {
    return beaconIntervalMillis;
  }

  public long getReadTimeoutMillis() {
    return readTimeoutMillis;
  }

  public int getCallbackPoolMinSize() {
    return callbackPoolMinSize;
  }

  public int getCallbackPoolMaxSize() {
    return callbackPoolMaxSize;
  }

  public int getCallbackPoolQueueSize() {
    return callbackPoolQueueSize;
  }

  /** Where beacons are sent. */
  public InetSocketAddress getTargetAddress() {
    return new InetSocketAddress(multicastAddress, port);
  }

  @Override
  public String toString() {
    return "DiscoveryConfig{" +
        "multicastAddress=" + multicastAddress +
        ", port=" + port +
        ", bindPort=" + bindPort +
        ", beaconIntervalMillis=" + beaconIntervalMillis +
        ", readTimeoutMillis=" + readTimeoutMillis +
        ", callbackPool=" + callbackPoolMinSize + "/" + callbackPoolMaxSize + "/" + callbackPoolQueueSize +
        '}';
  }

  public static class Builder {
    private String multicastAddress = LanScoutConstants.SSDP_MULTICAST_ADDRESS;
    private int port = LanScoutConstants.SSDP_PORT;
    private int bindPort = LanScoutConstants.SSDP_PORT;
    private long beaconIntervalMillis = LanScoutConstants.BEACON_INTERVAL_MILLIS;
    private long readTimeoutMillis = LanScoutConstants.RESPONSE_READ_TIMEOUT_MILLIS;
    private int callbackPoolMinSize = LanScoutConstants.CALLBACK_POOL_MIN_SIZE;
    private int callbackPoolMaxSize = LanScoutConstants.CALLBACK_POOL_MAX_SIZE;
    private int callbackPoolQueueSize = LanScoutConstants.CALLBACK_POOL_MAX_QUEUE_SIZE;

    private Builder() {
    }

    public Builder setMulticastAddress(String multicastAddress) {
      this.multicastAddress = checkNotNull(multicastAddress);
      return this;
    }

    public Builder setPort(int port) {
      this.port = port;
      return this;
    }

    public Builder setBindPort(int bindPort) {
      this.bindPort = bindPort;
      return this;
    }

    public Builder setBeaconIntervalMillis(long beaconIntervalMillis) {
      this.beaconIntervalMillis = beaconIntervalMillis;
      return this;
    }

    public Builder setReadTimeoutMillis(long readTimeoutMillis) {
      this.readTimeoutMillis = readTimeoutMillis;
      return this;
    }

    public Builder setCallbackPoolMinSize(int callbackPoolMinSize) {
      this.callbackPoolMinSize = callbackPoolMinSize;
      return this;
    }

    public Builder setCallbackPoolMaxSize(int callbackPoolMaxSize) {
      this.callbackPoolMaxSize = callbackPoolMaxSize;
      return this;
    }

    public Builder setCallbackPoolQueueSize(int callbackPoolQueueSize) {
      this.callbackPoolQueueSize = callbackPoolQueueSize;
      return this;
    }

    public DiscoveryConfig build() {
      checkArgument(port > 0 && port <= 0xFFFF, "port out of range: %s", port);
      checkArgument(bindPort >= 0 && bindPort <= 0xFFFF, "bindPort out of range: %s", bindPort);
      checkArgument(beaconIntervalMillis > 0, "beaconIntervalMillis must be positive");
      checkArgument(readTimeoutMillis > 0, "readTimeoutMillis must be positive");
      checkArgument(callbackPoolMinSize > 0, "callbackPoolMinSize must be positive");
      checkArgument(callbackPoolMaxSize >= callbackPoolMinSize,
          "callbackPoolMaxSize %s is below callbackPoolMinSize %s", callbackPoolMaxSize, callbackPoolMinSize);
      checkArgument(callbackPoolQueueSize > 0, "callbackPoolQueueSize must be positive");
      return new DiscoveryConfig(this);
    }
  }
}
