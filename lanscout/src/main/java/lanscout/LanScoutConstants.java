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

public class LanScoutConstants {
  public static final String SSDP_MULTICAST_ADDRESS = "239.255.255.250";
  public static final int SSDP_PORT = 1900;

  // MX header value, how long a device may wait before it answers an M-SEARCH
  public static final int M_SEARCH_MAX_WAIT_SECONDS = 1;

  public static final long BEACON_INTERVAL_MILLIS = 5000;
  public static final long RESPONSE_READ_TIMEOUT_MILLIS = 1000;
  public static final int MAX_DATAGRAM_SIZE = 2048;

  public static final String CALLBACK_POOL_NAME = "discoverDeviceCallbackPool";
  public static final int CALLBACK_POOL_MIN_SIZE = 1;
  public static final int CALLBACK_POOL_MAX_SIZE = 5;
  public static final int CALLBACK_POOL_MAX_QUEUE_SIZE = 20;

  public static final long INVALID_HANDLE = 0;

  public static final String ARP_TABLE_PATH = "/proc/net/arp";

  public static final String MULTICAST_ADDRESS_PROPERTY_NAME = "lanscout.multicastAddress";
  public static final String PORT_PROPERTY_NAME = "lanscout.port";
  public static final String BIND_PORT_PROPERTY_NAME = "lanscout.bindPort";
  public static final String BEACON_INTERVAL_PROPERTY_NAME = "lanscout.beaconIntervalMillis";
  public static final String READ_TIMEOUT_PROPERTY_NAME = "lanscout.readTimeoutMillis";
  public static final String CALLBACK_POOL_MIN_PROPERTY_NAME = "lanscout.callbackPool.min";
  public static final String CALLBACK_POOL_MAX_PROPERTY_NAME = "lanscout.callbackPool.max";
  public static final String CALLBACK_POOL_QUEUE_PROPERTY_NAME = "lanscout.callbackPool.queue";
}
