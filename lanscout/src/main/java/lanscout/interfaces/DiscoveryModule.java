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

import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.Service;
import lanscout.discovery.DeviceType;
import lanscout.discovery.DiscoveredDevice;
import org.jetlang.channels.Subscriber;

/**
 * The discovery module keeps searches for a fixed set of device types running while it is
 * started, and publishes every newly found device on a channel.  Consumers such as a pairing
 * flow subscribe with their own fiber instead of handing a callback to the engine.
 */
public interface DiscoveryModule extends Service {

  ImmutableSet<DeviceType> getDeviceTypes();

  Subscriber<DiscoveredDevice> getDeviceNotifications();
}
