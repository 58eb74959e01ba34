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

/**
 The interfaces package holds the seams between the discovery engine and everything around it.
 <p>
 {@link lanscout.interfaces.DiscoveryCallback} is how a caller hears about devices,
 {@link lanscout.interfaces.HardwareAddressResolver} is how the engine learns a device's MAC
 address, and {@link lanscout.interfaces.DiscoveryModule} is the service face of the engine
 for code that prefers jetlang channels over callbacks.
 */
