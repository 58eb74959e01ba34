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

import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.AbstractService;
import lanscout.LanScoutConstants;
import lanscout.interfaces.DiscoveryModule;
import org.jetlang.channels.Channel;
import org.jetlang.channels.MemoryChannel;
import org.jetlang.channels.Subscriber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Keeps one search per configured device type running for as long as the service is up, and
 * publishes every device found on {@link #getDeviceNotifications()}.
 */
public class DiscoveryService extends AbstractService implements DiscoveryModule {
  private static final Logger LOG = LoggerFactory.getLogger(DiscoveryService.class);

  private final DiscoveryEngine engine;
  private final ImmutableSet<DeviceType> deviceTypes;
  private final Channel<DiscoveredDevice> deviceNotifications = new MemoryChannel<>();

  private final List<Long> handles = new ArrayList<>();

  public DiscoveryService(DiscoveryEngine engine, Set<DeviceType> deviceTypes) {
    this.engine = checkNotNull(engine);
    this.deviceTypes = ImmutableSet.copyOf(deviceTypes);
    checkArgument(!this.deviceTypes.isEmpty(), "no device types to discover");
  }

  @Override
  protected void doStart() {
    try {
      for (DeviceType type : deviceTypes) {
        long handle = engine.startDiscovery(type, deviceNotifications::publish);
        if (handle == LanScoutConstants.INVALID_HANDLE) {
          stopSearches();
          notifyFailed(new IllegalStateException("Unable to start discovery of " + type));
          return;
        }
        handles.add(handle);
      }
      LOG.info("Discovering {}", deviceTypes);

      notifyStarted();
    } catch (Throwable t) {
      stopSearches();
      notifyFailed(t);
    }
  }

  @Override
  protected void doStop() {
    stopSearches();
    LOG.info("Stopped discovering {}", deviceTypes);

    notifyStopped();
  }

  @Override
  public ImmutableSet<DeviceType> getDeviceTypes() {
    return deviceTypes;
  }

  @Override
  public Subscriber<DiscoveredDevice> getDeviceNotifications() {
    return deviceNotifications;
  }

  private void stopSearches() {
    for (long handle : handles) {
      engine.stopDiscovery(handle);
    }
    handles.clear();
  }
}
