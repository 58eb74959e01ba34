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
import lanscout.interfaces.DiscoveryCallback;

import java.util.HashSet;
import java.util.Set;

/**
 * One caller's standing request to hear about devices of a type.  Lives in the engine's
 * registry from startDiscovery until stopDiscovery; the seen-address set only grows.
 * <p>
 * Not thread safe, every access happens under the engine's lock.
 */
class SearchDirective {
  private final long handle;
  private final DeviceType deviceType;
  private final SearchTargets searchTargets;
  private final DiscoveryCallback callback;
  private final Set<String> seenAddresses = new HashSet<>();

  SearchDirective(long handle, DeviceType deviceType, SearchTargets searchTargets, DiscoveryCallback callback) {
    this.handle = handle;
    this.deviceType = deviceType;
    this.searchTargets = searchTargets;
    this.callback = callback;
  }

  long getHandle() {
    return handle;
  }

  DeviceType getDeviceType() {
    return deviceType;
  }

  SearchCategory getCategory() {
    return searchTargets.getCategory();
  }

  ImmutableList<String> getTargets() {
    return searchTargets.getTargets();
  }

  DiscoveryCallback getCallback() {
    return callback;
  }

  /**
   * Is this search looking for something like {@code device}?
   */
  boolean matches(DiscoveredDevice device) {
    switch (getCategory()) {
      case STANDARD:
        // the bridge doesn't return the ST we searched for, trust the classification instead
        if (device.getType() != DeviceType.UNKNOWN && device.getType() == deviceType) {
          return true;
        }
        String searchTarget = device.getSearchTarget();
        if (searchTarget == null) {
          return false;
        }
        // exact match, devices echo the target byte for byte
        for (String target : getTargets()) {
          if (target.equals(searchTarget)) {
            return true;
          }
        }
        return false;

      case VENDOR:
        // vendor names end in a wildcard, don't use that part when we compare
        String serviceName = device.getVendorServiceName();
        if (serviceName == null) {
          return false;
        }
        String serviceTarget = getTargets().get(0);
        String prefix = serviceTarget.endsWith("*")
            ? serviceTarget.substring(0, serviceTarget.length() - 1)
            : serviceTarget;
        return serviceName.startsWith(prefix);

      default:
        return false;
    }
  }

  boolean hasSeen(String ipAddress) {
    return seenAddresses.contains(ipAddress);
  }

  void markSeen(String ipAddress) {
    seenAddresses.add(ipAddress);
  }

  @Override
  public String toString() {
    return "SearchDirective{" +
        "handle=" + handle +
        ", deviceType=" + deviceType +
        ", searchTargets=" + searchTargets +
        ", seen=" + seenAddresses.size() +
        '}';
  }
}
