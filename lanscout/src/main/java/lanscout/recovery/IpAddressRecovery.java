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

package lanscout.recovery;

import com.google.common.util.concurrent.SettableFuture;
import lanscout.LanScoutConstants;
import lanscout.discovery.DeviceType;
import lanscout.discovery.DiscoveredDevice;
import lanscout.discovery.DiscoveryEngine;
import lanscout.net.MacAddresses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Finds the current IP address of a device we already know by MAC address, for example after
 * its DHCP lease moved it.  Each call runs its own short search and waits for a device with
 * the same hardware address to answer.
 */
public class IpAddressRecovery {
  private static final Logger LOG = LoggerFactory.getLogger(IpAddressRecovery.class);

  private final DiscoveryEngine engine;
  private final List<PendingRecovery> pending = new CopyOnWriteArrayList<>();

  public IpAddressRecovery(DiscoveryEngine engine) {
    this.engine = checkNotNull(engine);
  }

  /**
   * Search for a {@code type} device whose MAC address is {@code macAddress}, waiting at most
   * {@code timeout}.
   *
   * @return the device's IP address, or empty if the MAC address is malformed, the search could
   * not be started, or nothing answered in time
   */
  public Optional<String> recoverIpAddress(DeviceType type, String macAddress, long timeout, TimeUnit unit)
      throws InterruptedException {
    if (macAddress == null || macAddress.isEmpty()) {
      return Optional.empty();
    }
    LOG.info("Attempting recovery of {}", macAddress);

    Optional<byte[]> macBytes = MacAddresses.toBytes(macAddress);
    if (!macBytes.isPresent()) {
      LOG.error("Unable to parse macAddress '{}'", macAddress);
      return Optional.empty();
    }

    PendingRecovery recovery = new PendingRecovery(macAddress, macBytes.get());
    pending.add(recovery);
    try {
      long handle = engine.startDiscovery(type, this::deviceDiscovered);
      if (handle == LanScoutConstants.INVALID_HANDLE) {
        LOG.warn("Error starting the recovery of {}", macAddress);
        return Optional.empty();
      }

      Optional<String> result;
      try {
        result = Optional.of(recovery.ipAddress.get(timeout, unit));
      } catch (TimeoutException e) {
        result = Optional.empty();
      } catch (ExecutionException e) {
        // nothing ever fails the future
        throw new IllegalStateException(e);
      } finally {
        engine.stopDiscovery(handle);
      }

      LOG.info("Completed search of {}, found={}", macAddress, result.isPresent());
      return result;
    } finally {
      pending.remove(recovery);
    }
  }

  private void deviceDiscovered(DiscoveredDevice device) {
    LOG.info("Found {} at IP {}", device.getMacAddress(), device.getIpAddress());

    Optional<byte[]> macBytes = MacAddresses.toBytes(device.getMacAddress());
    if (!macBytes.isPresent()) {
      LOG.warn("Device {} has invalid mac, unable to correlate to known devices", device.getIpAddress());
      return;
    }

    for (PendingRecovery recovery : pending) {
      if (Arrays.equals(recovery.macBytes, macBytes.get())) {
        LOG.debug("Located device {}/{} resolves our search for {}",
            device.getMacAddress(), device.getIpAddress(), recovery.macAddress);
        recovery.ipAddress.set(device.getIpAddress());
        return;
      }
    }

    LOG.debug("Located device {}/{} is not something we are searching for",
        device.getMacAddress(), device.getIpAddress());
  }

  private static class PendingRecovery {
    private final String macAddress;
    private final byte[] macBytes;
    private final SettableFuture<String> ipAddress = SettableFuture.create();

    private PendingRecovery(String macAddress, byte[] macBytes) {
      this.macAddress = macAddress;
      this.macBytes = macBytes;
    }
  }
}
