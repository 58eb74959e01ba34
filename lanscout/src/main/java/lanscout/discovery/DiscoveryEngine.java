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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import lanscout.DiscoveryConfig;
import lanscout.LanScoutConstants;
import lanscout.interfaces.DiscoveryCallback;
import lanscout.interfaces.HardwareAddressResolver;
import lanscout.net.ArpTableResolver;
import lanscout.net.NioSsdpSocket;
import lanscout.net.SsdpSocket;
import lanscout.net.SsdpSocketFactory;
import lanscout.util.LoopThread;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Runs any number of concurrent SSDP searches over one shared socket.
 * <p>
 * Each {@link #startDiscovery} registers a search directive and hands back a handle.  While at
 * least one directive is registered, two threads are running: the beacon thread broadcasts a
 * request per distinct search target every beacon interval, and the listener thread parses
 * responses and hands each device to the callback of every directive that wants it and hasn't
 * seen its address yet.  Callbacks run on a bounded {@link CallbackDispatcher}.  When the last
 * directive is stopped both threads are joined and the socket is closed; a later start begins
 * again from scratch.
 * <p>
 * All registry state is guarded by one lock.  Socket I/O happens outside of it.
 */
public class DiscoveryEngine implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(DiscoveryEngine.class);

  private final DiscoveryConfig config;
  private final SsdpSocketFactory socketFactory;
  private final SsdpResponseParser parser;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition beaconWakeup = lock.newCondition();
  private final AtomicLong lastHandle = new AtomicLong(LanScoutConstants.INVALID_HANDLE);

  // everything below is guarded by 'lock'
  private final Map<Long, SearchDirective> directives = new LinkedHashMap<>();
  private SsdpSocket socket;
  private boolean beaconRunning;
  private boolean listenerRunning;
  private BeaconThread beaconThread;
  private ListenerThread listenerThread;
  private CallbackDispatcher dispatcher;

  public DiscoveryEngine() {
    this(DiscoveryConfig.fromSystemProperties(), NioSsdpSocket::open, new ArpTableResolver());
  }

  public DiscoveryEngine(DiscoveryConfig config,
                         SsdpSocketFactory socketFactory,
                         HardwareAddressResolver addressResolver) {
    this.config = checkNotNull(config);
    this.socketFactory = checkNotNull(socketFactory);
    this.parser = new SsdpResponseParser(checkNotNull(addressResolver));
  }

  /**
   * Start background discovery of devices of {@code type}.  As devices are found the callback
   * is invoked, once per device address.  Stop with {@link #stopDiscovery}.
   *
   * @return handle for the stop call, {@link LanScoutConstants#INVALID_HANDLE} if the type
   * can't be searched for or the socket couldn't be set up
   */
  public long startDiscovery(DeviceType type, DiscoveryCallback callback) {
    checkNotNull(type);
    checkNotNull(callback);

    Optional<SearchTargets> searchTargets = SearchTargets.forType(type);
    if (!searchTargets.isPresent()) {
      LOG.error("SSDP discover for type {} not supported", type);
      return LanScoutConstants.INVALID_HANDLE;
    }

    lock.lock();
    try {
      if (socket == null) {
        try {
          socket = socketFactory.open(config.getBindPort());
        } catch (IOException e) {
          LOG.error("Error configuring socket for SSDP on port {}", config.getBindPort(), e);
          return LanScoutConstants.INVALID_HANDLE;
        }
      }

      long handle = lastHandle.incrementAndGet();
      directives.put(handle, new SearchDirective(handle, type, searchTargets.get(), callback));
      LOG.debug("Started search {} for {}", handle, type);

      if (!listenerRunning) {
        listenerRunning = true;
        listenerThread = new ListenerThread(this, socket, parser, config.getReadTimeoutMillis());
        listenerThread.start();
      }
      if (!beaconRunning) {
        beaconRunning = true;
        beaconThread = new BeaconThread(this, socket, config.getTargetAddress());
        beaconThread.start();
        // wakes a beacon left over from a teardown still in progress, so it sees it was replaced
        beaconWakeup.signalAll();
      }

      return handle;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Stop the search behind {@code handle}.  Stopping the last search blocks until both loop
   * threads are gone and the socket is closed.
   */
  public void stopDiscovery(long handle) {
    LoopThread stoppingBeacon;
    LoopThread stoppingListener;
    SsdpSocket closingSocket;

    lock.lock();
    try {
      if (directives.isEmpty()) {
        LOG.debug("stopDiscovery: discover not running!");
        return;
      }

      SearchDirective removed = directives.remove(handle);
      if (removed == null) {
        LOG.debug("stopDiscovery: no search with handle {}", handle);
        return;
      }
      LOG.debug("Stopped search {} for {}", handle, removed.getDeviceType());

      if (!directives.isEmpty()) {
        return;
      }

      LOG.debug("stopDiscovery: no more discover searches, shutting down threads");
      listenerRunning = false;
      beaconRunning = false;
      beaconWakeup.signalAll();

      stoppingBeacon = beaconThread;
      stoppingListener = listenerThread;
      closingSocket = socket;
    } finally {
      lock.unlock();
    }

    // the loops take the lock to exit, so they can't be joined while holding it
    join(stoppingListener);
    join(stoppingBeacon);

    lock.lock();
    try {
      // a start may have come in while we waited, in which case its loops own the socket now
      if (directives.isEmpty() && socket == closingSocket) {
        closeSocket();
        beaconThread = null;
        listenerThread = null;
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Stop every search and release the callback pool.
   */
  @Override
  public void close() {
    List<Long> handles;
    lock.lock();
    try {
      handles = new ArrayList<>(directives.keySet());
    } finally {
      lock.unlock();
    }

    for (long handle : handles) {
      stopDiscovery(handle);
    }

    CallbackDispatcher closingDispatcher;
    lock.lock();
    try {
      closingDispatcher = dispatcher;
      dispatcher = null;
    } finally {
      lock.unlock();
    }
    if (closingDispatcher != null) {
      closingDispatcher.shutdown();
    }
  }

  public int activeSearchCount() {
    lock.lock();
    try {
      return directives.size();
    } finally {
      lock.unlock();
    }
  }

  public boolean isBeaconRunning() {
    lock.lock();
    try {
      return beaconRunning;
    } finally {
      lock.unlock();
    }
  }

  public boolean isListenerRunning() {
    lock.lock();
    try {
      return listenerRunning;
    } finally {
      lock.unlock();
    }
  }

  @VisibleForTesting
  boolean hasSocket() {
    lock.lock();
    try {
      return socket != null;
    } finally {
      lock.unlock();
    }
  }

  ImmutableList<SearchDirective> snapshotDirectives() {
    lock.lock();
    try {
      return ImmutableList.copyOf(directives.values());
    } finally {
      lock.unlock();
    }
  }

  /**
   * A loop keeps going only while it is the engine's current loop; one left over from a
   * teardown that raced a new start must exit even though the flag is up again.
   */
  boolean shouldBeaconRun(BeaconThread beacon) {
    lock.lock();
    try {
      return beaconRunning && beaconThread == beacon;
    } finally {
      lock.unlock();
    }
  }

  boolean shouldListenerRun(ListenerThread listener) {
    lock.lock();
    try {
      return listenerRunning && listenerThread == listener;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Pause {@code beacon} for one interval, returning early if it is told to stop.
   *
   * @return whether the beacon should keep running
   */
  boolean awaitNextBeacon(BeaconThread beacon) throws InterruptedException {
    lock.lock();
    try {
      long remainingNanos = TimeUnit.MILLISECONDS.toNanos(config.getBeaconIntervalMillis());
      while (beaconRunning && beaconThread == beacon && remainingNanos > 0) {
        remainingNanos = beaconWakeup.awaitNanos(remainingNanos);
      }
      return beaconRunning && beaconThread == beacon;
    } finally {
      lock.unlock();
    }
  }

  void beaconFailed(BeaconThread failed) {
    lock.lock();
    try {
      if (beaconThread == failed) {
        beaconRunning = false;
      }
    } finally {
      lock.unlock();
    }
  }

  void listenerFailed(ListenerThread failed) {
    lock.lock();
    try {
      if (listenerThread == failed) {
        listenerRunning = false;
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Hand {@code device} to every directive that is looking for it and hasn't seen its address.
   * A rejected submission leaves the address unseen so the next announce gets another try.
   */
  void deliver(DiscoveredDevice device) {
    String ipAddress = device.getIpAddress();

    lock.lock();
    try {
      boolean processed = false;
      for (SearchDirective directive : directives.values()) {
        if (!directive.matches(device) || directive.hasSeen(ipAddress)) {
          continue;
        }

        LOG.debug("Adding discovered device {} to search {} and invoking callback", ipAddress,
            directive.getHandle());
        LOG.debug("{}", device);

        if (dispatcher == null) {
          dispatcher = new CallbackDispatcher(
              LanScoutConstants.CALLBACK_POOL_NAME,
              config.getCallbackPoolMinSize(),
              config.getCallbackPoolMaxSize(),
              config.getCallbackPoolQueueSize());
        }

        if (dispatcher.submit(device, directive.getCallback())) {
          directive.markSeen(ipAddress);
          processed = true;
        }
      }

      if (!processed) {
        LOG.debug("Skipping discovered device {}; no search wants it or all have already seen it", ipAddress);
      }
    } finally {
      lock.unlock();
    }
  }

  private void closeSocket() {
    try {
      socket.close();
    } catch (IOException e) {
      LOG.warn("Error closing SSDP socket", e);
    }
    socket = null;
  }

  private static void join(LoopThread thread) {
    if (thread == null) {
      return;
    }
    try {
      thread.join();
    } catch (InterruptedException e) {
      LOG.warn("Interrupted waiting for {} to exit", thread.getName());
      Thread.currentThread().interrupt();
    }
  }
}
