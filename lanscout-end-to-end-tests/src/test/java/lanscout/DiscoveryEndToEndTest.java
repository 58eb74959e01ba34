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

import com.google.common.collect.ImmutableSet;
import io.netty.channel.nio.NioEventLoopGroup;
import lanscout.discovery.DeviceType;
import lanscout.discovery.DiscoveredDevice;
import lanscout.discovery.DiscoveryEngine;
import lanscout.discovery.DiscoveryService;
import lanscout.net.NioSsdpSocket;
import org.jetlang.fibers.Fiber;
import org.jetlang.fibers.ThreadFiber;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.core.Is.is;

/**
 * Drives a real engine, on a real socket, against {@link SimulatedDevice} over loopback.
 */
public class DiscoveryEndToEndTest {
  private static final String BRIDGE_MAC = "00:17:88:1a:2b:3c";

  private final NioEventLoopGroup nioEventLoopGroup = new NioEventLoopGroup(1);
  private final SimulatedDevice device = new SimulatedDevice(nioEventLoopGroup);

  private DiscoveryEngine engine;

  @Before
  public void before() {
    device.startAsync().awaitRunning();

    DiscoveryConfig config = DiscoveryConfig.newBuilder()
        .setMulticastAddress(device.address())
        .setPort(device.port())
        .setBindPort(0)
        .setBeaconIntervalMillis(100)
        .setReadTimeoutMillis(50)
        .build();
    engine = new DiscoveryEngine(config, NioSsdpSocket::open,
        ipAddress -> ipAddress.equals(device.address()) ? Optional.of(BRIDGE_MAC) : Optional.empty());
  }

  @After
  public void after() throws Exception {
    engine.close();
    device.stopAsync().awaitTerminated();
    nioEventLoopGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS).sync();
  }

  @Test(timeout = 20000)
  public void findsTheBridgeOnceNoMatterHowOftenItAnswers() throws Exception {
    BlockingQueue<DiscoveredDevice> found = new LinkedBlockingQueue<>();

    long handle = engine.startDiscovery(DeviceType.PHILIPS_HUE, found::add);
    assertThat(handle, is(not(LanScoutConstants.INVALID_HANDLE)));

    DiscoveredDevice bridge = found.take();
    assertThat(bridge.getType(), is(DeviceType.PHILIPS_HUE));
    assertThat(bridge.getIpAddress(), is(equalTo("127.0.0.1")));
    assertThat(bridge.getMacAddress(), is(equalTo(BRIDGE_MAC)));

    while (device.bridgeSearches() < 3) {
      Thread.sleep(20);
    }
    assertThat(found.poll(200, TimeUnit.MILLISECONDS), is(nullValue()));
  }

  @Test(timeout = 20000)
  public void findsTheThermostatWithTheVendorFraming() throws Exception {
    BlockingQueue<DiscoveredDevice> found = new LinkedBlockingQueue<>();

    engine.startDiscovery(DeviceType.RTCOA, found::add);

    DiscoveredDevice thermostat = found.take();
    assertThat(thermostat.getType(), is(DeviceType.RTCOA));
    assertThat(thermostat.getPort(), is(8080));
    assertThat(thermostat.getVendorServiceName(), is(equalTo("com.rtcoa.tstat:1.0")));
    assertThat(device.bridgeSearches(), is(0));
  }

  @Test(timeout = 20000)
  public void beaconsStopWithTheLastSearch() throws Exception {
    BlockingQueue<DiscoveredDevice> found = new LinkedBlockingQueue<>();
    long handle = engine.startDiscovery(DeviceType.PHILIPS_HUE, found::add);
    found.take();

    engine.stopDiscovery(handle);
    assertThat(engine.isBeaconRunning(), is(false));
    assertThat(engine.isListenerRunning(), is(false));

    // let anything already on the wire arrive
    Thread.sleep(100);
    int searchesAtStop = device.bridgeSearches();
    Thread.sleep(300);
    assertThat(device.bridgeSearches(), is(searchesAtStop));

    engine.startDiscovery(DeviceType.PHILIPS_HUE, found::add);
    assertThat(found.take().getType(), is(DeviceType.PHILIPS_HUE));
    assertThat(device.bridgeSearches(), is(greaterThan(searchesAtStop)));
  }

  @Test(timeout = 20000)
  public void theDiscoveryServicePublishesEveryType() throws Exception {
    Fiber fiber = new ThreadFiber();
    fiber.start();
    BlockingQueue<DiscoveredDevice> notifications = new LinkedBlockingQueue<>();

    DiscoveryService service =
        new DiscoveryService(engine, ImmutableSet.of(DeviceType.PHILIPS_HUE, DeviceType.RTCOA));
    service.getDeviceNotifications().subscribe(fiber, notifications::add);
    try {
      service.startAsync().awaitRunning();

      ImmutableSet<DeviceType> types = ImmutableSet.of(notifications.take().getType(), notifications.take().getType());
      assertThat(types, is(equalTo(ImmutableSet.of(DeviceType.PHILIPS_HUE, DeviceType.RTCOA))));

      service.stopAsync().awaitTerminated();
      assertThat(engine.activeSearchCount(), is(0));
    } finally {
      fiber.dispose();
    }
  }
}
