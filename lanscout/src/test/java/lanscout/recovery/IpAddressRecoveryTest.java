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

import com.google.common.collect.ImmutableMap;
import lanscout.DiscoveryConfig;
import lanscout.discovery.DeviceType;
import lanscout.discovery.DiscoveryEngine;
import lanscout.discovery.SsdpResponses;
import lanscout.net.FakeSsdpSocketFactory;
import org.junit.After;
import org.junit.Test;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;

public class IpAddressRecoveryTest {
  private static final Map<String, String> ARP_TABLE = ImmutableMap.of(
      "192.168.1.20", "00:17:88:1a:2b:3c",
      "192.168.1.21", "00:17:88:1a:2b:3d");

  private final FakeSsdpSocketFactory socketFactory = new FakeSsdpSocketFactory();
  private final DiscoveryEngine engine = new DiscoveryEngine(
      DiscoveryConfig.newBuilder().setBindPort(0).setBeaconIntervalMillis(50).setReadTimeoutMillis(20).build(),
      socketFactory,
      ipAddress -> Optional.ofNullable(ARP_TABLE.get(ipAddress)));

  private final IpAddressRecovery recovery = new IpAddressRecovery(engine);
  private final ExecutorService executor = Executors.newSingleThreadExecutor();

  @After
  public void after() {
    executor.shutdownNow();
    engine.close();
  }

  @Test(timeout = 10000)
  public void findsTheAddressOfTheDeviceWithTheSameMacAddress() throws Exception {
    Future<Optional<String>> recovered = executor.submit(
        () -> recovery.recoverIpAddress(DeviceType.PHILIPS_HUE, "0:17:88:1A:2B:3C", 5, TimeUnit.SECONDS));

    while (engine.activeSearchCount() == 0) {
      Thread.sleep(10);
    }
    socketFactory.lastOpened().respond(SsdpResponses.bridgeResponse("192.168.1.21"));
    socketFactory.lastOpened().respond(SsdpResponses.bridgeResponse("192.168.1.20"));

    assertThat(recovered.get(), is(equalTo(Optional.of("192.168.1.20"))));
    assertThat(engine.activeSearchCount(), is(0));
  }

  @Test(timeout = 10000)
  public void givesUpAfterTheTimeout() throws Exception {
    assertThat(recovery.recoverIpAddress(DeviceType.PHILIPS_HUE, "00:17:88:1a:2b:3c", 200, TimeUnit.MILLISECONDS),
        is(equalTo(Optional.<String>empty())));
    assertThat(engine.activeSearchCount(), is(0));
  }

  @Test
  public void malformedMacAddressesAreNotSearchedFor() throws Exception {
    assertThat(recovery.recoverIpAddress(DeviceType.PHILIPS_HUE, "not-a-mac", 1, TimeUnit.SECONDS).isPresent(),
        is(false));
    assertThat(recovery.recoverIpAddress(DeviceType.PHILIPS_HUE, "", 1, TimeUnit.SECONDS).isPresent(), is(false));
    assertThat(socketFactory.openCount(), is(0));
  }

  @Test
  public void aSearchThatCanNotStartRecoversNothing() throws Exception {
    socketFactory.failOpen(true);

    assertThat(recovery.recoverIpAddress(DeviceType.PHILIPS_HUE, "00:17:88:1a:2b:3c", 1, TimeUnit.SECONDS).isPresent(),
        is(false));
  }
}
