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

import com.google.common.net.HostAndPort;
import lanscout.interfaces.HardwareAddressResolver;
import org.jmock.Expectations;
import org.jmock.integration.junit4.JUnitRuleMockery;
import org.junit.Rule;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static lanscout.discovery.DeviceMatchers.hasMacAddress;
import static lanscout.discovery.DeviceMatchers.isDevice;
import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;

public class SsdpResponseParserTest {
  @Rule
  public JUnitRuleMockery context = new JUnitRuleMockery();

  private final HardwareAddressResolver resolver = context.mock(HardwareAddressResolver.class);
  private final SsdpResponseParser parser = new SsdpResponseParser(resolver);

  @Test
  public void shouldParseLocationWithPortAndPath() {
    assertThat(SsdpResponseParser.parseLocation("http://192.168.0.5:8080/desc.xml"),
        is(equalTo(Optional.of(HostAndPort.fromParts("192.168.0.5", 8080)))));
  }

  @Test
  public void shouldUseHttpPortWhenLocationHasPathButNoPort() {
    assertThat(SsdpResponseParser.parseLocation("http://192.168.0.5/desc.xml"),
        is(equalTo(Optional.of(HostAndPort.fromParts("192.168.0.5", 80)))));
  }

  @Test
  public void shouldUseHttpPortForABareHostWithoutScheme() {
    assertThat(SsdpResponseParser.parseLocation("192.168.0.5"),
        is(equalTo(Optional.of(HostAndPort.fromParts("192.168.0.5", 80)))));
  }

  @Test
  public void shouldUseHttpsPortForHttpsLocations() {
    assertThat(SsdpResponseParser.parseLocation("HTTPS://10.0.0.2/setup"),
        is(equalTo(Optional.of(HostAndPort.fromParts("10.0.0.2", 443)))));
  }

  @Test
  public void shouldRejectLocationsWithoutAHost() {
    assertThat(SsdpResponseParser.parseLocation("http://:8080/desc.xml").isPresent(), is(false));
    assertThat(SsdpResponseParser.parseLocation("http:///desc.xml").isPresent(), is(false));
  }

  @Test
  public void shouldRejectLocationsWithAGarbledPort() {
    assertThat(SsdpResponseParser.parseLocation("http://10.0.0.2:eighty/").isPresent(), is(false));
  }

  @Test
  public void shouldClassifyTheBridgeByItsServerBanner() {
    context.checking(new Expectations() {{
      oneOf(resolver).lookup("192.168.1.20");
      will(returnValue(Optional.of("00:17:88:1a:2b:3c")));
    }});

    DiscoveredDevice device = parse(SsdpResponses.bridgeResponse("192.168.1.20"));

    assertThat(device, isDevice(DeviceType.PHILIPS_HUE, "192.168.1.20"));
    assertThat(device, hasMacAddress("00:17:88:1a:2b:3c"));
    assertThat(device.getPort(), is(80));
    assertThat(device.getSearchTarget(), is(equalTo("upnp:rootdevice")));
    assertThat(device.getUniqueServiceName(),
        is(equalTo("uuid:2f402f80-da50-11e1-9b23-0017881a2b3c::upnp:rootdevice")));
  }

  @Test
  public void shouldClassifyStandardResponsesByTheirSearchTargetRegardlessOfHeaderCase() {
    allowMissingMacAddress();

    DiscoveredDevice camera = parse(SsdpResponses.cameraResponse("192.168.1.30"));

    assertThat(camera, isDevice(DeviceType.CAMERA, "192.168.1.30"));
    assertThat(camera.getPort(), is(49152));
    assertThat(camera.getUrl(), is(equalTo("http://192.168.1.30:49152/rootDesc.xml")));
    assertThat(camera, hasMacAddress(""));
  }

  @Test
  public void shouldTakeTheSearchTargetFromNotifyHeaders() {
    allowMissingMacAddress();

    assertThat(parse(SsdpResponses.routerNotify("192.168.1.1")), isDevice(DeviceType.ROUTER, "192.168.1.1"));
  }

  @Test
  public void shouldClassifyVendorNotificationsAsThermostats() {
    allowMissingMacAddress();

    DiscoveredDevice thermostat = parse(SsdpResponses.thermostatNotify("192.168.1.40"));

    assertThat(thermostat, isDevice(DeviceType.RTCOA, "192.168.1.40"));
    assertThat(thermostat.getVendorServiceName(), is(equalTo("com.rtcoa.tstat:1.0")));
    assertThat(thermostat.getSearchTarget(), is(nullValue()));
  }

  @Test
  public void shouldLeaveUnrecognizedDevicesUnknown() {
    allowMissingMacAddress();

    DiscoveredDevice device = parse("HTTP/1.1 200 OK\r\n" +
        "LOCATION: http://192.168.1.50:8008/ssdp/device-desc.xml\r\n" +
        "SERVER: Linux/3.8.13, UPnP/1.0, Portable SDK for UPnP devices/1.6.18\r\n" +
        "ST: urn:dial-multiscreen-org:service:dial:1\r\n" +
        "\r\n");

    assertThat(device, isDevice(DeviceType.UNKNOWN, "192.168.1.50"));
  }

  @Test
  public void shouldAcceptTheUrlHeaderInPlaceOfLocation() {
    allowMissingMacAddress();

    DiscoveredDevice device = parse("HTTP/1.1 200 OK\r\n" +
        "ST: " + SearchTargets.SONOS_ST + "\r\n" +
        "url: 192.168.1.60\r\n" +
        "\r\n");

    assertThat(device, isDevice(DeviceType.SONOS, "192.168.1.60"));
    assertThat(device.getPort(), is(80));
  }

  @Test
  public void shouldRejectResponsesWithoutALocation() {
    assertThat(parser.parse("HTTP/1.1 200 OK\r\nST: libhue:idl\r\n\r\n").isPresent(), is(false));
  }

  @Test
  public void shouldRejectResponsesWhoseLocationHasNoHost() {
    assertThat(parser.parse("HTTP/1.1 200 OK\r\nLOCATION: http:///desc.xml\r\n\r\n").isPresent(), is(false));
  }

  @Test
  public void shouldParseAWindowOfTheReceiveBuffer() {
    allowMissingMacAddress();

    byte[] response = SsdpResponses.speakerResponse("192.168.1.70").getBytes(StandardCharsets.UTF_8);
    byte[] buffer = new byte[response.length + 10];
    System.arraycopy(response, 0, buffer, 10, response.length);

    Optional<DiscoveredDevice> device = parser.parse(buffer, 10, response.length);

    assertThat(device.isPresent(), is(true));
    assertThat(device.get(), isDevice(DeviceType.SONOS, "192.168.1.70"));
  }

  private DiscoveredDevice parse(String response) {
    Optional<DiscoveredDevice> device = parser.parse(response);
    assertThat(device.isPresent(), is(true));
    return device.get();
  }

  private void allowMissingMacAddress() {
    context.checking(new Expectations() {{
      allowing(resolver).lookup(with(any(String.class)));
      will(returnValue(Optional.empty()));
    }});
  }
}
