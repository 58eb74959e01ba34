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
import lanscout.net.SsdpSocket;
import lanscout.util.LoopThread;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Broadcasts one request per distinct search target, then sleeps for the beacon interval.
 * A stop wakes it up early.  A failed send ends the loop for good, until the engine is
 * restarted.
 */
class BeaconThread extends LoopThread {
  private static final Logger LOG = LoggerFactory.getLogger(BeaconThread.class);

  private final DiscoveryEngine engine;
  private final SsdpSocket socket;
  private final InetSocketAddress group;

  BeaconThread(DiscoveryEngine engine, SsdpSocket socket, InetSocketAddress group) {
    super("ssdpBeacon");
    this.engine = engine;
    this.socket = socket;
    this.group = group;
  }

  @Override
  public void run() {
    notifyStarted();
    LOG.debug("SSDP beacon started, sending to {}", group);

    try {
      while (engine.shouldBeaconRun(this)) {
        if (!broadcast(engine.snapshotDirectives())) {
          engine.beaconFailed(this);
          break;
        }
        if (!engine.awaitNextBeacon(this)) {
          break;
        }
      }
    } catch (InterruptedException e) {
      LOG.warn("SSDP beacon interrupted, exiting");
      engine.beaconFailed(this);
    } catch (Throwable t) {
      engine.beaconFailed(this);
      notifyCrashed(t);
      return;
    }

    LOG.debug("SSDP beacon exiting");
    notifyStopped();
  }

  /**
   * @return false if the socket refused a send
   */
  private boolean broadcast(ImmutableList<SearchDirective> directives) {
    // several searches may share a target, only ask once per round
    Set<String> sent = new HashSet<>();

    for (SearchDirective directive : directives) {
      List<String> targets = directive.getCategory() == SearchCategory.VENDOR
          ? directive.getTargets().subList(0, 1)
          : directive.getTargets();

      for (String target : targets) {
        if (!sent.add(target)) {
          continue;
        }

        String request = SsdpMessages.requestFor(directive.getCategory(), group, target);
        LOG.trace("Broadcasting:\n{}", request);
        try {
          socket.send(request, group);
        } catch (IOException e) {
          LOG.error("Error sending broadcast message for SSDP, stopping beacons", e);
          return false;
        }
      }
    }
    return true;
  }
}
