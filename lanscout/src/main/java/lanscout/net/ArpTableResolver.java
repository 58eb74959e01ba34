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

package lanscout.net;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import lanscout.LanScoutConstants;
import lanscout.interfaces.HardwareAddressResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

/**
 * Looks MAC addresses up in the kernel's ARP table.  The Linux format is:
 * <pre>
 *   IP address       HW type     Flags       HW address            Mask     Device
 *   10.0.6.1         0x1         0x2         00:25:59:3e:46:c4     *        eth0
 * </pre>
 * Entries that are still being resolved show an all zero address and are treated as unknown.
 */
public class ArpTableResolver implements HardwareAddressResolver {
  private static final Logger LOG = LoggerFactory.getLogger(ArpTableResolver.class);

  private static final String INCOMPLETE_ENTRY = "00:00:00:00:00:00";
  private static final Splitter COLUMN_SPLITTER = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  private final Path arpTable;

  public ArpTableResolver() {
    this(Paths.get(LanScoutConstants.ARP_TABLE_PATH));
  }

  public ArpTableResolver(Path arpTable) {
    this.arpTable = arpTable;
  }

  @Override
  public Optional<String> lookup(String ipAddress) {
    List<String> lines;
    try {
      lines = Files.readAllLines(arpTable, StandardCharsets.US_ASCII);
    } catch (IOException e) {
      LOG.warn("Unable to open ARP table {}", arpTable, e);
      return Optional.empty();
    }

    // first line is the column header
    for (String line : lines.subList(Math.min(1, lines.size()), lines.size())) {
      List<String> columns = COLUMN_SPLITTER.splitToList(line);
      if (columns.size() < 4) {
        LOG.warn("ARP table line has no mac address: {}", line);
        continue;
      }
      if (columns.get(0).equals(ipAddress)) {
        String macAddress = columns.get(3);
        if (INCOMPLETE_ENTRY.equals(macAddress)) {
          return Optional.empty();
        }
        LOG.trace("found macAddress = {} for ip = {}", macAddress, ipAddress);
        return Optional.of(macAddress);
      }
    }
    return Optional.empty();
  }
}
