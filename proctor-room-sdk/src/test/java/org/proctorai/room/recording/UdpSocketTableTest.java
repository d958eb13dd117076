/*
 * (C) Copyright 2024 ProctorAI (https://proctorai.org/)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.proctorai.room.recording;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class UdpSocketTableTest {

    private static final String HEADER = "  sl  local_address rem_address   st tx_queue rx_queue tr "
            + "tm->when retrnsmt   uid  timeout inode ref pointer drops";

    @Test
    public void readsLocalPortsFromEveryTable(@TempDir Path dir) throws IOException {
        Path udp = dir.resolve("udp");
        Path udp6 = dir.resolve("udp6");
        Files.write(udp, Arrays.asList(HEADER,
                "  12: 0100007F:9C40 00000000:0000 07 00000000:00000000 00:00000000 00000000  "
                        + "1000        0 4242 2 0000000000000000 0"), StandardCharsets.US_ASCII);
        Files.write(udp6, Arrays.asList(HEADER,
                "  40: 00000000000000000000000001000000:9C42 00000000000000000000000000000000:0000 07 "
                        + "00000000:00000000 00:00000000 00000000  1000        0 4343 2 0000000000000000 0"),
                StandardCharsets.US_ASCII);

        UdpSocketTable table = new UdpSocketTable(Arrays.asList(udp, udp6));

        assertTrue(table.isReadable());
        assertEquals(2, table.boundPorts().size());
        assertTrue(table.boundPorts().containsAll(Arrays.asList(40000, 40002)));
    }

    @Test
    public void missingTablesAreNotReadable(@TempDir Path dir) {
        UdpSocketTable table = new UdpSocketTable(Collections.singletonList(dir.resolve("udp")));

        assertFalse(table.isReadable());
        assertTrue(table.boundPorts().isEmpty());
    }

    @Test
    public void malformedLinesAreIgnored() {
        assertEquals(-1, UdpSocketTable.localPort(""));
        assertEquals(-1, UdpSocketTable.localPort("  1: 0100007F"));
        assertEquals(-1, UdpSocketTable.localPort("  1: 0100007F:ZZZZ 00000000:0000"));
        assertEquals(53, UdpSocketTable.localPort("  1: 3500007F:0035 00000000:0000 07"));
    }
}
