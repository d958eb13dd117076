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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the kernel's UDP socket tables ({@code /proc/net/udp}, {@code /proc/net/udp6}) to find
 * out which local ports are bound, without touching the ports themselves.
 */
public class UdpSocketTable {
    private static final Logger log = LoggerFactory.getLogger(UdpSocketTable.class);

    private static final List<Path> SYSTEM_TABLES = Arrays.asList(Paths.get("/proc/net/udp"),
            Paths.get("/proc/net/udp6"));

    private final List<Path> tables;

    public UdpSocketTable(List<Path> tables) {
        this.tables = tables;
    }

    public static UdpSocketTable system() {
        return new UdpSocketTable(SYSTEM_TABLES);
    }

    /**
     * @return false when none of the tables can be read, e.g. on a kernel without procfs
     */
    public boolean isReadable() {
        for (Path table : tables) {
            if (Files.isReadable(table)) {
                return true;
            }
        }
        return false;
    }

    public Set<Integer> boundPorts() {
        Set<Integer> ports = new HashSet<>();
        for (Path table : tables) {
            if (!Files.isReadable(table)) {
                continue;
            }
            try {
                List<String> lines = Files.readAllLines(table, StandardCharsets.US_ASCII);
                // first line is the column header
                for (int i = 1; i < lines.size(); i++) {
                    int port = localPort(lines.get(i));
                    if (port > 0) {
                        ports.add(port);
                    }
                }
            } catch (IOException e) {
                log.warn("Cannot read UDP socket table {}", table, e);
            }
        }
        return ports;
    }

    /**
     * Parses the {@code local_address} column, {@code HEXIP:HEXPORT}.
     */
    static int localPort(String line) {
        String[] columns = line.trim().split("\\s+");
        if (columns.length < 2) {
            return -1;
        }
        int colon = columns[1].lastIndexOf(':');
        if (colon < 0) {
            return -1;
        }
        try {
            return Integer.parseInt(columns[1].substring(colon + 1), 16);
        } catch (NumberFormatException e) {
            log.trace("Unexpected UDP table line: {}", line);
            return -1;
        }
    }
}
