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

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.proctorai.room.exception.RoomException;
import org.proctorai.room.exception.RoomException.Code;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands out UDP ports of the encoder range {@code [minPort, maxPort)} in round-robin order. Every
 * leased port is checked together with {@code port + 1}, on which the encoder binds RTCP.
 * Leases are bookkeeping only: the check right before use is what guarantees the port is free.
 */
public class PortAllocator {
    private static final Logger log = LoggerFactory.getLogger(PortAllocator.class);

    private final int minPort;
    private final int maxPort;
    private final PortChecker checker;
    private final Set<Integer> leased = ConcurrentHashMap.newKeySet();

    private int next;

    public PortAllocator(int minPort, int maxPort, PortChecker checker) {
        if (minPort <= 0 || maxPort > 65536 || minPort >= maxPort) {
            throw new IllegalArgumentException("Invalid port range [" + minPort + ", " + maxPort + ")");
        }
        this.minPort = minPort;
        this.maxPort = maxPort;
        this.checker = checker;
        this.next = minPort;
    }

    /**
     * @return the next port of the range, wrapping back to the lower bound after the last one
     */
    public synchronized int nextPort() {
        int port = next;
        next++;
        if (next >= maxPort) {
            next = minPort;
        }
        return port;
    }

    public int leasePort() {
        return leasePort(Collections.emptySet());
    }

    /**
     * Leases the next port that is free for RTP and RTCP, skipping the ports in {@code reserved}
     * and their RTCP companions.
     *
     * @throws RoomException with {@link Code#RECORDING_PORT_UNAVAILABLE_ERROR_CODE} after a full
     *                       turn of the range without finding one
     */
    public int leasePort(Collection<Integer> reserved) {
        int attempts = maxPort - minPort;
        for (int i = 0; i < attempts; i++) {
            int port = nextPort();
            if (clashes(port, reserved) || !checker.isAvailable(port) || !checker.isAvailable(port + 1)) {
                continue;
            }
            if (leased.add(port)) {
                log.debug("Leased encoder port {}", port);
                return port;
            }
        }
        throw new RoomException(Code.RECORDING_PORT_UNAVAILABLE_ERROR_CODE,
                "No free UDP port in [" + minPort + ", " + maxPort + ")");
    }

    public void release(int port) {
        if (leased.remove(port)) {
            log.debug("Released encoder port {}", port);
        }
    }

    public int getLeasedCount() {
        return leased.size();
    }

    public int getMinPort() {
        return minPort;
    }

    public int getMaxPort() {
        return maxPort;
    }

    private boolean clashes(int port, Collection<Integer> reserved) {
        for (int neighbour = port - 1; neighbour <= port + 1; neighbour++) {
            if (reserved.contains(neighbour) || leased.contains(neighbour)) {
                return true;
            }
        }
        return false;
    }
}
