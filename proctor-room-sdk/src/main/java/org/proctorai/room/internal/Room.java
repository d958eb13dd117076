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

package org.proctorai.room.internal;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.proctorai.room.exception.RoomException;
import org.proctorai.room.exception.RoomException.Code;
import org.proctorai.room.media.EngineRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An exam batch room. Owns exactly one media router for its whole life; a room is only kept
 * registered while it has peers.
 */
public class Room {
    private static final Logger log = LoggerFactory.getLogger(Room.class);

    private final ConcurrentMap<String, Peer> peers = new ConcurrentHashMap<>();
    private final String id;
    private final EngineRouter router;
    private final Instant createdAt;
    private volatile Instant lastActivity;

    private volatile boolean closed = false;

    public Room(String id, EngineRouter router) {
        this.id = id;
        this.router = router;
        this.createdAt = Instant.now();
        this.lastActivity = createdAt;
        log.debug("New ROOM instance, id '{}', router {}", id, router.getId());
    }

    public String getId() {
        return id;
    }

    public EngineRouter getRouter() {
        return router;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    /**
     * Records signaling activity on this room.
     */
    public void touch() {
        lastActivity = Instant.now();
    }

    public void addPeer(Peer peer) {
        checkClosed();
        peers.put(peer.getConnectionId(), peer);
        touch();
        log.info("ROOM {}: Added participant {} ({})", id, peer.getUserId(), peer.getRole());
    }

    public Peer removePeer(String connectionId) {
        Peer peer = peers.remove(connectionId);
        if (peer != null) {
            touch();
            log.info("ROOM {}: Removed participant {}", id, peer.getUserId());
        }
        return peer;
    }

    public Peer getPeer(String connectionId) {
        return peers.get(connectionId);
    }

    public Collection<Peer> getPeers() {
        return Collections.unmodifiableCollection(peers.values());
    }

    public boolean isEmpty() {
        return peers.isEmpty();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Closes the router, which releases every transport still attached to it.
     */
    public void close() {
        if (closed) {
            log.warn("ROOM {}: Already closed", id);
            return;
        }
        closed = true;
        router.close();
        log.info("ROOM {}: Closed, router {} released", id, router.getId());
    }

    private void checkClosed() {
        if (closed) {
            throw new RoomException(Code.ROOM_CLOSED_ERROR_CODE, "The room '" + id + "' is closed");
        }
    }

    @Override
    public String toString() {
        return "Room{id='" + id + "', peers=" + peers.size() + ", closed=" + closed + '}';
    }
}
