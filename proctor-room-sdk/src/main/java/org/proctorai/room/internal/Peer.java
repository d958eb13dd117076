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
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

import org.proctorai.room.api.pojo.MediaKind;
import org.proctorai.room.api.pojo.MediaRole;
import org.proctorai.room.api.pojo.PeerRole;
import org.proctorai.room.api.pojo.ProducerInfo;
import org.proctorai.room.api.pojo.TransportDirection;
import org.proctorai.room.exception.RoomException;
import org.proctorai.room.exception.RoomException.Code;
import org.proctorai.room.media.EngineConsumer;
import org.proctorai.room.media.EngineProducer;
import org.proctorai.room.media.EngineWebRtcTransport;
import org.proctorai.room.recording.RecordingSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A connected participant of a {@link Room}, identified by its signaling connection. Holds the
 * media objects it created, keyed by their engine ids, and the recording sessions started for its
 * producers.
 */
public class Peer {
    private static final Logger log = LoggerFactory.getLogger(Peer.class);

    private final String connectionId;
    private final String userId;
    private final PeerRole role;
    private final String examId;
    private final String batchId;
    private final Instant joinedAt;

    private final Map<String, EngineWebRtcTransport> transports = new ConcurrentHashMap<>();
    private final Map<String, EngineProducer> producers = new ConcurrentHashMap<>();
    private final Map<String, MediaRole> producerRoles = new ConcurrentHashMap<>();
    private final Map<String, EngineConsumer> consumers = new ConcurrentHashMap<>();
    private final Map<String, RecordingSession> recordingSessions = new ConcurrentHashMap<>();

    private volatile boolean closed = false;

    public Peer(String connectionId, String userId, PeerRole role, String examId, String batchId) {
        this.connectionId = connectionId;
        this.userId = userId;
        this.role = role;
        this.examId = examId;
        this.batchId = batchId;
        this.joinedAt = Instant.now();
    }

    public String getConnectionId() {
        return connectionId;
    }

    public String getUserId() {
        return userId;
    }

    public PeerRole getRole() {
        return role;
    }

    public String getExamId() {
        return examId;
    }

    public String getBatchId() {
        return batchId;
    }

    public Instant getJoinedAt() {
        return joinedAt;
    }

    public boolean isClosed() {
        return closed;
    }

    // ------------------------ transports ------------------------

    public void addTransport(EngineWebRtcTransport transport) {
        transports.put(transport.getId(), transport);
        transport.addCloseListener(() -> transports.remove(transport.getId()));
    }

    public EngineWebRtcTransport getTransport(String transportId) {
        EngineWebRtcTransport transport = transportId == null ? null : transports.get(transportId);
        if (transport == null) {
            throw new RoomException(Code.MEDIA_TRANSPORT_NOT_FOUND_ERROR_CODE,
                    "Transport '" + transportId + "' not found for participant " + userId);
        }
        return transport;
    }

    /**
     * @return the first receiving transport of this peer, or null when it has none
     */
    public EngineWebRtcTransport getRecvTransport() {
        for (EngineWebRtcTransport transport : transports.values()) {
            if (transport.getDirection() == TransportDirection.RECV && !transport.isClosed()) {
                return transport;
            }
        }
        return null;
    }

    public Collection<EngineWebRtcTransport> getTransports() {
        return Collections.unmodifiableCollection(transports.values());
    }

    // ------------------------ producers ------------------------

    public void addProducer(EngineProducer producer, MediaRole mediaRole) {
        producers.put(producer.getId(), producer);
        producerRoles.put(producer.getId(), mediaRole);
    }

    public EngineProducer getProducer(String producerId) {
        return producerId == null ? null : producers.get(producerId);
    }

    public boolean hasProducer(String producerId) {
        EngineProducer producer = getProducer(producerId);
        return producer != null && !producer.isClosed();
    }

    public EngineProducer removeProducer(String producerId) {
        producerRoles.remove(producerId);
        return producers.remove(producerId);
    }

    public MediaRole getMediaRole(String producerId) {
        return producerRoles.get(producerId);
    }

    /**
     * Finds an open producer of the given kind whose media role satisfies the test.
     */
    public EngineProducer findProducer(MediaKind kind, Predicate<MediaRole> role) {
        for (EngineProducer producer : producers.values()) {
            if (producer.getKind() == kind && !producer.isClosed()
                    && role.test(producerRoles.get(producer.getId()))) {
                return producer;
            }
        }
        return null;
    }

    public Collection<EngineProducer> getProducers() {
        return Collections.unmodifiableCollection(producers.values());
    }

    public List<ProducerInfo> getProducerInfos() {
        List<ProducerInfo> infos = new ArrayList<>();
        for (EngineProducer producer : producers.values()) {
            if (!producer.isClosed()) {
                infos.add(new ProducerInfo(producer.getId(), userId, producerRoles.get(producer.getId()),
                        producer.getKind()));
            }
        }
        return infos;
    }

    // ------------------------ consumers ------------------------

    public void addConsumer(EngineConsumer consumer) {
        consumers.put(consumer.getId(), consumer);
        consumer.addCloseListener(() -> consumers.remove(consumer.getId()));
    }

    public EngineConsumer getConsumer(String consumerId) {
        return consumers.get(consumerId);
    }

    public Collection<EngineConsumer> getConsumers() {
        return Collections.unmodifiableCollection(consumers.values());
    }

    // ------------------------ recordings ------------------------

    public RecordingSession getRecordingSession(String producerId) {
        return recordingSessions.get(producerId);
    }

    public void putRecordingSession(String producerId, RecordingSession session) {
        recordingSessions.put(producerId, session);
    }

    /**
     * Removes every key aliasing the given session.
     */
    public void removeRecordingSession(RecordingSession session) {
        recordingSessions.values().removeIf(s -> s == session);
    }

    /**
     * @return the distinct recording sessions of this peer
     */
    public Collection<RecordingSession> getRecordingSessions() {
        List<RecordingSession> distinct = new ArrayList<>();
        for (RecordingSession session : recordingSessions.values()) {
            if (!distinct.contains(session)) {
                distinct.add(session);
            }
        }
        return distinct;
    }

    /**
     * Closes every transport of the peer, and with them its producers and consumers.
     */
    public void close() {
        if (closed) {
            log.warn("PARTICIPANT {}: Already closed", userId);
            return;
        }
        closed = true;
        for (EngineWebRtcTransport transport : new ArrayList<>(transports.values())) {
            try {
                transport.close();
            } catch (RuntimeException e) {
                log.warn("PARTICIPANT {}: Error closing transport {}", userId, transport.getId(), e);
            }
        }
        transports.clear();
        consumers.clear();
        log.debug("PARTICIPANT {}: Closed {} producer(s)", userId, producers.size());
    }

    @Override
    public String toString() {
        return "Peer{connectionId='" + connectionId + "', userId='" + userId + "', role=" + role + '}';
    }
}
