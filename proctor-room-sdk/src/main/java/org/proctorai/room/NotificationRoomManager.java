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

package org.proctorai.room;

import java.util.ArrayList;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

import javax.annotation.PreDestroy;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.proctorai.room.api.UserNotificationService;
import org.proctorai.room.api.pojo.AuthenticatedUser;
import org.proctorai.room.api.pojo.MediaKind;
import org.proctorai.room.api.pojo.MediaRole;
import org.proctorai.room.api.pojo.ParticipantRequest;
import org.proctorai.room.api.pojo.PeerRole;
import org.proctorai.room.api.pojo.ProducerInfo;
import org.proctorai.room.api.pojo.TransportDirection;
import org.proctorai.room.exception.RoomException;
import org.proctorai.room.exception.RoomException.Code;
import org.proctorai.room.internal.Peer;
import org.proctorai.room.internal.Room;
import org.proctorai.room.media.EngineConsumer;
import org.proctorai.room.media.EngineProducer;
import org.proctorai.room.media.EngineWebRtcTransport;
import org.proctorai.room.media.MediaEngineAdapter;
import org.proctorai.room.recording.RecordingManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The room manager as seen by the signaling layer. Every client-originated request is executed
 * against the {@link RoomManager} and answered through the {@link UserNotificationService}, errors
 * included: a failing request never affects the connection it came from.
 * <p/>
 * All methods are to be invoked on the signaling event loop, and continuations of media engine
 * calls are brought back onto it. Peers and producers looked up before an engine call are checked
 * again after it, since the client may have left in the meantime.
 */
public class NotificationRoomManager {
    private final Logger log = LoggerFactory.getLogger(NotificationRoomManager.class);

    public static final String EXISTING_PRODUCERS = "existing-producers";
    public static final String NEW_PRODUCER = "new-producer";
    public static final String PRODUCER_CLOSED = "producer-closed";

    private static final int JOIN_ATTEMPTS = 2;

    private final RoomManager roomManager;
    private final AccessPolicy accessPolicy;
    private final RecordingManager recordingManager;
    private final MediaEngineAdapter mediaEngine;
    private final UserNotificationService notificationService;
    private final Executor loop;

    private final ConcurrentMap<String, AuthenticatedUser> connections = new ConcurrentHashMap<>();

    public NotificationRoomManager(RoomManager roomManager, AccessPolicy accessPolicy,
                                   RecordingManager recordingManager, MediaEngineAdapter mediaEngine,
                                   UserNotificationService notificationService, Executor loop) {
        this.roomManager = roomManager;
        this.accessPolicy = accessPolicy;
        this.recordingManager = recordingManager;
        this.mediaEngine = mediaEngine;
        this.notificationService = notificationService;
        this.loop = loop;
    }

    // ----------------- CONNECTION LIFECYCLE ------------

    /**
     * Registers the identity verified when the connection was established.
     */
    public void openConnection(String connectionId, AuthenticatedUser user) {
        connections.put(connectionId, user);
        log.info("PARTICIPANT {}: Connected as {} ({})", user.getUserId(), connectionId, user.getRole());
    }

    /**
     * Releases everything the connection owns: recordings, transports, membership, and the room
     * itself if it becomes empty.
     */
    public CompletableFuture<Void> disconnect(String connectionId) {
        AuthenticatedUser user = connections.remove(connectionId);
        if (!roomManager.isJoined(connectionId)) {
            log.debug("Connection {} ({}) closed without having joined", connectionId,
                    user != null ? user.getUserId() : null);
            return CompletableFuture.completedFuture(null);
        }
        try {
            return removePeer(connectionId);
        } catch (RoomException e) {
            log.warn("Error releasing connection {}", connectionId, e);
            return CompletableFuture.failedFuture(e);
        }
    }

    // ----------------- CLIENT-ORIGINATED REQUESTS ------------

    /**
     * Joins (creating it if needed) the room. Replies with the router RTP capabilities, then
     * pushes {@code existing-producers} with the streams the peer may consume.
     */
    public CompletableFuture<JsonElement> joinRoom(ParticipantRequest request, String roomId, String role,
                                                   String examId) {
        String connectionId = request.getConnectionId();
        return execute(request, "JOIN_ROOM", () -> {
            AuthenticatedUser user = requireUser(connectionId);
            requireText(roomId, "roomId");
            PeerRole peerRole = resolveRole(user, role);
            if (roomManager.isJoined(connectionId)) {
                removePeer(connectionId);
            }
            return joinWithRetry(roomId, connectionId, user, peerRole, blankToNull(examId), JOIN_ATTEMPTS)
                    .thenApply(peer -> {
                        JsonObject result = new JsonObject();
                        Room room = roomManager.findRoom(connectionId);
                        result.add("routerCapabilities", room.getRouter().getRtpCapabilities());
                        result.addProperty("role", peer.getRole().getValue());
                        return (JsonElement) result;
                    });
        }).thenApply(result -> {
            Room room = roomManager.findRoom(connectionId);
            Peer peer = roomManager.getPeer(connectionId);
            pushExistingProducers(room, peer);
            return result;
        });
    }

    public CompletableFuture<JsonElement> createTransport(ParticipantRequest request, String direction) {
        return execute(request, "CREATE_TRANSPORT", () -> {
            TransportDirection transportDirection = TransportDirection.fromValue(direction);
            Peer peer = roomManager.getPeer(request.getConnectionId());
            Room room = roomManager.findRoom(request.getConnectionId());
            return createTransport(room, peer, transportDirection)
                    .thenApply(transport -> (JsonElement) transportInfo(transport));
        });
    }

    public CompletableFuture<JsonElement> connectTransport(ParticipantRequest request, String transportId,
                                                           JsonObject dtlsParameters) {
        return execute(request, "CONNECT_TRANSPORT", () -> {
            requireObject(dtlsParameters, "dtlsParameters");
            Peer peer = roomManager.getPeer(request.getConnectionId());
            EngineWebRtcTransport transport = peer.getTransport(transportId);
            roomManager.findRoom(request.getConnectionId()).touch();
            return mediaEngine.connectWebRtcTransport(transport, dtlsParameters)
                    .thenApply(v -> (JsonElement) new JsonObject());
        });
    }

    /**
     * Publishes a track. After the reply, permitted viewers are told about the new producer and
     * the recording decision is applied.
     */
    public CompletableFuture<JsonElement> produce(ParticipantRequest request, String transportId, String kind,
                                                  JsonObject rtpParameters, JsonObject appData) {
        String connectionId = request.getConnectionId();
        return execute(request, "PRODUCE", () -> {
            MediaKind mediaKind = MediaKind.fromValue(kind);
            requireObject(rtpParameters, "rtpParameters");
            requireObject(appData, "appData");
            MediaRole mediaRole = MediaRole.fromValue(
                    appData.has("mediaRole") && !appData.get("mediaRole").isJsonNull()
                            ? appData.get("mediaRole").getAsString() : null);
            Peer peer = roomManager.getPeer(connectionId);
            Room room = roomManager.findRoom(connectionId);
            EngineWebRtcTransport transport = peer.getTransport(transportId);
            if (transport.getDirection() != TransportDirection.SEND) {
                throw new RoomException(Code.MEDIA_TRANSPORT_NOT_FOUND_ERROR_CODE,
                        "Transport '" + transportId + "' is not a send transport");
            }
            JsonObject producerAppData = appData.deepCopy();
            producerAppData.addProperty("userId", peer.getUserId());

            return mediaEngine.produce(transport, mediaKind, rtpParameters, producerAppData)
                    .thenApplyAsync(producer -> {
                        if (!isCurrent(room, peer)) {
                            producer.close();
                            throw new RoomException(Code.USER_NOT_FOUND_ERROR_CODE,
                                    "Participant " + peer.getUserId() + " left while producing");
                        }
                        peer.addProducer(producer, mediaRole);
                        room.touch();
                        producer.addCloseListener(() -> loop.execute(() -> onProducerClosed(room, peer,
                                producer.getId())));
                        log.info("PARTICIPANT {}: Producing {} {} ({})", peer.getUserId(), mediaRole, mediaKind,
                                producer.getId());
                        JsonObject result = new JsonObject();
                        result.addProperty("producerId", producer.getId());
                        return (JsonElement) result;
                    }, loop);
        }).thenApply(result -> {
            String producerId = result.getAsJsonObject().get("producerId").getAsString();
            onProducerPublished(connectionId, producerId);
            return result;
        });
    }

    /**
     * Subscribes the peer to another peer's producer, creating a receiving transport when the
     * peer has none.
     */
    public CompletableFuture<JsonElement> consume(ParticipantRequest request, String producerId,
                                                  JsonObject rtpCapabilities) {
        return execute(request, "CONSUME", () -> {
            requireText(producerId, "producerId");
            requireObject(rtpCapabilities, "rtpCapabilities");
            Peer viewer = roomManager.getPeer(request.getConnectionId());
            Room room = roomManager.findRoom(request.getConnectionId());
            Peer publisher = findPublisher(room, producerId);
            if (!accessPolicy.canAccessStream(viewer.getRole(), publisher.getRole())) {
                throw new RoomException(Code.USER_NOT_AUTHORIZED_ERROR_CODE,
                        "Role '" + viewer.getRole() + "' may not consume streams of role '" + publisher.getRole() + "'");
            }
            room.touch();
            JsonObject result = new JsonObject();
            return mediaEngine.canConsume(room.getRouter(), producerId, rtpCapabilities)
                    .thenComposeAsync(canConsume -> {
                        if (!Boolean.TRUE.equals(canConsume)) {
                            throw new RoomException(Code.MEDIA_CANNOT_CONSUME_ERROR_CODE,
                                    "Cannot consume producer '" + producerId + "' with the given capabilities");
                        }
                        EngineWebRtcTransport recv = viewer.getRecvTransport();
                        if (recv != null) {
                            return CompletableFuture.completedFuture(recv);
                        }
                        log.debug("PARTICIPANT {}: No receiving transport, creating one", viewer.getUserId());
                        return createTransport(room, viewer, TransportDirection.RECV).thenApply(created -> {
                            result.add("transport", transportInfo(created));
                            return created;
                        });
                    }, loop)
                    .thenComposeAsync(recv -> {
                        ensureCurrent(room, viewer);
                        return mediaEngine.consume(recv, producerId, rtpCapabilities, false)
                                .thenApplyAsync(consumer -> {
                                    if (!isCurrent(room, viewer) || !publisher.hasProducer(producerId)) {
                                        consumer.close();
                                        throw new RoomException(Code.MEDIA_PRODUCER_NOT_FOUND_ERROR_CODE,
                                                "Producer '" + producerId + "' or its viewer went away while consuming");
                                    }
                                    viewer.addConsumer(consumer);
                                    log.info("PARTICIPANT {}: Consuming {} of {} ({})", viewer.getUserId(),
                                            consumer.getKind(), publisher.getUserId(), consumer.getId());
                                    result.addProperty("consumerId", consumer.getId());
                                    result.addProperty("producerId", producerId);
                                    result.addProperty("kind", consumer.getKind().getValue());
                                    result.add("rtpParameters", consumer.getRtpParameters());
                                    result.addProperty("transportId", recv.getId());
                                    return (JsonElement) result;
                                }, loop);
                    }, loop);
        });
    }

    /**
     * Replies with, and pushes as {@code existing-producers}, the streams the peer may consume.
     */
    public CompletableFuture<JsonElement> getProducers(ParticipantRequest request) {
        return execute(request, "GET_PRODUCERS", () -> {
            Peer peer = roomManager.getPeer(request.getConnectionId());
            Room room = roomManager.findRoom(request.getConnectionId());
            room.touch();
            return CompletableFuture.completedFuture((JsonElement) pushExistingProducers(room, peer));
        });
    }

    /**
     * Stops one of the peer's own producers.
     */
    public CompletableFuture<JsonElement> closeProducer(ParticipantRequest request, String producerId) {
        return execute(request, "CLOSE_PRODUCER", () -> {
            requireText(producerId, "producerId");
            Peer peer = roomManager.getPeer(request.getConnectionId());
            Room room = roomManager.findRoom(request.getConnectionId());
            EngineProducer producer = peer.getProducer(producerId);
            if (producer == null) {
                throw new RoomException(Code.MEDIA_PRODUCER_NOT_FOUND_ERROR_CODE,
                        "Producer '" + producerId + "' not found for participant " + peer.getUserId());
            }
            producer.close();
            onProducerClosed(room, peer, producerId);
            return CompletableFuture.completedFuture((JsonElement) new JsonObject());
        });
    }

    // ----------------- SERVER-ORIGINATED EVENTS ------------

    /**
     * Cascade of a producer closing, whoever closed it: viewers are told, its recording stops.
     * Runs at most once per producer.
     */
    void onProducerClosed(Room room, Peer peer, String producerId) {
        MediaRole mediaRole = peer.getMediaRole(producerId);
        EngineProducer producer = peer.removeProducer(producerId);
        if (producer == null) {
            return;
        }
        log.info("PARTICIPANT {}: Producer {} ({}) closed", peer.getUserId(), producerId, mediaRole);
        if (!room.isClosed()) {
            JsonObject params = producerJson(new ProducerInfo(producerId, peer.getUserId(), mediaRole,
                    producer.getKind()));
            for (Peer viewer : accessPolicy.permittedViewers(room, peer)) {
                notificationService.sendNotification(viewer.getConnectionId(), PRODUCER_CLOSED, params);
            }
        }
        recordingManager.onProducerClosed(peer, producerId);
    }

    @PreDestroy
    public void close() {
        log.info("Disconnecting {} connection(s)", connections.size());
        for (String connectionId : new ArrayList<>(connections.keySet())) {
            disconnect(connectionId);
        }
    }

    public int getConnectionCount() {
        return connections.size();
    }

    // ----------------- internals ------------

    private CompletableFuture<JsonElement> execute(ParticipantRequest request, String method,
                                                   Supplier<CompletableFuture<JsonElement>> action) {
        log.debug("Request [{}] {}", method, request);
        CompletableFuture<JsonElement> pending;
        try {
            pending = action.get();
        } catch (RuntimeException e) {
            pending = CompletableFuture.failedFuture(e);
        }
        CompletableFuture<JsonElement> replied = new CompletableFuture<>();
        pending.whenCompleteAsync((result, error) -> {
            if (error != null) {
                RoomException e = RoomException.from(error);
                log.warn("PARTICIPANT {}: Error in [{}]: {} {}", request.getConnectionId(), method, e.getType(),
                        e.getMessage());
                notificationService.sendErrorResponse(request, e);
                replied.completeExceptionally(e);
            } else {
                notificationService.sendResponse(request, result);
                replied.complete(result);
            }
        }, loop);
        return replied;
    }

    private CompletableFuture<Peer> joinWithRetry(String roomId, String connectionId, AuthenticatedUser user,
                                                  PeerRole role, String examId, int attempts) {
        return roomManager.getOrCreateRoom(roomId)
                .thenApplyAsync(room -> {
                    if (connections.get(connectionId) != user) {
                        roomManager.closeIfEmpty(room);
                        throw new RoomException(Code.USER_NOT_FOUND_ERROR_CODE,
                                "Connection " + connectionId + " closed while joining room '" + roomId + "'");
                    }
                    return roomManager.join(room, connectionId, user.getUserId(), role, examId);
                }, loop)
                .handleAsync((peer, error) -> {
                    if (error == null) {
                        return CompletableFuture.completedFuture(peer);
                    }
                    RoomException e = RoomException.from(error);
                    if (e.getCode() == Code.ROOM_CLOSED_ERROR_CODE && attempts > 1 && !roomManager.isClosed()) {
                        log.info("ROOM {}: Closed while {} was joining, retrying", roomId, user.getUserId());
                        return joinWithRetry(roomId, connectionId, user, role, examId, attempts - 1);
                    }
                    return CompletableFuture.<Peer>failedFuture(e);
                }, loop)
                .thenCompose(f -> f);
    }

    private CompletableFuture<EngineWebRtcTransport> createTransport(Room room, Peer peer,
                                                                   TransportDirection direction) {
        room.touch();
        return mediaEngine.createWebRtcTransport(room.getRouter(), direction).thenApplyAsync(transport -> {
            if (!isCurrent(room, peer)) {
                transport.close();
                throw new RoomException(Code.USER_NOT_FOUND_ERROR_CODE,
                        "Participant " + peer.getUserId() + " left while creating a transport");
            }
            peer.addTransport(transport);
            log.debug("PARTICIPANT {}: Created {} transport {}", peer.getUserId(), direction, transport.getId());
            return transport;
        }, loop);
    }

    private void onProducerPublished(String connectionId, String producerId) {
        if (!roomManager.isJoined(connectionId)) {
            return;
        }
        Room room = roomManager.findRoom(connectionId);
        Peer peer = roomManager.getPeer(connectionId);
        EngineProducer producer = peer.getProducer(producerId);
        if (producer == null || producer.isClosed()) {
            return;
        }
        MediaRole mediaRole = peer.getMediaRole(producerId);
        JsonObject params = producerJson(new ProducerInfo(producerId, peer.getUserId(), mediaRole,
                producer.getKind()));
        for (Peer viewer : accessPolicy.permittedViewers(room, peer)) {
            notificationService.sendNotification(viewer.getConnectionId(), NEW_PRODUCER, params);
        }
        recordingManager.onProducerCreated(room, peer, producer, mediaRole);
    }

    private CompletableFuture<Void> removePeer(String connectionId) {
        Room room = roomManager.findRoom(connectionId);
        Peer peer = roomManager.getPeer(connectionId);
        CompletableFuture<Void> recordings = recordingManager.cleanupPeer(peer);
        roomManager.leave(connectionId);
        for (EngineProducer producer : new ArrayList<>(peer.getProducers())) {
            onProducerClosed(room, peer, producer.getId());
        }
        log.info("PARTICIPANT {}: Left room {}", peer.getUserId(), room.getId());
        return recordings;
    }

    private JsonArray pushExistingProducers(Room room, Peer peer) {
        JsonArray producers = new JsonArray();
        for (ProducerInfo info : accessPolicy.accessibleProducers(room, peer)) {
            producers.add(producerJson(info));
        }
        notificationService.sendNotification(peer.getConnectionId(), EXISTING_PRODUCERS, producers);
        return producers;
    }

    private Peer findPublisher(Room room, String producerId) {
        for (Peer candidate : room.getPeers()) {
            if (candidate.hasProducer(producerId)) {
                return candidate;
            }
        }
        throw new RoomException(Code.MEDIA_PRODUCER_NOT_FOUND_ERROR_CODE,
                "Producer '" + producerId + "' not found in room '" + room.getId() + "'");
    }

    private boolean isCurrent(Room room, Peer peer) {
        return !room.isClosed() && !peer.isClosed() && room.getPeer(peer.getConnectionId()) == peer;
    }

    private void ensureCurrent(Room room, Peer peer) {
        if (!isCurrent(room, peer)) {
            throw new RoomException(Code.USER_NOT_FOUND_ERROR_CODE,
                    "Participant " + peer.getUserId() + " is no longer in room '" + room.getId() + "'");
        }
    }

    private AuthenticatedUser requireUser(String connectionId) {
        AuthenticatedUser user = connectionId == null ? null : connections.get(connectionId);
        if (user == null) {
            throw new RoomException(Code.USER_NOT_AUTHENTICATED_ERROR_CODE,
                    "Connection '" + connectionId + "' is not authenticated");
        }
        return user;
    }

    /**
     * The token role wins; a token without role lets the client choose.
     */
    static PeerRole resolveRole(AuthenticatedUser user, String declared) {
        PeerRole declaredRole = declared == null || declared.isBlank() ? null : PeerRole.fromValue(declared);
        if (user.getRole() != null) {
            if (declaredRole != null && declaredRole != user.getRole()) {
                throw new RoomException(Code.USER_NOT_AUTHORIZED_ERROR_CODE,
                        "User " + user.getUserId() + " may not join as '" + declaredRole + "'");
            }
            return user.getRole();
        }
        if (declaredRole == null) {
            throw new RoomException(Code.REQUEST_INVALID_PARAMS_ERROR_CODE, "Missing role");
        }
        return declaredRole;
    }

    static JsonObject producerJson(ProducerInfo info) {
        JsonObject json = new JsonObject();
        json.addProperty("producerId", info.getProducerId());
        json.addProperty("userId", info.getUserId());
        json.addProperty("mediaRole", info.getMediaRole() != null ? info.getMediaRole().getValue() : null);
        json.addProperty("kind", info.getKind().getValue());
        return json;
    }

    private static JsonObject transportInfo(EngineWebRtcTransport transport) {
        JsonObject info = new JsonObject();
        info.addProperty("transportId", transport.getId());
        info.add("iceParameters", transport.getIceParameters());
        info.add("iceCandidates", transport.getIceCandidates());
        info.add("dtlsParameters", transport.getDtlsParameters());
        return info;
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new RoomException(Code.REQUEST_INVALID_PARAMS_ERROR_CODE, "Missing '" + name + "'");
        }
    }

    private static void requireObject(JsonObject value, String name) {
        if (value == null) {
            throw new RoomException(Code.REQUEST_INVALID_PARAMS_ERROR_CODE, "Missing '" + name + "'");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
