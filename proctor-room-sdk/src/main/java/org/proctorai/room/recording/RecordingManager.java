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
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import javax.annotation.PreDestroy;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.proctorai.room.api.RecordingUploader;
import org.proctorai.room.api.pojo.MediaKind;
import org.proctorai.room.api.pojo.MediaRole;
import org.proctorai.room.api.pojo.PeerRole;
import org.proctorai.room.api.pojo.RecordingMetadata;
import org.proctorai.room.api.pojo.RecordingType;
import org.proctorai.room.api.pojo.UploadResult;
import org.proctorai.room.config.ProctorRoomProperties;
import org.proctorai.room.exception.RoomException;
import org.proctorai.room.exception.RoomException.Code;
import org.proctorai.room.internal.Peer;
import org.proctorai.room.internal.Room;
import org.proctorai.room.media.EngineConsumer;
import org.proctorai.room.media.EnginePlainTransport;
import org.proctorai.room.media.EngineProducer;
import org.proctorai.room.media.MediaEngineAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records the streams of candidates. Every new producer of a {@link PeerRole#STUDENT} peer goes
 * through {@link #onProducerCreated}, which decides whether a recording session starts:
 * <ul>
 * <li>screen video is recorded on its own;</li>
 * <li>webcam video is recorded together with the candidate's webcam audio when there is one;</li>
 * <li>webcam audio arriving shortly after its video replaces the video-only recording with a
 * combined one, arriving later it is not recorded;</li>
 * <li>audio without webcam video and screen audio are not recorded.</li>
 * </ul>
 * Session setup is asynchronous and checks after every engine call that the peer, its producers
 * and the session itself are still alive, aborting into {@link RecordingSession#cleanup} when not.
 */
public class RecordingManager {
    private static final Logger log = LoggerFactory.getLogger(RecordingManager.class);

    private final MediaEngineAdapter mediaEngine;
    private final PortAllocator portAllocator;
    private final EncoderLauncher encoderLauncher;
    private final RecordingPathResolver pathResolver;
    private final RecordingUploader uploader;
    private final ProctorRoomProperties properties;
    private final ScheduledExecutorService scheduler;
    private final Executor loop;
    private final Executor uploadExecutor;

    private final Set<RecordingSession> sessions = ConcurrentHashMap.newKeySet();

    public RecordingManager(MediaEngineAdapter mediaEngine, PortAllocator portAllocator,
                            EncoderLauncher encoderLauncher, RecordingPathResolver pathResolver,
                            RecordingUploader uploader, ProctorRoomProperties properties,
                            ScheduledExecutorService scheduler, Executor loop, Executor uploadExecutor) {
        this.mediaEngine = mediaEngine;
        this.portAllocator = portAllocator;
        this.encoderLauncher = encoderLauncher;
        this.pathResolver = pathResolver;
        this.uploader = uploader;
        this.properties = properties;
        this.scheduler = scheduler;
        this.loop = loop;
        this.uploadExecutor = uploadExecutor;
    }

    /**
     * Applies the recording decision to a producer that has just been registered on the peer.
     *
     * @return the session started for it, or null when nothing is started
     */
    public RecordingSession onProducerCreated(Room room, Peer peer, EngineProducer producer,
                                              MediaRole mediaRole) {
        if (peer.getRole() != PeerRole.STUDENT) {
            return null;
        }
        if (producer.getKind() == MediaKind.VIDEO) {
            if (mediaRole == MediaRole.SCREEN) {
                return startSession(room, peer, RecordingType.SCREEN, producer, null);
            }
            if (mediaRole == MediaRole.WEBCAM) {
                EngineProducer audio = peer.findProducer(MediaKind.AUDIO, MediaRole::isWebcamSource);
                return startSession(room, peer, RecordingType.WEBCAM, producer, audio);
            }
            log.debug("PARTICIPANT {}: Video producer {} tagged '{}' is not recorded", peer.getUserId(),
                    producer.getId(), mediaRole);
            return null;
        }

        if (!mediaRole.isWebcamSource()) {
            log.debug("PARTICIPANT {}: Screen audio {} is not recorded", peer.getUserId(), producer.getId());
            return null;
        }
        EngineProducer video = peer.findProducer(MediaKind.VIDEO, role -> role == MediaRole.WEBCAM);
        if (video == null) {
            log.debug("PARTICIPANT {}: Audio {} has no webcam video to be recorded with",
                    peer.getUserId(), producer.getId());
            return null;
        }
        RecordingSession current = peer.getRecordingSession(video.getId());
        if (current == null || current.isCleanedUp()) {
            return startSession(room, peer, RecordingType.WEBCAM, video, producer);
        }
        if (current.isCombined()) {
            log.debug("PARTICIPANT {}: Webcam recording {} already carries audio", peer.getUserId(),
                    current.getId());
            return null;
        }
        Duration age = Duration.between(current.getCreatedAt(), Instant.now());
        long window = properties.getRecording().getRestartWindow();
        if (age.toMillis() < window) {
            log.info("PARTICIPANT {}: Audio arrived {} ms after webcam video, restarting recording {} with audio",
                    peer.getUserId(), age.toMillis(), current.getId());
            stopSession(peer, current, ExitReason.REPLACED);
            return startSession(room, peer, RecordingType.WEBCAM, video, producer);
        }
        log.info("PARTICIPANT {}: Audio arrived {} ms after webcam video, keeping video-only recording {}",
                peer.getUserId(), age.toMillis(), current.getId());
        return null;
    }

    /**
     * Tears down the session recording the given producer, if any.
     */
    public CompletableFuture<RecordingStatus> onProducerClosed(Peer peer, String producerId) {
        RecordingSession session = peer.getRecordingSession(producerId);
        if (session == null) {
            return CompletableFuture.completedFuture(null);
        }
        return stopSession(peer, session, ExitReason.PRODUCER_CLOSED);
    }

    /**
     * Tears down every session of a leaving peer.
     */
    public CompletableFuture<Void> cleanupPeer(Peer peer) {
        Collection<RecordingSession> peerSessions = peer.getRecordingSessions();
        List<CompletableFuture<RecordingStatus>> results = new ArrayList<>();
        for (RecordingSession session : peerSessions) {
            results.add(stopSession(peer, session, ExitReason.PEER_DISCONNECTED));
        }
        return CompletableFuture.allOf(results.toArray(new CompletableFuture[0]));
    }

    public Collection<RecordingSession> getSessions() {
        return new ArrayList<>(sessions);
    }

    @PreDestroy
    public void close() {
        List<CompletableFuture<RecordingStatus>> results = new ArrayList<>();
        for (RecordingSession session : new ArrayList<>(sessions)) {
            results.add(session.cleanup(ExitReason.SHUTDOWN));
        }
        if (results.isEmpty()) {
            return;
        }
        log.info("Stopping {} recording session(s)", results.size());
        long grace = properties.getRecording().getEncoderStopGrace() + 1000;
        try {
            CompletableFuture.allOf(results.toArray(new CompletableFuture[0])).get(grace, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping recordings");
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Recordings did not all stop within {} ms", grace, e);
        }
    }

    // ------------------------------ setup ------------------------------

    private RecordingSession startSession(Room room, Peer peer, RecordingType type, EngineProducer video,
                                          EngineProducer audio) {
        List<EngineProducer> producers = audio == null ? List.of(video) : Arrays.asList(video, audio);
        List<String> producerIds = new ArrayList<>();
        for (EngineProducer producer : producers) {
            producerIds.add(producer.getId());
        }
        Path output = pathResolver.resolve(type, peer.getExamId(), peer.getBatchId(), peer.getUserId(),
                this::isOutputInUse);
        RecordingSession session = new RecordingSession(type, producerIds, peer.getConnectionId(),
                peer.getUserId(), peer.getExamId(), peer.getBatchId(), output, portAllocator);
        for (String producerId : producerIds) {
            peer.putRecordingSession(producerId, session);
        }
        sessions.add(session);
        session.whenCleanedUp().thenAcceptAsync(status -> onCleanedUp(session, status), uploadExecutor);

        log.info("RECORDING {}: Starting {} recording of {} for candidate {} -> {}", session.getId(), type,
                producerIds, peer.getUserId(), output);
        runPipeline(room, peer, session, producers).whenComplete((v, error) -> {
            if (error == null) {
                return;
            }
            RoomException e = RoomException.from(error);
            if (session.isCleanedUp()) {
                log.debug("RECORDING {}: Setup stopped, session already cleaned up: {}", session.getId(),
                        e.getMessage());
            } else {
                log.error("RECORDING {}: Setup failed", session.getId(), e);
            }
            stopSession(peer, session, ExitReason.SETUP_FAILED);
        });
        return session;
    }

    private boolean isOutputInUse(Path output) {
        for (RecordingSession session : sessions) {
            if (session.getOutputPath().equals(output)) {
                return true;
            }
        }
        return false;
    }

    private static final class Track {
        final EngineProducer producer;
        EnginePlainTransport transport;
        EngineConsumer consumer;
        int port;

        Track(EngineProducer producer) {
            this.producer = producer;
        }
    }

    private CompletableFuture<Void> runPipeline(Room room, Peer peer, RecordingSession session,
                                                List<EngineProducer> producers) {
        List<Track> tracks = new ArrayList<>();
        for (EngineProducer producer : producers) {
            tracks.add(new Track(producer));
        }
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);

        for (Track track : tracks) {
            chain = chain
                    .thenComposeAsync(v -> {
                        ensureAlive(room, peer, session);
                        return mediaEngine.createPlainTransport(room.getRouter());
                    }, loop)
                    .thenAcceptAsync(transport -> {
                        session.attachTransport(transport);
                        if (transport.getLocalIp() == null || transport.getLocalPort() <= 0) {
                            throw new RoomException(Code.MEDIA_GENERIC_ERROR_CODE,
                                    "Plain transport " + transport.getId() + " has no local tuple");
                        }
                        track.transport = transport;
                    }, loop);
        }

        for (Track track : tracks) {
            chain = chain.thenComposeAsync(v -> waitUntilActive(peer, session, track.producer), loop);
        }

        for (Track track : tracks) {
            chain = chain
                    .thenComposeAsync(v -> {
                        ensureAlive(room, peer, session);
                        return mediaEngine.consume(track.transport, track.producer.getId(),
                                recordingCapabilities(room, track.producer.getKind()), true);
                    }, loop)
                    .thenAcceptAsync(consumer -> {
                        session.attachConsumer(consumer);
                        track.consumer = consumer;
                    }, loop);
        }

        CompletableFuture<EncoderProcess> encoderStarted = chain.thenApplyAsync(v -> {
            ensureAlive(room, peer, session);
            List<Integer> leased = new ArrayList<>();
            List<SessionDescriptor.Track> described = new ArrayList<>();
            for (Track track : tracks) {
                track.port = portAllocator.leasePort(leased);
                session.attachPort(track.port);
                leased.add(track.port);
                MediaKind kind = track.producer.getKind();
                described.add(new SessionDescriptor.Track(kind, track.port,
                        SessionDescriptor.payloadType(track.consumer.getRtpParameters(), kind)));
            }
            Path output = session.getOutputPath();
            Path descriptorPath = pathResolver.descriptorFor(output, session.getId());
            SessionDescriptor descriptor = new SessionDescriptor(properties.getRecording().getRecorderIp(),
                    "proctor " + session.getType() + " recording", described);
            try {
                Files.createDirectories(output.getParent());
                descriptor.write(descriptorPath);
                session.attachDescriptor(descriptorPath);
                EncoderProcess encoder = encoderLauncher.launch(descriptorPath, output, described);
                session.attachEncoder(encoder);
                encoder.onExit().thenAcceptAsync(code -> onEncoderExit(peer, session, code), loop);
                log.info("RECORDING {}: {} started on port(s) {}", session.getId(), encoder.getName(), leased);
                return encoder;
            } catch (IOException e) {
                throw new RoomException(Code.RECORDING_ENCODER_ERROR_CODE,
                        "Cannot start encoder for recording " + session.getId() + ": " + e.getMessage(), e);
            }
        }, loop);

        return encoderStarted
                .thenComposeAsync(encoder -> awaitBound(session, encoder), loop)
                .thenComposeAsync(v -> {
                    ensureAlive(room, peer, session);
                    String recorderIp = properties.getRecording().getRecorderIp();
                    List<CompletableFuture<Void>> connects = new ArrayList<>();
                    for (Track track : tracks) {
                        connects.add(mediaEngine.connectPlainTransport(track.transport, recorderIp, track.port));
                    }
                    return CompletableFuture.allOf(connects.toArray(new CompletableFuture[0]))
                            .orTimeout(properties.getTimeouts().getTransportConnect(), TimeUnit.MILLISECONDS);
                }, loop)
                .thenComposeAsync(v -> {
                    ensureAlive(room, peer, session);
                    List<CompletableFuture<Void>> resumed = new ArrayList<>();
                    for (Track track : tracks) {
                        resumed.add(mediaEngine.resume(track.consumer)
                                .thenCompose(r -> track.producer.getKind() == MediaKind.VIDEO
                                        ? mediaEngine.requestKeyFrame(track.consumer)
                                        : CompletableFuture.completedFuture(null)));
                    }
                    return CompletableFuture.allOf(resumed.toArray(new CompletableFuture[0]));
                }, loop)
                .thenAcceptAsync(v -> {
                    ensureAlive(room, peer, session);
                    if (session.markRecording()) {
                        log.info("RECORDING {}: Recording candidate {} ({})", session.getId(),
                                session.getCandidateId(), session.getType());
                    }
                }, loop);
    }

    /**
     * Waits for the encoder to bind its input ports. An encoder still running when the wait times
     * out is given the benefit of the doubt.
     */
    private CompletableFuture<Void> awaitBound(RecordingSession session, EncoderProcess encoder) {
        long timeout = properties.getTimeouts().getEncoderInit();
        return encoder.bound()
                .orTimeout(timeout, TimeUnit.MILLISECONDS)
                .handle((v, error) -> {
                    if (error == null) {
                        log.debug("RECORDING {}: {} bound its input ports", session.getId(), encoder.getName());
                        return null;
                    }
                    RoomException e = RoomException.from(error);
                    if (e.getCause() instanceof TimeoutException && encoder.isAlive()) {
                        log.warn("RECORDING {}: {} did not report bound ports within {} ms, connecting anyway",
                                session.getId(), encoder.getName(), timeout);
                        return null;
                    }
                    throw e;
                });
    }

    private CompletableFuture<Void> waitUntilActive(Peer peer, RecordingSession session, EngineProducer producer) {
        CompletableFuture<Void> active = new CompletableFuture<>();
        long deadline = System.currentTimeMillis() + properties.getTimeouts().getProducerActive();
        long interval = properties.getTimeouts().getProducerCheckInterval();
        Runnable check = () -> {
            if (session.isCleanedUp() || producer.isClosed() || !peer.hasProducer(producer.getId())) {
                active.completeExceptionally(new RoomException(Code.RECORDING_ABORTED_ERROR_CODE,
                        "Producer " + producer.getId() + " went away before recording started"));
            } else if (!producer.isPaused()) {
                active.complete(null);
            } else if (System.currentTimeMillis() >= deadline) {
                active.completeExceptionally(new RoomException(Code.RECORDING_PRODUCER_INACTIVE_ERROR_CODE,
                        "Producer " + producer.getId() + " stayed paused"));
            }
        };
        check.run();
        if (!active.isDone()) {
            log.debug("RECORDING {}: Waiting for producer {} to resume", session.getId(), producer.getId());
            ScheduledFuture<?> poll = scheduler.scheduleWithFixedDelay(check, interval, interval,
                    TimeUnit.MILLISECONDS);
            active.whenComplete((v, e) -> poll.cancel(false));
        }
        return active;
    }

    private void ensureAlive(Room room, Peer peer, RecordingSession session) {
        session.checkActive();
        if (room.isClosed() || peer.isClosed() || room.getPeer(peer.getConnectionId()) != peer) {
            throw new RoomException(Code.RECORDING_ABORTED_ERROR_CODE,
                    "Participant " + peer.getUserId() + " left before recording " + session.getId() + " started");
        }
        for (String producerId : session.getProducerIds()) {
            if (!peer.hasProducer(producerId)) {
                throw new RoomException(Code.RECORDING_ABORTED_ERROR_CODE,
                        "Producer " + producerId + " closed before recording " + session.getId() + " started");
            }
        }
    }

    /**
     * RTP capabilities restricted to the router codec of one kind.
     */
    static JsonObject recordingCapabilities(Room room, MediaKind kind) {
        JsonArray codecs = new JsonArray();
        JsonObject routerCapabilities = room.getRouter().getRtpCapabilities();
        if (routerCapabilities != null && routerCapabilities.has("codecs")) {
            for (JsonElement codec : routerCapabilities.getAsJsonArray("codecs")) {
                JsonObject candidate = codec.getAsJsonObject();
                if (candidate.has("kind") && kind.getValue().equals(candidate.get("kind").getAsString())) {
                    codecs.add(candidate.deepCopy());
                    break;
                }
            }
        }
        JsonObject capabilities = new JsonObject();
        capabilities.add("codecs", codecs);
        capabilities.add("headerExtensions", new JsonArray());
        return capabilities;
    }

    // ----------------------------- teardown -----------------------------

    private CompletableFuture<RecordingStatus> stopSession(Peer peer, RecordingSession session, ExitReason reason) {
        peer.removeRecordingSession(session);
        return session.cleanup(reason);
    }

    private void onEncoderExit(Peer peer, RecordingSession session, Integer code) {
        if (!session.isCleanedUp()) {
            log.warn("RECORDING {}: Encoder exited on its own with code {}", session.getId(), code);
            stopSession(peer, session, ExitReason.ENCODER_EXITED);
        }
    }

    private void onCleanedUp(RecordingSession session, RecordingStatus status) {
        sessions.remove(session);
        if (status != RecordingStatus.COMPLETED) {
            return;
        }
        if (session.getExitReason() == ExitReason.REPLACED) {
            log.info("RECORDING {}: Superseded by a recording with audio, {} is not uploaded", session.getId(),
                    session.getOutputPath());
            return;
        }
        if (session.getExamId() == null) {
            log.warn("RECORDING {}: No exam id, {} is kept locally", session.getId(), session.getOutputPath());
            return;
        }
        RecordingMetadata metadata = new RecordingMetadata(session.getCreatedAt(), session.getEndedAt(),
                session.outputSize(), session.getExitReason().getValue());
        try {
            UploadResult result = uploader.uploadAndSaveRecording(session.getOutputPath(), session.getExamId(),
                    session.getBatchId(), session.getCandidateId(), session.getType(), metadata);
            log.info("RECORDING {}: Uploaded as {}", session.getId(), result);
        } catch (IOException | RuntimeException e) {
            log.error("RECORDING {}: Upload of {} failed", session.getId(), session.getOutputPath(), e);
        }
    }
}
