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
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import org.proctorai.room.api.pojo.RecordingType;
import org.proctorai.room.exception.RoomException;
import org.proctorai.room.exception.RoomException.Code;
import org.proctorai.room.media.EngineConsumer;
import org.proctorai.room.media.EnginePlainTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One candidate recording: the plain transports and consumers forwarding the recorded tracks, the
 * leased encoder ports, the SDP file and the encoder process.
 * <p/>
 * Resources are attached one by one while the session is being set up. {@link #cleanup} may run
 * at any point of that setup, any number of times and from any thread: the first call releases
 * whatever is attached, later calls get the same result, and a resource attached after cleanup
 * began is released on the spot.
 */
public class RecordingSession {
    private static final Logger log = LoggerFactory.getLogger(RecordingSession.class);

    private final String id;
    private final RecordingType type;
    private final List<String> producerIds;
    private final String connectionId;
    private final String candidateId;
    private final String examId;
    private final String batchId;
    private final Path outputPath;
    private final Instant createdAt;
    private final PortAllocator portAllocator;

    private final List<EnginePlainTransport> transports = new ArrayList<>();
    private final List<EngineConsumer> consumers = new ArrayList<>();
    private final List<Integer> ports = new ArrayList<>();
    private EncoderProcess encoder;
    private Path descriptorPath;

    private volatile RecordingStatus status = RecordingStatus.INITIALIZING;
    private volatile ExitReason exitReason;
    private volatile Instant endedAt;

    private final AtomicBoolean cleanupStarted = new AtomicBoolean();
    private final CompletableFuture<RecordingStatus> cleanupResult = new CompletableFuture<>();
    private final CompletableFuture<Void> started = new CompletableFuture<>();

    public RecordingSession(RecordingType type, List<String> producerIds, String connectionId,
                            String candidateId, String examId, String batchId, Path outputPath,
                            PortAllocator portAllocator) {
        this.id = UUID.randomUUID().toString().substring(0, 8);
        this.type = type;
        this.producerIds = Collections.unmodifiableList(new ArrayList<>(producerIds));
        this.connectionId = connectionId;
        this.candidateId = candidateId;
        this.examId = examId;
        this.batchId = batchId;
        this.outputPath = outputPath;
        this.portAllocator = portAllocator;
        this.createdAt = Instant.now();
    }

    public String getId() {
        return id;
    }

    public RecordingType getType() {
        return type;
    }

    public List<String> getProducerIds() {
        return producerIds;
    }

    public boolean isCombined() {
        return producerIds.size() > 1;
    }

    public String getConnectionId() {
        return connectionId;
    }

    public String getCandidateId() {
        return candidateId;
    }

    public String getExamId() {
        return examId;
    }

    public String getBatchId() {
        return batchId;
    }

    public Path getOutputPath() {
        return outputPath;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getEndedAt() {
        return endedAt;
    }

    public RecordingStatus getStatus() {
        return status;
    }

    public ExitReason getExitReason() {
        return exitReason;
    }

    public boolean isCleanedUp() {
        return cleanupStarted.get();
    }

    public synchronized EncoderProcess getEncoder() {
        return encoder;
    }

    public synchronized Path getDescriptorPath() {
        return descriptorPath;
    }

    public synchronized List<Integer> getPorts() {
        return new ArrayList<>(ports);
    }

    public synchronized List<EnginePlainTransport> getTransports() {
        return new ArrayList<>(transports);
    }

    public synchronized List<EngineConsumer> getConsumers() {
        return new ArrayList<>(consumers);
    }

    /**
     * Completes when the session reaches {@link RecordingStatus#RECORDING}, fails when it is
     * cleaned up before.
     */
    public CompletableFuture<Void> started() {
        return started;
    }

    /**
     * Completes with the final status once cleanup has finished.
     */
    public CompletableFuture<RecordingStatus> whenCleanedUp() {
        return cleanupResult;
    }

    // --------------- resources attached during setup ---------------

    public void attachTransport(EnginePlainTransport transport) {
        synchronized (this) {
            if (!cleanupStarted.get()) {
                transports.add(transport);
                return;
            }
        }
        transport.close();
        throw aborted();
    }

    public void attachConsumer(EngineConsumer consumer) {
        synchronized (this) {
            if (!cleanupStarted.get()) {
                consumers.add(consumer);
                return;
            }
        }
        consumer.close();
        throw aborted();
    }

    public void attachPort(int port) {
        synchronized (this) {
            if (!cleanupStarted.get()) {
                ports.add(port);
                return;
            }
        }
        portAllocator.release(port);
        throw aborted();
    }

    public void attachDescriptor(Path path) {
        synchronized (this) {
            if (!cleanupStarted.get()) {
                descriptorPath = path;
                return;
            }
        }
        deleteQuietly(path);
        throw aborted();
    }

    public void attachEncoder(EncoderProcess process) {
        synchronized (this) {
            if (!cleanupStarted.get()) {
                encoder = process;
                return;
            }
        }
        process.stop();
        throw aborted();
    }

    /**
     * @throws RoomException with {@link Code#RECORDING_ABORTED_ERROR_CODE} if cleanup started
     */
    public void checkActive() {
        if (cleanupStarted.get()) {
            throw aborted();
        }
    }

    public synchronized boolean markRecording() {
        if (cleanupStarted.get()) {
            return false;
        }
        status = RecordingStatus.RECORDING;
        started.complete(null);
        return true;
    }

    // ---------------------------- teardown ----------------------------

    /**
     * Stops the encoder, then releases consumers, transports, the descriptor file and the ports.
     * Idempotent: every caller gets the future of the first invocation.
     *
     * @return the final status: {@link RecordingStatus#COMPLETED} when media reached the output,
     * {@link RecordingStatus#FAILED} otherwise, {@link RecordingStatus#ERROR} if a release failed
     */
    public CompletableFuture<RecordingStatus> cleanup(ExitReason reason) {
        if (!cleanupStarted.compareAndSet(false, true)) {
            return cleanupResult;
        }
        EncoderProcess encoderToStop;
        List<EngineConsumer> consumersToClose;
        List<EnginePlainTransport> transportsToClose;
        List<Integer> portsToRelease;
        Path descriptorToDelete;
        synchronized (this) {
            status = RecordingStatus.CLEANING;
            exitReason = reason;
            encoderToStop = encoder;
            consumersToClose = new ArrayList<>(consumers);
            transportsToClose = new ArrayList<>(transports);
            portsToRelease = new ArrayList<>(ports);
            descriptorToDelete = descriptorPath;
        }
        log.info("RECORDING {}: Cleaning up ({}), candidate {}, producers {}", id, reason, candidateId,
                producerIds);
        started.completeExceptionally(aborted());

        CompletableFuture<Integer> stopped = encoderToStop == null
                ? CompletableFuture.completedFuture(null)
                : encoderToStop.stop();
        stopped.whenComplete((code, stopError) -> {
            boolean releaseFailed = stopError != null;
            if (stopError != null) {
                log.error("RECORDING {}: Error stopping {}", id, encoderToStop.getName(), stopError);
            }
            for (EngineConsumer consumer : consumersToClose) {
                try {
                    consumer.close();
                } catch (RuntimeException e) {
                    releaseFailed = true;
                    log.error("RECORDING {}: Error closing consumer {}", id, consumer.getId(), e);
                }
            }
            for (EnginePlainTransport transport : transportsToClose) {
                try {
                    transport.close();
                } catch (RuntimeException e) {
                    releaseFailed = true;
                    log.error("RECORDING {}: Error closing transport {}", id, transport.getId(), e);
                }
            }
            if (descriptorToDelete != null && !deleteQuietly(descriptorToDelete)) {
                releaseFailed = true;
            }
            for (int port : portsToRelease) {
                portAllocator.release(port);
            }

            RecordingStatus result;
            if (releaseFailed) {
                result = RecordingStatus.ERROR;
            } else if ((encoderToStop != null && encoderToStop.hasObservedData()) || outputSize() > 0) {
                result = RecordingStatus.COMPLETED;
            } else {
                result = RecordingStatus.FAILED;
            }
            endedAt = Instant.now();
            status = result;
            log.info("RECORDING {}: {} after {} s, output {}", id, result,
                    endedAt.getEpochSecond() - createdAt.getEpochSecond(), outputPath);
            cleanupResult.complete(result);
        });
        return cleanupResult;
    }

    public long outputSize() {
        try {
            return Files.exists(outputPath) ? Files.size(outputPath) : 0;
        } catch (IOException e) {
            log.warn("RECORDING {}: Cannot read size of {}", id, outputPath, e);
            return 0;
        }
    }

    private boolean deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
            return true;
        } catch (IOException e) {
            log.error("RECORDING {}: Cannot delete {}", id, path, e);
            return false;
        }
    }

    private RoomException aborted() {
        return new RoomException(Code.RECORDING_ABORTED_ERROR_CODE,
                "Recording " + id + " was cleaned up during setup");
    }

    @Override
    public String toString() {
        return "RecordingSession{id='" + id + "', type=" + type + ", producers=" + producerIds
                + ", status=" + status + '}';
    }
}
