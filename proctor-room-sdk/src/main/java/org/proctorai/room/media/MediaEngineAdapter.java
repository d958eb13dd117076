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

package org.proctorai.room.media;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import javax.annotation.PreDestroy;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.proctorai.room.api.pojo.MediaKind;
import org.proctorai.room.api.pojo.TransportDirection;
import org.proctorai.room.config.ProctorRoomProperties;
import org.proctorai.room.exception.RoomException;
import org.proctorai.room.exception.RoomException.Code;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Façade over the {@link MediaEngine}. Owns the single media worker, applies the configured
 * listen addresses and codecs, and reports every engine failure as a {@link RoomException} with
 * {@link Code#MEDIA_GENERIC_ERROR_CODE}.
 * <p/>
 * When the worker dies unexpectedly one restart is attempted after the configured delay. Rooms
 * created before the death keep their routers; new routers are refused until the replacement
 * worker is up. If the restart fails the adapter stays unavailable.
 */
public class MediaEngineAdapter {
    private static final Logger log = LoggerFactory.getLogger(MediaEngineAdapter.class);

    public static final String PLAIN_TRANSPORT_IP = "127.0.0.1";

    enum WorkerState {
        IDLE, STARTING, RUNNING, RESTARTING, DEAD, CLOSED
    }

    private final MediaEngine engine;
    private final ProctorRoomProperties properties;
    private final ScheduledExecutorService scheduler;

    private WorkerState state = WorkerState.IDLE;
    private CompletableFuture<EngineWorker> worker;

    public MediaEngineAdapter(MediaEngine engine, ProctorRoomProperties properties,
                              ScheduledExecutorService scheduler) {
        this.engine = engine;
        this.properties = properties;
        this.scheduler = scheduler;
    }

    /**
     * Returns the media worker, starting it on first use. Concurrent callers share one start.
     */
    public synchronized CompletableFuture<EngineWorker> createWorker() {
        switch (state) {
            case RESTARTING:
                return failed(Code.MEDIA_GENERIC_ERROR_CODE, "Media worker is restarting");
            case DEAD:
                return failed(Code.MEDIA_GENERIC_ERROR_CODE, "Media worker is not available");
            case CLOSED:
                return failed(Code.MEDIA_GENERIC_ERROR_CODE, "Media engine adapter is closed");
            case IDLE:
                state = WorkerState.STARTING;
                worker = startWorker(false);
                return worker;
            default:
                return worker;
        }
    }

    public synchronized boolean isWorkerAvailable() {
        return state == WorkerState.RUNNING;
    }

    synchronized WorkerState getState() {
        return state;
    }

    public CompletableFuture<EngineRouter> createRouter() {
        return createWorker().thenCompose(w -> wrap("createRouter", () -> w.createRouter(mediaCodecs())));
    }

    public CompletableFuture<EngineWebRtcTransport> createWebRtcTransport(EngineRouter router,
                                                                         TransportDirection direction) {
        ProctorRoomProperties.Webrtc webrtc = properties.getWebrtc();
        JsonObject listenIp = new JsonObject();
        listenIp.addProperty("ip", webrtc.getListenIp());
        listenIp.addProperty("announcedIp", webrtc.getAnnouncedIp());
        JsonArray listenIps = new JsonArray();
        listenIps.add(listenIp);

        JsonObject appData = new JsonObject();
        appData.addProperty("direction", direction.getValue());

        JsonObject options = new JsonObject();
        options.add("listenIps", listenIps);
        options.addProperty("enableUdp", true);
        options.addProperty("enableTcp", true);
        options.addProperty("preferUdp", true);
        options.add("appData", appData);
        return wrap("createWebRtcTransport", () -> router.createWebRtcTransport(options));
    }

    public CompletableFuture<Void> connectWebRtcTransport(EngineWebRtcTransport transport,
                                                          JsonObject dtlsParameters) {
        return wrap("connectWebRtcTransport", () -> transport.connect(dtlsParameters));
    }

    public CompletableFuture<EngineProducer> produce(EngineTransport transport, MediaKind kind,
                                                     JsonObject rtpParameters, JsonObject appData) {
        return wrap("produce", () -> transport.produce(kind, rtpParameters, appData));
    }

    public CompletableFuture<EngineConsumer> consume(EngineTransport transport, String producerId,
                                                     JsonObject rtpCapabilities, boolean paused) {
        return wrap("consume", () -> transport.consume(producerId, rtpCapabilities, paused));
    }

    public CompletableFuture<Boolean> canConsume(EngineRouter router, String producerId,
                                                 JsonObject rtpCapabilities) {
        return wrap("canConsume", () -> router.canConsume(producerId, rtpCapabilities));
    }

    /**
     * Creates a loopback plain transport with RTCP multiplexing. The remote address is given
     * explicitly through {@link #connectPlainTransport}, never learnt from incoming packets.
     */
    public CompletableFuture<EnginePlainTransport> createPlainTransport(EngineRouter router) {
        JsonObject options = new JsonObject();
        JsonObject listenIp = new JsonObject();
        listenIp.addProperty("ip", PLAIN_TRANSPORT_IP);
        options.add("listenIp", listenIp);
        options.addProperty("rtcpMux", true);
        options.addProperty("comedia", false);
        return wrap("createPlainTransport", () -> router.createPlainTransport(options));
    }

    public CompletableFuture<Void> connectPlainTransport(EnginePlainTransport transport, String ip,
                                                         int port) {
        return wrap("connectPlainTransport", () -> transport.connect(ip, port));
    }

    public CompletableFuture<Void> resume(EngineConsumer consumer) {
        return wrap("resumeConsumer", consumer::resume);
    }

    public CompletableFuture<Void> requestKeyFrame(EngineConsumer consumer) {
        return wrap("requestKeyFrame", consumer::requestKeyFrame);
    }

    @PreDestroy
    public void close() {
        CompletableFuture<EngineWorker> current;
        synchronized (this) {
            if (state == WorkerState.CLOSED) {
                log.warn("Media engine adapter already closed");
                return;
            }
            state = WorkerState.CLOSED;
            current = worker;
            worker = null;
        }
        if (current != null && current.isDone() && !current.isCompletedExceptionally()) {
            EngineWorker w = current.join();
            log.info("Closing media worker {}", w.getId());
            w.close();
        }
    }

    static JsonArray mediaCodecs() {
        JsonArray codecs = new JsonArray();

        JsonObject opus = new JsonObject();
        opus.addProperty("kind", MediaKind.AUDIO.getValue());
        opus.addProperty("mimeType", "audio/opus");
        opus.addProperty("clockRate", 48000);
        opus.addProperty("channels", 2);
        codecs.add(opus);

        JsonObject vp8 = new JsonObject();
        vp8.addProperty("kind", MediaKind.VIDEO.getValue());
        vp8.addProperty("mimeType", "video/VP8");
        vp8.addProperty("clockRate", 90000);
        JsonObject parameters = new JsonObject();
        parameters.addProperty("x-google-start-bitrate", 1000);
        vp8.add("parameters", parameters);
        codecs.add(vp8);
        return codecs;
    }

    private CompletableFuture<EngineWorker> startWorker(boolean restart) {
        ProctorRoomProperties.Media media = properties.getMedia();
        JsonObject settings = new JsonObject();
        settings.addProperty("rtcMinPort", media.getRtcMinPort());
        settings.addProperty("rtcMaxPort", media.getRtcMaxPort());
        settings.addProperty("logLevel", media.getLogLevel());

        return wrap("createWorker", () -> engine.createWorker(settings)).whenComplete((w, error) -> {
            synchronized (this) {
                if (error != null) {
                    if (restart) {
                        log.error("Media worker restart failed, no new rooms can be created", error);
                    } else {
                        log.error("Media worker start failed", error);
                    }
                    state = restart ? WorkerState.DEAD : WorkerState.IDLE;
                    worker = null;
                    return;
                }
                if (state == WorkerState.CLOSED) {
                    w.close();
                    return;
                }
                state = WorkerState.RUNNING;
                log.info("Media worker {} {}", w.getId(), restart ? "restarted" : "started");
            }
            w.addDiedListener(cause -> onWorkerDied(w, cause));
        });
    }

    private void onWorkerDied(EngineWorker died, Throwable cause) {
        synchronized (this) {
            if (state != WorkerState.RUNNING) {
                return;
            }
            state = WorkerState.RESTARTING;
            worker = null;
        }
        long delay = properties.getMedia().getWorkerRestartDelay();
        log.error("Media worker {} died, restarting in {} ms", died.getId(), delay, cause);
        scheduler.schedule(this::restartWorker, delay, TimeUnit.MILLISECONDS);
    }

    private void restartWorker() {
        CompletableFuture<EngineWorker> restarted;
        synchronized (this) {
            if (state != WorkerState.RESTARTING) {
                return;
            }
            restarted = startWorker(true);
            if (state == WorkerState.RESTARTING || state == WorkerState.RUNNING) {
                worker = restarted;
            }
        }
    }

    private static <T> CompletableFuture<T> wrap(String operation, Supplier<CompletableFuture<T>> call) {
        CompletableFuture<T> result = new CompletableFuture<>();
        CompletableFuture<T> pending;
        try {
            pending = call.get();
        } catch (RuntimeException e) {
            result.completeExceptionally(engineError(operation, e));
            return result;
        }
        pending.whenComplete((value, error) -> {
            if (error != null) {
                result.completeExceptionally(engineError(operation, error));
            } else {
                result.complete(value);
            }
        });
        return result;
    }

    private static RoomException engineError(String operation, Throwable error) {
        RoomException cause = RoomException.from(error);
        if (cause.getCode() != Code.GENERIC_ERROR_CODE) {
            return cause;
        }
        return new RoomException(Code.MEDIA_GENERIC_ERROR_CODE,
                "Media engine " + operation + " failed: " + cause.getMessage(), cause.getCause());
    }

    private static <T> CompletableFuture<T> failed(Code code, String message) {
        CompletableFuture<T> future = new CompletableFuture<>();
        future.completeExceptionally(new RoomException(code, message));
        return future;
    }
}
