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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.proctorai.room.exception.RoomException;
import org.proctorai.room.exception.RoomException.Code;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A running ffmpeg. Its stderr is drained on a daemon thread; a progress line reporting at least
 * one frame or a non-zero size marks that media reached the output. Input ports are known to be
 * bound once they show up in the kernel's UDP socket table.
 */
class FfmpegEncoderProcess implements EncoderProcess {
    private static final Logger log = LoggerFactory.getLogger(FfmpegEncoderProcess.class);

    static final long BIND_POLL_INTERVAL_MS = 50;

    private static final Pattern FRAMES = Pattern.compile("frame=\\s*(\\d+)");
    private static final Pattern SIZE = Pattern.compile("size=\\s*(\\d+)");

    private final Process process;
    private final List<Integer> ports;
    private final UdpSocketTable sockets;
    private final ScheduledExecutorService scheduler;
    private final long stopGraceMillis;
    private final String name;

    private final AtomicBoolean dataObserved = new AtomicBoolean();
    private final AtomicBoolean stopping = new AtomicBoolean();
    private final CompletableFuture<Integer> exit;

    FfmpegEncoderProcess(Process process, List<Integer> ports, UdpSocketTable sockets,
                         ScheduledExecutorService scheduler, long stopGraceMillis) {
        this.process = process;
        this.ports = ports;
        this.sockets = sockets;
        this.scheduler = scheduler;
        this.stopGraceMillis = stopGraceMillis;
        this.name = "ffmpeg[" + process.pid() + "]";
        this.exit = process.onExit().thenApply(Process::exitValue);
        exit.thenAccept(code -> log.info("{} exited with code {}", name, code));
    }

    void startReading(ThreadFactory threads) {
        threads.newThread(this::drainStderr).start();
    }

    private void drainStderr() {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.contains("frame=") || line.contains("size=")) {
                    if (reportsData(line) && dataObserved.compareAndSet(false, true)) {
                        log.info("{} is writing media", name);
                    }
                    log.trace("{}: {}", name, line);
                } else if (!line.isBlank()) {
                    log.debug("{}: {}", name, line);
                }
            }
        } catch (IOException e) {
            if (process.isAlive()) {
                log.warn("{}: error reading stderr", name, e);
            }
        }
    }

    /**
     * Whether a progress line counts frames or bytes already written.
     */
    static boolean reportsData(String line) {
        Matcher frames = FRAMES.matcher(line);
        if (frames.find() && Long.parseLong(frames.group(1)) > 0) {
            return true;
        }
        Matcher size = SIZE.matcher(line);
        return size.find() && Long.parseLong(size.group(1)) > 0;
    }

    @Override
    public String getName() {
        return name;
    }

    /**
     * Completes once every input port is listed as bound. Without a readable socket table the
     * future only fails when the process exits, leaving the caller's timeout to decide.
     */
    @Override
    public CompletableFuture<Void> bound() {
        CompletableFuture<Void> bound = new CompletableFuture<>();
        boolean observable = sockets.isReadable();
        if (!observable) {
            log.debug("{}: UDP socket table not readable, cannot observe bound ports", name);
        }
        ScheduledFuture<?> poll = scheduler.scheduleWithFixedDelay(() -> {
            if (!process.isAlive()) {
                bound.completeExceptionally(new RoomException(Code.RECORDING_ENCODER_ERROR_CODE,
                        name + " exited before binding its input ports"));
                return;
            }
            if (observable && sockets.boundPorts().containsAll(ports)) {
                bound.complete(null);
            }
        }, 0, BIND_POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
        bound.whenComplete((v, e) -> poll.cancel(false));
        return bound;
    }

    @Override
    public boolean isAlive() {
        return process.isAlive();
    }

    @Override
    public boolean hasObservedData() {
        return dataObserved.get();
    }

    @Override
    public CompletableFuture<Integer> onExit() {
        return exit;
    }

    @Override
    public CompletableFuture<Integer> stop() {
        if (process.isAlive() && stopping.compareAndSet(false, true)) {
            log.debug("Stopping {}", name);
            process.destroy();
            scheduler.schedule(() -> {
                if (process.isAlive()) {
                    log.warn("{} did not exit within {} ms, killing it", name, stopGraceMillis);
                    process.destroyForcibly();
                }
            }, stopGraceMillis, TimeUnit.MILLISECONDS);
        }
        return exit;
    }
}
