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

package org.proctorai.room.mock;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import org.proctorai.room.recording.EncoderProcess;

public class MockEncoderProcess implements EncoderProcess {

    private final String name;
    private final Path output;
    private final boolean writesData;
    private final CompletableFuture<Void> bound = new CompletableFuture<>();
    private final CompletableFuture<Integer> exit = new CompletableFuture<>();
    private final AtomicInteger stopCalls = new AtomicInteger();
    private volatile boolean observedData;

    MockEncoderProcess(String name, Path output, boolean writesData, boolean bindsPorts) {
        this.name = name;
        this.output = output;
        this.writesData = writesData;
        if (bindsPorts) {
            bound.complete(null);
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public CompletableFuture<Void> bound() {
        return bound;
    }

    @Override
    public boolean isAlive() {
        return !exit.isDone();
    }

    @Override
    public boolean hasObservedData() {
        return observedData;
    }

    @Override
    public CompletableFuture<Integer> onExit() {
        return exit;
    }

    @Override
    public CompletableFuture<Integer> stop() {
        stopCalls.incrementAndGet();
        if (!exit.isDone()) {
            if (writesData) {
                writeFrames();
            }
            exit.complete(0);
        }
        return exit;
    }

    /**
     * Reports the input ports bound, for encoders launched without doing so.
     */
    public void bind() {
        bound.complete(null);
    }

    /**
     * Simulates the process dying on its own.
     */
    public void crash(int code) {
        exit.complete(code);
    }

    public int getStopCalls() {
        return stopCalls.get();
    }

    private void writeFrames() {
        try {
            Files.createDirectories(output.getParent());
            Files.write(output, new byte[]{0x1a, 0x45, (byte) 0xdf, (byte) 0xa3});
            observedData = true;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
