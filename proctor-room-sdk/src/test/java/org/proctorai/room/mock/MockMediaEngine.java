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

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import com.google.gson.JsonObject;
import org.proctorai.room.media.EngineWorker;
import org.proctorai.room.media.MediaEngine;

public class MockMediaEngine implements MediaEngine {

    private final List<MockWorker> workers = new CopyOnWriteArrayList<>();
    private volatile int failures;

    @Override
    public CompletableFuture<EngineWorker> createWorker(JsonObject settings) {
        if (failures > 0) {
            failures--;
            return CompletableFuture.failedFuture(new IllegalStateException("worker binary not found"));
        }
        MockWorker worker = new MockWorker(settings);
        workers.add(worker);
        return CompletableFuture.completedFuture(worker);
    }

    /**
     * Makes the next {@code count} worker starts fail.
     */
    public void failNextWorkers(int count) {
        this.failures = count;
    }

    public List<MockWorker> getWorkers() {
        return workers;
    }

    public MockWorker getLastWorker() {
        return workers.isEmpty() ? null : workers.get(workers.size() - 1);
    }
}
