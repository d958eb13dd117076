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

package org.proctorai.room.engine;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.proctorai.room.media.EngineRouter;
import org.proctorai.room.media.EngineWorker;

class RemoteWorker extends RemoteObject implements EngineWorker {

    private final List<Consumer<Throwable>> diedListeners = new CopyOnWriteArrayList<>();

    RemoteWorker(JsonRpcMediaEngine engine, String id) {
        super(engine, id);
    }

    @Override
    String closeMethod() {
        return "worker.close";
    }

    @Override
    String idParam() {
        return "workerId";
    }

    @Override
    public CompletableFuture<EngineRouter> createRouter(JsonArray mediaCodecs) {
        JsonObject params = idParams();
        params.add("mediaCodecs", mediaCodecs);
        return engine.getClient().request("worker.createRouter", params).thenApply(result -> {
            JsonObject json = result.getAsJsonObject();
            RemoteRouter router = new RemoteRouter(engine, json.get("routerId").getAsString(),
                    json.getAsJsonObject("rtpCapabilities"));
            engine.register(router);
            addChild(router);
            return router;
        });
    }

    @Override
    public void addDiedListener(Consumer<Throwable> listener) {
        diedListeners.add(listener);
    }

    void died(Throwable cause) {
        if (isClosed()) {
            return;
        }
        closedByEngine();
        for (Consumer<Throwable> listener : diedListeners) {
            listener.accept(cause);
        }
        diedListeners.clear();
    }
}
