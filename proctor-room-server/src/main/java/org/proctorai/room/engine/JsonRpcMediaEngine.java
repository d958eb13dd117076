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

import java.util.ArrayList;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import com.google.gson.JsonObject;
import org.proctorai.room.exception.RoomException;
import org.proctorai.room.exception.RoomException.Code;
import org.proctorai.room.media.EngineWorker;
import org.proctorai.room.media.MediaEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MediaEngine} backed by a sidecar process speaking JSON-RPC over a WebSocket. Engine
 * notifications ({@code workerDied}, {@code producerClosed}, ...) are applied to the local handles.
 */
public class JsonRpcMediaEngine implements MediaEngine, EngineRpcClient.NotificationListener {

    private static final Logger log = LoggerFactory.getLogger(JsonRpcMediaEngine.class);

    private final EngineRpcClient client;

    private final ConcurrentMap<String, RemoteObject> workers = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, RemoteObject> routers = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, RemoteObject> transports = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, RemoteObject> producers = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, RemoteObject> consumers = new ConcurrentHashMap<>();

    public JsonRpcMediaEngine(EngineRpcClient client) {
        this.client = client;
        client.addNotificationListener(this);
    }

    EngineRpcClient getClient() {
        return client;
    }

    @Override
    public CompletableFuture<EngineWorker> createWorker(JsonObject settings) {
        return client.request("createWorker", settings).thenApply(result -> {
            RemoteWorker worker = new RemoteWorker(this, result.getAsJsonObject().get("workerId").getAsString());
            register(worker);
            log.info("Media engine worker {} started", worker.getId());
            return worker;
        });
    }

    @Override
    public void onNotification(String method, JsonObject params) {
        switch (method) {
            case "workerDied": {
                RemoteWorker worker = (RemoteWorker) lookup(workers, string(params, "workerId"));
                if (worker != null) {
                    worker.died(new RoomException(Code.MEDIA_GENERIC_ERROR_CODE,
                            "Worker died: " + string(params, "error")));
                }
                break;
            }
            case "producerClosed":
                closedByEngine(lookup(producers, string(params, "producerId")));
                break;
            case "producerPaused":
            case "producerResumed": {
                RemoteProducer producer = (RemoteProducer) lookup(producers, string(params, "producerId"));
                if (producer != null) {
                    producer.setPaused("producerPaused".equals(method));
                }
                break;
            }
            case "consumerClosed":
                closedByEngine(lookup(consumers, string(params, "consumerId")));
                break;
            case "transportClosed":
                closedByEngine(lookup(transports, string(params, "transportId")));
                break;
            case "routerClosed":
                closedByEngine(lookup(routers, string(params, "routerId")));
                break;
            case EngineRpcClient.CONNECTION_CLOSED:
                for (RemoteObject worker : new ArrayList<>(workers.values())) {
                    ((RemoteWorker) worker).died(new RoomException(Code.MEDIA_GENERIC_ERROR_CODE,
                            "Lost connection to the media engine: " + string(params, "reason")));
                }
                break;
            default:
                log.debug("Unhandled engine notification {}: {}", method, params);
        }
    }

    private static void closedByEngine(RemoteObject object) {
        if (object != null) {
            object.closedByEngine();
        }
    }

    private static RemoteObject lookup(ConcurrentMap<String, RemoteObject> map, String id) {
        return id == null ? null : map.get(id);
    }

    private static String string(JsonObject params, String name) {
        return params.has(name) && !params.get(name).isJsonNull() ? params.get(name).getAsString() : null;
    }

    void register(RemoteObject object) {
        mapOf(object).put(object.getId(), object);
    }

    void unregister(RemoteObject object) {
        mapOf(object).remove(object.getId(), object);
    }

    RemoteProducer getProducer(String producerId) {
        return (RemoteProducer) lookup(producers, producerId);
    }

    private ConcurrentMap<String, RemoteObject> mapOf(RemoteObject object) {
        if (object instanceof RemoteWorker) {
            return workers;
        }
        if (object instanceof RemoteRouter) {
            return routers;
        }
        if (object instanceof RemoteTransport) {
            return transports;
        }
        if (object instanceof RemoteProducer) {
            return producers;
        }
        return consumers;
    }

    int getObjectCount() {
        return workers.size() + routers.size() + transports.size() + producers.size() + consumers.size();
    }
}
