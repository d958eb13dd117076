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

import java.io.IOException;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.kurento.jsonrpc.DefaultJsonRpcHandler;
import org.kurento.jsonrpc.Transaction;
import org.kurento.jsonrpc.client.Continuation;
import org.kurento.jsonrpc.client.JsonRpcClient;
import org.kurento.jsonrpc.client.JsonRpcClientNettyWebSocket;
import org.kurento.jsonrpc.client.JsonRpcWSConnectionListener;
import org.kurento.jsonrpc.message.Request;
import org.proctorai.room.exception.RoomException;
import org.proctorai.room.exception.RoomException.Code;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON-RPC client for the media engine sidecar, on top of the Kurento JSON-RPC WebSocket client.
 * Requests from the sidecar are one-way engine notifications and are handed to the listeners.
 */
public class EngineRpcClient {

    private static final Logger log = LoggerFactory.getLogger(EngineRpcClient.class);

    /**
     * Pseudo notification delivered when the connection to the sidecar is lost.
     */
    public static final String CONNECTION_CLOSED = "connectionClosed";

    static final long DEFAULT_REQUEST_TIMEOUT_MS = 10000;

    public interface NotificationListener {
        void onNotification(String method, JsonObject params);
    }

    private final JsonRpcClient client;
    private final String url;
    private final long requestTimeoutMs;

    private final Set<CompletableFuture<JsonElement>> pending = ConcurrentHashMap.newKeySet();
    private final List<NotificationListener> listeners = new CopyOnWriteArrayList<>();

    private volatile boolean closed = false;

    public EngineRpcClient(String url) {
        this(url, DEFAULT_REQUEST_TIMEOUT_MS);
    }

    public EngineRpcClient(String url, long requestTimeoutMs) {
        this.url = url;
        this.requestTimeoutMs = requestTimeoutMs;
        this.client = new JsonRpcClientNettyWebSocket(url, new ConnectionListener());
        client.setServerRequestHandler(new EngineNotificationHandler());
    }

    EngineRpcClient(JsonRpcClient client, String url, long requestTimeoutMs) {
        this.url = url;
        this.requestTimeoutMs = requestTimeoutMs;
        this.client = client;
        client.setServerRequestHandler(new EngineNotificationHandler());
    }

    public void addNotificationListener(NotificationListener listener) {
        listeners.add(listener);
    }

    /**
     * Sends a request; the underlying client connects on first use.
     *
     * @return a future completed with the {@code result} member of the response, or failed with a
     *         {@link RoomException} for error responses, timeouts and connection loss
     */
    public CompletableFuture<JsonElement> request(String method, JsonObject params) {
        if (closed) {
            return CompletableFuture.failedFuture(
                    new RoomException(Code.MEDIA_GENERIC_ERROR_CODE, "Engine client is closed"));
        }
        CompletableFuture<JsonElement> response = new CompletableFuture<>();
        pending.add(response);
        log.trace("Engine request {}: {}", method, params);
        try {
            client.sendRequest(method, params == null ? new JsonObject() : params,
                    new Continuation<JsonElement>() {
                        @Override
                        public void onSuccess(JsonElement result) {
                            response.complete(result == null || result.isJsonNull() ? new JsonObject() : result);
                        }

                        @Override
                        public void onError(Throwable cause) {
                            response.completeExceptionally(
                                    new RoomException(Code.MEDIA_GENERIC_ERROR_CODE, cause.getMessage(), cause));
                        }
                    });
        } catch (Exception e) {
            response.completeExceptionally(new RoomException(Code.MEDIA_GENERIC_ERROR_CODE,
                    "Unable to send '" + method + "' to engine at " + url, e));
        }
        return response.orTimeout(requestTimeoutMs, TimeUnit.MILLISECONDS).handle((result, error) -> {
            pending.remove(response);
            if (error == null) {
                return result;
            }
            if (error instanceof TimeoutException) {
                throw new RoomException(Code.MEDIA_GENERIC_ERROR_CODE,
                        "Engine did not answer '" + method + "' within " + requestTimeoutMs + "ms", error);
            }
            throw RoomException.from(error);
        });
    }

    void onNotification(String method, JsonObject params) {
        log.trace("Engine notification {}: {}", method, params);
        for (NotificationListener listener : listeners) {
            try {
                listener.onNotification(method, params);
            } catch (RuntimeException e) {
                log.warn("Error handling engine notification {}", method, e);
            }
        }
    }

    void onConnectionLost(String reason) {
        log.warn("Media engine connection at {} lost: {}", url, reason);
        RoomException error = new RoomException(Code.MEDIA_GENERIC_ERROR_CODE,
                "Media engine connection closed (" + reason + ")");
        for (CompletableFuture<JsonElement> response : pending) {
            pending.remove(response);
            response.completeExceptionally(error);
        }
        if (!closed) {
            JsonObject params = new JsonObject();
            params.addProperty("reason", reason);
            onNotification(CONNECTION_CLOSED, params);
        }
    }

    public void close() {
        closed = true;
        try {
            client.close();
        } catch (IOException e) {
            log.warn("Error closing media engine connection", e);
        }
    }

    private class EngineNotificationHandler extends DefaultJsonRpcHandler<JsonObject> {
        @Override
        public void handleRequest(Transaction transaction, Request<JsonObject> request) throws Exception {
            JsonObject params = request.getParams() == null ? new JsonObject() : request.getParams();
            onNotification(request.getMethod(), params);
        }
    }

    private class ConnectionListener implements JsonRpcWSConnectionListener {
        public void connected() {
            log.info("Connected to media engine at {}", url);
        }

        public void connectionFailed() {
            log.warn("Unable to connect to media engine at {}", url);
        }

        public void disconnected() {
            onConnectionLost("disconnected");
        }

        public void reconnecting() {
            log.info("Reconnecting to media engine at {}", url);
        }

        public void reconnected(boolean sameServer) {
            log.info("Reconnected to media engine at {} (same server: {})", url, sameServer);
            if (!sameServer) {
                // engine objects created before the reconnection no longer exist
                onConnectionLost("reconnected to a different engine");
            }
        }
    }
}
