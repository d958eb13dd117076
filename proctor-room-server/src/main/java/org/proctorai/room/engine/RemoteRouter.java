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

import java.util.concurrent.CompletableFuture;

import com.google.gson.JsonObject;
import org.proctorai.room.api.pojo.TransportDirection;
import org.proctorai.room.media.EnginePlainTransport;
import org.proctorai.room.media.EngineRouter;
import org.proctorai.room.media.EngineWebRtcTransport;

class RemoteRouter extends RemoteObject implements EngineRouter {

    private final JsonObject rtpCapabilities;

    RemoteRouter(JsonRpcMediaEngine engine, String id, JsonObject rtpCapabilities) {
        super(engine, id);
        this.rtpCapabilities = rtpCapabilities;
    }

    @Override
    String closeMethod() {
        return "router.close";
    }

    @Override
    String idParam() {
        return "routerId";
    }

    @Override
    public JsonObject getRtpCapabilities() {
        return rtpCapabilities;
    }

    @Override
    public CompletableFuture<Boolean> canConsume(String producerId, JsonObject rtpCapabilities) {
        JsonObject params = idParams();
        params.addProperty("producerId", producerId);
        params.add("rtpCapabilities", rtpCapabilities);
        return engine.getClient().request("router.canConsume", params)
                .thenApply(result -> result.getAsJsonObject().get("canConsume").getAsBoolean());
    }

    @Override
    public CompletableFuture<EngineWebRtcTransport> createWebRtcTransport(JsonObject options) {
        JsonObject params = idParams();
        params.add("options", options);
        TransportDirection direction = TransportDirection.fromValue(
                options.getAsJsonObject("appData").get("direction").getAsString());
        return engine.getClient().request("router.createWebRtcTransport", params).thenApply(result -> {
            JsonObject json = result.getAsJsonObject();
            RemoteWebRtcTransport transport = new RemoteWebRtcTransport(engine, json.get("transportId").getAsString(),
                    direction, json.getAsJsonObject("iceParameters"), json.getAsJsonArray("iceCandidates"),
                    json.getAsJsonObject("dtlsParameters"));
            engine.register(transport);
            addChild(transport);
            return transport;
        });
    }

    @Override
    public CompletableFuture<EnginePlainTransport> createPlainTransport(JsonObject options) {
        JsonObject params = idParams();
        params.add("options", options);
        return engine.getClient().request("router.createPlainTransport", params).thenApply(result -> {
            JsonObject json = result.getAsJsonObject();
            JsonObject tuple = json.has("tuple") ? json.getAsJsonObject("tuple") : new JsonObject();
            RemotePlainTransport transport = new RemotePlainTransport(engine, json.get("transportId").getAsString(),
                    tuple.has("localIp") ? tuple.get("localIp").getAsString() : null,
                    tuple.has("localPort") ? tuple.get("localPort").getAsInt() : 0);
            engine.register(transport);
            addChild(transport);
            return transport;
        });
    }
}
