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

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.proctorai.room.api.pojo.TransportDirection;
import org.proctorai.room.media.EngineWebRtcTransport;

class RemoteWebRtcTransport extends RemoteTransport implements EngineWebRtcTransport {

    private final TransportDirection direction;
    private final JsonObject iceParameters;
    private final JsonArray iceCandidates;
    private final JsonObject dtlsParameters;

    RemoteWebRtcTransport(JsonRpcMediaEngine engine, String id, TransportDirection direction,
                          JsonObject iceParameters, JsonArray iceCandidates, JsonObject dtlsParameters) {
        super(engine, id);
        this.direction = direction;
        this.iceParameters = iceParameters;
        this.iceCandidates = iceCandidates;
        this.dtlsParameters = dtlsParameters;
    }

    @Override
    public TransportDirection getDirection() {
        return direction;
    }

    @Override
    public JsonObject getIceParameters() {
        return iceParameters;
    }

    @Override
    public JsonArray getIceCandidates() {
        return iceCandidates;
    }

    @Override
    public JsonObject getDtlsParameters() {
        return dtlsParameters;
    }

    @Override
    public CompletableFuture<Void> connect(JsonObject dtlsParameters) {
        JsonObject params = idParams();
        params.add("dtlsParameters", dtlsParameters);
        return engine.getClient().request("transport.connect", params).thenApply(r -> null);
    }
}
