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

import java.util.concurrent.CompletableFuture;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.proctorai.room.api.pojo.TransportDirection;
import org.proctorai.room.media.EngineWebRtcTransport;

public class MockWebRtcTransport extends MockTransport implements EngineWebRtcTransport {

    private final TransportDirection direction;
    private volatile JsonObject remoteDtlsParameters;

    MockWebRtcTransport(MockRouter router, TransportDirection direction, JsonObject options) {
        super("transport", router, options);
        this.direction = direction;
    }

    @Override
    public TransportDirection getDirection() {
        return direction;
    }

    @Override
    public JsonObject getIceParameters() {
        JsonObject ice = new JsonObject();
        ice.addProperty("usernameFragment", getId());
        ice.addProperty("password", "secret");
        return ice;
    }

    @Override
    public JsonArray getIceCandidates() {
        return new JsonArray();
    }

    @Override
    public JsonObject getDtlsParameters() {
        JsonObject dtls = new JsonObject();
        dtls.addProperty("role", "auto");
        return dtls;
    }

    @Override
    public CompletableFuture<Void> connect(JsonObject dtlsParameters) {
        this.remoteDtlsParameters = dtlsParameters;
        return CompletableFuture.completedFuture(null);
    }

    public JsonObject getRemoteDtlsParameters() {
        return remoteDtlsParameters;
    }
}
