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
import org.proctorai.room.api.pojo.MediaKind;
import org.proctorai.room.media.EngineConsumer;

class RemoteConsumer extends RemoteObject implements EngineConsumer {

    private final String producerId;
    private final MediaKind kind;
    private final JsonObject rtpParameters;

    RemoteConsumer(JsonRpcMediaEngine engine, String id, String producerId, MediaKind kind,
                   JsonObject rtpParameters) {
        super(engine, id);
        this.producerId = producerId;
        this.kind = kind;
        this.rtpParameters = rtpParameters;
    }

    @Override
    String closeMethod() {
        return "consumer.close";
    }

    @Override
    String idParam() {
        return "consumerId";
    }

    @Override
    public String getProducerId() {
        return producerId;
    }

    @Override
    public MediaKind getKind() {
        return kind;
    }

    @Override
    public JsonObject getRtpParameters() {
        return rtpParameters;
    }

    @Override
    public CompletableFuture<Void> resume() {
        return engine.getClient().request("consumer.resume", idParams()).thenApply(r -> null);
    }

    @Override
    public CompletableFuture<Void> requestKeyFrame() {
        return engine.getClient().request("consumer.requestKeyFrame", idParams()).thenApply(r -> null);
    }
}
