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
import org.proctorai.room.media.EngineProducer;
import org.proctorai.room.media.EngineTransport;

abstract class RemoteTransport extends RemoteObject implements EngineTransport {

    RemoteTransport(JsonRpcMediaEngine engine, String id) {
        super(engine, id);
    }

    @Override
    String closeMethod() {
        return "transport.close";
    }

    @Override
    String idParam() {
        return "transportId";
    }

    @Override
    public CompletableFuture<EngineProducer> produce(MediaKind kind, JsonObject rtpParameters, JsonObject appData) {
        JsonObject params = idParams();
        params.addProperty("kind", kind.getValue());
        params.add("rtpParameters", rtpParameters);
        params.add("appData", appData);
        return engine.getClient().request("transport.produce", params).thenApply(result -> {
            JsonObject json = result.getAsJsonObject();
            RemoteProducer producer = new RemoteProducer(engine, json.get("producerId").getAsString(), kind,
                    json.has("paused") && json.get("paused").getAsBoolean());
            engine.register(producer);
            addChild(producer);
            return producer;
        });
    }

    @Override
    public CompletableFuture<EngineConsumer> consume(String producerId, JsonObject rtpCapabilities, boolean paused) {
        JsonObject params = idParams();
        params.addProperty("producerId", producerId);
        params.add("rtpCapabilities", rtpCapabilities);
        params.addProperty("paused", paused);
        return engine.getClient().request("transport.consume", params).thenApply(result -> {
            JsonObject json = result.getAsJsonObject();
            RemoteConsumer consumer = new RemoteConsumer(engine, json.get("consumerId").getAsString(), producerId,
                    MediaKind.fromValue(json.get("kind").getAsString()), json.getAsJsonObject("rtpParameters"));
            engine.register(consumer);
            addChild(consumer);
            RemoteProducer producer = engine.getProducer(producerId);
            if (producer != null) {
                producer.addChild(consumer);
            }
            return consumer;
        });
    }
}
