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
import org.proctorai.room.media.EnginePlainTransport;

class RemotePlainTransport extends RemoteTransport implements EnginePlainTransport {

    private final String localIp;
    private final int localPort;

    RemotePlainTransport(JsonRpcMediaEngine engine, String id, String localIp, int localPort) {
        super(engine, id);
        this.localIp = localIp;
        this.localPort = localPort;
    }

    @Override
    public String getLocalIp() {
        return localIp;
    }

    @Override
    public int getLocalPort() {
        return localPort;
    }

    @Override
    public CompletableFuture<Void> connect(String ip, int port) {
        JsonObject params = idParams();
        params.addProperty("ip", ip);
        params.addProperty("port", port);
        return engine.getClient().request("plainTransport.connect", params).thenApply(r -> null);
    }
}
