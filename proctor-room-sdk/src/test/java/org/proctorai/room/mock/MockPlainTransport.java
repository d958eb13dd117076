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

import com.google.gson.JsonObject;
import org.proctorai.room.media.EnginePlainTransport;

public class MockPlainTransport extends MockTransport implements EnginePlainTransport {

    private final int localPort;
    private volatile String remoteIp;
    private volatile int remotePort;

    MockPlainTransport(MockRouter router, JsonObject options, int localPort) {
        super("plain", router, options);
        this.localPort = localPort;
    }

    @Override
    public String getLocalIp() {
        return "127.0.0.1";
    }

    @Override
    public int getLocalPort() {
        return localPort;
    }

    @Override
    public CompletableFuture<Void> connect(String ip, int port) {
        this.remoteIp = ip;
        this.remotePort = port;
        return CompletableFuture.completedFuture(null);
    }

    public String getRemoteIp() {
        return remoteIp;
    }

    public int getRemotePort() {
        return remotePort;
    }

    public boolean isConnected() {
        return remoteIp != null;
    }
}
