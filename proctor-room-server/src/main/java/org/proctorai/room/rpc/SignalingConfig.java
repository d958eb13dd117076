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

package org.proctorai.room.rpc;

import org.kurento.jsonrpc.internal.server.config.JsonRpcConfiguration;
import org.kurento.jsonrpc.server.JsonRpcConfigurer;
import org.kurento.jsonrpc.server.JsonRpcHandlerRegistry;
import org.proctorai.room.api.TokenVerifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

/**
 * Exposes the signaling handler; connections are authenticated during the HTTP upgrade.
 */
@Configuration
@Import(JsonRpcConfiguration.class)
public class SignalingConfig implements JsonRpcConfigurer {

    private final RoomJsonRpcHandler roomHandler;
    private final TokenVerifier tokenVerifier;

    @Value("${proctor.signaling.path:/room}")
    private String signalingPath;

    @Value("${proctor.signaling.allowed-origins:*}")
    private String[] allowedOrigins;

    public SignalingConfig(RoomJsonRpcHandler roomHandler, TokenVerifier tokenVerifier) {
        this.roomHandler = roomHandler;
        this.tokenVerifier = tokenVerifier;
    }

    @Override
    public void registerJsonRpcHandlers(JsonRpcHandlerRegistry registry) {
        registry.addHandler(roomHandler.withPingWatchdog(true)
                .withInterceptors(new TokenHandshakeInterceptor(tokenVerifier))
                .withAllowedOrigins(allowedOrigins), signalingPath);
    }
}
