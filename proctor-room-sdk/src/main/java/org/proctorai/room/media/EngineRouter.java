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

package org.proctorai.room.media;

import java.util.concurrent.CompletableFuture;

import com.google.gson.JsonObject;

/**
 * A routing context: every transport, producer and consumer of one room lives in one router.
 * Closing it closes all of them.
 */
public interface EngineRouter {

  String getId();

  JsonObject getRtpCapabilities();

  CompletableFuture<Boolean> canConsume(String producerId, JsonObject rtpCapabilities);

  CompletableFuture<EngineWebRtcTransport> createWebRtcTransport(JsonObject options);

  CompletableFuture<EnginePlainTransport> createPlainTransport(JsonObject options);

  boolean isClosed();

  void close();
}
