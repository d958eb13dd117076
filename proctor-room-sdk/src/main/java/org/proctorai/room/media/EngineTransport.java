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
import org.proctorai.room.api.pojo.MediaKind;

/**
 * Common part of client-facing and plain transports. Closing a transport closes the producers and
 * consumers created on it.
 */
public interface EngineTransport {

  String getId();

  CompletableFuture<EngineProducer> produce(MediaKind kind, JsonObject rtpParameters,
      JsonObject appData);

  CompletableFuture<EngineConsumer> consume(String producerId, JsonObject rtpCapabilities,
      boolean paused);

  /**
   * Registers a listener invoked once when the transport closes, whatever the cause.
   */
  void addCloseListener(Runnable listener);

  boolean isClosed();

  void close();
}
