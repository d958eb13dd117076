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
import java.util.function.Consumer;

import com.google.gson.JsonArray;

/**
 * A media worker: the engine process hosting routers.
 */
public interface EngineWorker {

  String getId();

  CompletableFuture<EngineRouter> createRouter(JsonArray mediaCodecs);

  /**
   * Registers a listener invoked once if the worker dies without being closed.
   */
  void addDiedListener(Consumer<Throwable> listener);

  boolean isClosed();

  void close();
}
