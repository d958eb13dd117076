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
 * Entry point into the selective forwarding media engine. The room SDK does not care where the
 * engine runs (in-process binding, sidecar process, remote host); it is left for the developer
 * to provide an implementation for this API.
 */
public interface MediaEngine {

  /**
   * Starts a media worker.
   *
   * @param settings worker settings such as {@code rtcMinPort}, {@code rtcMaxPort} and
   *                 {@code logLevel}
   * @return a future completed with the running worker, or failed when the engine cannot start it
   */
  CompletableFuture<EngineWorker> createWorker(JsonObject settings);
}
