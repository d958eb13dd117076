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

public interface EngineConsumer {

  String getId();

  String getProducerId();

  MediaKind getKind();

  JsonObject getRtpParameters();

  CompletableFuture<Void> resume();

  CompletableFuture<Void> requestKeyFrame();

  /**
   * Registers a listener invoked once when the consumer closes, including when its producer or
   * its transport closes.
   */
  void addCloseListener(Runnable listener);

  boolean isClosed();

  void close();
}
