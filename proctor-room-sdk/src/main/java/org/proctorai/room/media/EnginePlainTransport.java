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

/**
 * Plain RTP transport used to forward a track to a local process. RTCP is multiplexed, so a
 * single remote address is involved.
 */
public interface EnginePlainTransport extends EngineTransport {

  /**
   * @return local ip of the transport tuple, null until the engine has bound it
   */
  String getLocalIp();

  /**
   * @return local port of the transport tuple, 0 until the engine has bound it
   */
  int getLocalPort();

  CompletableFuture<Void> connect(String ip, int port);
}
