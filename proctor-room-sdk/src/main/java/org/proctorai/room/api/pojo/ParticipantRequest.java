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

package org.proctorai.room.api.pojo;

/**
 * A client request as seen by the room manager: the connection it came from and the request id
 * the reply has to be correlated with (absent for implicit requests such as a disconnect).
 */
public class ParticipantRequest {
  private final String requestId;
  private final String connectionId;

  public ParticipantRequest(String connectionId, String requestId) {
    this.connectionId = connectionId;
    this.requestId = requestId;
  }

  public String getRequestId() {
    return requestId;
  }

  public String getConnectionId() {
    return connectionId;
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder("[");
    if (connectionId != null) {
      builder.append("connectionId=").append(connectionId).append(", ");
    }
    if (requestId != null) {
      builder.append("requestId=").append(requestId);
    }
    return builder.append("]").toString();
  }
}
