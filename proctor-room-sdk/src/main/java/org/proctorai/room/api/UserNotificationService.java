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

package org.proctorai.room.api;

import com.google.gson.JsonElement;
import org.proctorai.room.api.pojo.ParticipantRequest;
import org.proctorai.room.exception.RoomException;

/**
 * Outbound seam that lets the room manager send notifications or responses
 * back to the remote peers whilst remaining isolated from the transport or communications layer.
 * The notification methods will be invoked by the room manager on the signaling event loop.
 */
public interface UserNotificationService {

  /**
   * Responds back to the remote peer with the result of a previous request.
   *
   * @param request the request to answer
   * @param result  payload of the reply, an empty object when the request has no result
   */
  void sendResponse(ParticipantRequest request, JsonElement result);

  /**
   * Responds back to the remote peer with the details of why its request failed.
   *
   * @param request the request to answer
   * @param error   the failure, carrying its numeric code and error type
   */
  void sendErrorResponse(ParticipantRequest request, RoomException error);

  /**
   * Sends a server-originated notification (no reply expected) to a connected peer.
   *
   * @param connectionId the connection of the peer
   * @param method       notification name
   * @param params       notification payload
   */
  void sendNotification(String connectionId, String method, JsonElement params);
}
