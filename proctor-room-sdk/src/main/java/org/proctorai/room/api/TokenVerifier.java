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

import org.proctorai.room.api.pojo.AuthenticatedUser;
import org.proctorai.room.exception.RoomException;

/**
 * Verifies the bearer token a client presents when opening its signaling connection.
 */
public interface TokenVerifier {

  /**
   * @param token the raw token
   * @return the identity carried by the token
   * @throws RoomException with {@code USER_NOT_AUTHENTICATED_ERROR_CODE} when the token is missing,
   *                       malformed, expired or not signed by a trusted issuer
   */
  AuthenticatedUser verify(String token) throws RoomException;
}
