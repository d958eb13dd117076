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

import org.proctorai.room.exception.RoomException;
import org.proctorai.room.exception.RoomException.Code;

/**
 * Role of a room participant. Whose streams a role may see is decided by the
 * {@link org.proctorai.room.AccessPolicy}.
 */
public enum PeerRole {
  ADMIN("admin"),
  INVIGILATOR("invigilator"),
  STUDENT("student");

  private final String value;

  PeerRole(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  public static PeerRole fromValue(String value) {
    if (value != null) {
      for (PeerRole role : values()) {
        if (role.value.equalsIgnoreCase(value.trim())) {
          return role;
        }
      }
    }
    throw new RoomException(Code.REQUEST_INVALID_PARAMS_ERROR_CODE, "Unknown role '" + value + "'");
  }

  @Override
  public String toString() {
    return value;
  }
}
