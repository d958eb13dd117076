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
 * Application-level tag of a produced track, sent by the client in the producer's appData.
 */
public enum MediaRole {
  SCREEN("screen"),
  WEBCAM("webcam"),
  MIC("mic");

  private final String value;

  MediaRole(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  /**
   * @return true for the roles whose audio belongs with the candidate's camera recording
   */
  public boolean isWebcamSource() {
    return this == WEBCAM || this == MIC;
  }

  public static MediaRole fromValue(String value) {
    if (value != null) {
      for (MediaRole role : values()) {
        if (role.value.equals(value)) {
          return role;
        }
      }
    }
    throw new RoomException(Code.REQUEST_INVALID_PARAMS_ERROR_CODE,
        "Missing or unknown appData.mediaRole '" + value + "'");
  }

  @Override
  public String toString() {
    return value;
  }
}
