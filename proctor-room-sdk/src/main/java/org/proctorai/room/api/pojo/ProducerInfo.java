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

import java.util.Objects;

/**
 * Entry of the {@code existing-producers} snapshot and payload of the {@code new-producer} and
 * {@code producer-closed} notifications.
 */
public final class ProducerInfo {
  private final String producerId;
  private final String userId;
  private final MediaRole mediaRole;
  private final MediaKind kind;

  public ProducerInfo(String producerId, String userId, MediaRole mediaRole, MediaKind kind) {
    this.producerId = producerId;
    this.userId = userId;
    this.mediaRole = mediaRole;
    this.kind = kind;
  }

  public String getProducerId() {
    return producerId;
  }

  public String getUserId() {
    return userId;
  }

  public MediaRole getMediaRole() {
    return mediaRole;
  }

  public MediaKind getKind() {
    return kind;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o)
      return true;
    if (!(o instanceof ProducerInfo))
      return false;
    ProducerInfo that = (ProducerInfo) o;
    return Objects.equals(producerId, that.producerId) && Objects.equals(userId, that.userId)
        && mediaRole == that.mediaRole && kind == that.kind;
  }

  @Override
  public int hashCode() {
    return Objects.hash(producerId, userId, mediaRole, kind);
  }

  @Override
  public String toString() {
    return "ProducerInfo{producerId='" + producerId + "', userId='" + userId + "', mediaRole="
        + mediaRole + ", kind=" + kind + '}';
  }
}
