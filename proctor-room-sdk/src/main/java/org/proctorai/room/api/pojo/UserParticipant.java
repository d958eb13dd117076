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
 * This POJO holds information about a room participant, as exposed by status queries.
 */
public class UserParticipant {
  private String connectionId;
  private String userId;
  private PeerRole role;
  private int producers;
  private long joinedAt;

  public UserParticipant(String connectionId, String userId, PeerRole role, int producers,
      long joinedAt) {
    super();
    this.connectionId = connectionId;
    this.userId = userId;
    this.role = role;
    this.producers = producers;
    this.joinedAt = joinedAt;
  }

  public String getConnectionId() {
    return connectionId;
  }

  public String getUserId() {
    return userId;
  }

  public PeerRole getRole() {
    return role;
  }

  public int getProducers() {
    return producers;
  }

  public boolean isStreaming() {
    return producers > 0;
  }

  public long getJoinedAt() {
    return joinedAt;
  }

  @Override public int hashCode() {
    int result = connectionId != null ? connectionId.hashCode() : 0;
    result = 31 * result + (userId != null ? userId.hashCode() : 0);
    result = 31 * result + (role != null ? role.hashCode() : 0);
    return result;
  }

  @Override public boolean equals(Object o) {
    if (this == o)
      return true;
    if (!(o instanceof UserParticipant))
      return false;

    UserParticipant that = (UserParticipant) o;

    if (connectionId != null ? !connectionId.equals(that.connectionId) : that.connectionId != null)
      return false;
    if (userId != null ? !userId.equals(that.userId) : that.userId != null)
      return false;
    return role == that.role;
  }

  @Override public String toString() {
    final StringBuilder sb = new StringBuilder("UserParticipant{");
    sb.append("connectionId='").append(connectionId).append('\'');
    sb.append(", userId='").append(userId).append('\'');
    sb.append(", role=").append(role);
    sb.append(", producers=").append(producers);
    sb.append('}');
    return sb.toString();
  }
}
