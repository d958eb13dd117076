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
 * Identity extracted from a verified token. The role is optional: tokens issued without a role
 * claim let the client declare it when joining.
 */
public final class AuthenticatedUser {
  private final String userId;
  private final PeerRole role;

  public AuthenticatedUser(String userId, PeerRole role) {
    this.userId = Objects.requireNonNull(userId, "userId");
    this.role = role;
  }

  public String getUserId() {
    return userId;
  }

  public PeerRole getRole() {
    return role;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o)
      return true;
    if (!(o instanceof AuthenticatedUser))
      return false;
    AuthenticatedUser that = (AuthenticatedUser) o;
    return userId.equals(that.userId) && role == that.role;
  }

  @Override
  public int hashCode() {
    return Objects.hash(userId, role);
  }

  @Override
  public String toString() {
    return "AuthenticatedUser{userId='" + userId + "', role=" + role + '}';
  }
}
