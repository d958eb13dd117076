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

package org.proctorai.room.rpc;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps track of the signaling connections each user has open.
 */
public class UserConnectionMapper {
    // userId -> connection ids
    private final ConcurrentHashMap<String, Set<String>> map = new ConcurrentHashMap<>();

    /**
     * @return the number of connections the user has, this one included
     */
    public int add(final String userId, final String connectionId) {
        Set<String> connections = map.computeIfAbsent(userId, k -> ConcurrentHashMap.newKeySet());
        connections.add(connectionId);
        return connections.size();
    }

    public void removeByConnectionId(final String connectionId) {
        for (Map.Entry<String, Set<String>> entry : map.entrySet()) {
            if (entry.getValue().remove(connectionId)) {
                map.computeIfPresent(entry.getKey(), (k, v) -> v.isEmpty() ? null : v);
                break;
            }
        }
    }

    public Set<String> getConnectionIds(final String userId) {
        Set<String> connections = map.get(userId);
        return connections == null ? Collections.emptySet() : Collections.unmodifiableSet(connections);
    }

    public String getUserId(final String connectionId) {
        for (Map.Entry<String, Set<String>> entry : map.entrySet()) {
            if (entry.getValue().contains(connectionId)) {
                return entry.getKey();
            }
        }
        return null;
    }

    public int getUserCount() {
        return map.size();
    }
}
