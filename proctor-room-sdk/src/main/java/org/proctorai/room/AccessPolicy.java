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

package org.proctorai.room;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.proctorai.room.api.pojo.PeerRole;
import org.proctorai.room.api.pojo.ProducerInfo;
import org.proctorai.room.internal.Peer;
import org.proctorai.room.internal.Room;

/**
 * Decides which peers may see which streams. Each viewer role maps to the set of publisher roles
 * it may consume; the relation is not transitive, an admin watching invigilators does not get to
 * see the students those invigilators watch.
 */
public class AccessPolicy {

    private final Map<PeerRole, Set<PeerRole>> hierarchy;

    public AccessPolicy(Map<PeerRole, Set<PeerRole>> hierarchy) {
        EnumMap<PeerRole, Set<PeerRole>> copy = new EnumMap<>(PeerRole.class);
        for (PeerRole role : PeerRole.values()) {
            Set<PeerRole> visible = hierarchy.get(role);
            copy.put(role, visible == null || visible.isEmpty()
                    ? Collections.emptySet()
                    : Collections.unmodifiableSet(EnumSet.copyOf(visible)));
        }
        this.hierarchy = Collections.unmodifiableMap(copy);
    }

    /**
     * admin sees invigilators, invigilator sees students, students see nobody.
     */
    public static AccessPolicy defaultPolicy() {
        Map<PeerRole, Set<PeerRole>> table = new EnumMap<>(PeerRole.class);
        table.put(PeerRole.ADMIN, EnumSet.of(PeerRole.INVIGILATOR));
        table.put(PeerRole.INVIGILATOR, EnumSet.of(PeerRole.STUDENT));
        table.put(PeerRole.STUDENT, EnumSet.noneOf(PeerRole.class));
        return new AccessPolicy(table);
    }

    /**
     * Builds a policy from role names, as found in configuration.
     *
     * @throws org.proctorai.room.exception.RoomException on unknown role names
     */
    public static AccessPolicy fromTable(Map<String, ? extends Collection<String>> table) {
        Map<PeerRole, Set<PeerRole>> parsed = new EnumMap<>(PeerRole.class);
        for (Map.Entry<String, ? extends Collection<String>> entry : table.entrySet()) {
            Set<PeerRole> visible = EnumSet.noneOf(PeerRole.class);
            if (entry.getValue() != null) {
                for (String role : entry.getValue()) {
                    if (role != null && !role.isBlank()) {
                        visible.add(PeerRole.fromValue(role));
                    }
                }
            }
            parsed.put(PeerRole.fromValue(entry.getKey()), visible);
        }
        return new AccessPolicy(parsed);
    }

    public boolean canAccessStream(PeerRole viewerRole, PeerRole publisherRole) {
        return hierarchy.get(viewerRole).contains(publisherRole);
    }

    public Set<PeerRole> visibleRoles(PeerRole viewerRole) {
        return hierarchy.get(viewerRole);
    }

    /**
     * Producers of the other peers of the room that the viewer may consume.
     */
    public List<ProducerInfo> accessibleProducers(Room room, Peer viewer) {
        List<ProducerInfo> producers = new ArrayList<>();
        for (Peer publisher : room.getPeers()) {
            if (publisher != viewer && canAccessStream(viewer.getRole(), publisher.getRole())) {
                producers.addAll(publisher.getProducerInfos());
            }
        }
        return producers;
    }

    /**
     * Peers of the room, other than the publisher, that may consume the publisher's streams.
     */
    public List<Peer> permittedViewers(Room room, Peer publisher) {
        List<Peer> viewers = new ArrayList<>();
        for (Peer viewer : room.getPeers()) {
            if (viewer != publisher && canAccessStream(viewer.getRole(), publisher.getRole())) {
                viewers.add(viewer);
            }
        }
        return viewers;
    }

    @Override
    public String toString() {
        return "AccessPolicy" + hierarchy;
    }
}
