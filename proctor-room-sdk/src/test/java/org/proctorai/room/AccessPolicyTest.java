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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.gson.JsonObject;
import org.junit.jupiter.api.Test;
import org.proctorai.room.api.pojo.MediaKind;
import org.proctorai.room.api.pojo.MediaRole;
import org.proctorai.room.api.pojo.PeerRole;
import org.proctorai.room.api.pojo.ProducerInfo;
import org.proctorai.room.exception.RoomException;
import org.proctorai.room.internal.Peer;
import org.proctorai.room.internal.Room;
import org.proctorai.room.media.EngineRouter;
import org.proctorai.room.mock.MockProducer;

public class AccessPolicyTest {

    private final AccessPolicy policy = AccessPolicy.defaultPolicy();

    @Test
    public void defaultTable() {
        assertTrue(policy.canAccessStream(PeerRole.ADMIN, PeerRole.INVIGILATOR));
        assertFalse(policy.canAccessStream(PeerRole.ADMIN, PeerRole.STUDENT));
        assertFalse(policy.canAccessStream(PeerRole.ADMIN, PeerRole.ADMIN));
        assertTrue(policy.canAccessStream(PeerRole.INVIGILATOR, PeerRole.STUDENT));
        assertFalse(policy.canAccessStream(PeerRole.INVIGILATOR, PeerRole.INVIGILATOR));
        for (PeerRole publisher : PeerRole.values()) {
            assertFalse(policy.canAccessStream(PeerRole.STUDENT, publisher));
        }
    }

    @Test
    public void visibilityIsNotTransitive() {
        assertEquals(EnumSet.of(PeerRole.INVIGILATOR), policy.visibleRoles(PeerRole.ADMIN));
        assertTrue(policy.visibleRoles(PeerRole.STUDENT).isEmpty());
    }

    @Test
    public void buildsFromConfiguredTable() {
        Map<String, List<String>> table = new LinkedHashMap<>();
        table.put("admin", Arrays.asList("invigilator", "student"));
        table.put("Invigilator", Collections.singletonList("student"));
        AccessPolicy configured = AccessPolicy.fromTable(table);

        assertTrue(configured.canAccessStream(PeerRole.ADMIN, PeerRole.STUDENT));
        assertTrue(configured.canAccessStream(PeerRole.INVIGILATOR, PeerRole.STUDENT));
        // roles missing from the table see nothing
        assertTrue(configured.visibleRoles(PeerRole.STUDENT).isEmpty());
    }

    @Test
    public void rejectsUnknownRoles() {
        Map<String, List<String>> table = Collections.singletonMap("proctor", Collections.singletonList("student"));
        assertThrows(RoomException.class, () -> AccessPolicy.fromTable(table));
    }

    @Test
    public void filtersProducersAndViewersOfARoom() {
        Room room = new Room("batch-1", mock(EngineRouter.class));
        Peer student = new Peer("c1", "cand-1", PeerRole.STUDENT, "exam-9", "batch-1");
        Peer invigilator = new Peer("c2", "inv-1", PeerRole.INVIGILATOR, "exam-9", "batch-1");
        Peer admin = new Peer("c3", "adm-1", PeerRole.ADMIN, "exam-9", "batch-1");
        room.addPeer(student);
        room.addPeer(invigilator);
        room.addPeer(admin);

        MockProducer screen = new MockProducer(MediaKind.VIDEO, new JsonObject());
        student.addProducer(screen, MediaRole.SCREEN);
        MockProducer camera = new MockProducer(MediaKind.VIDEO, new JsonObject());
        invigilator.addProducer(camera, MediaRole.WEBCAM);

        assertEquals(Collections.singletonList(
                new ProducerInfo(screen.getId(), "cand-1", MediaRole.SCREEN, MediaKind.VIDEO)),
                policy.accessibleProducers(room, invigilator));
        assertEquals(Collections.singletonList(
                new ProducerInfo(camera.getId(), "inv-1", MediaRole.WEBCAM, MediaKind.VIDEO)),
                policy.accessibleProducers(room, admin));
        assertTrue(policy.accessibleProducers(room, student).isEmpty());

        assertEquals(Collections.singletonList(invigilator), policy.permittedViewers(room, student));
        assertEquals(Collections.singletonList(admin), policy.permittedViewers(room, invigilator));
        assertTrue(policy.permittedViewers(room, admin).isEmpty());
    }
}
