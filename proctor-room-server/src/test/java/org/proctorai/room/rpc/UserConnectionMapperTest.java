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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class UserConnectionMapperTest {

    @Test
    public void tracksConnectionsPerUser() {
        UserConnectionMapper mapper = new UserConnectionMapper();

        assertEquals(1, mapper.add("42", "c1"));
        assertEquals(2, mapper.add("42", "c2"));
        assertEquals(1, mapper.add("7", "c3"));

        assertEquals("42", mapper.getUserId("c2"));
        assertEquals(2, mapper.getUserCount());

        mapper.removeByConnectionId("c1");
        assertEquals(1, mapper.getConnectionIds("42").size());

        mapper.removeByConnectionId("c2");
        assertTrue(mapper.getConnectionIds("42").isEmpty());
        assertNull(mapper.getUserId("c2"));
        assertEquals(1, mapper.getUserCount());
    }
}
