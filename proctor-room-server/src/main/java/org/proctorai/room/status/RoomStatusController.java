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

package org.proctorai.room.status;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.proctorai.room.NotificationRoomManager;
import org.proctorai.room.RoomManager;
import org.proctorai.room.internal.Room;
import org.proctorai.room.media.MediaEngineAdapter;
import org.proctorai.room.recording.RecordingManager;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RoomStatusController {

    private final RoomManager roomManager;
    private final NotificationRoomManager notificationRoomManager;
    private final MediaEngineAdapter mediaEngine;
    private final RecordingManager recordingManager;

    public RoomStatusController(RoomManager roomManager, NotificationRoomManager notificationRoomManager,
                                MediaEngineAdapter mediaEngine, RecordingManager recordingManager) {
        this.roomManager = roomManager;
        this.notificationRoomManager = notificationRoomManager;
        this.mediaEngine = mediaEngine;
        this.recordingManager = recordingManager;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "ok");
        response.put("timestamp", Instant.now().toString());
        response.put("rooms", roomManager.getRooms().size());
        response.put("peers", roomManager.getPeerCount());
        response.put("connections", notificationRoomManager.getConnectionCount());
        response.put("recordings", recordingManager.getSessions().size());
        response.put("workerAvailable", mediaEngine.isWorkerAvailable());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/rooms")
    public ResponseEntity<List<Map<String, Object>>> rooms() {
        List<Map<String, Object>> response = new ArrayList<>();
        for (Room room : roomManager.getRooms()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", room.getId());
            entry.put("peers", room.getPeers().size());
            entry.put("createdAt", room.getCreatedAt().toString());
            entry.put("lastActivity", room.getLastActivity().toString());
            entry.put("routerId", room.getRouter().getId());
            response.add(entry);
        }
        return ResponseEntity.ok(response);
    }
}
