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

package org.proctorai.room.recording;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.function.Predicate;

import org.proctorai.room.api.pojo.RecordingType;

/**
 * Lays recordings out as
 * {@code {base}/{screen|webcam}/{examId}/{batchId}/{candidateId}/{type}_recording_{timestamp}.webm}.
 */
public class RecordingPathResolver {

    static final String UNKNOWN = "unknown";
    private static final String EXTENSION = ".webm";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy_MM_dd_HH_mm_ss");

    private final Path basePath;
    private final Clock clock;

    public RecordingPathResolver(String basePath) {
        this(Paths.get(basePath), Clock.systemDefaultZone());
    }

    public RecordingPathResolver(Path basePath, Clock clock) {
        this.basePath = basePath;
        this.clock = clock;
    }

    public Path getBasePath() {
        return basePath;
    }

    public Path resolve(RecordingType type, String examId, String batchId, String candidateId) {
        return resolve(type, examId, batchId, candidateId, path -> false);
    }

    /**
     * Resolves an output path that is neither on disk nor claimed by {@code taken}. Recordings
     * started within the same second get a {@code _2}, {@code _3}, ... suffix.
     */
    public Path resolve(RecordingType type, String examId, String batchId, String candidateId,
                        Predicate<Path> taken) {
        Path directory = basePath.resolve(type.getValue())
                .resolve(segment(examId))
                .resolve(segment(batchId))
                .resolve(segment(candidateId));
        String stem = type.getValue() + "_recording_" + LocalDateTime.now(clock).format(TIMESTAMP);
        Path candidate = directory.resolve(stem + EXTENSION);
        for (int n = 2; taken.test(candidate) || Files.exists(candidate); n++) {
            candidate = directory.resolve(stem + "_" + n + EXTENSION);
        }
        return candidate;
    }

    /**
     * Temporary SDP file written next to the output file.
     */
    public Path descriptorFor(Path output, String sessionId) {
        return output.resolveSibling("temp_" + sessionId + ".sdp");
    }

    static String segment(String id) {
        if (id == null || id.isBlank()) {
            return UNKNOWN;
        }
        String sanitized = id.trim().replaceAll("[^A-Za-z0-9_-]", "_");
        return sanitized.isEmpty() ? UNKNOWN : sanitized;
    }
}
