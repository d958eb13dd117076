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

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.proctorai.room.api.pojo.RecordingType;

public class RecordingPathResolverTest {

    private final RecordingPathResolver resolver = new RecordingPathResolver(Paths.get("recordings"),
            Clock.fixed(Instant.parse("2024-03-05T10:15:30Z"), ZoneOffset.UTC));

    @Test
    public void screenRecordingLayout() {
        Path path = resolver.resolve(RecordingType.SCREEN, "exam-9", "batch-1", "cand-1");
        assertEquals(Paths.get("recordings", "screen", "exam-9", "batch-1", "cand-1",
                "screen_recording_2024_03_05_10_15_30.webm"), path);
    }

    @Test
    public void webcamRecordingLayout() {
        Path path = resolver.resolve(RecordingType.WEBCAM, "exam-9", "batch-1", "cand-1");
        assertEquals(Paths.get("recordings", "webcam", "exam-9", "batch-1", "cand-1",
                "webcam_recording_2024_03_05_10_15_30.webm"), path);
    }

    @Test
    public void missingIdsBecomeUnknown() {
        Path path = resolver.resolve(RecordingType.SCREEN, null, " ", "cand-1");
        assertEquals(Paths.get("recordings", "screen", "unknown", "unknown", "cand-1",
                "screen_recording_2024_03_05_10_15_30.webm"), path);
    }

    @Test
    public void segmentsCannotEscapeTheBaseDirectory() {
        assertEquals("___etc", RecordingPathResolver.segment("../etc"));
        assertEquals("a_b_c", RecordingPathResolver.segment("a/b c"));
        assertEquals("Exam_2024-01", RecordingPathResolver.segment("Exam_2024-01"));
    }

    @Test
    public void pathsTakenWithinTheSameSecondGetASuffix() {
        Path first = resolver.resolve(RecordingType.WEBCAM, "exam-9", "batch-1", "cand-1");
        Set<Path> taken = new HashSet<>();
        taken.add(first);

        Path second = resolver.resolve(RecordingType.WEBCAM, "exam-9", "batch-1", "cand-1", taken::contains);
        taken.add(second);
        Path third = resolver.resolve(RecordingType.WEBCAM, "exam-9", "batch-1", "cand-1", taken::contains);

        assertEquals(first.resolveSibling("webcam_recording_2024_03_05_10_15_30_2.webm"), second);
        assertEquals(first.resolveSibling("webcam_recording_2024_03_05_10_15_30_3.webm"), third);
    }

    @Test
    public void existingFilesAreNotReused(@TempDir Path base) throws Exception {
        RecordingPathResolver onDisk = new RecordingPathResolver(base,
                Clock.fixed(Instant.parse("2024-03-05T10:15:30Z"), ZoneOffset.UTC));
        Path first = onDisk.resolve(RecordingType.SCREEN, "exam-9", "batch-1", "cand-1");
        Files.createDirectories(first.getParent());
        Files.write(first, new byte[]{1});

        assertEquals(first.resolveSibling("screen_recording_2024_03_05_10_15_30_2.webm"),
                onDisk.resolve(RecordingType.SCREEN, "exam-9", "batch-1", "cand-1"));
    }

    @Test
    public void descriptorSitsNextToTheOutput() {
        Path output = resolver.resolve(RecordingType.SCREEN, "exam-9", "batch-1", "cand-1");
        assertEquals(output.resolveSibling("temp_ab12cd34.sdp"), resolver.descriptorFor(output, "ab12cd34"));
    }
}
