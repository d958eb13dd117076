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

package org.proctorai.room.upload;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.proctorai.room.api.pojo.RecordingMetadata;
import org.proctorai.room.api.pojo.RecordingType;
import org.proctorai.room.api.pojo.UploadResult;

public class LocalRecordingUploaderTest {

    @TempDir
    Path base;

    private final LocalRecordingUploader uploader = new LocalRecordingUploader();

    private static RecordingMetadata metadata() {
        Instant start = Instant.parse("2024-03-05T10:15:30Z");
        return new RecordingMetadata(start, start.plusSeconds(90), 4, "producer_closed");
    }

    @Test
    public void keepsTheFileAndReportsItsKey() throws IOException {
        Path file = base.resolve("webcam/exam-9/batch-1/42/webcam_recording_2024_03_05_10_15_30.webm");
        Files.createDirectories(file.getParent());
        Files.write(file, new byte[]{1, 2, 3, 4});

        UploadResult result = uploader.uploadAndSaveRecording(file, "exam-9", "batch-1", "42", RecordingType.WEBCAM,
                metadata());

        assertEquals("webcam/exam-9/batch-1/42/webcam_recording_2024_03_05_10_15_30.webm", result.getObjectKey());
        assertEquals(file.toAbsolutePath().normalize().toUri().toString(), result.getUrl());
    }

    @Test
    public void filesOutsideTheLayoutAreKeyedByName() {
        assertEquals("clip.webm", LocalRecordingUploader.objectKey(base.resolve("clip.webm"), RecordingType.SCREEN));
    }

    @Test
    public void missingFilesFail() {
        assertThrows(NoSuchFileException.class, () -> uploader.uploadAndSaveRecording(base.resolve("gone.webm"),
                "exam-9", "batch-1", "42", RecordingType.SCREEN, metadata()));
    }
}
