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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import org.proctorai.room.api.RecordingUploader;
import org.proctorai.room.api.pojo.RecordingMetadata;
import org.proctorai.room.api.pojo.RecordingType;
import org.proctorai.room.api.pojo.UploadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Leaves finished recordings where the encoder wrote them. Used when no object storage is wired
 * in; the object key is the path below the recordings directory.
 */
public class LocalRecordingUploader implements RecordingUploader {

    private static final Logger log = LoggerFactory.getLogger(LocalRecordingUploader.class);

    @Override
    public UploadResult uploadAndSaveRecording(Path file, String examId, String batchId, String candidateId,
                                               RecordingType type, RecordingMetadata metadata) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString());
        }
        Path absolute = file.toAbsolutePath().normalize();
        String objectKey = objectKey(absolute, type);
        log.info("Recording {} of candidate {} kept locally as {} ({})", type, candidateId, absolute, metadata);
        return new UploadResult(absolute.toUri().toString(), objectKey);
    }

    static String objectKey(Path file, RecordingType type) {
        // {base}/{type}/{exam}/{batch}/{candidate}/{file}
        int names = file.getNameCount();
        for (int i = names - 5; i >= 0; i--) {
            if (file.getName(i).toString().equals(type.getValue())) {
                return file.subpath(i, names).toString().replace('\\', '/');
            }
        }
        return file.getFileName().toString();
    }
}
