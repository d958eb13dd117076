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

package org.proctorai.room.api;

import java.io.IOException;
import java.nio.file.Path;

import org.proctorai.room.api.pojo.RecordingMetadata;
import org.proctorai.room.api.pojo.RecordingType;
import org.proctorai.room.api.pojo.UploadResult;

/**
 * Receives finished recordings. Implementations move the file to durable storage and register it
 * with the exam backend; both are outside the room SDK.
 */
public interface RecordingUploader {

  UploadResult uploadAndSaveRecording(Path file, String examId, String batchId, String candidateId,
      RecordingType type, RecordingMetadata metadata) throws IOException;
}
