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

package org.proctorai.room.api.pojo;

import java.time.Instant;

/**
 * Facts about a finished recording handed to the uploader together with the file.
 */
public final class RecordingMetadata {
  private final Instant recordingStartedAt;
  private final Instant recordingEndedAt;
  private final long fileSizeBytes;
  private final String exitReason;

  public RecordingMetadata(Instant recordingStartedAt, Instant recordingEndedAt, long fileSizeBytes,
      String exitReason) {
    this.recordingStartedAt = recordingStartedAt;
    this.recordingEndedAt = recordingEndedAt;
    this.fileSizeBytes = fileSizeBytes;
    this.exitReason = exitReason;
  }

  public Instant getRecordingStartedAt() {
    return recordingStartedAt;
  }

  public Instant getRecordingEndedAt() {
    return recordingEndedAt;
  }

  public long getDurationSeconds() {
    return Math.max(0, recordingEndedAt.getEpochSecond() - recordingStartedAt.getEpochSecond());
  }

  public long getFileSizeBytes() {
    return fileSizeBytes;
  }

  public String getExitReason() {
    return exitReason;
  }

  @Override
  public String toString() {
    return "RecordingMetadata{startedAt=" + recordingStartedAt + ", endedAt=" + recordingEndedAt
        + ", durationSeconds=" + getDurationSeconds() + ", fileSizeBytes=" + fileSizeBytes
        + ", exitReason='" + exitReason + "'}";
  }
}
