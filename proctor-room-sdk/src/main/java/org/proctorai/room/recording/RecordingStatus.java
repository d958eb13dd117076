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

public enum RecordingStatus {
    INITIALIZING("initializing"),
    RECORDING("recording"),
    CLEANING("cleaning"),
    /** Stopped with data written. */
    COMPLETED("completed"),
    /** Stopped without any media having reached the output. */
    FAILED("failed"),
    /** Teardown itself failed; some resources may not have been released. */
    ERROR("error");

    private final String value;

    RecordingStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == ERROR;
    }

    @Override
    public String toString() {
        return value;
    }
}
