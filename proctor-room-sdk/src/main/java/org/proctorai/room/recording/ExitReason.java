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

/**
 * Why a recording session was torn down. Reported with the uploaded recording.
 */
public enum ExitReason {
    PRODUCER_CLOSED("producer_closed"),
    PEER_DISCONNECTED("disconnect"),
    REPLACED("replaced"),
    ENCODER_EXITED("encoder_exited"),
    SETUP_FAILED("setup_failed"),
    SHUTDOWN("shutdown");

    private final String value;

    ExitReason(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
