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

package org.proctorai.room.engine;

import org.proctorai.room.api.pojo.MediaKind;
import org.proctorai.room.media.EngineProducer;

class RemoteProducer extends RemoteObject implements EngineProducer {

    private final MediaKind kind;
    private volatile boolean paused;

    RemoteProducer(JsonRpcMediaEngine engine, String id, MediaKind kind, boolean paused) {
        super(engine, id);
        this.kind = kind;
        this.paused = paused;
    }

    @Override
    String closeMethod() {
        return "producer.close";
    }

    @Override
    String idParam() {
        return "producerId";
    }

    @Override
    public MediaKind getKind() {
        return kind;
    }

    @Override
    public boolean isPaused() {
        return paused;
    }

    void setPaused(boolean paused) {
        this.paused = paused;
    }
}
