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

package org.proctorai.room.mock;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import com.google.gson.JsonObject;
import org.proctorai.room.api.pojo.MediaKind;
import org.proctorai.room.media.EngineProducer;

public class MockProducer extends MockMediaObject implements EngineProducer {

    private final MediaKind kind;
    private final JsonObject appData;
    private final List<MockConsumer> consumers = new CopyOnWriteArrayList<>();
    private volatile boolean paused;

    public MockProducer(MediaKind kind, JsonObject appData) {
        super("producer");
        this.kind = kind;
        this.appData = appData;
    }

    @Override
    public MediaKind getKind() {
        return kind;
    }

    public JsonObject getAppData() {
        return appData;
    }

    @Override
    public boolean isPaused() {
        return paused;
    }

    public void setPaused(boolean paused) {
        this.paused = paused;
    }

    void addConsumer(MockConsumer consumer) {
        consumers.add(consumer);
    }

    public List<MockConsumer> getConsumers() {
        return consumers;
    }

    @Override
    protected void onClose() {
        for (MockConsumer consumer : consumers) {
            consumer.close();
        }
    }
}
