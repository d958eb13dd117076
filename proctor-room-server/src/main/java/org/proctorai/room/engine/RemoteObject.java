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

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Local handle of an object living in the engine sidecar. Closing a handle closes its children
 * and fires its close listeners exactly once, whether the close was requested locally or
 * reported by the engine.
 */
abstract class RemoteObject {

    private static final Logger log = LoggerFactory.getLogger(RemoteObject.class);

    protected final JsonRpcMediaEngine engine;
    private final String id;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final List<Runnable> closeListeners = new CopyOnWriteArrayList<>();
    private final Set<RemoteObject> children = ConcurrentHashMap.newKeySet();

    RemoteObject(JsonRpcMediaEngine engine, String id) {
        this.engine = engine;
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /**
     * @return the engine method closing this object, e.g. {@code router.close}
     */
    abstract String closeMethod();

    /**
     * @return the parameter name identifying this object in engine requests
     */
    abstract String idParam();

    JsonObject idParams() {
        JsonObject params = new JsonObject();
        params.addProperty(idParam(), id);
        return params;
    }

    void addChild(RemoteObject child) {
        if (isClosed()) {
            child.closedByEngine();
            return;
        }
        children.add(child);
        child.addCloseListener(() -> children.remove(child));
    }

    public void addCloseListener(Runnable listener) {
        if (isClosed()) {
            return;
        }
        closeListeners.add(listener);
    }

    public boolean isClosed() {
        return closed.get();
    }

    public void close() {
        if (markClosed()) {
            engine.getClient().request(closeMethod(), idParams()).whenComplete((r, error) -> {
                if (error != null) {
                    log.warn("Engine failed to close {} {}: {}", getClass().getSimpleName(), id, error.getMessage());
                }
            });
        }
    }

    /**
     * The engine already closed the object; only the local cascade is needed.
     */
    void closedByEngine() {
        markClosed();
    }

    private boolean markClosed() {
        if (!closed.compareAndSet(false, true)) {
            return false;
        }
        for (RemoteObject child : children) {
            child.closedByEngine();
        }
        children.clear();
        engine.unregister(this);
        for (Runnable listener : closeListeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.warn("Close listener of {} {} failed", getClass().getSimpleName(), id, e);
            }
        }
        closeListeners.clear();
        return true;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id + "]";
    }
}
