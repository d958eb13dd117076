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

import java.util.concurrent.CompletableFuture;

/**
 * Handle over a running encoder process.
 */
public interface EncoderProcess {

    String getName();

    /**
     * Completes once the process listens on all of its input ports; fails if it exits first.
     */
    CompletableFuture<Void> bound();

    boolean isAlive();

    /**
     * @return true once the process reported having written media
     */
    boolean hasObservedData();

    CompletableFuture<Integer> onExit();

    /**
     * Asks the process to finish its output and exit, killing it if it does not within the grace
     * period. Safe to call more than once.
     *
     * @return the exit code
     */
    CompletableFuture<Integer> stop();
}
