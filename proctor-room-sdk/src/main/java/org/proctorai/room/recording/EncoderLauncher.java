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

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Starts the external process that writes the forwarded RTP streams to a file.
 */
public interface EncoderLauncher {

    /**
     * @param descriptor SDP file describing the RTP input
     * @param output     file to write
     * @param tracks     the tracks of the descriptor; the process is expected to bind their ports
     * @return the started process
     * @throws IOException if the process cannot be started
     */
    EncoderProcess launch(Path descriptor, Path output, List<SessionDescriptor.Track> tracks) throws IOException;
}
