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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;

import org.junit.jupiter.api.Test;
import org.proctorai.room.api.pojo.MediaKind;
import org.proctorai.room.config.ProctorRoomProperties;

public class FfmpegEncoderLauncherTest {

    private final ProctorRoomProperties.Recording config = new ProctorRoomProperties().getRecording();
    private final FfmpegEncoderLauncher launcher = new FfmpegEncoderLauncher(config,
            UdpSocketTable.system(), mock(ScheduledExecutorService.class));

    private final Path descriptor = Paths.get("rec", "temp_1.sdp");
    private final Path output = Paths.get("rec", "screen_recording.webm");

    @Test
    public void videoOnlyCommand() {
        List<String> command = launcher.buildCommand(descriptor, output,
                Collections.singletonList(new SessionDescriptor.Track(MediaKind.VIDEO, 40000, 96)));

        assertEquals("ffmpeg", command.get(0));
        assertEquals(Arrays.asList("-nostdin", "-protocol_whitelist", "file,udp,rtp", "-loglevel", "info",
                "-stats", "-y", "-f", "sdp"), command.subList(1, 10));
        int input = command.indexOf("-i");
        assertEquals(descriptor.toAbsolutePath().toString(), command.get(input + 1));
        assertTrue(command.containsAll(Arrays.asList("-map", "0:v:0", "-c:v", "copy")));
        assertFalse(command.contains("0:a:0"));
        assertEquals(output.toAbsolutePath().toString(), command.get(command.size() - 1));
    }

    @Test
    public void combinedCommandMapsBothStreams() {
        config.setEncoderCommand("/usr/local/bin/ffmpeg");
        config.setEncoderLogLevel("warning");
        List<String> command = launcher.buildCommand(descriptor, output, Arrays.asList(
                new SessionDescriptor.Track(MediaKind.VIDEO, 40000, 96),
                new SessionDescriptor.Track(MediaKind.AUDIO, 40002, 111)));

        assertEquals("/usr/local/bin/ffmpeg", command.get(0));
        assertEquals("warning", command.get(command.indexOf("-loglevel") + 1));
        int video = command.indexOf("0:v:0");
        int audio = command.indexOf("0:a:0");
        assertTrue(video > command.indexOf("-i"));
        assertTrue(audio > video);
        assertEquals("copy", command.get(command.indexOf("-c:a") + 1));
    }
}
