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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;

import org.proctorai.room.api.pojo.MediaKind;
import org.proctorai.room.config.ProctorRoomProperties;
import org.proctorai.room.util.DaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Launches ffmpeg reading an SDP description and stream-copying VP8/Opus into a WebM file.
 */
public class FfmpegEncoderLauncher implements EncoderLauncher {
    private static final Logger log = LoggerFactory.getLogger(FfmpegEncoderLauncher.class);

    private static final List<String> INPUT_OPTIONS = Arrays.asList(
            "-f", "sdp",
            "-fflags", "+genpts",
            "-avoid_negative_ts", "make_zero",
            "-analyzeduration", "0",
            "-probesize", "32",
            "-rtbufsize", "64M",
            "-max_delay", "500000");

    private final ProctorRoomProperties.Recording config;
    private final UdpSocketTable sockets;
    private final ScheduledExecutorService scheduler;
    private final ThreadFactory readerThreads = new DaemonThreadFactory("ffmpeg-stderr");

    public FfmpegEncoderLauncher(ProctorRoomProperties.Recording config, UdpSocketTable sockets,
                                 ScheduledExecutorService scheduler) {
        this.config = config;
        this.sockets = sockets;
        this.scheduler = scheduler;
    }

    @Override
    public EncoderProcess launch(Path descriptor, Path output, List<SessionDescriptor.Track> tracks)
            throws IOException {
        List<String> command = buildCommand(descriptor, output, tracks);
        log.info("Starting encoder: {}", String.join(" ", command));
        Process process = new ProcessBuilder(command)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .start();

        List<Integer> ports = new ArrayList<>();
        for (SessionDescriptor.Track track : tracks) {
            ports.add(track.getPort());
        }
        FfmpegEncoderProcess encoder = new FfmpegEncoderProcess(process, ports, sockets, scheduler,
                config.getEncoderStopGrace());
        encoder.startReading(readerThreads);
        return encoder;
    }

    List<String> buildCommand(Path descriptor, Path output, List<SessionDescriptor.Track> tracks) {
        List<String> command = new ArrayList<>();
        command.add(config.getEncoderCommand());
        command.addAll(Arrays.asList("-nostdin", "-protocol_whitelist", "file,udp,rtp",
                "-loglevel", config.getEncoderLogLevel(), "-stats", "-y"));
        command.addAll(INPUT_OPTIONS);
        command.add("-i");
        command.add(descriptor.toAbsolutePath().toString());

        boolean video = tracks.stream().anyMatch(t -> t.getKind() == MediaKind.VIDEO);
        boolean audio = tracks.stream().anyMatch(t -> t.getKind() == MediaKind.AUDIO);
        if (video) {
            command.addAll(Arrays.asList("-map", "0:v:0", "-c:v", "copy"));
        }
        if (audio) {
            command.addAll(Arrays.asList("-map", "0:a:0", "-c:a", "copy"));
        }
        command.add(output.toAbsolutePath().toString());
        return command;
    }
}
