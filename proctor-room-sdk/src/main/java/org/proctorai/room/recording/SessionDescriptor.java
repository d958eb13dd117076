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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.proctorai.room.api.pojo.MediaKind;

/**
 * SDP description of the RTP streams an encoder process has to listen to: one media section per
 * forwarded track, each on its own port.
 */
public final class SessionDescriptor {

    public static final int DEFAULT_VIDEO_PAYLOAD_TYPE = 96;
    public static final int DEFAULT_AUDIO_PAYLOAD_TYPE = 111;

    public static final class Track {
        private final MediaKind kind;
        private final int port;
        private final int payloadType;

        public Track(MediaKind kind, int port, int payloadType) {
            this.kind = kind;
            this.port = port;
            this.payloadType = payloadType;
        }

        public MediaKind getKind() {
            return kind;
        }

        public int getPort() {
            return port;
        }

        public int getPayloadType() {
            return payloadType;
        }
    }

    private final String address;
    private final String sessionName;
    private final List<Track> tracks;

    public SessionDescriptor(String address, String sessionName, List<Track> tracks) {
        if (tracks.isEmpty()) {
            throw new IllegalArgumentException("A session descriptor needs at least one track");
        }
        this.address = address;
        this.sessionName = sessionName;
        this.tracks = Collections.unmodifiableList(new ArrayList<>(tracks));
    }

    public List<Track> getTracks() {
        return tracks;
    }

    /**
     * Payload type the engine negotiated for the consumer, or the default of its kind.
     */
    public static int payloadType(JsonObject rtpParameters, MediaKind kind) {
        if (rtpParameters != null && rtpParameters.has("codecs")) {
            JsonArray codecs = rtpParameters.getAsJsonArray("codecs");
            if (codecs.size() > 0) {
                JsonElement payloadType = codecs.get(0).getAsJsonObject().get("payloadType");
                if (payloadType != null && !payloadType.isJsonNull()) {
                    return payloadType.getAsInt();
                }
            }
        }
        return kind == MediaKind.AUDIO ? DEFAULT_AUDIO_PAYLOAD_TYPE : DEFAULT_VIDEO_PAYLOAD_TYPE;
    }

    public String render() {
        StringBuilder sdp = new StringBuilder();
        sdp.append("v=0\n");
        sdp.append("o=- 0 0 IN IP4 ").append(address).append('\n');
        sdp.append("s=").append(sessionName).append('\n');
        sdp.append("c=IN IP4 ").append(address).append('\n');
        sdp.append("t=0 0\n");
        for (Track track : tracks) {
            int pt = track.payloadType;
            if (track.kind == MediaKind.AUDIO) {
                sdp.append("m=audio ").append(track.port).append(" RTP/AVP ").append(pt).append('\n');
                sdp.append("a=rtpmap:").append(pt).append(" OPUS/48000/2\n");
                sdp.append("a=sendonly\n");
                sdp.append("a=fmtp:").append(pt).append(" minptime=10;useinbandfec=1\n");
            } else {
                sdp.append("m=video ").append(track.port).append(" RTP/AVP ").append(pt).append('\n');
                sdp.append("a=rtpmap:").append(pt).append(" VP8/90000\n");
                sdp.append("a=sendonly\n");
                sdp.append("a=fmtp:").append(pt)
                        .append(" x-google-start-bitrate=800;x-google-min-bitrate=400;x-google-max-bitrate=2000\n");
            }
        }
        return sdp.toString();
    }

    public void write(Path path) throws IOException {
        Files.write(path, render().getBytes(StandardCharsets.US_ASCII));
    }
}
