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

package org.proctorai.room.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tunables of the room SDK. Mutable bean so that it can be bound from external configuration
 * (prefix {@code proctor}); every duration is expressed in milliseconds.
 */
public class ProctorRoomProperties {

    private final Webrtc webrtc = new Webrtc();
    private final Media media = new Media();
    private final Recording recording = new Recording();
    private final Timeouts timeouts = new Timeouts();
    private final Auth auth = new Auth();
    private final Roles roles = new Roles();

    public Webrtc getWebrtc() {
        return webrtc;
    }

    public Media getMedia() {
        return media;
    }

    public Recording getRecording() {
        return recording;
    }

    public Timeouts getTimeouts() {
        return timeouts;
    }

    public Auth getAuth() {
        return auth;
    }

    public Roles getRoles() {
        return roles;
    }

    public static class Webrtc {
        private String listenIp = "0.0.0.0";
        private String announcedIp = "127.0.0.1";

        public String getListenIp() {
            return listenIp;
        }

        public void setListenIp(String listenIp) {
            this.listenIp = listenIp;
        }

        public String getAnnouncedIp() {
            return announcedIp;
        }

        public void setAnnouncedIp(String announcedIp) {
            this.announcedIp = announcedIp;
        }
    }

    public static class Media {
        private String engineUrl = "ws://127.0.0.1:3001/engine";
        private int rtcMinPort = 10000;
        private int rtcMaxPort = 59999;
        private String logLevel = "warn";
        private long workerRestartDelay = 2000;

        public String getEngineUrl() {
            return engineUrl;
        }

        public void setEngineUrl(String engineUrl) {
            this.engineUrl = engineUrl;
        }

        public int getRtcMinPort() {
            return rtcMinPort;
        }

        public void setRtcMinPort(int rtcMinPort) {
            this.rtcMinPort = rtcMinPort;
        }

        public int getRtcMaxPort() {
            return rtcMaxPort;
        }

        public void setRtcMaxPort(int rtcMaxPort) {
            this.rtcMaxPort = rtcMaxPort;
        }

        public String getLogLevel() {
            return logLevel;
        }

        public void setLogLevel(String logLevel) {
            this.logLevel = logLevel;
        }

        public long getWorkerRestartDelay() {
            return workerRestartDelay;
        }

        public void setWorkerRestartDelay(long workerRestartDelay) {
            this.workerRestartDelay = workerRestartDelay;
        }
    }

    public static class Recording {
        private String basePath = "recordings";
        private String recorderIp = "127.0.0.1";
        private int minPort = 40000;
        private int maxPort = 49999;
        private long restartWindow = 5000;
        private String encoderCommand = "ffmpeg";
        private String encoderLogLevel = "info";
        private long encoderStopGrace = 3000;

        public String getBasePath() {
            return basePath;
        }

        public void setBasePath(String basePath) {
            this.basePath = basePath;
        }

        public String getRecorderIp() {
            return recorderIp;
        }

        public void setRecorderIp(String recorderIp) {
            this.recorderIp = recorderIp;
        }

        public int getMinPort() {
            return minPort;
        }

        public void setMinPort(int minPort) {
            this.minPort = minPort;
        }

        public int getMaxPort() {
            return maxPort;
        }

        public void setMaxPort(int maxPort) {
            this.maxPort = maxPort;
        }

        public long getRestartWindow() {
            return restartWindow;
        }

        public void setRestartWindow(long restartWindow) {
            this.restartWindow = restartWindow;
        }

        public String getEncoderCommand() {
            return encoderCommand;
        }

        public void setEncoderCommand(String encoderCommand) {
            this.encoderCommand = encoderCommand;
        }

        public String getEncoderLogLevel() {
            return encoderLogLevel;
        }

        public void setEncoderLogLevel(String encoderLogLevel) {
            this.encoderLogLevel = encoderLogLevel;
        }

        public long getEncoderStopGrace() {
            return encoderStopGrace;
        }

        public void setEncoderStopGrace(long encoderStopGrace) {
            this.encoderStopGrace = encoderStopGrace;
        }
    }

    public static class Timeouts {
        private long producerActive = 10000;
        private long producerCheckInterval = 1000;
        private long encoderInit = 5000;
        private long transportConnect = 2000;

        public long getProducerActive() {
            return producerActive;
        }

        public void setProducerActive(long producerActive) {
            this.producerActive = producerActive;
        }

        public long getProducerCheckInterval() {
            return producerCheckInterval;
        }

        public void setProducerCheckInterval(long producerCheckInterval) {
            this.producerCheckInterval = producerCheckInterval;
        }

        public long getEncoderInit() {
            return encoderInit;
        }

        public void setEncoderInit(long encoderInit) {
            this.encoderInit = encoderInit;
        }

        public long getTransportConnect() {
            return transportConnect;
        }

        public void setTransportConnect(long transportConnect) {
            this.transportConnect = transportConnect;
        }
    }

    public static class Auth {
        private String jwtSecret = "supersecret";
        private String userIdClaim = "user_id";
        private String roleClaim = "role";

        public String getJwtSecret() {
            return jwtSecret;
        }

        public void setJwtSecret(String jwtSecret) {
            this.jwtSecret = jwtSecret;
        }

        public String getUserIdClaim() {
            return userIdClaim;
        }

        public void setUserIdClaim(String userIdClaim) {
            this.userIdClaim = userIdClaim;
        }

        public String getRoleClaim() {
            return roleClaim;
        }

        public void setRoleClaim(String roleClaim) {
            this.roleClaim = roleClaim;
        }
    }

    public static class Roles {
        // viewer role -> roles whose streams it may consume
        private Map<String, List<String>> hierarchy = defaultHierarchy();

        public Map<String, List<String>> getHierarchy() {
            return hierarchy;
        }

        public void setHierarchy(Map<String, List<String>> hierarchy) {
            this.hierarchy = hierarchy;
        }

        private static Map<String, List<String>> defaultHierarchy() {
            Map<String, List<String>> table = new LinkedHashMap<>();
            table.put("admin", new ArrayList<>(List.of("invigilator")));
            table.put("invigilator", new ArrayList<>(List.of("student")));
            table.put("student", new ArrayList<>());
            return table;
        }
    }
}
