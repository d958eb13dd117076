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

package org.proctorai.room;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import org.proctorai.room.api.RecordingUploader;
import org.proctorai.room.api.TokenVerifier;
import org.proctorai.room.auth.JwtTokenVerifier;
import org.proctorai.room.config.ProctorRoomProperties;
import org.proctorai.room.engine.EngineRpcClient;
import org.proctorai.room.engine.JsonRpcMediaEngine;
import org.proctorai.room.media.MediaEngine;
import org.proctorai.room.media.MediaEngineAdapter;
import org.proctorai.room.recording.EncoderLauncher;
import org.proctorai.room.recording.FfmpegEncoderLauncher;
import org.proctorai.room.recording.PortAllocator;
import org.proctorai.room.recording.PortChecker;
import org.proctorai.room.recording.RecordingManager;
import org.proctorai.room.recording.RecordingPathResolver;
import org.proctorai.room.recording.UdpPortChecker;
import org.proctorai.room.recording.UdpSocketTable;
import org.proctorai.room.rpc.JsonRpcNotificationService;
import org.proctorai.room.rpc.JsonRpcUserControl;
import org.proctorai.room.rpc.RoomJsonRpcHandler;
import org.proctorai.room.rpc.UserConnectionMapper;
import org.proctorai.room.upload.LocalRecordingUploader;
import org.proctorai.room.util.DaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Proctor room server application: Kurento JSON-RPC signaling on {@code /room}, backed by the
 * room SDK and a media engine sidecar.
 */
@SpringBootApplication
public class ProctorRoomServerApp {

    private static final Logger log = LoggerFactory.getLogger(ProctorRoomServerApp.class);

    @Bean
    @ConfigurationProperties(prefix = "proctor")
    public ProctorRoomProperties proctorRoomProperties() {
        return new ProctorRoomProperties();
    }

    /**
     * Single thread on which every signaling request, and every continuation of it, runs.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService signalingLoop() {
        return Executors.newSingleThreadExecutor(new DaemonThreadFactory("signaling-loop"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService roomScheduler() {
        return Executors.newScheduledThreadPool(2, new DaemonThreadFactory("room-scheduler"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService uploadExecutor() {
        return Executors.newFixedThreadPool(2, new DaemonThreadFactory("recording-upload"));
    }

    @Bean(destroyMethod = "close")
    public EngineRpcClient engineRpcClient(ProctorRoomProperties properties) {
        return new EngineRpcClient(properties.getMedia().getEngineUrl());
    }

    @Bean
    @ConditionalOnMissingBean
    public MediaEngine mediaEngine(EngineRpcClient engineRpcClient) {
        return new JsonRpcMediaEngine(engineRpcClient);
    }

    @Bean
    public MediaEngineAdapter mediaEngineAdapter(MediaEngine mediaEngine, ProctorRoomProperties properties,
                                                 ScheduledExecutorService roomScheduler) {
        return new MediaEngineAdapter(mediaEngine, properties, roomScheduler);
    }

    @Bean
    public RoomManager roomManager(MediaEngineAdapter mediaEngineAdapter) {
        return new RoomManager(mediaEngineAdapter);
    }

    @Bean
    public AccessPolicy accessPolicy(ProctorRoomProperties properties) {
        AccessPolicy policy = AccessPolicy.fromTable(properties.getRoles().getHierarchy());
        log.info("Stream access policy: {}", policy);
        return policy;
    }

    @Bean
    public PortChecker portChecker(ProctorRoomProperties properties) {
        return new UdpPortChecker(properties.getRecording().getRecorderIp());
    }

    @Bean
    public PortAllocator portAllocator(ProctorRoomProperties properties, PortChecker portChecker) {
        ProctorRoomProperties.Recording recording = properties.getRecording();
        return new PortAllocator(recording.getMinPort(), recording.getMaxPort(), portChecker);
    }

    @Bean
    public EncoderLauncher encoderLauncher(ProctorRoomProperties properties,
                                           ScheduledExecutorService roomScheduler) {
        return new FfmpegEncoderLauncher(properties.getRecording(), UdpSocketTable.system(), roomScheduler);
    }

    @Bean
    public RecordingPathResolver recordingPathResolver(ProctorRoomProperties properties) {
        return new RecordingPathResolver(properties.getRecording().getBasePath());
    }

    @Bean
    @ConditionalOnMissingBean
    public RecordingUploader recordingUploader() {
        return new LocalRecordingUploader();
    }

    @Bean
    public RecordingManager recordingManager(MediaEngineAdapter mediaEngineAdapter, PortAllocator portAllocator,
                                             EncoderLauncher encoderLauncher, RecordingPathResolver recordingPathResolver,
                                             RecordingUploader recordingUploader, ProctorRoomProperties properties,
                                             ScheduledExecutorService roomScheduler, ExecutorService signalingLoop,
                                             ExecutorService uploadExecutor) {
        return new RecordingManager(mediaEngineAdapter, portAllocator, encoderLauncher, recordingPathResolver,
                recordingUploader, properties, roomScheduler, signalingLoop, uploadExecutor);
    }

    @Bean
    public JsonRpcNotificationService notificationService() {
        return new JsonRpcNotificationService();
    }

    @Bean
    public NotificationRoomManager notificationRoomManager(RoomManager roomManager, AccessPolicy accessPolicy,
                                                           RecordingManager recordingManager,
                                                           MediaEngineAdapter mediaEngineAdapter,
                                                           JsonRpcNotificationService notificationService,
                                                           ExecutorService signalingLoop) {
        return new NotificationRoomManager(roomManager, accessPolicy, recordingManager, mediaEngineAdapter,
                notificationService, signalingLoop);
    }

    @Bean
    @ConditionalOnMissingBean
    public TokenVerifier tokenVerifier(ProctorRoomProperties properties) {
        return new JwtTokenVerifier(properties.getAuth());
    }

    @Bean
    public UserConnectionMapper userConnectionMapper() {
        return new UserConnectionMapper();
    }

    @Bean
    public JsonRpcUserControl userControl(NotificationRoomManager notificationRoomManager,
                                          JsonRpcNotificationService notificationService) {
        return new JsonRpcUserControl(notificationRoomManager, notificationService);
    }

    @Bean
    public RoomJsonRpcHandler roomHandler(NotificationRoomManager notificationRoomManager,
                                          JsonRpcUserControl userControl,
                                          JsonRpcNotificationService notificationService,
                                          UserConnectionMapper userConnectionMapper,
                                          ExecutorService signalingLoop) {
        return new RoomJsonRpcHandler(notificationRoomManager, userControl, notificationService,
                userConnectionMapper, signalingLoop);
    }

    public static void main(String[] args) {
        SpringApplication.run(ProctorRoomServerApp.class, args);
    }
}
