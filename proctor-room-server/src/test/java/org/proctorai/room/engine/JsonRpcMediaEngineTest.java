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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.kurento.jsonrpc.client.Continuation;
import org.kurento.jsonrpc.client.JsonRpcClient;
import org.proctorai.room.api.pojo.MediaKind;
import org.proctorai.room.api.pojo.TransportDirection;
import org.proctorai.room.exception.RoomException;
import org.proctorai.room.exception.RoomException.Code;
import org.proctorai.room.media.EngineConsumer;
import org.proctorai.room.media.EnginePlainTransport;
import org.proctorai.room.media.EngineProducer;
import org.proctorai.room.media.EngineRouter;
import org.proctorai.room.media.EngineWebRtcTransport;
import org.proctorai.room.media.EngineWorker;

public class JsonRpcMediaEngineTest {

    /**
     * Answers engine requests from a table of canned results, keeping what was asked.
     */
    private static class FakeSidecar {
        final JsonRpcClient rpc = mock(JsonRpcClient.class);
        final Map<String, JsonElement> results = new HashMap<>();
        final Map<String, String> errors = new HashMap<>();
        final List<String> methods = new ArrayList<>();
        final List<JsonObject> params = new ArrayList<>();

        @SuppressWarnings("unchecked")
        FakeSidecar() throws Exception {
            doAnswer(invocation -> {
                String method = invocation.getArgument(0);
                methods.add(method);
                params.add(invocation.getArgument(1));
                Continuation<JsonElement> continuation = invocation.getArgument(2);
                if (errors.containsKey(method)) {
                    continuation.onError(new IllegalStateException(errors.get(method)));
                } else if (results.containsKey(method)) {
                    continuation.onSuccess(results.get(method));
                }
                return null;
            }).when(rpc).sendRequest(anyString(), any(JsonObject.class), any(Continuation.class));
        }

        void result(String method, String json) {
            results.put(method, JsonParser.parseString(json));
        }

        JsonObject lastParams() {
            return params.get(params.size() - 1);
        }
    }

    private FakeSidecar sidecar;
    private EngineRpcClient client;
    private JsonRpcMediaEngine engine;

    @BeforeEach
    public void setUp() throws Exception {
        sidecar = new FakeSidecar();
        client = new EngineRpcClient(sidecar.rpc, "ws://127.0.0.1:3001/engine", 2000);
        engine = new JsonRpcMediaEngine(client);
        sidecar.result("createWorker", "{\"workerId\":\"w1\"}");
        sidecar.result("worker.createRouter", "{\"routerId\":\"r1\",\"rtpCapabilities\":{\"codecs\":[]}}");
        sidecar.result("router.createWebRtcTransport", "{\"transportId\":\"t1\",\"iceParameters\":{},"
                + "\"iceCandidates\":[],\"dtlsParameters\":{\"role\":\"auto\"}}");
        sidecar.result("router.createPlainTransport", "{\"transportId\":\"pt1\","
                + "\"tuple\":{\"localIp\":\"127.0.0.1\",\"localPort\":20000}}");
        sidecar.result("transport.produce", "{\"producerId\":\"p1\",\"paused\":false}");
        sidecar.result("transport.consume", "{\"consumerId\":\"k1\",\"kind\":\"video\","
                + "\"rtpParameters\":{\"codecs\":[{\"payloadType\":101}]}}");
        sidecar.result("plainTransport.connect", "{}");
        sidecar.result("transport.close", "{}");
        sidecar.result("router.canConsume", "{\"canConsume\":true}");
    }

    private void engineNotifies(String method, String params) {
        client.onNotification(method, JsonParser.parseString(params).getAsJsonObject());
    }

    private static JsonObject webRtcOptions(TransportDirection direction) {
        JsonObject appData = new JsonObject();
        appData.addProperty("direction", direction.getValue());
        JsonObject options = new JsonObject();
        options.add("appData", appData);
        return options;
    }

    private EngineRouter router() {
        EngineWorker worker = engine.createWorker(new JsonObject()).join();
        return worker.createRouter(new JsonArray()).join();
    }

    @Test
    public void handlesAreBuiltFromEngineResults() {
        EngineRouter router = router();
        assertEquals("r1", router.getId());

        EngineWebRtcTransport transport = router.createWebRtcTransport(webRtcOptions(TransportDirection.SEND))
                .join();
        assertEquals("t1", transport.getId());
        assertEquals(TransportDirection.SEND, transport.getDirection());
        assertEquals("auto", transport.getDtlsParameters().get("role").getAsString());

        EngineProducer producer = transport.produce(MediaKind.VIDEO, new JsonObject(), new JsonObject()).join();
        assertEquals("p1", producer.getId());
        assertEquals(MediaKind.VIDEO, producer.getKind());
        assertTrue(router.canConsume("p1", new JsonObject()).join());

        EnginePlainTransport plain = router.createPlainTransport(new JsonObject()).join();
        assertEquals("127.0.0.1", plain.getLocalIp());
        assertEquals(20000, plain.getLocalPort());
        plain.connect("127.0.0.1", 40000).join();

        JsonObject connect = sidecar.lastParams();
        assertEquals("pt1", connect.get("transportId").getAsString());
        assertEquals(40000, connect.get("port").getAsInt());
        assertEquals("r1", sidecar.params.get(2).get("routerId").getAsString());
    }

    @Test
    public void producerClosedByTheEngineClosesItsConsumers() {
        EngineRouter router = router();
        EngineWebRtcTransport send = router.createWebRtcTransport(webRtcOptions(TransportDirection.SEND)).join();
        EngineProducer producer = send.produce(MediaKind.VIDEO, new JsonObject(), new JsonObject()).join();
        EnginePlainTransport plain = router.createPlainTransport(new JsonObject()).join();
        EngineConsumer consumer = plain.consume("p1", new JsonObject(), true).join();
        AtomicReference<String> closed = new AtomicReference<>();
        producer.addCloseListener(() -> closed.set("producer"));
        int sent = sidecar.methods.size();

        engineNotifies("producerClosed", "{\"producerId\":\"p1\"}");

        assertTrue(producer.isClosed());
        assertTrue(consumer.isClosed());
        assertFalse(plain.isClosed());
        assertEquals("producer", closed.get());
        // nothing is sent back for objects the engine closed itself
        assertEquals(sent, sidecar.methods.size());
    }

    @Test
    public void localCloseIsSentOnceAndCascades() {
        EngineRouter router = router();
        EngineWebRtcTransport send = router.createWebRtcTransport(webRtcOptions(TransportDirection.SEND)).join();
        EngineProducer producer = send.produce(MediaKind.AUDIO, new JsonObject(), new JsonObject()).join();

        send.close();
        send.close();

        assertTrue(producer.isClosed());
        assertEquals(1, sidecar.methods.stream().filter("transport.close"::equals).count());
        assertFalse(sidecar.methods.contains("producer.close"));
    }

    @Test
    public void pauseNotificationsUpdateTheProducer() {
        EngineRouter router = router();
        EngineWebRtcTransport send = router.createWebRtcTransport(webRtcOptions(TransportDirection.SEND)).join();
        EngineProducer producer = send.produce(MediaKind.VIDEO, new JsonObject(), new JsonObject()).join();

        engineNotifies("producerPaused", "{\"producerId\":\"p1\"}");
        assertTrue(producer.isPaused());
        engineNotifies("producerResumed", "{\"producerId\":\"p1\"}");
        assertFalse(producer.isPaused());
    }

    @Test
    public void workerDeathIsReportedAndClosesItsRouters() {
        EngineWorker worker = engine.createWorker(new JsonObject()).join();
        EngineRouter router = worker.createRouter(new JsonArray()).join();
        AtomicReference<Throwable> cause = new AtomicReference<>();
        worker.addDiedListener(cause::set);

        engineNotifies("workerDied", "{\"workerId\":\"w1\",\"error\":\"SIGSEGV\"}");

        assertNotNull(cause.get());
        assertTrue(cause.get().getMessage().contains("SIGSEGV"));
        assertTrue(worker.isClosed());
        assertTrue(router.isClosed());
        assertEquals(0, engine.getObjectCount());
    }

    @Test
    public void errorResponsesFailTheRequest() {
        sidecar.errors.put("worker.createRouter", "too many routers");
        EngineWorker worker = engine.createWorker(new JsonObject()).join();

        CompletionException e = assertThrows(CompletionException.class,
                () -> worker.createRouter(new JsonArray()).join());
        RoomException cause = RoomException.from(e);
        assertEquals(Code.MEDIA_GENERIC_ERROR_CODE, cause.getCode());
        assertEquals("too many routers", cause.getMessage());
    }

    @Test
    public void lostConnectionFailsPendingRequestsAndKillsWorkers() {
        EngineWorker worker = engine.createWorker(new JsonObject()).join();
        AtomicReference<Throwable> cause = new AtomicReference<>();
        worker.addDiedListener(cause::set);
        CompletableFuture<JsonElement> unanswered = client.request("worker.getResourceUsage", new JsonObject());

        client.onConnectionLost("disconnected");

        CompletionException e = assertThrows(CompletionException.class, unanswered::join);
        assertEquals(Code.MEDIA_GENERIC_ERROR_CODE, RoomException.from(e).getCode());
        assertNotNull(cause.get());
        assertTrue(worker.isClosed());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void unreachableEngineFailsTheRequest() {
        doThrow(new IllegalStateException("Connection refused")).when(sidecar.rpc)
                .sendRequest(anyString(), any(JsonObject.class), any(Continuation.class));

        CompletionException e = assertThrows(CompletionException.class,
                () -> engine.createWorker(new JsonObject()).join());
        RoomException cause = RoomException.from(e);
        assertEquals(Code.MEDIA_GENERIC_ERROR_CODE, cause.getCode());
        assertTrue(cause.getMessage().contains("createWorker"));
    }

    @Test
    public void closedClientRejectsRequestsAndKeepsWorkersAlive() throws Exception {
        EngineWorker worker = engine.createWorker(new JsonObject()).join();

        client.close();
        client.onConnectionLost("disconnected");

        verify(sidecar.rpc).close();
        assertFalse(worker.isClosed());
        CompletionException e = assertThrows(CompletionException.class,
                () -> client.request("createWorker", new JsonObject()).join());
        assertEquals(Code.MEDIA_GENERIC_ERROR_CODE, RoomException.from(e).getCode());
    }
}
