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

package org.proctorai.room.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.concurrent.CompletableFuture;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.proctorai.room.NotificationRoomManager;
import org.proctorai.room.api.UserNotificationService;
import org.proctorai.room.api.pojo.ParticipantRequest;
import org.proctorai.room.exception.RoomException;
import org.proctorai.room.exception.RoomException.Code;

@ExtendWith(MockitoExtension.class)
public class JsonRpcUserControlTest {

    @Mock
    private NotificationRoomManager roomManager;

    @Mock
    private UserNotificationService notificationService;

    private JsonRpcUserControl userControl;
    private final ParticipantRequest request = new ParticipantRequest("c1", "5");

    @BeforeEach
    public void setUp() {
        userControl = new JsonRpcUserControl(roomManager, notificationService);
    }

    private static JsonObject params(String json) {
        return JsonParser.parseString(json).getAsJsonObject();
    }

    @Test
    public void joinRoomPassesOptionalParams() {
        CompletableFuture<JsonElement> reply = CompletableFuture.completedFuture(new JsonObject());
        when(roomManager.joinRoom(request, "batch-1", null, "exam-9")).thenReturn(reply);

        assertSame(reply, userControl.dispatch(request, "join-room",
                params("{\"roomId\":\"batch-1\",\"examId\":\"exam-9\"}")));
    }

    @Test
    public void produceExtractsAllParams() {
        when(roomManager.produce(eq(request), eq("t1"), eq("video"), any(), any()))
                .thenReturn(CompletableFuture.completedFuture(new JsonObject()));

        userControl.dispatch(request, "produce", params("{\"transportId\":\"t1\",\"kind\":\"video\","
                + "\"rtpParameters\":{\"mid\":\"0\"},\"appData\":{\"mediaRole\":\"webcam\"}}"));

        ArgumentCaptor<JsonObject> appData = ArgumentCaptor.forClass(JsonObject.class);
        ArgumentCaptor<JsonObject> rtp = ArgumentCaptor.forClass(JsonObject.class);
        verify(roomManager).produce(eq(request), eq("t1"), eq("video"), rtp.capture(), appData.capture());
        assertEquals("0", rtp.getValue().get("mid").getAsString());
        assertEquals("webcam", appData.getValue().get("mediaRole").getAsString());
    }

    @Test
    public void parameterlessMethods() {
        when(roomManager.getProducers(request)).thenReturn(CompletableFuture.completedFuture(new JsonObject()));

        userControl.dispatch(request, "get-producers", null);

        verify(roomManager).getProducers(request);
    }

    @Test
    public void missingMandatoryParamIsAnsweredWithAnError() {
        CompletableFuture<JsonElement> reply = userControl.dispatch(request, "consume",
                params("{\"producerId\":\"p1\"}"));

        assertTrue(reply.isCompletedExceptionally());
        ArgumentCaptor<RoomException> error = ArgumentCaptor.forClass(RoomException.class);
        verify(notificationService).sendErrorResponse(eq(request), error.capture());
        assertEquals(Code.REQUEST_INVALID_PARAMS_ERROR_CODE, error.getValue().getCode());
        assertEquals("ValidationError", error.getValue().getType());
        verifyNoInteractions(roomManager);
    }

    @Test
    public void unknownMethodIsAnsweredWithAnError() {
        assertTrue(userControl.dispatch(request, "leave-room", new JsonObject()).isCompletedExceptionally());
        assertTrue(userControl.dispatch(request, null, new JsonObject()).isCompletedExceptionally());
        verifyNoInteractions(roomManager);
    }

    @Test
    public void paramTypesAreChecked() {
        JsonObject p = params("{\"a\":\"x\",\"b\":{\"c\":1},\"n\":null}");

        assertEquals("x", JsonRpcUserControl.getStringParam(p, "a", true));
        assertNull(JsonRpcUserControl.getStringParam(p, "n", false));
        assertThrows(RoomException.class, () -> JsonRpcUserControl.getStringParam(p, "b", true));
        assertEquals(1, JsonRpcUserControl.getObjectParam(p, "b", true).get("c").getAsInt());
        assertThrows(RoomException.class, () -> JsonRpcUserControl.getObjectParam(p, "a", true));
        assertThrows(RoomException.class, () -> JsonRpcUserControl.getObjectParam(p, "missing", true));
    }
}
