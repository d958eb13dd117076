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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.kurento.jsonrpc.Session;
import org.kurento.jsonrpc.Transaction;
import org.kurento.jsonrpc.message.Request;
import org.mockito.ArgumentCaptor;
import org.proctorai.room.api.pojo.ParticipantRequest;
import org.proctorai.room.exception.RoomException;
import org.proctorai.room.exception.RoomException.Code;

public class JsonRpcNotificationServiceTest {

    private JsonRpcNotificationService service;
    private Session session;

    @BeforeEach
    public void setUp() {
        service = new JsonRpcNotificationService();
        session = mock(Session.class);
        when(session.getSessionId()).thenReturn("c1");
        service.addSession(session);
    }

    @SuppressWarnings("unchecked")
    private Transaction transaction(Integer id) {
        Transaction transaction = mock(Transaction.class);
        when(transaction.getSession()).thenReturn(session);
        Request<JsonObject> request = mock(Request.class);
        when(request.getId()).thenReturn(id);
        service.addTransaction(transaction, request);
        return transaction;
    }

    @Test
    public void responsesGoToTheTransactionOfTheRequest() throws Exception {
        Transaction first = transaction(17);
        Transaction second = transaction(18);
        JsonObject result = new JsonObject();
        result.addProperty("producerId", "p1");

        service.sendResponse(new ParticipantRequest("c1", "18"), result);

        verify(second).sendResponse(result);
        verify(first, never()).sendResponse(any());
    }

    @Test
    public void eachTransactionIsAnsweredOnce() throws Exception {
        Transaction transaction = transaction(3);

        service.sendResponse(new ParticipantRequest("c1", "3"), null);
        service.sendResponse(new ParticipantRequest("c1", "3"), null);

        ArgumentCaptor<Object> result = ArgumentCaptor.forClass(Object.class);
        verify(transaction, times(1)).sendResponse(result.capture());
        assertEquals(0, ((JsonElement) result.getValue()).getAsJsonObject().size());
    }

    @Test
    public void responsesToNotificationsAreDropped() throws Exception {
        Transaction transaction = transaction(null);

        service.sendResponse(new ParticipantRequest("c1", null), new JsonObject());
        service.sendResponse(new ParticipantRequest("c1", "not-a-number"), new JsonObject());

        verify(transaction, never()).sendResponse(any());
    }

    @Test
    public void errorsCarryCodeMessageAndType() throws Exception {
        Transaction transaction = transaction(9);

        service.sendErrorResponse(new ParticipantRequest("c1", "9"),
                new RoomException(Code.MEDIA_TRANSPORT_NOT_FOUND_ERROR_CODE, "Transport 't9' not found"));

        verify(transaction).sendError(302, "Transport 't9' not found", "TransportError");
    }

    @Test
    public void notificationsGoToTheSession() throws Exception {
        JsonArray producers = new JsonArray();

        service.sendNotification("c1", "existing-producers", producers);
        service.sendNotification("c1", "new-producer", null);

        verify(session).sendNotification("existing-producers", producers);
        verify(session).sendNotification(eq("new-producer"), any(JsonObject.class));
    }

    @Test
    public void closedOrFailingConnectionsAreSkipped() throws Exception {
        Transaction transaction = transaction(1);
        service.sendNotification("unknown", "new-producer", new JsonObject());
        verify(session, never()).sendNotification(anyString(), any());

        doThrow(new IllegalStateException("broken pipe")).when(session).sendNotification(anyString(), any());
        service.sendNotification("c1", "new-producer", new JsonObject());
        assertTrue(service.isConnected("c1"));

        service.removeSession("c1");
        assertFalse(service.isConnected("c1"));
        service.sendErrorResponse(new ParticipantRequest("c1", "1"),
                new RoomException(Code.ROOM_CLOSED_ERROR_CODE, "Room closed"));
        verify(transaction, never()).sendError(anyInt(), anyString(), anyString());
    }
}
