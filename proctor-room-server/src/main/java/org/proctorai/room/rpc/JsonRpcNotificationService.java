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

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.kurento.jsonrpc.Session;
import org.kurento.jsonrpc.Transaction;
import org.kurento.jsonrpc.message.Request;
import org.proctorai.room.api.UserNotificationService;
import org.proctorai.room.api.pojo.ParticipantRequest;
import org.proctorai.room.exception.RoomException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers signaling requests through the JSON-RPC transactions they arrived with, and pushes
 * notifications to the connection's session.
 */
public class JsonRpcNotificationService implements UserNotificationService {
    private static final Logger log = LoggerFactory.getLogger(JsonRpcNotificationService.class);

    private final ConcurrentMap<String, SessionWrapper> sessions = new ConcurrentHashMap<>();

    static class SessionWrapper {
        private final Session session;
        private final ConcurrentMap<Integer, Transaction> transactions = new ConcurrentHashMap<>();

        SessionWrapper(Session session) {
            this.session = session;
        }

        Session getSession() {
            return session;
        }

        void addTransaction(Integer requestId, Transaction transaction) {
            transactions.put(requestId, transaction);
        }

        Transaction removeTransaction(Integer requestId) {
            return transactions.remove(requestId);
        }

        int getTransactionCount() {
            return transactions.size();
        }
    }

    public void addSession(Session session) {
        sessions.putIfAbsent(session.getSessionId(), new SessionWrapper(session));
    }

    public void removeSession(String connectionId) {
        SessionWrapper wrapper = sessions.remove(connectionId);
        if (wrapper != null && wrapper.getTransactionCount() > 0) {
            log.debug("Connection {} closed with {} unanswered requests", connectionId,
                    wrapper.getTransactionCount());
        }
    }

    public boolean isConnected(String connectionId) {
        return sessions.containsKey(connectionId);
    }

    /**
     * Keeps the transaction of a request until the signaling loop answers it.
     */
    public void addTransaction(Transaction transaction, Request<JsonObject> request) {
        SessionWrapper wrapper = sessions.get(transaction.getSession().getSessionId());
        if (wrapper != null && request.getId() != null) {
            wrapper.addTransaction(request.getId(), transaction);
        }
    }

    private Transaction removeTransaction(ParticipantRequest request) {
        if (request.getRequestId() == null) {
            return null;
        }
        SessionWrapper wrapper = sessions.get(request.getConnectionId());
        if (wrapper == null) {
            return null;
        }
        try {
            return wrapper.removeTransaction(Integer.valueOf(request.getRequestId()));
        } catch (NumberFormatException e) {
            log.warn("Request id '{}' of connection {} is not numeric", request.getRequestId(),
                    request.getConnectionId());
            return null;
        }
    }

    @Override
    public void sendResponse(ParticipantRequest request, JsonElement result) {
        Transaction transaction = removeTransaction(request);
        if (transaction == null) {
            log.debug("No transaction found for {}, dropping its response", request);
            return;
        }
        try {
            transaction.sendResponse(result == null ? new JsonObject() : result);
        } catch (Exception e) {
            log.warn("Error responding to {}", request, e);
        }
    }

    /**
     * The error's taxonomy type travels in the JSON-RPC error {@code data} member.
     */
    @Override
    public void sendErrorResponse(ParticipantRequest request, RoomException error) {
        Transaction transaction = removeTransaction(request);
        if (transaction == null) {
            log.warn("No transaction found for {}, dropping error {}", request, error.getMessage());
            return;
        }
        try {
            transaction.sendError(error.getCodeValue(), error.getMessage(), error.getType());
        } catch (Exception e) {
            log.warn("Error sending error response to {}", request, e);
        }
    }

    @Override
    public void sendNotification(String connectionId, String method, JsonElement params) {
        SessionWrapper wrapper = sessions.get(connectionId);
        if (wrapper == null) {
            log.warn("Connection {} is gone, dropping notification {}", connectionId, method);
            return;
        }
        try {
            wrapper.getSession().sendNotification(method, params == null ? new JsonObject() : params);
        } catch (Exception e) {
            log.warn("Error sending notification {} to connection {}", method, connectionId, e);
        }
    }
}
