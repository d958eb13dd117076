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

import java.util.concurrent.Executor;

import com.google.gson.JsonObject;
import org.kurento.jsonrpc.DefaultJsonRpcHandler;
import org.kurento.jsonrpc.Session;
import org.kurento.jsonrpc.Transaction;
import org.kurento.jsonrpc.message.Request;
import org.proctorai.room.NotificationRoomManager;
import org.proctorai.room.api.pojo.AuthenticatedUser;
import org.proctorai.room.api.pojo.ParticipantRequest;
import org.proctorai.room.exception.RoomException;
import org.proctorai.room.exception.RoomException.Code;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON-RPC endpoint of the signaling protocol. Requests are answered asynchronously; every
 * connection event is handed over to the signaling loop, so room state is only touched from that
 * thread.
 */
public class RoomJsonRpcHandler extends DefaultJsonRpcHandler<JsonObject> {

    private static final Logger log = LoggerFactory.getLogger(RoomJsonRpcHandler.class);

    private final NotificationRoomManager roomManager;
    private final JsonRpcUserControl userControl;
    private final JsonRpcNotificationService notificationService;
    private final UserConnectionMapper userConnectionMapper;
    private final Executor loop;

    public RoomJsonRpcHandler(NotificationRoomManager roomManager, JsonRpcUserControl userControl,
                              JsonRpcNotificationService notificationService,
                              UserConnectionMapper userConnectionMapper, Executor loop) {
        this.roomManager = roomManager;
        this.userControl = userControl;
        this.notificationService = notificationService;
        this.userConnectionMapper = userConnectionMapper;
        this.loop = loop;
    }

    @Override
    public void afterConnectionEstablished(Session session) throws Exception {
        String connectionId = session.getSessionId();
        AuthenticatedUser user = (AuthenticatedUser) session.getAttributes()
                .get(TokenHandshakeInterceptor.USER_ATTRIBUTE);
        if (user == null) {
            log.warn("Connection {} has no authenticated user, closing it", connectionId);
            session.close();
            return;
        }
        notificationService.addSession(session);
        int connections = userConnectionMapper.add(user.getUserId(), connectionId);
        if (connections > 1) {
            log.info("User {} now has {} open connections", user.getUserId(), connections);
        }
        loop.execute(() -> roomManager.openConnection(connectionId, user));
    }

    @Override
    public void handleRequest(Transaction transaction, Request<JsonObject> request) throws Exception {
        String connectionId = transaction.getSession().getSessionId();
        log.debug("Connection {} - request: {}", connectionId, request);
        ParticipantRequest participantRequest = new ParticipantRequest(connectionId,
                request.getId() == null ? null : request.getId().toString());
        if (!notificationService.isConnected(connectionId)) {
            RoomException error = new RoomException(Code.USER_NOT_AUTHENTICATED_ERROR_CODE,
                    "Connection " + connectionId + " is not authenticated");
            log.warn("Rejecting {}: {}", participantRequest, error.getMessage());
            transaction.sendError(error.getCodeValue(), error.getMessage(), error.getType());
            return;
        }
        notificationService.addTransaction(transaction, request);
        JsonObject params = request.getParams() == null ? new JsonObject() : request.getParams();
        String method = request.getMethod();
        transaction.startAsync();
        loop.execute(() -> userControl.dispatch(participantRequest, method, params));
    }

    @Override
    public void handleTransportError(Session session, Throwable exception) throws Exception {
        log.warn("Transport error on connection {}", session.getSessionId(), exception);
    }

    @Override
    public void handleUncaughtException(Session session, Exception exception) {
        log.error("Uncaught exception on connection {}", session.getSessionId(), exception);
    }

    @Override
    public void afterConnectionClosed(Session session, String status) throws Exception {
        String connectionId = session.getSessionId();
        log.info("Connection {} closed ({})", connectionId, status);
        notificationService.removeSession(connectionId);
        userConnectionMapper.removeByConnectionId(connectionId);
        loop.execute(() -> roomManager.disconnect(connectionId));
    }
}
