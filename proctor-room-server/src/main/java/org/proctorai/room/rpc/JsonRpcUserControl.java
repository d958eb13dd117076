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

import java.util.concurrent.CompletableFuture;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.proctorai.room.NotificationRoomManager;
import org.proctorai.room.api.UserNotificationService;
import org.proctorai.room.api.pojo.ParticipantRequest;
import org.proctorai.room.exception.RoomException;
import org.proctorai.room.exception.RoomException.Code;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps JSON-RPC methods onto {@link NotificationRoomManager} operations. Must be called on the
 * signaling loop.
 */
public class JsonRpcUserControl {

    private static final Logger log = LoggerFactory.getLogger(JsonRpcUserControl.class);

    private final NotificationRoomManager roomManager;
    private final UserNotificationService notificationService;

    public JsonRpcUserControl(NotificationRoomManager roomManager, UserNotificationService notificationService) {
        this.roomManager = roomManager;
        this.notificationService = notificationService;
    }

    /**
     * Runs the request. Replies, including error replies, are sent by the room manager; only
     * malformed requests are answered here.
     */
    public CompletableFuture<JsonElement> dispatch(ParticipantRequest request, String method, JsonObject params) {
        log.debug("Request {} from {}: {}", method, request.getConnectionId(), params);
        try {
            JsonObject p = params == null ? new JsonObject() : params;
            switch (method == null ? "" : method) {
                case ProtocolElements.JOINROOM_METHOD:
                    return roomManager.joinRoom(request,
                            getStringParam(p, ProtocolElements.JOINROOM_ROOM_PARAM, true),
                            getStringParam(p, ProtocolElements.JOINROOM_ROLE_PARAM, false),
                            getStringParam(p, ProtocolElements.JOINROOM_EXAM_PARAM, false));
                case ProtocolElements.CREATETRANSPORT_METHOD:
                    return roomManager.createTransport(request,
                            getStringParam(p, ProtocolElements.CREATETRANSPORT_DIRECTION_PARAM, true));
                case ProtocolElements.CONNECTTRANSPORT_METHOD:
                    return roomManager.connectTransport(request,
                            getStringParam(p, ProtocolElements.CONNECTTRANSPORT_TRANSPORT_PARAM, true),
                            getObjectParam(p, ProtocolElements.CONNECTTRANSPORT_DTLS_PARAM, true));
                case ProtocolElements.PRODUCE_METHOD:
                    return roomManager.produce(request,
                            getStringParam(p, ProtocolElements.PRODUCE_TRANSPORT_PARAM, true),
                            getStringParam(p, ProtocolElements.PRODUCE_KIND_PARAM, true),
                            getObjectParam(p, ProtocolElements.PRODUCE_RTP_PARAM, true),
                            getObjectParam(p, ProtocolElements.PRODUCE_APPDATA_PARAM, true));
                case ProtocolElements.CONSUME_METHOD:
                    return roomManager.consume(request,
                            getStringParam(p, ProtocolElements.CONSUME_PRODUCER_PARAM, true),
                            getObjectParam(p, ProtocolElements.CONSUME_RTPCAPABILITIES_PARAM, true));
                case ProtocolElements.GETPRODUCERS_METHOD:
                    return roomManager.getProducers(request);
                case ProtocolElements.CLOSEPRODUCER_METHOD:
                    return roomManager.closeProducer(request,
                            getStringParam(p, ProtocolElements.CLOSEPRODUCER_PRODUCER_PARAM, true));
                default:
                    throw new RoomException(Code.REQUEST_INVALID_PARAMS_ERROR_CODE,
                            "Unknown method '" + method + "'");
            }
        } catch (RoomException e) {
            log.warn("Rejected request {} from {}: {}", method, request.getConnectionId(), e.getMessage());
            notificationService.sendErrorResponse(request, e);
            return CompletableFuture.failedFuture(e);
        }
    }

    static String getStringParam(JsonObject params, String name, boolean mandatory) {
        JsonElement value = params.get(name);
        if (value == null || value.isJsonNull()) {
            if (mandatory) {
                throw new RoomException(Code.REQUEST_INVALID_PARAMS_ERROR_CODE, "Missing parameter '" + name + "'");
            }
            return null;
        }
        if (!value.isJsonPrimitive()) {
            throw new RoomException(Code.REQUEST_INVALID_PARAMS_ERROR_CODE,
                    "Parameter '" + name + "' must be a string");
        }
        return value.getAsString();
    }

    static JsonObject getObjectParam(JsonObject params, String name, boolean mandatory) {
        JsonElement value = params.get(name);
        if (value == null || value.isJsonNull()) {
            if (mandatory) {
                throw new RoomException(Code.REQUEST_INVALID_PARAMS_ERROR_CODE, "Missing parameter '" + name + "'");
            }
            return null;
        }
        if (!value.isJsonObject()) {
            throw new RoomException(Code.REQUEST_INVALID_PARAMS_ERROR_CODE,
                    "Parameter '" + name + "' must be an object");
        }
        return value.getAsJsonObject();
    }
}
