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

package org.proctorai.room.exception;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * General exception for the room SDK. Every instance carries a {@link Code} whose numeric value is
 * stable across releases and is sent back to clients in error replies, together with the error
 * type of its category.
 */
public class RoomException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public enum Code {
        USER_NOT_FOUND_ERROR_CODE(102, ErrorType.PEER_NOT_FOUND),
        USER_NOT_AUTHENTICATED_ERROR_CODE(103, ErrorType.AUTHENTICATION),
        USER_NOT_AUTHORIZED_ERROR_CODE(104, ErrorType.AUTHORIZATION),

        ROOM_NOT_FOUND_ERROR_CODE(202, ErrorType.ROOM),
        ROOM_CLOSED_ERROR_CODE(203, ErrorType.ROOM),
        ROOM_CANNOT_BE_CREATED_ERROR_CODE(204, ErrorType.ROOM),

        MEDIA_GENERIC_ERROR_CODE(301, ErrorType.ENGINE),
        MEDIA_TRANSPORT_NOT_FOUND_ERROR_CODE(302, ErrorType.TRANSPORT),
        MEDIA_PRODUCER_NOT_FOUND_ERROR_CODE(303, ErrorType.ENGINE),
        MEDIA_CANNOT_CONSUME_ERROR_CODE(304, ErrorType.ENGINE),

        RECORDING_PORT_UNAVAILABLE_ERROR_CODE(401, ErrorType.RECORDING),
        RECORDING_PRODUCER_INACTIVE_ERROR_CODE(402, ErrorType.RECORDING),
        RECORDING_ENCODER_ERROR_CODE(403, ErrorType.RECORDING),
        RECORDING_ABORTED_ERROR_CODE(404, ErrorType.RECORDING),
        RECORDING_STORAGE_ERROR_CODE(405, ErrorType.RECORDING),

        REQUEST_INVALID_PARAMS_ERROR_CODE(801, ErrorType.VALIDATION),

        GENERIC_ERROR_CODE(999, ErrorType.INTERNAL);

        private final int value;
        private final ErrorType type;

        Code(int value, ErrorType type) {
            this.value = value;
            this.type = type;
        }

        public int getValue() {
            return value;
        }

        public ErrorType getType() {
            return type;
        }
    }

    /**
     * Error categories as reported to signaling clients.
     */
    public enum ErrorType {
        AUTHENTICATION("AuthenticationError"),
        AUTHORIZATION("AuthorizationError"),
        PEER_NOT_FOUND("PeerNotFound"),
        ROOM("RoomError"),
        TRANSPORT("TransportError"),
        ENGINE("EngineError"),
        RECORDING("RecordingError"),
        VALIDATION("ValidationError"),
        INTERNAL("InternalError");

        private final String label;

        ErrorType(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }

    private final Code code;

    public RoomException(Code code, String message) {
        super(message);
        this.code = code;
    }

    public RoomException(Code code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public Code getCode() {
        return code;
    }

    public int getCodeValue() {
        return code.getValue();
    }

    public String getType() {
        return code.getType().getLabel();
    }

    /**
     * Unwraps completion wrappers and converts any failure into a {@link RoomException}, keeping
     * the original one when it already is.
     */
    public static RoomException from(Throwable t) {
        Throwable cause = t;
        while ((cause instanceof CompletionException
                || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof RoomException) {
            return (RoomException) cause;
        }
        return new RoomException(Code.GENERIC_ERROR_CODE, String.valueOf(cause.getMessage()), cause);
    }

    @Override
    public String toString() {
        return "Code: " + getCodeValue() + " " + super.toString();
    }
}
