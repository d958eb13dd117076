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

/**
 * Method and parameter names of the signaling protocol.
 */
public final class ProtocolElements {

    public static final String JOINROOM_METHOD = "join-room";
    public static final String JOINROOM_ROOM_PARAM = "roomId";
    public static final String JOINROOM_ROLE_PARAM = "role";
    public static final String JOINROOM_EXAM_PARAM = "examId";

    public static final String CREATETRANSPORT_METHOD = "create-transport";
    public static final String CREATETRANSPORT_DIRECTION_PARAM = "direction";

    public static final String CONNECTTRANSPORT_METHOD = "connect-transport";
    public static final String CONNECTTRANSPORT_TRANSPORT_PARAM = "transportId";
    public static final String CONNECTTRANSPORT_DTLS_PARAM = "dtlsParameters";

    public static final String PRODUCE_METHOD = "produce";
    public static final String PRODUCE_TRANSPORT_PARAM = "transportId";
    public static final String PRODUCE_KIND_PARAM = "kind";
    public static final String PRODUCE_RTP_PARAM = "rtpParameters";
    public static final String PRODUCE_APPDATA_PARAM = "appData";

    public static final String CONSUME_METHOD = "consume";
    public static final String CONSUME_PRODUCER_PARAM = "producerId";
    public static final String CONSUME_RTPCAPABILITIES_PARAM = "rtpCapabilities";

    public static final String GETPRODUCERS_METHOD = "get-producers";

    public static final String CLOSEPRODUCER_METHOD = "close-producer";
    public static final String CLOSEPRODUCER_PRODUCER_PARAM = "producerId";

    private ProtocolElements() {
    }
}
