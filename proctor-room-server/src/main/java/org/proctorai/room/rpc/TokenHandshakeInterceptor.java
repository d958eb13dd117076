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

import java.util.List;
import java.util.Map;

import org.proctorai.room.api.TokenVerifier;
import org.proctorai.room.api.pojo.AuthenticatedUser;
import org.proctorai.room.exception.RoomException;
import org.proctorai.room.exception.RoomException.Code;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Authenticates the WebSocket upgrade. The token is taken from the {@code token} query parameter
 * or, failing that, from a {@code Bearer} authorization header. Rejected upgrades get a 401.
 */
public class TokenHandshakeInterceptor implements HandshakeInterceptor {

    private static final Logger log = LoggerFactory.getLogger(TokenHandshakeInterceptor.class);

    public static final String USER_ATTRIBUTE = "proctor.user";
    static final String TOKEN_PARAM = "token";
    private static final String BEARER = "Bearer ";

    private final TokenVerifier tokenVerifier;

    public TokenHandshakeInterceptor(TokenVerifier tokenVerifier) {
        this.tokenVerifier = tokenVerifier;
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        try {
            AuthenticatedUser user = tokenVerifier.verify(extractToken(request));
            attributes.put(USER_ATTRIBUTE, user);
            log.debug("Handshake from {} authenticated as {}", request.getRemoteAddress(), user);
            return true;
        } catch (RoomException e) {
            log.info("Rejected handshake from {}: {}", request.getRemoteAddress(), e.getMessage());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        if (exception != null) {
            log.warn("Handshake from {} failed", request.getRemoteAddress(), exception);
        }
    }

    static String extractToken(ServerHttpRequest request) {
        List<String> tokens = UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams().get(TOKEN_PARAM);
        if (tokens != null && !tokens.isEmpty() && tokens.get(0) != null && !tokens.get(0).isEmpty()) {
            return tokens.get(0);
        }
        String authorization = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER)) {
            return authorization.substring(BEARER.length()).trim();
        }
        throw new RoomException(Code.USER_NOT_AUTHENTICATED_ERROR_CODE, "No token provided");
    }
}
