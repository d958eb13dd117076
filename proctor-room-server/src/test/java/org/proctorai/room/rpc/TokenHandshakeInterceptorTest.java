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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.proctorai.room.api.TokenVerifier;
import org.proctorai.room.api.pojo.AuthenticatedUser;
import org.proctorai.room.api.pojo.PeerRole;
import org.proctorai.room.exception.RoomException;
import org.proctorai.room.exception.RoomException.Code;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.socket.WebSocketHandler;

public class TokenHandshakeInterceptorTest {

    private final TokenVerifier verifier = mock(TokenVerifier.class);
    private final TokenHandshakeInterceptor interceptor = new TokenHandshakeInterceptor(verifier);

    private static MockHttpServletRequest upgrade(String query) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/room");
        request.setQueryString(query);
        return request;
    }

    @Test
    public void tokenIsReadFromTheQuery() {
        assertEquals("abc.def", TokenHandshakeInterceptor.extractToken(
                new ServletServerHttpRequest(upgrade("token=abc.def"))));
    }

    @Test
    public void bearerHeaderIsTheFallback() {
        MockHttpServletRequest request = upgrade(null);
        request.addHeader(HttpHeaders.AUTHORIZATION, "Bearer xyz");

        assertEquals("xyz", TokenHandshakeInterceptor.extractToken(new ServletServerHttpRequest(request)));
    }

    @Test
    public void missingTokenIsNotAuthenticated() {
        RoomException e = assertThrows(RoomException.class,
                () -> TokenHandshakeInterceptor.extractToken(new ServletServerHttpRequest(upgrade("token="))));
        assertEquals(Code.USER_NOT_AUTHENTICATED_ERROR_CODE, e.getCode());
    }

    @Test
    public void verifiedUserIsStoredInTheSessionAttributes() {
        AuthenticatedUser user = new AuthenticatedUser("42", PeerRole.STUDENT);
        when(verifier.verify("good")).thenReturn(user);
        Map<String, Object> attributes = new HashMap<>();
        MockHttpServletResponse response = new MockHttpServletResponse();

        boolean accepted = interceptor.beforeHandshake(new ServletServerHttpRequest(upgrade("token=good")),
                new ServletServerHttpResponse(response), mock(WebSocketHandler.class), attributes);

        assertTrue(accepted);
        assertEquals(user, attributes.get(TokenHandshakeInterceptor.USER_ATTRIBUTE));
    }

    @Test
    public void rejectedTokensGetUnauthorized() {
        when(verifier.verify("bad")).thenThrow(
                new RoomException(Code.USER_NOT_AUTHENTICATED_ERROR_CODE, "Invalid token"));
        Map<String, Object> attributes = new HashMap<>();
        MockHttpServletResponse servletResponse = new MockHttpServletResponse();
        ServletServerHttpResponse response = new ServletServerHttpResponse(servletResponse);

        boolean accepted = interceptor.beforeHandshake(new ServletServerHttpRequest(upgrade("token=bad")),
                response, mock(WebSocketHandler.class), attributes);

        assertFalse(accepted);
        assertTrue(attributes.isEmpty());
        assertEquals(401, servletResponse.getStatus());
    }
}
