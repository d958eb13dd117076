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

package org.proctorai.room.auth;

import java.nio.charset.StandardCharsets;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.Claim;
import com.auth0.jwt.interfaces.DecodedJWT;
import org.proctorai.room.api.TokenVerifier;
import org.proctorai.room.api.pojo.AuthenticatedUser;
import org.proctorai.room.api.pojo.PeerRole;
import org.proctorai.room.config.ProctorRoomProperties;
import org.proctorai.room.exception.RoomException;
import org.proctorai.room.exception.RoomException.Code;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies HMAC-SHA256 signed tokens issued by the exam backend. The user id is read from the
 * configured claim (string or number), falling back to the subject; the role claim is optional.
 */
public class JwtTokenVerifier implements TokenVerifier {

    private static final Logger log = LoggerFactory.getLogger(JwtTokenVerifier.class);

    private final JWTVerifier verifier;
    private final String userIdClaim;
    private final String roleClaim;

    public JwtTokenVerifier(ProctorRoomProperties.Auth auth) {
        if (auth.getJwtSecret() == null || auth.getJwtSecret().isEmpty()) {
            throw new IllegalArgumentException("A JWT secret must be configured");
        }
        this.verifier = JWT.require(Algorithm.HMAC256(auth.getJwtSecret().getBytes(StandardCharsets.UTF_8)))
                .build();
        this.userIdClaim = auth.getUserIdClaim();
        this.roleClaim = auth.getRoleClaim();
    }

    @Override
    public AuthenticatedUser verify(String token) {
        if (token == null || token.isEmpty()) {
            throw new RoomException(Code.USER_NOT_AUTHENTICATED_ERROR_CODE, "No token provided");
        }
        DecodedJWT jwt;
        try {
            jwt = verifier.verify(token);
        } catch (JWTVerificationException e) {
            log.debug("Token rejected: {}", e.getMessage());
            throw new RoomException(Code.USER_NOT_AUTHENTICATED_ERROR_CODE, "Invalid token: " + e.getMessage(), e);
        }
        String userId = userId(jwt);
        if (userId == null || userId.isEmpty()) {
            throw new RoomException(Code.USER_NOT_AUTHENTICATED_ERROR_CODE,
                    "Token carries no '" + userIdClaim + "' claim");
        }
        PeerRole role = null;
        Claim claim = jwt.getClaim(roleClaim);
        if (!claim.isNull() && !claim.isMissing()) {
            try {
                role = PeerRole.fromValue(claim.asString());
            } catch (RoomException e) {
                throw new RoomException(Code.USER_NOT_AUTHENTICATED_ERROR_CODE,
                        "Token carries an unknown role '" + claim.asString() + "'", e);
            }
        }
        return new AuthenticatedUser(userId, role);
    }

    private String userId(DecodedJWT jwt) {
        Claim claim = jwt.getClaim(userIdClaim);
        if (claim.isNull() || claim.isMissing()) {
            return jwt.getSubject();
        }
        String value = claim.asString();
        if (value != null) {
            return value;
        }
        Long number = claim.asLong();
        return number != null ? number.toString() : null;
    }
}
