/*
 * Copyright (c) "Neo4j"
 * Neo4j Sweden AB [https://neo4j.com]
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.graphhttp.driver;

import io.graphhttp.driver.internal.security.InternalAuthToken;
import java.util.Objects;

/**
 * This is a listing of the various methods of authentication supported by this
 * client. The scheme used must be supported by the server you are connecting to.
 *
 * @see GraphDatabase#client(String, AuthToken)
 * @since 1.0
 */
public final class AuthTokens {
    private AuthTokens() {}

    /**
     * The basic authentication scheme, using a username and a password.
     *
     * @param username this is the "principal", identifying who this token represents
     * @param password this is the "credential", proving the identity of the user
     * @return an authentication token
     * @throws NullPointerException when either username or password is {@code null}
     */
    public static AuthToken basic(String username, String password) {
        Objects.requireNonNull(username, "Username can't be null");
        Objects.requireNonNull(password, "Password can't be null");
        return InternalAuthToken.basic(username, password);
    }

    /**
     * The bearer authentication scheme, using a base64 encoded token, such as an SSO token.
     *
     * @param token the token
     * @return an authentication token
     * @throws NullPointerException when token is {@code null}
     */
    public static AuthToken bearer(String token) {
        Objects.requireNonNull(token, "Token can't be null");
        return InternalAuthToken.bearer(token);
    }

    /**
     * No authentication scheme. No {@code Authorization} header is sent.
     *
     * @return an authentication token
     */
    public static AuthToken none() {
        return InternalAuthToken.NONE;
    }
}
