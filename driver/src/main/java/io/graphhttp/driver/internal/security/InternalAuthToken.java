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
package io.graphhttp.driver.internal.security;

import io.graphhttp.driver.AuthToken;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;

/**
 * Holds the scheme and credentials of an {@link AuthToken} and renders them as an {@code Authorization} header value.
 * Credentials never appear in {@link #toString()}.
 */
public final class InternalAuthToken implements AuthToken {
    public static final String SCHEME_BASIC = "basic";
    public static final String SCHEME_BEARER = "bearer";
    public static final String SCHEME_NONE = "none";

    public static final InternalAuthToken NONE = new InternalAuthToken(SCHEME_NONE, null, null);

    private final String scheme;
    private final String principal;
    private final String credentials;

    private InternalAuthToken(String scheme, String principal, String credentials) {
        this.scheme = scheme;
        this.principal = principal;
        this.credentials = credentials;
    }

    public static InternalAuthToken basic(String username, String password) {
        return new InternalAuthToken(SCHEME_BASIC, username, password);
    }

    public static InternalAuthToken bearer(String token) {
        return new InternalAuthToken(SCHEME_BEARER, null, token);
    }

    public String scheme() {
        return scheme;
    }

    public Optional<String> authorizationHeader() {
        return switch (scheme) {
            case SCHEME_BASIC -> Optional.of("Basic "
                    + Base64.getEncoder()
                            .encodeToString((principal + ":" + credentials).getBytes(StandardCharsets.UTF_8)));
            case SCHEME_BEARER -> Optional.of("Bearer " + credentials);
            default -> Optional.empty();
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        var that = (InternalAuthToken) o;
        return scheme.equals(that.scheme)
                && Objects.equals(principal, that.principal)
                && Objects.equals(credentials, that.credentials);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scheme, principal, credentials);
    }

    @Override
    public String toString() {
        return principal == null
                ? "AuthToken{scheme=" + scheme + "}"
                : "AuthToken{scheme=" + scheme + ", principal=" + principal + "}";
    }
}
