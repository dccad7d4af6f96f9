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
package io.graphhttp.driver.exceptions;

/**
 * The closed set of failure categories a call can end with. Every failed call carries exactly one kind, so callers can branch on it
 * without inspecting messages.
 */
public enum ErrorKind {
    /**
     * The request never produced a response: connection refused, name resolution failure, connection reset.
     */
    TRANSPORT(true),
    /**
     * No response arrived within the configured request timeout.
     */
    TIMEOUT(true),
    /**
     * The server rejected the credentials or the caller lacks the required permission.
     */
    AUTHENTICATION(false),
    /**
     * The database rejected the request itself: malformed query, constraint violation, unknown endpoint.
     */
    CLIENT_REQUEST(false),
    /**
     * The server failed while processing a request it accepted.
     */
    SERVER_INTERNAL(false),
    /**
     * The response did not have the structure the statement endpoint guarantees, or the request could not be built.
     */
    PROTOCOL(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * Whether the same request may succeed if submitted again unchanged. The driver itself never retries.
     *
     * @return {@code true} for transport failures and timeouts
     */
    public boolean isRetryable() {
        return retryable;
    }
}
