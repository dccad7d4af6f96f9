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

import java.io.Serial;

/**
 * A <em>ClientRequestException</em> indicates that the database rejected the request: the query is malformed, a constraint was violated, the
 * endpoint does not exist, or the request was made against a transaction that can no longer be used. Submitting it again unchanged will fail
 * again.
 *
 * @since 1.0
 */
public class ClientRequestException extends GraphException {
    @Serial
    private static final long serialVersionUID = -8317298731528416245L;

    /**
     * Creates a new instance for a failure detected before anything was sent.
     * @param message the message
     */
    public ClientRequestException(String message) {
        this(null, message, null, null, null);
    }

    /**
     * Creates a new instance.
     * @param code the database code
     * @param message the database message
     * @param statementIndex the index of the failing statement
     * @param status the response status
     * @param responseExcerpt the response excerpt
     */
    public ClientRequestException(
            String code, String message, Integer statementIndex, Integer status, String responseExcerpt) {
        super(ErrorKind.CLIENT_REQUEST, code, message, statementIndex, status, responseExcerpt, null);
    }
}
