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
 * A signal that the contract for client-server communication has broken down: the request could not be expressed on the wire, or the response
 * did not have the expected structure.
 *
 * @since 1.0
 */
public class ProtocolException extends GraphException {
    @Serial
    private static final long serialVersionUID = -1946521083247106129L;

    /**
     * Creates a new instance.
     * @param message the message
     */
    public ProtocolException(String message) {
        this(message, null);
    }

    /**
     * Creates a new instance.
     * @param message the message
     * @param cause the cause
     */
    public ProtocolException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    /**
     * Creates a new instance for a malformed response.
     * @param message the message
     * @param status the response status
     * @param responseExcerpt the response excerpt
     * @param cause the cause
     */
    public ProtocolException(String message, Integer status, String responseExcerpt, Throwable cause) {
        super(ErrorKind.PROTOCOL, null, message, null, status, responseExcerpt, cause);
    }
}
