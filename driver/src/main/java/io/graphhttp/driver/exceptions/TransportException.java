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
 * A <em>TransportException</em> indicates that the driver could not communicate with the database: the connection was refused, reset or the
 * host could not be resolved. No response was received.
 *
 * @since 1.0
 */
public class TransportException extends GraphException {
    @Serial
    private static final long serialVersionUID = -2251848102946128723L;

    /**
     * Creates a new instance.
     * @param message the message
     */
    public TransportException(String message) {
        this(message, null);
    }

    /**
     * Creates a new instance.
     * @param message the message
     * @param cause the cause
     */
    public TransportException(String message, Throwable cause) {
        super(ErrorKind.TRANSPORT, null, message, null, null, null, cause);
    }
}
