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
 * A <em>ServerInternalException</em> indicates that the server failed while processing an accepted request. Database errors of the transient
 * class are reported with this type; see {@link #isTransient()}.
 *
 * @since 1.0
 */
public class ServerInternalException extends GraphException {
    @Serial
    private static final long serialVersionUID = 2869418740571043762L;

    /**
     * Creates a new instance.
     * @param code the database code
     * @param message the message
     * @param statementIndex the index of the failing statement
     * @param status the response status
     * @param responseExcerpt the response excerpt
     */
    public ServerInternalException(
            String code, String message, Integer statementIndex, Integer status, String responseExcerpt) {
        super(ErrorKind.SERVER_INTERNAL, code, message, statementIndex, status, responseExcerpt, null);
    }
}
