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
 * Failed to authenticate the driver to the server due to bad credentials provided, or the authenticated user is not allowed to perform the
 * request.
 *
 * @since 1.0
 */
public class AuthenticationException extends GraphException {
    @Serial
    private static final long serialVersionUID = 1324352999966240271L;

    /**
     * Creates a new instance.
     * @param code the code
     * @param message the message
     * @param status the response status
     * @param responseExcerpt the response excerpt
     */
    public AuthenticationException(String code, String message, Integer status, String responseExcerpt) {
        super(ErrorKind.AUTHENTICATION, code, message, null, status, responseExcerpt, null);
    }
}
