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
package io.graphhttp.driver.exceptions.value;

import java.io.Serial;

/**
 * A <em>ValueException</em> indicates that the client has carried out an operation on a value that does not support it.
 *
 * @since 1.0
 */
public class ValueException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -1269336313727174998L;

    /**
     * Creates a new instance.
     * @param message the message
     */
    public ValueException(String message) {
        super(message);
    }
}
