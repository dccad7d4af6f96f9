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
package io.graphhttp.driver.types;

/**
 * The tag of a hydrated {@link io.graphhttp.driver.Value}. Every value returned by the driver has exactly one of these types.
 *
 * @since 1.0
 */
public enum ValueType {
    NULL,
    BOOLEAN,
    INTEGER,
    FLOAT,
    STRING,
    LIST,
    MAP,
    NODE,
    RELATIONSHIP,
    PATH;

    /**
     * Whether values of this type are graph entities or paths built from them.
     *
     * @return {@code true} for {@link #NODE}, {@link #RELATIONSHIP} and {@link #PATH}
     */
    public boolean isGraphType() {
        return this == NODE || this == RELATIONSHIP || this == PATH;
    }
}
