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
 * The <strong>Relationship</strong> interface describes the characteristics of a relationship from a graph. The endpoints are referenced by id
 * only.
 *
 * @see Path
 * @see Node
 * @since 1.0
 */
public interface Relationship extends Entity {
    /**
     * Return the id of the start node of this relationship.
     *
     * @return the start node id
     */
    long startNodeId();

    /**
     * Return the id of the end node of this relationship.
     *
     * @return the end node id
     */
    long endNodeId();

    /**
     * Return the type of this relationship.
     *
     * @return the type name
     */
    String type();
}
