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
 * A uniquely identifiable property container that can form part of a graph.
 * <p>
 * Entities are snapshots taken when a response was hydrated. They hold no reference to the client and are never refreshed.
 *
 * @since 1.0
 */
public interface Entity extends MapAccessor {
    /**
     * A unique id for this Entity within the database instance it was read from. Ids are not stable across database instances, and may be
     * reused after the entity has been deleted.
     *
     * @return the id of this entity
     */
    long id();
}
