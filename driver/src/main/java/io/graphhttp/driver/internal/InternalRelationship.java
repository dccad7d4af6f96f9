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
package io.graphhttp.driver.internal;

import io.graphhttp.driver.Value;
import io.graphhttp.driver.internal.value.RelationshipValue;
import io.graphhttp.driver.types.Relationship;
import java.util.Map;

/**
 * A relationship hydrated from a graph result, its endpoints referenced by node id.
 */
public class InternalRelationship extends InternalEntity implements Relationship {
    private final long startNodeId;
    private final long endNodeId;
    private final String type;

    public InternalRelationship(long id, long startNodeId, long endNodeId, String type, Map<String, Value> properties) {
        super(id, properties);
        this.startNodeId = startNodeId;
        this.endNodeId = endNodeId;
        this.type = type;
    }

    @Override
    public long startNodeId() {
        return startNodeId;
    }

    @Override
    public long endNodeId() {
        return endNodeId;
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public Value asValue() {
        return new RelationshipValue(this);
    }

    @Override
    public String toString() {
        return String.format("(%d)-[%d:%s]->(%d)", startNodeId, id(), type, endNodeId);
    }
}
