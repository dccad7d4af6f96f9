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
import io.graphhttp.driver.internal.value.NodeValue;
import io.graphhttp.driver.types.Node;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * {@link Node} implementation that directly contains labels and properties.
 */
public class InternalNode extends InternalEntity implements Node {
    private final List<String> labels;

    public InternalNode(long id) {
        this(id, Collections.emptyList(), Collections.emptyMap());
    }

    public InternalNode(long id, List<String> labels, Map<String, Value> properties) {
        super(id, properties);
        this.labels = Collections.unmodifiableList(labels);
    }

    @Override
    public List<String> labels() {
        return labels;
    }

    @Override
    public boolean hasLabel(String label) {
        return labels.contains(label);
    }

    @Override
    public Value asValue() {
        return new NodeValue(this);
    }

    @Override
    public String toString() {
        return String.format("node<%s>", id());
    }
}
