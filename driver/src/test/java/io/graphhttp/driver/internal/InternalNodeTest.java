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

import static io.graphhttp.driver.Values.value;
import static io.graphhttp.driver.testutil.TestUtil.asList;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.graphhttp.driver.Value;
import io.graphhttp.driver.Values;
import io.graphhttp.driver.types.ValueType;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InternalNodeTest {
    private static InternalNode alice() {
        Map<String, Value> properties = new LinkedHashMap<>();
        properties.put("name", value("Alice"));
        properties.put("age", value(33));
        return new InternalNode(12345678, List.of("Person", "Employee"), properties);
    }

    @Test
    void shouldExposeIdLabelsAndProperties() {
        var node = alice();

        assertThat(node.id(), equalTo(12345678L));
        assertTrue(node.hasLabel("Person"));
        assertFalse(node.hasLabel("Robot"));
        assertThat(asList(node.keys()), contains("name", "age"));
        assertThat(node.get("name").asString(), equalTo("Alice"));
        assertThat(node.get("age").asLong(), equalTo(33L));
    }

    @Test
    void shouldReturnNullForMissingProperty() {
        assertThat(alice().get("email"), equalTo(Values.NULL));
    }

    @Test
    void shouldConvertPropertiesToMap() {
        assertThat(alice().asMap(), equalTo(Map.of("name", "Alice", "age", 33L)));
    }

    @Test
    void shouldReduceToPropertiesValue() {
        var properties = alice().propertiesValue();

        assertThat(properties.type(), equalTo(ValueType.MAP));
        assertThat(properties.asMap(), equalTo(Map.of("name", "Alice", "age", 33L)));
    }

    @Test
    void shouldWrapAsNodeValue() {
        var value = alice().asValue();

        assertThat(value.type(), equalTo(ValueType.NODE));
        assertThat(value.asNode(), equalTo(alice()));
    }

    @Test
    void shouldCompareNodesById() {
        assertThat(alice(), equalTo(new InternalNode(12345678)));
    }
}
