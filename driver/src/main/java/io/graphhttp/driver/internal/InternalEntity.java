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

import static io.graphhttp.driver.Values.ofObject;

import io.graphhttp.driver.Value;
import io.graphhttp.driver.Values;
import io.graphhttp.driver.internal.util.Extract;
import io.graphhttp.driver.internal.value.MapValue;
import io.graphhttp.driver.types.Entity;
import java.util.Collections;
import java.util.Map;
import java.util.function.Function;

public abstract class InternalEntity implements Entity, AsValue {
    private final long id;
    private final Map<String, Value> properties;

    public InternalEntity(long id, Map<String, Value> properties) {
        this.id = id;
        this.properties = Collections.unmodifiableMap(properties);
    }

    @Override
    public long id() {
        return id;
    }

    @Override
    public int size() {
        return properties.size();
    }

    @Override
    public Map<String, Object> asMap() {
        return asMap(ofObject());
    }

    @Override
    public <T> Map<String, T> asMap(Function<Value, T> mapFunction) {
        return Extract.map(properties, mapFunction);
    }

    /**
     * The properties of this entity without the identity metadata.
     *
     * @return the properties as a map value
     */
    public Value propertiesValue() {
        return new MapValue(properties);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        var that = (InternalEntity) o;
        return id == that.id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "Entity{" + "id=" + id + ", properties=" + properties + '}';
    }

    @Override
    public boolean containsKey(String key) {
        return properties.containsKey(key);
    }

    @Override
    public Iterable<String> keys() {
        return properties.keySet();
    }

    @Override
    public Value get(String key) {
        var value = properties.get(key);
        return value == null ? Values.NULL : value;
    }

    @Override
    public Iterable<Value> values() {
        return properties.values();
    }
}
