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
package io.graphhttp.driver.internal.value;

import static io.graphhttp.driver.Values.ofObject;
import static java.util.Collections.emptyList;

import io.graphhttp.driver.Value;
import io.graphhttp.driver.exceptions.value.NotMultiValued;
import io.graphhttp.driver.exceptions.value.Uncoercible;
import io.graphhttp.driver.internal.AsValue;
import io.graphhttp.driver.types.Entity;
import io.graphhttp.driver.types.Node;
import io.graphhttp.driver.types.Path;
import io.graphhttp.driver.types.Relationship;
import io.graphhttp.driver.types.ValueType;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

public abstract class ValueAdapter implements Value, AsValue {
    @Override
    public Value asValue() {
        return this;
    }

    @Override
    public boolean hasType(ValueType type) {
        return type() == type;
    }

    @Override
    public boolean isTrue() {
        return false;
    }

    @Override
    public boolean isFalse() {
        return false;
    }

    @Override
    public boolean isNull() {
        return false;
    }

    @Override
    public boolean containsKey(String key) {
        throw new NotMultiValued(type().name() + " is not a keyed collection");
    }

    @Override
    public String asString() {
        throw new Uncoercible(type().name(), "Java String");
    }

    @Override
    public long asLong() {
        throw new Uncoercible(type().name(), "Java long");
    }

    @Override
    public int asInt() {
        throw new Uncoercible(type().name(), "Java int");
    }

    @Override
    public double asDouble() {
        throw new Uncoercible(type().name(), "Java double");
    }

    @Override
    public boolean asBoolean() {
        throw new Uncoercible(type().name(), "Java boolean");
    }

    @Override
    public List<Object> asList() {
        return asList(ofObject());
    }

    @Override
    public <T> List<T> asList(Function<Value, T> mapFunction) {
        throw new Uncoercible(type().name(), "Java List");
    }

    @Override
    public Map<String, Object> asMap() {
        return asMap(ofObject());
    }

    @Override
    public <T> Map<String, T> asMap(Function<Value, T> mapFunction) {
        throw new Uncoercible(type().name(), "Java Map");
    }

    @Override
    public Entity asEntity() {
        throw new Uncoercible(type().name(), "Entity");
    }

    @Override
    public Node asNode() {
        throw new Uncoercible(type().name(), "Node");
    }

    @Override
    public Path asPath() {
        throw new Uncoercible(type().name(), "Path");
    }

    @Override
    public Relationship asRelationship() {
        throw new Uncoercible(type().name(), "Relationship");
    }

    @Override
    public Value get(int index) {
        throw new NotMultiValued(type().name() + " is not an indexed collection");
    }

    @Override
    public Value get(String key) {
        throw new NotMultiValued(type().name() + " is not a keyed collection");
    }

    @Override
    public int size() {
        throw new NotMultiValued(type().name() + " is not a collection");
    }

    @Override
    public boolean isEmpty() {
        return size() == 0;
    }

    @Override
    public Iterable<String> keys() {
        return emptyList();
    }

    @Override
    public Iterable<Value> values() {
        throw new NotMultiValued(type().name() + " is not iterable");
    }

    @Override
    public abstract boolean equals(Object obj);

    @Override
    public abstract int hashCode();

    @Override
    public abstract String toString();
}
