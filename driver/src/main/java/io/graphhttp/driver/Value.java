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
package io.graphhttp.driver;

import io.graphhttp.driver.exceptions.value.NotMultiValued;
import io.graphhttp.driver.exceptions.value.Uncoercible;
import io.graphhttp.driver.types.Entity;
import io.graphhttp.driver.types.MapAccessor;
import io.graphhttp.driver.types.Node;
import io.graphhttp.driver.types.Path;
import io.graphhttp.driver.types.Relationship;
import io.graphhttp.driver.types.ValueType;
import io.graphhttp.driver.util.Immutable;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * A unit of data returned by a query, hydrated from the response. Every value is tagged with exactly one {@link ValueType}: a scalar, a list, a
 * map, or one of the graph types {@link Node}, {@link Relationship} and {@link Path}.
 * <h2>Coercion</h2>
 * Values can be converted to Java types using the {@code asX} methods. A method that does not apply to the value's type throws
 * {@link Uncoercible}.
 * <h2>Collection access</h2>
 * Lists are accessed by index with {@link #get(int)}, maps, nodes and relationships by key with {@link #get(String)}. Collection methods on
 * other types throw {@link NotMultiValued}.
 *
 * @since 1.0
 */
@Immutable
public interface Value extends MapAccessor {
    /**
     * @return the type of this value
     */
    ValueType type();

    /**
     * Test if this value has the given type
     *
     * @param type the given type
     * @return type.equals(type())
     */
    boolean hasType(ValueType type);

    /**
     * @return {@code true} if the value is a Boolean value and has the value True.
     */
    boolean isTrue();

    /**
     * @return {@code true} if the value is a Boolean value and has the value False.
     */
    boolean isFalse();

    /**
     * @return {@code true} if the value is a Null, otherwise {@code false}
     */
    boolean isNull();

    /**
     * If this value represents a list or map, test if the collection is empty.
     *
     * @return {@code true} if size() is 0, otherwise {@code false}
     */
    boolean isEmpty();

    /**
     * Retrieve the value at the given index
     *
     * @param index the index of the value
     * @return the value or a {@link Values#NULL} if the index is out of bounds
     * @throws NotMultiValued if the value is not a list
     */
    Value get(int index);

    /**
     * This returns a java standard library representation of the underlying value, using a java type that is "sensible" given the underlying
     * type. Lists become {@link List}, maps become {@link Map}, integers become {@link Long}, floats become {@link Double}; graph types are
     * returned as {@link Node}, {@link Relationship} and {@link Path}.
     *
     * @return the value as a Java Object
     */
    Object asObject();

    /**
     * @return the value as a Java boolean, if possible.
     * @throws Uncoercible if value types are incompatible.
     */
    boolean asBoolean();

    /**
     * @return the value as a Java String, if possible.
     * @throws Uncoercible if value types are incompatible.
     */
    String asString();

    /**
     * @return the value as a Java long, if possible.
     * @throws Uncoercible if value types are incompatible.
     */
    long asLong();

    /**
     * @return the value as a Java int, if it fits.
     * @throws Uncoercible if value types are incompatible or the value does not fit.
     */
    int asInt();

    /**
     * @return the value as a Java double, if possible.
     * @throws Uncoercible if value types are incompatible.
     */
    double asDouble();

    /**
     * If the underlying type can be viewed as a list, returns a java list of values, where each value has been converted using
     * {@link #asObject()}.
     *
     * @return the value as a Java list of values, if possible
     * @throws Uncoercible if value types are incompatible.
     */
    List<Object> asList();

    /**
     * @param mapFunction a function to map from Value to T.
     * @param <T> the type of target list elements
     * @return the value as a list of T obtained by mapping from the list elements, if possible
     * @throws Uncoercible if value types are incompatible.
     */
    <T> List<T> asList(Function<Value, T> mapFunction);

    /**
     * @return the value as a {@link Entity}, if possible.
     * @throws Uncoercible if value types are incompatible.
     */
    Entity asEntity();

    /**
     * @return the value as a {@link Node}, if possible.
     * @throws Uncoercible if value types are incompatible.
     */
    Node asNode();

    /**
     * @return the value as a {@link Relationship}, if possible.
     * @throws Uncoercible if value types are incompatible.
     */
    Relationship asRelationship();

    /**
     * @return the value as a {@link Path}, if possible.
     * @throws Uncoercible if value types are incompatible.
     */
    Path asPath();
}
