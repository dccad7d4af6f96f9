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

import io.graphhttp.driver.Value;
import io.graphhttp.driver.Values;
import java.util.Map;
import java.util.function.Function;

/**
 * Access the keys, properties and values of an underlying unordered map by key
 *
 * @since 1.0
 */
public interface MapAccessor {
    /**
     * Retrieve the keys of the underlying map
     *
     * @return all map keys in unspecified order
     */
    Iterable<String> keys();

    /**
     * Check if the list of keys contains the given key
     *
     * @param key the key
     * @return {@code true} if this map keys contains the given key otherwise {@code false}
     */
    boolean containsKey(String key);

    /**
     * Retrieve the value of the property with the given key
     *
     * @param key the key of the property
     * @return the property's value or a {@link Values#NULL} if no such key exists
     */
    Value get(String key);

    /**
     * Retrieve the number of entries in this map
     *
     * @return the number of entries in this map
     */
    int size();

    /**
     * Retrieve all values of the underlying collection
     *
     * @return all values in unspecified order
     */
    Iterable<Value> values();

    /**
     * Return the underlying map as a map of string keys and values converted using
     * {@link Value#asObject()}.
     *
     * @return the value as a Java map
     */
    Map<String, Object> asMap();

    /**
     * Return the underlying map with every value converted by the given function.
     *
     * @param mapFunction a function to map from Value to T.
     * @param <T> the type of map values
     * @return the value as a map from string keys to values of type T obtained from mapping he original map values, if possible
     */
    <T> Map<String, T> asMap(Function<Value, T> mapFunction);
}
