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

import io.graphhttp.driver.types.MapAccessor;
import io.graphhttp.driver.util.Immutable;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Container for query result values, one row of a {@link QueryResult}. Values are keyed by the return aliases of the query, in the order the
 * query returned them. A record is always a mapping, possibly empty.
 *
 * @since 1.0
 */
@Immutable
public interface Record extends MapAccessor {
    /**
     * Retrieve the keys of the underlying map
     *
     * @return all field keys in order
     */
    @Override
    List<String> keys();

    /**
     * Retrieve the values of the underlying map
     *
     * @return all field values in order
     */
    @Override
    List<Value> values();

    /**
     * Retrieve the index of the field with the given key
     *
     * @param key the give key
     * @return the index of the field as used by {@link #get(int)}
     * @throws NoSuchElementException if the given key is not from {@link #keys()}
     */
    int index(String key);

    /**
     * Retrieve the value at the given field index
     *
     * @param index the index of the value
     * @return the value or a {@link Values#NULL} if the index is out of bounds
     */
    Value get(int index);
}
