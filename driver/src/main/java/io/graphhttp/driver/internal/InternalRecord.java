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
import static io.graphhttp.driver.Values.ofValue;
import static io.graphhttp.driver.internal.util.Format.formatPairs;
import static java.lang.String.format;

import io.graphhttp.driver.Record;
import io.graphhttp.driver.Value;
import io.graphhttp.driver.Values;
import io.graphhttp.driver.internal.util.Extract;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.Function;

public class InternalRecord implements Record {
    private final List<String> keys;
    private final Map<String, Integer> keyIndex;
    private final Value[] values;
    private int hashCode = 0;

    public InternalRecord(List<String> keys, Value[] values) {
        if (keys.size() != values.length) {
            throw new IllegalArgumentException(
                    format("Record has %d keys but %d values", keys.size(), values.length));
        }
        this.keys = List.copyOf(keys);
        this.values = values;
        this.keyIndex = new HashMap<>(keys.size() * 2);
        for (var i = 0; i < keys.size(); i++) {
            keyIndex.putIfAbsent(keys.get(i), i);
        }
    }

    @Override
    public List<String> keys() {
        return keys;
    }

    @Override
    public List<Value> values() {
        return Arrays.asList(values);
    }

    @Override
    public int index(String key) {
        var result = keyIndex.get(key);
        if (result == null) {
            throw new NoSuchElementException("Unknown key: " + key);
        }
        return result;
    }

    @Override
    public boolean containsKey(String key) {
        return keyIndex.containsKey(key);
    }

    @Override
    public Value get(String key) {
        var fieldIndex = keyIndex.get(key);
        return fieldIndex == null ? Values.NULL : values[fieldIndex];
    }

    @Override
    public Value get(int index) {
        return index >= 0 && index < values.length ? values[index] : Values.NULL;
    }

    @Override
    public int size() {
        return values.length;
    }

    @Override
    public Map<String, Object> asMap() {
        return Extract.map(keys, values, ofObject());
    }

    @Override
    public <T> Map<String, T> asMap(Function<Value, T> mapper) {
        return Extract.map(keys, values, mapper);
    }

    @Override
    public String toString() {
        return format("Record<%s>", formatPairs(asMap(ofValue())));
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Record otherRecord)) {
            return false;
        }
        return keys.equals(otherRecord.keys()) && values().equals(otherRecord.values());
    }

    @Override
    public int hashCode() {
        if (hashCode == 0) {
            hashCode = 31 * keys.hashCode() + Arrays.hashCode(values);
        }
        return hashCode;
    }
}
