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
package io.graphhttp.driver.internal.util;

import static java.util.Collections.emptyList;
import static java.util.Collections.emptyMap;
import static java.util.Collections.singletonList;
import static java.util.Collections.singletonMap;
import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;

import io.graphhttp.driver.Value;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Utility class for extracting data.
 */
public final class Extract {
    private Extract() {
        throw new UnsupportedOperationException();
    }

    public static <T> List<T> list(Value[] values, Function<Value, T> mapFunction) {
        var size = values.length;
        switch (size) {
            case 0 -> {
                return emptyList();
            }
            case 1 -> {
                return singletonList(mapFunction.apply(values[0]));
            }
            default -> {
                List<T> list = new ArrayList<>(size);
                for (var value : values) {
                    list.add(mapFunction.apply(value));
                }
                return unmodifiableList(list);
            }
        }
    }

    public static <T> Map<String, T> map(Map<String, Value> data, Function<Value, T> mapFunction) {
        if (data.isEmpty()) {
            return emptyMap();
        } else {
            var size = data.size();
            if (size == 1) {
                var head = data.entrySet().iterator().next();
                return singletonMap(head.getKey(), mapFunction.apply(head.getValue()));
            } else {
                Map<String, T> map = new LinkedHashMap<>(size);
                for (var entry : data.entrySet()) {
                    map.put(entry.getKey(), mapFunction.apply(entry.getValue()));
                }
                return unmodifiableMap(map);
            }
        }
    }

    public static <T> Map<String, T> map(List<String> keys, Value[] values, Function<Value, T> mapFunction) {
        var size = keys.size();
        if (size == 0) {
            return emptyMap();
        }
        Map<String, T> map = new LinkedHashMap<>(size);
        for (var i = 0; i < size; i++) {
            map.put(keys.get(i), mapFunction.apply(values[i]));
        }
        return unmodifiableMap(map);
    }
}
