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

import io.graphhttp.driver.exceptions.value.ValueException;
import io.graphhttp.driver.internal.AsValue;
import io.graphhttp.driver.internal.value.BooleanValue;
import io.graphhttp.driver.internal.value.FloatValue;
import io.graphhttp.driver.internal.value.IntegerValue;
import io.graphhttp.driver.internal.value.ListValue;
import io.graphhttp.driver.internal.value.MapValue;
import io.graphhttp.driver.internal.value.NullValue;
import io.graphhttp.driver.internal.value.StringValue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Utility for wrapping regular Java types and exposing them as {@link Value} objects, and functions to convert values back into Java types.
 *
 * @since 1.0
 */
public final class Values {
    /**
     * The value that represents a null.
     */
    public static final Value NULL = NullValue.NULL;

    private Values() {
        throw new UnsupportedOperationException();
    }

    /**
     * Returns a value from object.
     *
     * @param value the object value
     * @return the array of values
     * @throws ValueException if the object cannot be represented as a value
     */
    @SuppressWarnings("unchecked")
    public static Value value(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof Value graphValue) {
            return graphValue;
        }
        if (value instanceof AsValue asValue) {
            return asValue.asValue();
        }
        if (value instanceof Boolean bool) {
            return value((boolean) bool);
        }
        if (value instanceof String string) {
            return value(string);
        }
        if (value instanceof Character character) {
            return value(String.valueOf((char) character));
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return value(((Number) value).longValue());
        }
        if (value instanceof Double || value instanceof Float) {
            return value(((Number) value).doubleValue());
        }
        if (value instanceof Map<?, ?> map) {
            return value((Map<String, Object>) map);
        }
        if (value instanceof Iterable<?> iterable) {
            return value((Iterable<Object>) iterable);
        }
        if (value instanceof Iterator<?> iterator) {
            return value((Iterator<Object>) iterator);
        }
        if (value instanceof long[] longs) {
            return new ListValue(Arrays.stream(longs).mapToObj(Values::value).toArray(Value[]::new));
        }
        if (value instanceof int[] ints) {
            return new ListValue(Arrays.stream(ints).mapToObj(Values::value).toArray(Value[]::new));
        }
        if (value instanceof double[] doubles) {
            return new ListValue(Arrays.stream(doubles).mapToObj(Values::value).toArray(Value[]::new));
        }
        if (value instanceof boolean[] booleans) {
            var values = new Value[booleans.length];
            for (var i = 0; i < booleans.length; i++) {
                values[i] = value(booleans[i]);
            }
            return new ListValue(values);
        }
        if (value instanceof Object[] objects) {
            return value(Arrays.asList(objects));
        }

        throw new ValueException("Unable to convert " + value.getClass().getName() + " to a graph value.");
    }

    public static Value value(List<Object> vals) {
        return new ListValue(vals.stream().map(Values::value).toArray(Value[]::new));
    }

    /**
     * Returns a value from an iterable of objects.
     *
     * @param val the iterable of objects
     * @return the value
     */
    public static Value value(Iterable<Object> val) {
        return value(val.iterator());
    }

    /**
     * Returns a value from an iterator of objects.
     *
     * @param val the iterator of objects
     * @return the value
     */
    public static Value value(Iterator<Object> val) {
        List<Value> values = new ArrayList<>();
        while (val.hasNext()) {
            values.add(value(val.next()));
        }
        return new ListValue(values.toArray(new Value[0]));
    }

    /**
     * Returns a value from string.
     *
     * @param val the string value
     * @return the value
     */
    public static Value value(final String val) {
        return new StringValue(val);
    }

    /**
     * Returns a value from long.
     *
     * @param val the long value
     * @return the value
     */
    public static Value value(final long val) {
        return new IntegerValue(val);
    }

    /**
     * Returns a value from int.
     *
     * @param val the int value
     * @return the value
     */
    public static Value value(final int val) {
        return new IntegerValue(val);
    }

    /**
     * Returns a value from double.
     *
     * @param val the double value
     * @return the value
     */
    public static Value value(final double val) {
        return new FloatValue(val);
    }

    /**
     * Returns a value from boolean.
     *
     * @param val the boolean value
     * @return the value
     */
    public static Value value(final boolean val) {
        return BooleanValue.fromBoolean(val);
    }

    /**
     * Returns a value from string to object map. Insertion order of the given map is preserved.
     *
     * @param val the string to object map
     * @return the value
     */
    public static Value value(final Map<String, Object> val) {
        Map<String, Value> asValues = new LinkedHashMap<>(val.size());
        for (var entry : val.entrySet()) {
            asValues.put(entry.getKey(), value(entry.getValue()));
        }
        return new MapValue(asValues);
    }

    /**
     * Helper function for creating a map of parameters, this can be used when you {@link Query#withParameters(Map) pass parameters} to a query.
     * <p>
     * Allowed parameter types are:
     * <ul>
     * <li>{@link Integer}, {@link Long}, {@link Short}, {@link Byte}</li>
     * <li>{@link Double}, {@link Float}</li>
     * <li>{@link Boolean}</li>
     * <li>{@link String}, {@link Character}</li>
     * <li>{@link Map} with String keys and values of any type in this list</li>
     * <li>{@link Iterable} and arrays with values of any type in this list</li>
     * <li>{@link Value} and hydrated entities, which are sent as their property maps</li>
     * </ul>
     *
     * @param keysAndValues alternating sequence of keys and values
     * @return Map containing all parameters specified
     * @throws IllegalArgumentException if the number of arguments is odd or a key is not a string
     */
    public static Map<String, Object> parameters(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Parameters function requires an even number of arguments, "
                    + "alternating key and value. Arguments were: "
                    + Arrays.toString(keysAndValues) + ".");
        }
        Map<String, Object> map = new LinkedHashMap<>(keysAndValues.length / 2);
        for (var i = 0; i < keysAndValues.length; i += 2) {
            var key = keysAndValues[i];
            if (!(key instanceof String)) {
                throw new IllegalArgumentException("Parameter keys must be strings, but got: " + key);
            }
            map.put((String) key, keysAndValues[i + 1]);
        }
        return map;
    }

    /**
     * The identity function for value conversion - returns the value untouched.
     *
     * @return a function that returns the value passed into it - the identity function
     */
    public static Function<Value, Value> ofValue() {
        return val -> val;
    }

    /**
     * Converts values using {@link Value#asObject()}.
     *
     * @return a function that returns {@link Value#asObject()} of a {@link Value}
     */
    public static Function<Value, Object> ofObject() {
        return Value::asObject;
    }

    /**
     * Converts values to {@link Long}.
     *
     * @return a function that returns {@link Value#asLong()} of a {@link Value}
     */
    public static Function<Value, Long> ofLong() {
        return Value::asLong;
    }
}
