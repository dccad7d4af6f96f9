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

import io.graphhttp.driver.exceptions.value.Uncoercible;
import io.graphhttp.driver.types.ValueType;

public class FloatValue extends ValueAdapter {
    private final double val;

    public FloatValue(double val) {
        this.val = val;
    }

    @Override
    public ValueType type() {
        return ValueType.FLOAT;
    }

    @Override
    public Double asObject() {
        return val;
    }

    @Override
    public double asDouble() {
        return val;
    }

    @Override
    public long asLong() {
        var longVal = (long) val;
        if ((double) longVal != val) {
            throw new Uncoercible(type().name() + " " + val, "Java long");
        }
        return longVal;
    }

    @Override
    public int asInt() {
        var intVal = (int) val;
        if ((double) intVal != val) {
            throw new Uncoercible(type().name() + " " + val, "Java int");
        }
        return intVal;
    }

    @Override
    public String toString() {
        return Double.toString(val);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        var values = (FloatValue) o;
        return Double.compare(values.val, val) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(val);
    }
}
