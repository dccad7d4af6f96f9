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

public class IntegerValue extends ValueAdapter {
    private final long val;

    public IntegerValue(long val) {
        this.val = val;
    }

    @Override
    public ValueType type() {
        return ValueType.INTEGER;
    }

    @Override
    public Long asObject() {
        return val;
    }

    @Override
    public long asLong() {
        return val;
    }

    @Override
    public int asInt() {
        if (val > Integer.MAX_VALUE || val < Integer.MIN_VALUE) {
            throw new Uncoercible(type().name() + " " + val, "Java int");
        }
        return (int) val;
    }

    @Override
    public double asDouble() {
        return (double) val;
    }

    @Override
    public String toString() {
        return Long.toString(val);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        var values = (IntegerValue) o;
        return val == values.val;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(val);
    }
}
