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

import static java.lang.String.format;

import io.graphhttp.driver.QueryResult;
import io.graphhttp.driver.Record;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

public class InternalQueryResult implements QueryResult {
    private final List<String> columns;
    private final List<Record> records;

    public InternalQueryResult(List<String> columns, List<Record> records) {
        this.columns = List.copyOf(columns);
        this.records = List.copyOf(records);
    }

    @Override
    public List<String> columns() {
        return columns;
    }

    @Override
    public List<Record> records() {
        return records;
    }

    @Override
    public int size() {
        return records.size();
    }

    @Override
    public boolean isEmpty() {
        return records.isEmpty();
    }

    @Override
    public Record single() {
        if (records.size() != 1) {
            throw new NoSuchElementException(
                    format("Expected a result with a single record, but this result contains %d", records.size()));
        }
        return records.get(0);
    }

    @Override
    public Iterator<Record> iterator() {
        return records.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QueryResult other)) {
            return false;
        }
        return columns.equals(other.columns()) && records.equals(other.records());
    }

    @Override
    public int hashCode() {
        return 31 * columns.hashCode() + records.hashCode();
    }

    @Override
    public String toString() {
        return format("QueryResult{columns=%s, size=%d}", columns, records.size());
    }
}
