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

import io.graphhttp.driver.util.Immutable;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * The ordered rows produced by one statement. A result is always a sequence, even when the statement returned zero or one row.
 *
 * @since 1.0
 */
@Immutable
public interface QueryResult extends Iterable<Record> {
    /**
     * Retrieve the column names, which are the keys of every record.
     *
     * @return the column names in order
     */
    List<String> columns();

    /**
     * Retrieve all records in the order the server returned them.
     *
     * @return the records, never {@code null}
     */
    List<Record> records();

    /**
     * @return the number of records
     */
    int size();

    /**
     * @return {@code true} if the statement returned no rows
     */
    boolean isEmpty();

    /**
     * Return the only record of this result.
     *
     * @return the record
     * @throws NoSuchElementException if the result does not contain exactly one record
     */
    Record single();
}
