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

import static java.lang.String.format;

import io.graphhttp.driver.util.Immutable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The components of a query: its text, the parameters bound to its named placeholders, and whether its result should be shaped in lean mode.
 * <p>
 * Parameters are always sent as a field separate from the query text. The query text is validated when the query is submitted, so a query
 * with missing text fails with a protocol error before any network call.
 * <p>
 * In lean mode nodes and relationships are returned as plain property maps, and paths as lists of alternating property maps.
 *
 * @see GraphClient
 * @since 1.0
 */
@Immutable
public final class Query {
    private final String text;
    private final Map<String, Object> parameters;
    private final boolean lean;

    /**
     * Create a new query.
     *
     * @param text the query text
     * @param parameters the parameter map, {@code null} means no parameters
     * @param lean whether records should contain bare property maps instead of graph entities
     */
    public Query(String text, Map<String, Object> parameters, boolean lean) {
        this.text = text;
        this.parameters = parameters == null || parameters.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.lean = lean;
    }

    /**
     * Create a new query.
     *
     * @param text the query text
     * @param parameters the parameter map
     */
    public Query(String text, Map<String, Object> parameters) {
        this(text, parameters, false);
    }

    /**
     * Create a new query without parameters.
     *
     * @param text the query text
     */
    public Query(String text) {
        this(text, Collections.emptyMap(), false);
    }

    /**
     * @return the query text
     */
    public String text() {
        return text;
    }

    /**
     * @return the parameters, never {@code null}
     */
    public Map<String, Object> parameters() {
        return parameters;
    }

    /**
     * @return {@code true} if the result should contain bare property maps
     */
    public boolean isLean() {
        return lean;
    }

    /**
     * @param newText the new query text
     * @return a new query with updated text
     */
    public Query withText(String newText) {
        return new Query(newText, parameters, lean);
    }

    /**
     * @param newParameters the new parameters
     * @return a new query with replaced parameters
     */
    public Query withParameters(Map<String, Object> newParameters) {
        return new Query(text, newParameters, lean);
    }

    /**
     * Create a new query with the given parameters merged over the current ones.
     *
     * @param updates the parameters to add or replace
     * @return a new query with updated parameters
     */
    public Query withUpdatedParameters(Map<String, Object> updates) {
        if (updates == null || updates.isEmpty()) {
            return this;
        }
        Map<String, Object> newParameters = new LinkedHashMap<>(parameters);
        newParameters.putAll(updates);
        return new Query(text, newParameters, lean);
    }

    /**
     * @param newLean the lean flag
     * @return a new query with the given lean flag
     */
    public Query withLean(boolean newLean) {
        return new Query(text, parameters, newLean);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        var query = (Query) o;
        return lean == query.lean && Objects.equals(text, query.text) && parameters.equals(query.parameters);
    }

    @Override
    public int hashCode() {
        var result = Objects.hashCode(text);
        result = 31 * result + parameters.hashCode();
        result = 31 * result + Boolean.hashCode(lean);
        return result;
    }

    @Override
    public String toString() {
        return format("Query{text='%s', parameters=%s, lean=%s}", text, parameters.keySet(), lean);
    }
}
