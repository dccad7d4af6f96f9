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

import static io.graphhttp.driver.Values.parameters;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class QueryTest {
    @Test
    void shouldDefaultToNoParametersAndFullHydration() {
        var query = new Query("MATCH (n) RETURN n");

        assertTrue(query.parameters().isEmpty());
        assertFalse(query.isLean());
    }

    @Test
    void shouldTreatNullParametersAsEmpty() {
        assertTrue(new Query("RETURN 1", null).parameters().isEmpty());
    }

    @Test
    void shouldCopyParameters() {
        // Given
        var parameters = new HashMap<String, Object>();
        parameters.put("name", "Alice");
        var query = new Query("RETURN $name", parameters);

        // When
        parameters.put("name", "Bob");

        // Then
        assertThat(query.parameters().get("name"), equalTo("Alice"));
        assertThrows(UnsupportedOperationException.class, () -> query.parameters().put("x", 1));
    }

    @Test
    void shouldUpdateParameters() {
        // Given
        var query = new Query("RETURN $a, $b", parameters("a", 1, "b", 2));

        // When
        var updated = query.withUpdatedParameters(Map.of("b", 3));

        // Then
        assertThat(updated.parameters(), equalTo(Map.of("a", 1, "b", 3)));
        assertThat(query.parameters(), equalTo(Map.of("a", 1, "b", 2)));
    }

    @Test
    void shouldDeriveQueries() {
        var query = new Query("RETURN 1");

        assertThat(query.withText("RETURN 2").text(), equalTo("RETURN 2"));
        assertTrue(query.withLean(true).isLean());
        assertThat(query.withLean(true), not(equalTo(query)));
        assertThat(query.withParameters(Map.of("x", 1)).parameters(), equalTo(Map.of("x", 1)));
    }

    @Test
    void shouldCompareByContent() {
        assertThat(new Query("RETURN $x", Map.of("x", 1)), equalTo(new Query("RETURN $x", Map.of("x", 1))));
        assertThat(
                new Query("RETURN $x", Map.of("x", 1)).hashCode(),
                equalTo(new Query("RETURN $x", Map.of("x", 1)).hashCode()));
    }
}
