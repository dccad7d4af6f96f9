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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.graphhttp.driver.exceptions.ClientRequestException;
import io.graphhttp.driver.exceptions.GraphException;
import org.junit.jupiter.api.Test;

class OutcomeTest {
    private static final GraphException ERROR = new ClientRequestException("invalid");

    @Test
    void shouldHoldValue() {
        var outcome = Outcome.success(42);

        assertTrue(outcome.isSuccess());
        assertFalse(outcome.isFailure());
        assertThat(outcome.value(), equalTo(42));
        assertThat(outcome.orElseThrow(), equalTo(42));
        assertThrows(IllegalStateException.class, outcome::error);
    }

    @Test
    void shouldHoldError() {
        Outcome<Integer> outcome = Outcome.failure(ERROR);

        assertTrue(outcome.isFailure());
        assertThat(outcome.error(), sameInstance(ERROR));
        assertThrows(IllegalStateException.class, outcome::value);
        assertThat(assertThrows(GraphException.class, outcome::orElseThrow), sameInstance(ERROR));
    }

    @Test
    void shouldRejectMissingError() {
        assertThrows(NullPointerException.class, () -> Outcome.failure(null));
    }

    @Test
    void shouldMapOnlySuccess() {
        assertThat(Outcome.success(2).map(i -> i * 21).value(), equalTo(42));
        assertThat(Outcome.<Integer>failure(ERROR).map(i -> i * 21).error(), sameInstance(ERROR));
    }

    @Test
    void shouldChainOutcomes() {
        var chained = Outcome.success("1").flatMap(text -> Outcome.<Integer>failure(ERROR));

        assertThat(chained.error(), sameInstance(ERROR));
        assertThat(Outcome.success("7").flatMap(text -> Outcome.success(Integer.parseInt(text))).value(), equalTo(7));
    }

    @Test
    void shouldFold() {
        assertThat(Outcome.success(1).fold(value -> "value", error -> "error"), equalTo("value"));
        assertThat(Outcome.failure(ERROR).fold(value -> "value", GraphException::getMessage), equalTo("invalid"));
    }
}
