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

import static io.graphhttp.driver.testutil.TestUtil.await;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.graphhttp.driver.exceptions.ErrorKind;
import io.graphhttp.driver.testutil.StubTransport;
import java.net.URI;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class GraphDatabaseTest {
    @ParameterizedTest
    @ValueSource(strings = {"bolt://localhost:7687", "neo4j://localhost", "ftp://localhost", "localhost:7474"})
    void shouldRejectUnsupportedScheme(String uri) {
        assertThrows(IllegalArgumentException.class, () -> GraphDatabase.client(uri, AuthTokens.none()));
    }

    @Test
    void shouldRejectUriWithQuery() {
        var error = assertThrows(
                IllegalArgumentException.class,
                () -> GraphDatabase.client("http://localhost:7474/?db=neo4j", AuthTokens.none()));

        assertThat(error.getMessage(), containsString("query"));
    }

    @Test
    void shouldRejectNullUri() {
        assertThrows(NullPointerException.class, () -> GraphDatabase.client((String) null, AuthTokens.none()));
    }

    @Test
    void shouldCreateAndCloseClientWithDefaultTransport() {
        // Given
        var client = GraphDatabase.client("http://localhost:7474", AuthTokens.basic("neo4j", "secret"));

        // When
        client.close();

        // Then
        var outcome = await(client.execute(new Query("RETURN 1")));
        assertThat(outcome.error().kind(), equalTo(ErrorKind.CLIENT_REQUEST));
    }

    @Test
    void shouldSendThroughGivenTransport() {
        // Given
        var transport = new StubTransport()
                .respondJson(200, "{\"results\":[{\"columns\":[\"n\"],\"data\":[]}],\"errors\":[]}");
        var client = GraphDatabase.client(
                URI.create("https://graph.example.com:7473/api"),
                AuthTokens.bearer("token"),
                Config.builder().withDatabase("movies").build(),
                transport);

        // When
        var outcome = await(client.execute(new Query("MATCH (n) RETURN n")));
        client.close();

        // Then
        assertTrue(outcome.isSuccess());
        assertThat(transport.lastRequest().path(), equalTo("/api/db/movies/tx/commit"));
        assertThat(transport.closeCount(), equalTo(0));
    }

    @Test
    void shouldRejectAuthTokenNotCreatedByAuthTokens() {
        // Given
        var token = new AuthToken() {};

        // When
        var error = assertThrows(
                IllegalArgumentException.class,
                () -> GraphDatabase.client(
                        URI.create("http://localhost:7474"), token, Config.defaultConfig(), new StubTransport()));

        // Then
        assertThat(error.getMessage(), containsString("AuthTokens"));
    }
}
