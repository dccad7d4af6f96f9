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

import static io.graphhttp.driver.testutil.TestUtil.await;
import static io.graphhttp.driver.testutil.TestUtil.json;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.graphhttp.driver.AuthTokens;
import io.graphhttp.driver.Config;
import io.graphhttp.driver.GraphClient;
import io.graphhttp.driver.GraphDatabase;
import io.graphhttp.driver.Query;
import io.graphhttp.driver.Transaction;
import io.graphhttp.driver.exceptions.ErrorKind;
import io.graphhttp.driver.net.HttpResponse;
import io.graphhttp.driver.testutil.StubTransport;
import java.net.ConnectException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InternalTransactionTest {
    private static final String BEGIN = "{\"commit\":\"http://localhost:7474/db/neo4j/tx/9/commit\",\"results\":[],"
            + "\"transaction\":{\"expires\":\"Thu, 15 Mar 2018 16:55:43 GMT\"},\"errors\":[]}";
    private static final String EMPTY = "{\"results\":[],\"errors\":[]}";
    private static final String ONE_ROW = "{\"results\":[{\"columns\":[\"n\"],\"data\":[{\"row\":[1]}]}],"
            + "\"transaction\":{\"expires\":\"Thu, 15 Mar 2018 16:56:43 GMT\"},\"errors\":[]}";

    private final StubTransport transport = new StubTransport();
    private GraphClient client;

    @BeforeEach
    void setUp() {
        client = GraphDatabase.client(
                URI.create("http://localhost:7474"), AuthTokens.none(), Config.defaultConfig(), transport);
    }

    @Test
    void shouldBeginTransaction() {
        // Given
        transport.respondJson(201, BEGIN);

        // When
        var transaction = begin();

        // Then
        assertThat(transaction.id(), equalTo("9"));
        assertThat(transaction.state(), equalTo(Transaction.State.OPEN));
        assertThat(
                transaction.expires().orElseThrow(),
                equalTo(ZonedDateTime.of(2018, 3, 15, 16, 55, 43, 0, ZoneOffset.UTC)));
        var request = transport.lastRequest();
        assertThat(request.method(), equalTo("POST"));
        assertThat(request.path(), equalTo("/db/neo4j/tx"));
    }

    @Test
    void shouldTakeIdFromLocationHeader() {
        // Given
        transport.respond(new HttpResponse(
                201,
                Map.of("Content-Type", "application/json", "Location", "http://localhost:7474/db/neo4j/tx/31"),
                EMPTY.getBytes(StandardCharsets.UTF_8)));

        // When
        var transaction = begin();

        // Then
        assertThat(transaction.id(), equalTo("31"));
        assertTrue(transaction.expires().isEmpty());
    }

    @Test
    void shouldFailToBeginWithoutTransactionId() {
        transport.respondJson(201, EMPTY);

        var outcome = await(client.beginTransaction());

        assertThat(outcome.error().kind(), equalTo(ErrorKind.PROTOCOL));
    }

    @Test
    void shouldExecuteAndCommit() {
        // Given
        transport.respondJson(201, BEGIN).respondJson(200, ONE_ROW).respondJson(200, EMPTY);
        var transaction = begin();

        // When
        var results = await(transaction.execute(new Query("RETURN 1 AS n"))).value();
        var commit = await(transaction.commit());

        // Then
        assertThat(results.get(0).single().get("n").asLong(), equalTo(1L));
        assertTrue(commit.isSuccess());
        assertThat(transaction.state(), equalTo(Transaction.State.COMMITTED));
        assertThat(
                transaction.expires().orElseThrow(),
                equalTo(ZonedDateTime.of(2018, 3, 15, 16, 56, 43, 0, ZoneOffset.UTC)));

        var requests = transport.requests();
        assertThat(requests.get(1).path(), equalTo("/db/neo4j/tx/9"));
        assertThat(requests.get(2).path(), equalTo("/db/neo4j/tx/9/commit"));
        assertThat(json(requests.get(2).body()), equalTo(json("{\"statements\":[]}")));
    }

    @Test
    void shouldExecuteBatchInTransaction() {
        // Given
        transport.respondJson(201, BEGIN)
                .respondJson(
                        200,
                        "{\"results\":[{\"columns\":[\"a\"],\"data\":[]},{\"columns\":[\"b\"],\"data\":[{\"row\":[2]}]}],"
                                + "\"errors\":[]}");
        var transaction = begin();

        // When
        var results = await(transaction.execute(List.of(new Query("CREATE (:A)"), new Query("RETURN 2 AS b"))))
                .value();

        // Then
        assertThat(results.size(), equalTo(2));
        assertTrue(transaction.isOpen());
    }

    @Test
    void shouldRollBack() {
        // Given
        transport.respondJson(201, BEGIN).respondJson(200, EMPTY);
        var transaction = begin();

        // When
        var outcome = await(transaction.rollback());

        // Then
        assertTrue(outcome.isSuccess());
        assertThat(transaction.state(), equalTo(Transaction.State.ROLLED_BACK));
        var request = transport.lastRequest();
        assertThat(request.method(), equalTo("DELETE"));
        assertThat(request.path(), equalTo("/db/neo4j/tx/9"));
        assertThat(request.bodyLength(), equalTo(0));
    }

    @Test
    void shouldKeepAlive() {
        transport.respondJson(201, BEGIN).respondJson(200, ONE_ROW.replace("[{\"columns\":[\"n\"],\"data\":[{\"row\":[1]}]}]", "[]"));
        var transaction = begin();

        var outcome = await(transaction.keepAlive());

        assertTrue(outcome.isSuccess());
        assertTrue(transaction.isOpen());
        assertThat(transaction.expires().orElseThrow().getMinute(), equalTo(56));
    }

    @Test
    void shouldFailTransactionOnDatabaseError() {
        // Given
        transport.respondJson(201, BEGIN)
                .respondJson(
                        200,
                        "{\"results\":[],\"errors\":[{\"code\":\"Neo.ClientError.Statement.SyntaxError\","
                                + "\"message\":\"Invalid input\"}]}");
        var transaction = begin();

        // When
        var outcome = await(transaction.execute(new Query("RETRN 1")));

        // Then
        assertThat(outcome.error().kind(), equalTo(ErrorKind.CLIENT_REQUEST));
        assertThat(transaction.state(), equalTo(Transaction.State.FAILED));
        assertTrue(await(transaction.rollback()).isSuccess());
        assertThat(transport.requests().size(), equalTo(2));
    }

    @Test
    void shouldRollBackOnServerAfterConnectionFailure() {
        // Given
        transport.respondJson(201, BEGIN).fail(new ConnectException("Connection refused")).respondJson(200, EMPTY);
        var transaction = begin();

        // When
        var outcome = await(transaction.execute(new Query("RETURN 1 AS n")));
        var rollback = await(transaction.rollback());

        // Then
        assertThat(outcome.error().kind(), equalTo(ErrorKind.TRANSPORT));
        assertTrue(rollback.isSuccess());
        assertThat(transport.requests().size(), equalTo(3));
        var request = transport.lastRequest();
        assertThat(request.method(), equalTo("DELETE"));
        assertThat(request.path(), equalTo("/db/neo4j/tx/9"));
        assertThat(transaction.state(), equalTo(Transaction.State.ROLLED_BACK));
    }

    @Test
    void shouldStayOpenWhenFailureHasNoDatabaseCode() {
        // Given
        transport.respondJson(201, BEGIN).respond(HttpResponse.of(503, "text/plain", "Service Unavailable"));
        var transaction = begin();

        // When
        var outcome = await(transaction.execute(new Query("RETURN 1 AS n")));

        // Then
        assertThat(outcome.error().kind(), equalTo(ErrorKind.SERVER_INTERNAL));
        assertThat(transaction.state(), equalTo(Transaction.State.OPEN));
    }

    @Test
    void shouldNotChangeStateOnInvalidQuery() {
        transport.respondJson(201, BEGIN);
        var transaction = begin();

        var outcome = await(transaction.execute(new Query("")));

        assertThat(outcome.error().kind(), equalTo(ErrorKind.PROTOCOL));
        assertTrue(transaction.isOpen());
    }

    @Test
    void shouldRejectUseAfterCommit() {
        // Given
        transport.respondJson(201, BEGIN).respondJson(200, EMPTY);
        var transaction = begin();
        await(transaction.commit());

        // When
        var outcome = await(transaction.execute(new Query("RETURN 1")));

        // Then
        assertThat(outcome.error().kind(), equalTo(ErrorKind.CLIENT_REQUEST));
        assertThat(outcome.error().getMessage(), containsString("it is COMMITTED"));
        assertThat(await(transaction.rollback()).error().kind(), equalTo(ErrorKind.CLIENT_REQUEST));
    }

    @Test
    void shouldRejectConcurrentRequest() {
        // Given
        var pending = new CompletableFuture<HttpResponse>();
        transport.respondJson(201, BEGIN).respondWith(pending);
        var transaction = begin();
        var first = transaction.execute(new Query("RETURN 1 AS n")).toCompletableFuture();

        // When
        var second = await(transaction.commit());

        // Then
        assertThat(second.error().kind(), equalTo(ErrorKind.CLIENT_REQUEST));
        assertThat(second.error().getMessage(), containsString("busy"));
        assertFalse(first.isDone());

        pending.complete(HttpResponse.of(200, "application/json", ONE_ROW));
        assertTrue(await(first).isSuccess());
        assertTrue(transaction.isOpen());
    }

    private Transaction begin() {
        return await(client.beginTransaction()).value();
    }
}
