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
package io.graphhttp.driver.internal.request;

import static io.graphhttp.driver.testutil.TestUtil.json;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.graphhttp.driver.CustomRequest;
import io.graphhttp.driver.Query;
import io.graphhttp.driver.Values;
import io.graphhttp.driver.exceptions.ErrorKind;
import io.graphhttp.driver.internal.InternalNode;
import io.graphhttp.driver.internal.json.JsonCodec;
import io.graphhttp.driver.internal.security.InternalAuthToken;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class QueryRequestBuilderTest {
    private final QueryRequestBuilder builder = new QueryRequestBuilder(
            new JsonCodec(),
            new HeaderComposer("graphhttp-java/test", InternalAuthToken.NONE, Map.of()),
            "",
            "neo4j");

    @Test
    void shouldKeepParametersApartFromQueryText() {
        // Given
        var query = new Query("MATCH (u:User {name: $name}) RETURN u", Map.of("name", "Robert'); DROP"));

        // When
        var prepared = builder.buildSingle(builder.commitPath(), query, Map.of()).value();

        // Then
        var body = json(prepared.request().body());
        var statement = body.get("statements").get(0);
        assertThat(statement.get("statement").asText(), equalTo("MATCH (u:User {name: $name}) RETURN u"));
        assertThat(statement.get("parameters").get("name").asText(), equalTo("Robert'); DROP"));
        assertThat(statement.get("resultDataContents"), equalTo(json("[\"row\"]")));
    }

    @Test
    void shouldBuildSingleStatementRequest() {
        // When
        var prepared = builder.buildSingle(builder.commitPath(), new Query("RETURN 1"), Map.of()).value();

        // Then
        var request = prepared.request();
        assertThat(request.method(), equalTo("POST"));
        assertThat(request.path(), equalTo("/db/neo4j/tx/commit"));
        assertThat(prepared.statementCount(), equalTo(1));
        assertThat(json(request.body()), equalTo(json("{\"statements\":[{\"statement\":\"RETURN 1\",\"resultDataContents\":[\"row\"]}]}")));
    }

    @Test
    void shouldKeepStatementOrderAndLeanFlags() {
        // Given
        var queries = List.of(new Query("CREATE (n)"), new Query("MATCH (n) RETURN n", null, true), new Query("RETURN 3"));

        // When
        var prepared = builder.buildBatch(builder.commitPath(), queries, Map.of()).value();

        // Then
        var statements = json(prepared.request().body()).get("statements");
        assertThat(statements.size(), equalTo(3));
        assertThat(statements.get(0).get("statement").asText(), equalTo("CREATE (n)"));
        assertThat(statements.get(2).get("statement").asText(), equalTo("RETURN 3"));
        assertThat(prepared.leanFlags(), contains(false, true, false));
    }

    @Test
    void shouldSerializeStructuredParameters() {
        // Given
        var parameters = new HashMap<String, Object>();
        parameters.put("list", List.of(1, 2.5, "three"));
        parameters.put("nested", Map.of("flag", true));
        parameters.put("missing", null);
        parameters.put("node", new InternalNode(1, List.of("User"), Map.of("name", Values.value("Alice"))));

        // When
        var prepared = builder.buildSingle(builder.commitPath(), new Query("RETURN $list", parameters), Map.of())
                .value();

        // Then
        var sent = json(prepared.request().body()).get("statements").get(0).get("parameters");
        assertThat(sent.get("list"), equalTo(json("[1, 2.5, \"three\"]")));
        assertThat(sent.get("nested"), equalTo(json("{\"flag\": true}")));
        assertTrue(sent.get("missing").isNull());
        assertThat(sent.get("node"), equalTo(json("{\"name\": \"Alice\"}")));
    }

    @Test
    void shouldRejectEmptyBatch() {
        var outcome = builder.buildBatch(builder.commitPath(), List.of(), Map.of());

        assertThat(outcome.error().kind(), equalTo(ErrorKind.PROTOCOL));
        assertThat(outcome.error().getMessage(), equalTo("Batch must contain at least one query"));
    }

    @Test
    void shouldRejectNullQueryInBatch() {
        var outcome = builder.buildBatch(builder.commitPath(), Arrays.asList(new Query("RETURN 1"), null), Map.of());

        assertThat(outcome.error().getMessage(), equalTo("Query at index 1 is null"));
    }

    @Test
    void shouldRejectBlankQueryText() {
        var outcome = builder.buildSingle(builder.commitPath(), new Query("  "), Map.of());

        assertThat(outcome.error().kind(), equalTo(ErrorKind.PROTOCOL));
        assertThat(outcome.error().getMessage(), equalTo("Query at index 0 has no text"));
    }

    @Test
    void shouldRejectParameterWithoutName() {
        var parameters = new HashMap<String, Object>();
        parameters.put(null, 1);

        var outcome = builder.buildSingle(builder.commitPath(), new Query("RETURN 1", parameters), Map.of());

        assertThat(outcome.error().getMessage(), equalTo("Query at index 0 has a parameter without name"));
    }

    @Test
    void shouldRejectUnsupportedParameterValue() {
        var outcome = builder.buildSingle(
                builder.commitPath(), new Query("RETURN $p", Map.of("p", new Object())), Map.of());

        assertThat(outcome.error().kind(), equalTo(ErrorKind.PROTOCOL));
        assertThat(outcome.error().getMessage(), containsString("Parameter 'p' of query at index 0 cannot be sent"));
    }

    @Test
    void shouldBuildTransactionPaths() {
        assertThat(builder.beginPath(), equalTo("/db/neo4j/tx"));
        assertThat(builder.transactionPath("17"), equalTo("/db/neo4j/tx/17"));
        assertThat(builder.transactionCommitPath("17"), equalTo("/db/neo4j/tx/17/commit"));
    }

    @Test
    void shouldEncodeDatabaseNameAndPrefixBasePath() {
        var custom = new QueryRequestBuilder(
                new JsonCodec(),
                new HeaderComposer("graphhttp-java/test", InternalAuthToken.NONE, Map.of()),
                "/graph",
                "my db");

        assertThat(custom.commitPath(), equalTo("/graph/db/my%20db/tx/commit"));
    }

    @Test
    void shouldBuildEmptyRequests() {
        // When
        var keepAlive = builder.buildEmpty(QueryRequestBuilder.POST, builder.transactionPath("5"), Map.of()).value();
        var rollback = builder.buildEmpty(QueryRequestBuilder.DELETE, builder.transactionPath("5"), Map.of()).value();

        // Then
        assertThat(json(keepAlive.request().body()), equalTo(json("{\"statements\":[]}")));
        assertThat(keepAlive.statementCount(), equalTo(0));
        assertThat(rollback.request().method(), equalTo("DELETE"));
        assertThat(rollback.request().bodyLength(), equalTo(0));
    }

    @Test
    void shouldBuildCustomRequestWithJsonBody() {
        // When
        var request = builder.buildCustom(
                        CustomRequest.of("post", "/db/neo4j/query/v2").withBody(Map.of("statement", "RETURN 1")),
                        "/graph")
                .value();

        // Then
        assertThat(request.method(), equalTo("POST"));
        assertThat(request.path(), equalTo("/graph/db/neo4j/query/v2"));
        assertThat(json(request.body()), equalTo(json("{\"statement\":\"RETURN 1\"}")));
    }

    @Test
    void shouldSendCustomBytesUnchanged() {
        var bytes = "plain text".getBytes(StandardCharsets.UTF_8);

        var request = builder.buildCustom(CustomRequest.of("PUT", "/raw").withBody(bytes), "").value();

        assertArrayEquals(bytes, request.body());
    }

    @Test
    void shouldSendCustomRequestWithoutBody() {
        var request = builder.buildCustom(CustomRequest.of("GET", "/"), "").value();

        assertThat(request.bodyLength(), equalTo(0));
        assertFalse(request.headers().isEmpty());
    }

    @Test
    void shouldNotExposeCredentialsInRequestDescription() {
        var authorized = new QueryRequestBuilder(
                new JsonCodec(),
                new HeaderComposer("graphhttp-java/test", InternalAuthToken.basic("neo4j", "secret"), Map.of()),
                "",
                "neo4j");

        var request = authorized.buildSingle(authorized.commitPath(), new Query("RETURN 1"), Map.of()).value().request();

        assertThat(request.headers().get("authorization"), equalTo("Basic bmVvNGo6c2VjcmV0"));
        assertThat(request.toString(), not(containsString("bmVvNGo6c2VjcmV0")));
    }
}
