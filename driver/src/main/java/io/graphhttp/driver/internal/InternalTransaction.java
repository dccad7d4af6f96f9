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

import static io.graphhttp.driver.internal.request.QueryRequestBuilder.DELETE;
import static io.graphhttp.driver.internal.request.QueryRequestBuilder.POST;
import static java.lang.String.format;
import static java.util.concurrent.CompletableFuture.completedFuture;

import com.fasterxml.jackson.databind.JsonNode;
import io.graphhttp.driver.Logger;
import io.graphhttp.driver.Logging;
import io.graphhttp.driver.Outcome;
import io.graphhttp.driver.Query;
import io.graphhttp.driver.QueryResult;
import io.graphhttp.driver.Transaction;
import io.graphhttp.driver.exceptions.ClientRequestException;
import io.graphhttp.driver.exceptions.GraphException;
import io.graphhttp.driver.exceptions.ProtocolException;
import io.graphhttp.driver.internal.batch.BatchExecutor;
import io.graphhttp.driver.internal.batch.StatementResponse;
import io.graphhttp.driver.internal.request.PreparedRequest;
import io.graphhttp.driver.internal.request.QueryRequestBuilder;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class InternalTransaction implements Transaction {
    private static final Pattern COMMIT_URI = Pattern.compile("/tx/([^/]+)/commit/?$");
    private static final Pattern LOCATION_URI = Pattern.compile("/tx/([^/]+)/?$");
    private static final String LOCATION = "Location";
    private static final String COMMIT = "commit";
    private static final String TRANSACTION = "transaction";
    private static final String EXPIRES = "expires";

    private final String id;
    private final BatchExecutor executor;
    private final QueryRequestBuilder requestBuilder;
    private final Map<String, String> headers;
    private final Logger log;
    private final AtomicReference<State> state = new AtomicReference<>(State.OPEN);
    private final AtomicBoolean busy = new AtomicBoolean();
    private volatile ZonedDateTime expires;

    InternalTransaction(
            String id,
            BatchExecutor executor,
            QueryRequestBuilder requestBuilder,
            Map<String, String> headers,
            Logging logging) {
        this.id = id;
        this.executor = executor;
        this.requestBuilder = requestBuilder;
        this.headers = headers;
        this.log = logging.getLog(getClass());
    }

    /**
     * Create a transaction from the response to the request that opened it.
     *
     * @param response the response
     * @param executor executes the requests of the transaction
     * @param requestBuilder builds the requests of the transaction
     * @param headers the per-call headers sent with every request
     * @param logging the logging
     * @return the transaction, or a protocol failure when the response does not identify one
     */
    static Outcome<Transaction> open(
            StatementResponse response,
            BatchExecutor executor,
            QueryRequestBuilder requestBuilder,
            Map<String, String> headers,
            Logging logging) {
        var id = transactionId(response);
        if (id.isEmpty()) {
            return Outcome.failure(new ProtocolException("Response does not identify the opened transaction"));
        }
        var transaction = new InternalTransaction(id.get(), executor, requestBuilder, headers, logging);
        transaction.updateExpiry(response.body());
        transaction.log.debug("Opened transaction %s", id.get());
        return Outcome.success(transaction);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public State state() {
        return state.get();
    }

    @Override
    public Optional<ZonedDateTime> expires() {
        return Optional.ofNullable(expires);
    }

    @Override
    public CompletionStage<Outcome<List<QueryResult>>> execute(Query query) {
        var path = requestBuilder.transactionPath(id);
        return run(
                "execute",
                () -> requestBuilder.buildSingle(path, query, headers),
                false,
                State.OPEN,
                StatementResponse::results);
    }

    @Override
    public CompletionStage<Outcome<List<QueryResult>>> execute(List<Query> queries) {
        var path = requestBuilder.transactionPath(id);
        return run(
                "execute",
                () -> requestBuilder.buildBatch(path, queries, headers),
                true,
                State.OPEN,
                StatementResponse::results);
    }

    @Override
    public CompletionStage<Outcome<Void>> keepAlive() {
        var path = requestBuilder.transactionPath(id);
        return run("keep alive", () -> requestBuilder.buildEmpty(POST, path, headers), false, State.OPEN, ignored -> null);
    }

    @Override
    public CompletionStage<Outcome<Void>> commit() {
        var path = requestBuilder.transactionCommitPath(id);
        return run("commit", () -> requestBuilder.buildEmpty(POST, path, headers), false, State.COMMITTED, ignored -> null);
    }

    @Override
    public CompletionStage<Outcome<Void>> rollback() {
        if (state.get() == State.FAILED) {
            return completedFuture(Outcome.success(null));
        }
        var path = requestBuilder.transactionPath(id);
        return run(
                "roll back", () -> requestBuilder.buildEmpty(DELETE, path, headers), false, State.ROLLED_BACK, ignored -> null);
    }

    private <T> CompletionStage<Outcome<T>> run(
            String action,
            Supplier<Outcome<PreparedRequest>> prepare,
            boolean trackIndex,
            State successState,
            Function<StatementResponse, T> mapper) {
        if (!busy.compareAndSet(false, true)) {
            return completedFuture(Outcome.failure(new ClientRequestException(
                    format("Cannot %s transaction %s, it is busy with another request", action, id))));
        }
        var current = state.get();
        if (current != State.OPEN) {
            busy.set(false);
            return completedFuture(Outcome.failure(
                    new ClientRequestException(format("Cannot %s transaction %s, it is %s", action, id, current))));
        }
        var prepared = prepare.get();
        if (prepared.isFailure()) {
            busy.set(false);
            return completedFuture(Outcome.failure(prepared.error()));
        }
        return executor.submit(prepared.value(), trackIndex).thenApply(outcome -> {
            if (outcome.isSuccess()) {
                updateExpiry(outcome.value().body());
                if (successState != State.OPEN) {
                    state.set(successState);
                    log.debug("Transaction %s is %s", id, successState);
                }
            } else if (discardedByServer(outcome.error())) {
                state.set(State.FAILED);
                log.debug("Transaction %s failed: %s", id, outcome.error().getMessage());
            } else {
                log.debug(
                        "Transaction %s is still open after %s failure: %s",
                        id,
                        outcome.error().kind(),
                        outcome.error().getMessage());
            }
            busy.set(false);
            return outcome.map(mapper);
        });
    }

    /**
     * The server rolls a transaction back when one of its requests fails with a database error. Without a database code the outcome on the
     * server is unknown, for example after a timeout or a lost connection, and the transaction has to be rolled back explicitly.
     */
    private static boolean discardedByServer(GraphException error) {
        return !GraphException.UNKNOWN_CODE.equals(error.code());
    }

    private void updateExpiry(JsonNode body) {
        var expiresNode = body.path(TRANSACTION).path(EXPIRES);
        if (!expiresNode.isTextual()) {
            return;
        }
        try {
            expires = ZonedDateTime.parse(expiresNode.asText(), DateTimeFormatter.RFC_1123_DATE_TIME);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable expiry of transaction %s: %s", id, expiresNode.asText());
        }
    }

    private static Optional<String> transactionId(StatementResponse response) {
        var commitNode = response.body().path(COMMIT);
        if (commitNode.isTextual()) {
            var matcher = COMMIT_URI.matcher(commitNode.asText());
            if (matcher.find()) {
                return Optional.of(matcher.group(1));
            }
        }
        return response.response()
                .header(LOCATION)
                .map(LOCATION_URI::matcher)
                .filter(Matcher::find)
                .map(matcher -> matcher.group(1));
    }

    @Override
    public String toString() {
        return "Transaction{id=" + id + ", state=" + state.get() + "}";
    }
}
