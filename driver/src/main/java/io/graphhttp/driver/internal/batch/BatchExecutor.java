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
package io.graphhttp.driver.internal.batch;

import static java.util.concurrent.CompletableFuture.completedFuture;

import io.graphhttp.driver.Logger;
import io.graphhttp.driver.Logging;
import io.graphhttp.driver.Outcome;
import io.graphhttp.driver.Query;
import io.graphhttp.driver.exceptions.ErrorKind;
import io.graphhttp.driver.exceptions.GraphException;
import io.graphhttp.driver.internal.classify.ErrorClassifier;
import io.graphhttp.driver.internal.hydration.EntityHydrator;
import io.graphhttp.driver.internal.request.PreparedRequest;
import io.graphhttp.driver.internal.request.QueryRequestBuilder;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionStage;

/**
 * Executes statements in one round trip. All statements of a request run in one server-side transaction: when any of them fails, the
 * whole request fails and no result is returned. On success there is exactly one result per statement, in submission order.
 * <p>
 * Nothing is retried.
 */
public class BatchExecutor {
    private final QueryRequestBuilder requestBuilder;
    private final RequestDispatcher dispatcher;
    private final ErrorClassifier classifier;
    private final EntityHydrator hydrator;
    private final Logger log;

    public BatchExecutor(
            QueryRequestBuilder requestBuilder,
            RequestDispatcher dispatcher,
            ErrorClassifier classifier,
            EntityHydrator hydrator,
            Logging logging) {
        this.requestBuilder = requestBuilder;
        this.dispatcher = dispatcher;
        this.classifier = classifier;
        this.hydrator = hydrator;
        this.log = logging.getLog(getClass());
    }

    /**
     * Execute a single statement. A failure carries no statement index.
     *
     * @param path the target path
     * @param query the query
     * @param headers the per-call headers
     * @return a stage of the response
     */
    public CompletionStage<Outcome<StatementResponse>> executeSingle(
            String path, Query query, Map<String, String> headers) {
        return requestBuilder
                .buildSingle(path, query, headers)
                .fold(prepared -> submit(prepared, false), this::rejected);
    }

    /**
     * Execute statements atomically. A failure carries the index of the failing statement when it can be derived.
     *
     * @param path the target path
     * @param queries the queries
     * @param headers the per-call headers
     * @return a stage of the response
     */
    public CompletionStage<Outcome<StatementResponse>> executeBatch(
            String path, List<Query> queries, Map<String, String> headers) {
        return requestBuilder
                .buildBatch(path, queries, headers)
                .fold(prepared -> submit(prepared, true), this::rejected);
    }

    /**
     * Send a prepared request and turn its response into results.
     *
     * @param prepared the request
     * @param trackIndex whether a failing statement index should be derived
     * @return a stage of the response
     */
    public CompletionStage<Outcome<StatementResponse>> submit(PreparedRequest prepared, boolean trackIndex) {
        var request = prepared.request();
        if (log.isDebugEnabled()) {
            log.debug(
                    "Sending %d statement(s) to %s %s", prepared.statementCount(), request.method(), request.path());
        }
        return dispatcher.send(request).thenApply(sent -> {
            var outcome = sent.flatMap(response -> classifier
                    .classifyStatementResponse(response, prepared.statementCount(), trackIndex)
                    .flatMap(body -> hydrator
                            .hydrateResults(body.get(ErrorClassifier.RESULTS), prepared.leanFlags())
                            .map(results -> new StatementResponse(response, body, results))));
            if (outcome.isFailure()) {
                logFailure(request.method(), request.path(), outcome.error());
            }
            return outcome;
        });
    }

    private CompletionStage<Outcome<StatementResponse>> rejected(GraphException error) {
        log.debug("Request rejected before sending: %s", error.getMessage());
        return completedFuture(Outcome.failure(error));
    }

    private void logFailure(String method, String path, GraphException error) {
        if (error.kind() == ErrorKind.PROTOCOL) {
            log.warn("%s %s on %s: %s", method, path, dispatcher.target(), error.getMessage());
        } else {
            log.debug("%s %s on %s failed with %s: %s", method, path, dispatcher.target(), error.kind(), error.getMessage());
        }
    }
}
