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

import static io.graphhttp.driver.internal.request.QueryRequestBuilder.POST;
import static io.graphhttp.driver.internal.util.Futures.completedWithNull;
import static java.util.concurrent.CompletableFuture.completedFuture;

import io.graphhttp.driver.Config;
import io.graphhttp.driver.CustomRequest;
import io.graphhttp.driver.GraphClient;
import io.graphhttp.driver.Logger;
import io.graphhttp.driver.Outcome;
import io.graphhttp.driver.Query;
import io.graphhttp.driver.QueryResult;
import io.graphhttp.driver.RawResponse;
import io.graphhttp.driver.RequestOptions;
import io.graphhttp.driver.Transaction;
import io.graphhttp.driver.exceptions.ClientRequestException;
import io.graphhttp.driver.internal.batch.BatchExecutor;
import io.graphhttp.driver.internal.batch.RequestDispatcher;
import io.graphhttp.driver.internal.batch.StatementResponse;
import io.graphhttp.driver.internal.classify.ErrorClassifier;
import io.graphhttp.driver.internal.request.QueryRequestBuilder;
import io.graphhttp.driver.internal.util.Futures;
import io.graphhttp.driver.net.Transport;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;

public class InternalGraphClient implements GraphClient {
    private final Config config;
    private final HttpServerAddress address;
    private final Transport transport;
    private final boolean ownsTransport;
    private final QueryRequestBuilder requestBuilder;
    private final RequestDispatcher dispatcher;
    private final ErrorClassifier classifier;
    private final BatchExecutor executor;
    private final Logger log;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    InternalGraphClient(
            Config config,
            HttpServerAddress address,
            Transport transport,
            boolean ownsTransport,
            QueryRequestBuilder requestBuilder,
            RequestDispatcher dispatcher,
            ErrorClassifier classifier,
            BatchExecutor executor) {
        this.config = config;
        this.address = address;
        this.transport = transport;
        this.ownsTransport = ownsTransport;
        this.requestBuilder = requestBuilder;
        this.dispatcher = dispatcher;
        this.classifier = classifier;
        this.executor = executor;
        this.log = config.logging().getLog(getClass());
    }

    @Override
    public CompletionStage<Outcome<List<QueryResult>>> execute(Query query) {
        return execute(query, RequestOptions.defaults());
    }

    @Override
    public CompletionStage<Outcome<List<QueryResult>>> execute(Query query, RequestOptions options) {
        if (closed.get()) {
            return closedFailure();
        }
        return executor.executeSingle(requestBuilder.commitPath(), query, headers(options))
                .thenApply(outcome -> outcome.map(StatementResponse::results));
    }

    @Override
    public CompletionStage<Outcome<List<QueryResult>>> execute(List<Query> queries) {
        return execute(queries, RequestOptions.defaults());
    }

    @Override
    public CompletionStage<Outcome<List<QueryResult>>> execute(List<Query> queries, RequestOptions options) {
        if (closed.get()) {
            return closedFailure();
        }
        return executor.executeBatch(requestBuilder.commitPath(), queries, headers(options))
                .thenApply(outcome -> outcome.map(StatementResponse::results));
    }

    @Override
    public CompletionStage<Outcome<Object>> executeCustom(CustomRequest request) {
        if (closed.get()) {
            return closedFailure();
        }
        return requestBuilder
                .buildCustom(request, address.basePath())
                .fold(
                        httpRequest -> {
                            log.debug("Sending custom request %s %s", httpRequest.method(), httpRequest.path());
                            return dispatcher
                                    .send(httpRequest)
                                    .thenApply(sent -> sent.flatMap(classifier::classifyCustomResponse));
                        },
                        error -> completedFuture(Outcome.failure(error)));
    }

    @Override
    public CompletionStage<Outcome<RawResponse>> executeRaw(CustomRequest request) {
        if (closed.get()) {
            return closedFailure();
        }
        return requestBuilder
                .buildCustom(request, address.basePath())
                .fold(
                        httpRequest -> {
                            log.debug("Sending raw request %s %s", httpRequest.method(), httpRequest.path());
                            return dispatcher.send(httpRequest).thenApply(sent -> sent.map(response -> new RawResponse(
                                    response.status(), response.headers(), classifier.rawBody(response))));
                        },
                        error -> completedFuture(Outcome.failure(error)));
    }

    @Override
    public CompletionStage<Outcome<Transaction>> beginTransaction() {
        return beginTransaction(RequestOptions.defaults());
    }

    @Override
    public CompletionStage<Outcome<Transaction>> beginTransaction(RequestOptions options) {
        if (closed.get()) {
            return closedFailure();
        }
        var headers = headers(options);
        return requestBuilder
                .buildEmpty(POST, requestBuilder.beginPath(), headers)
                .fold(
                        prepared -> executor.submit(prepared, false)
                                .thenApply(outcome -> outcome.flatMap(response -> InternalTransaction.open(
                                        response, executor, requestBuilder, headers, config.logging()))),
                        error -> completedFuture(Outcome.failure(error)));
    }

    @Override
    public Config config() {
        return config;
    }

    @Override
    public CompletionStage<Void> closeAsync() {
        if (closed.compareAndSet(false, true)) {
            log.info("Closing client instance %s for %s", hashCode(), address);
            return ownsTransport ? transport.closeAsync() : completedWithNull();
        }
        return completedWithNull();
    }

    @Override
    public void close() {
        Futures.blockingGet(closeAsync());
    }

    public boolean isClosed() {
        return closed.get();
    }

    private static Map<String, String> headers(RequestOptions options) {
        return options == null ? Map.of() : options.headers();
    }

    private static <T> CompletionStage<Outcome<T>> closedFailure() {
        return completedFuture(Outcome.failure(new ClientRequestException("This client instance has already been closed")));
    }
}
