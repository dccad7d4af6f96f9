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

import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * Accessor for a graph database over its HTTP statement endpoint.
 * <p>
 * All operations are asynchronous: they return immediately and the returned stage completes when the response has been received and
 * processed. Stages returned by a client never complete exceptionally. Every failure is reported as a failed {@link Outcome}, carrying a
 * {@link io.graphhttp.driver.exceptions.GraphException} whose {@link io.graphhttp.driver.exceptions.GraphException#kind() kind} callers can
 * branch on.
 * <p>
 * Clients are thread-safe and hold no per-call state. Any number of calls may be in flight concurrently. Clients never retry a request,
 * as statements may have side effects.
 * <p>
 * Create clients with {@link GraphDatabase}.
 *
 * @since 1.0
 */
public interface GraphClient extends AutoCloseable {
    /**
     * Execute a single statement in its own transaction.
     *
     * @param query the query
     * @return a stage of the results, a list with exactly one {@link QueryResult}
     */
    CompletionStage<Outcome<List<QueryResult>>> execute(Query query);

    /**
     * Execute a single statement in its own transaction.
     *
     * @param query the query
     * @param options per-call options
     * @return a stage of the results, a list with exactly one {@link QueryResult}
     */
    CompletionStage<Outcome<List<QueryResult>>> execute(Query query, RequestOptions options);

    /**
     * Execute statements in order, in one transaction. Either all statements succeed, or the call fails and no result is returned.
     *
     * @param queries the queries, at least one
     * @return a stage of the results, one per query in the same order
     */
    CompletionStage<Outcome<List<QueryResult>>> execute(List<Query> queries);

    /**
     * Execute statements in order, in one transaction. Either all statements succeed, or the call fails and no result is returned.
     *
     * @param queries the queries, at least one
     * @param options per-call options
     * @return a stage of the results, one per query in the same order
     */
    CompletionStage<Outcome<List<QueryResult>>> execute(List<Query> queries, RequestOptions options);

    /**
     * Send a request to an endpoint other than the statement endpoint, such as a server plugin. Responses are classified like statement
     * responses.
     *
     * @param request the request
     * @return a stage of the body: maps, lists and scalars for JSON, the raw bytes otherwise, {@code null} when empty
     */
    CompletionStage<Outcome<Object>> executeCustom(CustomRequest request);

    /**
     * Send a request to an endpoint other than the statement endpoint and return the response whatever its status. Only failures to get a
     * response are reported as errors.
     *
     * @param request the request
     * @return a stage of the response
     */
    CompletionStage<Outcome<RawResponse>> executeRaw(CustomRequest request);

    /**
     * Open an explicit transaction spanning several requests.
     *
     * @return a stage of the transaction
     */
    CompletionStage<Outcome<Transaction>> beginTransaction();

    /**
     * Open an explicit transaction spanning several requests.
     *
     * @param options per-call options, applied to every request of the transaction
     * @return a stage of the transaction
     */
    CompletionStage<Outcome<Transaction>> beginTransaction(RequestOptions options);

    /**
     * @return the configuration of this client
     */
    Config config();

    /**
     * Close the client and release its transport, if the client created it. Calls made afterwards fail with
     * {@link io.graphhttp.driver.exceptions.ErrorKind#CLIENT_REQUEST}.
     *
     * @return a stage completed when all resources are released
     */
    CompletionStage<Void> closeAsync();

    /**
     * Close the client, waiting for its resources to be released.
     */
    @Override
    void close();
}
