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

import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * A server-side transaction that spans several requests. It stays open until it is committed, rolled back, fails or expires on the
 * server.
 * <p>
 * Only one request of a transaction may be in flight at a time: a call made while another is outstanding fails with
 * {@link io.graphhttp.driver.exceptions.ErrorKind#CLIENT_REQUEST}. So does any call on a transaction that is no longer
 * {@link State#OPEN}, without a network round trip. A request failing with a database error leaves the transaction {@link State#FAILED};
 * the server has rolled it back. Any other failure, such as a timeout or a lost connection, leaves it {@link State#OPEN} and it should be
 * rolled back.
 *
 * @since 1.0
 */
public interface Transaction {
    /**
     * The life cycle of a transaction.
     */
    enum State {
        OPEN,
        COMMITTED,
        ROLLED_BACK,
        FAILED
    }

    /**
     * @return the id the server assigned to this transaction
     */
    String id();

    /**
     * @return the current state
     */
    State state();

    /**
     * @return {@code true} while the transaction accepts requests
     */
    default boolean isOpen() {
        return state() == State.OPEN;
    }

    /**
     * The time the server will roll back the transaction unless it is used or kept alive.
     *
     * @return the expiry, if the server reported one
     */
    Optional<ZonedDateTime> expires();

    /**
     * Execute a statement in this transaction.
     *
     * @param query the query
     * @return a stage of the results, a list with exactly one {@link QueryResult}
     */
    CompletionStage<Outcome<List<QueryResult>>> execute(Query query);

    /**
     * Execute statements in order in this transaction.
     *
     * @param queries the queries
     * @return a stage of the results, one per query in the same order
     */
    CompletionStage<Outcome<List<QueryResult>>> execute(List<Query> queries);

    /**
     * Reset the expiry of this transaction.
     *
     * @return a stage completed when the server confirmed
     */
    CompletionStage<Outcome<Void>> keepAlive();

    /**
     * Commit this transaction.
     *
     * @return a stage completed when the server confirmed
     */
    CompletionStage<Outcome<Void>> commit();

    /**
     * Roll back this transaction. Rolling back a failed transaction succeeds without a request, the server already rolled it back.
     *
     * @return a stage completed when the server confirmed
     */
    CompletionStage<Outcome<Void>> rollback();
}
