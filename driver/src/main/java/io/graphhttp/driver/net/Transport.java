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
package io.graphhttp.driver.net;

import java.util.concurrent.CompletionStage;

/**
 * Performs the network I/O for a {@link io.graphhttp.driver.GraphClient}. A transport is bound to one server endpoint and owns whatever
 * connections, TLS sessions and proxies it needs to reach it.
 * <p>
 * Implementations must be safe for concurrent use. The returned stage completes with the response for every status code, and completes
 * exceptionally only when no complete response was received, for example with a {@link java.net.ConnectException} or a
 * {@link java.util.concurrent.TimeoutException}.
 *
 * @since 1.0
 */
public interface Transport {
    /**
     * Send a request.
     *
     * @param request the request
     * @return a stage of the complete response
     */
    CompletionStage<HttpResponse> send(HttpRequest request);

    /**
     * Release the resources held by this transport. Requests in flight fail.
     *
     * @return a stage completed when all resources are released
     */
    CompletionStage<Void> closeAsync();
}
