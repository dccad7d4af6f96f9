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
package io.graphhttp.driver.testutil;

import static java.util.concurrent.CompletableFuture.completedFuture;

import io.graphhttp.driver.net.HttpRequest;
import io.graphhttp.driver.net.HttpResponse;
import io.graphhttp.driver.net.Transport;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * Transport answering requests from a script. Every request is recorded.
 */
public class StubTransport implements Transport {
    private final Deque<Function<HttpRequest, CompletionStage<HttpResponse>>> script = new ArrayDeque<>();
    private final List<HttpRequest> requests = new ArrayList<>();
    private int closeCount;

    public synchronized StubTransport respond(HttpResponse response) {
        script.add(request -> completedFuture(response));
        return this;
    }

    public StubTransport respondJson(int status, String json) {
        return respond(HttpResponse.of(status, "application/json", json));
    }

    public synchronized StubTransport fail(Throwable error) {
        script.add(request -> CompletableFuture.failedFuture(error));
        return this;
    }

    public synchronized StubTransport respondWith(CompletableFuture<HttpResponse> future) {
        script.add(request -> future);
        return this;
    }

    @Override
    public synchronized CompletionStage<HttpResponse> send(HttpRequest request) {
        requests.add(request);
        var next = script.poll();
        if (next == null) {
            throw new AssertionError("Unexpected request " + request);
        }
        return next.apply(request);
    }

    @Override
    public synchronized CompletionStage<Void> closeAsync() {
        closeCount++;
        return completedFuture(null);
    }

    public synchronized List<HttpRequest> requests() {
        return new ArrayList<>(requests);
    }

    public synchronized HttpRequest lastRequest() {
        if (requests.isEmpty()) {
            throw new AssertionError("No request was sent");
        }
        return requests.get(requests.size() - 1);
    }

    public synchronized int closeCount() {
        return closeCount;
    }
}
