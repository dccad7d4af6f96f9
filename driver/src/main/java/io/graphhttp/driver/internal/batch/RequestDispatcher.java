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

import static io.graphhttp.driver.internal.util.Futures.futureCompletingConsumer;

import io.graphhttp.driver.Logger;
import io.graphhttp.driver.Logging;
import io.graphhttp.driver.Outcome;
import io.graphhttp.driver.internal.classify.ErrorClassifier;
import io.graphhttp.driver.net.HttpRequest;
import io.graphhttp.driver.net.HttpResponse;
import io.graphhttp.driver.net.Transport;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;

/**
 * Hands requests to the {@link Transport} and enforces the request deadline. The returned stage never completes exceptionally and
 * completes once: a response arriving after the deadline is dropped.
 */
public class RequestDispatcher {
    private final Transport transport;
    private final ErrorClassifier classifier;
    private final long requestTimeoutMillis;
    private final String target;
    private final Logger log;

    public RequestDispatcher(
            Transport transport, ErrorClassifier classifier, long requestTimeoutMillis, String target, Logging logging) {
        this.transport = transport;
        this.classifier = classifier;
        this.requestTimeoutMillis = requestTimeoutMillis;
        this.target = target;
        this.log = logging.getLog(getClass());
    }

    /**
     * Send a request.
     *
     * @param request the request
     * @return a stage of the response, or of the classified transport failure
     */
    public CompletionStage<Outcome<HttpResponse>> send(HttpRequest request) {
        CompletableFuture<HttpResponse> sent;
        try {
            sent = transport.send(request).toCompletableFuture();
        } catch (RuntimeException e) {
            sent = CompletableFuture.failedFuture(e);
        }

        var result = new CompletableFuture<HttpResponse>();
        sent.whenComplete(futureCompletingConsumer(result));
        if (requestTimeoutMillis > 0) {
            result.orTimeout(requestTimeoutMillis, TimeUnit.MILLISECONDS);
        }

        var inFlight = sent;
        return result.handle((response, error) -> {
            if (error == null) {
                return Outcome.success(response);
            }
            if (!inFlight.isDone()) {
                log.debug("Abandoning %s %s, no response within %d ms", request.method(), request.path(), requestTimeoutMillis);
                inFlight.cancel(false);
            }
            return Outcome.failure(classifier.classifyFailure(error, target));
        });
    }

    public String target() {
        return target;
    }
}
