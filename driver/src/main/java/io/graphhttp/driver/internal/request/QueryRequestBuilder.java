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

import static java.lang.String.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.graphhttp.driver.CustomRequest;
import io.graphhttp.driver.Outcome;
import io.graphhttp.driver.Query;
import io.graphhttp.driver.Value;
import io.graphhttp.driver.Values;
import io.graphhttp.driver.exceptions.ProtocolException;
import io.graphhttp.driver.exceptions.value.ValueException;
import io.graphhttp.driver.internal.json.JsonCodec;
import io.graphhttp.driver.internal.json.StatementPayload;
import io.graphhttp.driver.net.HttpRequest;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns queries and custom requests into {@link HttpRequest}s. Nothing is sent when validation fails: the failure is returned as a
 * {@link io.graphhttp.driver.exceptions.ErrorKind#PROTOCOL} outcome.
 * <p>
 * Query parameters always travel in their own field next to the query text.
 */
public class QueryRequestBuilder {
    public static final String POST = "POST";
    public static final String DELETE = "DELETE";

    private final JsonCodec codec;
    private final HeaderComposer headerComposer;
    private final String databasePath;

    public QueryRequestBuilder(JsonCodec codec, HeaderComposer headerComposer, String basePath, String database) {
        this.codec = codec;
        this.headerComposer = headerComposer;
        this.databasePath = basePath + "/db/" + encode(database);
    }

    /**
     * Build a request carrying one statement.
     *
     * @param path the target path, see the {@code *Path} methods
     * @param query the query
     * @param callHeaders the per-call headers
     * @return the request or a protocol failure
     */
    public Outcome<PreparedRequest> buildSingle(String path, Query query, Map<String, String> callHeaders) {
        if (query == null) {
            return invalid("Query must not be null");
        }
        return buildBatch(path, Collections.singletonList(query), callHeaders);
    }

    /**
     * Build a request carrying the given statements in order.
     *
     * @param path the target path, see the {@code *Path} methods
     * @param queries the queries, at least one
     * @param callHeaders the per-call headers
     * @return the request or a protocol failure
     */
    public Outcome<PreparedRequest> buildBatch(String path, List<Query> queries, Map<String, String> callHeaders) {
        if (queries == null || queries.isEmpty()) {
            return invalid("Batch must contain at least one query");
        }
        var statements = new ArrayList<StatementPayload.Statement>(queries.size());
        var leanFlags = new ArrayList<Boolean>(queries.size());
        for (var i = 0; i < queries.size(); i++) {
            var query = queries.get(i);
            if (query == null) {
                return invalid(format("Query at index %d is null", i));
            }
            if (query.text() == null || query.text().isBlank()) {
                return invalid(format("Query at index %d has no text", i));
            }
            var parameters = new LinkedHashMap<String, Value>();
            for (var entry : query.parameters().entrySet()) {
                if (entry.getKey() == null) {
                    return invalid(format("Query at index %d has a parameter without name", i));
                }
                try {
                    parameters.put(entry.getKey(), Values.value(entry.getValue()));
                } catch (ValueException e) {
                    var message = format(
                            "Parameter '%s' of query at index %d cannot be sent: %s", entry.getKey(), i, e.getMessage());
                    return Outcome.failure(new ProtocolException(message, e));
                }
            }
            statements.add(new StatementPayload.Statement(query.text(), parameters));
            leanFlags.add(query.isLean());
        }
        return compose(callHeaders).flatMap(headers -> write(new StatementPayload(statements))
                .map(body -> new PreparedRequest(new HttpRequest(POST, path, headers, body), leanFlags)));
    }

    /**
     * Build a request without statements, used to open, keep alive or commit a transaction.
     *
     * @param method the method
     * @param path the target path
     * @param callHeaders the per-call headers
     * @return the request or a protocol failure
     */
    public Outcome<PreparedRequest> buildEmpty(String method, String path, Map<String, String> callHeaders) {
        return compose(callHeaders).flatMap(headers -> {
            if (DELETE.equals(method)) {
                return Outcome.success(new PreparedRequest(new HttpRequest(method, path, headers, null), List.of()));
            }
            return write(new StatementPayload(List.of()))
                    .map(body -> new PreparedRequest(new HttpRequest(method, path, headers, body), List.of()));
        });
    }

    /**
     * Build a request to an arbitrary endpoint.
     *
     * @param customRequest the request
     * @param basePath the base path of the endpoint
     * @return the request or a protocol failure
     */
    public Outcome<HttpRequest> buildCustom(CustomRequest customRequest, String basePath) {
        if (customRequest == null) {
            return invalid("Custom request must not be null");
        }
        Outcome<byte[]> body;
        if (customRequest.body() == null) {
            body = Outcome.success(null);
        } else if (customRequest.body() instanceof byte[] bytes) {
            body = Outcome.success(bytes);
        } else {
            body = write(customRequest.body());
        }
        return compose(customRequest.headers()).flatMap(headers -> body.map(bytes -> new HttpRequest(
                customRequest.method(), basePath + customRequest.path(), headers, bytes)));
    }

    public String commitPath() {
        return databasePath + "/tx/commit";
    }

    public String beginPath() {
        return databasePath + "/tx";
    }

    public String transactionPath(String transactionId) {
        return databasePath + "/tx/" + encode(transactionId);
    }

    public String transactionCommitPath(String transactionId) {
        return transactionPath(transactionId) + "/commit";
    }

    private Outcome<Map<String, String>> compose(Map<String, String> callHeaders) {
        for (var entry : callHeaders.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                return invalid("Header name must not be empty");
            }
            if (entry.getValue() == null) {
                return invalid(format("Header '%s' has no value", entry.getKey()));
            }
        }
        return Outcome.success(headerComposer.compose(callHeaders));
    }

    private Outcome<byte[]> write(Object payload) {
        try {
            return Outcome.success(codec.write(payload));
        } catch (JsonProcessingException e) {
            return Outcome.failure(new ProtocolException("Request body cannot be serialized: " + e.getOriginalMessage(), e));
        }
    }

    private static <T> Outcome<T> invalid(String message) {
        return Outcome.failure(new ProtocolException(message));
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
