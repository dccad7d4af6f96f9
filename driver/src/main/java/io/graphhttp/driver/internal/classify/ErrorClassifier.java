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
package io.graphhttp.driver.internal.classify;

import static java.lang.String.format;

import com.fasterxml.jackson.databind.JsonNode;
import io.graphhttp.driver.Outcome;
import io.graphhttp.driver.exceptions.AuthenticationException;
import io.graphhttp.driver.exceptions.ClientRequestException;
import io.graphhttp.driver.exceptions.GraphException;
import io.graphhttp.driver.exceptions.ProtocolException;
import io.graphhttp.driver.exceptions.RequestTimeoutException;
import io.graphhttp.driver.exceptions.ServerInternalException;
import io.graphhttp.driver.exceptions.TransportException;
import io.graphhttp.driver.internal.json.JsonCodec;
import io.graphhttp.driver.internal.util.Format;
import io.graphhttp.driver.internal.util.Futures;
import io.graphhttp.driver.net.HttpResponse;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.timeout.ReadTimeoutException;
import java.io.IOException;
import java.nio.channels.UnresolvedAddressException;
import java.util.concurrent.TimeoutException;

/**
 * Decides the outcome of every call. Rules are evaluated in order and the first match wins:
 * <ol>
 *     <li>no response because of a network failure: {@link io.graphhttp.driver.exceptions.ErrorKind#TRANSPORT}</li>
 *     <li>no response in time: {@link io.graphhttp.driver.exceptions.ErrorKind#TIMEOUT}</li>
 *     <li>a database error in the body, by code: {@code Neo.ClientError.Security.*} is AUTHENTICATION, any other
 *     {@code Neo.ClientError.*} is CLIENT_REQUEST, everything else SERVER_INTERNAL. An error without a code is classified by the
 *     status as below, or SERVER_INTERNAL under a successful status</li>
 *     <li>an error status without database error: 401 and 403 are AUTHENTICATION, other 4xx CLIENT_REQUEST, 5xx SERVER_INTERNAL</li>
 *     <li>a body that does not have the expected structure: PROTOCOL</li>
 * </ol>
 * Failures keep a truncated excerpt of the response body. Request headers never make it into a failure.
 */
public class ErrorClassifier {
    public static final int MAX_EXCERPT_LENGTH = 512;

    static final String ERRORS = "errors";
    public static final String RESULTS = "results";
    static final String CODE = "code";
    static final String MESSAGE = "message";

    private static final String CLIENT_ERROR_PREFIX = "Neo.ClientError.";
    private static final String SECURITY_ERROR_PREFIX = "Neo.ClientError.Security.";

    private final JsonCodec codec;

    public ErrorClassifier(JsonCodec codec) {
        this.codec = codec;
    }

    /**
     * Classify a failure that prevented a complete response.
     *
     * @param error the failure of the transport, possibly wrapped
     * @param target the endpoint, used in messages
     * @return the classified failure
     */
    public GraphException classifyFailure(Throwable error, String target) {
        var cause = Futures.completionExceptionCause(error);
        if (cause instanceof GraphException graphException) {
            return graphException;
        }
        if (cause instanceof TimeoutException || cause instanceof ReadTimeoutException) {
            return new RequestTimeoutException(format("No response from %s in time", target), cause);
        }
        if (cause instanceof DecoderException) {
            return new ProtocolException(format("Malformed HTTP response from %s", target), cause);
        }
        if (cause instanceof IOException || cause instanceof UnresolvedAddressException) {
            return new TransportException(
                    format("Unable to communicate with %s: %s", target, describe(cause)), cause);
        }
        return new TransportException(format("Request to %s failed: %s", target, describe(cause)), cause);
    }

    /**
     * Classify the response to a statement request.
     *
     * @param response the response
     * @param statementCount the number of statements sent
     * @param trackIndex whether a failing statement index should be derived
     * @return the parsed body with exactly {@code statementCount} results, or the failure
     */
    public Outcome<JsonNode> classifyStatementResponse(HttpResponse response, int statementCount, boolean trackIndex) {
        var parsed = parse(response);
        var body = parsed.body;

        if (body != null) {
            var databaseError = firstError(body);
            if (databaseError != null) {
                Integer statementIndex = null;
                if (trackIndex && statementCount > 0) {
                    var results = body.get(RESULTS);
                    var completed = results != null && results.isArray() ? results.size() : 0;
                    statementIndex = Math.min(completed, statementCount - 1);
                }
                return Outcome.failure(databaseFailure(databaseError, statementIndex, response, parsed.text));
            }
        }

        if (!response.isSuccessful()) {
            return Outcome.failure(statusFailure(response, parsed.text));
        }
        if (body == null) {
            var message = parsed.error == null ? "Response body is empty" : "Response body is not JSON";
            return Outcome.failure(protocolFailure(message, response, parsed.text, parsed.error));
        }
        var results = body.get(RESULTS);
        if (!body.isObject() || results == null || !results.isArray()) {
            return Outcome.failure(protocolFailure("Response body has no results", response, parsed.text, null));
        }
        if (results.size() != statementCount) {
            return Outcome.failure(protocolFailure(
                    format("Expected %d results but received %d", statementCount, results.size()),
                    response,
                    parsed.text,
                    null));
        }
        return Outcome.success(body);
    }

    /**
     * Classify the response to a custom request.
     *
     * @param response the response
     * @return the parsed body as maps, lists and scalars, the raw bytes when the body is not JSON, {@code null} for an empty body, or the failure
     */
    public Outcome<Object> classifyCustomResponse(HttpResponse response) {
        var parsed = parse(response);
        if (parsed.body != null) {
            var databaseError = firstError(parsed.body);
            // plugin bodies may carry their own "errors" field, only database errors fail a successful response
            if (databaseError != null && (!response.isSuccessful() || hasCode(databaseError))) {
                return Outcome.failure(databaseFailure(databaseError, null, response, parsed.text));
            }
        }
        if (!response.isSuccessful()) {
            return Outcome.failure(statusFailure(response, parsed.text));
        }
        return Outcome.success(customBody(response, parsed.body));
    }

    /**
     * Convert a body without classification of its status.
     *
     * @param response the response
     * @return the parsed body as maps, lists and scalars, the raw bytes when the body is not JSON, or {@code null} for an empty body
     */
    public Object rawBody(HttpResponse response) {
        return customBody(response, parse(response).body);
    }

    private Object customBody(HttpResponse response, JsonNode body) {
        if (body != null) {
            return codec.toPlainObject(body);
        }
        var bytes = response.body();
        return bytes.length == 0 ? null : bytes;
    }

    private ParsedBody parse(HttpResponse response) {
        var bytes = response.body();
        if (bytes.length == 0) {
            return new ParsedBody(null, null, null);
        }
        var text = Format.excerpt(response.bodyAsString(), MAX_EXCERPT_LENGTH);
        try {
            return new ParsedBody(codec.read(bytes), text, null);
        } catch (IOException e) {
            return new ParsedBody(null, text, e);
        }
    }

    private static JsonNode firstError(JsonNode body) {
        var errors = body.get(ERRORS);
        if (errors == null || !errors.isArray() || errors.isEmpty()) {
            return null;
        }
        return errors.get(0);
    }

    private static boolean hasCode(JsonNode error) {
        return error.path(CODE).isTextual();
    }

    private static GraphException databaseFailure(
            JsonNode error, Integer statementIndex, HttpResponse response, String excerpt) {
        var message = error.path(MESSAGE).isTextual() ? error.get(MESSAGE).asText() : "Database reported an error";
        var status = response.status();
        if (!hasCode(error)) {
            if (response.isSuccessful()) {
                return new ServerInternalException(null, message, statementIndex, status, excerpt);
            }
            return statusFailure(response, message, statementIndex, excerpt);
        }
        var code = error.get(CODE).asText();
        if (code.startsWith(SECURITY_ERROR_PREFIX)) {
            return new AuthenticationException(code, message, status, excerpt);
        }
        if (code.startsWith(CLIENT_ERROR_PREFIX)) {
            return new ClientRequestException(code, message, statementIndex, status, excerpt);
        }
        return new ServerInternalException(code, message, statementIndex, status, excerpt);
    }

    private static GraphException statusFailure(HttpResponse response, String excerpt) {
        var status = response.status();
        var message = status >= 500 && status < 600
                ? format("Server failed with status %d", status)
                : format("Request was rejected with status %d", status);
        return statusFailure(response, message, null, excerpt);
    }

    private static GraphException statusFailure(
            HttpResponse response, String message, Integer statementIndex, String excerpt) {
        var status = response.status();
        if (status == 401 || status == 403) {
            return new AuthenticationException(null, message, status, excerpt);
        }
        if (status >= 400 && status < 500) {
            return new ClientRequestException(null, message, statementIndex, status, excerpt);
        }
        if (status >= 500 && status < 600) {
            return new ServerInternalException(null, message, statementIndex, status, excerpt);
        }
        return protocolFailure(format("Unexpected status %d", status), response, excerpt, null);
    }

    private static ProtocolException protocolFailure(
            String message, HttpResponse response, String excerpt, Throwable cause) {
        return new ProtocolException(message, response.status(), excerpt, cause);
    }

    private static String describe(Throwable error) {
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }

    private record ParsedBody(JsonNode body, String text, IOException error) {}
}
