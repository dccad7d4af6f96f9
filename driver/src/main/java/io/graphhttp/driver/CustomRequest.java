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

import static io.graphhttp.driver.internal.util.Preconditions.checkArgument;

import io.graphhttp.driver.util.Immutable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A request to an arbitrary endpoint of the database server, such as a server plugin or a management endpoint.
 * <p>
 * The body is sent as-is when it is a {@code byte[]}; any other non-null body is serialized as JSON.
 *
 * @since 1.0
 */
@Immutable
public final class CustomRequest {
    private final String method;
    private final String path;
    private final Object body;
    private final Map<String, String> headers;

    private CustomRequest(String method, String path, Object body, Map<String, String> headers) {
        this.method = method;
        this.path = path;
        this.body = body;
        this.headers = headers;
    }

    /**
     * Create a new request.
     *
     * @param method the HTTP method, such as {@code GET} or {@code POST}
     * @param path the path relative to the base endpoint, starting with {@code /}
     * @return the request
     */
    public static CustomRequest of(String method, String path) {
        checkArgument(method != null && !method.isBlank(), "Method must be given");
        checkArgument(path != null && path.startsWith("/"), "Path must start with '/' but was: " + path);
        return new CustomRequest(method.toUpperCase(Locale.ROOT), path, null, Collections.emptyMap());
    }

    /**
     * @param newBody the body
     * @return a new request with the given body
     */
    public CustomRequest withBody(Object newBody) {
        return new CustomRequest(method, path, newBody, headers);
    }

    /**
     * @param newHeaders the per-call headers
     * @return a new request with the given headers
     */
    public CustomRequest withHeaders(Map<String, String> newHeaders) {
        return new CustomRequest(
                method,
                path,
                body,
                newHeaders == null
                        ? Collections.emptyMap()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(newHeaders)));
    }

    public String method() {
        return method;
    }

    public String path() {
        return path;
    }

    public Object body() {
        return body;
    }

    public Map<String, String> headers() {
        return headers;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        var that = (CustomRequest) o;
        return method.equals(that.method)
                && path.equals(that.path)
                && Objects.equals(body, that.body)
                && headers.equals(that.headers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(method, path, body, headers);
    }

    @Override
    public String toString() {
        return "CustomRequest{" + method + " " + path + "}";
    }
}
