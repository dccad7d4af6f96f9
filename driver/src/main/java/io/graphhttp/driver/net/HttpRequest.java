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

import io.graphhttp.driver.util.Immutable;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A fully composed request handed to a {@link Transport}. The path is absolute on the server, including any base path of the endpoint.
 * Header names are case-insensitive.
 *
 * @since 1.0
 */
@Immutable
public final class HttpRequest {
    private static final byte[] NO_BODY = new byte[0];

    private final String method;
    private final String path;
    private final Map<String, String> headers;
    private final byte[] body;

    public HttpRequest(String method, String path, Map<String, String> headers, byte[] body) {
        this.method = Objects.requireNonNull(method, "method");
        this.path = Objects.requireNonNull(path, "path");
        var copy = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(headers);
        this.headers = Collections.unmodifiableMap(copy);
        this.body = body == null ? NO_BODY : body.clone();
    }

    public String method() {
        return method;
    }

    public String path() {
        return path;
    }

    /**
     * @return the headers, keyed case-insensitively
     */
    public Map<String, String> headers() {
        return headers;
    }

    /**
     * @return a copy of the body, empty when there is none
     */
    public byte[] body() {
        return body.clone();
    }

    public int bodyLength() {
        return body.length;
    }

    @Override
    public String toString() {
        // headers are left out, they carry credentials
        return "HttpRequest{" + method + " " + path + ", bodyLength=" + body.length + "}";
    }
}
