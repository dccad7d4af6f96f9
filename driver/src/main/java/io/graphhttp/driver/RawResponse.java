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

import io.graphhttp.driver.util.Immutable;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * A complete response to a {@link CustomRequest}, returned by {@link GraphClient#executeRaw(CustomRequest)}.
 *
 * @since 1.0
 */
@Immutable
public final class RawResponse {
    private final int status;
    private final Map<String, String> headers;
    private final Object body;

    public RawResponse(int status, Map<String, String> headers, Object body) {
        this.status = status;
        var copy = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(headers);
        this.headers = Collections.unmodifiableMap(copy);
        this.body = body;
    }

    /**
     * @return the status code
     */
    public int status() {
        return status;
    }

    /**
     * @return the response headers, looked up case-insensitively
     */
    public Map<String, String> headers() {
        return headers;
    }

    /**
     * The parsed JSON body as maps, lists and scalars, the raw bytes if the body is not JSON, or {@code null} for an empty body.
     *
     * @return the body
     */
    public Object body() {
        return body;
    }

    @Override
    public String toString() {
        return "RawResponse{status=" + status + "}";
    }
}
