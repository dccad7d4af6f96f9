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
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-call options. Headers given here take precedence over the client's configured headers and built-in defaults.
 *
 * @since 1.0
 */
@Immutable
public final class RequestOptions {
    private static final RequestOptions DEFAULT = new RequestOptions(Collections.emptyMap());

    private final Map<String, String> headers;

    private RequestOptions(Map<String, String> headers) {
        this.headers = headers;
    }

    /**
     * @return options without per-call headers
     */
    public static RequestOptions defaults() {
        return DEFAULT;
    }

    /**
     * @param headers the per-call headers
     * @return options carrying the given headers
     */
    public static RequestOptions withHeaders(Map<String, String> headers) {
        if (headers == null || headers.isEmpty()) {
            return DEFAULT;
        }
        return new RequestOptions(Collections.unmodifiableMap(new LinkedHashMap<>(headers)));
    }

    /**
     * @return the per-call headers
     */
    public Map<String, String> headers() {
        return headers;
    }
}
