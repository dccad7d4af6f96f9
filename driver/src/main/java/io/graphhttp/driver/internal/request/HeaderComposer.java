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

import io.graphhttp.driver.internal.security.InternalAuthToken;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Merges the header layers of a request. From lowest to highest precedence: built-in defaults, the {@code Authorization} header of the
 * configured token, client headers, per-call headers. Names collide case-insensitively and a later layer replaces the value of an earlier
 * one.
 */
public class HeaderComposer {
    public static final String ACCEPT = "Accept";
    public static final String CONTENT_TYPE = "Content-Type";
    public static final String USER_AGENT = "User-Agent";
    public static final String AUTHORIZATION = "Authorization";
    public static final String STREAM = "X-Stream";

    public static final String JSON = "application/json";

    private final Map<String, String> baseHeaders;

    public HeaderComposer(String userAgent, InternalAuthToken authToken, Map<String, String> clientHeaders) {
        var headers = newHeaderMap();
        headers.put(ACCEPT, JSON + ";charset=UTF-8");
        headers.put(CONTENT_TYPE, JSON);
        headers.put(USER_AGENT, userAgent);
        headers.put(STREAM, "true");
        authToken.authorizationHeader().ifPresent(value -> headers.put(AUTHORIZATION, value));
        headers.putAll(clientHeaders);
        this.baseHeaders = Collections.unmodifiableMap(headers);
    }

    /**
     * @param callHeaders the per-call headers
     * @return the headers to send
     */
    public Map<String, String> compose(Map<String, String> callHeaders) {
        var headers = newHeaderMap();
        headers.putAll(baseHeaders);
        headers.putAll(callHeaders);
        return headers;
    }

    private static TreeMap<String, String> newHeaderMap() {
        return new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    }
}
