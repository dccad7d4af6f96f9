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
package io.graphhttp.driver.internal;

import static java.util.Objects.requireNonNull;

import io.graphhttp.driver.net.ServerAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.URI;
import java.util.Locale;
import java.util.Objects;

/**
 * Holds the scheme, host, port and base path of an HTTP endpoint. User information of the URI it was parsed from is dropped, so instances
 * can be logged and put in error messages.
 */
public class HttpServerAddress implements ServerAddress {
    public static final String HTTP_SCHEME = "http";
    public static final String HTTPS_SCHEME = "https";
    public static final int DEFAULT_HTTP_PORT = 7474;
    public static final int DEFAULT_HTTPS_PORT = 7473;

    private final String scheme;
    private final String host;
    private final int port;
    private final String basePath;
    private final String stringValue;

    public HttpServerAddress(String scheme, String host, int port, String basePath) {
        this.scheme = requireNonNull(scheme, "scheme");
        this.host = requireNonNull(host, "host");
        this.port = requireValidPort(port);
        this.basePath = requireNonNull(basePath, "basePath");
        this.stringValue = String.format("%s://%s:%d%s", scheme, hostForUri(host), port, basePath);
    }

    public static HttpServerAddress from(URI uri) {
        var scheme = uri.getScheme() == null ? null : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!HTTP_SCHEME.equals(scheme) && !HTTPS_SCHEME.equals(scheme)) {
            throw new IllegalArgumentException("Unsupported URI scheme: " + scheme + ", expected http or https");
        }
        var host = uri.getHost();
        if (host == null) {
            throw new IllegalArgumentException("URI has no host: " + scrub(uri));
        }
        if (uri.getRawQuery() != null || uri.getRawFragment() != null) {
            throw new IllegalArgumentException("URI must not have a query or fragment: " + scrub(uri));
        }
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        var port = uri.getPort() != -1 ? uri.getPort() : HTTPS_SCHEME.equals(scheme) ? DEFAULT_HTTPS_PORT : DEFAULT_HTTP_PORT;
        var path = uri.getRawPath() == null ? "" : uri.getRawPath();
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return new HttpServerAddress(scheme, host, port, path);
    }

    public String scheme() {
        return scheme;
    }

    @Override
    public String host() {
        return host;
    }

    @Override
    public int port() {
        return port;
    }

    /**
     * @return the base path without trailing slash, empty for the root
     */
    public String basePath() {
        return basePath;
    }

    public boolean isSecure() {
        return HTTPS_SCHEME.equals(scheme);
    }

    /**
     * @return the value of a {@code Host} header for this address
     */
    public String hostHeader() {
        return hostForUri(host) + ":" + port;
    }

    /**
     * Create a {@link SocketAddress} from this address. The host is left unresolved so the event loop resolves it when connecting.
     *
     * @return the socket address
     */
    public SocketAddress toSocketAddress() {
        return InetSocketAddress.createUnresolved(host, port);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        var that = (HttpServerAddress) o;
        return port == that.port && scheme.equals(that.scheme) && host.equals(that.host) && basePath.equals(that.basePath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scheme, host, port, basePath);
    }

    @Override
    public String toString() {
        return stringValue;
    }

    private static String hostForUri(String host) {
        return host.contains(":") ? "[" + host + "]" : host;
    }

    private static String scrub(URI uri) {
        return uri.getRawUserInfo() == null ? uri.toString() : uri.toString().replace(uri.getRawUserInfo() + "@", "");
    }

    private static int requireValidPort(int port) {
        if (port >= 0 && port <= 65_535) {
            return port;
        }
        throw new IllegalArgumentException("Illegal port: " + port);
    }
}
