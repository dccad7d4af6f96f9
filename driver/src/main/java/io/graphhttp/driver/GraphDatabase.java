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

import static java.util.Objects.requireNonNull;

import io.graphhttp.driver.internal.ClientFactory;
import io.graphhttp.driver.net.Transport;
import java.net.URI;

/**
 * Creates {@link GraphClient clients}, optionally letting you {@link #client(URI, AuthToken, Config)} to configure them.
 * <p>
 * The URI names the HTTP endpoint of the server, such as {@code http://localhost:7474} or {@code https://graph.example.com:7473/base}. A
 * missing port defaults to 7474 for {@code http} and 7473 for {@code https}.
 *
 * @see GraphClient
 * @since 1.0
 */
public final class GraphDatabase {
    private static final ClientFactory FACTORY = new ClientFactory();

    private GraphDatabase() {}

    /**
     * Return a client with the default configuration settings
     *
     * @param uri the URL of the server endpoint
     * @param authToken authentication to use, see {@link AuthTokens}
     * @return a new client
     */
    public static GraphClient client(String uri, AuthToken authToken) {
        return client(uri, authToken, Config.defaultConfig());
    }

    /**
     * Return a client with custom configuration.
     *
     * @param uri the URL of the server endpoint
     * @param authToken authentication to use, see {@link AuthTokens}
     * @param config user defined configuration
     * @return a new client
     */
    public static GraphClient client(String uri, AuthToken authToken, Config config) {
        return client(URI.create(requireNonNull(uri, "uri")), authToken, config);
    }

    /**
     * Return a client with custom configuration.
     *
     * @param uri the URL of the server endpoint
     * @param authToken authentication to use, see {@link AuthTokens}
     * @param config user defined configuration
     * @return a new client
     */
    public static GraphClient client(URI uri, AuthToken authToken, Config config) {
        return FACTORY.newInstance(uri, authToken, config, null);
    }

    /**
     * Return a client sending its requests through the given transport. The client does not close the transport.
     *
     * @param uri the URL of the server endpoint
     * @param authToken authentication to use, see {@link AuthTokens}
     * @param config user defined configuration
     * @param transport the transport
     * @return a new client
     */
    public static GraphClient client(URI uri, AuthToken authToken, Config config, Transport transport) {
        return FACTORY.newInstance(uri, authToken, config, requireNonNull(transport, "transport"));
    }
}
