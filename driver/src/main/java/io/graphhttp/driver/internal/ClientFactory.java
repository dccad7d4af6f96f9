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

import io.graphhttp.driver.AuthToken;
import io.graphhttp.driver.AuthTokens;
import io.graphhttp.driver.Config;
import io.graphhttp.driver.GraphClient;
import io.graphhttp.driver.internal.batch.BatchExecutor;
import io.graphhttp.driver.internal.batch.RequestDispatcher;
import io.graphhttp.driver.internal.classify.ErrorClassifier;
import io.graphhttp.driver.internal.hydration.EntityHydrator;
import io.graphhttp.driver.internal.json.JsonCodec;
import io.graphhttp.driver.internal.netty.NettyTransport;
import io.graphhttp.driver.internal.request.HeaderComposer;
import io.graphhttp.driver.internal.request.QueryRequestBuilder;
import io.graphhttp.driver.internal.security.InternalAuthToken;
import io.graphhttp.driver.net.Transport;
import java.net.URI;

public class ClientFactory {
    /**
     * Create a client.
     *
     * @param uri the endpoint
     * @param authToken the authentication, {@code null} for none
     * @param config the configuration, {@code null} for the defaults
     * @param transport the transport, {@code null} to create a Netty transport owned by the client
     * @return the client
     */
    public final GraphClient newInstance(URI uri, AuthToken authToken, Config config, Transport transport) {
        requireNonNull(uri, "uri");
        var token = authToken == null ? AuthTokens.none() : authToken;
        if (!(token instanceof InternalAuthToken internalToken)) {
            throw new IllegalArgumentException(
                    "Unsupported authentication token, use one created by AuthTokens: " + token.getClass().getName());
        }
        var effectiveConfig = config == null ? Config.defaultConfig() : config;
        var address = HttpServerAddress.from(uri);
        var log = effectiveConfig.logging().getLog(getClass());

        var ownsTransport = transport == null;
        var effectiveTransport = ownsTransport ? createTransport(address, effectiveConfig) : transport;

        var codec = new JsonCodec();
        var classifier = new ErrorClassifier(codec);
        var headerComposer =
                new HeaderComposer(effectiveConfig.userAgent(), internalToken, effectiveConfig.defaultHeaders());
        var requestBuilder =
                new QueryRequestBuilder(codec, headerComposer, address.basePath(), effectiveConfig.database());
        var dispatcher = new RequestDispatcher(
                effectiveTransport,
                classifier,
                effectiveConfig.requestTimeoutMillis(),
                address.toString(),
                effectiveConfig.logging());
        var executor = new BatchExecutor(
                requestBuilder, dispatcher, classifier, new EntityHydrator(), effectiveConfig.logging());

        log.info("Created client for %s, database '%s'", address, effectiveConfig.database());
        return new InternalGraphClient(
                effectiveConfig,
                address,
                effectiveTransport,
                ownsTransport,
                requestBuilder,
                dispatcher,
                classifier,
                executor);
    }

    protected Transport createTransport(HttpServerAddress address, Config config) {
        return new NettyTransport(address, config);
    }
}
