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
package io.graphhttp.driver.internal.netty;

import static io.graphhttp.driver.internal.netty.ChannelAttributes.setCreationTimestamp;
import static io.graphhttp.driver.internal.netty.ChannelAttributes.setServerAddress;

import io.graphhttp.driver.Logging;
import io.graphhttp.driver.internal.HttpServerAddress;
import io.graphhttp.driver.internal.logging.ChannelActivityLogger;
import io.graphhttp.driver.net.ServerAddress;
import io.netty.channel.Channel;
import io.netty.channel.pool.ChannelPoolHandler;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.proxy.HttpProxyHandler;
import io.netty.handler.ssl.SslHandler;
import java.net.InetSocketAddress;
import java.time.Clock;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;

/**
 * Sets up the pipeline of every new pooled channel and traces channel use.
 */
public class HttpChannelPoolHandler implements ChannelPoolHandler {
    static final int MAX_CONTENT_LENGTH = 64 * 1024 * 1024;

    private final HttpServerAddress address;
    private final SSLContext sslContext;
    private final ServerAddress proxyAddress;
    private final int connectTimeoutMillis;
    private final Clock clock;
    private final Logging logging;

    public HttpChannelPoolHandler(
            HttpServerAddress address,
            SSLContext sslContext,
            ServerAddress proxyAddress,
            int connectTimeoutMillis,
            Clock clock,
            Logging logging) {
        this.address = address;
        this.sslContext = sslContext;
        this.proxyAddress = proxyAddress;
        this.connectTimeoutMillis = connectTimeoutMillis;
        this.clock = clock;
        this.logging = logging;
    }

    @Override
    public void channelCreated(Channel channel) {
        setServerAddress(channel, address);
        setCreationTimestamp(channel, clock.millis());

        var pipeline = channel.pipeline();
        if (proxyAddress != null) {
            var proxyHandler = new HttpProxyHandler(new InetSocketAddress(proxyAddress.host(), proxyAddress.port()));
            proxyHandler.setConnectTimeoutMillis(connectTimeoutMillis);
            pipeline.addLast(proxyHandler);
        }
        if (sslContext != null) {
            pipeline.addLast(createSslHandler());
        }
        pipeline.addLast(new HttpClientCodec());
        pipeline.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
        pipeline.addLast(new HttpResponseHandler(logging));

        new ChannelActivityLogger(channel, logging, getClass()).trace("Channel created");
    }

    @Override
    public void channelAcquired(Channel channel) {
        new ChannelActivityLogger(channel, logging, getClass()).trace("Channel acquired");
    }

    @Override
    public void channelReleased(Channel channel) {
        new ChannelActivityLogger(channel, logging, getClass()).trace("Channel released");
    }

    private SslHandler createSslHandler() {
        var sslHandler = new SslHandler(createSslEngine());
        sslHandler.setHandshakeTimeoutMillis(connectTimeoutMillis);
        return sslHandler;
    }

    private SSLEngine createSslEngine() {
        var sslEngine = sslContext.createSSLEngine(address.host(), address.port());
        sslEngine.setUseClientMode(true);
        var sslParameters = sslEngine.getSSLParameters();
        sslParameters.setEndpointIdentificationAlgorithm("HTTPS");
        sslEngine.setSSLParameters(sslParameters);
        return sslEngine;
    }
}
