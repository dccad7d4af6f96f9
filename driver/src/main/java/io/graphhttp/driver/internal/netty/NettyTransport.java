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

import static io.graphhttp.driver.internal.netty.ChannelAttributes.setPendingResponse;
import static io.graphhttp.driver.internal.netty.ChannelAttributes.takePendingResponse;
import static io.graphhttp.driver.internal.util.Futures.asCompletionStage;
import static java.lang.String.format;

import io.graphhttp.driver.Config;
import io.graphhttp.driver.Logger;
import io.graphhttp.driver.Logging;
import io.graphhttp.driver.internal.HttpServerAddress;
import io.graphhttp.driver.internal.logging.ChannelActivityLogger;
import io.graphhttp.driver.internal.util.Futures;
import io.graphhttp.driver.net.HttpRequest;
import io.graphhttp.driver.net.HttpResponse;
import io.graphhttp.driver.net.Transport;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.pool.ChannelHealthChecker;
import io.netty.channel.pool.FixedChannelPool;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.resolver.NoopAddressResolverGroup;
import java.io.IOException;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.net.ssl.SSLContext;

/**
 * {@link Transport} on a pool of Netty channels speaking HTTP/1.1 to one endpoint. One request is in flight per channel; the pool size
 * bounds concurrency and further requests wait for a free channel.
 * <p>
 * A request that does not complete within the configured request timeout fails with a {@link TimeoutException} and its channel is closed.
 */
public class NettyTransport implements Transport {
    /**
     * Unlimited amount of parties are allowed to request channels from the pool.
     */
    private static final int MAX_PENDING_ACQUIRES = Integer.MAX_VALUE;
    /**
     * Do not check channels when they are returned to the pool.
     */
    private static final boolean RELEASE_HEALTH_CHECK = false;

    private final HttpServerAddress address;
    private final EventLoopGroup eventLoopGroup;
    private final FixedChannelPool pool;
    private final long requestTimeoutMillis;
    private final Logging logging;
    private final Logger log;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final CompletableFuture<Void> closeFuture = new CompletableFuture<>();

    public NettyTransport(HttpServerAddress address, Config config) {
        this(address, config, EventLoopGroupFactory.newEventLoopGroup(config.eventLoopThreads()), Clock.systemUTC());
    }

    NettyTransport(HttpServerAddress address, Config config, EventLoopGroup eventLoopGroup, Clock clock) {
        this.address = address;
        this.eventLoopGroup = eventLoopGroup;
        this.requestTimeoutMillis = config.requestTimeoutMillis();
        this.logging = config.logging();
        this.log = logging.getLog(getClass());

        var bootstrap = new Bootstrap()
                .group(eventLoopGroup)
                .channel(EventLoopGroupFactory.channelClass())
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, config.connectionTimeoutMillis())
                .remoteAddress(address.toSocketAddress());
        var proxyAddress = config.proxyAddress().orElse(null);
        if (proxyAddress != null) {
            // the proxy resolves the target host
            bootstrap.resolver(NoopAddressResolverGroup.INSTANCE);
        }

        var handler = new HttpChannelPoolHandler(
                address,
                address.isSecure() ? defaultSslContext() : null,
                proxyAddress,
                config.connectionTimeoutMillis(),
                clock,
                logging);
        var acquireTimeoutMillis = config.connectionAcquisitionTimeoutMillis();
        this.pool = new FixedChannelPool(
                bootstrap,
                handler,
                ChannelHealthChecker.ACTIVE,
                acquireTimeoutMillis < 0 ? null : FixedChannelPool.AcquireTimeoutAction.FAIL,
                acquireTimeoutMillis < 0 ? -1 : acquireTimeoutMillis,
                config.maxConnectionPoolSize(),
                MAX_PENDING_ACQUIRES,
                RELEASE_HEALTH_CHECK);
    }

    @Override
    public CompletionStage<HttpResponse> send(HttpRequest request) {
        if (closed.get()) {
            return CompletableFuture.failedFuture(new IOException("Transport to " + address + " is closed"));
        }
        var result = new CompletableFuture<HttpResponse>();
        asCompletionStage(pool.acquire()).whenComplete((channel, error) -> {
            if (error != null) {
                result.completeExceptionally(Futures.completionExceptionCause(error));
            } else {
                try {
                    exchange(channel, request, result);
                } catch (RuntimeException e) {
                    result.completeExceptionally(e);
                }
            }
        });
        return result;
    }

    private void exchange(Channel channel, HttpRequest request, CompletableFuture<HttpResponse> result) {
        var channelLog = new ChannelActivityLogger(channel, logging, getClass());
        var released = new AtomicBoolean();
        result.whenComplete((response, error) -> {
            if (error != null) {
                // the channel may still receive the abandoned response
                takePendingResponse(channel);
                channel.close();
            }
            if (released.compareAndSet(false, true)) {
                pool.release(channel);
            }
        });

        try {
            setPendingResponse(channel, result);
        } catch (IllegalStateException e) {
            result.completeExceptionally(e);
            return;
        }

        if (requestTimeoutMillis > 0) {
            var timeout = channel.eventLoop()
                    .schedule(
                            () -> {
                                if (result.completeExceptionally(new TimeoutException(
                                        format("No response within %d ms", requestTimeoutMillis)))) {
                                    channelLog.debug("Request %s %s timed out", request.method(), request.path());
                                }
                            },
                            requestTimeoutMillis,
                            TimeUnit.MILLISECONDS);
            result.whenComplete((response, error) -> timeout.cancel(false));
        }

        DefaultFullHttpRequest nettyRequest;
        try {
            nettyRequest = toNettyRequest(request);
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
            return;
        }
        channelLog.trace("Writing %s %s", request.method(), request.path());
        channel.writeAndFlush(nettyRequest).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                result.completeExceptionally(future.cause());
            }
        });
    }

    private DefaultFullHttpRequest toNettyRequest(HttpRequest request) {
        var body = request.body();
        var nettyRequest = new DefaultFullHttpRequest(
                HttpVersion.HTTP_1_1,
                HttpMethod.valueOf(request.method()),
                request.path(),
                Unpooled.wrappedBuffer(body));
        var headers = nettyRequest.headers();
        request.headers().forEach(headers::set);
        headers.set(HttpHeaderNames.HOST, address.hostHeader());
        headers.set(HttpHeaderNames.CONTENT_LENGTH, body.length);
        return nettyRequest;
    }

    @Override
    public CompletionStage<Void> closeAsync() {
        if (closed.compareAndSet(false, true)) {
            log.debug("Closing transport to %s", address);
            pool.closeAsync().addListener(poolClosed -> {
                if (!poolClosed.isSuccess()) {
                    log.warn("Failed to close the connection pool", poolClosed.cause());
                }
                eventLoopGroup
                        .shutdownGracefully(200, 15_000, TimeUnit.MILLISECONDS)
                        .addListener(groupClosed -> {
                            if (groupClosed.isSuccess()) {
                                closeFuture.complete(null);
                            } else {
                                closeFuture.completeExceptionally(groupClosed.cause());
                            }
                        });
            });
        }
        return closeFuture;
    }

    private static SSLContext defaultSslContext() {
        try {
            return SSLContext.getDefault();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("No default TLS context available", e);
        }
    }
}
