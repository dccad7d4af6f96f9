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

import static io.graphhttp.driver.testutil.TestUtil.await;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.graphhttp.driver.Config;
import io.graphhttp.driver.internal.HttpServerAddress;
import io.graphhttp.driver.net.HttpRequest;
import io.graphhttp.driver.net.HttpResponse;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpVersion;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class NettyTransportTest {
    private static EventLoopGroup serverGroup;
    private static Channel serverChannel;
    private static int port;

    private NettyTransport transport;

    @BeforeAll
    static void startServer() throws InterruptedException {
        serverGroup = new NioEventLoopGroup(1);
        serverChannel = new ServerBootstrap()
                .group(serverGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel channel) {
                        channel.pipeline()
                                .addLast(new HttpServerCodec())
                                .addLast(new HttpObjectAggregator(1024 * 1024))
                                .addLast(new EchoHandler());
                    }
                })
                .bind("localhost", 0)
                .sync()
                .channel();
        port = ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    @AfterAll
    static void stopServer() {
        serverChannel.close().syncUninterruptibly();
        serverGroup.shutdownGracefully(0, 1, SECONDS).syncUninterruptibly();
    }

    @AfterEach
    void closeTransport() {
        if (transport != null) {
            await(transport.closeAsync());
        }
    }

    @Test
    void shouldExchangeRequestAndResponse() {
        // Given
        transport = transport(port, Config.defaultConfig());

        // When
        var response = await(transport.send(request("POST", "/db/neo4j/tx/commit", "{\"statements\":[]}")));

        // Then
        assertThat(response.status(), equalTo(200));
        assertThat(response.bodyAsString(), equalTo("POST /db/neo4j/tx/commit localhost:" + port + " {\"statements\":[]}"));
        assertThat(response.header("Content-Type").orElseThrow(), equalTo("text/plain"));
    }

    @Test
    void shouldReuseSingleConnectionForSequentialRequests() {
        // Given
        transport = transport(port, Config.builder().withMaxConnectionPoolSize(1).build());

        // When
        for (var i = 0; i < 5; i++) {
            var response = await(transport.send(request("GET", "/db/neo4j/" + i, "")));

            // Then
            assertThat(response.bodyAsString(), equalTo("GET /db/neo4j/" + i + " localhost:" + port + " "));
        }
    }

    @Test
    void shouldReturnErrorStatusAsResponse() {
        transport = transport(port, Config.defaultConfig());

        var response = await(transport.send(request("GET", "/missing", "")));

        assertThat(response.status(), equalTo(404));
    }

    @Test
    void shouldFailWhenServerIsNotListening() throws IOException {
        // Given
        int unusedPort;
        try (var socket = new ServerSocket(0)) {
            unusedPort = socket.getLocalPort();
        }
        transport = transport(unusedPort, Config.defaultConfig());

        // When
        var error = failure(transport.send(request("GET", "/", "")));

        // Then
        assertThat(error, instanceOf(IOException.class));
    }

    @Test
    void shouldTimeOutWhenServerDoesNotRespond() {
        // Given
        transport = transport(port, Config.builder().withRequestTimeout(100, TimeUnit.MILLISECONDS).build());

        // When
        var error = failure(transport.send(request("GET", "/slow", "")));

        // Then
        assertThat(error, instanceOf(TimeoutException.class));
    }

    @Test
    void shouldRecoverAfterTimeout() {
        // Given
        transport = transport(
                port,
                Config.builder()
                        .withRequestTimeout(100, TimeUnit.MILLISECONDS)
                        .withMaxConnectionPoolSize(1)
                        .build());
        failure(transport.send(request("GET", "/slow", "")));

        // When
        var response = await(transport.send(request("GET", "/fast", "")));

        // Then
        assertThat(response.status(), equalTo(200));
    }

    @Test
    void shouldFailWhenServerDropsConnection() {
        transport = transport(port, Config.defaultConfig());

        var error = failure(transport.send(request("GET", "/drop", "")));

        assertThat(error, instanceOf(IOException.class));
    }

    @Test
    void shouldFailRequestThatCannotBeEncodedAndReleaseConnection() {
        // Given
        transport = transport(
                port,
                Config.builder()
                        .withRequestTimeout(0, TimeUnit.MILLISECONDS)
                        .withMaxConnectionPoolSize(1)
                        .build());
        var headers = new HashMap<String, String>();
        headers.put("X-Trace", null);

        // When
        var error = failure(transport.send(new HttpRequest("GET", "/", headers, null)));
        var response = await(transport.send(request("GET", "/after", "")));

        // Then
        assertThat(error, instanceOf(NullPointerException.class));
        assertThat(response.status(), equalTo(200));
    }

    @Test
    void shouldRejectRequestsAfterClose() {
        // Given
        transport = transport(port, Config.defaultConfig());
        await(transport.closeAsync());

        // When
        var error = failure(transport.send(request("GET", "/", "")));

        // Then
        assertThat(error, instanceOf(IOException.class));
    }

    private static NettyTransport transport(int port, Config config) {
        return new NettyTransport(new HttpServerAddress("http", "localhost", port, ""), config);
    }

    private static HttpRequest request(String method, String path, String body) {
        return new HttpRequest(
                method, path, Map.of("Content-Type", "application/json"), body.getBytes(StandardCharsets.UTF_8));
    }

    private static Throwable failure(CompletionStage<HttpResponse> stage) {
        var error = assertThrows(ExecutionException.class, () -> stage.toCompletableFuture().get(30, SECONDS));
        return error.getCause();
    }

    private static class EchoHandler extends SimpleChannelInboundHandler<FullHttpRequest> {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
            switch (request.uri()) {
                case "/slow" -> {}
                case "/drop" -> ctx.close();
                case "/missing" -> respond(ctx, HttpResponseStatus.NOT_FOUND, "");
                default -> respond(
                        ctx,
                        HttpResponseStatus.OK,
                        request.method() + " " + request.uri() + " " + request.headers().get(HttpHeaderNames.HOST)
                                + " " + request.content().toString(StandardCharsets.UTF_8));
            }
        }

        private static void respond(ChannelHandlerContext ctx, HttpResponseStatus status, String body) {
            var response = new DefaultFullHttpResponse(
                    HttpVersion.HTTP_1_1, status, Unpooled.copiedBuffer(body, StandardCharsets.UTF_8));
            response.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/plain");
            response.headers().set(HttpHeaderNames.CONTENT_LENGTH, response.content().readableBytes());
            ctx.writeAndFlush(response);
        }
    }
}
