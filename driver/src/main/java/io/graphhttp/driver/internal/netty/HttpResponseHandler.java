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

import static io.graphhttp.driver.internal.netty.ChannelAttributes.takePendingResponse;

import io.graphhttp.driver.Logger;
import io.graphhttp.driver.Logging;
import io.graphhttp.driver.internal.logging.ChannelActivityLogger;
import io.graphhttp.driver.net.HttpResponse;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpUtil;
import java.io.IOException;
import java.util.LinkedHashMap;

/**
 * Completes the exchange in progress on a channel with the aggregated response, or fails it when the channel breaks first.
 */
public class HttpResponseHandler extends SimpleChannelInboundHandler<FullHttpResponse> {
    private final Logging logging;
    private Logger log;

    public HttpResponseHandler(Logging logging) {
        this.logging = logging;
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        log = new ChannelActivityLogger(ctx.channel(), logging, getClass());
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse msg) {
        var future = takePendingResponse(ctx.channel());
        if (future == null) {
            log.warn("Received a response without a pending request, closing channel");
            ctx.close();
            return;
        }
        var response = toResponse(msg);
        log.trace("Received response with status %d", response.status());
        if (!HttpUtil.isKeepAlive(msg)) {
            ctx.close();
        }
        future.complete(response);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        log.debug("Channel is inactive");
        var future = takePendingResponse(ctx.channel());
        if (future != null) {
            future.completeExceptionally(new IOException("Connection closed before a complete response was received"));
        }
        ctx.fireChannelInactive();
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable error) {
        var future = takePendingResponse(ctx.channel());
        if (future != null) {
            log.debug("Fatal error occurred in the pipeline", error);
            future.completeExceptionally(error);
        } else {
            log.warn("Fatal error occurred in the pipeline", error);
        }
        ctx.close();
    }

    static HttpResponse toResponse(FullHttpResponse msg) {
        var headers = new LinkedHashMap<String, String>();
        for (var name : msg.headers().names()) {
            headers.put(name, String.join(", ", msg.headers().getAll(name)));
        }
        return new HttpResponse(msg.status().code(), headers, ByteBufUtil.getBytes(msg.content()));
    }
}
