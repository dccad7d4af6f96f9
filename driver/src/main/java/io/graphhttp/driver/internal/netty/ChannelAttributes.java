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

import static io.netty.util.AttributeKey.newInstance;

import io.graphhttp.driver.internal.HttpServerAddress;
import io.graphhttp.driver.net.HttpResponse;
import io.netty.channel.Channel;
import io.netty.util.AttributeKey;
import java.util.concurrent.CompletableFuture;

public final class ChannelAttributes {
    private static final AttributeKey<HttpServerAddress> ADDRESS = newInstance("serverAddress");
    private static final AttributeKey<Long> CREATION_TIMESTAMP = newInstance("creationTimestamp");
    private static final AttributeKey<CompletableFuture<HttpResponse>> PENDING_RESPONSE = newInstance("pendingResponse");

    private ChannelAttributes() {}

    public static HttpServerAddress serverAddress(Channel channel) {
        return get(channel, ADDRESS);
    }

    public static void setServerAddress(Channel channel, HttpServerAddress address) {
        setOnce(channel, ADDRESS, address);
    }

    public static long creationTimestamp(Channel channel) {
        return get(channel, CREATION_TIMESTAMP);
    }

    public static void setCreationTimestamp(Channel channel, long creationTimestamp) {
        setOnce(channel, CREATION_TIMESTAMP, creationTimestamp);
    }

    /**
     * Register the future of the exchange in progress on a channel.
     *
     * @param channel the channel
     * @param future the future completed by the inbound handler
     * @throws IllegalStateException if another exchange is in progress
     */
    public static void setPendingResponse(Channel channel, CompletableFuture<HttpResponse> future) {
        if (!channel.attr(PENDING_RESPONSE).compareAndSet(null, future)) {
            throw new IllegalStateException("Channel " + channel + " already has an exchange in progress");
        }
    }

    /**
     * Remove the future of the exchange in progress on a channel.
     *
     * @param channel the channel
     * @return the future, or {@code null} when no exchange is in progress
     */
    public static CompletableFuture<HttpResponse> takePendingResponse(Channel channel) {
        return channel.attr(PENDING_RESPONSE).getAndSet(null);
    }

    private static <T> T get(Channel channel, AttributeKey<T> key) {
        return channel.attr(key).get();
    }

    private static <T> void setOnce(Channel channel, AttributeKey<T> key, T value) {
        var existingValue = channel.attr(key).setIfAbsent(value);
        if (existingValue != null) {
            throw new IllegalStateException(
                    "Unable to set " + key.name() + " because it is already set to " + existingValue);
        }
    }
}
