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
package io.graphhttp.driver.internal.logging;

import static java.lang.String.format;

import io.graphhttp.driver.Logging;
import io.graphhttp.driver.internal.netty.ChannelAttributes;
import io.netty.channel.Channel;

/**
 * Prefixes every message with the local channel id and the server address of a channel.
 */
public class ChannelActivityLogger extends ReformattedLogger {
    private final Channel channel;
    private final String localChannelId;
    private String serverAddress;

    public ChannelActivityLogger(Channel channel, Logging logging, Class<?> owner) {
        super(logging.getLog(owner));
        this.channel = channel;
        this.localChannelId = channel != null ? channel.id().toString() : null;
    }

    @Override
    protected String reformat(String message) {
        if (channel == null) {
            return message;
        }
        var address = getServerAddress();
        return format("[0x%s][%s] %s", localChannelId, address == null ? "" : address, message);
    }

    private String getServerAddress() {
        if (serverAddress == null) {
            var address = ChannelAttributes.serverAddress(channel);
            this.serverAddress = address != null ? address.toString() : null;
        }
        return serverAddress;
    }
}
