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

import static io.graphhttp.driver.internal.logging.DevNullLogging.DEV_NULL_LOGGING;
import static java.lang.String.format;

import io.graphhttp.driver.internal.util.DriverInfoUtil;
import io.graphhttp.driver.net.ServerAddress;
import io.graphhttp.driver.util.Immutable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * A configuration class to config client properties.
 * <p>
 * To build a simple config with custom logging implementation:
 * <pre>
 * {@code
 * Config config = Config.builder()
 *                       .withLogging(new MyLogging())
 *                       .build();
 * }
 * </pre>
 * <p>
 * To build a more complicated config with default headers and tuned connection pool options:
 * <pre>
 * {@code
 * Config config = Config.builder()
 *                       .withDatabase("movies")
 *                       .withDefaultHeader("X-Tenant", "acme")
 *                       .withRequestTimeout(20, TimeUnit.SECONDS)
 *                       .withMaxConnectionPoolSize(10)
 *                       .build();
 * }
 * </pre>
 * A config is immutable and may be shared between clients.
 *
 * @since 1.0
 */
@Immutable
public final class Config {
    /**
     * The database used when none is configured.
     */
    public static final String DEFAULT_DATABASE = "neo4j";

    private static final Config EMPTY = builder().build();

    /**
     * User defined logging
     */
    private final Logging logging;

    /**
     * The database statements are sent to.
     */
    private final String database;

    /**
     * The headers sent with every request, before per-call headers.
     */
    private final Map<String, String> defaultHeaders;

    /**
     * The deadline of a single request in milliseconds, non-positive when disabled.
     */
    private final long requestTimeoutMillis;

    /**
     * The configured connection timeout value in milliseconds.
     */
    private final int connectionTimeoutMillis;

    /**
     * The maximum connection pool size.
     */
    private final int maxConnectionPoolSize;

    /**
     * The maximum amount of time connection acquisition will attempt to acquire a connection from the connection pool.
     */
    private final long connectionAcquisitionTimeoutMillis;

    /**
     * The HTTP proxy, or {@code null}.
     */
    private final ServerAddress proxyAddress;

    /**
     * The event loop thread count.
     */
    private final int eventLoopThreads;

    /**
     * The user_agent configured for this client.
     */
    private final String userAgent;

    private Config(ConfigBuilder builder) {
        this.logging = builder.logging;
        this.database = builder.database;
        this.defaultHeaders = Collections.unmodifiableMap(new LinkedHashMap<>(builder.defaultHeaders));
        this.requestTimeoutMillis = builder.requestTimeoutMillis;
        this.connectionTimeoutMillis = builder.connectionTimeoutMillis;
        this.maxConnectionPoolSize = builder.maxConnectionPoolSize;
        this.connectionAcquisitionTimeoutMillis = builder.connectionAcquisitionTimeoutMillis;
        this.proxyAddress = builder.proxyAddress;
        this.eventLoopThreads = builder.eventLoopThreads;
        this.userAgent = builder.userAgent;
    }

    /**
     * Logging provider
     *
     * @return the Logging provider to use
     */
    public Logging logging() {
        return logging;
    }

    /**
     * @return the name of the database statements are sent to
     */
    public String database() {
        return database;
    }

    /**
     * @return the headers sent with every request
     */
    public Map<String, String> defaultHeaders() {
        return defaultHeaders;
    }

    /**
     * @return the request deadline in milliseconds, zero or negative when requests never time out on the client
     */
    public long requestTimeoutMillis() {
        return requestTimeoutMillis;
    }

    /**
     * @return the configured connection timeout value in milliseconds.
     */
    public int connectionTimeoutMillis() {
        return connectionTimeoutMillis;
    }

    /**
     * Returns the maximum connection pool size.
     *
     * @return the maximum size
     */
    public int maxConnectionPoolSize() {
        return maxConnectionPoolSize;
    }

    /**
     * Returns the connection acquisition timeout in milliseconds.
     *
     * @return the acquisition timeout, negative when acquisition waits forever
     */
    public long connectionAcquisitionTimeoutMillis() {
        return connectionAcquisitionTimeoutMillis;
    }

    /**
     * @return the HTTP proxy all connections go through, if any
     */
    public Optional<ServerAddress> proxyAddress() {
        return Optional.ofNullable(proxyAddress);
    }

    /**
     * @return the configured event loop thread count, zero for the Netty default
     */
    public int eventLoopThreads() {
        return eventLoopThreads;
    }

    /**
     * @return the user agent string sent with every request
     */
    public String userAgent() {
        return userAgent;
    }

    /**
     * Return a {@link ConfigBuilder} instance
     *
     * @return a {@link ConfigBuilder} instance
     */
    public static ConfigBuilder builder() {
        return new ConfigBuilder();
    }

    /**
     * @return A config with all default settings
     */
    public static Config defaultConfig() {
        return EMPTY;
    }

    /**
     * Used to build new config instances
     */
    public static final class ConfigBuilder {
        private Logging logging = DEV_NULL_LOGGING;
        private String database = DEFAULT_DATABASE;
        private final Map<String, String> defaultHeaders = new LinkedHashMap<>();
        private long requestTimeoutMillis = TimeUnit.SECONDS.toMillis(60);
        private int connectionTimeoutMillis = (int) TimeUnit.SECONDS.toMillis(30);
        private int maxConnectionPoolSize = 100;
        private long connectionAcquisitionTimeoutMillis = TimeUnit.SECONDS.toMillis(60);
        private ServerAddress proxyAddress;
        private int eventLoopThreads = 0;
        private String userAgent = DriverInfoUtil.userAgent();

        private ConfigBuilder() {}

        /**
         * Provide a logging implementation for the client to use. Nothing is logged by default.
         * Callers are expected to either implement {@link Logging} interface or provide one of the existing implementations available from static factory
         * methods in the {@link Logging} interface.
         *
         * @param logging the logging instance to use
         * @return this builder
         * @see Logging
         */
        public ConfigBuilder withLogging(Logging logging) {
            this.logging = Objects.requireNonNull(logging, "logging");
            return this;
        }

        /**
         * Set the database statements are sent to. Defaults to {@value Config#DEFAULT_DATABASE}.
         *
         * @param database the database name
         * @return this builder
         */
        public ConfigBuilder withDatabase(String database) {
            if (database == null || database.isBlank()) {
                throw new IllegalArgumentException("Database name must not be empty");
            }
            this.database = database;
            return this;
        }

        /**
         * Add headers sent with every request. They override built-in defaults with the same name and are overridden by per-call headers.
         *
         * @param headers the headers
         * @return this builder
         */
        public ConfigBuilder withDefaultHeaders(Map<String, String> headers) {
            Objects.requireNonNull(headers, "headers");
            headers.forEach(this::withDefaultHeader);
            return this;
        }

        /**
         * Add a header sent with every request.
         *
         * @param name the header name
         * @param value the header value
         * @return this builder
         * @see #withDefaultHeaders(Map)
         */
        public ConfigBuilder withDefaultHeader(String name, String value) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Header name must not be empty");
            }
            Objects.requireNonNull(value, "Header value can't be null");
            this.defaultHeaders.put(name, value);
            return this;
        }

        /**
         * Set the deadline of a single request, measured from submission to the complete response. A request that misses it fails with
         * {@link io.graphhttp.driver.exceptions.ErrorKind#TIMEOUT}. Zero or a negative value disables the deadline.
         * <p>
         * Default value is 60 seconds.
         *
         * @param value the timeout duration
         * @param unit the unit in which duration is given
         * @return this builder
         */
        public ConfigBuilder withRequestTimeout(long value, TimeUnit unit) {
            this.requestTimeoutMillis = value <= 0 ? 0 : unit.toMillis(value);
            return this;
        }

        /**
         * Configure socket connection timeout.
         * <p>
         * A timeout of zero is treated as an infinite timeout and will be bound by the timeout configured on the
         * operating system level. Default value is 30 seconds.
         *
         * @param value the timeout duration
         * @param unit the unit in which duration is given
         * @return this builder
         * @throws IllegalArgumentException when given value is negative or does not fit in {@code int} when
         * converted to milliseconds.
         */
        public ConfigBuilder withConnectionTimeout(long value, TimeUnit unit) {
            var connectionTimeoutMillis = unit.toMillis(value);
            if (connectionTimeoutMillis < 0) {
                throw new IllegalArgumentException(
                        format("The connection timeout may not be smaller than 0, but was %d %s.", value, unit));
            }
            var connectionTimeoutMillisInt = (int) connectionTimeoutMillis;
            if (connectionTimeoutMillisInt != connectionTimeoutMillis) {
                throw new IllegalArgumentException(format(
                        "The connection timeout must represent int value when converted to milliseconds %d.",
                        connectionTimeoutMillis));
            }
            this.connectionTimeoutMillis = connectionTimeoutMillisInt;
            return this;
        }

        /**
         * Configure the maximum amount of connections in the connection pool. Requests wait for a free
         * connection at most {@link #withConnectionAcquisitionTimeout(long, TimeUnit)} when the limit is reached.
         * <p>
         * Default value is 100. Negative values mean the pool is unbounded.
         *
         * @param value the maximum connection pool size.
         * @return this builder
         * @throws IllegalArgumentException when given value is zero
         */
        public ConfigBuilder withMaxConnectionPoolSize(int value) {
            if (value == 0) {
                throw new IllegalArgumentException("Zero value is not supported");
            } else if (value < 0) {
                this.maxConnectionPoolSize = Integer.MAX_VALUE;
            } else {
                this.maxConnectionPoolSize = value;
            }
            return this;
        }

        /**
         * Configure the maximum amount of time a request waits for a connection from the pool. A request failing to get one in time fails
         * with {@link io.graphhttp.driver.exceptions.ErrorKind#TIMEOUT}.
         * <p>
         * Default value is 60 seconds. Negative values mean waiting forever.
         *
         * @param value the acquisition timeout
         * @param unit the unit in which the duration is given
         * @return this builder
         */
        public ConfigBuilder withConnectionAcquisitionTimeout(long value, TimeUnit unit) {
            var valueInMillis = unit.toMillis(value);
            if (value >= 0) {
                this.connectionAcquisitionTimeoutMillis = valueInMillis;
            } else {
                this.connectionAcquisitionTimeoutMillis = -1;
            }
            return this;
        }

        /**
         * Send all requests through the given HTTP proxy.
         *
         * @param host the proxy host
         * @param port the proxy port
         * @return this builder
         */
        public ConfigBuilder withProxy(String host, int port) {
            this.proxyAddress = ServerAddress.of(host, port);
            return this;
        }

        /**
         * Configure the event loop thread count. This specifies how many threads the client can use to handle network I/O events
         * and user's events in client's I/O threads. By default, 2 * NumberOfProcessors amount of threads will be used instead.
         *
         * @param size the thread count.
         * @return this builder.
         * @throws IllegalArgumentException if the value of the size is set to a number that is less than 1.
         */
        public ConfigBuilder withEventLoopThreads(int size) {
            if (size < 1) {
                throw new IllegalArgumentException(
                        format("The event loop thread may not be smaller than 1, but was %d.", size));
            }
            this.eventLoopThreads = size;
            return this;
        }

        /**
         * Configure the user_agent field sent to the server to identify the connected client.
         *
         * @param userAgent the string to configure user_agent.
         * @return this builder.
         */
        public ConfigBuilder withUserAgent(String userAgent) {
            if (userAgent == null || userAgent.isEmpty()) {
                throw new IllegalArgumentException("The user_agent string must not be empty");
            }
            this.userAgent = userAgent;
            return this;
        }

        /**
         * Create a config instance from this builder.
         *
         * @return a new {@link Config} instance.
         */
        public Config build() {
            return new Config(this);
        }
    }
}
