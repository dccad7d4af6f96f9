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

import io.graphhttp.driver.Logger;
import java.util.Objects;

/**
 * Passes fully formatted messages to SLF4J, the driver's templates use {@link String#format(String, Object...)} placeholders rather than
 * {@code {}}.
 */
class Slf4jLogger implements Logger {
    private final org.slf4j.Logger delegate;

    Slf4jLogger(org.slf4j.Logger delegate) {
        this.delegate = Objects.requireNonNull(delegate);
    }

    @Override
    public void info(String message, Object... params) {
        if (delegate.isInfoEnabled()) {
            delegate.info(String.format(message, params));
        }
    }

    @Override
    public void warn(String message, Object... params) {
        if (delegate.isWarnEnabled()) {
            delegate.warn(String.format(message, params));
        }
    }

    @Override
    public void warn(String message, Throwable cause) {
        delegate.warn(message, cause);
    }

    @Override
    public void debug(String message, Object... params) {
        if (delegate.isDebugEnabled()) {
            delegate.debug(String.format(message, params));
        }
    }

    @Override
    public void debug(String message, Throwable throwable) {
        delegate.debug(message, throwable);
    }

    @Override
    public void trace(String message, Object... params) {
        if (delegate.isTraceEnabled()) {
            delegate.trace(String.format(message, params));
        }
    }

    @Override
    public boolean isDebugEnabled() {
        return delegate.isDebugEnabled();
    }
}
