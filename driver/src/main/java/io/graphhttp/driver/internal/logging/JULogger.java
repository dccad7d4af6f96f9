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
import java.util.logging.Level;

/**
 * {@link Logger} writing to a {@link java.util.logging.Logger} of the same name. Debug maps to {@link Level#FINE}, trace to
 * {@link Level#FINEST}.
 */
public class JULogger implements Logger {
    private final java.util.logging.Logger delegate;

    public JULogger(String name, Level level) {
        delegate = java.util.logging.Logger.getLogger(name);
        delegate.setLevel(level);
    }

    @Override
    public void info(String message, Object... params) {
        log(Level.INFO, message, params);
    }

    @Override
    public void warn(String message, Object... params) {
        log(Level.WARNING, message, params);
    }

    @Override
    public void warn(String message, Throwable cause) {
        delegate.log(Level.WARNING, message, cause);
    }

    @Override
    public void debug(String message, Object... params) {
        log(Level.FINE, message, params);
    }

    @Override
    public void debug(String message, Throwable throwable) {
        delegate.log(Level.FINE, message, throwable);
    }

    @Override
    public void trace(String message, Object... params) {
        log(Level.FINEST, message, params);
    }

    @Override
    public boolean isDebugEnabled() {
        return delegate.isLoggable(Level.FINE);
    }

    private void log(Level level, String message, Object[] params) {
        if (delegate.isLoggable(level)) {
            delegate.log(level, String.format(message, params));
        }
    }
}
