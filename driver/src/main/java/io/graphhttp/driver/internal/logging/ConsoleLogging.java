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

import static java.time.format.DateTimeFormatter.ISO_LOCAL_DATE_TIME;

import io.graphhttp.driver.Logger;
import io.graphhttp.driver.Logging;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;

/**
 * Logging to {@code System.err} through a dedicated {@link ConsoleHandler}, one line per message.
 * Loggers created here do not propagate to the parent handlers of {@code java.util.logging}.
 *
 * @see Logging#console(Level)
 */
public class ConsoleLogging implements Logging {
    private final Level level;
    private Handler handler;

    public ConsoleLogging(Level level) {
        this.level = Objects.requireNonNull(level);
    }

    @Override
    public Logger getLog(String name) {
        // created first so the JUL logger configured below stays strongly referenced
        var logger = new JULogger(name, level);
        var julLogger = java.util.logging.Logger.getLogger(name);
        var consoleHandler = handler();
        synchronized (julLogger) {
            julLogger.setUseParentHandlers(false);
            for (var existing : julLogger.getHandlers()) {
                if (existing != consoleHandler) {
                    julLogger.removeHandler(existing);
                }
            }
            if (julLogger.getHandlers().length == 0) {
                julLogger.addHandler(consoleHandler);
            }
        }
        return logger;
    }

    private synchronized Handler handler() {
        if (handler == null) {
            handler = new ConsoleHandler();
            handler.setFormatter(new LineFormatter());
            handler.setLevel(level);
        }
        return handler;
    }

    private static class LineFormatter extends Formatter {
        @Override
        public String format(LogRecord record) {
            var line = new StringBuilder()
                    .append(LocalDateTime.now().format(ISO_LOCAL_DATE_TIME))
                    .append(' ')
                    .append(record.getLevel())
                    .append(" [")
                    .append(Thread.currentThread().getName())
                    .append("] ")
                    .append(record.getLoggerName())
                    .append(" - ")
                    .append(formatMessage(record));
            if (record.getThrown() != null) {
                var stackTrace = new StringWriter();
                try (var writer = new PrintWriter(stackTrace)) {
                    writer.println();
                    record.getThrown().printStackTrace(writer);
                }
                line.append(stackTrace);
            }
            return line.append(System.lineSeparator()).toString();
        }
    }
}
