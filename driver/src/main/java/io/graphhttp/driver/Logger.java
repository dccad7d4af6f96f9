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

/**
 * Logs messages for driver activity.
 * <p>
 * Some methods in this interface take a message template together with a list of parameters. These methods are expected to construct the final
 * message only if the needed logging level is enabled. Driver expects formatting to be done using {@link String#format(String, Object...)} method.
 * Thus all supplied message templates will contain "%s" as parameter placeholders. This is different from all SLF4J-compatible logging frameworks
 * where parameter placeholder is "{}". Implementations of this interface should adapt placeholders from "%s" to "{}", if required.
 */
public interface Logger {
    /**
     * Logs information from the driver.
     *
     * @param message the information message template.
     * @param params parameters used in the information message.
     */
    void info(String message, Object... params);

    /**
     * Logs warnings that happened when using the driver.
     *
     * @param message the warning message template.
     * @param params parameters used in the warning message.
     */
    void warn(String message, Object... params);

    /**
     * Logs warnings that happened during using the driver
     *
     * @param message the warning message
     * @param cause the cause of the warning
     */
    void warn(String message, Throwable cause);

    /**
     * Logs requests sent and responses received by this driver.
     * It is only enabled when {@link Logger#isDebugEnabled()} returns {@code true}.
     *
     * @param message the debug message template.
     * @param params parameters used in the debug message.
     */
    void debug(String message, Object... params);

    /**
     * Logs debug message with throwable.
     *
     * @param message the message
     * @param throwable the throwable
     */
    void debug(String message, Throwable throwable);

    /**
     * Logs channel level activity, such as connection acquisition and release. Implementations skip formatting when the level is disabled.
     *
     * @param message the trace message template.
     * @param params parameters used in the trace message.
     */
    void trace(String message, Object... params);

    /**
     * Return true if the debug level is enabled.
     *
     * @return true if the debug level is enabled.
     * @see Logger#debug(String, Object...)
     */
    boolean isDebugEnabled();
}
