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
package io.graphhttp.driver.exceptions;

import java.io.Serial;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * This is the base class for all failures reported by the driver. Each failure carries an {@link ErrorKind}, the database code when the database
 * reported one, the index of the failing statement when it can be derived, and an excerpt of the response for debugging.
 * <p>
 * Instances never contain request credentials.
 *
 * @since 1.0
 */
public abstract class GraphException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 7043289174605341857L;

    /**
     * Code used when the failure did not originate from a database error code.
     */
    public static final String UNKNOWN_CODE = "N/A";

    private static final String TRANSIENT_CODE_PREFIX = "Neo.TransientError.";
    private static final int NO_VALUE = -1;

    private final ErrorKind kind;
    private final String code;
    private final int statementIndex;
    private final int status;
    private final String responseExcerpt;

    /**
     * Creates a new instance.
     *
     * @param kind            the error kind
     * @param code            the database code or {@code null}
     * @param message         the message
     * @param statementIndex  the failing statement index or {@code null}
     * @param status          the response status or {@code null}
     * @param responseExcerpt the response excerpt or {@code null}
     * @param cause           the cause
     */
    protected GraphException(
            ErrorKind kind,
            String code,
            String message,
            Integer statementIndex,
            Integer status,
            String responseExcerpt,
            Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.code = code == null ? UNKNOWN_CODE : code;
        this.statementIndex = statementIndex == null ? NO_VALUE : statementIndex;
        this.status = status == null ? NO_VALUE : status;
        this.responseExcerpt = responseExcerpt;
    }

    /**
     * Returns the kind of this failure.
     *
     * @return the kind, never {@code null}
     */
    public ErrorKind kind() {
        return kind;
    }

    /**
     * Access the database status code for this exception. The database manual can provide further details on the available codes and their
     * meanings.
     *
     * @return textual code, such as "Neo.ClientError.Statement.SyntaxError", or {@value #UNKNOWN_CODE}
     */
    public String code() {
        return code;
    }

    /**
     * Index of the statement that failed within the submitted request.
     *
     * @return the index or empty if it could not be derived
     */
    public OptionalInt statementIndex() {
        return statementIndex == NO_VALUE ? OptionalInt.empty() : OptionalInt.of(statementIndex);
    }

    /**
     * The response status code, if a response was received.
     *
     * @return the status or empty
     */
    public OptionalInt status() {
        return status == NO_VALUE ? OptionalInt.empty() : OptionalInt.of(status);
    }

    /**
     * A truncated copy of the response body, if a response was received.
     *
     * @return the excerpt or empty
     */
    public Optional<String> responseExcerpt() {
        return Optional.ofNullable(responseExcerpt);
    }

    /**
     * Whether submitting the same request again may succeed.
     *
     * @return {@code true} for retryable kinds and for database errors of the transient class
     */
    public boolean isTransient() {
        return kind.isRetryable() || code.startsWith(TRANSIENT_CODE_PREFIX);
    }
}
