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

import io.graphhttp.driver.exceptions.GraphException;
import io.graphhttp.driver.util.Immutable;
import java.util.Objects;
import java.util.function.Function;

/**
 * The terminal outcome of a call: exactly one of a successful value or a {@link GraphException}. A call never produces both and never
 * produces neither.
 *
 * @param <T> the type of the successful value
 * @since 1.0
 */
@Immutable
public final class Outcome<T> {
    private final T value;
    private final GraphException error;

    private Outcome(T value, GraphException error) {
        this.value = value;
        this.error = error;
    }

    /**
     * Create a successful outcome.
     *
     * @param value the value, may be {@code null} for operations without a result
     * @param <T> the type of the value
     * @return the outcome
     */
    public static <T> Outcome<T> success(T value) {
        return new Outcome<>(value, null);
    }

    /**
     * Create a failed outcome.
     *
     * @param error the error
     * @param <T> the type of the value the call would have produced
     * @return the outcome
     */
    public static <T> Outcome<T> failure(GraphException error) {
        return new Outcome<>(null, Objects.requireNonNull(error, "error"));
    }

    /**
     * @return {@code true} if this outcome holds a value
     */
    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @return {@code true} if this outcome holds an error
     */
    public boolean isFailure() {
        return error != null;
    }

    /**
     * Return the value of a successful outcome.
     *
     * @return the value
     * @throws IllegalStateException if this outcome is a failure
     */
    public T value() {
        if (error != null) {
            throw new IllegalStateException("Outcome is a failure: " + error.kind(), error);
        }
        return value;
    }

    /**
     * Return the error of a failed outcome.
     *
     * @return the error
     * @throws IllegalStateException if this outcome is a success
     */
    public GraphException error() {
        if (error == null) {
            throw new IllegalStateException("Outcome is a success");
        }
        return error;
    }

    /**
     * Return the value or throw the error.
     *
     * @return the value
     * @throws GraphException the error of a failed outcome
     */
    public T orElseThrow() {
        if (error != null) {
            throw error;
        }
        return value;
    }

    /**
     * Transform the value of a successful outcome. A failure is passed on unchanged.
     *
     * @param mapper the function to apply
     * @param <U> the new value type
     * @return the transformed outcome
     */
    public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
        return error == null ? success(mapper.apply(value)) : failure(error);
    }

    /**
     * Chain another step producing an outcome. A failure is passed on unchanged.
     *
     * @param mapper the function to apply
     * @param <U> the new value type
     * @return the outcome of the mapper or this failure
     */
    public <U> Outcome<U> flatMap(Function<? super T, Outcome<U>> mapper) {
        return error == null ? mapper.apply(value) : failure(error);
    }

    /**
     * Reduce this outcome to a single value.
     *
     * @param onSuccess applied to the value of a success
     * @param onFailure applied to the error of a failure
     * @param <R> the result type
     * @return the result of the applied function
     */
    public <R> R fold(Function<? super T, ? extends R> onSuccess, Function<? super GraphException, ? extends R> onFailure) {
        return error == null ? onSuccess.apply(value) : onFailure.apply(error);
    }

    @Override
    public String toString() {
        return error == null ? "Success{" + value + "}" : "Failure{" + error.kind() + ": " + error.getMessage() + "}";
    }
}
