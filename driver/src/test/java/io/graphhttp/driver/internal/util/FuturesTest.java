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
package io.graphhttp.driver.internal.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.util.concurrent.DefaultPromise;
import io.netty.util.concurrent.ImmediateEventExecutor;
import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.junit.jupiter.api.Test;

class FuturesTest {
    @Test
    void shouldThrowInBlockingGetWhenFutureThrowsUncheckedException() {
        var error = new RuntimeException("Hello");

        var future = new CompletableFuture<String>();
        future.completeExceptionally(error);

        var e = assertThrows(Exception.class, () -> Futures.blockingGet(future));
        assertEquals(error, e);
    }

    @Test
    void shouldThrowInBlockingGetWhenFutureThrowsCheckedException() {
        var error = new IOException("Hello");

        var future = new CompletableFuture<String>();
        future.completeExceptionally(error);

        var e = assertThrows(CompletionException.class, () -> Futures.blockingGet(future));
        assertEquals(error, e.getCause());
    }

    @Test
    void shouldReturnFromBlockingGetWhenFutureCompletes() {
        var future = new CompletableFuture<String>();
        future.complete("Hello");

        assertEquals("Hello", Futures.blockingGet(future));
    }

    @Test
    void shouldKeepInterruptFlagInBlockingGet() {
        try {
            Thread.currentThread().interrupt();

            assertEquals("Hello", Futures.blockingGet(CompletableFuture.completedFuture("Hello")));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted(); // clear interruption status
        }
    }

    @Test
    void shouldGetCauseFromCompletionException() {
        var error = new RuntimeException("Hello");
        var completionException = new CompletionException(new CompletionException(error));

        assertEquals(error, Futures.completionExceptionCause(completionException));
    }

    @Test
    void shouldReturnSameExceptionWhenItIsNotCompletionException() {
        var error = new RuntimeException("Hello");

        assertEquals(error, Futures.completionExceptionCause(error));
    }

    @Test
    void shouldCompleteFutureFromConsumer() {
        var success = new CompletableFuture<String>();
        Futures.<String>futureCompletingConsumer(success).accept("Hello", null);
        assertEquals("Hello", success.join());

        var error = new IOException("Hello");
        var failure = new CompletableFuture<String>();
        Futures.<String>futureCompletingConsumer(failure).accept(null, error);
        var e = assertThrows(ExecutionException.class, failure::get);
        assertSame(error, e.getCause());
    }

    @Test
    void shouldReturnCompletedWithNull() {
        assertNull(Futures.completedWithNull().toCompletableFuture().join());
    }

    @Test
    void shouldConvertCompletedNettyFuture() {
        var channel = new EmbeddedChannel();
        try {
            var stage = Futures.asCompletionStage(channel.newSucceededFuture());

            assertNull(stage.toCompletableFuture().join());
        } finally {
            channel.finishAndReleaseAll();
        }
    }

    @Test
    void shouldConvertNettyFutureCompletedLater() throws Exception {
        var promise = new DefaultPromise<String>(ImmediateEventExecutor.INSTANCE);
        var stage = Futures.asCompletionStage(promise).toCompletableFuture();
        assertFalse(stage.isDone());

        promise.setSuccess("Hello");

        assertEquals("Hello", stage.get());
    }

    @Test
    void shouldConvertFailedNettyFuture() {
        var error = new IOException("Hello");
        var promise = new DefaultPromise<String>(ImmediateEventExecutor.INSTANCE);
        var stage = Futures.asCompletionStage(promise).toCompletableFuture();

        promise.setFailure(error);

        var e = assertThrows(ExecutionException.class, stage::get);
        assertSame(error, e.getCause());
    }
}
