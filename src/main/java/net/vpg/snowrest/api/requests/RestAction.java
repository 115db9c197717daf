/*
 * Copyright 2015 Austin Keener, Michael Ritter, Florian Spieß, and the JDA contributors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package net.vpg.snowrest.api.requests;

import net.vpg.snowrest.api.SnowRest;
import net.vpg.snowrest.internal.utils.Checks;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * A request that has been prepared but not sent yet.
 *
 * <p>Nothing happens until one of the terminal operations is used:
 * <ul>
 *     <li>{@link #queue(Consumer, Consumer)} - asynchronous, with callbacks on the callback pool</li>
 *     <li>{@link #submit()} - asynchronous, returning a {@link CompletableFuture}</li>
 *     <li>{@link #complete()} - blocks the calling thread until the response arrived</li>
 * </ul>
 * Each terminal operation sends a new request, so an action can be reused.
 *
 * <p>Failures are reported as {@link net.vpg.snowrest.api.exceptions.RestException RestException},
 * {@link java.util.concurrent.TimeoutException TimeoutException} if the deadline passed,
 * or {@link java.util.concurrent.CancellationException CancellationException} if the request was cancelled.
 *
 * @param <T> The result type
 */
public interface RestAction<T> {
    /**
     * The API instance that created this action.
     *
     * @return The API instance
     */
    @Nonnull
    SnowRest getApi();

    /**
     * Sets the last-second checks before finally executing the http request in the queue.
     * <br>If the provided supplier evaluates to {@code false} or throws an exception, this will not be finished.
     * When an exception is thrown from the supplier it will be provided to the failure callback.
     *
     * @param checks The checks to run before executing the request, or {@code null} to run no checks
     * @return The current RestAction for chaining convenience
     */
    @Nonnull
    RestAction<T> setCheck(@Nullable BooleanSupplier checks);

    /**
     * The current checks for this RestAction.
     *
     * @return The current checks, or null if none were set
     */
    @Nullable
    default BooleanSupplier getCheck() {
        return null;
    }

    /**
     * Shortcut for {@code setCheck(() -> getCheck().getAsBoolean() && checks.getAsBoolean())}.
     *
     * @param checks Other checks to run
     * @return The current RestAction for chaining convenience
     */
    @Nonnull
    @CheckReturnValue
    default RestAction<T> addCheck(@Nonnull BooleanSupplier checks) {
        Checks.notNull(checks, "Checks");
        BooleanSupplier check = getCheck();
        return setCheck(() -> (check == null || check.getAsBoolean()) && checks.getAsBoolean());
    }

    /**
     * Timeout for this RestAction instance.
     * <br>If the request doesn't get completed within the timeout it fails with a
     * {@link java.util.concurrent.TimeoutException TimeoutException}.
     * A waiting request is removed from its queue, a running request is aborted.
     *
     * @param timeout The timeout to use
     * @param unit    {@link TimeUnit Unit} for the timeout value
     * @return The same RestAction instance with the applied timeout
     * @throws IllegalArgumentException If the provided unit is null
     */
    @Nonnull
    default RestAction<T> timeout(long timeout, @Nonnull TimeUnit unit) {
        Checks.notNull(unit, "TimeUnit");
        return deadline(timeout <= 0 ? 0 : System.currentTimeMillis() + unit.toMillis(timeout));
    }

    /**
     * Similar to {@link #timeout(long, TimeUnit)} but schedules a deadline at which the request has to be completed.
     *
     * @param timestamp Millisecond timestamp at which the request will timeout, or 0 for no deadline
     * @return The same RestAction with the applied deadline
     */
    @Nonnull
    RestAction<T> deadline(long timestamp);

    default void queue() {
        queue(null);
    }

    default void queue(@Nullable Consumer<? super T> success) {
        queue(success, null);
    }

    /**
     * Submits a Request for execution.
     *
     * @param success The success callback that will be called at a convenient time for the API. (can be null to use default)
     * @param failure The failure callback that will be called if the Request encounters an exception at its execution point. (can be null to use default)
     * @throws java.util.concurrent.RejectedExecutionException If the requester has been shut down
     */
    void queue(@Nullable Consumer<? super T> success, @Nullable Consumer<? super Throwable> failure);

    /**
     * Blocks the current Thread and awaits the completion of the request.
     *
     * @return The response value
     * @throws IllegalStateException If used within a callback thread
     */
    T complete();

    /**
     * Submits a Request for execution and provides a {@link CompletableFuture} representing its completion task.
     * <br>Cancelling the returned Future will result in the cancellation of the Request!
     *
     * @return Never-null {@link CompletableFuture} task representing the completion promise
     */
    @Nonnull
    CompletableFuture<T> submit();
}
