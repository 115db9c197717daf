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

import javax.annotation.Nonnull;
import java.util.Collections;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Interface used to handle requests to the REST API.
 * <br>Requests are handed to the rate-limiter as {@link Work} instances.
 *
 * @see RestConfig#setRateLimiterFactory(java.util.function.Function)
 */
public interface RestRateLimiter {
    /**
     * Number of seconds until the current rate-limit bucket resets, fractional.
     */
    String RESET_AFTER_HEADER = "X-RateLimit-Reset-After";
    /**
     * Epoch time in seconds at which the current rate-limit bucket resets.
     */
    String RESET_HEADER = "X-RateLimit-Reset";
    /**
     * The number of requests allowed per window of the bucket.
     */
    String LIMIT_HEADER = "X-RateLimit-Limit";
    /**
     * The number of requests left in the current window.
     */
    String REMAINING_HEADER = "X-RateLimit-Remaining";
    /**
     * Set to {@code true} on a {@code 429} caused by the global rate-limit.
     */
    String GLOBAL_HEADER = "X-RateLimit-Global";
    /**
     * The remote identifier of the bucket, shared by all routes of that bucket.
     */
    String HASH_HEADER = "X-RateLimit-Bucket";
    /**
     * Seconds to wait before retrying a rate-limited request.
     */
    String RETRY_AFTER_HEADER = "Retry-After";
    /**
     * The scope of a {@code 429}, one of {@code user}, {@code global} or {@code shared}.
     */
    String SCOPE_HEADER = "X-RateLimit-Scope";

    /**
     * Enqueue a new request.
     *
     * <p>Use {@link Work#getRoute()} to determine the correct bucket.
     *
     * @param task The {@link Work} to enqueue
     */
    void enqueue(@Nonnull Work task);

    /**
     * Removes a request that is still waiting in its queue, for example because its deadline passed.
     * <br>The next request of the bucket may proceed immediately.
     *
     * @param task The {@link Work} to remove
     * @return True, if the request was still queued
     */
    boolean dequeue(@Nonnull Work task);

    /**
     * Indication to stop accepting new requests.
     *
     * @param shutdown Whether to also cancel previously queued request
     * @param callback Function to call once all requests are completed, used for final cleanup
     */
    void stop(boolean shutdown, @Nonnull Runnable callback);

    /**
     * Whether the queue has stopped accepting new requests.
     *
     * @return True, if the queue is stopped
     */
    boolean isStopped();

    /**
     * Cancel all currently queued requests.
     *
     * @return The number of cancelled requests
     */
    int cancelRequests();

    /**
     * Type representing a pending request.
     *
     * <p>The rate-limiter is the only writer of the scheduling state on {@link #getRequest()}.
     */
    interface Work {
        /**
         * The {@link Route.CompiledRoute compiled route} of the request.
         * <br>This is primarily used to handle rate-limit buckets.
         *
         * @return The compiled route
         */
        @Nonnull
        Route.CompiledRoute getRoute();

        /**
         * The API instance which started the request.
         *
         * @return The API instance
         */
        @Nonnull
        SnowRest getApi();

        /**
         * The request descriptor, carrying attempt counters, retry time and lifecycle state.
         *
         * @return The request
         */
        @Nonnull
        RestRequest<?> getRequest();

        /**
         * Executes the request on the calling thread (blocking).
         * <br>This does not complete the request, use {@link #handleResponse(RestResponse)} with the result.
         *
         * @return The response, possibly an error response carrying the exception
         */
        @Nonnull
        RestResponse execute();

        /**
         * Completes the request with the provided final response.
         *
         * @param response The response
         */
        void handleResponse(@Nonnull RestResponse response);

        /**
         * Whether the request should be skipped.
         * <br>This can be caused by user cancellation, a passed deadline, or a failing check.
         * Skipped requests are completed as a side effect.
         *
         * @return True, if the request should be skipped
         */
        boolean isSkipped();

        /**
         * Whether the request has been completed or skipped.
         *
         * @return True, if the request is done
         */
        boolean isDone();

        /**
         * Whether the request has been cancelled by the user.
         *
         * @return True, if the request is cancelled
         */
        boolean isCancelled();

        /**
         * Cancel the request.
         * <br>Primarily used for {@link SnowRest#shutdownNow()}.
         */
        void cancel();
    }

    /**
     * Global rate-limit store.
     * <br>Timestamps are on the monotonic clock of {@link net.vpg.snowrest.internal.utils.Helpers#monotonicMillis()}.
     */
    interface GlobalRateLimit {
        /**
         * Create a default implementation of this interface.
         *
         * @return {@link GlobalRateLimit}
         */
        @Nonnull
        static GlobalRateLimit create() {
            return new GlobalRateLimit() {
                private final AtomicLong resetTime = new AtomicLong(-1);

                @Override
                public long getResetTime() {
                    return resetTime.get();
                }

                @Override
                public void setResetTime(long timestamp) {
                    resetTime.accumulateAndGet(timestamp, Math::max);
                }
            };
        }

        /**
         * The current global rate-limit reset time.
         *
         * @return The timestamp when the global rate-limit expires, or a past value if not limited
         */
        long getResetTime();

        /**
         * Set the current global rate-limit reset time.
         * <br>An earlier timestamp than the current one is ignored.
         *
         * @param timestamp The timestamp when the global rate-limit expires
         */
        void setResetTime(long timestamp);

        /**
         * The time until the global rate-limit expires.
         *
         * @param now The current time
         * @return Milliseconds until no longer limited, or 0 if not limited
         */
        default long getRemaining(long now) {
            return Math.max(0, getResetTime() - now);
        }
    }

    /**
     * Configuration for the rate-limiter.
     */
    class RateLimitConfig {
        private final ScheduledExecutorService scheduler;
        private final ExecutorService elastic;
        private final GlobalRateLimit globalRateLimit;
        private final boolean isRelative;
        private final RetryPolicy retryPolicy;
        private final MajorParameters majorParameters;
        private final int maxConcurrentRequests;
        private final RestListener listener;

        public RateLimitConfig(@Nonnull ScheduledExecutorService scheduler, @Nonnull ExecutorService elastic,
                               @Nonnull GlobalRateLimit globalRateLimit, boolean isRelative,
                               @Nonnull RetryPolicy retryPolicy, @Nonnull MajorParameters majorParameters,
                               int maxConcurrentRequests) {
            this(scheduler, elastic, globalRateLimit, isRelative, retryPolicy, majorParameters, maxConcurrentRequests,
                RestListener.of(Collections.emptyList()));
        }

        public RateLimitConfig(@Nonnull ScheduledExecutorService scheduler, @Nonnull ExecutorService elastic,
                               @Nonnull GlobalRateLimit globalRateLimit, boolean isRelative,
                               @Nonnull RetryPolicy retryPolicy, @Nonnull MajorParameters majorParameters,
                               int maxConcurrentRequests, @Nonnull RestListener listener) {
            this.scheduler = scheduler;
            this.elastic = elastic;
            this.globalRateLimit = globalRateLimit;
            this.isRelative = isRelative;
            this.retryPolicy = retryPolicy;
            this.majorParameters = majorParameters;
            this.maxConcurrentRequests = maxConcurrentRequests;
            this.listener = listener;
        }

        /**
         * The {@link ScheduledExecutorService} used to schedule rate-limit tasks.
         *
         * @return The {@link ScheduledExecutorService}
         */
        @Nonnull
        public ScheduledExecutorService getScheduler() {
            return scheduler;
        }

        /**
         * The elastic {@link ExecutorService} used to run bucket workers, which block on the network.
         *
         * @return The elastic {@link ExecutorService}
         */
        @Nonnull
        public ExecutorService getElastic() {
            return elastic;
        }

        /**
         * The global rate-limit store.
         *
         * @return The global rate-limit store
         */
        @Nonnull
        public GlobalRateLimit getGlobalRateLimit() {
            return globalRateLimit;
        }

        /**
         * Whether to use {@link #RESET_AFTER_HEADER}.
         * <br>This is primarily to avoid NTP sync issues.
         *
         * @return True, if {@link #RESET_AFTER_HEADER} should be used instead of {@link #RESET_HEADER}
         */
        public boolean isRelative() {
            return isRelative;
        }

        @Nonnull
        public RetryPolicy getRetryPolicy() {
            return retryPolicy;
        }

        @Nonnull
        public MajorParameters getMajorParameters() {
            return majorParameters;
        }

        /**
         * The maximum number of requests in flight across all buckets.
         *
         * @return The maximum, or 0 for no limit
         */
        public int getMaxConcurrentRequests() {
            return maxConcurrentRequests;
        }

        /**
         * The listener notified about rate-limits.
         *
         * @return The listener
         */
        @Nonnull
        public RestListener getListener() {
            return listener;
        }
    }
}
