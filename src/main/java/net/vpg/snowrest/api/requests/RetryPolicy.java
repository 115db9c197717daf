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

import net.vpg.snowrest.internal.utils.Checks;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Decides which failed requests are attempted again and how long to wait in between.
 *
 * <table>
 *     <caption>Classification</caption>
 *     <tr><th>Outcome</th><th>Behavior</th></tr>
 *     <tr><td>2xx, 304</td><td>{@link Outcome#SUCCESS}, no retry</td></tr>
 *     <tr><td>429</td><td>{@link Outcome#RATE_LIMITED}, retried after the reported delay, see {@link #setMaxRateLimitRetries(int)}</td></tr>
 *     <tr><td>5xx</td><td>{@link Outcome#SERVER_ERROR}, retried with exponential backoff</td></tr>
 *     <tr><td>I/O failure</td><td>{@link Outcome#NETWORK_ERROR}, retried with exponential backoff</td></tr>
 *     <tr><td>other 4xx</td><td>{@link Outcome#CLIENT_ERROR}, never retried</td></tr>
 *     <tr><td>other failures</td><td>{@link Outcome#UNEXPECTED_ERROR}, never retried</td></tr>
 * </table>
 *
 * <p>The backoff before the n-th retry is {@code min(maxBackoff, baseBackoff * 2^(n-1))}
 * plus a random jitter of up to {@code jitterRatio} of that delay.
 */
public class RetryPolicy {
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_BASE_BACKOFF = 500;
    public static final long DEFAULT_MAX_BACKOFF = TimeUnit.SECONDS.toMillis(30);
    public static final double DEFAULT_JITTER_RATIO = 0.25;

    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
    private long baseBackoff = DEFAULT_BASE_BACKOFF;
    private long maxBackoff = DEFAULT_MAX_BACKOFF;
    private double jitterRatio = DEFAULT_JITTER_RATIO;
    private int maxRateLimitRetries = -1;

    @Nonnull
    public static Outcome classify(@Nonnull RestResponse response) {
        if (response.isError())
            return response.getException() instanceof IOException ? Outcome.NETWORK_ERROR : Outcome.UNEXPECTED_ERROR;
        if (response.isOk())
            return Outcome.SUCCESS;
        if (response.isRateLimit())
            return Outcome.RATE_LIMITED;
        if (response.isServerError())
            return Outcome.SERVER_ERROR;
        return Outcome.CLIENT_ERROR;
    }

    /**
     * Whether a request should be sent again after a server or network error.
     *
     * @param failedAttempts The number of failed attempts so far, not counting rate-limited ones
     * @return True, if the attempt budget is not exhausted yet
     */
    public boolean shouldRetry(int failedAttempts) {
        return failedAttempts < maxAttempts;
    }

    /**
     * Whether a request should be sent again after it was rate-limited.
     *
     * @param rateLimitHits How often this request has been rate-limited, including the current response
     * @return True, if the request should be retried
     */
    public boolean shouldRetryRateLimit(int rateLimitHits) {
        return maxRateLimitRetries < 0 || rateLimitHits <= maxRateLimitRetries;
    }

    /**
     * The delay before the next attempt without jitter.
     *
     * @param failedAttempts The number of failed attempts so far, at least 1
     * @return The delay in milliseconds
     */
    public long getBaseDelay(int failedAttempts) {
        int exponent = Math.max(0, Math.min(failedAttempts - 1, 30));
        long delay = baseBackoff << exponent;
        return delay < 0 || delay > maxBackoff ? maxBackoff : delay;
    }

    /**
     * The delay before the next attempt including a random jitter.
     *
     * @param failedAttempts The number of failed attempts so far, at least 1
     * @return The delay in milliseconds
     */
    public long getBackoff(int failedAttempts) {
        long delay = getBaseDelay(failedAttempts);
        if (jitterRatio <= 0 || delay == 0)
            return delay;
        long jitter = (long) (delay * jitterRatio * ThreadLocalRandom.current().nextDouble());
        return delay + jitter;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * The number of attempts for a request failing with a server or network error.
     * <br>Default: {@value #DEFAULT_MAX_ATTEMPTS}
     *
     * @param maxAttempts The maximum attempts, 1 disables retries
     * @return The current RetryPolicy for chaining convenience
     */
    @Nonnull
    public RetryPolicy setMaxAttempts(int maxAttempts) {
        Checks.positive(maxAttempts, "Max attempts");
        this.maxAttempts = maxAttempts;
        return this;
    }

    public long getBaseBackoff() {
        return baseBackoff;
    }

    @Nonnull
    public RetryPolicy setBaseBackoff(long baseBackoff, @Nonnull TimeUnit unit) {
        Checks.notNegative(baseBackoff, "Base backoff");
        Checks.notNull(unit, "TimeUnit");
        this.baseBackoff = unit.toMillis(baseBackoff);
        return this;
    }

    public long getMaxBackoff() {
        return maxBackoff;
    }

    @Nonnull
    public RetryPolicy setMaxBackoff(long maxBackoff, @Nonnull TimeUnit unit) {
        Checks.notNegative(maxBackoff, "Max backoff");
        Checks.notNull(unit, "TimeUnit");
        this.maxBackoff = unit.toMillis(maxBackoff);
        return this;
    }

    public double getJitterRatio() {
        return jitterRatio;
    }

    /**
     * The upper bound of the random jitter added to each backoff, relative to the delay.
     * <br>Default: {@value #DEFAULT_JITTER_RATIO}
     *
     * @param jitterRatio The ratio between 0 and 1, 0 disables jitter
     * @return The current RetryPolicy for chaining convenience
     */
    @Nonnull
    public RetryPolicy setJitterRatio(double jitterRatio) {
        Checks.check(jitterRatio >= 0 && jitterRatio <= 1, "Jitter ratio must be between 0 and 1");
        this.jitterRatio = jitterRatio;
        return this;
    }

    public int getMaxRateLimitRetries() {
        return maxRateLimitRetries;
    }

    /**
     * How often a single request may be retried after a {@code 429} response.
     * <br>A negative value, the default, retries until the request succeeds or fails otherwise.
     * With {@code 0} the first rate-limit is surfaced as a {@link net.vpg.snowrest.api.exceptions.RateLimitedException}.
     *
     * @param maxRateLimitRetries The maximum number of rate-limit retries
     * @return The current RetryPolicy for chaining convenience
     */
    @Nonnull
    public RetryPolicy setMaxRateLimitRetries(int maxRateLimitRetries) {
        this.maxRateLimitRetries = maxRateLimitRetries;
        return this;
    }

    public enum Outcome {
        SUCCESS,
        RATE_LIMITED,
        SERVER_ERROR,
        NETWORK_ERROR,
        CLIENT_ERROR,
        UNEXPECTED_ERROR;

        public boolean isRetryable() {
            return this == SERVER_ERROR || this == NETWORK_ERROR;
        }
    }
}
