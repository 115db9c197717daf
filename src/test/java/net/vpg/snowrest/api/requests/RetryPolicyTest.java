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

import okhttp3.Headers;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {
    private static RestResponse response(int code) {
        return new RestResponse(code, "", Headers.of(), null);
    }

    @Test
    void shouldClassifyResponses() {
        assertEquals(RetryPolicy.Outcome.SUCCESS, RetryPolicy.classify(response(200)));
        assertEquals(RetryPolicy.Outcome.SUCCESS, RetryPolicy.classify(response(204)));
        assertEquals(RetryPolicy.Outcome.RATE_LIMITED, RetryPolicy.classify(response(429)));
        assertEquals(RetryPolicy.Outcome.SERVER_ERROR, RetryPolicy.classify(response(502)));
        assertEquals(RetryPolicy.Outcome.CLIENT_ERROR, RetryPolicy.classify(response(404)));
        assertEquals(RetryPolicy.Outcome.NETWORK_ERROR, RetryPolicy.classify(new RestResponse(new IOException("reset"))));
        assertEquals(RetryPolicy.Outcome.UNEXPECTED_ERROR, RetryPolicy.classify(new RestResponse(new IllegalStateException())));
    }

    @Test
    void shouldOnlyRetryServerAndNetworkErrors() {
        assertTrue(RetryPolicy.Outcome.SERVER_ERROR.isRetryable());
        assertTrue(RetryPolicy.Outcome.NETWORK_ERROR.isRetryable());
        assertFalse(RetryPolicy.Outcome.CLIENT_ERROR.isRetryable());
        assertFalse(RetryPolicy.Outcome.UNEXPECTED_ERROR.isRetryable());
        assertFalse(RetryPolicy.Outcome.RATE_LIMITED.isRetryable());
    }

    @Test
    void shouldLimitAttempts() {
        RetryPolicy policy = new RetryPolicy();

        assertTrue(policy.shouldRetry(1));
        assertTrue(policy.shouldRetry(2));
        assertFalse(policy.shouldRetry(3));
        assertFalse(policy.setMaxAttempts(1).shouldRetry(1));
    }

    @Test
    void shouldGrowBackoffExponentiallyUpToMaximum() {
        RetryPolicy policy = new RetryPolicy()
            .setBaseBackoff(100, TimeUnit.MILLISECONDS)
            .setMaxBackoff(1, TimeUnit.SECONDS)
            .setJitterRatio(0);

        assertEquals(100, policy.getBackoff(1));
        assertEquals(200, policy.getBackoff(2));
        assertEquals(400, policy.getBackoff(3));
        assertEquals(800, policy.getBackoff(4));
        assertEquals(1000, policy.getBackoff(5));
        assertEquals(1000, policy.getBackoff(64));
    }

    @Test
    void shouldKeepJitterWithinRatio() {
        RetryPolicy policy = new RetryPolicy().setJitterRatio(0.5);

        for (int i = 0; i < 100; i++) {
            long backoff = policy.getBackoff(2);
            assertTrue(backoff >= 1000 && backoff <= 1500, "Backoff out of range: " + backoff);
        }
    }

    @Test
    void shouldBoundRateLimitRetriesWhenConfigured() {
        RetryPolicy policy = new RetryPolicy();
        assertTrue(policy.shouldRetryRateLimit(1_000));

        policy.setMaxRateLimitRetries(0);
        assertFalse(policy.shouldRetryRateLimit(1));

        policy.setMaxRateLimitRetries(2);
        assertTrue(policy.shouldRetryRateLimit(2));
        assertFalse(policy.shouldRetryRateLimit(3));
    }

    @Test
    void shouldRejectInvalidSettings() {
        RetryPolicy policy = new RetryPolicy();

        assertThrows(IllegalArgumentException.class, () -> policy.setMaxAttempts(0));
        assertThrows(IllegalArgumentException.class, () -> policy.setJitterRatio(1.5));
    }
}
