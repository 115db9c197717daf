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
package net.vpg.snowrest.api.exceptions;

import net.vpg.snowrest.api.requests.Route;
import net.vpg.snowrest.internal.utils.Helpers;

import javax.annotation.Nonnull;

/**
 * Indicates that we received a {@code 429: Too Many Requests} response
 * and rate-limit retries are disabled or exhausted.
 */
public class RateLimitedException extends HttpException {
    private final long retryAfter;
    private final boolean global;

    public RateLimitedException(@Nonnull Route.CompiledRoute route, int attempts, @Nonnull String body, long retryAfter, boolean global) {
        super(route, attempts, 429, body, Helpers.format("The request was rate limited! Retry-After: %d ms, Global: %s, Route: %s",
            retryAfter, global, route.getBaseRoute()));
        this.retryAfter = retryAfter;
        this.global = global;
    }

    /**
     * The back-off delay in milliseconds that should be respected
     * before trying to query the route again
     *
     * @return The back-off delay in milliseconds
     */
    public long getRetryAfter() {
        return retryAfter;
    }

    public boolean isGlobal() {
        return global;
    }
}
