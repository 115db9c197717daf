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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Base class of all failures reported for a request.
 */
public class RestException extends RuntimeException {
    private final Route.CompiledRoute route;
    private final int attempts;

    public RestException(@Nonnull Route.CompiledRoute route, int attempts, String message, @Nullable Throwable cause) {
        super(message, cause);
        this.route = route;
        this.attempts = attempts;
    }

    public RestException(@Nonnull Route.CompiledRoute route, int attempts, String message) {
        this(route, attempts, message, null);
    }

    /**
     * The route of the failed request.
     *
     * @return The compiled route
     */
    @Nonnull
    public Route.CompiledRoute getRoute() {
        return route;
    }

    /**
     * The number of network attempts made before this failure was reported.
     *
     * @return The attempt count
     */
    public int getAttempts() {
        return attempts;
    }
}
