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
 * Indicates that the server answered with an unsuccessful status code.
 */
public class HttpException extends RestException {
    private final int status;
    private final String body;

    public HttpException(@Nonnull Route.CompiledRoute route, int attempts, int status, @Nonnull String body, String message) {
        super(route, attempts, message);
        this.status = status;
        this.body = body;
    }

    public HttpException(@Nonnull Route.CompiledRoute route, int attempts, int status, @Nonnull String body) {
        this(route, attempts, status, body, Helpers.format("%d on %s after %d attempt(s): %s", status, route, attempts, body));
    }

    public int getStatus() {
        return status;
    }

    /**
     * The raw response body.
     *
     * @return The body, empty if there was none
     */
    @Nonnull
    public String getBody() {
        return body;
    }
}
