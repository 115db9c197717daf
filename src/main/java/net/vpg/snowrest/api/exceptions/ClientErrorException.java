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
import javax.annotation.Nullable;

/**
 * Indicates a {@code 4xx} response other than {@code 429}. These requests are never retried.
 */
public class ClientErrorException extends HttpException {
    private final int errorCode;
    private final String errorMessage;

    public ClientErrorException(@Nonnull Route.CompiledRoute route, int attempts, int status, @Nonnull String body,
                                int errorCode, @Nullable String errorMessage) {
        super(route, attempts, status, body, Helpers.format("%d: %s on %s", status,
            errorMessage == null ? body : errorCode + " " + errorMessage, route));
        this.errorCode = errorCode;
        this.errorMessage = errorMessage;
    }

    /**
     * The JSON error code sent by the API.
     *
     * @return The error code, or 0 if the body did not contain one
     */
    public int getErrorCode() {
        return errorCode;
    }

    @Nullable
    public String getErrorMessage() {
        return errorMessage;
    }
}
