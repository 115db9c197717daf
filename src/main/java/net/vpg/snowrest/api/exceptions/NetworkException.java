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
import java.io.IOException;

/**
 * Indicates that no response could be received, after all attempts were used up.
 */
public class NetworkException extends RestException {
    public NetworkException(@Nonnull Route.CompiledRoute route, int attempts, @Nonnull IOException cause) {
        super(route, attempts, Helpers.format("I/O failure on %s after %d attempt(s): %s", route, attempts, cause.getMessage()), cause);
    }

    @Nonnull
    @Override
    public synchronized IOException getCause() {
        return (IOException) super.getCause();
    }
}
