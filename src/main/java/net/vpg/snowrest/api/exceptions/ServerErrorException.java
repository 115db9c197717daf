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

/**
 * Indicates a {@code 5xx} response after all attempts were used up.
 */
public class ServerErrorException extends HttpException {
    public ServerErrorException(@Nonnull Route.CompiledRoute route, int attempts, int status, @Nonnull String body) {
        super(route, attempts, status, body);
    }
}
