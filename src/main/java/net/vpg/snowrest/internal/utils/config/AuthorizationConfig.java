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
package net.vpg.snowrest.internal.utils.config;

import net.vpg.snowrest.internal.utils.Checks;

import javax.annotation.Nullable;

public final class AuthorizationConfig {
    private final String token;

    public AuthorizationConfig(@Nullable String token) {
        if (token != null) {
            Checks.notBlank(token, "Token");
            if (!token.startsWith("Bot ") && !token.startsWith("Bearer "))
                token = "Bot " + token;
            Checks.noWhitespace(token.substring(token.indexOf(' ') + 1), "Token");
        }
        this.token = token;
    }

    /**
     * The value of the authorization header.
     *
     * @return The prefixed token, or null for unauthenticated use
     */
    @Nullable
    public String getToken() {
        return token;
    }
}
