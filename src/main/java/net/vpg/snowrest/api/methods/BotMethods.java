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
package net.vpg.snowrest.api.methods;

import com.fasterxml.jackson.databind.JsonNode;
import net.vpg.snowrest.api.SnowRest;
import net.vpg.snowrest.api.requests.RestAction;
import net.vpg.snowrest.api.requests.Route;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;

public class BotMethods extends AbstractMethods {
    public BotMethods(@Nonnull SnowRest api) {
        super(api);
    }

    /**
     * Retrieves the gateway URL, which requires no authorization.
     *
     * @return {@link RestAction} resolving to an object with the {@code url}
     */
    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getGateway() {
        return get(Route.Bots.GET_GATEWAY.compile());
    }

    /**
     * Retrieves the gateway URL with the recommended shard count and session start limits.
     *
     * @return {@link RestAction} resolving to the gateway information
     */
    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getGatewayBot() {
        return get(Route.Bots.GET_BOT_GATEWAY.compile());
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getApplicationInfo() {
        return get(Route.Bots.GET_APPLICATION_INFO.compile());
    }
}
