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
import net.vpg.snowrest.internal.utils.Checks;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

public class UserMethods extends AbstractMethods {
    public static final int GUILDS_MAX_RESULTS = 200;

    public UserMethods(@Nonnull SnowRest api) {
        super(api);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getSelf() {
        return get(Route.Users.GET_SELF.compile());
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getUser(@Nonnull String userId) {
        Checks.isSnowflake(userId, "User ID");
        return get(Route.Users.GET_USER.compile(userId));
    }

    /**
     * Updates the current user.
     *
     * @param data Object with {@code username} and/or {@code avatar} as data URI
     * @return {@link RestAction} resolving to the updated user
     */
    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> updateSelf(@Nonnull Object data) {
        Checks.notNull(data, "Data");
        return send(Route.Users.MODIFY_SELF.compile(), data, null);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getGuilds() {
        return getGuilds(null, null, null);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getGuilds(@Nullable String before, @Nullable String after, @Nullable Integer limit) {
        if (limit != null)
            Checks.inRange(limit, 1, GUILDS_MAX_RESULTS, "Limit");
        return get(Route.Users.GET_GUILDS.compile().withOptionalQueryParams("before", before, "after", after, "limit", limit));
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> leaveGuild(@Nonnull String guildId) {
        Checks.isSnowflake(guildId, "Guild ID");
        return send(Route.Users.LEAVE_GUILD.compile(guildId), null);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> createDirectMessageChannel(@Nonnull String userId) {
        Checks.isSnowflake(userId, "User ID");
        return send(Route.Users.CREATE_PRIVATE_CHANNEL.compile(), object().put("recipient_id", userId), null);
    }
}
