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

public class GuildScheduledEventMethods extends AbstractMethods {
    public static final int USERS_MIN_RESULTS = 1;
    public static final int USERS_MAX_RESULTS = 100;

    public GuildScheduledEventMethods(@Nonnull SnowRest api) {
        super(api);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> listGuildScheduledEvents(@Nonnull String guildId, boolean withUserCount) {
        Checks.isSnowflake(guildId, "Guild ID");
        return get(Route.ScheduledEvents.GET_EVENTS.compile(guildId)
            .withOptionalQueryParams("with_user_count", withUserCount ? "true" : null));
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> createGuildScheduledEvent(@Nonnull String guildId, @Nonnull Object data, @Nullable String reason) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.notNull(data, "Data");
        return send(Route.ScheduledEvents.CREATE_EVENT.compile(guildId), data, reason);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getGuildScheduledEvent(@Nonnull String guildId, @Nonnull String eventId, boolean withUserCount) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.isSnowflake(eventId, "Event ID");
        return get(Route.ScheduledEvents.GET_EVENT.compile(guildId, eventId)
            .withOptionalQueryParams("with_user_count", withUserCount ? "true" : null));
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> editGuildScheduledEvent(@Nonnull String guildId, @Nonnull String eventId, @Nonnull Object data,
                                                        @Nullable String reason) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.isSnowflake(eventId, "Event ID");
        Checks.notNull(data, "Data");
        return send(Route.ScheduledEvents.MODIFY_EVENT.compile(guildId, eventId), data, reason);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> deleteGuildScheduledEvent(@Nonnull String guildId, @Nonnull String eventId) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.isSnowflake(eventId, "Event ID");
        return send(Route.ScheduledEvents.DELETE_EVENT.compile(guildId, eventId), null);
    }

    /**
     * Retrieves the users subscribed to a scheduled event.
     *
     * @param guildId    The guild
     * @param eventId    The event
     * @param limit      Amount of users, 1 to 100, or null for the API default
     * @param withMember Whether to include the guild member of each user
     * @param before     Only users before this user ID, or null
     * @param after      Only users after this user ID, or null
     * @return {@link RestAction} resolving to an array of event users
     */
    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getGuildScheduledEventUsers(@Nonnull String guildId, @Nonnull String eventId, @Nullable Integer limit,
                                                            boolean withMember, @Nullable String before, @Nullable String after) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.isSnowflake(eventId, "Event ID");
        if (limit != null)
            Checks.inRange(limit, USERS_MIN_RESULTS, USERS_MAX_RESULTS, "Limit");
        Route.CompiledRoute route = Route.ScheduledEvents.GET_EVENT_USERS.compile(guildId, eventId)
            .withOptionalQueryParams("limit", limit, "with_member", withMember ? "true" : null, "before", before, "after", after);
        return get(route);
    }
}
