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

public class AuditLogMethods extends AbstractMethods {
    public static final int MAX_RESULTS = 100;

    public AuditLogMethods(@Nonnull SnowRest api) {
        super(api);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getAuditLog(@Nonnull String guildId) {
        return getAuditLog(guildId, null, null, null, null);
    }

    /**
     * Retrieves the audit log of a guild.
     *
     * @param guildId    The guild
     * @param userId     Only entries by this user, or null
     * @param actionType Only entries of this action type, or null
     * @param before     Only entries before this entry, or null
     * @param limit      Amount of entries, 1 to 100, or null for the API default
     * @return {@link RestAction} resolving to the audit log
     */
    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getAuditLog(@Nonnull String guildId, @Nullable String userId, @Nullable Integer actionType,
                                            @Nullable String before, @Nullable Integer limit) {
        Checks.isSnowflake(guildId, "Guild ID");
        if (limit != null)
            Checks.inRange(limit, 1, MAX_RESULTS, "Limit");
        Route.CompiledRoute route = Route.AuditLogs.GET_AUDIT_LOGS.compile(guildId)
            .withOptionalQueryParams("user_id", userId, "action_type", actionType, "before", before, "limit", limit);
        return get(route);
    }
}
