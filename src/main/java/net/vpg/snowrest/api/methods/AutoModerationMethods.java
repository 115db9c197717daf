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

public class AutoModerationMethods extends AbstractMethods {
    public AutoModerationMethods(@Nonnull SnowRest api) {
        super(api);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getAutoModerationRules(@Nonnull String guildId) {
        Checks.isSnowflake(guildId, "Guild ID");
        return get(Route.AutoModeration.GET_RULES.compile(guildId));
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getAutoModerationRule(@Nonnull String guildId, @Nonnull String ruleId) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.isSnowflake(ruleId, "Rule ID");
        return get(Route.AutoModeration.GET_RULE.compile(guildId, ruleId));
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> createAutoModerationRule(@Nonnull String guildId, @Nonnull Object data, @Nullable String reason) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.notNull(data, "Data");
        return send(Route.AutoModeration.CREATE_RULE.compile(guildId), data, reason);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> editAutoModerationRule(@Nonnull String guildId, @Nonnull String ruleId, @Nonnull Object data,
                                                       @Nullable String reason) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.isSnowflake(ruleId, "Rule ID");
        Checks.notNull(data, "Data");
        return send(Route.AutoModeration.MODIFY_RULE.compile(guildId, ruleId), data, reason);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> deleteAutoModerationRule(@Nonnull String guildId, @Nonnull String ruleId, @Nullable String reason) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.isSnowflake(ruleId, "Rule ID");
        return send(Route.AutoModeration.DELETE_RULE.compile(guildId, ruleId), reason);
    }
}
