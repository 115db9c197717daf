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
import com.fasterxml.jackson.databind.node.ObjectNode;
import net.vpg.snowrest.api.SnowRest;
import net.vpg.snowrest.api.requests.RestAction;
import net.vpg.snowrest.api.requests.Route;
import net.vpg.snowrest.internal.utils.Checks;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

public class GuildMethods extends AbstractMethods {
    public static final int MEMBERS_MAX_RESULTS = 1000;
    public static final int MAX_DELETE_MESSAGE_SECONDS = 604800;

    public GuildMethods(@Nonnull SnowRest api) {
        super(api);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> createGuild(@Nonnull Object data) {
        Checks.notNull(data, "Data");
        return send(Route.Guilds.CREATE_GUILD.compile(), data, null);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getGuild(@Nonnull String guildId) {
        return getGuild(guildId, false);
    }

    /**
     * Retrieves a guild.
     *
     * @param guildId    The guild
     * @param withCounts Whether to include the approximate member and presence counts
     * @return {@link RestAction} resolving to the guild
     */
    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getGuild(@Nonnull String guildId, boolean withCounts) {
        Checks.isSnowflake(guildId, "Guild ID");
        return get(Route.Guilds.GET_GUILD.compile(guildId).withOptionalQueryParams("with_counts", withCounts ? "true" : null));
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> updateGuild(@Nonnull String guildId, @Nonnull Object data, @Nullable String reason) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.notNull(data, "Data");
        return send(Route.Guilds.MODIFY_GUILD.compile(guildId), data, reason);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> deleteGuild(@Nonnull String guildId) {
        Checks.isSnowflake(guildId, "Guild ID");
        return send(Route.Guilds.DELETE_GUILD.compile(guildId), null);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getGuildChannels(@Nonnull String guildId) {
        Checks.isSnowflake(guildId, "Guild ID");
        return get(Route.Guilds.GET_CHANNELS.compile(guildId));
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> createGuildChannel(@Nonnull String guildId, @Nonnull Object data, @Nullable String reason) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.notNull(data, "Data");
        return send(Route.Guilds.CREATE_CHANNEL.compile(guildId), data, reason);
    }

    /**
     * Updates the positions of channels.
     *
     * @param guildId The guild
     * @param data    Array of objects with {@code id} and {@code position}
     * @param reason  The audit-log reason, or null
     * @return {@link RestAction}
     */
    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> updateChannelPositions(@Nonnull String guildId, @Nonnull Object data, @Nullable String reason) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.notNull(data, "Data");
        return send(Route.Guilds.MODIFY_CHANNEL_POSITIONS.compile(guildId), data, reason);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getGuildMember(@Nonnull String guildId, @Nonnull String userId) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.isSnowflake(userId, "User ID");
        return get(Route.Guilds.GET_MEMBER.compile(guildId, userId));
    }

    /**
     * Retrieves members of a guild, sorted by user ID.
     *
     * @param guildId The guild
     * @param limit   Amount of members, 1 to 1000, or null for the API default
     * @param after   Highest user ID of the previous page, or null
     * @return {@link RestAction} resolving to an array of members
     */
    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getGuildMembers(@Nonnull String guildId, @Nullable Integer limit, @Nullable String after) {
        Checks.isSnowflake(guildId, "Guild ID");
        if (limit != null)
            Checks.inRange(limit, 1, MEMBERS_MAX_RESULTS, "Limit");
        return get(Route.Guilds.GET_MEMBERS.compile(guildId).withOptionalQueryParams("limit", limit, "after", after));
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> addGuildMember(@Nonnull String guildId, @Nonnull String userId, @Nonnull Object data) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.isSnowflake(userId, "User ID");
        Checks.notNull(data, "Data");
        return send(Route.Guilds.ADD_MEMBER.compile(guildId, userId), data, null);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> updateGuildMember(@Nonnull String guildId, @Nonnull String userId, @Nonnull Object data, @Nullable String reason) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.isSnowflake(userId, "User ID");
        Checks.notNull(data, "Data");
        return send(Route.Guilds.MODIFY_MEMBER.compile(guildId, userId), data, reason);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> updateSelf(@Nonnull String guildId, @Nonnull Object data, @Nullable String reason) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.notNull(data, "Data");
        return send(Route.Guilds.MODIFY_SELF.compile(guildId), data, reason);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> addGuildMemberRole(@Nonnull String guildId, @Nonnull String userId, @Nonnull String roleId, @Nullable String reason) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.isSnowflake(userId, "User ID");
        Checks.isSnowflake(roleId, "Role ID");
        return send(Route.Guilds.ADD_MEMBER_ROLE.compile(guildId, userId, roleId), reason);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> removeGuildMemberRole(@Nonnull String guildId, @Nonnull String userId, @Nonnull String roleId, @Nullable String reason) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.isSnowflake(userId, "User ID");
        Checks.isSnowflake(roleId, "Role ID");
        return send(Route.Guilds.REMOVE_MEMBER_ROLE.compile(guildId, userId, roleId), reason);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> removeGuildMember(@Nonnull String guildId, @Nonnull String userId, @Nullable String reason) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.isSnowflake(userId, "User ID");
        return send(Route.Guilds.KICK_MEMBER.compile(guildId, userId), reason);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getGuildBans(@Nonnull String guildId) {
        Checks.isSnowflake(guildId, "Guild ID");
        return get(Route.Guilds.GET_BANS.compile(guildId));
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getGuildBan(@Nonnull String guildId, @Nonnull String userId) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.isSnowflake(userId, "User ID");
        return get(Route.Guilds.GET_BAN.compile(guildId, userId));
    }

    /**
     * Bans a user from a guild.
     *
     * @param guildId              The guild
     * @param userId               The user
     * @param deleteMessageSeconds Seconds of messages to delete, 0 to 604800, or null to delete none
     * @param reason               The audit-log reason, or null
     * @return {@link RestAction}
     */
    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> createGuildBan(@Nonnull String guildId, @Nonnull String userId,
                                               @Nullable Integer deleteMessageSeconds, @Nullable String reason) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.isSnowflake(userId, "User ID");
        Route.CompiledRoute route = Route.Guilds.BAN.compile(guildId, userId);
        if (deleteMessageSeconds == null)
            return send(route, reason);
        Checks.inRange(deleteMessageSeconds, 0, MAX_DELETE_MESSAGE_SECONDS, "Delete message seconds");
        return send(route, object().put("delete_message_seconds", deleteMessageSeconds), reason);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> removeGuildBan(@Nonnull String guildId, @Nonnull String userId, @Nullable String reason) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.isSnowflake(userId, "User ID");
        return send(Route.Guilds.UNBAN.compile(guildId, userId), reason);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getGuildRoles(@Nonnull String guildId) {
        Checks.isSnowflake(guildId, "Guild ID");
        return get(Route.Guilds.GET_ROLES.compile(guildId));
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> createGuildRole(@Nonnull String guildId, @Nullable Object data, @Nullable String reason) {
        Checks.isSnowflake(guildId, "Guild ID");
        return send(Route.Guilds.CREATE_ROLE.compile(guildId), data, reason);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> updateGuildRolePositions(@Nonnull String guildId, @Nonnull Object data, @Nullable String reason) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.notNull(data, "Data");
        return send(Route.Guilds.MODIFY_ROLE_POSITIONS.compile(guildId), data, reason);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> updateGuildRole(@Nonnull String guildId, @Nonnull String roleId, @Nonnull Object data, @Nullable String reason) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.isSnowflake(roleId, "Role ID");
        Checks.notNull(data, "Data");
        return send(Route.Guilds.MODIFY_ROLE.compile(guildId, roleId), data, reason);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> removeGuildRole(@Nonnull String guildId, @Nonnull String roleId, @Nullable String reason) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.isSnowflake(roleId, "Role ID");
        return send(Route.Guilds.DELETE_ROLE.compile(guildId, roleId), reason);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getGuildPruneCount(@Nonnull String guildId, int days) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.inRange(days, 1, 30, "Days");
        return get(Route.Guilds.PRUNE_COUNT.compile(guildId).withQueryParams("days", Integer.toString(days)));
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> startGuildPrune(@Nonnull String guildId, int days, @Nullable String reason) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.inRange(days, 1, 30, "Days");
        ObjectNode data = object().put("days", days);
        return send(Route.Guilds.PRUNE.compile(guildId), data, reason);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getGuildVoiceRegions(@Nonnull String guildId) {
        Checks.isSnowflake(guildId, "Guild ID");
        return get(Route.Guilds.GET_VOICE_REGIONS.compile(guildId));
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getGuildInvites(@Nonnull String guildId) {
        Checks.isSnowflake(guildId, "Guild ID");
        return get(Route.Guilds.GET_INVITES.compile(guildId));
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getGuildIntegrations(@Nonnull String guildId) {
        Checks.isSnowflake(guildId, "Guild ID");
        return get(Route.Guilds.GET_INTEGRATIONS.compile(guildId));
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> removeGuildIntegration(@Nonnull String guildId, @Nonnull String integrationId, @Nullable String reason) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.isSnowflake(integrationId, "Integration ID");
        return send(Route.Guilds.DELETE_INTEGRATION.compile(guildId, integrationId), reason);
    }
}
