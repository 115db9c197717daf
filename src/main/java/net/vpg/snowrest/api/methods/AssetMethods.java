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
import net.vpg.snowrest.api.requests.RestBody;
import net.vpg.snowrest.api.requests.Route;
import net.vpg.snowrest.api.utils.FileUpload;
import net.vpg.snowrest.internal.requests.Requester;
import net.vpg.snowrest.internal.utils.Checks;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Emojis and stickers of guilds, and emojis of applications.
 */
public class AssetMethods extends AbstractMethods {
    public AssetMethods(@Nonnull SnowRest api) {
        super(api);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getGuildEmojis(@Nonnull String guildId) {
        Checks.isSnowflake(guildId, "Guild ID");
        return get(Route.Emojis.GET_GUILD_EMOJIS.compile(guildId));
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getGuildEmoji(@Nonnull String guildId, @Nonnull String emojiId) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.isSnowflake(emojiId, "Emoji ID");
        return get(Route.Emojis.GET_GUILD_EMOJI.compile(guildId, emojiId));
    }

    /**
     * Creates an emoji in a guild.
     *
     * @param guildId The guild
     * @param data    The emoji, with {@code name}, {@code image} as data URI and optional {@code roles}
     * @param reason  The audit-log reason, or null
     * @return {@link RestAction} resolving to the created emoji
     */
    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> createGuildEmoji(@Nonnull String guildId, @Nonnull Object data, @Nullable String reason) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.notNull(data, "Data");
        return send(Route.Emojis.CREATE_GUILD_EMOJI.compile(guildId), data, reason);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> updateGuildEmoji(@Nonnull String guildId, @Nonnull String emojiId, @Nonnull Object data, @Nullable String reason) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.isSnowflake(emojiId, "Emoji ID");
        Checks.notNull(data, "Data");
        return send(Route.Emojis.MODIFY_GUILD_EMOJI.compile(guildId, emojiId), data, reason);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> deleteGuildEmoji(@Nonnull String guildId, @Nonnull String emojiId, @Nullable String reason) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.isSnowflake(emojiId, "Emoji ID");
        return send(Route.Emojis.DELETE_GUILD_EMOJI.compile(guildId, emojiId), reason);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getSticker(@Nonnull String stickerId) {
        Checks.isSnowflake(stickerId, "Sticker ID");
        return get(Route.Stickers.GET_STICKER.compile(stickerId));
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getGuildStickers(@Nonnull String guildId) {
        Checks.isSnowflake(guildId, "Guild ID");
        return get(Route.Stickers.GET_GUILD_STICKERS.compile(guildId));
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getGuildSticker(@Nonnull String guildId, @Nonnull String stickerId) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.isSnowflake(stickerId, "Sticker ID");
        return get(Route.Stickers.GET_GUILD_STICKER.compile(guildId, stickerId));
    }

    /**
     * Uploads a sticker to a guild.
     * <br>The sticker is sent as {@code multipart/form-data} with the fields {@code name}, {@code description},
     * {@code tags} and the image as {@code file}.
     *
     * @param guildId     The guild
     * @param name        The sticker name, 2 to 30 characters
     * @param description The description, or null
     * @param tags        The autocomplete tags
     * @param file        The PNG, APNG, GIF or Lottie JSON file
     * @param reason      The audit-log reason, or null
     * @return {@link RestAction} resolving to the created sticker
     */
    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> createGuildSticker(@Nonnull String guildId, @Nonnull String name, @Nullable String description,
                                                   @Nonnull String tags, @Nonnull FileUpload file, @Nullable String reason) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.notBlank(name, "Name");
        Checks.notBlank(tags, "Tags");
        Checks.notNull(file, "File");
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("name", name);
        fields.put("description", description == null ? "" : description);
        fields.put("tags", tags);
        return api.request(Route.Stickers.CREATE_GUILD_STICKER.compile(guildId), RestBody.form(fields, "file", file), Requester.reasonHeader(reason));
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> updateGuildSticker(@Nonnull String guildId, @Nonnull String stickerId, @Nonnull Object data, @Nullable String reason) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.isSnowflake(stickerId, "Sticker ID");
        Checks.notNull(data, "Data");
        return send(Route.Stickers.MODIFY_GUILD_STICKER.compile(guildId, stickerId), data, reason);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> deleteGuildSticker(@Nonnull String guildId, @Nonnull String stickerId, @Nullable String reason) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.isSnowflake(stickerId, "Sticker ID");
        return send(Route.Stickers.DELETE_GUILD_STICKER.compile(guildId, stickerId), reason);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getApplicationEmojis(@Nonnull String applicationId) {
        Checks.isSnowflake(applicationId, "Application ID");
        return get(Route.Emojis.GET_APPLICATION_EMOJIS.compile(applicationId));
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getApplicationEmoji(@Nonnull String applicationId, @Nonnull String emojiId) {
        Checks.isSnowflake(applicationId, "Application ID");
        Checks.isSnowflake(emojiId, "Emoji ID");
        return get(Route.Emojis.GET_APPLICATION_EMOJI.compile(applicationId, emojiId));
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> createApplicationEmoji(@Nonnull String applicationId, @Nonnull Object data) {
        Checks.isSnowflake(applicationId, "Application ID");
        Checks.notNull(data, "Data");
        return send(Route.Emojis.CREATE_APPLICATION_EMOJI.compile(applicationId), data, null);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> updateApplicationEmoji(@Nonnull String applicationId, @Nonnull String emojiId, @Nonnull Object data) {
        Checks.isSnowflake(applicationId, "Application ID");
        Checks.isSnowflake(emojiId, "Emoji ID");
        Checks.notNull(data, "Data");
        return send(Route.Emojis.MODIFY_APPLICATION_EMOJI.compile(applicationId, emojiId), data, null);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> deleteApplicationEmoji(@Nonnull String applicationId, @Nonnull String emojiId) {
        Checks.isSnowflake(applicationId, "Application ID");
        Checks.isSnowflake(emojiId, "Emoji ID");
        return send(Route.Emojis.DELETE_APPLICATION_EMOJI.compile(applicationId, emojiId), null);
    }
}
