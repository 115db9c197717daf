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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import net.vpg.snowrest.api.SnowRest;
import net.vpg.snowrest.api.requests.RestAction;
import net.vpg.snowrest.api.requests.Route;
import net.vpg.snowrest.api.utils.FileUpload;
import net.vpg.snowrest.internal.utils.Checks;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;
import java.util.Collections;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Channels, messages, reactions, pins, permission overwrites and invites of channels.
 */
public class ChannelMethods extends AbstractMethods {
    public static final int MESSAGES_MIN_RESULTS = 1;
    public static final int MESSAGES_MAX_RESULTS = 100;
    public static final int DEFAULT_MESSAGES_LIMIT = 50;
    public static final int BULK_DELETE_MIN = 2;
    public static final int BULK_DELETE_MAX = 100;
    // Discord epoch plus two weeks
    private static final long BULK_DELETE_EPOCH = 1421280000000L;
    private static final Pattern CUSTOM_EMOJI = Pattern.compile("<a?:([a-zA-Z0-9_~-]+):(\\d{17,20})>");

    public ChannelMethods(@Nonnull SnowRest api) {
        super(api);
    }

    /**
     * Converts a custom emoji mention into the {@code name:id} form used by reaction routes.
     * <br>Unicode emoji are returned unchanged, the route takes care of the encoding.
     *
     * @param emoji The emoji
     * @return The reaction code
     */
    @Nonnull
    static String toReactionCode(@Nonnull String emoji) {
        Checks.notBlank(emoji, "Emoji");
        Matcher matcher = CUSTOM_EMOJI.matcher(emoji);
        return matcher.matches() ? matcher.group(1) + ":" + matcher.group(2) : emoji;
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getChannel(@Nonnull String channelId) {
        Checks.isSnowflake(channelId, "Channel ID");
        return get(Route.Channels.GET_CHANNEL.compile(channelId));
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> updateChannel(@Nonnull String channelId, @Nonnull Object data, @Nullable String reason) {
        Checks.isSnowflake(channelId, "Channel ID");
        Checks.notNull(data, "Data");
        return send(Route.Channels.MODIFY_CHANNEL.compile(channelId), data, reason);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> deleteChannel(@Nonnull String channelId, @Nullable String reason) {
        Checks.isSnowflake(channelId, "Channel ID");
        return send(Route.Channels.DELETE_CHANNEL.compile(channelId), reason);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getChannelMessages(@Nonnull String channelId) {
        return getChannelMessages(channelId, null, null, null, DEFAULT_MESSAGES_LIMIT);
    }

    /**
     * Retrieves messages of a channel.
     * <br>Only one of {@code around}, {@code before} and {@code after} is sent, in that order of priority.
     *
     * @param channelId The channel
     * @param around    Message to get messages around, or null
     * @param before    Message to get messages before, or null
     * @param after     Message to get messages after, or null
     * @param limit     Amount of messages, 1 to 100, or null for the API default
     * @return {@link RestAction} resolving to an array of messages
     * @throws IllegalArgumentException If the limit is out of range
     */
    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getChannelMessages(@Nonnull String channelId, @Nullable String around, @Nullable String before,
                                                   @Nullable String after, @Nullable Integer limit) {
        Checks.isSnowflake(channelId, "Channel ID");
        if (limit != null)
            Checks.inRange(limit, MESSAGES_MIN_RESULTS, MESSAGES_MAX_RESULTS, "Limit");
        if (around != null) {
            before = null;
            after = null;
        } else if (before != null) {
            after = null;
        }
        Route.CompiledRoute route = Route.Messages.GET_MESSAGE_HISTORY.compile(channelId)
            .withOptionalQueryParams("around", around, "before", before, "after", after, "limit", limit);
        return get(route);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getChannelMessage(@Nonnull String channelId, @Nonnull String messageId) {
        Checks.isSnowflake(channelId, "Channel ID");
        Checks.isSnowflake(messageId, "Message ID");
        return get(Route.Messages.GET_MESSAGE.compile(channelId, messageId));
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> createMessage(@Nonnull String channelId, @Nonnull String content) {
        Checks.notEmpty(content, "Content");
        return createMessage(channelId, object().put("content", content), Collections.emptyList());
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> createMessage(@Nonnull String channelId, @Nonnull Object data) {
        return createMessage(channelId, data, Collections.emptyList());
    }

    /**
     * Sends a message to a channel.
     * <br>With attachments the message is sent as {@code multipart/form-data},
     * the data as {@code payload_json} and the files as {@code files[n]}.
     *
     * @param channelId The channel
     * @param data      The message payload, or null to send only files
     * @param files     The attachments, or null
     * @return {@link RestAction} resolving to the created message
     */
    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> createMessage(@Nonnull String channelId, @Nullable Object data, @Nullable Collection<? extends FileUpload> files) {
        Checks.isSnowflake(channelId, "Channel ID");
        Checks.check(data != null || files != null && !files.isEmpty(), "Message requires data or at least one file");
        return sendWithFiles(Route.Messages.SEND_MESSAGE.compile(channelId), data, files, null);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> editMessage(@Nonnull String channelId, @Nonnull String messageId, @Nonnull String content) {
        Checks.notNull(content, "Content");
        return editMessage(channelId, messageId, object().put("content", content), Collections.emptyList());
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> editMessage(@Nonnull String channelId, @Nonnull String messageId, @Nullable Object data,
                                            @Nullable Collection<? extends FileUpload> files) {
        Checks.isSnowflake(channelId, "Channel ID");
        Checks.isSnowflake(messageId, "Message ID");
        Checks.check(data != null || files != null && !files.isEmpty(), "Message edit requires data or at least one file");
        return sendWithFiles(Route.Messages.EDIT_MESSAGE.compile(channelId, messageId), data, files, null);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> deleteMessage(@Nonnull String channelId, @Nonnull String messageId, @Nullable String reason) {
        Checks.isSnowflake(channelId, "Channel ID");
        Checks.isSnowflake(messageId, "Message ID");
        return send(Route.Messages.DELETE_MESSAGE.compile(channelId, messageId), reason);
    }

    /**
     * Deletes 2 to 100 messages at once.
     *
     * @param channelId The channel
     * @param messages  The message IDs, none older than two weeks
     * @param reason    The audit-log reason, or null
     * @return {@link RestAction}
     * @throws IllegalArgumentException If the amount is out of range or a message is older than two weeks
     */
    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> bulkDeleteMessages(@Nonnull String channelId, @Nonnull Collection<String> messages, @Nullable String reason) {
        Checks.isSnowflake(channelId, "Channel ID");
        Checks.noneNull(messages, "Messages");
        Checks.inRange(messages.size(), BULK_DELETE_MIN, BULK_DELETE_MAX, "Amount of messages");
        long oldest = (System.currentTimeMillis() - BULK_DELETE_EPOCH) << 22;
        ObjectNode data = object();
        ArrayNode ids = data.putArray("messages");
        for (String message : messages) {
            Checks.isSnowflake(message, "Message ID");
            Checks.check(Long.parseUnsignedLong(message) >= oldest,
                "The message %s is older than 2 weeks and may not be deleted using the bulk delete endpoint", message);
            ids.add(message);
        }
        return send(Route.Messages.DELETE_MESSAGES.compile(channelId), data, reason);
    }

    /**
     * Adds a reaction as the current user.
     *
     * @param channelId The channel
     * @param messageId The message
     * @param emoji     A unicode emoji, {@code name:id}, or a custom emoji mention
     * @return {@link RestAction}
     */
    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> createReaction(@Nonnull String channelId, @Nonnull String messageId, @Nonnull String emoji) {
        Checks.isSnowflake(channelId, "Channel ID");
        Checks.isSnowflake(messageId, "Message ID");
        return send(Route.Messages.ADD_REACTION.compile(channelId, messageId, toReactionCode(emoji)), null);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> deleteReactionSelf(@Nonnull String channelId, @Nonnull String messageId, @Nonnull String emoji) {
        Checks.isSnowflake(channelId, "Channel ID");
        Checks.isSnowflake(messageId, "Message ID");
        return send(Route.Messages.REMOVE_OWN_REACTION.compile(channelId, messageId, toReactionCode(emoji)), null);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> deleteReaction(@Nonnull String channelId, @Nonnull String messageId, @Nonnull String emoji, @Nonnull String userId) {
        Checks.isSnowflake(channelId, "Channel ID");
        Checks.isSnowflake(messageId, "Message ID");
        Checks.isSnowflake(userId, "User ID");
        return send(Route.Messages.REMOVE_REACTION.compile(channelId, messageId, toReactionCode(emoji), userId), null);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getReactions(@Nonnull String channelId, @Nonnull String messageId, @Nonnull String emoji) {
        Checks.isSnowflake(channelId, "Channel ID");
        Checks.isSnowflake(messageId, "Message ID");
        return get(Route.Messages.GET_REACTION_USERS.compile(channelId, messageId, toReactionCode(emoji)));
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> deleteAllReactions(@Nonnull String channelId, @Nonnull String messageId) {
        Checks.isSnowflake(channelId, "Channel ID");
        Checks.isSnowflake(messageId, "Message ID");
        return send(Route.Messages.REMOVE_ALL_REACTIONS.compile(channelId, messageId), null);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> editChannelPermission(@Nonnull String channelId, @Nonnull String permissionId, @Nonnull Object data, @Nullable String reason) {
        Checks.isSnowflake(channelId, "Channel ID");
        Checks.isSnowflake(permissionId, "Permission ID");
        Checks.notNull(data, "Data");
        return send(Route.Channels.MODIFY_PERM_OVERRIDE.compile(channelId, permissionId), data, reason);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> deleteChannelPermission(@Nonnull String channelId, @Nonnull String permissionId, @Nullable String reason) {
        Checks.isSnowflake(channelId, "Channel ID");
        Checks.isSnowflake(permissionId, "Permission ID");
        return send(Route.Channels.DELETE_PERM_OVERRIDE.compile(channelId, permissionId), reason);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getChannelInvites(@Nonnull String channelId) {
        Checks.isSnowflake(channelId, "Channel ID");
        return get(Route.Channels.GET_CHANNEL_INVITES.compile(channelId));
    }

    /**
     * Creates an invite for a channel.
     *
     * @param channelId The channel
     * @param data      The invite settings, or null for a permanent reusable invite valid for 24 hours
     * @param reason    The audit-log reason, or null
     * @return {@link RestAction} resolving to the invite
     */
    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> createChannelInvite(@Nonnull String channelId, @Nullable Object data, @Nullable String reason) {
        Checks.isSnowflake(channelId, "Channel ID");
        if (data == null) {
            data = object()
                .put("max_age", 86400)
                .put("max_uses", 0)
                .put("temporary", false)
                .put("unique", false);
        }
        return send(Route.Channels.CREATE_INVITE.compile(channelId), data, reason);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> startChannelTyping(@Nonnull String channelId) {
        Checks.isSnowflake(channelId, "Channel ID");
        return send(Route.Channels.SEND_TYPING.compile(channelId), null);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getChannelPinnedMessages(@Nonnull String channelId) {
        Checks.isSnowflake(channelId, "Channel ID");
        return get(Route.Channels.GET_PINNED_MESSAGES.compile(channelId));
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> addChannelPinnedMessage(@Nonnull String channelId, @Nonnull String messageId, @Nullable String reason) {
        Checks.isSnowflake(channelId, "Channel ID");
        Checks.isSnowflake(messageId, "Message ID");
        return send(Route.Channels.ADD_PINNED_MESSAGE.compile(channelId, messageId), reason);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> removeChannelPinnedMessage(@Nonnull String channelId, @Nonnull String messageId, @Nullable String reason) {
        Checks.isSnowflake(channelId, "Channel ID");
        Checks.isSnowflake(messageId, "Message ID");
        return send(Route.Channels.REMOVE_PINNED_MESSAGE.compile(channelId, messageId), reason);
    }

    /**
     * Adds a recipient to a group DM using their OAuth2 access token.
     *
     * @param channelId   The group DM
     * @param userId      The user to add
     * @param accessToken Access token of the user with the {@code gdm.join} scope
     * @param nick        Nickname of the user, or null
     * @return {@link RestAction}
     */
    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> addDmChannelRecipient(@Nonnull String channelId, @Nonnull String userId,
                                                      @Nonnull String accessToken, @Nullable String nick) {
        Checks.isSnowflake(channelId, "Channel ID");
        Checks.isSnowflake(userId, "User ID");
        Checks.notBlank(accessToken, "Access Token");
        ObjectNode data = object().put("access_token", accessToken);
        if (nick != null)
            data.put("nick", nick);
        return send(Route.Channels.ADD_RECIPIENT.compile(channelId, userId), data, null);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> removeDmChannelRecipient(@Nonnull String channelId, @Nonnull String userId) {
        Checks.isSnowflake(channelId, "Channel ID");
        Checks.isSnowflake(userId, "User ID");
        return send(Route.Channels.REMOVE_RECIPIENT.compile(channelId, userId), null);
    }
}
