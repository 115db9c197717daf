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
import net.vpg.snowrest.api.utils.FileUpload;
import net.vpg.snowrest.internal.utils.Checks;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;

/**
 * Application commands and interaction responses.
 *
 * <p>Responses and followup messages are addressed by the interaction token.
 * They are sent without the authorization header and are rate-limited per token.
 */
public class InteractionMethods extends AbstractMethods {
    public InteractionMethods(@Nonnull SnowRest api) {
        super(api);
    }

    // Global commands

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getApplicationCommands(@Nonnull String applicationId, boolean withLocalizations) {
        Checks.isSnowflake(applicationId, "Application ID");
        return get(Route.Interactions.GET_COMMANDS.compile(applicationId)
            .withOptionalQueryParams("with_localizations", withLocalizations ? "true" : null));
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> createApplicationCommand(@Nonnull String applicationId, @Nonnull Object data) {
        Checks.isSnowflake(applicationId, "Application ID");
        Checks.notNull(data, "Data");
        return send(Route.Interactions.CREATE_COMMAND.compile(applicationId), data, null);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getApplicationCommand(@Nonnull String applicationId, @Nonnull String commandId) {
        Checks.isSnowflake(applicationId, "Application ID");
        Checks.isSnowflake(commandId, "Command ID");
        return get(Route.Interactions.GET_COMMAND.compile(applicationId, commandId));
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> editApplicationCommand(@Nonnull String applicationId, @Nonnull String commandId, @Nonnull Object data) {
        Checks.isSnowflake(applicationId, "Application ID");
        Checks.isSnowflake(commandId, "Command ID");
        Checks.notNull(data, "Data");
        return send(Route.Interactions.EDIT_COMMAND.compile(applicationId, commandId), data, null);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> deleteApplicationCommand(@Nonnull String applicationId, @Nonnull String commandId) {
        Checks.isSnowflake(applicationId, "Application ID");
        Checks.isSnowflake(commandId, "Command ID");
        return send(Route.Interactions.DELETE_COMMAND.compile(applicationId, commandId), null);
    }

    /**
     * Replaces all global commands of the application.
     * <br>Commands missing from the list are deleted.
     *
     * @param applicationId The application
     * @param commands      The full list of commands
     * @return {@link RestAction} resolving to the array of commands
     */
    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> bulkOverwriteApplicationCommands(@Nonnull String applicationId, @Nonnull Collection<?> commands) {
        Checks.isSnowflake(applicationId, "Application ID");
        Checks.noneNull(commands, "Commands");
        return send(Route.Interactions.UPDATE_COMMANDS.compile(applicationId), commands, null);
    }

    // Guild commands

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getGuildApplicationCommands(@Nonnull String applicationId, @Nonnull String guildId, boolean withLocalizations) {
        Checks.isSnowflake(applicationId, "Application ID");
        Checks.isSnowflake(guildId, "Guild ID");
        return get(Route.Interactions.GET_GUILD_COMMANDS.compile(applicationId, guildId)
            .withOptionalQueryParams("with_localizations", withLocalizations ? "true" : null));
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> createGuildApplicationCommand(@Nonnull String applicationId, @Nonnull String guildId, @Nonnull Object data) {
        Checks.isSnowflake(applicationId, "Application ID");
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.notNull(data, "Data");
        return send(Route.Interactions.CREATE_GUILD_COMMAND.compile(applicationId, guildId), data, null);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getGuildApplicationCommand(@Nonnull String applicationId, @Nonnull String guildId, @Nonnull String commandId) {
        Checks.isSnowflake(applicationId, "Application ID");
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.isSnowflake(commandId, "Command ID");
        return get(Route.Interactions.GET_GUILD_COMMAND.compile(applicationId, guildId, commandId));
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> editGuildApplicationCommand(@Nonnull String applicationId, @Nonnull String guildId,
                                                            @Nonnull String commandId, @Nonnull Object data) {
        Checks.isSnowflake(applicationId, "Application ID");
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.isSnowflake(commandId, "Command ID");
        Checks.notNull(data, "Data");
        return send(Route.Interactions.EDIT_GUILD_COMMAND.compile(applicationId, guildId, commandId), data, null);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> deleteGuildApplicationCommand(@Nonnull String applicationId, @Nonnull String guildId, @Nonnull String commandId) {
        Checks.isSnowflake(applicationId, "Application ID");
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.isSnowflake(commandId, "Command ID");
        return send(Route.Interactions.DELETE_GUILD_COMMAND.compile(applicationId, guildId, commandId), null);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> bulkOverwriteGuildApplicationCommands(@Nonnull String applicationId, @Nonnull String guildId,
                                                                      @Nonnull Collection<?> commands) {
        Checks.isSnowflake(applicationId, "Application ID");
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.noneNull(commands, "Commands");
        return send(Route.Interactions.UPDATE_GUILD_COMMANDS.compile(applicationId, guildId), commands, null);
    }

    /**
     * Retrieves the command permissions of a guild.
     *
     * @param applicationId The application
     * @param guildId       The guild
     * @param commandId     A single command, or null for the permissions of all commands
     * @return {@link RestAction} resolving to the permissions, or an array of them if no command was given
     */
    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getGuildApplicationCommandPermissions(@Nonnull String applicationId, @Nonnull String guildId,
                                                                      @Nullable String commandId) {
        Checks.isSnowflake(applicationId, "Application ID");
        Checks.isSnowflake(guildId, "Guild ID");
        if (commandId == null)
            return get(Route.Interactions.GET_ALL_COMMAND_PERMISSIONS.compile(applicationId, guildId));
        Checks.isSnowflake(commandId, "Command ID");
        return get(Route.Interactions.GET_COMMAND_PERMISSIONS.compile(applicationId, guildId, commandId));
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> editGuildApplicationCommandPermissions(@Nonnull String applicationId, @Nonnull String guildId,
                                                                       @Nonnull String commandId, @Nonnull Collection<?> permissions) {
        Checks.isSnowflake(applicationId, "Application ID");
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.isSnowflake(commandId, "Command ID");
        Checks.noneNull(permissions, "Permissions");
        ObjectNode payload = object();
        payload.set("permissions", api.getRestConfig().getObjectMapper().valueToTree(permissions));
        return send(Route.Interactions.EDIT_COMMAND_PERMISSIONS.compile(applicationId, guildId, commandId), payload, null);
    }

    // Responses

    /**
     * Responds to an interaction.
     *
     * @param interactionId The interaction
     * @param token         The interaction token
     * @param data          The response, with its {@code type} and {@code data}
     * @param files         Attachments of the response message, or null
     * @return {@link RestAction}
     */
    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> createInteractionResponse(@Nonnull String interactionId, @Nonnull String token, @Nonnull Object data,
                                                          @Nullable Collection<? extends FileUpload> files) {
        Checks.isSnowflake(interactionId, "Interaction ID");
        Checks.notBlank(token, "Token");
        Checks.notNull(data, "Data");
        return sendWithFiles(Route.Interactions.CALLBACK.compile(interactionId, token), data, files, null);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> createInteractionResponse(@Nonnull String interactionId, @Nonnull String token, @Nonnull Object data) {
        return createInteractionResponse(interactionId, token, data, null);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getOriginalInteractionResponse(@Nonnull String applicationId, @Nonnull String token) {
        checkToken(applicationId, token);
        return get(Route.Interactions.GET_ORIGINAL.compile(applicationId, token));
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> editOriginalInteractionResponse(@Nonnull String applicationId, @Nonnull String token,
                                                                @Nullable Object data, @Nullable Collection<? extends FileUpload> files) {
        checkToken(applicationId, token);
        Checks.check(data != null || files != null && !files.isEmpty(), "Message edit requires data or at least one file");
        return sendWithFiles(Route.Interactions.EDIT_ORIGINAL.compile(applicationId, token), data, files, null);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> deleteOriginalInteractionResponse(@Nonnull String applicationId, @Nonnull String token) {
        checkToken(applicationId, token);
        return send(Route.Interactions.DELETE_ORIGINAL.compile(applicationId, token), null);
    }

    /**
     * Sends a followup message for an interaction.
     * <br>The API always waits for the message, so no {@code wait} parameter is sent.
     *
     * @param applicationId The application
     * @param token         The interaction token
     * @param data          The message payload, or null to send only files
     * @param files         The attachments, or null
     * @return {@link RestAction} resolving to the message
     */
    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> createFollowupMessage(@Nonnull String applicationId, @Nonnull String token,
                                                      @Nullable Object data, @Nullable Collection<? extends FileUpload> files) {
        checkToken(applicationId, token);
        Checks.check(data != null || files != null && !files.isEmpty(), "Followup message requires data or at least one file");
        return sendWithFiles(Route.Interactions.CREATE_FOLLOWUP.compile(applicationId, token), data, files, null);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getFollowupMessage(@Nonnull String applicationId, @Nonnull String token, @Nonnull String messageId) {
        checkMessage(applicationId, token, messageId);
        return get(Route.Interactions.GET_MESSAGE.compile(applicationId, token, messageId));
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> editFollowupMessage(@Nonnull String applicationId, @Nonnull String token, @Nonnull String messageId,
                                                    @Nullable Object data, @Nullable Collection<? extends FileUpload> files) {
        checkMessage(applicationId, token, messageId);
        Checks.check(data != null || files != null && !files.isEmpty(), "Message edit requires data or at least one file");
        return sendWithFiles(Route.Interactions.EDIT_MESSAGE.compile(applicationId, token, messageId), data, files, null);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> deleteFollowupMessage(@Nonnull String applicationId, @Nonnull String token, @Nonnull String messageId) {
        checkMessage(applicationId, token, messageId);
        return send(Route.Interactions.DELETE_MESSAGE.compile(applicationId, token, messageId), null);
    }

    private static void checkToken(String applicationId, String token) {
        Checks.isSnowflake(applicationId, "Application ID");
        Checks.notBlank(token, "Token");
    }

    private static void checkMessage(String applicationId, String token, String messageId) {
        checkToken(applicationId, token);
        Checks.isSnowflake(messageId, "Message ID");
    }
}
