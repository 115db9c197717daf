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
import net.vpg.snowrest.api.utils.FileUpload;
import net.vpg.snowrest.internal.utils.Checks;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;

/**
 * Webhook management and execution.
 *
 * <p>Methods taking a webhook token use the token routes, which are sent without the authorization header.
 */
public class WebhookMethods extends AbstractMethods {
    public WebhookMethods(@Nonnull SnowRest api) {
        super(api);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> createWebhook(@Nonnull String channelId, @Nonnull Object data, @Nullable String reason) {
        Checks.isSnowflake(channelId, "Channel ID");
        Checks.notNull(data, "Data");
        return send(Route.Webhooks.CREATE_WEBHOOK.compile(channelId), data, reason);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getChannelWebhooks(@Nonnull String channelId) {
        Checks.isSnowflake(channelId, "Channel ID");
        return get(Route.Webhooks.GET_CHANNEL_WEBHOOKS.compile(channelId));
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getGuildWebhooks(@Nonnull String guildId) {
        Checks.isSnowflake(guildId, "Guild ID");
        return get(Route.Webhooks.GET_GUILD_WEBHOOKS.compile(guildId));
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getWebhook(@Nonnull String webhookId, @Nullable String token) {
        Checks.isSnowflake(webhookId, "Webhook ID");
        Route.CompiledRoute route = token == null
            ? Route.Webhooks.GET_WEBHOOK.compile(webhookId)
            : Route.Webhooks.GET_TOKEN_WEBHOOK.compile(webhookId, token);
        return get(route);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> updateWebhook(@Nonnull String webhookId, @Nullable String token, @Nonnull Object data, @Nullable String reason) {
        Checks.isSnowflake(webhookId, "Webhook ID");
        Checks.notNull(data, "Data");
        Route.CompiledRoute route = token == null
            ? Route.Webhooks.MODIFY_WEBHOOK.compile(webhookId)
            : Route.Webhooks.MODIFY_TOKEN_WEBHOOK.compile(webhookId, token);
        return send(route, data, reason);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> deleteWebhook(@Nonnull String webhookId, @Nullable String token, @Nullable String reason) {
        Checks.isSnowflake(webhookId, "Webhook ID");
        Route.CompiledRoute route = token == null
            ? Route.Webhooks.DELETE_WEBHOOK.compile(webhookId)
            : Route.Webhooks.DELETE_TOKEN_WEBHOOK.compile(webhookId, token);
        return send(route, reason);
    }

    /**
     * Executes a webhook.
     *
     * @param webhookId The webhook
     * @param token     The webhook token
     * @param data      The message payload, or null to send only files
     * @param files     The attachments, or null
     * @param wait      Whether to wait for the message to be created, the response is empty otherwise
     * @param threadId  Thread to send the message to, or null
     * @return {@link RestAction} resolving to the message if {@code wait} is true
     */
    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> executeWebhook(@Nonnull String webhookId, @Nonnull String token, @Nullable Object data,
                                               @Nullable Collection<? extends FileUpload> files, boolean wait, @Nullable String threadId) {
        Checks.isSnowflake(webhookId, "Webhook ID");
        Checks.notBlank(token, "Token");
        Checks.check(data != null || files != null && !files.isEmpty(), "Webhook message requires data or at least one file");
        Route.CompiledRoute route = Route.Webhooks.EXECUTE_WEBHOOK.compile(webhookId, token)
            .withOptionalQueryParams("wait", wait ? "true" : null, "thread_id", threadId);
        return sendWithFiles(route, data, files, null);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> executeWebhook(@Nonnull String webhookId, @Nonnull String token, @Nonnull Object data) {
        return executeWebhook(webhookId, token, data, null, false, null);
    }

    /**
     * Executes a webhook with a Slack compatible payload.
     *
     * @param webhookId The webhook
     * @param token     The webhook token
     * @param data      The Slack payload
     * @param wait      Whether to wait for the message to be created
     * @param threadId  Thread to send the message to, or null
     * @return {@link RestAction}
     */
    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> executeWebhookSlack(@Nonnull String webhookId, @Nonnull String token, @Nonnull Object data,
                                                    boolean wait, @Nullable String threadId) {
        Checks.isSnowflake(webhookId, "Webhook ID");
        Checks.notBlank(token, "Token");
        Checks.notNull(data, "Data");
        Route.CompiledRoute route = Route.Webhooks.EXECUTE_WEBHOOK_SLACK.compile(webhookId, token)
            .withOptionalQueryParams("wait", wait ? "true" : null, "thread_id", threadId);
        return send(route, data, null);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getWebhookMessage(@Nonnull String webhookId, @Nonnull String token, @Nonnull String messageId, @Nullable String threadId) {
        Checks.isSnowflake(webhookId, "Webhook ID");
        Checks.notBlank(token, "Token");
        Checks.isSnowflake(messageId, "Message ID");
        return get(Route.Webhooks.GET_WEBHOOK_MESSAGE.compile(webhookId, token, messageId)
            .withOptionalQueryParams("thread_id", threadId));
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> editWebhookMessage(@Nonnull String webhookId, @Nonnull String token, @Nonnull String messageId,
                                                   @Nullable Object data, @Nullable Collection<? extends FileUpload> files,
                                                   @Nullable String threadId) {
        Checks.isSnowflake(webhookId, "Webhook ID");
        Checks.notBlank(token, "Token");
        Checks.isSnowflake(messageId, "Message ID");
        Checks.check(data != null || files != null && !files.isEmpty(), "Webhook message edit requires data or at least one file");
        Route.CompiledRoute route = Route.Webhooks.EDIT_WEBHOOK_MESSAGE.compile(webhookId, token, messageId)
            .withOptionalQueryParams("thread_id", threadId);
        return sendWithFiles(route, data, files, null);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> deleteWebhookMessage(@Nonnull String webhookId, @Nonnull String token, @Nonnull String messageId, @Nullable String threadId) {
        Checks.isSnowflake(webhookId, "Webhook ID");
        Checks.notBlank(token, "Token");
        Checks.isSnowflake(messageId, "Message ID");
        return send(Route.Webhooks.DELETE_WEBHOOK_MESSAGE.compile(webhookId, token, messageId)
            .withOptionalQueryParams("thread_id", threadId), null);
    }
}
