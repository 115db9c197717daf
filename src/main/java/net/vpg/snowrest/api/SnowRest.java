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
package net.vpg.snowrest.api;

import com.fasterxml.jackson.databind.JsonNode;
import net.vpg.snowrest.api.exceptions.MalformedResponseException;
import net.vpg.snowrest.api.methods.*;
import net.vpg.snowrest.api.requests.*;
import net.vpg.snowrest.internal.requests.Requester;
import net.vpg.snowrest.internal.requests.RestActionImpl;
import net.vpg.snowrest.internal.utils.Checks;
import net.vpg.snowrest.internal.utils.IOUtil;
import net.vpg.snowrest.internal.utils.SnowLogger;
import net.vpg.snowrest.internal.utils.config.AuthorizationConfig;
import net.vpg.snowrest.internal.utils.config.ThreadingConfig;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.util.Map;

/**
 * Entry point of the library, one instance per credential.
 *
 * <p>Every request goes through {@link #request(Route.CompiledRoute, RestBody, Map)}, which returns a
 * {@link RestAction} resolving to the response body as JSON tree. The resource modules, like
 * {@link #getChannelMethods()}, only build routes and bodies for it.
 *
 * <p><b>Example</b>
 * <pre>{@code
 * SnowRest api = SnowRest.create("token");
 * api.getChannelMethods()
 *    .createMessage(channelId, Collections.singletonMap("content", "Hello"))
 *    .queue(message -> System.out.println(message.get("id")));
 * }</pre>
 */
public class SnowRest {
    public static final Logger LOG = SnowLogger.getLog(SnowRest.class);
    public static final int API_VERSION = 10;
    public static final String DEFAULT_BASE_URL = "https://discord.com/api/v" + API_VERSION + "/";
    public static final String DEFAULT_USER_AGENT = "DiscordBot (snowrest, 1.0.0)";

    protected final Requester requester;
    protected final AuthorizationConfig authorizationConfig;
    protected final ThreadingConfig threadingConfig;
    protected final RestConfig restConfig;
    protected final RestRateLimiter.GlobalRateLimit globalRateLimit;

    private final AssetMethods assetMethods;
    private final ChannelMethods channelMethods;
    private final GuildMethods guildMethods;
    private final WebhookMethods webhookMethods;
    private final AuditLogMethods auditLogMethods;
    private final InviteMethods inviteMethods;
    private final UserMethods userMethods;
    private final VoiceMethods voiceMethods;
    private final BotMethods botMethods;
    private final InteractionMethods interactionMethods;
    private final GuildScheduledEventMethods guildScheduledEventMethods;
    private final StageInstanceMethods stageInstanceMethods;
    private final AutoModerationMethods autoModerationMethods;
    private final GuildTemplateMethods guildTemplateMethods;
    private final EntitlementMethods entitlementMethods;
    private final SkuMethods skuMethods;

    public SnowRest(@Nonnull AuthorizationConfig authorizationConfig, @Nonnull ThreadingConfig threadingConfig, @Nonnull RestConfig restConfig) {
        Checks.notNull(authorizationConfig, "AuthorizationConfig");
        Checks.notNull(threadingConfig, "ThreadingConfig");
        Checks.notNull(restConfig, "RestConfig");
        this.authorizationConfig = authorizationConfig;
        this.threadingConfig = threadingConfig;
        this.restConfig = restConfig;
        this.globalRateLimit = RestRateLimiter.GlobalRateLimit.create();

        threadingConfig.init(this::getIdentifierString);
        OkHttpClient httpClient = restConfig.getHttpClient();
        if (httpClient == null)
            httpClient = IOUtil.newHttpClientBuilder().build();

        RestRateLimiter rateLimiter = restConfig.getRateLimiterFactory().apply(
            new RestRateLimiter.RateLimitConfig(
                threadingConfig.getRateLimitScheduler(),
                threadingConfig.getRateLimitElastic(),
                globalRateLimit,
                restConfig.isRelativeRateLimit(),
                restConfig.getRetryPolicy(),
                restConfig.getMajorParameters(),
                restConfig.getMaxConcurrentRequests(),
                RestListener.of(restConfig.getListeners())
            )
        );
        this.requester = new Requester(this, authorizationConfig, restConfig, rateLimiter, httpClient);

        this.assetMethods = new AssetMethods(this);
        this.channelMethods = new ChannelMethods(this);
        this.guildMethods = new GuildMethods(this);
        this.webhookMethods = new WebhookMethods(this);
        this.auditLogMethods = new AuditLogMethods(this);
        this.inviteMethods = new InviteMethods(this);
        this.userMethods = new UserMethods(this);
        this.voiceMethods = new VoiceMethods(this);
        this.botMethods = new BotMethods(this);
        this.interactionMethods = new InteractionMethods(this);
        this.guildScheduledEventMethods = new GuildScheduledEventMethods(this);
        this.stageInstanceMethods = new StageInstanceMethods(this);
        this.autoModerationMethods = new AutoModerationMethods(this);
        this.guildTemplateMethods = new GuildTemplateMethods(this);
        this.entitlementMethods = new EntitlementMethods(this);
        this.skuMethods = new SkuMethods(this);
    }

    /**
     * Creates an instance with default threading and REST configuration.
     *
     * @param token The bot token, prefixed with {@code Bot } if no prefix is given
     * @return The new instance
     */
    @Nonnull
    public static SnowRest create(@Nullable String token) {
        return new SnowRest(new AuthorizationConfig(token), ThreadingConfig.getDefault(), new RestConfig());
    }

    /**
     * Prepares a request on the provided route.
     * <br>The returned action resolves to the parsed response body,
     * or a {@link com.fasterxml.jackson.databind.node.MissingNode MissingNode} for an empty body.
     *
     * @param route   The compiled route
     * @param body    The request body, or null for none
     * @param headers Additional headers, or null
     * @return {@link RestAction} resolving to the response body
     */
    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> request(@Nonnull Route.CompiledRoute route, @Nullable RestBody body, @Nullable Map<String, String> headers) {
        return new RestActionImpl<JsonNode>(this, route, body, headers, (response, request) -> {
            try {
                return response.getJson(restConfig.getObjectMapper());
            } catch (IOException e) {
                throw new MalformedResponseException(route, request.getAttempts(), response.code, e);
            }
        });
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> request(@Nonnull Route.CompiledRoute route, @Nullable RestBody body) {
        return request(route, body, null);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> request(@Nonnull Route.CompiledRoute route) {
        return request(route, null, null);
    }

    /**
     * Stops accepting new requests and shuts down the owned thread pools once all queued requests are done.
     */
    public void shutdown() {
        requester.stop(false, threadingConfig::shutdown);
    }

    /**
     * Cancels all queued requests and shuts down the owned thread pools.
     */
    public void shutdownNow() {
        requester.cancelRequests();
        requester.stop(true, threadingConfig::shutdownNow);
    }

    @Nonnull
    public String getIdentifierString() {
        return "SnowRest";
    }

    @Nonnull
    public AuthorizationConfig getAuthorizationConfig() {
        return authorizationConfig;
    }

    @Nonnull
    public ThreadingConfig getThreadingConfig() {
        return threadingConfig;
    }

    @Nonnull
    public RestConfig getRestConfig() {
        return restConfig;
    }

    @Nonnull
    public Requester getRequester() {
        return requester;
    }

    @Nonnull
    public RestRateLimiter.GlobalRateLimit getGlobalRateLimit() {
        return globalRateLimit;
    }

    @Nonnull
    public AssetMethods getAssetMethods() {
        return assetMethods;
    }

    @Nonnull
    public ChannelMethods getChannelMethods() {
        return channelMethods;
    }

    @Nonnull
    public GuildMethods getGuildMethods() {
        return guildMethods;
    }

    @Nonnull
    public WebhookMethods getWebhookMethods() {
        return webhookMethods;
    }

    @Nonnull
    public AuditLogMethods getAuditLogMethods() {
        return auditLogMethods;
    }

    @Nonnull
    public InviteMethods getInviteMethods() {
        return inviteMethods;
    }

    @Nonnull
    public UserMethods getUserMethods() {
        return userMethods;
    }

    @Nonnull
    public VoiceMethods getVoiceMethods() {
        return voiceMethods;
    }

    @Nonnull
    public BotMethods getBotMethods() {
        return botMethods;
    }

    @Nonnull
    public InteractionMethods getInteractionMethods() {
        return interactionMethods;
    }

    @Nonnull
    public GuildScheduledEventMethods getGuildScheduledEventMethods() {
        return guildScheduledEventMethods;
    }

    @Nonnull
    public StageInstanceMethods getStageInstanceMethods() {
        return stageInstanceMethods;
    }

    @Nonnull
    public AutoModerationMethods getAutoModerationMethods() {
        return autoModerationMethods;
    }

    @Nonnull
    public GuildTemplateMethods getGuildTemplateMethods() {
        return guildTemplateMethods;
    }

    @Nonnull
    public EntitlementMethods getEntitlementMethods() {
        return entitlementMethods;
    }

    @Nonnull
    public SkuMethods getSkuMethods() {
        return skuMethods;
    }
}
