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

/**
 * Guild templates, addressed by their template code.
 */
public class GuildTemplateMethods extends AbstractMethods {
    public GuildTemplateMethods(@Nonnull SnowRest api) {
        super(api);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getGuildTemplate(@Nonnull String code) {
        Checks.notBlank(code, "Template code");
        return get(Route.Templates.GET_TEMPLATE.compile(code));
    }

    /**
     * Creates a new guild based on a template.
     *
     * @param code The template code
     * @param name Name of the guild
     * @param icon Base64 image data of the guild icon, or null
     * @return {@link RestAction} resolving to the guild
     */
    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> createGuildFromGuildTemplate(@Nonnull String code, @Nonnull String name, @Nullable String icon) {
        Checks.notBlank(code, "Template code");
        Checks.notBlank(name, "Name");
        ObjectNode payload = object().put("name", name);
        if (icon != null)
            payload.put("icon", icon);
        return send(Route.Templates.CREATE_GUILD_FROM_TEMPLATE.compile(code), payload, null);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getGuildTemplates(@Nonnull String guildId) {
        Checks.isSnowflake(guildId, "Guild ID");
        return get(Route.Templates.GET_GUILD_TEMPLATES.compile(guildId));
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> createGuildTemplate(@Nonnull String guildId, @Nonnull String name, @Nullable String description) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.notBlank(name, "Name");
        ObjectNode payload = object().put("name", name);
        if (description != null)
            payload.put("description", description);
        return send(Route.Templates.CREATE_TEMPLATE.compile(guildId), payload, null);
    }

    /**
     * Updates the template to the current state of the guild.
     *
     * @param guildId The guild
     * @param code    The template code
     * @return {@link RestAction} resolving to the template
     */
    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> syncGuildTemplate(@Nonnull String guildId, @Nonnull String code) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.notBlank(code, "Template code");
        return send(Route.Templates.SYNC_TEMPLATE.compile(guildId, code), null);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> modifyGuildTemplate(@Nonnull String guildId, @Nonnull String code, @Nonnull Object data) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.notBlank(code, "Template code");
        Checks.notNull(data, "Data");
        return send(Route.Templates.MODIFY_TEMPLATE.compile(guildId, code), data, null);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> deleteGuildTemplate(@Nonnull String guildId, @Nonnull String code) {
        Checks.isSnowflake(guildId, "Guild ID");
        Checks.notBlank(code, "Template code");
        return send(Route.Templates.DELETE_TEMPLATE.compile(guildId, code), null);
    }
}
