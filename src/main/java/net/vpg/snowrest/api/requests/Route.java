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
package net.vpg.snowrest.api.requests;

import net.vpg.snowrest.internal.utils.Checks;
import net.vpg.snowrest.internal.utils.EncodingUtil;
import net.vpg.snowrest.internal.utils.Helpers;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import java.util.*;

import static net.vpg.snowrest.api.requests.Method.*;

@ParametersAreNonnullByDefault
public class Route {
    private final Method method;
    private final boolean requireAuth;
    private final String[] template;
    private final List<String> paramNames;

    private Route(Method method, String route, boolean requireAuth) {
        this.method = method;
        this.requireAuth = requireAuth;
        this.template = route.split("/");

        // Validate route syntax
        List<String> paramNames = new ArrayList<>();
        for (String element : this.template) {
            int opening = Helpers.countMatches(element, '{');
            int closing = Helpers.countMatches(element, '}');
            if (element.startsWith("{") && element.endsWith("}")) {
                // Ensure the brackets are only on the start and end
                // Valid: {guild_id}
                // Invalid: {guild_id}abc
                // Invalid: {{guild_id}}
                Checks.check(opening == 1 && closing == 1, "Route element has invalid syntax: '%s'", element);
                String name = element.substring(1, element.length() - 1);
                Checks.check(!paramNames.contains(name), "Route parameter '%s' is used more than once", name);
                paramNames.add(name);
            } else {
                Checks.check(opening == 0 && closing == 0, "Route element has invalid syntax: '%s'", element);
            }
        }
        this.paramNames = Collections.unmodifiableList(paramNames);
    }

    /**
     * Create a route template for the given HTTP method.
     *
     * <p>Route syntax should include valid argument placeholders of the format: {@code '{' argument_name '}'}
     * <br>The rate-limit handling relies on the names of major parameters, see {@link MajorParameters}.
     * By default these are:
     * <ul>
     *     <li>{@code channel_id} for channel routes</li>
     *     <li>{@code guild_id} for guild routes</li>
     *     <li>{@code webhook_id} for webhook routes</li>
     *     <li>{@code interaction_token} for interaction routes</li>
     * </ul>
     * <p>
     * For example, to compose the route to create a message in a channel:
     * <pre>{@code
     * Route route = Route.custom(Method.POST, "channels/{channel_id}/messages");
     * }</pre>
     *
     * <p>To compile the route, use {@link #compile(String...)} with the positional arguments.
     * <pre>{@code
     * Route.CompiledRoute compiled = route.compile(channelId);
     * }</pre>
     *
     * @param method      The HTTP method
     * @param route       The route template with valid argument placeholders
     * @param requireAuth Whether the authorization header should be sent with this route
     * @return The custom route template
     * @throws IllegalArgumentException If null is provided or the route is invalid (containing spaces or empty)
     */
    @Nonnull
    public static Route custom(Method method, String route, boolean requireAuth) {
        Checks.notNull(method, "Method");
        Checks.notEmpty(route, "Route");
        Checks.noWhitespace(route, "Route");
        return new Route(method, route, requireAuth);
    }

    /**
     * Create an authorized route template for the given HTTP method.
     *
     * @param method The HTTP method
     * @param route  The route template with valid argument placeholders
     * @return The custom route template
     * @throws IllegalArgumentException If null is provided or the route is invalid (containing spaces or empty)
     * @see #custom(Method, String, boolean)
     */
    @Nonnull
    public static Route custom(Method method, String route) {
        return custom(method, route, true);
    }

    @Nonnull
    public static Route delete(String route) {
        return custom(DELETE, route);
    }

    @Nonnull
    public static Route delete(String route, boolean requireAuth) {
        return custom(DELETE, route, requireAuth);
    }

    @Nonnull
    public static Route post(String route) {
        return custom(POST, route);
    }

    @Nonnull
    public static Route post(String route, boolean requireAuth) {
        return custom(POST, route, requireAuth);
    }

    @Nonnull
    public static Route put(String route) {
        return custom(PUT, route);
    }

    @Nonnull
    public static Route put(String route, boolean requireAuth) {
        return custom(PUT, route, requireAuth);
    }

    @Nonnull
    public static Route patch(String route) {
        return custom(PATCH, route);
    }

    @Nonnull
    public static Route patch(String route, boolean requireAuth) {
        return custom(PATCH, route, requireAuth);
    }

    @Nonnull
    public static Route get(String route) {
        return custom(GET, route);
    }

    @Nonnull
    public static Route get(String route, boolean requireAuth) {
        return custom(GET, route, requireAuth);
    }

    /**
     * The {@link Method} of this route template.
     * <br>Multiple routes with different HTTP methods can share a rate-limit.
     *
     * @return The HTTP method
     */
    @Nonnull
    public Method getMethod() {
        return method;
    }

    /**
     * The route template with argument placeholders.
     *
     * @return The route template
     */
    @Nonnull
    public String getRoute() {
        return String.join("/", template);
    }

    /**
     * The elements of the route template, split on {@code '/'}.
     *
     * @return Immutable list of template elements
     */
    @Nonnull
    public List<String> getTemplateElements() {
        return Collections.unmodifiableList(Arrays.asList(template));
    }

    /**
     * The names of the placeholders in this route, in order of appearance.
     *
     * @return Immutable list of parameter names
     */
    @Nonnull
    public List<String> getParamNames() {
        return paramNames;
    }

    /**
     * The number of parameters for this route, not including query parameters.
     *
     * @return The parameter count
     */
    public int getParamCount() {
        return paramNames.size();
    }

    public boolean isAuthorizationRequired() {
        return requireAuth;
    }

    /**
     * Compile the route with provided parameters.
     * <br>The number of parameters must match the number of placeholders in the route template.
     * The provided arguments are positional and will replace the placeholders of the template in order of appearance.
     *
     * <p>Use {@link CompiledRoute#withQueryParams(String...)} to add query parameters to the route.
     *
     * @param params The parameters to compile the route with
     * @return The compiled route, ready to use for rate-limit handling
     * @throws IllegalArgumentException If the number of parameters does not match the number of placeholders, or null is provided
     */
    @Nonnull
    public CompiledRoute compile(String... params) {
        Checks.noneNull(params, "Arguments");
        Checks.check(
            params.length == paramNames.size(),
            "Error Compiling Route: [%s], incorrect amount of parameters provided. Expected: %d, Provided: %d",
            this, paramNames.size(), params.length
        );

        StringJoiner compiledRoute = new StringJoiner("/");
        Map<String, String> values = new LinkedHashMap<>();

        int paramIndex = 0;
        for (String element : template) {
            if (element.charAt(0) == '{') {
                String encoded = EncodingUtil.encodeUTF8(params[paramIndex]);
                values.put(paramNames.get(paramIndex++), encoded);
                compiledRoute.add(encoded);
            } else {
                compiledRoute.add(element);
            }
        }

        return new CompiledRoute(this, compiledRoute.toString(), Collections.unmodifiableMap(values));
    }

    @Override
    public int hashCode() {
        return Objects.hash(method, Arrays.hashCode(template));
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Route))
            return false;

        Route oRoute = (Route) o;
        return method.equals(oRoute.method) && Arrays.equals(template, oRoute.template);
    }

    @Override
    public String toString() {
        return method + "/" + getRoute();
    }

    /**
     * A route compiled with arguments.
     *
     * @see Route#compile(String...)
     */
    public static class CompiledRoute {
        private final Route baseRoute;
        private final String compiledRoute;
        private final Map<String, String> params;
        private final List<String> query;

        private CompiledRoute(Route baseRoute, String compiledRoute, Map<String, String> params) {
            this.baseRoute = baseRoute;
            this.compiledRoute = compiledRoute;
            this.params = params;
            this.query = null;
        }

        private CompiledRoute(CompiledRoute original, List<String> query) {
            this.baseRoute = original.baseRoute;
            this.compiledRoute = original.compiledRoute;
            this.params = original.params;
            this.query = query;
        }

        /**
         * Returns a copy of this CompiledRoute with the provided parameters added as query.
         * <br>This will use <a href="https://en.wikipedia.org/wiki/Percent-encoding" target="_blank">percent-encoding</a>
         * for all provided <em>values</em> but not for the keys.
         *
         * <p><b>Example Usage</b><br>
         * <pre>{@code
         * Route.CompiledRoute history = Route.Messages.GET_MESSAGE_HISTORY.compile(channelId);
         *
         * // returns a new route
         * route = history.withQueryParams(
         *   "limit", "100"
         * );
         * // adds another parameter ontop of limit
         * route = route.withQueryParams(
         *   "after", messageId
         * );
         * }</pre>
         *
         * @param params The parameters to add as query, alternating key and value (see example)
         * @return A copy of this CompiledRoute with the provided parameters added as query
         * @throws IllegalArgumentException If the number of arguments is not even or null is provided
         */
        @Nonnull
        @CheckReturnValue
        public CompiledRoute withQueryParams(String... params) {
            Checks.notNull(params, "Params");
            Checks.check(params.length >= 2, "Params length must be at least 2");
            Checks.check((params.length % 2) == 0, "Params length must be a multiple of 2");

            List<String> newQuery = query == null ? new ArrayList<>() : new ArrayList<>(query);

            // Assuming names don't need encoding
            for (int i = 0; i < params.length; i += 2) {
                Checks.notEmpty(params[i], "Query key [" + i / 2 + "]");
                Checks.notNull(params[i + 1], "Query value [" + i / 2 + "]");
                newQuery.add(params[i] + '=' + EncodingUtil.encodeUTF8(params[i + 1]));
            }

            return new CompiledRoute(this, newQuery);
        }

        /**
         * Same as {@link #withQueryParams(String...)}, but pairs with a {@code null} value are left out.
         * <br>Non-null values are converted using {@link String#valueOf(Object)}.
         *
         * <pre>{@code
         * // only "limit=50" is appended
         * route.withOptionalQueryParams("limit", 50, "before", null);
         * }</pre>
         *
         * @param params The parameters to add as query, alternating key and value
         * @return A copy of this CompiledRoute with the defined parameters added as query,
         * or this instance if no value was defined
         * @throws IllegalArgumentException If the number of arguments is not even or a key is null or empty
         */
        @Nonnull
        @CheckReturnValue
        public CompiledRoute withOptionalQueryParams(@Nullable Object... params) {
            Checks.notNull(params, "Params");
            Checks.check((params.length % 2) == 0, "Params length must be a multiple of 2");

            List<String> defined = new ArrayList<>();
            for (int i = 0; i < params.length; i += 2) {
                Checks.check(params[i] instanceof String, "Query key [%d] must be a String", i / 2);
                if (params[i + 1] == null)
                    continue;
                defined.add((String) params[i]);
                defined.add(String.valueOf(params[i + 1]));
            }
            return defined.isEmpty() ? this : withQueryParams(defined.toArray(new String[0]));
        }

        /**
         * The compiled route string of the endpoint,
         * including all arguments and query parameters.
         *
         * @return The compiled route string of the endpoint
         */
        @Nonnull
        public String getCompiledRoute() {
            if (query == null)
                return compiledRoute;
            // Append query to url
            return compiledRoute + '?' + String.join("&", query);
        }

        /**
         * The encoded value of the given route parameter.
         *
         * @param name The placeholder name, without braces
         * @return The encoded value, or null if the route has no such parameter
         */
        @Nullable
        public String getParameter(String name) {
            return params.get(name);
        }

        /**
         * The encoded values of all route parameters, keyed by placeholder name in order of appearance.
         *
         * @return Immutable map of parameters
         */
        @Nonnull
        public Map<String, String> getParameters() {
            return params;
        }

        /**
         * The route template with the original placeholders.
         *
         * @return The route template with the original placeholders
         */
        @Nonnull
        public Route getBaseRoute() {
            return baseRoute;
        }

        /**
         * The HTTP method.
         *
         * @return The HTTP method
         */
        @Nonnull
        public Method getMethod() {
            return baseRoute.method;
        }

        @Override
        public int hashCode() {
            return (compiledRoute + baseRoute.method).hashCode();
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof CompiledRoute))
                return false;

            CompiledRoute oCompiled = (CompiledRoute) o;

            return baseRoute.equals(oCompiled.getBaseRoute()) && compiledRoute.equals(oCompiled.compiledRoute);
        }

        @Override
        public String toString() {
            return baseRoute.method + "/" + getCompiledRoute();
        }
    }

    public static class Emojis {
        public static final Route GET_GUILD_EMOJIS = get("guilds/{guild_id}/emojis");
        public static final Route GET_GUILD_EMOJI = get("guilds/{guild_id}/emojis/{emoji_id}");
        public static final Route CREATE_GUILD_EMOJI = post("guilds/{guild_id}/emojis");
        public static final Route MODIFY_GUILD_EMOJI = patch("guilds/{guild_id}/emojis/{emoji_id}");
        public static final Route DELETE_GUILD_EMOJI = delete("guilds/{guild_id}/emojis/{emoji_id}");

        public static final Route GET_APPLICATION_EMOJIS = get("applications/{application_id}/emojis");
        public static final Route GET_APPLICATION_EMOJI = get("applications/{application_id}/emojis/{emoji_id}");
        public static final Route CREATE_APPLICATION_EMOJI = post("applications/{application_id}/emojis");
        public static final Route MODIFY_APPLICATION_EMOJI = patch("applications/{application_id}/emojis/{emoji_id}");
        public static final Route DELETE_APPLICATION_EMOJI = delete("applications/{application_id}/emojis/{emoji_id}");
    }

    public static class Stickers {
        public static final Route GET_STICKER = get("stickers/{sticker_id}");
        public static final Route GET_GUILD_STICKERS = get("guilds/{guild_id}/stickers");
        public static final Route GET_GUILD_STICKER = get("guilds/{guild_id}/stickers/{sticker_id}");
        public static final Route CREATE_GUILD_STICKER = post("guilds/{guild_id}/stickers");
        public static final Route MODIFY_GUILD_STICKER = patch("guilds/{guild_id}/stickers/{sticker_id}");
        public static final Route DELETE_GUILD_STICKER = delete("guilds/{guild_id}/stickers/{sticker_id}");
    }

    public static class Channels {
        public static final Route GET_CHANNEL = get("channels/{channel_id}");
        public static final Route MODIFY_CHANNEL = patch("channels/{channel_id}");
        public static final Route DELETE_CHANNEL = delete("channels/{channel_id}");
        public static final Route SEND_TYPING = post("channels/{channel_id}/typing");
        public static final Route GET_PINNED_MESSAGES = get("channels/{channel_id}/pins");
        public static final Route ADD_PINNED_MESSAGE = put("channels/{channel_id}/pins/{message_id}");
        public static final Route REMOVE_PINNED_MESSAGE = delete("channels/{channel_id}/pins/{message_id}");
        public static final Route MODIFY_PERM_OVERRIDE = put("channels/{channel_id}/permissions/{permission_id}");
        public static final Route DELETE_PERM_OVERRIDE = delete("channels/{channel_id}/permissions/{permission_id}");
        public static final Route GET_CHANNEL_INVITES = get("channels/{channel_id}/invites");
        public static final Route CREATE_INVITE = post("channels/{channel_id}/invites");
        public static final Route ADD_RECIPIENT = put("channels/{channel_id}/recipients/{user_id}");
        public static final Route REMOVE_RECIPIENT = delete("channels/{channel_id}/recipients/{user_id}");
    }

    public static class Messages {
        public static final Route GET_MESSAGE_HISTORY = get("channels/{channel_id}/messages");
        public static final Route GET_MESSAGE = get("channels/{channel_id}/messages/{message_id}");
        public static final Route SEND_MESSAGE = post("channels/{channel_id}/messages");
        public static final Route EDIT_MESSAGE = patch("channels/{channel_id}/messages/{message_id}");
        public static final Route DELETE_MESSAGE = delete("channels/{channel_id}/messages/{message_id}");
        public static final Route DELETE_MESSAGES = post("channels/{channel_id}/messages/bulk-delete");

        public static final Route ADD_REACTION = put("channels/{channel_id}/messages/{message_id}/reactions/{reaction_code}/@me");
        public static final Route REMOVE_OWN_REACTION = delete("channels/{channel_id}/messages/{message_id}/reactions/{reaction_code}/@me");
        public static final Route REMOVE_REACTION = delete("channels/{channel_id}/messages/{message_id}/reactions/{reaction_code}/{user_id}");
        public static final Route GET_REACTION_USERS = get("channels/{channel_id}/messages/{message_id}/reactions/{reaction_code}");
        public static final Route REMOVE_ALL_REACTIONS = delete("channels/{channel_id}/messages/{message_id}/reactions");
    }

    public static class Guilds {
        public static final Route CREATE_GUILD = post("guilds");
        public static final Route GET_GUILD = get("guilds/{guild_id}");
        public static final Route MODIFY_GUILD = patch("guilds/{guild_id}");
        public static final Route DELETE_GUILD = delete("guilds/{guild_id}");
        public static final Route GET_CHANNELS = get("guilds/{guild_id}/channels");
        public static final Route CREATE_CHANNEL = post("guilds/{guild_id}/channels");
        public static final Route MODIFY_CHANNEL_POSITIONS = patch("guilds/{guild_id}/channels");

        public static final Route GET_MEMBER = get("guilds/{guild_id}/members/{user_id}");
        public static final Route GET_MEMBERS = get("guilds/{guild_id}/members");
        public static final Route ADD_MEMBER = put("guilds/{guild_id}/members/{user_id}");
        public static final Route MODIFY_MEMBER = patch("guilds/{guild_id}/members/{user_id}");
        public static final Route MODIFY_SELF = patch("guilds/{guild_id}/members/@me");
        public static final Route KICK_MEMBER = delete("guilds/{guild_id}/members/{user_id}");
        public static final Route ADD_MEMBER_ROLE = put("guilds/{guild_id}/members/{user_id}/roles/{role_id}");
        public static final Route REMOVE_MEMBER_ROLE = delete("guilds/{guild_id}/members/{user_id}/roles/{role_id}");

        public static final Route GET_BANS = get("guilds/{guild_id}/bans");
        public static final Route GET_BAN = get("guilds/{guild_id}/bans/{user_id}");
        public static final Route BAN = put("guilds/{guild_id}/bans/{user_id}");
        public static final Route UNBAN = delete("guilds/{guild_id}/bans/{user_id}");

        public static final Route GET_ROLES = get("guilds/{guild_id}/roles");
        public static final Route CREATE_ROLE = post("guilds/{guild_id}/roles");
        public static final Route MODIFY_ROLE_POSITIONS = patch("guilds/{guild_id}/roles");
        public static final Route MODIFY_ROLE = patch("guilds/{guild_id}/roles/{role_id}");
        public static final Route DELETE_ROLE = delete("guilds/{guild_id}/roles/{role_id}");

        public static final Route PRUNE_COUNT = get("guilds/{guild_id}/prune");
        public static final Route PRUNE = post("guilds/{guild_id}/prune");
        public static final Route GET_VOICE_REGIONS = get("guilds/{guild_id}/regions");
        public static final Route GET_INVITES = get("guilds/{guild_id}/invites");
        public static final Route GET_INTEGRATIONS = get("guilds/{guild_id}/integrations");
        public static final Route DELETE_INTEGRATION = delete("guilds/{guild_id}/integrations/{integration_id}");
    }

    public static class Webhooks {
        public static final Route CREATE_WEBHOOK = post("channels/{channel_id}/webhooks");
        public static final Route GET_CHANNEL_WEBHOOKS = get("channels/{channel_id}/webhooks");
        public static final Route GET_GUILD_WEBHOOKS = get("guilds/{guild_id}/webhooks");

        public static final Route GET_WEBHOOK = get("webhooks/{webhook_id}");
        public static final Route GET_TOKEN_WEBHOOK = get("webhooks/{webhook_id}/{webhook_token}", false);
        public static final Route MODIFY_WEBHOOK = patch("webhooks/{webhook_id}");
        public static final Route MODIFY_TOKEN_WEBHOOK = patch("webhooks/{webhook_id}/{webhook_token}", false);
        public static final Route DELETE_WEBHOOK = delete("webhooks/{webhook_id}");
        public static final Route DELETE_TOKEN_WEBHOOK = delete("webhooks/{webhook_id}/{webhook_token}", false);

        public static final Route EXECUTE_WEBHOOK = post("webhooks/{webhook_id}/{webhook_token}", false);
        public static final Route EXECUTE_WEBHOOK_SLACK = post("webhooks/{webhook_id}/{webhook_token}/slack", false);
        public static final Route GET_WEBHOOK_MESSAGE = get("webhooks/{webhook_id}/{webhook_token}/messages/{message_id}", false);
        public static final Route EDIT_WEBHOOK_MESSAGE = patch("webhooks/{webhook_id}/{webhook_token}/messages/{message_id}", false);
        public static final Route DELETE_WEBHOOK_MESSAGE = delete("webhooks/{webhook_id}/{webhook_token}/messages/{message_id}", false);
    }

    public static class Interactions {
        public static final Route GET_COMMANDS = get("applications/{application_id}/commands");
        public static final Route CREATE_COMMAND = post("applications/{application_id}/commands");
        public static final Route UPDATE_COMMANDS = put("applications/{application_id}/commands");
        public static final Route GET_COMMAND = get("applications/{application_id}/commands/{command_id}");
        public static final Route EDIT_COMMAND = patch("applications/{application_id}/commands/{command_id}");
        public static final Route DELETE_COMMAND = delete("applications/{application_id}/commands/{command_id}");

        public static final Route GET_GUILD_COMMANDS = get("applications/{application_id}/guilds/{guild_id}/commands");
        public static final Route CREATE_GUILD_COMMAND = post("applications/{application_id}/guilds/{guild_id}/commands");
        public static final Route UPDATE_GUILD_COMMANDS = put("applications/{application_id}/guilds/{guild_id}/commands");
        public static final Route GET_GUILD_COMMAND = get("applications/{application_id}/guilds/{guild_id}/commands/{command_id}");
        public static final Route EDIT_GUILD_COMMAND = patch("applications/{application_id}/guilds/{guild_id}/commands/{command_id}");
        public static final Route DELETE_GUILD_COMMAND = delete("applications/{application_id}/guilds/{guild_id}/commands/{command_id}");

        public static final Route GET_ALL_COMMAND_PERMISSIONS = get("applications/{application_id}/guilds/{guild_id}/commands/permissions");
        public static final Route GET_COMMAND_PERMISSIONS = get("applications/{application_id}/guilds/{guild_id}/commands/{command_id}/permissions");
        public static final Route EDIT_COMMAND_PERMISSIONS = put("applications/{application_id}/guilds/{guild_id}/commands/{command_id}/permissions");

        public static final Route CALLBACK = post("interactions/{interaction_id}/{interaction_token}/callback", false);
        public static final Route GET_ORIGINAL = get("webhooks/{application_id}/{interaction_token}/messages/@original", false);
        public static final Route EDIT_ORIGINAL = patch("webhooks/{application_id}/{interaction_token}/messages/@original", false);
        public static final Route DELETE_ORIGINAL = delete("webhooks/{application_id}/{interaction_token}/messages/@original", false);
        public static final Route CREATE_FOLLOWUP = post("webhooks/{application_id}/{interaction_token}", false);
        public static final Route GET_MESSAGE = get("webhooks/{application_id}/{interaction_token}/messages/{message_id}", false);
        public static final Route EDIT_MESSAGE = patch("webhooks/{application_id}/{interaction_token}/messages/{message_id}", false);
        public static final Route DELETE_MESSAGE = delete("webhooks/{application_id}/{interaction_token}/messages/{message_id}", false);
    }

    public static class ScheduledEvents {
        public static final Route GET_EVENTS = get("guilds/{guild_id}/scheduled-events");
        public static final Route CREATE_EVENT = post("guilds/{guild_id}/scheduled-events");
        public static final Route GET_EVENT = get("guilds/{guild_id}/scheduled-events/{event_id}");
        public static final Route MODIFY_EVENT = patch("guilds/{guild_id}/scheduled-events/{event_id}");
        public static final Route DELETE_EVENT = delete("guilds/{guild_id}/scheduled-events/{event_id}");
        public static final Route GET_EVENT_USERS = get("guilds/{guild_id}/scheduled-events/{event_id}/users");
    }

    public static class StageInstances {
        public static final Route CREATE_INSTANCE = post("stage-instances");
        public static final Route GET_INSTANCE = get("stage-instances/{channel_id}");
        public static final Route MODIFY_INSTANCE = patch("stage-instances/{channel_id}");
        public static final Route DELETE_INSTANCE = delete("stage-instances/{channel_id}");
    }

    public static class AutoModeration {
        public static final Route GET_RULES = get("guilds/{guild_id}/auto-moderation/rules");
        public static final Route CREATE_RULE = post("guilds/{guild_id}/auto-moderation/rules");
        public static final Route GET_RULE = get("guilds/{guild_id}/auto-moderation/rules/{rule_id}");
        public static final Route MODIFY_RULE = patch("guilds/{guild_id}/auto-moderation/rules/{rule_id}");
        public static final Route DELETE_RULE = delete("guilds/{guild_id}/auto-moderation/rules/{rule_id}");
    }

    public static class Templates {
        public static final Route GET_TEMPLATE = get("guilds/templates/{code}");
        public static final Route CREATE_GUILD_FROM_TEMPLATE = post("guilds/templates/{code}");
        public static final Route GET_GUILD_TEMPLATES = get("guilds/{guild_id}/templates");
        public static final Route CREATE_TEMPLATE = post("guilds/{guild_id}/templates");
        public static final Route SYNC_TEMPLATE = put("guilds/{guild_id}/templates/{code}");
        public static final Route MODIFY_TEMPLATE = patch("guilds/{guild_id}/templates/{code}");
        public static final Route DELETE_TEMPLATE = delete("guilds/{guild_id}/templates/{code}");
    }

    public static class Entitlements {
        public static final Route GET_ENTITLEMENTS = get("applications/{application_id}/entitlements");
        public static final Route CREATE_TEST_ENTITLEMENT = post("applications/{application_id}/entitlements");
        public static final Route GET_ENTITLEMENT = get("applications/{application_id}/entitlements/{entitlement_id}");
        public static final Route DELETE_TEST_ENTITLEMENT = delete("applications/{application_id}/entitlements/{entitlement_id}");
        public static final Route CONSUME_ENTITLEMENT = post("applications/{application_id}/entitlements/{entitlement_id}/consume");
    }

    public static class Skus {
        public static final Route GET_SKUS = get("applications/{application_id}/skus");
        public static final Route GET_SUBSCRIPTIONS = get("skus/{sku_id}/subscriptions");
        public static final Route GET_SUBSCRIPTION = get("skus/{sku_id}/subscriptions/{subscription_id}");
    }

    public static class AuditLogs {
        public static final Route GET_AUDIT_LOGS = get("guilds/{guild_id}/audit-logs");
    }

    public static class Invites {
        public static final Route GET_INVITE = get("invites/{code}");
        public static final Route DELETE_INVITE = delete("invites/{code}");
    }

    public static class Users {
        public static final Route GET_USER = get("users/{user_id}");
        public static final Route GET_SELF = get("users/@me");
        public static final Route MODIFY_SELF = patch("users/@me");
        public static final Route GET_GUILDS = get("users/@me/guilds");
        public static final Route LEAVE_GUILD = delete("users/@me/guilds/{guild_id}");
        public static final Route CREATE_PRIVATE_CHANNEL = post("users/@me/channels");
    }

    public static class Voice {
        public static final Route GET_VOICE_REGIONS = get("voice/regions");
    }

    public static class Bots {
        public static final Route GET_GATEWAY = get("gateway", false);
        public static final Route GET_BOT_GATEWAY = get("gateway/bot");
        public static final Route GET_APPLICATION_INFO = get("oauth2/applications/@me");
    }
}
