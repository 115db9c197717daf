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
package net.vpg.snowrest.internal.requests.ratelimit;

import net.vpg.snowrest.api.requests.MajorParameters;
import net.vpg.snowrest.api.requests.Route;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RouteKeyResolverTest {
    private RouteKeyResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new RouteKeyResolver(MajorParameters.getDefault());
    }

    @Test
    void shouldKeepMajorValuesAndMinorPlaceholders() {
        Route.CompiledRoute route = Route.Messages.DELETE_MESSAGE.compile("123", "456");

        assertEquals("DELETE /channels/123/messages/{message_id}", resolver.resolve(route));
    }

    @Test
    void shouldShareKeyAcrossMinorParameters() {
        String first = resolver.resolve(Route.Messages.EDIT_MESSAGE.compile("1", "10"));
        String second = resolver.resolve(Route.Messages.EDIT_MESSAGE.compile("1", "20"));
        String otherChannel = resolver.resolve(Route.Messages.EDIT_MESSAGE.compile("2", "10"));

        assertEquals(first, second);
        assertNotEquals(first, otherChannel);
    }

    @Test
    void shouldSeparateMethods() {
        String get = resolver.resolve(Route.Messages.GET_MESSAGE.compile("1", "2"));
        String delete = resolver.resolve(Route.Messages.DELETE_MESSAGE.compile("1", "2"));

        assertNotEquals(get, delete);
    }

    @Test
    void shouldIgnoreQueryParameters() {
        Route.CompiledRoute plain = Route.Messages.GET_MESSAGE_HISTORY.compile("1");

        assertEquals(resolver.resolve(plain), resolver.resolve(plain.withQueryParams("limit", "10")));
    }

    @Test
    void shouldJoinMajorParameterValues() {
        assertEquals("guild_id=5", resolver.resolveMajorParameters(Route.Guilds.GET_MEMBER.compile("5", "6")));
        assertEquals("webhook_id=7", resolver.resolveMajorParameters(Route.Webhooks.EXECUTE_WEBHOOK.compile("7", "secret")));
        assertEquals(RouteKeyResolver.NO_MAJOR_PARAMETERS, resolver.resolveMajorParameters(Route.Users.GET_USER.compile("1")));
    }

    @Test
    void shouldApplyTemplateOverrides() {
        resolver = new RouteKeyResolver(MajorParameters.builder()
            .override("users/{user_id}", "user_id")
            .build());

        assertEquals("GET /users/42", resolver.resolve(Route.Users.GET_USER.compile("42")));
    }
}
