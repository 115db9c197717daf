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

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class RouteTest {
    @Test
    void shouldCompileParametersInOrder() {
        Route.CompiledRoute route = Route.Messages.GET_MESSAGE.compile("123", "456");

        assertEquals("channels/123/messages/456", route.getCompiledRoute());
        assertEquals("123", route.getParameter("channel_id"));
        assertEquals("456", route.getParameter("message_id"));
        assertEquals(Arrays.asList("channel_id", "message_id"), Route.Messages.GET_MESSAGE.getParamNames());
        assertEquals(Method.GET, route.getMethod());
    }

    @Test
    void shouldPercentEncodeParameterValues() {
        Route.CompiledRoute route = Route.Messages.ADD_REACTION.compile("1", "2", "😀");

        assertEquals("channels/1/messages/2/reactions/%F0%9F%98%80/@me", route.getCompiledRoute());
    }

    @Test
    void shouldRejectWrongParameterCount() {
        assertThrows(IllegalArgumentException.class, () -> Route.Messages.GET_MESSAGE.compile("123"));
        assertThrows(IllegalArgumentException.class, () -> Route.Messages.GET_MESSAGE.compile("1", "2", "3"));
    }

    @Test
    void shouldRejectInvalidTemplates() {
        assertThrows(IllegalArgumentException.class, () -> Route.get("channels/{channel_id}abc"));
        assertThrows(IllegalArgumentException.class, () -> Route.get("channels/{{channel_id}}"));
        assertThrows(IllegalArgumentException.class, () -> Route.get("channels/id}"));
        assertThrows(IllegalArgumentException.class, () -> Route.get("channels/{id}/messages/{id}"));
        assertThrows(IllegalArgumentException.class, () -> Route.get("channels/ {id}"));
    }

    @Test
    void shouldAppendOnlyDefinedQueryParameters() {
        Route.CompiledRoute base = Route.Messages.GET_MESSAGE_HISTORY.compile("123");

        Route.CompiledRoute route = base.withOptionalQueryParams("before", null, "limit", 50, "after", null);

        assertEquals("channels/123/messages?limit=50", route.getCompiledRoute());
        assertSame(base, base.withOptionalQueryParams("before", null));
    }

    @Test
    void shouldEncodeQueryValues() {
        Route.CompiledRoute route = Route.Guilds.GET_MEMBERS.compile("1").withQueryParams("query", "a b&c");

        assertEquals("guilds/1/members?query=a%20b%26c", route.getCompiledRoute());
    }

    @Test
    void shouldCompareRoutesByMethodAndTemplate() {
        assertEquals(Route.get("channels/{channel_id}"), Route.Channels.GET_CHANNEL);
        assertNotEquals(Route.patch("channels/{channel_id}"), Route.Channels.GET_CHANNEL);
        assertEquals(Route.Channels.GET_CHANNEL.compile("1"), Route.Channels.GET_CHANNEL.compile("1"));
    }

    @Test
    void shouldCarryAuthorizationRequirement() {
        assertTrue(Route.Channels.GET_CHANNEL.isAuthorizationRequired());
        assertFalse(Route.Webhooks.EXECUTE_WEBHOOK.isAuthorizationRequired());
        assertFalse(Route.custom(Method.GET, "gateway", false).isAuthorizationRequired());
    }
}
