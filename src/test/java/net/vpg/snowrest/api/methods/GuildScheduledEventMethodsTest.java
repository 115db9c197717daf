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

import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class GuildScheduledEventMethodsTest extends MethodsTestBase {
    private GuildScheduledEventMethods events;

    @BeforeEach
    void setUp() {
        events = api.getGuildScheduledEventMethods();
    }

    @Test
    void shouldAskForUserCount() {
        events.listGuildScheduledEvents("1", true).complete();
        events.getGuildScheduledEvent("1", "2", false).complete();

        assertEquals("/guilds/1/scheduled-events?with_user_count=true", dispatcher.getHits().get(0).getRequest().getPath());
        assertEquals("/guilds/1/scheduled-events/2", dispatcher.getHits().get(1).getRequest().getPath());
    }

    @Test
    void shouldCreateWithReason() {
        events.createGuildScheduledEvent("1", Collections.singletonMap("name", "Game night"), "weekly event").complete();

        RecordedRequest request = lastRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/guilds/1/scheduled-events", request.getPath());
        assertEquals("weekly%20event", request.getHeader("X-Audit-Log-Reason"));
        assertEquals("{\"name\":\"Game night\"}", request.getBody().readUtf8());
    }

    @Test
    void shouldPageUsers() {
        events.getGuildScheduledEventUsers("1", "2", 50, true, null, "7").complete();

        assertEquals("/guilds/1/scheduled-events/2/users?limit=50&with_member=true&after=7", lastRequest().getPath());
    }

    @Test
    void shouldOmitUnsetUserQuery() {
        events.getGuildScheduledEventUsers("1", "2", null, false, null, null).complete();

        assertEquals("/guilds/1/scheduled-events/2/users", lastRequest().getPath());
    }

    @Test
    void shouldRejectUserLimitOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> events.getGuildScheduledEventUsers("1", "2", 0, false, null, null));
        assertThrows(IllegalArgumentException.class, () -> events.getGuildScheduledEventUsers("1", "2", 101, false, null, null));
        assertTrue(dispatcher.getHits().isEmpty());
    }

    @Test
    void shouldDeleteEvent() {
        events.deleteGuildScheduledEvent("1", "2").complete();

        RecordedRequest request = lastRequest();
        assertEquals("DELETE", request.getMethod());
        assertEquals("/guilds/1/scheduled-events/2", request.getPath());
    }
}
