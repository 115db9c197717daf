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
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GuildMethodsTest extends MethodsTestBase {
    private GuildMethods guilds;

    @BeforeEach
    void setUp() {
        guilds = api.getGuildMethods();
    }

    @Test
    void shouldRequestCountsOnlyWhenAsked() {
        guilds.getGuild("1").complete();
        guilds.getGuild("1", true).complete();

        assertEquals("/guilds/1", dispatcher.getHits().get(0).getRequest().getPath());
        assertEquals("/guilds/1?with_counts=true", dispatcher.getHits().get(1).getRequest().getPath());
    }

    @Test
    void shouldPageMembers() {
        guilds.getGuildMembers("1", 1000, "55").complete();

        assertEquals("/guilds/1/members?limit=1000&after=55", lastRequest().getPath());
        assertThrows(IllegalArgumentException.class, () -> guilds.getGuildMembers("1", 1001, null));
    }

    @Test
    void shouldSendBanWithoutBodyByDefault() throws Exception {
        guilds.createGuildBan("1", "2", null, "rule 3").complete();
        guilds.createGuildBan("1", "3", 3600, null).complete();

        RecordedRequest plain = dispatcher.getHits().get(0).getRequest();
        RecordedRequest withMessages = dispatcher.getHits().get(1).getRequest();
        assertEquals("PUT", plain.getMethod());
        assertEquals(0, plain.getBodySize());
        assertEquals("rule%203", plain.getHeader("X-Audit-Log-Reason"));
        JsonNode body = new ObjectMapper().readTree(withMessages.getBody().readUtf8());
        assertEquals(3600, body.get("delete_message_seconds").asInt());
        assertThrows(IllegalArgumentException.class, () -> guilds.createGuildBan("1", "2", 604801, null));
    }

    @Test
    void shouldSendPruneDaysAsQueryOrBody() throws Exception {
        guilds.getGuildPruneCount("1", 7).complete();
        guilds.startGuildPrune("1", 7, null).complete();

        assertEquals("/guilds/1/prune?days=7", dispatcher.getHits().get(0).getRequest().getPath());
        RecordedRequest prune = dispatcher.getHits().get(1).getRequest();
        assertEquals("POST", prune.getMethod());
        assertEquals(7, new ObjectMapper().readTree(prune.getBody().readUtf8()).get("days").asInt());
        assertThrows(IllegalArgumentException.class, () -> guilds.getGuildPruneCount("1", 31));
    }

    @Test
    void shouldFilterAuditLog() {
        api.getAuditLogMethods().getAuditLog("1", "2", 22, null, 50).complete();

        assertEquals("/guilds/1/audit-logs?user_id=2&action_type=22&limit=50", lastRequest().getPath());
    }
}
