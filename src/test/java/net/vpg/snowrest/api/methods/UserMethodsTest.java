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

import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UserMethodsTest extends MethodsTestBase {
    @Test
    void shouldListGuildsOfCurrentUser() {
        api.getUserMethods().getGuilds(null, "10", 200).complete();

        assertEquals("/users/@me/guilds?after=10&limit=200", lastRequest().getPath());
        assertThrows(IllegalArgumentException.class, () -> api.getUserMethods().getGuilds(null, null, 201));
    }

    @Test
    void shouldOpenDirectMessageChannel() throws Exception {
        api.getUserMethods().createDirectMessageChannel("42").complete();

        RecordedRequest request = lastRequest();
        assertEquals("/users/@me/channels", request.getPath());
        assertEquals("42", new ObjectMapper().readTree(request.getBody().readUtf8()).get("recipient_id").asText());
    }

    @Test
    void shouldFetchGatewayWithoutAuthorization() {
        api.getBotMethods().getGateway().complete();

        RecordedRequest request = lastRequest();
        assertEquals("/gateway", request.getPath());
        assertNull(request.getHeader("Authorization"));
    }

    @Test
    void shouldResolveInviteWithFlags() {
        api.getInviteMethods().getInvite("abc", true, false).complete();

        assertEquals("/invites/abc?with_counts=true", lastRequest().getPath());
    }

    @Test
    void shouldListVoiceRegions() {
        api.getVoiceMethods().getVoiceRegions().complete();

        assertEquals("/voice/regions", lastRequest().getPath());
    }
}
