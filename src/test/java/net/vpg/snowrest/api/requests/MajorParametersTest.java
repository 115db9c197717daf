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

import java.util.Collections;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MajorParametersTest {
    @Test
    void shouldUseDefaultNamesForEveryRoute() {
        MajorParameters table = MajorParameters.getDefault();

        assertTrue(table.isMajor(Route.Messages.SEND_MESSAGE, "channel_id"));
        assertTrue(table.isMajor(Route.Guilds.GET_MEMBER, "guild_id"));
        assertTrue(table.isMajor(Route.Webhooks.EXECUTE_WEBHOOK, "webhook_id"));
        assertFalse(table.isMajor(Route.Messages.DELETE_MESSAGE, "message_id"));
        assertFalse(table.isMajor(Route.Webhooks.EXECUTE_WEBHOOK, "webhook_token"));
    }

    @Test
    void shouldPreferOverrideForTemplate() {
        MajorParameters table = MajorParameters.builder()
            .override("applications/{application_id}/emojis", "application_id")
            .build();

        assertEquals(Collections.singleton("application_id"), table.getMajorParameters(Route.Emojis.GET_APPLICATION_EMOJIS));
        // Same template with another method uses the same override
        assertTrue(table.isMajor(Route.Emojis.CREATE_APPLICATION_EMOJI, "application_id"));
        assertFalse(table.isMajor(Route.Emojis.GET_APPLICATION_EMOJI, "application_id"));
    }

    @Test
    void shouldBuildIndependentCopies() {
        MajorParameters.Builder builder = MajorParameters.builder().setDefaults("guild_id");
        MajorParameters first = builder.build();
        builder.addDefault("user_id");
        MajorParameters second = builder.build();

        assertEquals(Collections.singleton("guild_id"), first.getDefaults());
        assertEquals(2, second.getDefaults().size());
        assertEquals(second.getDefaults(), second.toBuilder().build().getDefaults());
    }

    @Test
    void shouldExposeImmutableSets() {
        Set<String> defaults = MajorParameters.getDefault().getDefaults();

        assertThrows(UnsupportedOperationException.class, () -> defaults.add("user_id"));
    }
}
