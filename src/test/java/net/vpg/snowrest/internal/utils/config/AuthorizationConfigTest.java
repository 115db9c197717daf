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
package net.vpg.snowrest.internal.utils.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AuthorizationConfigTest {
    @Test
    void shouldPrefixBotTokens() {
        assertEquals("Bot abc.def", new AuthorizationConfig("abc.def").getToken());
        assertEquals("Bot abc.def", new AuthorizationConfig("Bot abc.def").getToken());
        assertEquals("Bearer xyz", new AuthorizationConfig("Bearer xyz").getToken());
    }

    @Test
    void shouldAllowMissingToken() {
        assertNull(new AuthorizationConfig(null).getToken());
    }

    @Test
    void shouldRejectMalformedTokens() {
        assertThrows(IllegalArgumentException.class, () -> new AuthorizationConfig(""));
        assertThrows(IllegalArgumentException.class, () -> new AuthorizationConfig("   "));
        assertThrows(IllegalArgumentException.class, () -> new AuthorizationConfig("abc def"));
        assertThrows(IllegalArgumentException.class, () -> new AuthorizationConfig("Bot abc def"));
    }
}
