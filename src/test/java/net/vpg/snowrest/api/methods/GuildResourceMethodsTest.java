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
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class GuildResourceMethodsTest extends MethodsTestBase {
    // ===== Stage instances =====

    @Test
    void shouldCreateStageInstanceForChannel() {
        api.getStageInstanceMethods().createStageInstance("5", "Town hall", "scheduled").complete();

        RecordedRequest request = lastRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/stage-instances", request.getPath());
        assertEquals("scheduled", request.getHeader("X-Audit-Log-Reason"));
        assertEquals("{\"channel_id\":\"5\",\"topic\":\"Town hall\"}", request.getBody().readUtf8());
    }

    // ===== Auto moderation =====

    @Test
    void shouldDeleteRuleWithReason() {
        api.getAutoModerationMethods().deleteAutoModerationRule("1", "3", "obsolete").complete();

        RecordedRequest request = lastRequest();
        assertEquals("DELETE", request.getMethod());
        assertEquals("/guilds/1/auto-moderation/rules/3", request.getPath());
        assertEquals("obsolete", request.getHeader("X-Audit-Log-Reason"));
    }

    // ===== Templates =====

    @Test
    void shouldSyncTemplateWithPut() {
        api.getGuildTemplateMethods().syncGuildTemplate("1", "hgM48av5Q69A").complete();

        RecordedRequest request = lastRequest();
        assertEquals("PUT", request.getMethod());
        assertEquals("/guilds/1/templates/hgM48av5Q69A", request.getPath());
    }

    @Test
    void shouldCreateGuildFromTemplateWithoutIcon() {
        api.getGuildTemplateMethods().createGuildFromGuildTemplate("hgM48av5Q69A", "Copy", null).complete();

        RecordedRequest request = lastRequest();
        assertEquals("/guilds/templates/hgM48av5Q69A", request.getPath());
        assertEquals("{\"name\":\"Copy\"}", request.getBody().readUtf8());
    }

    // ===== Monetization =====

    @Test
    void shouldConsumeEntitlement() {
        api.getEntitlementMethods().consumeEntitlement("10", "11").complete();

        RecordedRequest request = lastRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/applications/10/entitlements/11/consume", request.getPath());
    }

    @Test
    void shouldFilterSubscriptionsByUser() {
        api.getSkuMethods().getSubscriptions("12", "13", null, null, 10).complete();

        assertEquals("/skus/12/subscriptions?limit=10&user_id=13", lastRequest().getPath());
    }

    @Test
    void shouldRejectEmptyTemplateName() {
        assertThrows(IllegalArgumentException.class,
            () -> api.getGuildTemplateMethods().createGuildTemplate("1", " ", null));
        assertThrows(IllegalArgumentException.class,
            () -> api.getAutoModerationMethods().createAutoModerationRule("1", null, null));
    }
}
