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
import net.vpg.snowrest.api.SnowRest;
import net.vpg.snowrest.api.requests.RestAction;
import net.vpg.snowrest.api.requests.Route;
import net.vpg.snowrest.internal.utils.Checks;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;

public class EntitlementMethods extends AbstractMethods {
    public EntitlementMethods(@Nonnull SnowRest api) {
        super(api);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getEntitlements(@Nonnull String applicationId) {
        Checks.isSnowflake(applicationId, "Application ID");
        return get(Route.Entitlements.GET_ENTITLEMENTS.compile(applicationId));
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getEntitlement(@Nonnull String applicationId, @Nonnull String entitlementId) {
        Checks.isSnowflake(applicationId, "Application ID");
        Checks.isSnowflake(entitlementId, "Entitlement ID");
        return get(Route.Entitlements.GET_ENTITLEMENT.compile(applicationId, entitlementId));
    }

    /**
     * Marks a one-time purchase entitlement as consumed.
     *
     * @param applicationId The application
     * @param entitlementId The entitlement
     * @return {@link RestAction} with an empty response
     */
    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> consumeEntitlement(@Nonnull String applicationId, @Nonnull String entitlementId) {
        Checks.isSnowflake(applicationId, "Application ID");
        Checks.isSnowflake(entitlementId, "Entitlement ID");
        return send(Route.Entitlements.CONSUME_ENTITLEMENT.compile(applicationId, entitlementId), null);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> createTestEntitlement(@Nonnull String applicationId, @Nonnull Object data) {
        Checks.isSnowflake(applicationId, "Application ID");
        Checks.notNull(data, "Data");
        return send(Route.Entitlements.CREATE_TEST_ENTITLEMENT.compile(applicationId), data, null);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> deleteTestEntitlement(@Nonnull String applicationId, @Nonnull String entitlementId) {
        Checks.isSnowflake(applicationId, "Application ID");
        Checks.isSnowflake(entitlementId, "Entitlement ID");
        return send(Route.Entitlements.DELETE_TEST_ENTITLEMENT.compile(applicationId, entitlementId), null);
    }
}
