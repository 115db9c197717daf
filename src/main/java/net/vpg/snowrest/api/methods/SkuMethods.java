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
import javax.annotation.Nullable;

public class SkuMethods extends AbstractMethods {
    public static final int SUBSCRIPTIONS_MAX_RESULTS = 100;

    public SkuMethods(@Nonnull SnowRest api) {
        super(api);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getSkus(@Nonnull String applicationId) {
        Checks.isSnowflake(applicationId, "Application ID");
        return get(Route.Skus.GET_SKUS.compile(applicationId));
    }

    /**
     * Retrieves the subscriptions of a SKU.
     *
     * @param skuId  The SKU
     * @param userId Only subscriptions of this user, or null
     * @param before Only subscriptions before this ID, or null
     * @param after  Only subscriptions after this ID, or null
     * @param limit  Amount of subscriptions, 1 to 100, or null for the API default
     * @return {@link RestAction} resolving to an array of subscriptions
     */
    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getSubscriptions(@Nonnull String skuId, @Nullable String userId, @Nullable String before,
                                                 @Nullable String after, @Nullable Integer limit) {
        Checks.isSnowflake(skuId, "SKU ID");
        if (limit != null)
            Checks.inRange(limit, 1, SUBSCRIPTIONS_MAX_RESULTS, "Limit");
        Route.CompiledRoute route = Route.Skus.GET_SUBSCRIPTIONS.compile(skuId)
            .withOptionalQueryParams("before", before, "after", after, "limit", limit, "user_id", userId);
        return get(route);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getSubscription(@Nonnull String skuId, @Nonnull String subscriptionId) {
        Checks.isSnowflake(skuId, "SKU ID");
        Checks.isSnowflake(subscriptionId, "Subscription ID");
        return get(Route.Skus.GET_SUBSCRIPTION.compile(skuId, subscriptionId));
    }
}
