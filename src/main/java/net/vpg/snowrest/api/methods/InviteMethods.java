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

public class InviteMethods extends AbstractMethods {
    public InviteMethods(@Nonnull SnowRest api) {
        super(api);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getInvite(@Nonnull String code) {
        return getInvite(code, false, false);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getInvite(@Nonnull String code, boolean withCounts, boolean withExpiration) {
        Checks.notBlank(code, "Invite code");
        Route.CompiledRoute route = Route.Invites.GET_INVITE.compile(code)
            .withOptionalQueryParams(
                "with_counts", withCounts ? "true" : null,
                "with_expiration", withExpiration ? "true" : null);
        return get(route);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> deleteInvite(@Nonnull String code, @Nullable String reason) {
        Checks.notBlank(code, "Invite code");
        return send(Route.Invites.DELETE_INVITE.compile(code), reason);
    }
}
