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
import com.fasterxml.jackson.databind.node.ObjectNode;
import net.vpg.snowrest.api.SnowRest;
import net.vpg.snowrest.api.requests.RestAction;
import net.vpg.snowrest.api.requests.Route;
import net.vpg.snowrest.internal.utils.Checks;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Live stages of stage channels. Stage instances are addressed by their channel.
 */
public class StageInstanceMethods extends AbstractMethods {
    public StageInstanceMethods(@Nonnull SnowRest api) {
        super(api);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> createStageInstance(@Nonnull String channelId, @Nonnull String topic, @Nullable String reason) {
        Checks.isSnowflake(channelId, "Channel ID");
        Checks.notBlank(topic, "Topic");
        ObjectNode payload = object()
            .put("channel_id", channelId)
            .put("topic", topic);
        return send(Route.StageInstances.CREATE_INSTANCE.compile(), payload, reason);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> getStageInstance(@Nonnull String channelId) {
        Checks.isSnowflake(channelId, "Channel ID");
        return get(Route.StageInstances.GET_INSTANCE.compile(channelId));
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> editStageInstance(@Nonnull String channelId, @Nonnull String topic, @Nullable String reason) {
        Checks.isSnowflake(channelId, "Channel ID");
        Checks.notBlank(topic, "Topic");
        return send(Route.StageInstances.MODIFY_INSTANCE.compile(channelId), object().put("topic", topic), reason);
    }

    @Nonnull
    @CheckReturnValue
    public RestAction<JsonNode> deleteStageInstance(@Nonnull String channelId, @Nullable String reason) {
        Checks.isSnowflake(channelId, "Channel ID");
        return send(Route.StageInstances.DELETE_INSTANCE.compile(channelId), reason);
    }
}
