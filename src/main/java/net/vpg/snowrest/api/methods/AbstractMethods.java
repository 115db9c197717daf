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
import net.vpg.snowrest.api.requests.RestBody;
import net.vpg.snowrest.api.requests.Route;
import net.vpg.snowrest.api.utils.FileUpload;
import net.vpg.snowrest.internal.requests.Requester;
import net.vpg.snowrest.internal.utils.Checks;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;

/**
 * Base of the resource modules, which only translate arguments into routes and bodies.
 */
public abstract class AbstractMethods {
    protected final SnowRest api;

    protected AbstractMethods(@Nonnull SnowRest api) {
        Checks.notNull(api, "api");
        this.api = api;
    }

    @Nonnull
    public SnowRest getApi() {
        return api;
    }

    @Nonnull
    protected RestAction<JsonNode> get(@Nonnull Route.CompiledRoute route) {
        return api.request(route);
    }

    @Nonnull
    protected RestAction<JsonNode> send(@Nonnull Route.CompiledRoute route, @Nullable String reason) {
        return api.request(route, null, Requester.reasonHeader(reason));
    }

    @Nonnull
    protected RestAction<JsonNode> send(@Nonnull Route.CompiledRoute route, @Nullable Object data, @Nullable String reason) {
        return api.request(route, data == null ? null : RestBody.json(data), Requester.reasonHeader(reason));
    }

    /**
     * Sends the payload as JSON, or as multipart with {@code payload_json} if any files are provided.
     */
    @Nonnull
    protected RestAction<JsonNode> sendWithFiles(@Nonnull Route.CompiledRoute route, @Nullable Object data,
                                                 @Nullable Collection<? extends FileUpload> files, @Nullable String reason) {
        RestBody body = files == null || files.isEmpty()
            ? data == null ? null : RestBody.json(data)
            : RestBody.multipart(data, files);
        return api.request(route, body, Requester.reasonHeader(reason));
    }

    @Nonnull
    protected ObjectNode object() {
        return api.getRestConfig().getObjectMapper().createObjectNode();
    }
}
