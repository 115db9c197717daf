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
package net.vpg.snowrest.internal.requests;

import net.vpg.snowrest.api.requests.RestBody;
import net.vpg.snowrest.api.requests.RestRequest;
import net.vpg.snowrest.api.requests.Route;
import org.apache.commons.collections4.map.CaseInsensitiveMap;

import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;

public class RestFuture<T> extends CompletableFuture<T> {
    final RestRequest<T> request;

    public RestFuture(RestActionImpl<T> restAction, BooleanSupplier checks, RestBody data, long deadline,
                      Route.CompiledRoute route, CaseInsensitiveMap<String, String> headers) {
        this.request = new RestRequest<>(restAction, this::complete, this::completeExceptionally,
            checks, data, deadline, route, headers);
        restAction.getApi().getRequester().request(this.request);
    }

    public RestFuture(Throwable t) {
        this.request = null;
        completeExceptionally(t);
    }

    @Override
    public boolean cancel(boolean mayInterrupt) {
        if (request != null)
            request.cancel();

        if (!isDone() && !isCancelled())
            return super.cancel(mayInterrupt);
        return false;
    }
}
