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

import net.vpg.snowrest.api.SnowRest;
import net.vpg.snowrest.api.exceptions.RestException;
import net.vpg.snowrest.api.requests.*;
import net.vpg.snowrest.internal.utils.Checks;
import net.vpg.snowrest.internal.utils.Helpers;
import net.vpg.snowrest.internal.utils.SnowLogger;
import org.apache.commons.collections4.map.CaseInsensitiveMap;
import org.slf4j.Logger;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;
import java.util.concurrent.*;
import java.util.function.BiFunction;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

public class RestActionImpl<T> implements RestAction<T> {
    public static final Logger LOG = SnowLogger.getLog(RestAction.class);
    private static Consumer<Object> DEFAULT_SUCCESS = Helpers.emptyConsumer();
    private static Consumer<? super Throwable> DEFAULT_FAILURE = t -> {
        String message = t.getMessage();
        if (t instanceof CancellationException || t instanceof TimeoutException)
            LOG.debug(message);
        else
            LOG.error("RestAction queue returned failure: [{}] {}", t.getClass().getSimpleName(), message);
    };

    protected final SnowRest api;
    private final Route.CompiledRoute route;
    private final RestBody data;
    private final CaseInsensitiveMap<String, String> headers;
    private final BiFunction<RestResponse, RestRequest<T>, T> handler;

    private long deadline = 0;
    private BooleanSupplier checks;

    public RestActionImpl(SnowRest api, Route.CompiledRoute route) {
        this(api, route, null, null, null);
    }

    public RestActionImpl(SnowRest api, Route.CompiledRoute route, RestBody data) {
        this(api, route, data, null, null);
    }

    public RestActionImpl(SnowRest api, Route.CompiledRoute route, BiFunction<RestResponse, RestRequest<T>, T> handler) {
        this(api, route, null, null, handler);
    }

    public RestActionImpl(SnowRest api, Route.CompiledRoute route, @Nullable RestBody data,
                          @Nullable Map<String, String> headers, @Nullable BiFunction<RestResponse, RestRequest<T>, T> handler) {
        Checks.notNull(api, "api");
        Checks.notNull(route, "Route");
        this.api = api;
        this.route = route;
        this.data = data == null ? RestBody.none() : data;
        this.headers = headers == null || headers.isEmpty() ? null : new CaseInsensitiveMap<>(headers);
        this.handler = handler;
    }

    public static Consumer<? super Throwable> getDefaultFailure() {
        return DEFAULT_FAILURE;
    }

    public static void setDefaultFailure(final Consumer<? super Throwable> callback) {
        DEFAULT_FAILURE = callback == null ? (Consumer<Throwable>) t -> {
        } : callback;
    }

    public static <T> Consumer<? super T> getDefaultSuccess() {
        return DEFAULT_SUCCESS;
    }

    public static void setDefaultSuccess(Consumer<Object> callback) {
        DEFAULT_SUCCESS = callback == null ? Helpers.emptyConsumer() : callback;
    }

    @Nonnull
    @Override
    public SnowRest getApi() {
        return api;
    }

    @Nonnull
    @Override
    public RestAction<T> setCheck(BooleanSupplier checks) {
        this.checks = checks;
        return this;
    }

    @Nullable
    @Override
    public BooleanSupplier getCheck() {
        return this.checks;
    }

    @Nonnull
    @Override
    public RestAction<T> deadline(long timestamp) {
        this.deadline = timestamp;
        return this;
    }

    @Override
    public void queue(Consumer<? super T> success, Consumer<? super Throwable> failure) {
        if (success == null)
            success = DEFAULT_SUCCESS;
        if (failure == null)
            failure = DEFAULT_FAILURE;
        api.getRequester().request(new RestRequest<>(this, success, failure, checks, data, getDeadline(), route, copyHeaders()));
    }

    @Nonnull
    @Override
    public CompletableFuture<T> submit() {
        try {
            return new RestFuture<>(this, checks, data, getDeadline(), route, copyHeaders());
        } catch (RejectedExecutionException e) {
            return new RestFuture<>(e);
        }
    }

    @Override
    public T complete() {
        if (CallbackContext.isCallbackContext())
            throw new IllegalStateException("Preventing use of complete() in callback threads! This operation can be a deadlock cause");
        try {
            return submit().join();
        } catch (CompletionException e) {
            if (e.getCause() != null) {
                Throwable cause = e.getCause();
                if (cause instanceof RestException)
                    cause.fillInStackTrace(); // this method will update the stacktrace to the current thread stack
                if (cause instanceof RuntimeException)
                    throw (RuntimeException) cause;
                if (cause instanceof Error)
                    throw (Error) cause;
            }
            throw e;
        }
    }

    @Nonnull
    public Route.CompiledRoute getRoute() {
        return route;
    }

    @Nonnull
    public RestBody getBody() {
        return data;
    }

    private CaseInsensitiveMap<String, String> copyHeaders() {
        return headers == null ? null : new CaseInsensitiveMap<>(headers);
    }

    public void handleResponse(RestResponse response, RestRequest<T> request) {
        if (response.isOk())
            handleSuccess(response, request);
        else
            request.onFailure(response);
    }

    protected void handleSuccess(RestResponse response, RestRequest<T> request) {
        T result;
        try {
            result = handler == null ? null : handler.apply(response, request);
        } catch (Exception e) {
            request.onFailure(e);
            return;
        }
        request.onSuccess(result);
    }

    private long getDeadline() {
        long defaultTimeout = api.getRestConfig().getDefaultTimeout();
        return deadline > 0
            ? deadline
            : defaultTimeout > 0
            ? System.currentTimeMillis() + defaultTimeout
            : 0;
    }
}
