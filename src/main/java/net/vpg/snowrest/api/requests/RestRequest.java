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

import com.fasterxml.jackson.databind.JsonNode;
import net.vpg.snowrest.api.SnowRest;
import net.vpg.snowrest.api.exceptions.*;
import net.vpg.snowrest.internal.requests.CallbackContext;
import net.vpg.snowrest.internal.requests.RestActionImpl;
import org.apache.commons.collections4.map.CaseInsensitiveMap;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * A single request on its way through the rate-limiter.
 *
 * <p>Besides the immutable request data this carries the scheduling state:
 * the submission sequence, attempt counters, the earliest retry time and the {@link State}.
 * That state is only written by the rate-limiter.
 *
 * @param <T> The result type
 */
public class RestRequest<T> {
    private final RestActionImpl<T> restAction;
    private final Consumer<? super T> onSuccess;
    private final Consumer<? super Throwable> onFailure;
    private final BooleanSupplier checks;
    private final Route.CompiledRoute route;
    private final RestBody body;
    private final CaseInsensitiveMap<String, String> headers;
    private final long deadline;
    private final SnowRest api;

    private final AtomicBoolean done = new AtomicBoolean();
    private volatile boolean isCancelled = false;

    private volatile State state = State.QUEUED;
    private volatile long sequence;
    private volatile int attempts;
    private volatile int rateLimitHits;
    private volatile long retryAt;

    public RestRequest(
        RestActionImpl<T> restAction, Consumer<? super T> onSuccess, Consumer<? super Throwable> onFailure,
        BooleanSupplier checks, RestBody body, long deadline, Route.CompiledRoute route,
        CaseInsensitiveMap<String, String> headers) {
        this.deadline = deadline;
        this.restAction = restAction;
        this.onSuccess = onSuccess;
        this.onFailure = onFailure;
        this.checks = checks;
        this.body = body == null ? RestBody.none() : body;
        this.route = route;
        this.headers = headers;

        this.api = restAction.getApi();
    }

    public void onSuccess(T successObj) {
        if (!done.compareAndSet(false, true))
            return;
        state = State.SUCCEEDED;
        runCallback(() -> {
            try (CallbackContext ___ = CallbackContext.getInstance()) {
                onSuccess.accept(successObj);
            } catch (Throwable t) {
                RestActionImpl.LOG.error("Encountered error while processing success consumer", t);
                if (t instanceof Error)
                    throw (Error) t;
            }
        });
    }

    public void onFailure(RestResponse response) {
        onFailure(createException(response));
    }

    public void onFailure(Throwable failException) {
        if (!done.compareAndSet(false, true))
            return;
        state = State.FAILED;
        runCallback(() -> {
            try (CallbackContext ___ = CallbackContext.getInstance()) {
                onFailure.accept(failException);
            } catch (Throwable t) {
                RestActionImpl.LOG.error("Encountered error while processing failure consumer", t);
                if (t instanceof Error)
                    throw (Error) t;
            }
        });
    }

    public void onCancelled() {
        onFailure(new CancellationException("RestAction has been cancelled"));
    }

    public void onTimeout() {
        onFailure(new TimeoutException("RestAction has timed out"));
    }

    private void runCallback(Runnable callback) {
        try {
            api.getThreadingConfig().getCallbackPool().execute(callback);
        } catch (RejectedExecutionException e) {
            RestActionImpl.LOG.debug("Callback pool rejected callback, running it on the current thread");
            callback.run();
        }
    }

    @Nonnull
    private RestException createException(RestResponse response) {
        if (response.isError()) {
            Exception exception = response.getException();
            if (exception instanceof IOException)
                return new NetworkException(route, attempts, (IOException) exception);
            return new RestException(route, attempts, "Unexpected failure while executing request on " + route, exception);
        }

        String body = response.getString();
        if (response.isRateLimit())
            return new RateLimitedException(route, attempts, body, response.getRetryAfter(), response.isGlobalRateLimit());
        if (response.isServerError())
            return new ServerErrorException(route, attempts, response.code, body);

        JsonNode error = response.optJson(api.getRestConfig().getObjectMapper()).orElse(null);
        int errorCode = error == null ? 0 : error.path("code").asInt(0);
        String errorMessage = error == null || !error.path("message").isTextual() ? null : error.path("message").asText();
        return new ClientErrorException(route, attempts, response.code, body, errorCode, errorMessage);
    }

    @Nonnull
    public RestAction<T> getRestAction() {
        return restAction;
    }

    @Nonnull
    public Consumer<? super T> getOnSuccess() {
        return onSuccess;
    }

    @Nonnull
    public Consumer<? super Throwable> getOnFailure() {
        return onFailure;
    }

    public boolean isSkipped() {
        if (isTimeout()) {
            onTimeout();
            return true;
        }
        boolean skip = runChecks();
        if (skip)
            onCancelled();
        return skip;
    }

    private boolean isTimeout() {
        return deadline > 0 && deadline < System.currentTimeMillis();
    }

    private boolean runChecks() {
        try {
            return isCancelled() || checks != null && !checks.getAsBoolean();
        } catch (Exception e) {
            onFailure(e);
            return true;
        }
    }

    @Nullable
    public Map<String, String> getHeaders() {
        return headers;
    }

    @Nonnull
    public Route.CompiledRoute getRoute() {
        return route;
    }

    @Nonnull
    public RestBody getBody() {
        return body;
    }

    /**
     * The deadline of this request as epoch milliseconds.
     *
     * @return The deadline, or 0 if there is none
     */
    public long getDeadline() {
        return deadline;
    }

    public void cancel() {
        if (!isCancelled) {
            isCancelled = true;
            onCancelled();
        }
    }

    public boolean isCancelled() {
        return isCancelled;
    }

    /**
     * Whether this request has been completed, successfully or not.
     *
     * @return True, if a callback has been triggered
     */
    public boolean isDone() {
        return done.get();
    }

    public void handleResponse(@Nonnull RestResponse response) {
        restAction.handleResponse(response, this);
    }

    // Scheduling state, written by the rate-limiter

    @Nonnull
    public State getState() {
        return state;
    }

    public void setState(@Nonnull State state) {
        if (!isDone())
            this.state = state;
    }

    /**
     * The position of this request in submission order, assigned when it is enqueued.
     *
     * @return The sequence number
     */
    public long getSequence() {
        return sequence;
    }

    public void setSequence(long sequence) {
        this.sequence = sequence;
    }

    /**
     * The number of network calls made for this request so far.
     *
     * @return The attempt count
     */
    public int getAttempts() {
        return attempts;
    }

    public int incrementAttempts() {
        return ++attempts;
    }

    /**
     * The number of responses with status {@code 429} received for this request.
     *
     * @return The rate-limit count
     */
    public int getRateLimitHits() {
        return rateLimitHits;
    }

    public int incrementRateLimitHits() {
        return ++rateLimitHits;
    }

    /**
     * The number of attempts that failed with a server or network error.
     *
     * @return The failed attempt count
     */
    public int getFailedAttempts() {
        return attempts - rateLimitHits;
    }

    /**
     * The earliest monotonic time at which this request may be sent again.
     *
     * @return The retry time, or 0 if the request is not backing off
     */
    public long getRetryAt() {
        return retryAt;
    }

    public void setRetryAt(long retryAt) {
        this.retryAt = retryAt;
    }

    @Override
    public String toString() {
        return "RestRequest[" + route + ", #" + sequence + ", " + state + ']';
    }

    /**
     * Lifecycle of a request.
     * <pre>
     * QUEUED -&gt; WAITING -&gt; IN_FLIGHT -&gt; SUCCEEDED
     *                                 -&gt; RETRYING -&gt; WAITING
     *                                 -&gt; FAILED
     * </pre>
     * Timeouts and cancellations end in {@link #FAILED}.
     */
    public enum State {
        QUEUED, WAITING, IN_FLIGHT, RETRYING, SUCCEEDED, FAILED
    }
}
