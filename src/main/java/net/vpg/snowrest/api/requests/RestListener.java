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

import net.vpg.snowrest.internal.utils.SnowLogger;
import org.slf4j.Logger;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;

/**
 * Observer of the request lifecycle, registered with {@link RestConfig#addListener(RestListener)}.
 *
 * <p>Every method has an empty default, so implementations only override what they need.
 * Listeners are called on the rate-limiter threads, {@link #onRateLimit(Route.CompiledRoute, String, long, boolean)}
 * even while the rate-limiter lock is held. They should return quickly and never block.
 * Exceptions thrown by a listener are logged and do not affect the request.
 *
 * <pre>{@code
 * config.addListener(new RestListener() {
 *     public void onRateLimit(Route.CompiledRoute route, String bucket, long retryAfter, boolean global) {
 *         metrics.increment(global ? "global" : bucket);
 *     }
 * });
 * }</pre>
 */
public interface RestListener {
    /**
     * Called right before a request is sent over the network.
     *
     * @param route   The route of the request
     * @param attempt The attempt number, starting at 1
     */
    default void onRequest(@Nonnull Route.CompiledRoute route, int attempt) {}

    /**
     * Called once an HTTP response was read completely, including error and 429 responses.
     *
     * @param route    The route of the request
     * @param response The response
     * @param latency  Milliseconds the network call took
     */
    default void onResponse(@Nonnull Route.CompiledRoute route, @Nonnull RestResponse response, long latency) {}

    /**
     * Called when a request failed without any HTTP response, for instance on I/O errors.
     *
     * @param route The route of the request
     * @param error The failure
     */
    default void onRequestError(@Nonnull Route.CompiledRoute route, @Nonnull Throwable error) {}

    /**
     * Called when a 429 response was received.
     *
     * @param route      The route of the request
     * @param bucket     The key of the exhausted bucket, or null for the global rate-limit
     * @param retryAfter Milliseconds until requests may be sent again
     * @param global     Whether this is the global rate-limit
     */
    default void onRateLimit(@Nonnull Route.CompiledRoute route, @Nullable String bucket, long retryAfter, boolean global) {}

    /**
     * Combines the listeners into one, which isolates each of them from the failures of the others.
     *
     * @param listeners The listeners, in call order
     * @return The combined listener
     */
    @Nonnull
    static RestListener of(@Nonnull Collection<? extends RestListener> listeners) {
        return new Composite(listeners);
    }

    final class Composite implements RestListener {
        private static final Logger LOG = SnowLogger.getLog(RestListener.class);

        private final List<RestListener> listeners;

        private Composite(Collection<? extends RestListener> listeners) {
            this.listeners = new ArrayList<>(listeners);
        }

        @Override
        public void onRequest(@Nonnull Route.CompiledRoute route, int attempt) {
            fire(listener -> listener.onRequest(route, attempt));
        }

        @Override
        public void onResponse(@Nonnull Route.CompiledRoute route, @Nonnull RestResponse response, long latency) {
            fire(listener -> listener.onResponse(route, response, latency));
        }

        @Override
        public void onRequestError(@Nonnull Route.CompiledRoute route, @Nonnull Throwable error) {
            fire(listener -> listener.onRequestError(route, error));
        }

        @Override
        public void onRateLimit(@Nonnull Route.CompiledRoute route, @Nullable String bucket, long retryAfter, boolean global) {
            fire(listener -> listener.onRateLimit(route, bucket, retryAfter, global));
        }

        private void fire(Consumer<RestListener> call) {
            for (RestListener listener : listeners) {
                try {
                    call.accept(listener);
                } catch (Exception e) {
                    LOG.error("One of the RestListeners had an uncaught exception", e);
                }
            }
        }
    }
}
