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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.vpg.snowrest.api.SnowRest;
import net.vpg.snowrest.api.requests.*;
import net.vpg.snowrest.internal.utils.EncodingUtil;
import net.vpg.snowrest.internal.utils.Helpers;
import net.vpg.snowrest.internal.utils.IOUtil;
import net.vpg.snowrest.internal.utils.SnowLogger;
import net.vpg.snowrest.internal.utils.config.AuthorizationConfig;
import okhttp3.Call;
import okhttp3.Headers;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.internal.http.HttpMethod;
import org.slf4j.Logger;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.net.UnknownHostException;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

public class Requester {
    public static final Logger LOGGER = SnowLogger.getLog(Requester.class);
    public static final RequestBody EMPTY_BODY = RequestBody.create(new byte[0], null);
    public static final String AUDIT_LOG_REASON_HEADER = "X-Audit-Log-Reason";

    protected final SnowRest api;
    protected final AuthorizationConfig authConfig;
    private final RestRateLimiter rateLimiter;
    private final String baseUrl;
    private final String userAgent;
    private final Consumer<? super Request.Builder> customBuilder;
    private final ObjectMapper mapper;
    private final ScheduledExecutorService scheduler;
    private final RestListener listener;

    private final OkHttpClient httpClient;

    private volatile long latency = -1;

    public Requester(SnowRest api, AuthorizationConfig authConfig, RestConfig config, RestRateLimiter rateLimiter, OkHttpClient httpClient) {
        this.authConfig = authConfig;
        this.api = api;
        this.rateLimiter = rateLimiter;
        this.baseUrl = config.getBaseUrl();
        this.userAgent = config.getUserAgent();
        this.customBuilder = config.getCustomBuilder();
        this.mapper = config.getObjectMapper();
        this.scheduler = api.getThreadingConfig().getRateLimitScheduler();
        this.listener = RestListener.of(config.getListeners());
        this.httpClient = httpClient;
    }

    /**
     * Creates the headers carrying an audit-log reason.
     * <br>The reason is percent-encoded so that unicode survives the header encoding.
     *
     * @param reason The reason, or null
     * @return Immutable map with the {@value #AUDIT_LOG_REASON_HEADER} header, empty if the reason is null or blank
     */
    @Nonnull
    public static Map<String, String> reasonHeader(@Nullable String reason) {
        if (Helpers.isBlank(reason))
            return Collections.emptyMap();
        return Collections.singletonMap(AUDIT_LOG_REASON_HEADER, EncodingUtil.encodeUTF8(reason));
    }

    private static String getContentType(Response response) {
        String type = response.header("content-type");
        return type == null ? "" : type.toLowerCase(Locale.ROOT);
    }

    public SnowRest getApi() {
        return api;
    }

    public <T> void request(RestRequest<T> apiRequest) {
        if (rateLimiter.isStopped())
            throw new RejectedExecutionException("The Requester has been stopped! No new requests can be requested!");

        WorkTask task = new WorkTask(apiRequest);
        scheduleDeadline(task);
        rateLimiter.enqueue(task);
    }

    private void scheduleDeadline(WorkTask task) {
        long deadline = task.request.getDeadline();
        if (deadline <= 0)
            return;
        long delay = deadline - System.currentTimeMillis();
        try {
            task.expiry = scheduler.schedule(task::expire, Math.max(0, delay), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOGGER.warn("Could not schedule deadline for request on {}", task.getRoute(), e);
        }
    }

    /**
     * Sends the request once and reads the full response.
     *
     * @param task The API request that needs to be sent
     * @return The response, or an error response carrying the failure
     */
    @Nonnull
    public RestResponse execute(WorkTask task) {
        RestRequest<?> apiRequest = task.request;
        Route.CompiledRoute route = apiRequest.getRoute();
        String url = baseUrl + route.getCompiledRoute();
        int attempt = apiRequest.incrementAttempts();

        try {
            Request.Builder builder = new Request.Builder().url(url);
            applyBody(apiRequest, builder);
            applyHeaders(apiRequest, builder);
            if (customBuilder != null) {
                try {
                    customBuilder.accept(builder);
                } catch (Exception e) {
                    LOGGER.error("Custom request builder caused exception", e);
                }
            }

            Call call = httpClient.newCall(builder.build());
            task.call = call;
            if (apiRequest.isDone())
                call.cancel();

            LOGGER.trace("Executing request {} {} (attempt {})", route.getMethod(), url, attempt);
            listener.onRequest(route, attempt);
            long start = System.nanoTime();
            try (Response response = call.execute()) {
                byte[] body = IOUtil.readBody(response);
                latency = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
                LOGGER.trace("Finished Request {} {} with code {}", route.getMethod(), url, response.code());

                Headers headers = response.headers();
                if (response.code() == 429 && getContentType(response).startsWith("application/json"))
                    headers = mergeRateLimitBody(headers, body);
                RestResponse result = new RestResponse(response.code(), response.message(), headers, body);
                listener.onResponse(route, result, latency);
                return result;
            }
        } catch (UnknownHostException e) {
            LOGGER.error("DNS resolution failed: {}", e.getMessage());
            listener.onRequestError(route, e);
            return new RestResponse(e);
        } catch (IOException e) {
            if (!apiRequest.isDone())
                LOGGER.error("There was an I/O error while executing a REST request: {}", e.getMessage());
            listener.onRequestError(route, e);
            return new RestResponse(e);
        } catch (Exception e) {
            LOGGER.error("There was an unexpected error while executing a REST request", e);
            listener.onRequestError(route, e);
            return new RestResponse(e);
        } finally {
            task.call = null;
        }
    }

    // potentially not json when cloudflare does 429
    // On 429, replace the retry-after header if its wrong, we just pick whichever is bigger between body and header
    private Headers mergeRateLimitBody(Headers headers, byte[] body) {
        try {
            JsonNode json = mapper.readTree(body);
            if (json == null || !json.isObject())
                return headers;
            Headers.Builder builder = headers.newBuilder();
            double retryAfterBody = json.path("retry_after").asDouble(0);
            double retryAfterHeader = parseSeconds(headers.get(RestRateLimiter.RETRY_AFTER_HEADER));
            if (retryAfterBody > retryAfterHeader)
                builder.set(RestRateLimiter.RETRY_AFTER_HEADER, Double.toString(retryAfterBody));
            if (json.path("global").asBoolean(false))
                builder.set(RestRateLimiter.GLOBAL_HEADER, "true");
            return builder.build();
        } catch (Exception e) {
            LOGGER.warn("Failed to parse retry-after response body", e);
            return headers;
        }
    }

    private static double parseSeconds(String value) {
        if (value == null)
            return 0;
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private void applyBody(RestRequest<?> apiRequest, Request.Builder builder) {
        String method = apiRequest.getRoute().getMethod().name();
        RequestBody body = apiRequest.getBody().toRequestBody(mapper);

        if (body == null && HttpMethod.requiresRequestBody(method))
            body = EMPTY_BODY;

        builder.method(method, body);
    }

    private void applyHeaders(RestRequest<?> apiRequest, Request.Builder builder) {
        builder.header("user-agent", userAgent)
            .header("accept-encoding", "gzip")
            .header("x-ratelimit-precision", "millisecond"); // still sending this in case of regressions

        String token = authConfig.getToken();
        if (token != null && apiRequest.getRoute().getBaseRoute().isAuthorizationRequired())
            builder.header("authorization", token);

        // Apply custom headers like X-Audit-Log-Reason
        // If customHeaders is null this does nothing
        if (apiRequest.getHeaders() != null) {
            apiRequest.getHeaders().forEach(builder::header);
        }
    }

    public OkHttpClient getHttpClient() {
        return httpClient;
    }

    public RestRateLimiter getRateLimiter() {
        return rateLimiter;
    }

    /**
     * The duration of the last completed network call.
     *
     * @return The latency in milliseconds, or -1 if no call completed yet
     */
    public long getLatency() {
        return latency;
    }

    public int cancelRequests() {
        return rateLimiter.cancelRequests();
    }

    public void stop(boolean shutdown, Runnable callback) {
        rateLimiter.stop(shutdown, callback);
    }

    public class WorkTask implements RestRateLimiter.Work {
        private final RestRequest<?> request;
        private volatile Call call;
        private volatile ScheduledFuture<?> expiry;

        private WorkTask(RestRequest<?> request) {
            this.request = request;
        }

        @Nonnull
        @Override
        public Route.CompiledRoute getRoute() {
            return request.getRoute();
        }

        @Nonnull
        @Override
        public SnowRest getApi() {
            return request.getRestAction().getApi();
        }

        @Nonnull
        @Override
        public RestRequest<?> getRequest() {
            return request;
        }

        @Nonnull
        @Override
        public RestResponse execute() {
            return Requester.this.execute(this);
        }

        @Override
        public boolean isSkipped() {
            return request.isSkipped();
        }

        @Override
        public boolean isDone() {
            return request.isDone();
        }

        @Override
        public boolean isCancelled() {
            return request.isCancelled();
        }

        @Override
        public void cancel() {
            request.cancel();
            clearExpiry();
        }

        @Override
        public void handleResponse(@Nonnull RestResponse response) {
            clearExpiry();
            request.handleResponse(response);
        }

        private void expire() {
            if (request.isDone())
                return;
            LOGGER.debug("Request on {} reached its deadline", getRoute());
            request.onTimeout();
            Call running = call;
            if (running != null)
                running.cancel();
            rateLimiter.dequeue(this);
        }

        private void clearExpiry() {
            ScheduledFuture<?> future = expiry;
            if (future != null)
                future.cancel(false);
        }

        @Override
        public String toString() {
            return request.toString();
        }
    }
}
