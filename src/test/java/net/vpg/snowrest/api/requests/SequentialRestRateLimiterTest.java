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
import net.vpg.snowrest.RecordingDispatcher;
import net.vpg.snowrest.RecordingDispatcher.Hit;
import net.vpg.snowrest.api.SnowRest;
import net.vpg.snowrest.api.exceptions.*;
import net.vpg.snowrest.internal.utils.config.AuthorizationConfig;
import net.vpg.snowrest.internal.utils.config.ThreadingConfig;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.*;
import java.util.concurrent.*;

import static net.vpg.snowrest.RecordingDispatcher.json;
import static net.vpg.snowrest.RecordingDispatcher.millisBetween;
import static net.vpg.snowrest.RecordingDispatcher.ok;
import static org.junit.jupiter.api.Assertions.*;

class SequentialRestRateLimiterTest {
    // Scheduler delays are computed in whole milliseconds
    private static final long TOLERANCE = 10;

    private static final String LIMIT = RestRateLimiter.LIMIT_HEADER;
    private static final String REMAINING = RestRateLimiter.REMAINING_HEADER;
    private static final String RESET_AFTER = RestRateLimiter.RESET_AFTER_HEADER;

    private MockWebServer server;
    private RecordingDispatcher dispatcher;
    private SnowRest api;

    @BeforeEach
    void setUp() throws IOException {
        dispatcher = new RecordingDispatcher();
        server = new MockWebServer();
        server.setDispatcher(dispatcher);
        server.start();
        api = createApi(new RestConfig());
    }

    @AfterEach
    void tearDown() throws IOException {
        api.shutdownNow();
        server.shutdown();
    }

    private SnowRest createApi(RestConfig config) {
        if (api != null)
            api.shutdownNow();
        config.setBaseUrl(server.url("/").toString())
            .setHttpClient(new OkHttpClient.Builder().retryOnConnectionFailure(false).build());
        config.getRetryPolicy().setJitterRatio(0);
        return new SnowRest(new AuthorizationConfig("token"), new ThreadingConfig(), config);
    }

    private static RetryPolicy fastRetries() {
        return new RetryPolicy().setBaseBackoff(50, TimeUnit.MILLISECONDS);
    }

    private static void awaitAll(List<CompletableFuture<JsonNode>> futures) throws Exception {
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);
    }

    // ===== Ordering and bucket state =====

    @Test
    void shouldDispatchSameBucketInSubmissionOrder() throws Exception {
        String path = "/channels/123/messages";
        for (int i = 0; i < 5; i++)
            dispatcher.enqueue(path, ok(LIMIT, "5", REMAINING, String.valueOf(4 - i), RESET_AFTER, "1"));
        dispatcher.setHoldMillis(20);
        Route.CompiledRoute route = Route.Messages.SEND_MESSAGE.compile("123");

        long start = System.nanoTime();
        List<CompletableFuture<JsonNode>> futures = new ArrayList<>();
        for (int i = 0; i < 5; i++)
            futures.add(api.request(route, RestBody.json(Collections.singletonMap("n", i))).submit());
        awaitAll(futures);
        long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        List<String> bodies = new ArrayList<>();
        for (Hit hit : dispatcher.getHits(path))
            bodies.add(hit.getRequest().getBody().readUtf8());
        assertEquals(Arrays.asList("{\"n\":0}", "{\"n\":1}", "{\"n\":2}", "{\"n\":3}", "{\"n\":4}"), bodies);
        assertEquals(1, dispatcher.getMaxInFlight());
        assertTrue(elapsed < 1000, "Known bucket should not wait, took " + elapsed + " ms");
    }

    @Test
    void shouldKeepOrderWhenBucketHashIsLearnedFromAnotherChannel() throws Exception {
        String busy = "/channels/456/messages";
        dispatcher.enqueue(busy, ok().setHeadersDelay(800, TimeUnit.MILLISECONDS));
        dispatcher.enqueue("/channels/123/messages", ok(RestRateLimiter.HASH_HEADER, "abc",
            LIMIT, "5", REMAINING, "4", RESET_AFTER, "1"));
        Route.CompiledRoute route = Route.Messages.SEND_MESSAGE.compile("456");

        List<CompletableFuture<JsonNode>> futures = new ArrayList<>();
        futures.add(api.request(route, RestBody.json(Collections.singletonMap("n", "A0"))).submit());
        assertTrue(dispatcher.awaitHits(busy, 1, 5000));
        futures.add(api.request(route, RestBody.json(Collections.singletonMap("n", "A1"))).submit());
        api.request(Route.Messages.SEND_MESSAGE.compile("123"), RestBody.json(Collections.emptyMap()))
            .submit().get(5, TimeUnit.SECONDS);
        futures.add(api.request(route, RestBody.json(Collections.singletonMap("n", "B"))).submit());
        awaitAll(futures);

        List<Hit> hits = dispatcher.getHits(busy);
        List<String> bodies = new ArrayList<>();
        for (Hit hit : hits)
            bodies.add(hit.getRequest().getBody().readUtf8());
        assertEquals(Arrays.asList("{\"n\":\"A0\"}", "{\"n\":\"A1\"}", "{\"n\":\"B\"}"), bodies);
        // Nothing else is sent on the channel while the first response is pending
        assertTrue(millisBetween(hits.get(0), hits.get(1)) >= 800 - TOLERANCE);
    }

    @Test
    void shouldWaitForResetWhenBucketIsExhausted() throws Exception {
        String path = "/channels/1";
        dispatcher.enqueue(path, ok(LIMIT, "1", REMAINING, "0", RESET_AFTER, "2"));
        Route.CompiledRoute route = Route.Channels.GET_CHANNEL.compile("1");

        awaitAll(Arrays.asList(api.request(route).submit(), api.request(route).submit()));

        List<Hit> hits = dispatcher.getHits(path);
        assertEquals(2, hits.size());
        assertTrue(millisBetween(hits.get(0), hits.get(1)) >= 2000 - TOLERANCE);
    }

    @Test
    void shouldRetryAfterBucketRateLimitWithoutBlockingOtherBuckets() throws Exception {
        String limited = "/channels/1/messages";
        String other = "/guilds/2";
        dispatcher.enqueue(limited, json(429, "{\"message\":\"You are being rate limited.\",\"retry_after\":1.5,\"global\":false}",
            "Retry-After", "1", RestRateLimiter.SCOPE_HEADER, "user"));

        CompletableFuture<JsonNode> first = api.request(Route.Messages.SEND_MESSAGE.compile("1"), RestBody.json(Collections.emptyMap())).submit();
        assertTrue(dispatcher.awaitHits(limited, 1, 5000));
        CompletableFuture<JsonNode> second = api.request(Route.Guilds.GET_GUILD.compile("2")).submit();
        awaitAll(Arrays.asList(first, second));

        List<Hit> limitedHits = dispatcher.getHits(limited);
        Hit otherHit = dispatcher.getHits(other).get(0);
        assertEquals(2, limitedHits.size());
        // The body reported a longer retry_after than the header
        assertTrue(millisBetween(limitedHits.get(0), limitedHits.get(1)) >= 1500 - TOLERANCE);
        assertTrue(millisBetween(limitedHits.get(0), otherHit) < 1500);
        assertTrue(otherHit.getNanos() < limitedHits.get(1).getNanos());
    }

    @Test
    void shouldPauseAllBucketsOnGlobalRateLimit() throws Exception {
        String limited = "/channels/1/messages";
        String other = "/guilds/2";
        dispatcher.enqueue(limited, json(429, "{\"retry_after\":1.0,\"global\":true}",
            "Retry-After", "1", RestRateLimiter.GLOBAL_HEADER, "true"));

        CompletableFuture<JsonNode> first = api.request(Route.Messages.SEND_MESSAGE.compile("1"), RestBody.json(Collections.emptyMap())).submit();
        assertTrue(dispatcher.awaitHits(limited, 1, 5000));
        long deadline = System.currentTimeMillis() + 5000;
        while (api.getGlobalRateLimit().getResetTime() < 0 && System.currentTimeMillis() < deadline)
            Thread.sleep(5);
        CompletableFuture<JsonNode> second = api.request(Route.Guilds.GET_GUILD.compile("2")).submit();
        awaitAll(Arrays.asList(first, second));

        List<Hit> limitedHits = dispatcher.getHits(limited);
        Hit otherHit = dispatcher.getHits(other).get(0);
        assertTrue(millisBetween(limitedHits.get(0), limitedHits.get(1)) >= 1000 - TOLERANCE);
        assertTrue(millisBetween(limitedHits.get(0), otherHit) >= 1000 - TOLERANCE);
    }

    @Test
    void shouldSurfaceRateLimitWhenRetriesAreDisabled() {
        api = createApi(new RestConfig().setRetryPolicy(new RetryPolicy().setMaxRateLimitRetries(0)));
        dispatcher.enqueue("/channels/1", json(429, "{\"retry_after\":0.5,\"global\":false}", "Retry-After", "0.5"));

        RateLimitedException exception = assertThrows(RateLimitedException.class,
            () -> api.request(Route.Channels.GET_CHANNEL.compile("1")).complete());

        assertEquals(500, exception.getRetryAfter());
        assertFalse(exception.isGlobal());
        assertEquals(1, dispatcher.getHits("/channels/1").size());
    }

    // ===== Listeners =====

    @Test
    void shouldNotifyListenersAboutRequestLifecycle() throws Exception {
        List<String> events = new CopyOnWriteArrayList<>();
        RestListener recorder = new RestListener() {
            @Override
            public void onRequest(Route.CompiledRoute route, int attempt) {
                events.add("request " + attempt);
            }

            @Override
            public void onResponse(Route.CompiledRoute route, RestResponse response, long latency) {
                events.add("response " + response.code);
            }

            @Override
            public void onRateLimit(Route.CompiledRoute route, String bucket, long retryAfter, boolean global) {
                assertNotNull(bucket);
                events.add("rate limit " + retryAfter + " " + global);
            }
        };
        RestListener failing = new RestListener() {
            @Override
            public void onRequest(Route.CompiledRoute route, int attempt) {
                throw new IllegalStateException("listener failure");
            }
        };
        api = createApi(new RestConfig().addListener(failing).addListener(recorder));
        dispatcher.enqueue("/channels/1", json(429, "{\"retry_after\":0.2,\"global\":false}", "Retry-After", "0.2"));

        api.request(Route.Channels.GET_CHANNEL.compile("1")).submit().get(10, TimeUnit.SECONDS);

        assertEquals(Arrays.asList("request 1", "response 429", "rate limit 200 false", "request 2", "response 200"), events);
    }

    @Test
    void shouldNotifyListenersAboutNetworkFailure() throws Exception {
        List<Throwable> errors = new CopyOnWriteArrayList<>();
        api = createApi(new RestConfig().setRetryPolicy(fastRetries()).addListener(new RestListener() {
            @Override
            public void onRequestError(Route.CompiledRoute route, Throwable error) {
                errors.add(error);
            }
        }));
        dispatcher.enqueue("/channels/1", new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AFTER_REQUEST));

        api.request(Route.Channels.GET_CHANNEL.compile("1")).submit().get(10, TimeUnit.SECONDS);

        assertEquals(1, errors.size());
        assertTrue(errors.get(0) instanceof IOException);
    }

    // ===== Retries =====

    @Test
    void shouldRetryServerErrorsWithExponentialBackoff() throws Exception {
        api = createApi(new RestConfig());
        String path = "/channels/1";
        dispatcher.enqueue(path, json(500, "{}"), json(500, "{}"), json(200, "{\"id\":\"1\"}"));

        JsonNode channel = api.request(Route.Channels.GET_CHANNEL.compile("1")).submit().get(10, TimeUnit.SECONDS);

        List<Hit> hits = dispatcher.getHits(path);
        assertEquals("1", channel.get("id").asText());
        assertEquals(3, hits.size());
        assertTrue(millisBetween(hits.get(0), hits.get(1)) >= 500 - TOLERANCE);
        assertTrue(millisBetween(hits.get(1), hits.get(2)) >= 1000 - TOLERANCE);
    }

    @Test
    void shouldFailAfterExhaustingAttempts() {
        api = createApi(new RestConfig().setRetryPolicy(fastRetries()));
        String path = "/channels/1";
        dispatcher.enqueue(path, json(502, "{}"), json(503, "{}"), json(500, "bad gateway"));

        ServerErrorException exception = assertThrows(ServerErrorException.class,
            () -> api.request(Route.Channels.GET_CHANNEL.compile("1")).complete());

        assertEquals(3, exception.getAttempts());
        assertEquals(500, exception.getStatus());
        assertEquals("bad gateway", exception.getBody());
        assertEquals(3, dispatcher.getHits(path).size());
    }

    @Test
    void shouldRetryAfterConnectionFailure() throws Exception {
        api = createApi(new RestConfig().setRetryPolicy(fastRetries()));
        String path = "/channels/1";
        dispatcher.enqueue(path, new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AFTER_REQUEST));

        JsonNode result = api.request(Route.Channels.GET_CHANNEL.compile("1")).submit().get(10, TimeUnit.SECONDS);

        assertTrue(result.isObject());
        assertEquals(2, dispatcher.getHits(path).size());
    }

    @Test
    void shouldReportNetworkFailureAfterExhaustingAttempts() {
        api = createApi(new RestConfig().setRetryPolicy(fastRetries()));
        String path = "/channels/1";
        for (int i = 0; i < 3; i++)
            dispatcher.enqueue(path, new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AFTER_REQUEST));

        NetworkException exception = assertThrows(NetworkException.class,
            () -> api.request(Route.Channels.GET_CHANNEL.compile("1")).complete());

        assertEquals(3, exception.getAttempts());
        assertNotNull(exception.getCause());
    }

    @Test
    void shouldNotRetryClientErrors() throws Exception {
        String path = "/channels/404";
        dispatcher.enqueue(path, json(404, "{\"message\":\"Unknown Channel\",\"code\":10003}"));

        ClientErrorException exception = assertThrows(ClientErrorException.class,
            () -> api.request(Route.Channels.GET_CHANNEL.compile("404")).complete());

        assertEquals(404, exception.getStatus());
        assertEquals(10003, exception.getErrorCode());
        assertEquals("Unknown Channel", exception.getErrorMessage());
        assertEquals(1, exception.getAttempts());
        Thread.sleep(100);
        assertEquals(1, dispatcher.getHits(path).size());
    }

    // ===== Deadlines and lifecycle =====

    @Test
    void shouldTimeoutInFlightRequestAndContinueWithNext() throws Exception {
        String path = "/channels/9";
        dispatcher.enqueue(path, ok().setHeadersDelay(2, TimeUnit.SECONDS));
        Route.CompiledRoute route = Route.Channels.GET_CHANNEL.compile("9");

        long start = System.nanoTime();
        CompletableFuture<JsonNode> slow = api.request(route).timeout(300, TimeUnit.MILLISECONDS).submit();
        CompletableFuture<JsonNode> next = api.request(route).submit();

        ExecutionException exception = assertThrows(ExecutionException.class, () -> slow.get(5, TimeUnit.SECONDS));
        assertInstanceOf(TimeoutException.class, exception.getCause());
        next.get(5, TimeUnit.SECONDS);
        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 1500);
    }

    @Test
    void shouldRemoveWaitingRequestOnDeadline() throws Exception {
        String path = "/channels/1";
        dispatcher.enqueue(path, ok(LIMIT, "1", REMAINING, "0", RESET_AFTER, "2"));
        Route.CompiledRoute route = Route.Channels.GET_CHANNEL.compile("1");
        api.request(route).complete();

        CompletableFuture<JsonNode> waiting = api.request(route).timeout(200, TimeUnit.MILLISECONDS).submit();

        ExecutionException exception = assertThrows(ExecutionException.class, () -> waiting.get(5, TimeUnit.SECONDS));
        assertInstanceOf(TimeoutException.class, exception.getCause());
        assertEquals(1, dispatcher.getHits(path).size());
    }

    @Test
    void shouldCancelQueuedRequest() throws Exception {
        String path = "/channels/1";
        dispatcher.enqueue(path, ok(LIMIT, "1", REMAINING, "0", RESET_AFTER, "1"));
        Route.CompiledRoute route = Route.Channels.GET_CHANNEL.compile("1");
        api.request(route).complete();

        CompletableFuture<JsonNode> queued = api.request(route).submit();
        queued.cancel(false);

        assertThrows(CancellationException.class, () -> queued.get(5, TimeUnit.SECONDS));
        Thread.sleep(1200);
        assertEquals(1, dispatcher.getHits(path).size());
    }

    @Test
    void shouldLimitConcurrentRequestsAcrossBuckets() throws Exception {
        api = createApi(new RestConfig().setMaxConcurrentRequests(1));
        dispatcher.setHoldMillis(50);

        List<CompletableFuture<JsonNode>> futures = new ArrayList<>();
        for (int i = 0; i < 4; i++)
            futures.add(api.request(Route.Channels.GET_CHANNEL.compile(String.valueOf(i))).submit());
        awaitAll(futures);

        assertEquals(4, dispatcher.getHits().size());
        assertEquals(1, dispatcher.getMaxInFlight());
    }

    @Test
    void shouldResolveEmptyBodyAsMissingNode() {
        dispatcher.enqueue("/channels/1/messages/2", new MockResponse().setResponseCode(204));

        JsonNode result = api.request(Route.Messages.DELETE_MESSAGE.compile("1", "2")).complete();

        assertTrue(result.isMissingNode());
    }

    @Test
    void shouldReportMalformedSuccessBody() {
        dispatcher.enqueue("/channels/1", json(200, "{not json"));

        MalformedResponseException exception = assertThrows(MalformedResponseException.class,
            () -> api.request(Route.Channels.GET_CHANNEL.compile("1")).complete());

        assertEquals(200, exception.getStatus());
    }

    @Test
    void shouldRejectRequestsAfterShutdown() {
        api.shutdown();

        assertThrows(RejectedExecutionException.class, () -> api.request(Route.Channels.GET_CHANNEL.compile("1")).queue());
        CompletableFuture<JsonNode> future = api.request(Route.Channels.GET_CHANNEL.compile("1")).submit();
        assertTrue(future.isCompletedExceptionally());
    }
}
