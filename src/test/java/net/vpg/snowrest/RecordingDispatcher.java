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
package net.vpg.snowrest;

import okhttp3.HttpUrl;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.RecordedRequest;

import javax.annotation.Nonnull;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Serves scripted responses per path and records when each request arrived.
 * <br>Paths without a scripted response are answered with {@code 200 {}}.
 */
public class RecordingDispatcher extends Dispatcher {
    private final Map<String, Deque<MockResponse>> scripted = new ConcurrentHashMap<>();
    private final List<Hit> hits = new ArrayList<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private int maxInFlight;
    private volatile long holdMillis;

    public static MockResponse ok(String... headers) {
        return json(200, "{}", headers);
    }

    public static MockResponse json(int code, String body, String... headers) {
        MockResponse response = new MockResponse()
            .setResponseCode(code)
            .setHeader("Content-Type", "application/json")
            .setBody(body);
        for (int i = 0; i < headers.length; i += 2)
            response.setHeader(headers[i], headers[i + 1]);
        return response;
    }

    public static long millisBetween(Hit first, Hit second) {
        return TimeUnit.NANOSECONDS.toMillis(second.getNanos() - first.getNanos());
    }

    public RecordingDispatcher enqueue(String path, MockResponse... responses) {
        scripted.computeIfAbsent(path, k -> new ConcurrentLinkedDeque<>()).addAll(Arrays.asList(responses));
        return this;
    }

    // Keeps each request on the server for a while, to observe overlapping requests
    public void setHoldMillis(long holdMillis) {
        this.holdMillis = holdMillis;
    }

    @Nonnull
    @Override
    public MockResponse dispatch(@Nonnull RecordedRequest request) throws InterruptedException {
        HttpUrl url = request.getRequestUrl();
        String path = url == null ? request.getPath() : url.encodedPath();
        int current = inFlight.incrementAndGet();
        synchronized (this) {
            maxInFlight = Math.max(maxInFlight, current);
            hits.add(new Hit(path, request, System.nanoTime()));
            notifyAll();
        }
        try {
            long hold = holdMillis;
            if (hold > 0)
                Thread.sleep(hold);
        } finally {
            inFlight.decrementAndGet();
        }
        Deque<MockResponse> queue = scripted.get(path);
        MockResponse response = queue == null ? null : queue.poll();
        return response == null ? ok() : response;
    }

    public synchronized List<Hit> getHits() {
        return new ArrayList<>(hits);
    }

    public synchronized List<Hit> getHits(String path) {
        return hits.stream().filter(hit -> hit.getPath().equals(path)).collect(Collectors.toList());
    }

    public synchronized int getMaxInFlight() {
        return maxInFlight;
    }

    public synchronized boolean awaitHits(String path, int count, long timeoutMillis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (getHits(path).size() < count) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0)
                return false;
            wait(remaining);
        }
        return true;
    }

    public static class Hit {
        private final String path;
        private final RecordedRequest request;
        private final long nanos;

        Hit(String path, RecordedRequest request, long nanos) {
            this.path = path;
            this.request = request;
            this.nanos = nanos;
        }

        public String getPath() {
            return path;
        }

        public RecordedRequest getRequest() {
            return request;
        }

        public long getNanos() {
            return nanos;
        }

        @Override
        public String toString() {
            return request.getMethod() + " " + request.getPath();
        }
    }
}
