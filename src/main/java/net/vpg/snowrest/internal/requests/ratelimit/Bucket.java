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
package net.vpg.snowrest.internal.requests.ratelimit;

import net.vpg.snowrest.api.requests.RestRateLimiter.Work;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Deque;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Quota state and pending requests of a single rate-limit bucket.
 * <br>All mutations happen under the lock of the rate-limiter.
 */
public class Bucket {
    public static final int UNKNOWN = -1;

    private final String key;
    private final Deque<Work> requests = new ConcurrentLinkedDeque<>();

    private long reset = 0;
    private int remaining = UNKNOWN;
    private int limit = UNKNOWN;
    private boolean inFlight = false;

    public Bucket(@Nonnull String key) {
        this.key = key;
    }

    @Nonnull
    public String getKey() {
        return key;
    }

    public void enqueue(@Nonnull Work request) {
        requests.addLast(request);
    }

    public void retry(@Nonnull Work request) {
        requests.addFirst(request);
    }

    @Nullable
    public Work peek() {
        return requests.peekFirst();
    }

    @Nullable
    public Work poll() {
        return requests.pollFirst();
    }

    public boolean remove(@Nonnull Work request) {
        return requests.remove(request);
    }

    public boolean isEmpty() {
        return requests.isEmpty();
    }

    @Nonnull
    public Deque<Work> getRequests() {
        return requests;
    }

    public boolean isInFlight() {
        return inFlight;
    }

    public void reserve() {
        inFlight = true;
        if (remaining > 0)
            remaining--;
    }

    public void release() {
        inFlight = false;
    }

    public boolean isUnknown() {
        return remaining == UNKNOWN;
    }

    public void markUnknown() {
        limit = UNKNOWN;
        remaining = UNKNOWN;
        reset = 0;
    }

    public void update(int limit, int remaining, long reset) {
        this.limit = Math.max(limit, UNKNOWN);
        this.remaining = Math.max(remaining, 0);
        this.reset = reset;
    }

    /**
     * Exhausts this bucket until the provided time.
     *
     * @param reset Monotonic time at which the bucket may be used again
     */
    public void exhaust(long reset) {
        this.remaining = 0;
        this.reset = Math.max(this.reset, reset);
    }

    public int getLimit() {
        return limit;
    }

    public int getRemaining() {
        return remaining;
    }

    public long getReset() {
        return reset;
    }

    /**
     * Restores the remaining count to the limit once the reset time of an exhausted bucket passed.
     *
     * @param now The current monotonic time
     */
    public void refill(long now) {
        if (remaining == 0 && reset <= now)
            remaining = limit;
    }

    /**
     * The time until this bucket may dispatch again.
     *
     * @param now The current monotonic time
     * @return Milliseconds to wait, or 0 if a request may be sent now
     */
    public long getRateLimit(long now) {
        if (remaining != 0 || reset <= now)
            return 0;
        return reset - now;
    }

    @Override
    public String toString() {
        return "Bucket(" + key + ", remaining=" + remaining + "/" + limit + ", queue=" + requests.size() + ")";
    }

    @Override
    public int hashCode() {
        return key.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof Bucket))
            return false;
        return key.equals(((Bucket) obj).key);
    }
}
