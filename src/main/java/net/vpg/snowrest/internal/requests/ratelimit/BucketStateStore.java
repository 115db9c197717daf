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

import net.vpg.snowrest.api.requests.RestListener;
import net.vpg.snowrest.api.requests.RestRateLimiter;
import net.vpg.snowrest.api.requests.RestRateLimiter.GlobalRateLimit;
import net.vpg.snowrest.api.requests.RestRateLimiter.Work;
import net.vpg.snowrest.api.requests.RestResponse;
import net.vpg.snowrest.api.requests.Route;
import net.vpg.snowrest.internal.utils.Helpers;
import net.vpg.snowrest.internal.utils.SnowLogger;
import okhttp3.Headers;
import org.slf4j.Logger;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.*;
import java.util.function.LongSupplier;
import java.util.function.Predicate;

/**
 * Table of rate-limit buckets and the only place that interprets rate-limit headers.
 *
 * <p>Buckets are first keyed by the locally resolved route key.
 * Once a response reports the remote bucket hash of a route, that route resolves to
 * {@code hash:majorParameters} instead, shared by every route with the same hash.
 *
 * <p>This class is not thread-safe, callers must hold the rate-limiter lock.
 */
public class BucketStateStore {
    public static final Logger log = SnowLogger.getLog(BucketStateStore.class);
    public static final long DEFAULT_RETRY_AFTER = 1000;

    private final Map<Route, String> hashes = new HashMap<>();
    private final Map<Route, String> previousHashes = new HashMap<>();
    private final Map<String, Bucket> buckets = new HashMap<>();
    private final RouteKeyResolver resolver;
    private final GlobalRateLimit globalRateLimit;
    private final boolean relative;
    private final LongSupplier clock;
    private final RestListener listener;

    public BucketStateStore(@Nonnull RouteKeyResolver resolver, @Nonnull GlobalRateLimit globalRateLimit, boolean relative,
                            @Nonnull RestListener listener) {
        this(resolver, globalRateLimit, relative, Helpers::monotonicMillis, listener);
    }

    public BucketStateStore(@Nonnull RouteKeyResolver resolver, @Nonnull GlobalRateLimit globalRateLimit,
                            boolean relative, @Nonnull LongSupplier clock) {
        this(resolver, globalRateLimit, relative, clock, RestListener.of(Collections.emptyList()));
    }

    public BucketStateStore(@Nonnull RouteKeyResolver resolver, @Nonnull GlobalRateLimit globalRateLimit,
                            boolean relative, @Nonnull LongSupplier clock, @Nonnull RestListener listener) {
        this.resolver = resolver;
        this.globalRateLimit = globalRateLimit;
        this.relative = relative;
        this.clock = clock;
        this.listener = listener;
    }

    public long now() {
        return clock.getAsLong();
    }

    @Nonnull
    public String resolveKey(@Nonnull Route.CompiledRoute route) {
        String hash = hashes.get(route.getBaseRoute());
        if (hash == null)
            return resolver.resolve(route);
        return hash + ":" + resolver.resolveMajorParameters(route);
    }

    /**
     * The bucket new requests for this route are queued in.
     * <br>While a bucket the route used before learning its current hash still has queued or running work,
     * that bucket is returned instead, so requests stay behind earlier ones until the old bucket moves its work.
     *
     * @param route The route
     * @return The bucket, created if needed
     */
    @Nonnull
    public Bucket getBucket(@Nonnull Route.CompiledRoute route) {
        for (String key : getPreviousKeys(route)) {
            Bucket previous = buckets.get(key);
            if (previous != null && (previous.isInFlight() || !previous.isEmpty()))
                return previous;
        }
        return buckets.computeIfAbsent(resolveKey(route), Bucket::new);
    }

    /**
     * Finds the existing buckets a request on this route may be queued in.
     *
     * @param route The route
     * @return The buckets, starting with the current one
     */
    @Nonnull
    public List<Bucket> findBuckets(@Nonnull Route.CompiledRoute route) {
        List<Bucket> found = new ArrayList<>(3);
        Bucket current = buckets.get(resolveKey(route));
        if (current != null)
            found.add(current);
        for (String key : getPreviousKeys(route)) {
            Bucket previous = buckets.get(key);
            if (previous != null)
                found.add(previous);
        }
        return found;
    }

    // Keys this route resolved to before its current hash was known, most recent first
    private List<String> getPreviousKeys(Route.CompiledRoute route) {
        String hash = hashes.get(route.getBaseRoute());
        if (hash == null)
            return Collections.emptyList();
        String previousHash = previousHashes.get(route.getBaseRoute());
        if (previousHash == null)
            return Collections.singletonList(resolver.resolve(route));
        return Arrays.asList(previousHash + ":" + resolver.resolveMajorParameters(route), resolver.resolve(route));
    }

    @Nullable
    public String getHash(@Nonnull Route route) {
        return hashes.get(route);
    }

    @Nonnull
    public Collection<Bucket> getBuckets() {
        return Collections.unmodifiableCollection(buckets.values());
    }

    @Nonnull
    public GlobalRateLimit getGlobalRateLimit() {
        return globalRateLimit;
    }

    /**
     * The time until the bucket may dispatch, considering the global rate-limit.
     *
     * @param bucket The bucket
     * @return Milliseconds to wait, or 0
     */
    public long getRateLimit(@Nonnull Bucket bucket) {
        long now = now();
        bucket.refill(now);
        return Math.max(globalRateLimit.getRemaining(now), bucket.getRateLimit(now));
    }

    public boolean isAvailable(@Nonnull Bucket bucket) {
        return !bucket.isInFlight() && getRateLimit(bucket) == 0;
    }

    /**
     * Applies the rate-limit information of a response.
     *
     * @param bucket   The bucket the request was dispatched from
     * @param route    The route of the request
     * @param response The response
     * @return The bucket the route belongs to from now on, usually the same bucket
     */
    @Nonnull
    public Bucket update(@Nonnull Bucket bucket, @Nonnull Route.CompiledRoute route, @Nonnull RestResponse response) {
        if (response.isError())
            return bucket;

        String hash = response.getHeader(RestRateLimiter.HASH_HEADER);
        if (hash != null) {
            String previous = hashes.put(route.getBaseRoute(), hash);
            if (previous == null) {
                log.debug("Caching bucket hash {} -> {}", route.getBaseRoute(), hash);
            } else if (!previous.equals(hash)) {
                previousHashes.put(route.getBaseRoute(), previous);
                log.debug("Bucket hash of {} changed from {} to {}", route.getBaseRoute(), previous, hash);
            }
        }

        // Every bucket the route used before its current key moves its work over on its next response
        String key = resolveKey(route);
        Bucket target = bucket.getKey().equals(key) ? bucket : buckets.computeIfAbsent(key, Bucket::new);

        long now = now();
        if (response.isRateLimit()) {
            long retryAfter = response.getRetryAfter();
            if (retryAfter < 0) {
                log.warn("Received 429 without valid Retry-After on route {}, assuming {} ms", route, DEFAULT_RETRY_AFTER);
                retryAfter = DEFAULT_RETRY_AFTER;
            }
            String scope = response.getHeader(RestRateLimiter.SCOPE_HEADER);
            if (response.isGlobalRateLimit()) {
                globalRateLimit.setResetTime(now + retryAfter);
                log.error("Encountered global rate limit! Retry-After: {} ms Scope: {}", retryAfter, scope);
                listener.onRateLimit(route, null, retryAfter, true);
            } else {
                target.exhaust(now + retryAfter);
                log.warn("Encountered 429 on route {} with bucket {} Retry-After: {} ms Scope: {}",
                    route.getBaseRoute(), target.getKey(), retryAfter, scope);
                listener.onRateLimit(route, target.getKey(), retryAfter, false);
            }
            return target;
        }

        applyHeaders(target, route, response, now);
        return target;
    }

    private void applyHeaders(Bucket bucket, Route.CompiledRoute route, RestResponse response, long now) {
        Headers headers = response.getHeaders();
        String limitHeader = headers.get(RestRateLimiter.LIMIT_HEADER);
        String remainingHeader = headers.get(RestRateLimiter.REMAINING_HEADER);
        String resetHeader = relative
            ? headers.get(RestRateLimiter.RESET_AFTER_HEADER)
            : headers.get(RestRateLimiter.RESET_HEADER);

        if (limitHeader == null && remainingHeader == null && resetHeader == null) {
            // No rate-limit information, fall back to one request at a time
            if (response.isOk())
                bucket.markUnknown();
            return;
        }

        try {
            if (remainingHeader == null || resetHeader == null)
                throw new NumberFormatException("Missing remaining or reset header");
            int remaining = parseCount(remainingHeader);
            int limit = limitHeader == null ? Math.max(bucket.getLimit(), remaining) : parseCount(limitHeader);
            long reset = relative
                ? now + parseSeconds(resetHeader)
                : now + Math.max(0, parseSeconds(resetHeader) - System.currentTimeMillis());
            bucket.update(limit, remaining, reset);
            log.trace("Updated bucket {} to ({}/{}, {})", bucket.getKey(), remaining, limit, reset - now);
        } catch (NumberFormatException e) {
            log.warn("Encountered malformed rate-limit headers on route {}, bucket state is now unknown: {}", route, e.getMessage());
            bucket.markUnknown();
        }
    }

    private static int parseCount(String value) {
        int count = Integer.parseInt(value.trim());
        if (count < 0)
            throw new NumberFormatException("Negative count: " + value);
        return count;
    }

    private static long parseSeconds(String value) {
        double seconds = Double.parseDouble(value.trim());
        if (Double.isNaN(seconds) || Double.isInfinite(seconds) || seconds < 0)
            throw new NumberFormatException("Invalid seconds: " + value);
        return (long) Math.ceil(seconds * 1000);
    }

    /**
     * Moves all queued work to the front of another bucket, keeping the order, and forgets the old bucket.
     *
     * @param from The bucket to empty
     * @param to   The bucket to receive the work
     */
    public void transfer(@Nonnull Bucket from, @Nonnull Bucket to) {
        if (from == to)
            return;
        Iterator<Work> iterator = from.getRequests().descendingIterator();
        while (iterator.hasNext())
            to.retry(iterator.next());
        from.getRequests().clear();
        if (!from.isInFlight())
            buckets.remove(from.getKey(), from);
    }

    /**
     * Removes buckets that are idle and no longer rate-limited.
     * <br>Remote bucket hashes are kept.
     *
     * @param active Buckets that must be kept, for example because a worker is scheduled
     * @return The number of removed buckets
     */
    public int cleanup(@Nonnull Predicate<Bucket> active) {
        long now = now();
        int removed = 0;
        Iterator<Bucket> iterator = buckets.values().iterator();
        while (iterator.hasNext()) {
            Bucket bucket = iterator.next();
            if (bucket.isEmpty() && !bucket.isInFlight() && bucket.getReset() <= now && !active.test(bucket)) {
                iterator.remove();
                removed++;
            }
        }
        return removed;
    }
}
