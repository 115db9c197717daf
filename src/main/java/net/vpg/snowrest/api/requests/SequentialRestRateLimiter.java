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

import net.vpg.snowrest.api.utils.MiscUtil;
import net.vpg.snowrest.internal.requests.ratelimit.Bucket;
import net.vpg.snowrest.internal.requests.ratelimit.BucketStateStore;
import net.vpg.snowrest.internal.requests.ratelimit.RouteKeyResolver;
import net.vpg.snowrest.internal.utils.SnowLogger;
import org.slf4j.Logger;

import javax.annotation.Nonnull;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A bucket-aware rate-limiter which executes the requests of each bucket sequentially.
 *
 * <p>Every bucket is drained by at most one worker at a time. A worker takes the head of its bucket,
 * sends it, applies the rate-limit headers of the response and only then continues with the next request.
 * When the bucket or the global rate-limit is exhausted, the worker exits and is scheduled again once the
 * limit has reset.
 *
 * <p>Retries go back to the head of their bucket:
 * <ul>
 *     <li>{@code 429} responses are retried after the reported {@code Retry-After},
 *     up to {@link RetryPolicy#getMaxRateLimitRetries()} times</li>
 *     <li>server and network errors are retried with the backoff of the {@link RetryPolicy}</li>
 * </ul>
 *
 * <p>Buckets are identified by the route key of {@link RouteKeyResolver}, until the API reports the
 * {@value #HASH_HEADER} of a route. From then on all routes sharing that hash and the same major parameters
 * use one bucket. A route keeps using its previous bucket while that bucket still has work, which moves over
 * once its next response arrived.
 */
public class SequentialRestRateLimiter implements RestRateLimiter {
    private static final Logger log = SnowLogger.getLog(RestRateLimiter.class);

    private final CompletableFuture<?> shutdownHandle = new CompletableFuture<>();
    private final Future<?> cleanupWorker;
    private final RateLimitConfig config;
    private final RetryPolicy retryPolicy;
    private final BucketStateStore store;
    private final Semaphore concurrency;
    private final AtomicLong sequence = new AtomicLong();

    private final ReentrantLock lock = new ReentrantLock();
    // Buckets with a scheduled or running worker
    private final Map<Bucket, Future<?>> rateLimitQueue = new HashMap<>();

    private boolean isStopped, isShutdown;

    public SequentialRestRateLimiter(@Nonnull RateLimitConfig config) {
        this.config = config;
        this.retryPolicy = config.getRetryPolicy();
        this.store = new BucketStateStore(new RouteKeyResolver(config.getMajorParameters()), config.getGlobalRateLimit(), config.isRelative(),
            config.getListener());
        this.concurrency = config.getMaxConcurrentRequests() > 0 ? new Semaphore(config.getMaxConcurrentRequests(), true) : null;
        this.cleanupWorker = config.getScheduler().scheduleAtFixedRate(this::cleanup, 30, 30, TimeUnit.SECONDS);
    }

    @Override
    public void enqueue(@Nonnull Work task) {
        MiscUtil.locked(lock, () -> {
            task.getRequest().setSequence(sequence.getAndIncrement());
            Bucket bucket = store.getBucket(task.getRoute());
            bucket.enqueue(task);
            runBucket(bucket);
        });
    }

    @Override
    public boolean dequeue(@Nonnull Work task) {
        return MiscUtil.locked(lock, () -> {
            Bucket bucket = null;
            for (Bucket candidate : store.findBuckets(task.getRoute())) {
                if (candidate.remove(task)) {
                    bucket = candidate;
                    break;
                }
            }
            if (bucket == null)
                return false;
            // A worker waiting for the backoff of this request can start right away
            Future<?> worker = rateLimitQueue.get(bucket);
            if (worker != null && worker.cancel(false)) {
                rateLimitQueue.remove(bucket);
                if (!bucket.isEmpty())
                    runBucket(bucket);
            }
            return true;
        });
    }

    @Override
    public void stop(boolean shutdown, @Nonnull Runnable callback) {
        MiscUtil.locked(lock, () -> {
            boolean doShutdown = shutdown;
            if (!isStopped) {
                isStopped = true;
                shutdownHandle.thenRun(callback);
                if (!doShutdown) {
                    int count = store.getBuckets().stream()
                        .mapToInt(bucket -> bucket.getRequests().size())
                        .sum();

                    if (count > 0)
                        log.info("Waiting for {} requests to finish.", count);

                    doShutdown = count == 0 && rateLimitQueue.isEmpty();
                }
            }
            if (doShutdown && !isShutdown)
                shutdown();
        });
    }

    @Override
    public boolean isStopped() {
        return isStopped;
    }

    @Override
    public int cancelRequests() {
        return MiscUtil.locked(lock, () -> {
            int cancelled = 0;
            for (Bucket bucket : store.getBuckets()) {
                for (Work request : bucket.getRequests()) {
                    if (!request.isDone()) {
                        request.cancel();
                        cancelled++;
                    }
                }
                bucket.getRequests().removeIf(Work::isDone);
            }

            if (cancelled == 1)
                log.warn("Cancelled 1 request!");
            else if (cancelled > 1)
                log.warn("Cancelled {} requests!", cancelled);
            return cancelled;
        });
    }

    @Nonnull
    public RateLimitConfig getConfig() {
        return config;
    }

    @Nonnull
    public BucketStateStore getStore() {
        return store;
    }

    private void shutdown() {
        isShutdown = true;
        cleanupWorker.cancel(false);
        cleanup();
        shutdownHandle.complete(null);
    }

    private void cleanup() {
        // This will remove buckets that are no longer needed every 30 seconds to avoid memory leakage
        // We will keep the hashes in memory since they are very limited (by the amount of possible routes)
        MiscUtil.locked(lock, () -> {
            for (Bucket bucket : store.getBuckets()) {
                if (isShutdown)
                    bucket.getRequests().forEach(Work::cancel);
                bucket.getRequests().removeIf(Work::isSkipped);
            }
            int removed = store.cleanup(rateLimitQueue::containsKey);
            if (removed > 0)
                log.debug("Removed {} expired buckets", removed);
        });
    }

    private void scheduleElastic(Bucket bucket) {
        if (isShutdown)
            return;

        ExecutorService elastic = config.getElastic();
        ScheduledExecutorService scheduler = config.getScheduler();

        try {
            // Execute on elastic pool to avoid blocking the scheduler with network calls
            elastic.execute(() -> drain(bucket));
        } catch (RejectedExecutionException ex) {
            if (elastic == scheduler)
                throw ex;
            log.debug("Elastic pool rejected the bucket worker, running on the scheduler");
            scheduler.execute(() -> drain(bucket));
        }
    }

    private void runBucket(Bucket bucket) {
        if (isShutdown)
            return;
        // Schedule a new bucket worker if no worker is running
        rateLimitQueue.computeIfAbsent(bucket,
            k -> config.getScheduler().schedule(
                () -> scheduleElastic(bucket),
                getDelay(bucket), TimeUnit.MILLISECONDS));
    }

    private long getDelay(Bucket bucket) {
        long delay = store.getRateLimit(bucket);
        Work head = bucket.peek();
        if (head != null)
            delay = Math.max(delay, head.getRequest().getRetryAt() - store.now());
        return Math.max(0, delay);
    }

    private Work next(Bucket bucket) {
        while (true) {
            Work head = bucket.peek();
            if (head == null)
                return null;
            if (head.isDone() || head.isSkipped()) {
                bucket.poll();
                continue;
            }

            long delay = getDelay(bucket);
            if (delay > 0) {
                head.getRequest().setState(RestRequest.State.WAITING);
                log.debug("Waiting for {} ms before running bucket {}", delay, bucket.getKey());
                return null;
            }

            bucket.poll();
            bucket.reserve();
            head.getRequest().setState(RestRequest.State.IN_FLIGHT);
            return head;
        }
    }

    private void drain(Bucket bucket) {
        log.trace("Bucket {} is running {} requests", bucket.getKey(), bucket.getRequests().size());
        try {
            while (true) {
                Work task = MiscUtil.locked(lock, () -> next(bucket));
                if (task == null)
                    break;

                RestResponse response = execute(task);
                boolean retry = prepareRetry(task, response);

                Bucket target = MiscUtil.locked(lock, () -> {
                    bucket.release();
                    Bucket updated = store.update(bucket, task.getRoute(), response);
                    if (retry && !task.isDone()) {
                        task.getRequest().setState(RestRequest.State.RETRYING);
                        bucket.retry(task);
                    }
                    if (updated != bucket) {
                        log.debug("Moving {} requests from bucket {} to {}", bucket.getRequests().size(), bucket.getKey(), updated.getKey());
                        store.transfer(bucket, updated);
                        runBucket(updated);
                    }
                    return updated;
                });

                if (!retry)
                    task.handleResponse(response);
                if (target != bucket)
                    break;
            }
        } catch (Throwable t) {
            log.error("Encountered exception in bucket worker for {}", bucket.getKey(), t);
            if (t instanceof Error)
                throw (Error) t;
        } finally {
            backoff(bucket);
        }
    }

    private RestResponse execute(Work task) {
        if (concurrency != null)
            concurrency.acquireUninterruptibly();
        try {
            return task.execute();
        } catch (Exception e) {
            log.error("Encountered exception trying to execute request", e);
            return new RestResponse(e);
        } finally {
            if (concurrency != null)
                concurrency.release();
        }
    }

    private boolean prepareRetry(Work task, RestResponse response) {
        if (task.isDone())
            return false;
        RestRequest<?> request = task.getRequest();
        RetryPolicy.Outcome outcome = RetryPolicy.classify(response);
        if (outcome == RetryPolicy.Outcome.RATE_LIMITED) {
            if (!retryPolicy.shouldRetryRateLimit(request.getRateLimitHits() + 1))
                return false;
            request.incrementRateLimitHits();
            return true;
        }
        if (outcome.isRetryable() && retryPolicy.shouldRetry(request.getFailedAttempts())) {
            long backoff = retryPolicy.getBackoff(request.getFailedAttempts());
            request.setRetryAt(store.now() + backoff);
            log.debug("Retrying request on {} after {} in {} ms (attempt {})", task.getRoute(), outcome, backoff, request.getAttempts());
            return true;
        }
        return false;
    }

    private void backoff(Bucket bucket) {
        // Schedule backoff if requests are not done
        MiscUtil.locked(lock, () -> {
            rateLimitQueue.remove(bucket);
            if (isShutdown) {
                bucket.getRequests().forEach(Work::cancel);
                bucket.getRequests().clear();
            } else if (!bucket.isEmpty()) {
                runBucket(bucket);
            }
            if (isStopped && !isShutdown && rateLimitQueue.isEmpty())
                shutdown();
        });
    }
}
