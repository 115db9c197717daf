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
package net.vpg.snowrest.internal.utils.config;

import net.vpg.snowrest.internal.utils.CountingThreadFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.concurrent.*;
import java.util.function.Supplier;

/**
 * Owns the executors used by the API.
 * <br>Executors created here are shut down with the API, provided executors only if requested.
 */
public class ThreadingConfig {
    private ScheduledExecutorService rateLimitScheduler;
    private ExecutorService rateLimitElastic;
    private ExecutorService callbackPool;

    private boolean shutdownRateLimitScheduler;
    private boolean shutdownRateLimitElastic;
    private boolean shutdownCallbackPool;

    public ThreadingConfig() {
        this.callbackPool = ForkJoinPool.commonPool();
        this.shutdownRateLimitScheduler = true;
        this.shutdownRateLimitElastic = true;
        this.shutdownCallbackPool = false;
    }

    @Nonnull
    public static ScheduledExecutorService newScheduler(int coreSize, Supplier<String> identifier, String baseName) {
        return new ScheduledThreadPoolExecutor(coreSize, new CountingThreadFactory(identifier, baseName));
    }

    @Nonnull
    public static ExecutorService newElastic(Supplier<String> identifier, String baseName) {
        return Executors.newCachedThreadPool(new CountingThreadFactory(identifier, baseName));
    }

    @Nonnull
    public static ThreadingConfig getDefault() {
        return new ThreadingConfig();
    }

    public void setRateLimitScheduler(@Nullable ScheduledExecutorService executor, boolean shutdown) {
        this.rateLimitScheduler = executor;
        this.shutdownRateLimitScheduler = shutdown;
    }

    public void setRateLimitElastic(@Nullable ExecutorService executor, boolean shutdown) {
        this.rateLimitElastic = executor;
        this.shutdownRateLimitElastic = shutdown;
    }

    public void setCallbackPool(@Nullable ExecutorService executor, boolean shutdown) {
        this.callbackPool = executor == null ? ForkJoinPool.commonPool() : executor;
        this.shutdownCallbackPool = executor != null && shutdown;
    }

    public void init(@Nonnull Supplier<String> identifier) {
        if (this.rateLimitScheduler == null)
            this.rateLimitScheduler = newScheduler(2, identifier, "RateLimit-Scheduler");
        if (this.rateLimitElastic == null)
            this.rateLimitElastic = newElastic(identifier, "RateLimit-Elastic");
    }

    public void shutdown() {
        if (shutdownCallbackPool)
            callbackPool.shutdown();
        if (shutdownRateLimitElastic && rateLimitElastic != null)
            rateLimitElastic.shutdown();
        if (shutdownRateLimitScheduler && rateLimitScheduler != null)
            rateLimitScheduler.shutdown();
    }

    public void shutdownNow() {
        if (shutdownCallbackPool)
            callbackPool.shutdownNow();
        if (shutdownRateLimitElastic && rateLimitElastic != null)
            rateLimitElastic.shutdownNow();
        if (shutdownRateLimitScheduler && rateLimitScheduler != null)
            rateLimitScheduler.shutdownNow();
    }

    @Nonnull
    public ScheduledExecutorService getRateLimitScheduler() {
        return rateLimitScheduler;
    }

    @Nonnull
    public ExecutorService getRateLimitElastic() {
        return rateLimitElastic;
    }

    @Nonnull
    public ExecutorService getCallbackPool() {
        return callbackPool;
    }

    public boolean isShutdownRateLimitScheduler() {
        return shutdownRateLimitScheduler;
    }

    public boolean isShutdownRateLimitElastic() {
        return shutdownRateLimitElastic;
    }

    public boolean isShutdownCallbackPool() {
        return shutdownCallbackPool;
    }
}
