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
package net.vpg.snowrest.api.utils;

import javax.annotation.Nonnull;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

/**
 * Utility methods for locks shared across the library.
 */
public class MiscUtil {
    /**
     * Tries to acquire the lock within a timeout of 10 seconds.
     *
     * @param lock The lock to acquire
     * @throws IllegalStateException If the lock could not be acquired in time, or the thread was interrupted
     */
    public static void tryLock(@Nonnull Lock lock) {
        try {
            if (!lock.tryLock() && !lock.tryLock(10, TimeUnit.SECONDS))
                throw new IllegalStateException("Could not acquire lock in a reasonable timeframe! (10 seconds)");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Unable to acquire lock while thread is interrupted!");
        }
    }

    public static <E> E locked(@Nonnull Lock lock, @Nonnull Supplier<E> task) {
        tryLock(lock);
        try {
            return task.get();
        } finally {
            lock.unlock();
        }
    }

    public static void locked(@Nonnull Lock lock, @Nonnull Runnable task) {
        tryLock(lock);
        try {
            task.run();
        } finally {
            lock.unlock();
        }
    }
}
