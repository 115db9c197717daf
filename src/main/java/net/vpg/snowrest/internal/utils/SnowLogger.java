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
package net.vpg.snowrest.internal.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central place for obtaining loggers of this library.
 * <br>Loggers are cached by their simple name.
 */
public class SnowLogger {
    private static final Map<String, Logger> LOGS = new ConcurrentHashMap<>();

    private SnowLogger() {
    }

    @Nonnull
    public static Logger getLog(@Nonnull String name) {
        return LOGS.computeIfAbsent(name, LoggerFactory::getLogger);
    }

    @Nonnull
    public static Logger getLog(@Nonnull Class<?> clazz) {
        return LOGS.computeIfAbsent(clazz.getName(), key -> LoggerFactory.getLogger(clazz));
    }

    /**
     * Utility function to enable logging of complex statements more efficiently (lazy).
     *
     * @param lazyLambda The Supplier used when evaluating the expression
     * @return An Object that can be passed to SLF4J's logging methods as lazy parameter
     */
    @Nonnull
    public static Object getLazyString(@Nonnull LazyEvaluation lazyLambda) {
        return new Object() {
            @Override
            public String toString() {
                try {
                    return lazyLambda.getString();
                } catch (Exception ex) {
                    return "Error while evaluating lazy String... " + ex;
                }
            }
        };
    }

    /**
     * Functional interface used for {@link #getLazyString(LazyEvaluation)} to lazily construct a String.
     */
    @FunctionalInterface
    public interface LazyEvaluation {
        String getString() throws Exception;
    }
}
