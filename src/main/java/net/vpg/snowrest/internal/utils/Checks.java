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

import org.jetbrains.annotations.Contract;

import java.util.Collection;

public class Checks {
    @Contract("false, _ -> fail")
    public static void check(boolean expression, String message) {
        if (!expression)
            fail(message);
    }

    @Contract("false, _, _ -> fail")
    public static void check(boolean expression, String message, Object... args) {
        if (!expression)
            fail(message, args);
    }

    @Contract("null, _ -> fail")
    public static void notNull(Object argument, String name) {
        check(argument != null, name + " may not be null");
    }

    @Contract("null, _ -> fail")
    public static void notEmpty(CharSequence argument, String name) {
        notNull(argument, name);
        check(!Helpers.isEmpty(argument), name + " may not be empty");
    }

    @Contract("null, _ -> fail")
    public static void notBlank(CharSequence argument, String name) {
        notNull(argument, name);
        check(!Helpers.isBlank(argument), name + " may not be blank");
    }

    @Contract("null, _ -> fail")
    public static void noWhitespace(CharSequence argument, String name) {
        notNull(argument, name);
        check(!Helpers.containsWhitespace(argument), "%s may not contain blanks. Provided: \"%s\"", name, argument);
    }

    @Contract("null, _ -> fail")
    public static void noneNull(Collection<?> argument, String name) {
        notNull(argument, name);
        argument.forEach(it -> notNull(it, name));
    }

    @Contract("null, _ -> fail")
    public static void noneNull(Object[] argument, String name) {
        notNull(argument, name);
        for (Object it : argument) {
            notNull(it, name);
        }
    }

    @Contract("null, _ -> fail")
    public static void isSnowflake(String input, String name) {
        notNull(input, name);
        check(Helpers.isNumeric(input) && input.length() <= 20, "%s is not a valid snowflake value! Provided: \"%s\"", name, input);
    }

    public static void inRange(int input, int min, int max, String name) {
        check(min <= input && input <= max, "%s must be between %d and %d! Provided: %d", name, min, max, input);
    }

    public static void positive(int n, String name) {
        check(n > 0, name + " may not be negative or zero");
    }

    public static void positive(long n, String name) {
        check(n > 0, name + " may not be negative or zero");
    }

    public static void notNegative(int n, String name) {
        check(n >= 0, name + " may not be negative");
    }

    public static void notNegative(long n, String name) {
        check(n >= 0, name + " may not be negative");
    }

    private static void fail(String message) {
        throw new IllegalArgumentException(message);
    }

    private static void fail(String message, Object... args) {
        throw new IllegalArgumentException(Helpers.format(message, args));
    }
}
