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

import net.vpg.snowrest.internal.utils.Checks;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.ParametersAreNonnullByDefault;
import java.util.*;

/**
 * Table of route parameters that are <em>major</em> for rate-limit purposes.
 *
 * <p>Two requests on the same route template share a bucket only if their major parameter values are equal.
 * Minor parameters (message ids, user ids, ...) are collapsed into their placeholder.
 *
 * <p>The table holds a default set of names applied to every route
 * and optional per-template overrides, keyed by {@link Route#getRoute() route template}.
 * Instances are immutable, use {@link #builder()} to create a customized table.
 *
 * <pre>{@code
 * MajorParameters table = MajorParameters.builder()
 *     .override("applications/{application_id}/emojis", "application_id")
 *     .build();
 * }</pre>
 */
@ParametersAreNonnullByDefault
public final class MajorParameters {
    public static final Set<String> DEFAULT_NAMES = Collections.unmodifiableSet(
        new LinkedHashSet<>(Arrays.asList("channel_id", "guild_id", "webhook_id", "interaction_token"))
    );

    private static final MajorParameters DEFAULT = new MajorParameters(DEFAULT_NAMES, Collections.emptyMap());

    private final Set<String> defaults;
    private final Map<String, Set<String>> overrides;

    private MajorParameters(Set<String> defaults, Map<String, Set<String>> overrides) {
        this.defaults = defaults;
        this.overrides = overrides;
    }

    @Nonnull
    public static MajorParameters getDefault() {
        return DEFAULT;
    }

    @Nonnull
    @CheckReturnValue
    public static Builder builder() {
        return new Builder();
    }

    /**
     * The major parameter names for the provided route.
     *
     * @param route The route template
     * @return Immutable set of major parameter names
     */
    @Nonnull
    public Set<String> getMajorParameters(Route route) {
        Checks.notNull(route, "Route");
        return overrides.getOrDefault(route.getRoute(), defaults);
    }

    public boolean isMajor(Route route, String name) {
        return getMajorParameters(route).contains(name);
    }

    @Nonnull
    public Set<String> getDefaults() {
        return defaults;
    }

    @Nonnull
    public Map<String, Set<String>> getOverrides() {
        return overrides;
    }

    @Nonnull
    @CheckReturnValue
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.defaults.clear();
        builder.defaults.addAll(defaults);
        builder.overrides.putAll(overrides);
        return builder;
    }

    @Override
    public String toString() {
        return "MajorParameters[defaults=" + defaults + ", overrides=" + overrides + ']';
    }

    public static class Builder {
        private final Set<String> defaults = new LinkedHashSet<>(DEFAULT_NAMES);
        private final Map<String, Set<String>> overrides = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Replaces the default set of major parameter names.
         *
         * @param names The new default names
         * @return The current Builder for chaining convenience
         */
        @Nonnull
        public Builder setDefaults(String... names) {
            Checks.noneNull(names, "Names");
            defaults.clear();
            defaults.addAll(Arrays.asList(names));
            return this;
        }

        @Nonnull
        public Builder addDefault(String name) {
            Checks.notBlank(name, "Name");
            defaults.add(name);
            return this;
        }

        /**
         * Sets the exact set of major parameter names for one route template.
         * <br>The defaults do not apply to an overridden template.
         *
         * @param template The route template, for example {@code "applications/{application_id}/emojis"}
         * @param names    The major parameter names for this template, may be empty
         * @return The current Builder for chaining convenience
         */
        @Nonnull
        public Builder override(String template, String... names) {
            Checks.notEmpty(template, "Template");
            Checks.noneNull(names, "Names");
            overrides.put(template, Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(names))));
            return this;
        }

        @Nonnull
        public MajorParameters build() {
            return new MajorParameters(
                Collections.unmodifiableSet(new LinkedHashSet<>(defaults)),
                Collections.unmodifiableMap(new LinkedHashMap<>(overrides))
            );
        }
    }
}
