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

import net.vpg.snowrest.api.requests.MajorParameters;
import net.vpg.snowrest.api.requests.Route;

import javax.annotation.Nonnull;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Derives rate-limit keys from compiled routes.
 *
 * <p>A key keeps the values of major parameters and the placeholders of minor ones,
 * so {@code POST channels/{channel_id}/messages/{message_id}} compiled with {@code 123, 456}
 * becomes {@code POST /channels/123/messages/{message_id}}.
 */
public class RouteKeyResolver {
    public static final String NO_MAJOR_PARAMETERS = "n/a";

    private final MajorParameters majorParameters;

    public RouteKeyResolver(@Nonnull MajorParameters majorParameters) {
        this.majorParameters = majorParameters;
    }

    @Nonnull
    public MajorParameters getMajorParameters() {
        return majorParameters;
    }

    @Nonnull
    public String resolve(@Nonnull Route.CompiledRoute route) {
        Route baseRoute = route.getBaseRoute();
        Set<String> major = majorParameters.getMajorParameters(baseRoute);
        StringJoiner path = new StringJoiner("/", baseRoute.getMethod() + " /", "");
        for (String element : baseRoute.getTemplateElements()) {
            if (element.charAt(0) == '{') {
                String name = element.substring(1, element.length() - 1);
                path.add(major.contains(name) ? route.getParameter(name) : element);
            } else {
                path.add(element);
            }
        }
        return path.toString();
    }

    /**
     * Joins the major parameter values of the route, used to split a shared remote bucket.
     *
     * @param route The compiled route
     * @return The values as {@code name=value} pairs joined by {@code &}, or {@value #NO_MAJOR_PARAMETERS}
     */
    @Nonnull
    public String resolveMajorParameters(@Nonnull Route.CompiledRoute route) {
        Set<String> major = majorParameters.getMajorParameters(route.getBaseRoute());
        StringJoiner joiner = new StringJoiner("&");
        route.getParameters().forEach((name, value) -> {
            if (major.contains(name))
                joiner.add(name + "=" + value);
        });
        return joiner.length() == 0 ? NO_MAJOR_PARAMETERS : joiner.toString();
    }
}
