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

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

public class EncodingUtil {
    /**
     * Percent-encodes the input for use in a path segment, query value or header.
     * <br>Spaces become {@code %20} rather than {@code +}.
     *
     * @param chars The raw input
     * @return The encoded string
     */
    public static String encodeUTF8(String chars) {
        return URLEncoder.encode(chars, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
