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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import okhttp3.Headers;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * A fully read HTTP response, or the exception that prevented one.
 * <br>The body is decoded and buffered, so the response can be inspected any number of times.
 */
@ParametersAreNonnullByDefault
public class RestResponse {
    public static final int ERROR_CODE = -1;
    public static final String ERROR_MESSAGE = "ERROR";

    private static final byte[] EMPTY = new byte[0];

    public final int code;
    public final String message;
    private final Headers headers;
    private final byte[] body;
    private final Exception exception;
    private JsonNode json;

    public RestResponse(Exception exception) {
        this.code = ERROR_CODE;
        this.message = ERROR_MESSAGE;
        this.headers = Headers.of();
        this.body = EMPTY;
        this.exception = exception;
    }

    public RestResponse(int code, String message, Headers headers, @Nullable byte[] body) {
        this.code = code;
        this.message = message;
        this.headers = headers;
        this.body = body == null ? EMPTY : body;
        this.exception = null;
    }

    /**
     * Parses the body as JSON.
     * <br>An empty body, as sent with {@code 204 No Content}, results in a {@link MissingNode}.
     *
     * @param mapper The mapper used for parsing
     * @return The parsed JSON tree
     * @throws IOException If the body is not valid JSON
     */
    @Nonnull
    public synchronized JsonNode getJson(ObjectMapper mapper) throws IOException {
        if (json == null) {
            JsonNode node = body.length == 0 ? null : mapper.readTree(body);
            json = node == null ? MissingNode.getInstance() : node;
        }
        return json;
    }

    @Nonnull
    public Optional<JsonNode> optJson(ObjectMapper mapper) {
        try {
            return Optional.of(getJson(mapper));
        } catch (IOException e) {
            return Optional.empty();
        }
    }

    @Nonnull
    public String getString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    @Nonnull
    public byte[] getBody() {
        return body;
    }

    @Nonnull
    public Headers getHeaders() {
        return headers;
    }

    @Nullable
    public String getHeader(String name) {
        return headers.get(name);
    }

    @Nullable
    public Exception getException() {
        return exception;
    }

    /**
     * The {@code Retry-After} of a rate-limited response in milliseconds.
     *
     * @return The delay in milliseconds, or {@code -1} if absent or malformed
     */
    public long getRetryAfter() {
        String header = getHeader(RestRateLimiter.RETRY_AFTER_HEADER);
        if (header == null)
            return -1;
        try {
            double seconds = Double.parseDouble(header);
            return seconds < 0 ? -1 : (long) Math.ceil(seconds * 1000);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    /**
     * Whether this response was caused by the global rate-limit.
     *
     * @return True, if either the global or scope header reports a global limit
     */
    public boolean isGlobalRateLimit() {
        return "true".equalsIgnoreCase(getHeader(RestRateLimiter.GLOBAL_HEADER))
            || "global".equalsIgnoreCase(getHeader(RestRateLimiter.SCOPE_HEADER));
    }

    public boolean isError() {
        return code == RestResponse.ERROR_CODE;
    }

    public boolean isOk() {
        return (199 < code && code < 300) || code == 304;
    }

    public boolean isRateLimit() {
        return code == 429;
    }

    public boolean isServerError() {
        return code >= 500;
    }

    public boolean isClientError() {
        return code >= 400 && code < 500 && code != 429;
    }

    @Override
    public String toString() {
        return this.exception == null
            ? "HTTPResponse[" + this.code + ", " + body.length + " bytes]"
            : "HttpException[" + this.exception.getMessage() + ']';
    }
}
