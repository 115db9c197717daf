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

import okhttp3.*;
import okio.Okio;
import org.slf4j.Logger;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;
import java.util.zip.GZIPInputStream;
import java.util.zip.Inflater;
import java.util.zip.InflaterInputStream;
import java.util.zip.ZipException;

public class IOUtil {
    private static final Logger log = SnowLogger.getLog(IOUtil.class);

    public static OkHttpClient.Builder newHttpClientBuilder() {
        Dispatcher dispatcher = new Dispatcher();
        // Allow 25 parallel requests to the same host (usually discord.com)
        dispatcher.setMaxRequestsPerHost(25);
        // Allow 5 idle threads with 10 seconds timeout for each
        ConnectionPool connectionPool = new ConnectionPool(5, 10, TimeUnit.SECONDS);
        return new OkHttpClient.Builder()
            .connectionPool(connectionPool)
            .dispatcher(dispatcher);
    }

    /**
     * Creates a new request body that transmits the provided {@link InputStream}.
     * <br>The transmitted bytes are retained, so the body can be sent again if the request is retried.
     *
     * @param contentType The {@link MediaType} of the data
     * @param stream      The {@link InputStream} to be transmitted
     * @return RequestBody capable of transmitting the provided InputStream of data
     */
    public static RequestBody createRequestBody(MediaType contentType, InputStream stream) {
        return new BufferedRequestBody(Okio.source(stream), contentType);
    }

    /**
     * Retrieves an {@link InputStream} for the provided {@link Response}.
     * <br>When the header for {@code content-encoding} is set with {@code gzip} this will wrap the body
     * in a {@link GZIPInputStream} which decodes the data.
     *
     * @param response The not-null Response object
     * @return InputStream representing the body of this response, or null if the encoded content is corrupt
     * @throws IOException If the body could not be read
     */
    @SuppressWarnings("ConstantConditions")
    // methods here don't return null despite the annotations on them, read the docs
    public static InputStream getBody(Response response) throws IOException {
        String encoding = response.header("content-encoding", "");
        InputStream data = new BufferedInputStream(response.body().byteStream());
        data.mark(256);
        try {
            if (encoding.equalsIgnoreCase("gzip"))
                return new GZIPInputStream(data);
            else if (encoding.equalsIgnoreCase("deflate"))
                return new InflaterInputStream(data, new Inflater(true));
        } catch (ZipException | EOFException ex) {
            data.reset(); // reset to get full content
            log.error("Failed to read gzip content for response. Headers: {}\nContent: '{}'",
                response.headers(), SnowLogger.getLazyString(() -> new String(data.readAllBytes(), StandardCharsets.UTF_8)), ex);
            return null;
        }
        return data;
    }

    /**
     * Reads the decoded body of the response completely.
     *
     * @param response The response
     * @return The body bytes, empty if the response has no body
     * @throws IOException If the body could not be read or decoded
     */
    public static byte[] readBody(Response response) throws IOException {
        if (response.body() == null)
            return new byte[0];
        InputStream body = getBody(response);
        if (body == null)
            throw new IOException("Could not decode response body with content-encoding " + response.header("content-encoding"));
        try (InputStream in = body) {
            return in.readAllBytes();
        }
    }
}
