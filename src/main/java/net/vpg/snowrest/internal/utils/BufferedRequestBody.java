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

import okhttp3.MediaType;
import okhttp3.RequestBody;
import okio.Buffer;
import okio.BufferedSink;
import okio.Source;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;

/**
 * Request body backed by a streaming {@link Source}.
 *
 * <p>The first write streams the source to the sink chunk by chunk,
 * retaining every chunk read. Later writes (a retried request) replay the retained bytes
 * and then continue with whatever the source has not delivered yet.
 */
public class BufferedRequestBody extends RequestBody {
    private static final long CHUNK_SIZE = 8192;

    private final Source source;
    private final MediaType type;
    private final Buffer retained = new Buffer();
    private boolean exhausted;

    public BufferedRequestBody(Source source, MediaType type) {
        this.source = source;
        this.type = type;
    }

    @Nullable
    @Override
    public MediaType contentType() {
        return type;
    }

    @Override
    public synchronized long contentLength() {
        return exhausted ? retained.size() : -1;
    }

    @Override
    public synchronized void writeTo(@Nonnull BufferedSink sink) throws IOException {
        sink.write(retained.copy(), retained.size());
        if (exhausted)
            return;

        Buffer chunk = new Buffer();
        try {
            long read;
            while ((read = source.read(chunk, CHUNK_SIZE)) != -1) {
                chunk.copyTo(retained, 0, read);
                sink.write(chunk, read);
            }
        } finally {
            chunk.clear();
        }
        exhausted = true;
        source.close();
    }
}
