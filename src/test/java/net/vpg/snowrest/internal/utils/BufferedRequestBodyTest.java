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
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class BufferedRequestBodyTest {
    private static final MediaType TYPE = MediaType.get("application/octet-stream");

    @Test
    void shouldReplayStreamOnSecondWrite() throws IOException {
        byte[] data = new byte[50_000];
        new Random(42).nextBytes(data);
        RequestBody body = IOUtil.createRequestBody(TYPE, new ByteArrayInputStream(data));

        assertEquals(-1, body.contentLength());
        Buffer first = new Buffer();
        body.writeTo(first);
        Buffer second = new Buffer();
        body.writeTo(second);

        assertArrayEquals(data, first.readByteArray());
        assertArrayEquals(data, second.readByteArray());
        assertEquals(data.length, body.contentLength());
        assertEquals(TYPE, body.contentType());
    }

    @Test
    void shouldContinueAfterInterruptedWrite() throws IOException {
        byte[] data = new byte[20_000];
        new Random(7).nextBytes(data);
        InputStream failing = new FailingInputStream(data, 10_000);
        RequestBody body = IOUtil.createRequestBody(TYPE, failing);

        assertThrows(IOException.class, () -> body.writeTo(new Buffer()));
        Buffer retry = new Buffer();
        body.writeTo(retry);

        assertArrayEquals(data, retry.readByteArray());
    }

    // Fails once after the given number of bytes, then continues normally
    private static class FailingInputStream extends InputStream {
        private final ByteArrayInputStream delegate;
        private final int failAt;
        private int read;
        private boolean failed;

        FailingInputStream(byte[] data, int failAt) {
            this.delegate = new ByteArrayInputStream(data);
            this.failAt = failAt;
        }

        @Override
        public int read() throws IOException {
            byte[] single = new byte[1];
            return read(single, 0, 1) == -1 ? -1 : single[0] & 0xFF;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            if (!failed && read >= failAt) {
                failed = true;
                throw new IOException("Connection reset");
            }
            int limit = failed ? len : Math.min(len, failAt - read);
            int count = delegate.read(b, off, limit);
            if (count > 0)
                read += count;
            return count;
        }
    }
}
