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
package net.vpg.snowrest.api.methods;

import net.vpg.snowrest.api.utils.FileUpload;
import okhttp3.MediaType;
import okhttp3.MultipartReader;
import okhttp3.mockwebserver.RecordedRequest;
import okio.Buffer;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AssetMethodsTest extends MethodsTestBase {
    private static Map<String, byte[]> readParts(RecordedRequest request) throws IOException {
        MediaType type = MediaType.get(request.getHeader("Content-Type"));
        Buffer body = request.getBody();
        Map<String, byte[]> parts = new LinkedHashMap<>();
        try (MultipartReader reader = new MultipartReader(body, type.parameter("boundary"))) {
            MultipartReader.Part part;
            while ((part = reader.nextPart()) != null) {
                try (MultipartReader.Part current = part) {
                    parts.put(current.headers().get("Content-Disposition"), current.body().readByteArray());
                }
            }
        }
        return parts;
    }

    @Test
    void shouldUploadStickerAsForm() throws IOException {
        byte[] image = {(byte) 0x89, 'P', 'N', 'G', 0, 1, 2, 3};
        FileUpload file = FileUpload.fromData(new ByteArrayInputStream(image), "wave.png");

        api.getAssetMethods().createGuildSticker("5", "wave", null, "hand", file, "new sticker").complete();

        RecordedRequest request = lastRequest();
        Map<String, byte[]> parts = readParts(request);
        assertEquals("/guilds/5/stickers", request.getPath());
        assertEquals("new%20sticker", request.getHeader("X-Audit-Log-Reason"));
        assertEquals("wave", new String(parts.get("form-data; name=\"name\""), StandardCharsets.UTF_8));
        assertEquals("", new String(parts.get("form-data; name=\"description\""), StandardCharsets.UTF_8));
        assertEquals("hand", new String(parts.get("form-data; name=\"tags\""), StandardCharsets.UTF_8));
        assertArrayEquals(image, parts.get("form-data; name=\"file\"; filename=\"wave.png\""));
    }

    @Test
    void shouldUseApplicationEmojiRoutes() {
        api.getAssetMethods().getApplicationEmojis("77").complete();

        assertEquals("/applications/77/emojis", lastRequest().getPath());
    }

    @Test
    void shouldValidateStickerArguments() {
        FileUpload file = FileUpload.fromData(new byte[]{1}, "a.png");

        assertThrows(IllegalArgumentException.class, () -> api.getAssetMethods().createGuildSticker("5", " ", null, "tag", file, null));
        assertThrows(IllegalArgumentException.class, () -> api.getAssetMethods().createGuildSticker("5", "name", null, "", file, null));
    }
}
