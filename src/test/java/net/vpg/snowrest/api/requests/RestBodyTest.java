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
import com.fasterxml.jackson.databind.node.ObjectNode;
import net.vpg.snowrest.api.utils.FileUpload;
import okhttp3.MultipartBody;
import okhttp3.MultipartReader;
import okhttp3.RequestBody;
import okio.Buffer;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class RestBodyTest {
    private final ObjectMapper mapper = new ObjectMapper();

    private static Map<String, String> readParts(MultipartBody body) throws IOException {
        Buffer buffer = new Buffer();
        body.writeTo(buffer);
        Map<String, String> parts = new LinkedHashMap<>();
        try (MultipartReader reader = new MultipartReader(buffer, body.boundary())) {
            MultipartReader.Part part;
            while ((part = reader.nextPart()) != null) {
                try (MultipartReader.Part current = part) {
                    parts.put(current.headers().get("Content-Disposition"), current.body().readUtf8());
                }
            }
        }
        return parts;
    }

    @Test
    void shouldSendNoBody() {
        assertNull(RestBody.none().toRequestBody(mapper));
        assertEquals(RestBody.Kind.NONE, RestBody.none().getKind());
    }

    @Test
    void shouldEncodeNestedJson() throws IOException {
        ObjectNode payload = mapper.createObjectNode().put("content", "héllo");
        payload.putArray("embeds").addObject().put("title", "t").putNull("url");
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", "general");
        map.put("position", 3);
        map.put("tags", Arrays.asList("a", "b"));

        RequestBody jsonBody = RestBody.json(payload).toRequestBody(mapper);
        RequestBody mapBody = RestBody.json(map).toRequestBody(mapper);
        Buffer buffer = new Buffer();
        jsonBody.writeTo(buffer);

        assertEquals("application/json; charset=utf-8", String.valueOf(jsonBody.contentType()));
        assertEquals(payload, mapper.readTree(buffer.readByteArray()));
        buffer.clear();
        mapBody.writeTo(buffer);
        JsonNode mapped = mapper.readTree(buffer.readUtf8());
        assertEquals(3, mapped.get("position").asInt());
        assertEquals("b", mapped.get("tags").get(1).asText());
    }

    @Test
    void shouldRejectUnserializablePayload() {
        RestBody body = RestBody.json(new Object());

        assertThrows(IllegalArgumentException.class, () -> body.toRequestBody(mapper));
    }

    @Test
    void shouldBuildMultipartWithPayloadAndFiles() throws IOException {
        FileUpload first = FileUpload.fromData("one".getBytes(StandardCharsets.UTF_8), "one.txt");
        FileUpload second = FileUpload.fromData("two".getBytes(StandardCharsets.UTF_8), "two.png");
        RestBody body = RestBody.multipart(Collections.singletonMap("content", "files"), first, second);

        MultipartBody encoded = (MultipartBody) body.toRequestBody(mapper);
        Map<String, String> parts = readParts(encoded);

        assertEquals(3, encoded.size());
        assertEquals(Arrays.asList(
            "form-data; name=\"payload_json\"",
            "form-data; name=\"files[0]\"; filename=\"one.txt\"",
            "form-data; name=\"files[1]\"; filename=\"two.png\""
        ), new ArrayList<>(parts.keySet()));
        assertEquals("{\"content\":\"files\"}", parts.get("form-data; name=\"payload_json\""));
        assertEquals("two", parts.get("form-data; name=\"files[1]\"; filename=\"two.png\""));
        assertEquals("image/png", String.valueOf(encoded.part(2).body().contentType()));
    }

    @Test
    void shouldRequirePayloadOrFiles() {
        assertThrows(IllegalArgumentException.class, () -> RestBody.multipart(null, Collections.emptyList()));
    }

    @Test
    void shouldBuildFormWithNamedFilePart() throws IOException {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("name", "wave");
        fields.put("description", null);
        FileUpload file = FileUpload.fromData(new byte[]{1, 2, 3}, "wave.png");

        MultipartBody encoded = (MultipartBody) RestBody.form(fields, "file", file).toRequestBody(mapper);
        Map<String, String> parts = readParts(encoded);

        assertEquals(2, parts.size());
        assertEquals("wave", parts.get("form-data; name=\"name\""));
        assertTrue(parts.containsKey("form-data; name=\"file\"; filename=\"wave.png\""));
    }
}
