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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.vpg.snowrest.api.utils.FileUpload;
import net.vpg.snowrest.internal.utils.Checks;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.RequestBody;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.*;

/**
 * The payload of a request and how it is encoded on the wire.
 *
 * <ul>
 *     <li>{@link Kind#NONE} - no body</li>
 *     <li>{@link Kind#JSON} - any value Jackson can serialize, sent as {@code application/json}</li>
 *     <li>{@link Kind#MULTIPART} - a {@code payload_json} part plus one {@code files[i]} part per attachment</li>
 *     <li>{@link Kind#FORM} - plain form fields plus one named file part</li>
 * </ul>
 *
 * <p>A body is encoded once per attempt with {@link #toRequestBody(ObjectMapper)}.
 */
public final class RestBody {
    public static final MediaType MEDIA_TYPE_JSON = MediaType.get("application/json; charset=utf-8");
    public static final String PAYLOAD_JSON = "payload_json";

    private static final RestBody NONE = new RestBody(Kind.NONE, null, Collections.emptyList(), Collections.emptyMap(), null);

    private final Kind kind;
    private final Object payload;
    private final List<FileUpload> files;
    private final Map<String, String> fields;
    private final String fileField;

    private RestBody(Kind kind, Object payload, List<FileUpload> files, Map<String, String> fields, String fileField) {
        this.kind = kind;
        this.payload = payload;
        this.files = files;
        this.fields = fields;
        this.fileField = fileField;
    }

    @Nonnull
    public static RestBody none() {
        return NONE;
    }

    @Nonnull
    @CheckReturnValue
    public static RestBody json(@Nonnull Object payload) {
        Checks.notNull(payload, "Payload");
        return new RestBody(Kind.JSON, payload, Collections.emptyList(), Collections.emptyMap(), null);
    }

    /**
     * Multipart body with a {@code payload_json} part and the provided attachments as {@code files[0..n]}.
     *
     * @param payload The JSON payload, or null to send only the files
     * @param files   The attachments
     * @return The multipart body
     */
    @Nonnull
    @CheckReturnValue
    public static RestBody multipart(@Nullable Object payload, @Nonnull Collection<? extends FileUpload> files) {
        Checks.noneNull(files, "Files");
        Checks.check(payload != null || !files.isEmpty(), "Multipart body requires a payload or at least one file");
        return new RestBody(Kind.MULTIPART, payload, Collections.unmodifiableList(new ArrayList<>(files)), Collections.emptyMap(), null);
    }

    @Nonnull
    @CheckReturnValue
    public static RestBody multipart(@Nullable Object payload, @Nonnull FileUpload... files) {
        Checks.noneNull(files, "Files");
        return multipart(payload, Arrays.asList(files));
    }

    /**
     * Multipart body with plain text fields and a single file part named {@code fileField}.
     *
     * @param fields    The form fields, null values are left out
     * @param fileField The name of the file part
     * @param file      The file
     * @return The form body
     */
    @Nonnull
    @CheckReturnValue
    public static RestBody form(@Nonnull Map<String, String> fields, @Nonnull String fileField, @Nonnull FileUpload file) {
        Checks.notNull(fields, "Fields");
        Checks.notBlank(fileField, "File field");
        Checks.notNull(file, "File");
        Map<String, String> copy = new LinkedHashMap<>();
        fields.forEach((key, value) -> {
            if (value != null)
                copy.put(key, value);
        });
        return new RestBody(Kind.FORM, null, Collections.singletonList(file), Collections.unmodifiableMap(copy), fileField);
    }

    @Nonnull
    public Kind getKind() {
        return kind;
    }

    @Nullable
    public Object getPayload() {
        return payload;
    }

    @Nonnull
    public List<FileUpload> getFiles() {
        return files;
    }

    @Nonnull
    public Map<String, String> getFields() {
        return fields;
    }

    /**
     * Encodes this body for transmission.
     *
     * @param mapper The mapper used for JSON payloads
     * @return The request body, or null for {@link Kind#NONE}
     * @throws IllegalArgumentException If the payload cannot be serialized
     */
    @Nullable
    public RequestBody toRequestBody(@Nonnull ObjectMapper mapper) {
        switch (kind) {
            case JSON:
                return RequestBody.create(encode(mapper), MEDIA_TYPE_JSON);
            case MULTIPART: {
                MultipartBody.Builder builder = new MultipartBody.Builder().setType(MultipartBody.FORM);
                if (payload != null)
                    builder.addFormDataPart(PAYLOAD_JSON, null, RequestBody.create(encode(mapper), MEDIA_TYPE_JSON));
                for (int i = 0; i < files.size(); i++) {
                    FileUpload file = files.get(i);
                    builder.addFormDataPart("files[" + i + "]", file.getName(), file.getRequestBody());
                }
                return builder.build();
            }
            case FORM: {
                MultipartBody.Builder builder = new MultipartBody.Builder().setType(MultipartBody.FORM);
                fields.forEach(builder::addFormDataPart);
                FileUpload file = files.get(0);
                builder.addFormDataPart(fileField, file.getName(), file.getRequestBody());
                return builder.build();
            }
            default:
                return null;
        }
    }

    private byte[] encode(ObjectMapper mapper) {
        try {
            return mapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not serialize request payload", e);
        }
    }

    @Override
    public String toString() {
        return "RestBody[" + kind + (files.isEmpty() ? "" : ", files=" + files) + ']';
    }

    public enum Kind {
        NONE, JSON, MULTIPART, FORM
    }
}
