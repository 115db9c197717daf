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
package net.vpg.snowrest.api.utils;

import net.vpg.snowrest.internal.utils.Checks;
import net.vpg.snowrest.internal.utils.IOUtil;
import okhttp3.MediaType;
import okhttp3.RequestBody;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.File;
import java.io.InputStream;
import java.net.URLConnection;

/**
 * A named binary attachment for multipart requests.
 *
 * <p>Uploads from byte arrays and files can be sent any number of times.
 * Uploads from an {@link InputStream} are streamed on the first transmission and replayed
 * from memory if the request has to be retried.
 */
public class FileUpload {
    public static final MediaType DEFAULT_TYPE = MediaType.get("application/octet-stream");

    private final String name;
    private final MediaType type;
    private final RequestBody body;

    protected FileUpload(String name, MediaType type, RequestBody body) {
        this.name = name;
        this.type = type;
        this.body = body;
    }

    @Nonnull
    public static FileUpload fromData(@Nonnull byte[] data, @Nonnull String name) {
        Checks.notNull(data, "Data");
        Checks.notBlank(name, "Name");
        MediaType type = guessType(name);
        return new FileUpload(name, type, RequestBody.create(data, type));
    }

    @Nonnull
    public static FileUpload fromData(@Nonnull File file, @Nonnull String name) {
        Checks.notNull(file, "File");
        Checks.check(file.exists() && file.canRead(), "Provided file doesn't exist or cannot be read!");
        Checks.notBlank(name, "Name");
        MediaType type = guessType(name);
        return new FileUpload(name, type, RequestBody.create(file, type));
    }

    @Nonnull
    public static FileUpload fromData(@Nonnull File file) {
        Checks.notNull(file, "File");
        return fromData(file, file.getName());
    }

    @Nonnull
    public static FileUpload fromData(@Nonnull InputStream stream, @Nonnull String name) {
        Checks.notNull(stream, "InputStream");
        Checks.notBlank(name, "Name");
        MediaType type = guessType(name);
        return new FileUpload(name, type, IOUtil.createRequestBody(type, stream));
    }

    @Nonnull
    private static MediaType guessType(String name) {
        String guess = URLConnection.guessContentTypeFromName(name);
        MediaType type = guess == null ? null : MediaType.parse(guess);
        return type == null ? DEFAULT_TYPE : type;
    }

    /**
     * The file name sent with the attachment part.
     *
     * @return The file name
     */
    @Nonnull
    public String getName() {
        return name;
    }

    @Nullable
    public MediaType getContentType() {
        return type;
    }

    /**
     * The body of this attachment part.
     * <br>The same instance is returned every time, so stream uploads are only read once.
     *
     * @return The request body
     */
    @Nonnull
    public RequestBody getRequestBody() {
        return body;
    }

    @Override
    public String toString() {
        return "FileUpload(" + name + ")";
    }
}
