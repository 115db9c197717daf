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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.vpg.snowrest.api.utils.FileUpload;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class ChannelMethodsTest extends MethodsTestBase {
    private static final long DISCORD_EPOCH = 1420070400000L;

    private ChannelMethods channels;

    @BeforeEach
    void setUp() {
        channels = api.getChannelMethods();
    }

    private static String snowflake(long timestamp) {
        return String.valueOf((timestamp - DISCORD_EPOCH) << 22);
    }

    @Test
    void shouldNormalizeCustomEmoji() {
        assertEquals("blob:123456789012345678", ChannelMethods.toReactionCode("<:blob:123456789012345678>"));
        assertEquals("party:123456789012345678", ChannelMethods.toReactionCode("<a:party:123456789012345678>"));
        assertEquals("blob:123456789012345678", ChannelMethods.toReactionCode("blob:123456789012345678"));
        assertEquals("👍", ChannelMethods.toReactionCode("👍"));
    }

    @Test
    void shouldEncodeReactionInPath() {
        channels.createReaction("1", "2", "<:blob:123456789012345678>").complete();
        channels.createReaction("1", "2", "👍").complete();

        assertEquals("/channels/1/messages/2/reactions/blob%3A123456789012345678/@me", dispatcher.getHits().get(0).getRequest().getPath());
        assertEquals("/channels/1/messages/2/reactions/%F0%9F%91%8D/@me", dispatcher.getHits().get(1).getRequest().getPath());
        assertEquals("PUT", dispatcher.getHits().get(1).getRequest().getMethod());
    }

    @Test
    void shouldSendAuthorizationAndUserAgent() {
        channels.getChannel("1").complete();

        RecordedRequest request = lastRequest();
        assertEquals("Bot token", request.getHeader("Authorization"));
        assertTrue(request.getHeader("User-Agent").startsWith("DiscordBot"));
    }

    @Test
    void shouldEncodeAuditLogReason() {
        channels.deleteChannel("1", "Spam & ünïcode").complete();

        RecordedRequest request = lastRequest();
        assertEquals("DELETE", request.getMethod());
        assertEquals("Spam%20%26%20%C3%BCn%C3%AFcode", request.getHeader("X-Audit-Log-Reason"));
    }

    @Test
    void shouldOmitReasonHeaderWhenBlank() {
        channels.deleteChannel("1", " ").complete();

        assertNull(lastRequest().getHeader("X-Audit-Log-Reason"));
    }

    @Test
    void shouldOnlySendDefinedQueryParameters() {
        channels.getChannelMessages("1", null, "5", "6", null).complete();

        RecordedRequest request = lastRequest();
        assertEquals("/channels/1/messages?before=5", request.getPath());
    }

    @Test
    void shouldPreferAroundOverOtherAnchors() {
        channels.getChannelMessages("1", "4", "5", "6", 10).complete();

        assertEquals("/channels/1/messages?around=4&limit=10", lastRequest().getPath());
    }

    @Test
    void shouldValidateMessageLimit() {
        assertThrows(IllegalArgumentException.class, () -> channels.getChannelMessages("1", null, null, null, 0));
        assertThrows(IllegalArgumentException.class, () -> channels.getChannelMessages("1", null, null, null, 101));
        assertThrows(IllegalArgumentException.class, () -> channels.getChannel("abc"));
    }

    @Test
    void shouldBulkDeleteRecentMessages() throws Exception {
        long now = System.currentTimeMillis();
        String first = snowflake(now - 1000);
        String second = snowflake(now - 2000);

        channels.bulkDeleteMessages("1", Arrays.asList(first, second), "cleanup").complete();

        RecordedRequest request = lastRequest();
        JsonNode body = new ObjectMapper().readTree(request.getBody().readUtf8());
        assertEquals("/channels/1/messages/bulk-delete", request.getPath());
        assertEquals(first, body.get("messages").get(0).asText());
        assertEquals(2, body.get("messages").size());
        assertEquals("cleanup", request.getHeader("X-Audit-Log-Reason"));
    }

    @Test
    void shouldRejectInvalidBulkDelete() {
        String recent = snowflake(System.currentTimeMillis());
        String old = snowflake(System.currentTimeMillis() - 15L * 24 * 60 * 60 * 1000);

        assertThrows(IllegalArgumentException.class, () -> channels.bulkDeleteMessages("1", Collections.singletonList(recent), null));
        assertThrows(IllegalArgumentException.class, () -> channels.bulkDeleteMessages("1", Arrays.asList(recent, old), null));
        assertTrue(dispatcher.getHits().isEmpty());
    }

    @Test
    void shouldSendMessageWithAttachments() {
        FileUpload file = FileUpload.fromData("hello".getBytes(StandardCharsets.UTF_8), "hello.txt");

        channels.createMessage("1", Collections.singletonMap("content", "see attached"), Collections.singletonList(file)).complete();

        RecordedRequest request = lastRequest();
        String body = request.getBody().readUtf8();
        assertTrue(request.getHeader("Content-Type").startsWith("multipart/form-data"));
        assertTrue(body.contains("name=\"payload_json\""));
        assertTrue(body.contains("{\"content\":\"see attached\"}"));
        assertTrue(body.contains("name=\"files[0]\"; filename=\"hello.txt\""));
        assertTrue(body.contains("hello"));
    }

    @Test
    void shouldCreateInviteWithDefaults() throws Exception {
        channels.createChannelInvite("1", null, null).complete();

        JsonNode body = new ObjectMapper().readTree(lastRequest().getBody().readUtf8());
        assertEquals(86400, body.get("max_age").asInt());
        assertEquals(0, body.get("max_uses").asInt());
        assertFalse(body.get("unique").asBoolean());
    }
}
