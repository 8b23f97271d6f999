package com.relaybot.client;

import com.relaybot.http.HttpClientEx;
import com.relaybot.model.ChatMessage;
import com.relaybot.model.DialogInfo;
import com.relaybot.model.MediaKind;
import com.relaybot.model.MediaRef;
import com.relaybot.model.TopicInfo;
import com.relaybot.model.Window;
import com.relaybot.runner.RetryBackoff;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TelegramBotApiClientTest {
    private static final long GROUP = -100111L;
    private static final long FORUM = -100222L;
    private static final long T0 = Instant.parse("2026-10-19T08:00:00Z").getEpochSecond();

    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochSecond(T0 + 3600), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private final ScriptedHttp http = new ScriptedHttp();
    private UpdateJournal journal;
    private TelegramBotApiClient client;

    @BeforeEach
    void setUp() {
        journal = new UpdateJournal(tempDir.resolve("updates.json"), Duration.ofDays(7), CLOCK);
        client = newClient(http, true);
    }

    @Test
    void fetchShouldDrainUpdatesOnceAndFilterPerChat() throws Exception {
        queueUpdates();
        List<Long> ids = new ArrayList<>();

        client.fetchMessages(GROUP, null, Window.afterMessageId(10L, Instant.ofEpochSecond(T0 + 3600)), message -> {
            ids.add(message.getId());
            return true;
        });
        client.fetchMessages(GROUP, null, Window.afterMessageId(0L, Instant.ofEpochSecond(T0 + 3600)), message -> true);

        assertEquals(List.of(11L, 12L), ids);
        List<JSONObject> pages = http.calls("getUpdates");
        assertEquals(4, pages.size());
        assertFalse(pages.get(0).has("offset"));
        assertEquals(3L, pages.get(1).getLong("offset"));
        assertEquals(5L, pages.get(2).getLong("offset"));
        assertEquals(7L, pages.get(3).getLong("offset"));
        assertEquals(1, http.calls("getChat").size());
        assertTrue(http.urls.get(0).startsWith("https://api.example.org/bot123:abc/"));
        assertEquals(6, journal.load().size());
    }

    @Test
    void readOnlyClientShouldLeavePendingUpdatesForTheNextRun() throws Exception {
        BotApiServer server = new BotApiServer();
        for (long id = 1; id <= 5; id++) {
            server.post(id, message(id, GROUP, "supergroup", "Jobs", false, null).put("text", "post " + id));
        }

        newClient(server, false).listDialogs();

        assertEquals(1, server.getUpdatesCalls);
        assertEquals(5, server.pending.size());
        assertFalse(Files.exists(journal.path()));
        assertEquals(List.of(1L, 2L, 3L, 4L, 5L), fetchIds(newClient(server, true)));
    }

    @Test
    void confirmedUpdatesShouldStayAvailableUntilReleased() throws Exception {
        BotApiServer server = new BotApiServer();
        for (long id = 1; id <= 5; id++) {
            server.post(id, message(id, GROUP, "supergroup", "Jobs", false, null).put("text", "post " + id));
        }

        assertEquals(List.of(1L, 2L, 3L, 4L, 5L), fetchIds(newClient(server, true)));
        assertEquals(1, server.pending.size());

        // no release: the source failed, so the next run must see everything again
        TelegramBotApiClient second = newClient(server, true);
        assertEquals(List.of(1L, 2L, 3L, 4L, 5L), fetchIds(second));

        second.release(Map.of(GROUP, 3L));
        assertEquals(List.of(4L, 5L), fetchIds(newClient(server, true)));
    }

    @Test
    void releaseShouldKeepChatsWithoutWatermarkAndDropExpiredUpdates() throws Exception {
        BotApiServer server = new BotApiServer();
        server.post(1L, message(1, GROUP, "supergroup", "Jobs", false, null).put("text", "a"));
        server.post(2L, message(2, FORUM, "supergroup", "Dev", true, null).put("text", "b"));
        server.post(3L, message(3, GROUP, "supergroup", "Jobs", false, null)
                .put("date", T0 - Duration.ofDays(8).getSeconds()).put("text", "stale"));
        TelegramBotApiClient consuming = newClient(server, true);
        consuming.listDialogs();

        consuming.release(Map.of(GROUP, 0L));

        List<Long> kept = new ArrayList<>();
        for (JSONObject update : journal.load()) {
            kept.add(update.getLong("update_id"));
        }
        assertEquals(List.of(1L, 2L), kept);
    }

    @Test
    void releaseShouldBeIgnoredByReadOnlyClient() throws Exception {
        BotApiServer server = new BotApiServer();
        server.post(1L, message(1, GROUP, "supergroup", "Jobs", false, null).put("text", "a"));
        TelegramBotApiClient readOnly = newClient(server, false);
        readOnly.listDialogs();

        readOnly.release(Map.of(GROUP, 1L));

        assertFalse(Files.exists(journal.path()));
    }

    @Test
    void unreadableJournalShouldFailLoudly() throws Exception {
        Files.writeString(journal.path(), "{not json", StandardCharsets.UTF_8);

        assertThrows(ChatClientException.class, () -> client.listDialogs());
    }

    @Test
    void fetchShouldRestrictToTopicAndStopWhenVisitorDeclines() throws Exception {
        queueUpdates();
        List<ChatMessage> seen = new ArrayList<>();

        client.fetchMessages(FORUM, 5L, Window.afterMessageId(20L, Instant.ofEpochSecond(T0 + 3600)), message -> {
            seen.add(message);
            return false;
        });

        assertEquals(1, seen.size());
        assertEquals(5L, seen.get(0).getTopicId());
        assertEquals(21L, seen.get(0).getId());
    }

    @Test
    void dialogsAndTopicsShouldComeFromSnapshot() throws Exception {
        queueUpdates();

        List<DialogInfo> dialogs = client.listDialogs();
        Optional<List<TopicInfo>> topics = client.listTopics(FORUM);

        assertEquals(2, dialogs.size());
        assertEquals(new DialogInfo(GROUP, "supergroup", "Jobs", false), dialogs.get(0));
        assertTrue(dialogs.get(1).forum());
        assertEquals(Optional.empty(), client.listTopics(GROUP));
        assertEquals(List.of(new TopicInfo(FORUM, 5L, "Backend"), new TopicInfo(FORUM, 9L, null)), topics.orElseThrow());
    }

    @Test
    void unknownChatShouldRaiseAccessError() {
        http.queue("getChat", 400, "{\"ok\":false,\"error_code\":400,\"description\":\"Bad Request: chat not found\"}");

        assertThrows(ChatAccessException.class, () -> client.fetchMessages(-5L, null,
                Window.afterMessageId(0L, Instant.ofEpochSecond(T0)), message -> true));
    }

    @Test
    void forwardShouldPostForwardMessage() throws Exception {
        client.forward(ChatMessage.builder().id(11L).chatId(GROUP).text("x").build(), -1001L);

        JSONObject params = http.calls("forwardMessage").get(0);
        assertEquals(-1001L, params.getLong("chat_id"));
        assertEquals(GROUP, params.getLong("from_chat_id"));
        assertEquals(11L, params.getLong("message_id"));
    }

    @Test
    void copyShouldResendMediaWithCaptionOrText() throws Exception {
        ChatMessage photo = ChatMessage.builder().id(1L).chatId(GROUP).text("caption here")
                .media(new MediaRef(MediaKind.PHOTO, "file-9")).build();
        ChatMessage text = ChatMessage.builder().id(2L).chatId(GROUP).text("plain").build();

        client.copy(photo, -1001L);
        client.copy(text, -1001L);

        JSONObject sendPhoto = http.calls("sendPhoto").get(0);
        assertEquals("file-9", sendPhoto.getString("photo"));
        assertEquals("caption here", sendPhoto.getString("caption"));
        assertEquals("plain", http.calls("sendMessage").get(0).getString("text"));
        assertThrows(ChatClientException.class,
                () -> client.copy(ChatMessage.builder().id(3L).chatId(GROUP).build(), -1001L));
    }

    @Test
    void errorsShouldBeClassified() {
        TransientChatException flood = assertInstanceOf(TransientChatException.class, TelegramBotApiClient.classify("sendMessage", 429,
                new JSONObject("{\"ok\":false,\"error_code\":429,\"description\":\"Too Many Requests\",\"parameters\":{\"retry_after\":5}}")));
        assertEquals(Duration.ofSeconds(5), flood.retryAfter());
        assertInstanceOf(TransientChatException.class, TelegramBotApiClient.classify("sendMessage", 502,
                new JSONObject("{\"ok\":false,\"error_code\":502,\"description\":\"Bad Gateway\"}")));
        assertInstanceOf(ForwardRestrictedException.class, TelegramBotApiClient.classify("forwardMessage", 400,
                new JSONObject("{\"ok\":false,\"error_code\":400,\"description\":\"Bad Request: message can't be forwarded\"}")));
        assertInstanceOf(ChatAccessException.class, TelegramBotApiClient.classify("getChat", 403,
                new JSONObject("{\"ok\":false,\"error_code\":403,\"description\":\"Forbidden: bot was kicked\"}")));
        ChatClientException other = TelegramBotApiClient.classify("sendMessage", 400,
                new JSONObject("{\"ok\":false,\"error_code\":400,\"description\":\"Bad Request: message text is empty\"}"));
        assertEquals(ChatClientException.class, other.getClass());
    }

    @Test
    void ioFailureShouldBeTransient() {
        http.failWith = new IOException("connection reset");

        assertThrows(TransientChatException.class, () -> client.sendText(-1001L, "hi"));
    }

    @Test
    void transientUpdateFailureShouldBeRetried() throws Exception {
        http.queue("getUpdates", 502, "<html>bad gateway</html>");
        http.queue("getUpdates", 200, "{\"ok\":true,\"result\":[]}");

        assertTrue(client.listDialogs().isEmpty());
        assertEquals(2, http.calls("getUpdates").size());
    }

    @Test
    void parseMessageShouldPickLargestPhotoAndCaption() {
        JSONObject raw = new JSONObject()
                .put("message_id", 7)
                .put("date", T0)
                .put("caption", "look")
                .put("chat", new JSONObject().put("id", GROUP).put("type", "channel").put("title", "News"))
                .put("photo", new JSONArray()
                        .put(new JSONObject().put("file_id", "small"))
                        .put(new JSONObject().put("file_id", "large")));

        ChatMessage message = TelegramBotApiClient.parseMessage(raw);

        assertEquals(new MediaRef(MediaKind.PHOTO, "large"), message.getMedia());
        assertEquals("look", message.getText());
        assertEquals("News", message.getChatTitle());
        assertNull(message.getTopicId());
        assertEquals(Instant.ofEpochSecond(T0), message.getDate());
    }

    private TelegramBotApiClient newClient(HttpClientEx transport, boolean consumeUpdates) {
        return new TelegramBotApiClient(
                transport, "https://api.example.org/", "123:abc", 5, 2, 10, 3,
                new RetryBackoff(1L, 1L, false, delay -> { }), journal, consumeUpdates);
    }

    private static List<Long> fetchIds(TelegramBotApiClient reader) throws ChatClientException {
        List<Long> ids = new ArrayList<>();
        reader.fetchMessages(GROUP, null, Window.afterMessageId(0L, Instant.ofEpochSecond(T0 + 3600)), message -> {
            ids.add(message.getId());
            return true;
        });
        return ids;
    }

    private void queueUpdates() {
        JSONArray first = new JSONArray()
                .put(update(1, message(12, GROUP, "supergroup", "Jobs", false, null).put("text", "java two")))
                .put(update(2, message(11, GROUP, "supergroup", "Jobs", false, null).put("text", "java one")));
        JSONArray second = new JSONArray()
                .put(update(3, message(10, GROUP, "supergroup", "Jobs", false, null).put("text", "old")))
                .put(update(4, message(20, FORUM, "supergroup", "Dev", true, 5L)
                        .put("forum_topic_created", new JSONObject().put("name", "Backend"))));
        JSONArray third = new JSONArray()
                .put(update(5, message(21, FORUM, "supergroup", "Dev", true, 5L).put("text", "topic post")))
                .put(update(6, message(22, FORUM, "supergroup", "Dev", true, 9L).put("text", "other topic")));
        http.queue("getUpdates", 200, new JSONObject().put("ok", true).put("result", first).toString());
        http.queue("getUpdates", 200, new JSONObject().put("ok", true).put("result", second).toString());
        http.queue("getUpdates", 200, new JSONObject().put("ok", true).put("result", third).toString());
    }

    private static JSONObject update(long updateId, JSONObject message) {
        return new JSONObject().put("update_id", updateId).put("message", message);
    }

    private static JSONObject message(long id, long chatId, String type, String title, boolean forum, Long topicId) {
        JSONObject chat = new JSONObject().put("id", chatId).put("type", type).put("title", title);
        if (forum) {
            chat.put("is_forum", true);
        }
        JSONObject message = new JSONObject().put("message_id", id).put("date", T0 + id).put("chat", chat);
        if (topicId != null) {
            message.put("message_thread_id", topicId).put("is_topic_message", true);
        }
        return message;
    }

    /**
     * Keeps pending updates the way Telegram does: a request with {@code offset} drops every update
     * below it for good.
     */
    private static final class BotApiServer extends HttpClientEx {
        private final List<JSONObject> pending = new ArrayList<>();
        private int getUpdatesCalls;

        void post(long updateId, JSONObject message) {
            pending.add(update(updateId, message));
        }

        @Override
        public Response postJson(String url, String json, int timeoutSeconds) {
            String method = url.substring(url.lastIndexOf('/') + 1);
            if (!method.equals("getUpdates")) {
                return new Response(200, "{\"ok\":true,\"result\":{}}");
            }
            getUpdatesCalls++;
            JSONObject params = new JSONObject(json);
            if (params.has("offset")) {
                long offset = params.getLong("offset");
                pending.removeIf(update -> update.getLong("update_id") < offset);
            }
            JSONArray result = new JSONArray();
            for (int i = 0; i < pending.size() && i < params.optInt("limit", 100); i++) {
                result.put(pending.get(i));
            }
            return new Response(200, new JSONObject().put("ok", true).put("result", result).toString());
        }
    }

    private static final class ScriptedHttp extends HttpClientEx {
        private final Map<String, Deque<Response>> scripted = new HashMap<>();
        private final Map<String, List<JSONObject>> requests = new HashMap<>();
        private final List<String> urls = new ArrayList<>();
        private IOException failWith;

        void queue(String method, int status, String body) {
            scripted.computeIfAbsent(method, ignored -> new ArrayDeque<>()).add(new Response(status, body));
        }

        List<JSONObject> calls(String method) {
            return requests.getOrDefault(method, List.of());
        }

        @Override
        public Response postJson(String url, String json, int timeoutSeconds) throws IOException {
            if (failWith != null) {
                throw failWith;
            }
            urls.add(url);
            String method = url.substring(url.lastIndexOf('/') + 1);
            requests.computeIfAbsent(method, ignored -> new ArrayList<>()).add(new JSONObject(json));
            Deque<Response> queue = scripted.get(method);
            if (queue != null && !queue.isEmpty()) {
                return queue.poll();
            }
            if (method.equals("getUpdates")) {
                return new Response(200, "{\"ok\":true,\"result\":[]}");
            }
            return new Response(200, "{\"ok\":true,\"result\":{}}");
        }
    }
}
