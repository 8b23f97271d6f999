package com.relaybot.client;

import com.relaybot.config.Config;
import com.relaybot.config.ConfigException;
import com.relaybot.http.HttpClientEx;
import com.relaybot.model.ChatMessage;
import com.relaybot.model.DialogInfo;
import com.relaybot.model.MediaKind;
import com.relaybot.model.MediaRef;
import com.relaybot.model.TopicInfo;
import com.relaybot.model.Window;
import com.relaybot.runner.RetryBackoff;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * {@link ChatClient} on top of the Telegram Bot HTTP API.
 *
 * <p>A bot cannot page through chat history; it only sees the updates Telegram keeps pending for it
 * (up to 24 hours). The first call that needs messages merges the {@link UpdateJournal} with
 * {@code getUpdates} into a snapshot which every source of the run then reads from. Dialogs and
 * topics are derived from the same snapshot.
 *
 * <p>A read-only client ({@code consumeUpdates == false}) never sends an {@code offset}, so it
 * confirms nothing to Telegram and leaves the journal untouched. It sees at most one page of new
 * updates.
 */
public final class TelegramBotApiClient implements ChatClient {
    private static final Logger LOG = LogManager.getLogger(TelegramBotApiClient.class);

    public static final String TOKEN_ENV = "TELEGRAM_BOT_TOKEN";

    // animation messages also carry a document; check the specific kind first
    private static final MediaKind[] MEDIA_LOOKUP_ORDER = {
            MediaKind.PHOTO, MediaKind.VIDEO, MediaKind.ANIMATION, MediaKind.AUDIO, MediaKind.VOICE, MediaKind.DOCUMENT
    };

    private final HttpClientEx http;
    private final String baseUrl;
    private final String token;
    private final int timeoutSeconds;
    private final int pageSize;
    private final int maxPages;
    private final int fetchMaxAttempts;
    private final RetryBackoff fetchBackoff;
    private final UpdateJournal journal;
    private final boolean consumeUpdates;

    private final Object snapshotLock = new Object();
    private Snapshot snapshot;
    private final Set<Long> verifiedChats = new HashSet<>();

    public TelegramBotApiClient(
            HttpClientEx http,
            String baseUrl,
            String token,
            int timeoutSeconds,
            int pageSize,
            int maxPages,
            int fetchMaxAttempts,
            RetryBackoff fetchBackoff,
            UpdateJournal journal,
            boolean consumeUpdates
    ) {
        this.http = Objects.requireNonNull(http, "http");
        this.baseUrl = stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl"));
        this.token = Objects.requireNonNull(token, "token");
        this.timeoutSeconds = Math.max(1, timeoutSeconds);
        this.pageSize = Math.max(1, Math.min(100, pageSize));
        this.maxPages = Math.max(1, maxPages);
        this.fetchMaxAttempts = Math.max(1, fetchMaxAttempts);
        this.fetchBackoff = Objects.requireNonNull(fetchBackoff, "fetchBackoff");
        this.journal = Objects.requireNonNull(journal, "journal");
        this.consumeUpdates = consumeUpdates;
    }

    /**
     * @param consumeUpdates false for listings and dry runs, which must leave pending updates for the
     *                       next real run
     */
    public static TelegramBotApiClient fromConfig(Config config, HttpClientEx http, boolean consumeUpdates) {
        String token = System.getenv(TOKEN_ENV);
        if (token == null || token.isBlank()) {
            token = config.getString("telegram.bot_token");
        }
        if (token == null || token.isBlank()) {
            throw new ConfigException("missing bot token: set " + TOKEN_ENV + " or telegram.bot_token");
        }
        return new TelegramBotApiClient(
                http,
                config.getString("telegram.api_base_url", "https://api.telegram.org"),
                token.trim(),
                config.getInt("telegram.timeout_sec", 30),
                config.getInt("telegram.updates.page_size", 100),
                config.getInt("telegram.updates.max_pages", 50),
                config.getInt("telegram.fetch.max_attempts", 5),
                RetryBackoff.fromConfig(config),
                new UpdateJournal(
                        config.getPath("telegram.updates.journal_path"),
                        Duration.ofHours(config.getInt("telegram.updates.journal_retention_hours", 168)),
                        Clock.systemUTC()
                ),
                consumeUpdates
        );
    }

    @Override
    public List<DialogInfo> listDialogs() throws ChatClientException {
        return new ArrayList<>(snapshot().dialogs.values());
    }

    @Override
    public Optional<List<TopicInfo>> listTopics(long chatId) throws ChatClientException {
        Snapshot current = snapshot();
        DialogInfo dialog = current.dialogs.get(chatId);
        if (dialog == null || !dialog.forum()) {
            return Optional.empty();
        }
        Map<Long, String> topics = current.topics.getOrDefault(chatId, Map.of());
        List<TopicInfo> out = new ArrayList<>(topics.size());
        for (Map.Entry<Long, String> entry : topics.entrySet()) {
            out.add(new TopicInfo(chatId, entry.getKey(), entry.getValue()));
        }
        return Optional.of(out);
    }

    @Override
    public void fetchMessages(long chatId, Long topicId, Window window, MessageVisitor visitor)
            throws ChatClientException {
        verifyChat(chatId);
        List<ChatMessage> messages = snapshot().messages.getOrDefault(chatId, List.of());
        for (ChatMessage message : messages) {
            if (topicId != null && !topicId.equals(message.getTopicId())) {
                continue;
            }
            if (!window.admits(message)) {
                continue;
            }
            if (!visitor.visit(message)) {
                return;
            }
        }
    }

    @Override
    public void forward(ChatMessage message, long destinationChatId) throws ChatClientException {
        JSONObject params = new JSONObject()
                .put("chat_id", destinationChatId)
                .put("from_chat_id", message.getChatId())
                .put("message_id", message.getId());
        call("forwardMessage", params);
    }

    @Override
    public void copy(ChatMessage message, long destinationChatId) throws ChatClientException {
        if (message.hasMedia()) {
            MediaKind kind = message.getMedia().kind();
            JSONObject params = new JSONObject()
                    .put("chat_id", destinationChatId)
                    .put(kind.field(), message.getMedia().fileId());
            if (message.hasText()) {
                params.put("caption", message.getText());
            }
            call(kind.sendMethod(), params);
            return;
        }
        if (message.hasText()) {
            sendText(destinationChatId, message.getText());
            return;
        }
        throw new ChatClientException("no copyable content in message_id=" + message.getId());
    }

    @Override
    public void sendText(long destinationChatId, String text) throws ChatClientException {
        call("sendMessage", new JSONObject().put("chat_id", destinationChatId).put("text", text));
    }

    @Override
    public void release(Map<Long, Long> handledThroughByChat) throws ChatClientException {
        if (!consumeUpdates) {
            return;
        }
        Snapshot current;
        synchronized (snapshotLock) {
            current = snapshot;
        }
        if (current == null) {
            return;
        }
        List<JSONObject> kept = journal.prune(current.pending.values(), handledThroughByChat);
        journal.save(kept);
        LOG.info("event=updates_released kept={} dropped={} journal={}",
                kept.size(), current.pending.size() - kept.size(), journal.path());
    }

    @Override
    public void close() {
        synchronized (snapshotLock) {
            snapshot = null;
            verifiedChats.clear();
        }
    }

    private void verifyChat(long chatId) throws ChatClientException {
        synchronized (snapshotLock) {
            if (verifiedChats.contains(chatId)) {
                return;
            }
        }
        callWithRetry("getChat", new JSONObject().put("chat_id", chatId));
        synchronized (snapshotLock) {
            verifiedChats.add(chatId);
        }
    }

    private Snapshot snapshot() throws ChatClientException {
        synchronized (snapshotLock) {
            if (snapshot == null) {
                snapshot = loadSnapshot();
            }
            return snapshot;
        }
    }

    /**
     * Reads pending updates page by page on top of the journal. Requesting the next offset confirms
     * the previous pages to Telegram, so they are written to the journal first.
     */
    private Snapshot loadSnapshot() throws ChatClientException {
        Map<Long, JSONObject> pending = new TreeMap<>();
        for (JSONObject update : journal.load()) {
            pending.put(update.optLong("update_id"), update);
        }
        int journaled = pending.size();
        long offset = 0L;
        for (int page = 0; page < maxPages; page++) {
            if (page > 0) {
                if (!consumeUpdates) {
                    LOG.warn("event=updates_truncated reason=read_only page_size={}", pageSize);
                    break;
                }
                journal.save(pending.values());
            }
            JSONObject params = new JSONObject()
                    .put("limit", pageSize)
                    .put("timeout", 0)
                    .put("allowed_updates", new JSONArray().put("message").put("channel_post"));
            if (offset > 0L) {
                params.put("offset", offset);
            }
            Object result = callWithRetry("getUpdates", params);
            JSONArray batch = result instanceof JSONArray array ? array : new JSONArray();
            for (int i = 0; i < batch.length(); i++) {
                JSONObject update = batch.optJSONObject(i);
                if (update == null || !update.has("update_id")) {
                    continue;
                }
                long updateId = update.optLong("update_id");
                offset = Math.max(offset, updateId + 1L);
                pending.put(updateId, update);
            }
            if (batch.length() < pageSize) {
                break;
            }
        }

        Snapshot out = new Snapshot(pending);
        int messages = 0;
        for (JSONObject update : pending.values()) {
            JSONObject message = UpdateJournal.messageOf(update);
            if (message != null) {
                out.add(message);
                messages++;
            }
        }
        out.sort();
        LOG.info("event=updates_loaded messages={} chats={} journaled={} consume={}",
                messages, out.dialogs.size(), journaled, consumeUpdates);
        return out;
    }

    private Object callWithRetry(String method, JSONObject params) throws ChatClientException {
        for (int attempt = 1; ; attempt++) {
            try {
                return call(method, params);
            } catch (TransientChatException e) {
                if (attempt >= fetchMaxAttempts) {
                    throw e;
                }
                LOG.warn("event=api_retry method={} attempt={}/{} error={}", method, attempt, fetchMaxAttempts, e.getMessage());
                try {
                    fetchBackoff.pause(attempt, e.retryAfter());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new ChatClientException("interrupted while retrying " + method, ie);
                }
            }
        }
    }

    Object call(String method, JSONObject params) throws ChatClientException {
        String url = baseUrl + "/bot" + token + "/" + method;
        HttpClientEx.Response response;
        try {
            response = http.postJson(url, params.toString(), timeoutSeconds);
        } catch (IOException e) {
            throw new TransientChatException(method + " I/O failure: " + e.getMessage(), Duration.ZERO, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChatClientException(method + " interrupted", e);
        }

        JSONObject body;
        try {
            body = new JSONObject(response.body() == null ? "" : response.body());
        } catch (JSONException e) {
            if (response.statusCode() >= 500 || response.statusCode() == 429) {
                throw new TransientChatException(method + " HTTP " + response.statusCode());
            }
            throw new ChatClientException(method + " HTTP " + response.statusCode() + ": unreadable response", e);
        }
        if (body.optBoolean("ok", false)) {
            return body.opt("result");
        }
        throw classify(method, response.statusCode(), body);
    }

    static ChatClientException classify(String method, int httpStatus, JSONObject body) {
        int code = body.optInt("error_code", httpStatus);
        String description = body.optString("description", "").trim();
        String message = method + " failed: " + code + (description.isEmpty() ? "" : " " + description);
        String lower = description.toLowerCase(Locale.ROOT);

        if (code == 429 || httpStatus == 429) {
            JSONObject parameters = body.optJSONObject("parameters");
            long retryAfter = parameters == null ? 0L : parameters.optLong("retry_after", 0L);
            return new TransientChatException(message, Duration.ofSeconds(Math.max(0L, retryAfter)));
        }
        if (code >= 500 || httpStatus >= 500) {
            return new TransientChatException(message);
        }
        if (lower.contains("protected") || lower.contains("can't be forwarded")) {
            return new ForwardRestrictedException(message);
        }
        if (code == 403 || lower.contains("chat not found")) {
            return new ChatAccessException(message);
        }
        return new ChatClientException(message);
    }

    static ChatMessage parseMessage(JSONObject raw) {
        JSONObject chat = raw.optJSONObject("chat");
        if (chat == null || !raw.has("message_id")) {
            return null;
        }
        Long topicId = null;
        if (raw.optBoolean("is_topic_message", false) && raw.has("message_thread_id")) {
            topicId = raw.optLong("message_thread_id");
        }
        String text = raw.has("text") ? raw.optString("text") : raw.optString("caption", null);
        return ChatMessage.builder()
                .id(raw.optLong("message_id"))
                .chatId(chat.optLong("id"))
                .topicId(topicId)
                .date(Instant.ofEpochSecond(raw.optLong("date", 0L)))
                .text(text)
                .media(parseMedia(raw))
                .chatTitle(chatTitle(chat))
                .build();
    }

    private static MediaRef parseMedia(JSONObject raw) {
        for (MediaKind kind : MEDIA_LOOKUP_ORDER) {
            Object value = raw.opt(kind.field());
            if (value instanceof JSONArray sizes && sizes.length() > 0) {
                // photo sizes are ordered smallest first
                JSONObject largest = sizes.optJSONObject(sizes.length() - 1);
                String fileId = largest == null ? "" : largest.optString("file_id", "");
                if (!fileId.isEmpty()) {
                    return new MediaRef(kind, fileId);
                }
            } else if (value instanceof JSONObject file) {
                String fileId = file.optString("file_id", "");
                if (!fileId.isEmpty()) {
                    return new MediaRef(kind, fileId);
                }
            }
        }
        return null;
    }

    private static String chatTitle(JSONObject chat) {
        String title = chat.optString("title", "").trim();
        if (!title.isEmpty()) {
            return title;
        }
        String username = chat.optString("username", "").trim();
        if (!username.isEmpty()) {
            return "@" + username;
        }
        String name = (chat.optString("first_name", "") + " " + chat.optString("last_name", "")).trim();
        return name.isEmpty() ? null : name;
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static final class Snapshot {
        private final Map<Long, JSONObject> pending;
        private final Map<Long, DialogInfo> dialogs = new LinkedHashMap<>();
        private final Map<Long, Map<Long, String>> topics = new LinkedHashMap<>();
        private final Map<Long, List<ChatMessage>> messages = new LinkedHashMap<>();

        private Snapshot(Map<Long, JSONObject> pending) {
            this.pending = pending;
        }

        private void add(JSONObject raw) {
            JSONObject chat = raw.optJSONObject("chat");
            ChatMessage message = parseMessage(raw);
            if (chat == null || message == null) {
                return;
            }
            long chatId = message.getChatId();
            boolean forum = chat.optBoolean("is_forum", false);
            DialogInfo known = dialogs.get(chatId);
            dialogs.put(chatId, new DialogInfo(
                    chatId,
                    chat.optString("type", "unknown"),
                    message.getChatTitle() == null ? "" : message.getChatTitle(),
                    forum || (known != null && known.forum())
            ));

            if (message.getTopicId() != null) {
                Map<Long, String> chatTopics = topics.computeIfAbsent(chatId, ignored -> new TreeMap<>());
                JSONObject created = raw.optJSONObject("forum_topic_created");
                if (created != null && !created.optString("name", "").isBlank()) {
                    chatTopics.put(message.getTopicId(), created.optString("name").trim());
                } else {
                    chatTopics.putIfAbsent(message.getTopicId(), null);
                }
            }
            messages.computeIfAbsent(chatId, ignored -> new ArrayList<>()).add(message);
        }

        private void sort() {
            for (List<ChatMessage> list : messages.values()) {
                list.sort(Comparator.comparingLong(ChatMessage::getId));
            }
        }
    }
}
