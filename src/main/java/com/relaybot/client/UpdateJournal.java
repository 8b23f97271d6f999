package com.relaybot.client;

import com.relaybot.core.AtomicFiles;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Local copy of Bot API updates that Telegram no longer redelivers.
 *
 * <p>Asking {@code getUpdates} for the next page confirms every earlier update, after which Telegram
 * drops it. Updates are saved here before they are confirmed and stay until the stored cursors have
 * moved past them, so a dry run, a failed source or a cancelled run can still rescan them later.
 * Entries older than the retention are dropped regardless.
 */
public final class UpdateJournal {
    private static final Logger LOG = LogManager.getLogger(UpdateJournal.class);

    private final Path path;
    private final Duration retention;
    private final Clock clock;

    public UpdateJournal(Path path, Duration retention, Clock clock) {
        this.path = Objects.requireNonNull(path, "path");
        this.retention = retention == null || retention.isNegative() || retention.isZero()
                ? Duration.ofDays(7)
                : retention;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public Path path() {
        return path;
    }

    /**
     * Saved updates in file order; empty when nothing has been saved yet.
     */
    public List<JSONObject> load() throws ChatClientException {
        if (!Files.exists(path)) {
            return new ArrayList<>();
        }
        JSONArray array;
        try {
            String content = Files.readString(path, StandardCharsets.UTF_8);
            if (content.isBlank()) {
                return new ArrayList<>();
            }
            array = new JSONObject(content).optJSONArray("updates");
        } catch (IOException e) {
            throw new ChatClientException("unable to read update journal " + path, e);
        } catch (JSONException e) {
            throw new ChatClientException("update journal " + path + " is not valid JSON; move it aside to start over", e);
        }
        List<JSONObject> out = new ArrayList<>();
        if (array == null) {
            return out;
        }
        for (int i = 0; i < array.length(); i++) {
            JSONObject update = array.optJSONObject(i);
            if (update != null && update.has("update_id")) {
                out.add(update);
            }
        }
        return out;
    }

    public void save(Collection<JSONObject> updates) throws ChatClientException {
        JSONArray array = new JSONArray();
        for (JSONObject update : updates) {
            array.put(update);
        }
        try {
            AtomicFiles.writeString(path, new JSONObject().put("updates", array).toString());
        } catch (IOException e) {
            throw new ChatClientException("unable to write update journal " + path, e);
        }
    }

    /**
     * Drops updates whose message is covered by {@code handledThroughByChat}, plus anything past the
     * retention or without a message. Chats missing from the map keep all their updates.
     */
    public List<JSONObject> prune(Collection<JSONObject> updates, Map<Long, Long> handledThroughByChat) {
        Instant oldest = clock.instant().minus(retention);
        List<JSONObject> kept = new ArrayList<>();
        for (JSONObject update : updates) {
            JSONObject message = messageOf(update);
            if (message == null) {
                continue;
            }
            if (Instant.ofEpochSecond(message.optLong("date", 0L)).isBefore(oldest)) {
                continue;
            }
            JSONObject chat = message.optJSONObject("chat");
            Long handledThrough = chat == null ? null : handledThroughByChat.get(chat.optLong("id"));
            if (handledThrough != null && message.optLong("message_id", Long.MAX_VALUE) <= handledThrough) {
                continue;
            }
            kept.add(update);
        }
        LOG.debug("event=journal_pruned kept={} dropped={}", kept.size(), updates.size() - kept.size());
        return kept;
    }

    static JSONObject messageOf(JSONObject update) {
        JSONObject message = update.optJSONObject("message");
        return message != null ? message : update.optJSONObject("channel_post");
    }
}
