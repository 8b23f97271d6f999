package com.relaybot.state;

import com.relaybot.config.ConfigException;
import com.relaybot.config.YamlDocument;
import com.relaybot.model.Cursor;
import com.relaybot.model.SourceKey;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps cursors inside the YAML config document, under each source's {@code cursor} mapping.
 *
 * <p>Every operation re-reads the document from disk, so a change made by another process between a
 * read and a write is seen as a conflict. All cursors share one file, so writes are serialized on the
 * store instance.
 */
public final class YamlCursorStore implements CursorStore {
    private static final Logger LOG = LogManager.getLogger(YamlCursorStore.class);

    private final Path path;
    private final Object documentLock = new Object();

    public YamlCursorStore(Path path) {
        this.path = Objects.requireNonNull(path, "path");
    }

    public Path path() {
        return path;
    }

    @Override
    public Optional<Cursor> read(SourceKey key) throws CursorStoreException {
        synchronized (documentLock) {
            Map<String, Object> source = findSource(loadDocument(), key);
            if (source == null) {
                return Optional.empty();
            }
            Cursor cursor = parseCursor(source.get("cursor"), key);
            return cursor.isEmpty() ? Optional.empty() : Optional.of(cursor);
        }
    }

    @Override
    public WriteResult compareAndWrite(SourceKey key, Cursor expected, Cursor next) throws CursorStoreException {
        Cursor observed = expected == null ? Cursor.empty() : expected;
        synchronized (documentLock) {
            Map<String, Object> document = loadDocument();
            Map<String, Object> source = findSource(document, key);
            if (source == null) {
                LOG.warn("event=cursor_conflict {} reason=source_missing_from_document", key);
                return WriteResult.CONFLICT;
            }
            Cursor current = parseCursor(source.get("cursor"), key);
            if (!current.equals(observed)) {
                LOG.warn("event=cursor_conflict {} expected={} stored={}", key, observed, current);
                return WriteResult.CONFLICT;
            }
            Cursor merged = current.mergeForward(next);
            if (merged.equals(current)) {
                return WriteResult.WRITTEN;
            }
            source.put("cursor", toRaw(merged));
            try {
                YamlDocument.writeAtomically(path, document);
            } catch (IOException e) {
                throw new CursorStoreException("Unable to persist cursor for " + key + " to " + path, e);
            }
            LOG.debug("event=cursor_written {} cursor={}", key, merged);
            return WriteResult.WRITTEN;
        }
    }

    private Map<String, Object> loadDocument() throws CursorStoreException {
        try {
            return YamlDocument.read(path);
        } catch (ConfigException e) {
            throw new CursorStoreException(e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> findSource(Map<String, Object> document, SourceKey key) {
        if (!(document.get("sources") instanceof List<?> sources)) {
            return null;
        }
        for (Object item : sources) {
            if (!(item instanceof Map<?, ?> source)) {
                continue;
            }
            Long chatId = YamlDocument.asLong(source.get("chat_id"));
            Long topicId = YamlDocument.asLong(source.get("topic_id"));
            if (chatId != null && chatId == key.chatId() && Objects.equals(topicId, key.topicId())) {
                return (Map<String, Object>) source;
            }
        }
        return null;
    }

    static Cursor parseCursor(Object raw, SourceKey key) {
        if (raw == null) {
            return Cursor.empty();
        }
        if (!(raw instanceof Map<?, ?> map)) {
            LOG.warn("Cursor for {} is not a mapping; ignoring", key);
            return Cursor.empty();
        }
        Object idRaw = map.get("last_message_id");
        Long lastMessageId = YamlDocument.asLong(idRaw);
        if (lastMessageId == null && idRaw != null) {
            LOG.warn("Cursor last_message_id for {} is invalid; ignoring", key);
        }
        return new Cursor(lastMessageId, parseTimestamp(map.get("last_timestamp"), key));
    }

    static Instant parseTimestamp(Object raw, SourceKey key) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Date date) {
            return date.toInstant();
        }
        if (!(raw instanceof String text) || text.isBlank()) {
            LOG.warn("Cursor last_timestamp for {} is invalid; ignoring", key);
            return null;
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(
                    text.trim(), OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offset) {
                return offset.toInstant();
            }
            // stored timestamps without an offset are UTC
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            LOG.warn("Cursor last_timestamp for {} is invalid; ignoring", key);
            return null;
        }
    }

    static Map<String, Object> toRaw(Cursor cursor) {
        Map<String, Object> raw = new LinkedHashMap<>();
        if (cursor.lastMessageId() != null) {
            raw.put("last_message_id", cursor.lastMessageId());
        }
        if (cursor.lastTimestamp() != null) {
            raw.put("last_timestamp", cursor.lastTimestamp().toString());
        }
        return raw;
    }
}
