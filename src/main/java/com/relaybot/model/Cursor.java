package com.relaybot.model;

import java.time.Instant;

/**
 * Scan progress of one source. The message id is authoritative; the timestamp is only used to plan
 * a window while no id has been recorded yet.
 */
public record Cursor(Long lastMessageId, Instant lastTimestamp) {

    private static final Cursor EMPTY = new Cursor(null, null);

    public static Cursor empty() {
        return EMPTY;
    }

    public static Cursor ofMessageId(long lastMessageId) {
        return new Cursor(lastMessageId, null);
    }

    public boolean isEmpty() {
        return lastMessageId == null && lastTimestamp == null;
    }

    /**
     * Field-wise maximum of both cursors. The result is never behind either input.
     */
    public Cursor mergeForward(Cursor other) {
        if (other == null) {
            return this;
        }
        return new Cursor(maxId(lastMessageId, other.lastMessageId), maxInstant(lastTimestamp, other.lastTimestamp));
    }

    public Cursor advanceTo(ChatMessage message) {
        if (message == null) {
            return this;
        }
        return mergeForward(new Cursor(message.getId(), message.getDate()));
    }

    private static Long maxId(Long current, Long incoming) {
        if (incoming == null) {
            return current;
        }
        if (current == null) {
            return incoming;
        }
        return Math.max(current, incoming);
    }

    private static Instant maxInstant(Instant current, Instant incoming) {
        if (incoming == null) {
            return current;
        }
        if (current == null) {
            return incoming;
        }
        return incoming.isAfter(current) ? incoming : current;
    }
}
