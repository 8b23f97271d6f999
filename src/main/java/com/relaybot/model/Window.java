package com.relaybot.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Half-open scan range {@code (lowerBound, upperBound]}. The lower bound is either a message id or a
 * timestamp, never both.
 */
public final class Window {
    private final Long afterMessageId;
    private final Instant afterTimestamp;
    private final Instant upperBound;

    private Window(Long afterMessageId, Instant afterTimestamp, Instant upperBound) {
        this.afterMessageId = afterMessageId;
        this.afterTimestamp = afterTimestamp;
        this.upperBound = Objects.requireNonNull(upperBound, "upperBound");
    }

    public static Window afterMessageId(long messageId, Instant upperBound) {
        return new Window(messageId, null, upperBound);
    }

    public static Window afterTimestamp(Instant timestamp, Instant upperBound) {
        return new Window(null, Objects.requireNonNull(timestamp, "timestamp"), upperBound);
    }

    public boolean isIdBounded() {
        return afterMessageId != null;
    }

    public Long afterMessageId() {
        return afterMessageId;
    }

    public Instant afterTimestamp() {
        return afterTimestamp;
    }

    public Instant upperBound() {
        return upperBound;
    }

    public boolean admits(ChatMessage message) {
        if (message == null) {
            return false;
        }
        Instant date = message.getDate();
        if (date != null && date.isAfter(upperBound)) {
            return false;
        }
        if (afterMessageId != null) {
            return message.getId() > afterMessageId;
        }
        return date != null && date.isAfter(afterTimestamp);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Window other)) {
            return false;
        }
        return Objects.equals(afterMessageId, other.afterMessageId)
                && Objects.equals(afterTimestamp, other.afterTimestamp)
                && upperBound.equals(other.upperBound);
    }

    @Override
    public int hashCode() {
        return Objects.hash(afterMessageId, afterTimestamp, upperBound);
    }

    @Override
    public String toString() {
        String lower = afterMessageId != null ? "id>" + afterMessageId : "ts>" + afterTimestamp;
        return "(" + lower + ", " + upperBound + "]";
    }
}
