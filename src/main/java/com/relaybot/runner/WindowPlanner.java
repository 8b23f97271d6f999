package com.relaybot.runner;

import com.relaybot.config.Config;
import com.relaybot.model.Cursor;
import com.relaybot.model.Window;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Chooses the scan window of a source from its stored cursor. Without a cursor only the last
 * {@code firstRunLookback} is scanned, never the full history.
 */
public final class WindowPlanner {
    public static final Duration DEFAULT_FIRST_RUN_LOOKBACK = Duration.ofHours(24);

    private final Duration firstRunLookback;

    public WindowPlanner() {
        this(DEFAULT_FIRST_RUN_LOOKBACK);
    }

    public WindowPlanner(Duration firstRunLookback) {
        Objects.requireNonNull(firstRunLookback, "firstRunLookback");
        this.firstRunLookback = firstRunLookback.isNegative() || firstRunLookback.isZero()
                ? DEFAULT_FIRST_RUN_LOOKBACK
                : firstRunLookback;
    }

    public static WindowPlanner fromConfig(Config config) {
        int hours = config.getInt("window.first_run_lookback_hours", 24);
        return new WindowPlanner(Duration.ofHours(Math.max(1, hours)));
    }

    public Window plan(Optional<Cursor> cursor, Instant now) {
        Objects.requireNonNull(now, "now");
        Cursor stored = cursor == null ? Cursor.empty() : cursor.orElse(Cursor.empty());
        if (stored.lastMessageId() != null) {
            return Window.afterMessageId(stored.lastMessageId(), now);
        }
        if (stored.lastTimestamp() != null) {
            return Window.afterTimestamp(stored.lastTimestamp(), now);
        }
        return Window.afterTimestamp(now.minus(firstRunLookback), now);
    }

    public Duration firstRunLookback() {
        return firstRunLookback;
    }
}
