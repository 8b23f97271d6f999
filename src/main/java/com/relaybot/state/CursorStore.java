package com.relaybot.state;

import com.relaybot.model.Cursor;
import com.relaybot.model.SourceKey;

import java.util.Optional;

/**
 * Durable per-source cursor positions. Implementations must make writes atomic and must never let a
 * stored cursor move backward.
 */
public interface CursorStore {

    enum WriteResult {
        WRITTEN,
        CONFLICT
    }

    /**
     * Stored cursor of {@code key}, or empty when the source has never been scanned.
     */
    Optional<Cursor> read(SourceKey key) throws CursorStoreException;

    /**
     * Stores {@code next} only if the currently stored value still equals {@code expected} (an absent
     * cursor equals {@link Cursor#empty()}). The stored value becomes the field-wise maximum of the
     * current and the next cursor.
     */
    WriteResult compareAndWrite(SourceKey key, Cursor expected, Cursor next) throws CursorStoreException;
}
