package com.relaybot.model;

import com.relaybot.core.FailureKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Counters for one source in one run. Owned by a single runner, so not thread-safe.
 */
public final class SourceStatistics {
    private final SourceKey key;
    private final String label;
    private int scanned;
    private int matched;
    private int forwarded;
    private int copied;
    private int failed;
    private int skipped;
    private final List<String> errors = new ArrayList<>();
    private SourceState state = SourceState.PLANNING;
    private FailureKind failureKind = FailureKind.NONE;
    private Cursor cursorBefore = Cursor.empty();
    private Cursor cursorAfter = Cursor.empty();

    public SourceStatistics(SourceKey key, String label) {
        this.key = key;
        this.label = label == null ? "" : label.trim();
    }

    public SourceKey key() {
        return key;
    }

    public String label() {
        return label;
    }

    public int scanned() {
        return scanned;
    }

    public int matched() {
        return matched;
    }

    public int forwarded() {
        return forwarded;
    }

    public int copied() {
        return copied;
    }

    public int delivered() {
        return forwarded + copied;
    }

    public int failed() {
        return failed;
    }

    public int skipped() {
        return skipped;
    }

    public List<String> errors() {
        return Collections.unmodifiableList(errors);
    }

    public SourceState state() {
        return state;
    }

    public FailureKind failureKind() {
        return failureKind;
    }

    public Cursor cursorBefore() {
        return cursorBefore;
    }

    public Cursor cursorAfter() {
        return cursorAfter;
    }

    public boolean sourceFailed() {
        return state == SourceState.SOURCE_FAILED;
    }

    public boolean cancelled() {
        return failureKind == FailureKind.CANCELLED;
    }

    public void recordScanned() {
        scanned++;
    }

    public void recordMatched() {
        matched++;
    }

    public void recordOutcome(DeliveryOutcome outcome) {
        if (outcome == null) {
            return;
        }
        switch (outcome.status) {
            case FORWARDED -> forwarded++;
            case COPIED -> copied++;
            case FAILED -> failed++;
            case SKIPPED -> skipped++;
        }
    }

    public void addError(String error) {
        if (error != null && !error.isBlank()) {
            errors.add(error.trim());
        }
    }

    public void enter(SourceState next) {
        this.state = next;
    }

    public void markFailure(FailureKind kind, String error) {
        this.failureKind = kind == null ? FailureKind.RUNTIME_ERROR : kind;
        addError(error);
    }

    public void setCursorBefore(Cursor cursor) {
        this.cursorBefore = cursor == null ? Cursor.empty() : cursor;
        this.cursorAfter = this.cursorBefore;
    }

    public void setCursorAfter(Cursor cursor) {
        this.cursorAfter = cursor == null ? Cursor.empty() : cursor;
    }
}
