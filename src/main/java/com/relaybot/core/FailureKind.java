package com.relaybot.core;

/**
 * Why a source did not finish cleanly. Delivery failures of single messages are counted in the
 * statistics and do not show up here.
 */
public enum FailureKind {
    NONE("none"),
    SOURCE_FATAL("source_fatal"),
    CURSOR_CONFLICT("cursor_conflict"),
    CURSOR_WRITE_FAILED("cursor_write_failed"),
    CANCELLED("cancelled"),
    RUNTIME_ERROR("runtime_error");

    private final String label;

    FailureKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
