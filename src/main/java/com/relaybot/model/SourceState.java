package com.relaybot.model;

public enum SourceState {
    PLANNING,
    SCANNING,
    MATCHING,
    DELIVERING,
    ADVANCING,
    DONE,
    SOURCE_FAILED;

    public boolean terminal() {
        return this == DONE || this == SOURCE_FAILED;
    }
}
