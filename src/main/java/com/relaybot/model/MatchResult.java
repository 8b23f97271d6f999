package com.relaybot.model;

public record MatchResult(boolean matched, String keyword) {

    private static final MatchResult NO_MATCH = new MatchResult(false, null);

    public static MatchResult noMatch() {
        return NO_MATCH;
    }

    public static MatchResult matched(String keyword) {
        return new MatchResult(true, keyword);
    }
}
