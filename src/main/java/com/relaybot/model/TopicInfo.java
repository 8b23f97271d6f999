package com.relaybot.model;

/**
 * A forum topic. {@code title} is null when the topic id was only inferred from message threads.
 */
public record TopicInfo(long chatId, long topicId, String title) {

    public boolean inferred() {
        return title == null;
    }
}
