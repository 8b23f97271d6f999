package com.relaybot.model;

/**
 * Identity of a cursor: a chat plus an optional forum topic. A null topic means the whole chat.
 */
public record SourceKey(long chatId, Long topicId) {

    public static SourceKey of(long chatId, Long topicId) {
        return new SourceKey(chatId, topicId);
    }

    public boolean hasTopic() {
        return topicId != null;
    }

    @Override
    public String toString() {
        return "chat_id=" + chatId + " topic_id=" + (topicId == null ? "-" : topicId);
    }
}
