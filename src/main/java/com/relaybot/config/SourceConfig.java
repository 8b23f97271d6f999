package com.relaybot.config;

import com.relaybot.model.SourceKey;

import java.util.List;

/**
 * One scan target. Keywords are kept in configured order.
 */
public record SourceConfig(long chatId, Long topicId, List<String> keywords, String label) {

    public SourceConfig {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        label = label == null || label.isBlank() ? null : label.trim();
    }

    public static SourceConfig of(long chatId, Long topicId, List<String> keywords) {
        return new SourceConfig(chatId, topicId, keywords, null);
    }

    public SourceKey key() {
        return SourceKey.of(chatId, topicId);
    }

    public String displayName() {
        return label != null ? label : key().toString();
    }
}
