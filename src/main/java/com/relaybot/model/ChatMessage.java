package com.relaybot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A message as seen by the relay engine. Text holds the message body or the media caption.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public class ChatMessage {
    long id;
    long chatId;
    Long topicId;
    Instant date;
    String text;
    MediaRef media;
    String chatTitle;

    public boolean hasText() {
        return text != null && !text.isBlank();
    }

    public boolean hasMedia() {
        return media != null && media.fileId() != null && !media.fileId().isBlank();
    }

    public boolean hasCopyableContent() {
        return hasText() || hasMedia();
    }
}
