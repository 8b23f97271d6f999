package com.relaybot.model;

import java.util.Locale;

/**
 * Kinds of attachments that can be re-sent by file id when a message has to be copied.
 */
public enum MediaKind {
    PHOTO("photo", "sendPhoto"),
    VIDEO("video", "sendVideo"),
    DOCUMENT("document", "sendDocument"),
    AUDIO("audio", "sendAudio"),
    VOICE("voice", "sendVoice"),
    ANIMATION("animation", "sendAnimation");

    private final String field;
    private final String sendMethod;

    MediaKind(String field, String sendMethod) {
        this.field = field;
        this.sendMethod = sendMethod;
    }

    public String field() {
        return field;
    }

    public String sendMethod() {
        return sendMethod;
    }

    public static MediaKind fromField(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return null;
        }
        String target = raw.trim().toLowerCase(Locale.ROOT);
        for (MediaKind kind : values()) {
            if (kind.field.equals(target)) {
                return kind;
            }
        }
        return null;
    }
}
