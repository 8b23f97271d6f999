package com.relaybot.client;

/**
 * The chat cannot be reached at all: unknown, not joined, or access revoked.
 */
public class ChatAccessException extends ChatClientException {

    public ChatAccessException(String message) {
        super(message);
    }

    public ChatAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
