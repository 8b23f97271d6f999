package com.relaybot.client;

import java.time.Duration;

/**
 * Network failure, timeout, server error or rate limit. {@link #retryAfter()} carries the wait the
 * server asked for, or {@link Duration#ZERO}.
 */
public class TransientChatException extends ChatClientException {
    private final Duration retryAfter;

    public TransientChatException(String message) {
        this(message, Duration.ZERO, null);
    }

    public TransientChatException(String message, Duration retryAfter) {
        this(message, retryAfter, null);
    }

    public TransientChatException(String message, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.retryAfter = retryAfter == null || retryAfter.isNegative() ? Duration.ZERO : retryAfter;
    }

    public Duration retryAfter() {
        return retryAfter;
    }
}
