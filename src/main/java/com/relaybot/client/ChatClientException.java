package com.relaybot.client;

/**
 * A chat platform call failed. Subclasses narrow down whether the call may be retried, whether the
 * content is protected, or whether the whole chat is out of reach.
 */
public class ChatClientException extends Exception {

    public ChatClientException(String message) {
        super(message);
    }

    public ChatClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
