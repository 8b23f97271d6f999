package com.relaybot.state;

public class CursorStoreException extends Exception {

    public CursorStoreException(String message) {
        super(message);
    }

    public CursorStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
