package com.relaybot.config;

/**
 * Invalid or unreadable configuration. Raised before any source runs and aborts the invocation.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
