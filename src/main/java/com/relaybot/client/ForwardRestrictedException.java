package com.relaybot.client;

public class ForwardRestrictedException extends ChatClientException {

    public ForwardRestrictedException(String message) {
        super(message);
    }
}
