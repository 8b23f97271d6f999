package com.relaybot.client;

import com.relaybot.model.ChatMessage;

@FunctionalInterface
public interface MessageVisitor {

    /**
     * @return false to stop the stream
     */
    boolean visit(ChatMessage message);
}
