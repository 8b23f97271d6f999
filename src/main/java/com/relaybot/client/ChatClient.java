package com.relaybot.client;

import com.relaybot.model.ChatMessage;
import com.relaybot.model.DialogInfo;
import com.relaybot.model.TopicInfo;
import com.relaybot.model.Window;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Chat platform operations the relay engine depends on.
 */
public interface ChatClient extends AutoCloseable {

    List<DialogInfo> listDialogs() throws ChatClientException;

    /**
     * Topics of a forum chat, or empty when the chat has no topics or the platform cannot list them.
     */
    Optional<List<TopicInfo>> listTopics(long chatId) throws ChatClientException;

    /**
     * Streams the messages of {@code chatId} (restricted to {@code topicId} when non-null) that fall
     * inside {@code window}, oldest first. Each call starts a fresh stream. Stops early when the
     * visitor returns false.
     */
    void fetchMessages(long chatId, Long topicId, Window window, MessageVisitor visitor) throws ChatClientException;

    /**
     * @throws ForwardRestrictedException the source protects its content from forwarding
     * @throws TransientChatException network failure or rate limit, safe to retry
     */
    void forward(ChatMessage message, long destinationChatId) throws ChatClientException;

    /**
     * Re-sends the text, media and caption of {@code message} as a new message.
     */
    void copy(ChatMessage message, long destinationChatId) throws ChatClientException;

    void sendText(long destinationChatId, String text) throws ChatClientException;

    /**
     * Called once the cursors are stored. {@code handledThroughByChat} maps a chat to the highest
     * message id every source of that chat has moved past; the client may forget those messages.
     * Chats without an entry must stay available to later runs.
     */
    default void release(Map<Long, Long> handledThroughByChat) throws ChatClientException {
    }

    @Override
    void close();
}
