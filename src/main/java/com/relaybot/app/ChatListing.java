package com.relaybot.app;

import com.relaybot.client.ChatClient;
import com.relaybot.client.ChatClientException;
import com.relaybot.model.DialogInfo;
import com.relaybot.model.TopicInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Tab-separated listing of reachable chats and their topics, used to look up ids for the YAML file.
 */
final class ChatListing {

    private ChatListing() {
    }

    static List<String> render(ChatClient client) throws ChatClientException {
        List<String> lines = new ArrayList<>();
        for (DialogInfo dialog : client.listDialogs()) {
            lines.add("CHAT\t" + dialog.chatId() + "\t" + dialog.type() + "\t" + clean(dialog.title()));
            if (!dialog.forum()) {
                continue;
            }
            Optional<List<TopicInfo>> topics = client.listTopics(dialog.chatId());
            if (topics.isEmpty()) {
                continue;
            }
            for (TopicInfo topic : topics.get()) {
                if (topic.inferred()) {
                    lines.add("TOPIC_HINT\t" + topic.chatId() + "\t" + topic.topicId());
                } else {
                    lines.add("TOPIC\t" + topic.chatId() + "\t" + topic.topicId() + "\t" + clean(topic.title()));
                }
            }
        }
        return lines;
    }

    private static String clean(String value) {
        return value == null ? "" : value.replace('\t', ' ').replace('\n', ' ').trim();
    }
}
