package com.relaybot.state;

import com.relaybot.config.SourceConfig;
import com.relaybot.model.Cursor;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-chat message id that every configured source of the chat has moved past, according to the
 * stored cursors.
 */
public final class CursorWatermarks {

    private CursorWatermarks() {
    }

    /**
     * A chat is left out when any of its sources has no stored message id yet, since that source may
     * still need every message of the chat.
     */
    public static Map<Long, Long> handledThrough(List<SourceConfig> sources, CursorStore store)
            throws CursorStoreException {
        Map<Long, Long> out = new LinkedHashMap<>();
        Set<Long> open = new HashSet<>();
        for (SourceConfig source : sources) {
            long chatId = source.chatId();
            Optional<Cursor> stored = store.read(source.key());
            Long id = stored.map(Cursor::lastMessageId).orElse(null);
            if (id == null) {
                open.add(chatId);
                continue;
            }
            out.merge(chatId, id, Math::min);
        }
        out.keySet().removeAll(open);
        return out;
    }
}
