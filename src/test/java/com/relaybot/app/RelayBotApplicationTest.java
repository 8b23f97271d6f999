package com.relaybot.app;

import com.relaybot.client.FakeChatClient;
import com.relaybot.config.YamlDocument;
import com.relaybot.model.ChatMessage;
import com.relaybot.model.DialogInfo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RelayBotApplicationTest {
    private static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");

    @TempDir
    Path workingDir;

    private final FakeChatClient client = new FakeChatClient();
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private final List<Boolean> consumeRequests = new ArrayList<>();

    @Test
    void runShouldRelayMatchesAndPersistCursor() throws Exception {
        writeRelayConfig();
        client.addMessage(message(43L, "Remote Java role")).addMessage(message(44L, "weather"));

        int exit = app().run(new String[]{"run", "--config", "relay.yaml"});

        assertEquals(0, exit, err.toString(StandardCharsets.UTF_8));
        assertEquals(List.of(43L), client.deliveredIds());
        assertTrue(client.closed);
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("event=run_summary"));
        assertEquals(44, storedCursorId());
        assertEquals(List.of(true), consumeRequests);
        assertEquals(List.of(Map.of(-200L, 44L)), client.releases);
    }

    @Test
    void dryRunShouldLeaveEverythingUntouched() throws Exception {
        writeRelayConfig();
        client.addMessage(message(43L, "java"));

        int exit = app().run(new String[]{"--config", "relay.yaml", "--dry-run"});

        assertEquals(0, exit);
        assertTrue(client.actions.isEmpty());
        assertEquals(42, storedCursorId());
        assertEquals(List.of(false), consumeRequests);
        assertTrue(client.releases.isEmpty());
    }

    @Test
    void missingConfigShouldExitWithOne() {
        int exit = app().run(new String[]{"--config", "absent.yaml"});

        assertEquals(1, exit);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("CONFIG ERROR"));
    }

    @Test
    void everySourceFailingShouldExitWithOne() throws Exception {
        writeRelayConfig();
        client.makeInaccessible(-200L);

        assertEquals(1, app().run(new String[]{"--config", "relay.yaml"}));
        assertEquals(List.of(Map.of(-200L, 42L)), client.releases);
    }

    @Test
    void usageErrorsShouldExitWithTwo() {
        assertEquals(2, app().run(new String[]{"--no-such-flag"}));
        assertEquals(2, app().run(new String[]{"--threads", "zero"}));
        assertEquals(2, app().run(new String[]{"--threads", "0"}));
        assertEquals(2, app().run(new String[]{"purge"}));
        assertEquals(2, app().run(new String[]{"run", "list-chats"}));
    }

    @Test
    void helpShouldExitWithZero() {
        assertEquals(0, app().run(new String[]{"--help"}));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("--dry-run"));
    }

    @Test
    void listChatsShouldPrintDialogs() {
        client.addDialog(new DialogInfo(-200L, "supergroup", "Jobs", false));

        int exit = app().run(new String[]{"list-chats"});

        assertEquals(0, exit);
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("CHAT\t-200\tsupergroup\tJobs"));
        assertEquals(List.of(false), consumeRequests);
    }

    private RelayBotApplication app() {
        return new RelayBotApplication(
                workingDir,
                (config, consumeUpdates) -> {
                    consumeRequests.add(consumeUpdates);
                    return client;
                },
                Clock.fixed(NOW, ZoneOffset.UTC),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8),
                false
        );
    }

    private void writeRelayConfig() throws Exception {
        Files.writeString(workingDir.resolve("relay.yaml"),
                "destination_chat_id: -1001\n"
                        + "sources:\n"
                        + "  - chat_id: -200\n"
                        + "    label: Jobs\n"
                        + "    keywords: [java]\n"
                        + "    cursor:\n"
                        + "      last_message_id: 42\n",
                StandardCharsets.UTF_8);
    }

    private Object storedCursorId() {
        Map<String, Object> document = YamlDocument.read(workingDir.resolve("relay.yaml"));
        Map<?, ?> source = (Map<?, ?>) ((List<?>) document.get("sources")).get(0);
        return ((Map<?, ?>) source.get("cursor")).get("last_message_id");
    }

    private static ChatMessage message(long id, String text) {
        return ChatMessage.builder().id(id).chatId(-200L).date(NOW.minusSeconds(600 - id)).text(text).build();
    }
}
