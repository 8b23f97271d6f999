package com.relaybot.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void defaultsShouldApplyWhenNothingIsSet() {
        Config config = Config.fromProperties(tempDir, Map.of());

        assertEquals(5, config.getInt("delivery.max_attempts"));
        assertEquals("SKIP_AND_LOG", config.getString("delivery.on_failure"));
        assertTrue(config.getBoolean("relay.source_header.enabled"));
    }

    @Test
    void nestedMapsShouldFlattenToDottedKeys() {
        Config config = Config.fromProperties(tempDir, Map.of(
                "delivery", Map.of("max_attempts", 2, "backoff", Map.of("base_ms", 50)),
                "telegram", Map.of("allowed", List.of("a", "b"))
        ));

        assertEquals(2, config.getInt("delivery.max_attempts"));
        assertEquals(50L, config.getLong("delivery.backoff.base_ms", 0L));
        assertEquals("a,b", config.getString("telegram.allowed"));
    }

    @Test
    void workingDirectoryFileShouldOverrideClasspath() throws Exception {
        Files.writeString(tempDir.resolve(Config.FILE_NAME), "run.threads=4\nrelay.source_header.enabled=no\n", StandardCharsets.UTF_8);

        Config config = Config.load(tempDir);

        assertEquals(4, config.getInt("run.threads", 1));
        assertFalse(config.getBoolean("relay.source_header.enabled", true));
    }

    @Test
    void invalidNumbersShouldFallBack() {
        Config config = Config.fromProperties(tempDir, Map.of("run", Map.of("threads", "many")));

        assertEquals(3, config.getInt("run.threads", 3));
        assertEquals(9L, config.getLong("run.threads", 9L));
    }

    @Test
    void pathsShouldResolveAgainstWorkingDirAndHome() {
        Config config = Config.fromProperties(tempDir, Map.of("config", Map.of("path", "conf/relay.yaml")));

        assertEquals(tempDir.resolve("conf/relay.yaml"), config.getPath("config.path"));
        assertEquals(Path.of(System.getProperty("user.home")).resolve(".relaybot.yaml"),
                Config.resolvePath(tempDir, "~/.relaybot.yaml"));
    }

    @Test
    void requireStringShouldFailOnMissingKey() {
        Config config = Config.fromProperties(tempDir, Map.of());

        assertThrows(ConfigException.class, () -> config.requireString("telegram.bot_token"));
    }
}
