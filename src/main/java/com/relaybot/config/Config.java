package com.relaybot.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Engine tuning: classpath {@code relaybot.properties}, overridden by a {@code relaybot.properties}
 * in the working directory, falling back to built-in defaults.
 */
public final class Config {

    public static final String FILE_NAME = "relaybot.properties";

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream(FILE_NAME)) {
            if (in != null) {
                config.props.load(in);
            }
        } catch (IOException e) {
            throw new ConfigException("Unable to read classpath " + FILE_NAME, e);
        }

        Path local = workingDir.resolve(FILE_NAME);
        if (Files.exists(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                config.props.load(in);
            } catch (IOException e) {
                throw new ConfigException("Unable to read " + local, e);
            }
        }

        return config;
    }

    /**
     * Build Config from nested maps, e.g. {@code Map.of("delivery", Map.of("max_attempts", 3))}.
     */
    public static Config fromProperties(Path workingDir, Map<String, ?> rawProperties) {
        Config config = new Config(workingDir);
        flattenInto(config, "", rawProperties);
        return config;
    }

    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    public boolean getBoolean(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return false;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value);
    }

    public boolean getBoolean(String key, boolean fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return getBoolean(key);
    }

    public int getInt(String key) {
        return getInt(key, parseInt(DEFAULTS.get(key), 0));
    }

    public int getInt(String key, int fallback) {
        return parseInt(getString(key), fallback);
    }

    public long getLong(String key, long fallback) {
        String value = getString(key);
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    public Path getPath(String key) {
        return resolvePath(workingDir, getString(key));
    }

    /**
     * Resolves against the working directory; a leading {@code ~/} resolves against the user home.
     */
    public static Path resolvePath(Path workingDir, String value) {
        String raw = value == null ? "" : value.trim();
        if (raw.isEmpty()) {
            return workingDir;
        }
        if (raw.equals("~") || raw.startsWith("~/")) {
            Path home = Path.of(System.getProperty("user.home"));
            return raw.length() <= 2 ? home : home.resolve(raw.substring(2)).normalize();
        }
        return workingDir.resolve(raw).normalize();
    }

    public String requireString(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            throw new ConfigException("missing required config: " + key);
        }
        return value;
    }

    private static void flattenInto(Config config, String prefix, Object value) {
        if (config == null || value == null) {
            return;
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = entry.getKey() == null ? "" : entry.getKey().toString().trim();
                if (key.isEmpty()) {
                    continue;
                }
                String fullKey = prefix.isEmpty() ? key : prefix + "." + key;
                flattenInto(config, fullKey, entry.getValue());
            }
            return;
        }
        if (value instanceof List<?> list) {
            List<String> parts = new ArrayList<>();
            for (Object item : list) {
                parts.add(item == null ? "" : String.valueOf(item));
            }
            putBoundValue(config, prefix, String.join(",", parts));
            return;
        }
        putBoundValue(config, prefix, String.valueOf(value));
    }

    private static void putBoundValue(Config config, String key, String value) {
        if (key == null || key.trim().isEmpty()) {
            return;
        }
        String normalizedKey = key.trim();
        String normalizedValue = value == null ? "" : value;
        config.props.setProperty(normalizedKey, normalizedValue);
    }

    private static int parseInt(String value, int fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("config.path", "~/.relaybot.yaml");

        defaults.put("run.threads", "1");
        defaults.put("run.deadline_seconds", "0");

        defaults.put("window.first_run_lookback_hours", "24");

        defaults.put("delivery.max_attempts", "5");
        defaults.put("delivery.backoff.base_ms", "1000");
        defaults.put("delivery.backoff.max_ms", "30000");
        defaults.put("delivery.on_failure", "SKIP_AND_LOG");

        defaults.put("relay.source_header.enabled", "true");

        defaults.put("telegram.api_base_url", "https://api.telegram.org");
        defaults.put("telegram.timeout_sec", "30");
        defaults.put("telegram.updates.page_size", "100");
        defaults.put("telegram.updates.max_pages", "50");
        defaults.put("telegram.fetch.max_attempts", "5");
        defaults.put("telegram.updates.journal_path", "~/.relaybot-updates.json");
        defaults.put("telegram.updates.journal_retention_hours", "168");

        return defaults;
    }
}
