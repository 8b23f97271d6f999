package com.relaybot.config;

import com.relaybot.match.KeywordMatcher;
import com.relaybot.model.SourceKey;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads and validates the YAML document listing the destination chat and the sources. Cursors stored
 * in the same document are left to {@link com.relaybot.state.YamlCursorStore}.
 */
public final class RelayConfigLoader {
    private static final Logger LOG = LogManager.getLogger(RelayConfigLoader.class);

    public RelayConfig load(Path path) {
        Map<String, Object> raw = YamlDocument.read(path);
        warnOnPermissions(path);
        return parse(raw, path);
    }

    RelayConfig parse(Map<String, Object> raw, Path path) {
        long destination = requireLong(raw, "destination_chat_id", "config");
        Object sourcesRaw = raw.get("sources");
        if (!(sourcesRaw instanceof List<?> items)) {
            throw new ConfigException("Config requires a 'sources' list");
        }

        List<SourceConfig> sources = new ArrayList<>();
        Set<SourceKey> seen = new HashSet<>();
        for (int idx = 0; idx < items.size(); idx++) {
            String context = "source[" + idx + "]";
            if (!(items.get(idx) instanceof Map<?, ?> item)) {
                throw new ConfigException(context + " must be a mapping");
            }
            long chatId = requireLong(item, "chat_id", context);
            Long topicId = optionalLong(item.get("topic_id"), context + ".topic_id");
            List<String> keywords = parseKeywords(item.get("keywords"), context + ".keywords");
            String label = optionalString(item.get("label"), context + ".label");
            if (label == null) {
                label = optionalString(item.get("chat_name"), context + ".chat_name");
            }
            SourceConfig source = new SourceConfig(chatId, topicId, keywords, label);
            if (!seen.add(source.key())) {
                throw new ConfigException("Duplicate source configuration for " + source.key());
            }
            sources.add(source);
        }
        return new RelayConfig(destination, sources, path);
    }

    private static long requireLong(Map<?, ?> raw, String key, String context) {
        Long value = YamlDocument.asLong(raw.get(key));
        if (value == null) {
            throw new ConfigException(context + " requires integer '" + key + "'");
        }
        return value;
    }

    private static Long optionalLong(Object value, String context) {
        if (value == null) {
            return null;
        }
        Long parsed = YamlDocument.asLong(value);
        if (parsed == null) {
            throw new ConfigException(context + " must be an integer");
        }
        return parsed;
    }

    private static String optionalString(Object value, String context) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof String text)) {
            throw new ConfigException(context + " must be a string");
        }
        return text.isBlank() ? null : text.trim();
    }

    private static List<String> parseKeywords(Object raw, String context) {
        if (!(raw instanceof List<?> list)) {
            throw new ConfigException(context + " must be a list of strings");
        }
        List<String> values = new ArrayList<>();
        for (Object keyword : list) {
            if (!(keyword instanceof String text)) {
                throw new ConfigException(context + " entries must be strings");
            }
            values.add(text);
        }
        List<String> normalized = KeywordMatcher.normalizeKeywords(values);
        if (normalized.isEmpty()) {
            throw new ConfigException(context + " must contain at least one non-empty keyword");
        }
        return normalized;
    }

    private static void warnOnPermissions(Path path) {
        if (!FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            return;
        }
        Set<PosixFilePermission> perms;
        try {
            perms = Files.getPosixFilePermissions(path);
        } catch (IOException | UnsupportedOperationException e) {
            LOG.debug("Unable to read permissions of {}: {}", path, e.getMessage());
            return;
        }
        for (PosixFilePermission perm : perms) {
            if (perm.name().startsWith("GROUP_") || perm.name().startsWith("OTHERS_")) {
                LOG.warn("Config file permissions are broad; consider chmod 600 {}", path);
                return;
            }
        }
    }
}
