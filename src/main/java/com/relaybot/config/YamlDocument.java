package com.relaybot.config;

import com.relaybot.core.AtomicFiles;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.representer.Representer;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads and atomically rewrites the YAML document that holds the destination, the sources and their
 * cursors.
 */
public final class YamlDocument {

    private YamlDocument() {
    }

    public static Map<String, Object> read(Path path) {
        if (path == null || !Files.exists(path)) {
            throw new ConfigException("Config file not found at " + path);
        }
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigException("Unable to read config file at " + path, e);
        }
        if (content.isBlank()) {
            throw new ConfigException("Config file at " + path + " is empty");
        }
        Object data;
        try {
            data = newYaml().load(content);
        } catch (YAMLException e) {
            throw new ConfigException("Config file at " + path + " is not valid YAML", e);
        }
        if (!(data instanceof Map<?, ?> map)) {
            throw new ConfigException("Config root must be a YAML mapping");
        }
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            out.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return out;
    }

    /**
     * Replaces the document on disk; readers see either the old or the new document.
     */
    public static void writeAtomically(Path path, Map<String, Object> document) throws IOException {
        AtomicFiles.writeString(path, newYaml().dump(document));
    }

    /**
     * Integral YAML scalar as a long; booleans, floats and strings are rejected with null.
     */
    public static Long asLong(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big && big.bitLength() < 64) {
            return big.longValue();
        }
        return null;
    }

    private static Yaml newYaml() {
        LoaderOptions loaderOptions = new LoaderOptions();
        DumperOptions dumperOptions = new DumperOptions();
        dumperOptions.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        dumperOptions.setIndent(2);
        dumperOptions.setIndicatorIndent(0);
        return new Yaml(new SafeConstructor(loaderOptions), new Representer(dumperOptions), dumperOptions, loaderOptions);
    }
}
