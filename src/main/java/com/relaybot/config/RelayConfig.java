package com.relaybot.config;

import java.nio.file.Path;
import java.util.List;

public record RelayConfig(long destinationChatId, List<SourceConfig> sources, Path path) {

    public RelayConfig {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
