package com.relaybot.runner;

import com.relaybot.config.Config;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Per-invocation engine settings resolved from {@link Config}, the YAML document and the command line.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public class RelaySettings {
    long destinationChatId;
    @Builder.Default
    FailurePolicy failurePolicy = FailurePolicy.SKIP_AND_LOG;
    @Builder.Default
    boolean sourceHeaderEnabled = true;
    boolean dryRun;
    @Builder.Default
    int threads = 1;

    public static RelaySettings fromConfig(Config config, long destinationChatId) {
        return RelaySettings.builder()
                .destinationChatId(destinationChatId)
                .failurePolicy(FailurePolicy.parse(config.getString("delivery.on_failure")))
                .sourceHeaderEnabled(config.getBoolean("relay.source_header.enabled", true))
                .threads(Math.max(1, config.getInt("run.threads", 1)))
                .build();
    }
}
