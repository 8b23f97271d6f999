package com.relaybot.runner;

import com.relaybot.config.ConfigException;

import java.util.Locale;

/**
 * What happens to the cursor when a matched message could not be delivered.
 */
public enum FailurePolicy {
    /** Log the failure and move the cursor past the message. */
    SKIP_AND_LOG,
    /** Stop the source at the failed message so the next run retries it. */
    RETRY_NEXT_RUN;

    public static FailurePolicy parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return SKIP_AND_LOG;
        }
        String value = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (FailurePolicy policy : values()) {
            if (policy.name().equals(value)) {
                return policy;
            }
        }
        throw new ConfigException("unknown delivery.on_failure policy: " + raw);
    }
}
