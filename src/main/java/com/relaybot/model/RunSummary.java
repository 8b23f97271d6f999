package com.relaybot.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Aggregate of one batch run, sources listed in configured order.
 */
@Value
@Builder
public class RunSummary {
    Instant startedAt;
    Instant finishedAt;
    boolean dryRun;
    @Singular
    List<SourceStatistics> sources;

    public int totalScanned() {
        return sources.stream().mapToInt(SourceStatistics::scanned).sum();
    }

    public int totalMatched() {
        return sources.stream().mapToInt(SourceStatistics::matched).sum();
    }

    public int totalForwarded() {
        return sources.stream().mapToInt(SourceStatistics::forwarded).sum();
    }

    public int totalCopied() {
        return sources.stream().mapToInt(SourceStatistics::copied).sum();
    }

    public int totalFailed() {
        return sources.stream().mapToInt(SourceStatistics::failed).sum();
    }

    public int totalSkipped() {
        return sources.stream().mapToInt(SourceStatistics::skipped).sum();
    }

    public int failedSources() {
        return (int) sources.stream().filter(SourceStatistics::sourceFailed).count();
    }

    public boolean allSourcesFailed() {
        return !sources.isEmpty() && failedSources() == sources.size();
    }

    public long elapsedMs() {
        if (startedAt == null || finishedAt == null) {
            return 0L;
        }
        return Math.max(0L, Duration.between(startedAt, finishedAt).toMillis());
    }
}
