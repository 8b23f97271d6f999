package com.relaybot.report;

import com.relaybot.model.RunSummary;
import com.relaybot.model.SourceStatistics;

/**
 * Receives run results for presentation. The engine itself never formats log lines for users.
 */
public interface RunReporter {

    default void runStarted(int sourceCount, boolean dryRun) {
    }

    void sourceFinished(SourceStatistics statistics);

    void runFinished(RunSummary summary);
}
