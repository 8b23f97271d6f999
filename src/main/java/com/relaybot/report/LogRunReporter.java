package com.relaybot.report;

import com.relaybot.core.FailureKind;
import com.relaybot.model.Cursor;
import com.relaybot.model.RunSummary;
import com.relaybot.model.SourceStatistics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Writes run results as {@code event=... key=value} lines through Log4j.
 */
public final class LogRunReporter implements RunReporter {
    private static final Logger LOG = LogManager.getLogger(LogRunReporter.class);
    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    @Override
    public void runStarted(int sourceCount, boolean dryRun) {
        LOG.info("event=run_started sources={} dry_run={}", sourceCount, dryRun);
    }

    @Override
    public void sourceFinished(SourceStatistics statistics) {
        String line = formatSource(statistics);
        if (statistics.sourceFailed()) {
            LOG.error(line);
        } else if (statistics.failureKind() != FailureKind.NONE || statistics.failed() > 0) {
            LOG.warn(line);
        } else {
            LOG.info(line);
        }
    }

    @Override
    public void runFinished(RunSummary summary) {
        LOG.info(formatSummary(summary));
    }

    public static String formatSource(SourceStatistics s) {
        StringBuilder sb = new StringBuilder();
        sb.append("event=source_summary ").append(s.key());
        if (!s.label().isEmpty()) {
            sb.append(" label=\"").append(s.label()).append('"');
        }
        sb.append(" state=").append(s.state().name().toLowerCase(Locale.ROOT));
        sb.append(" scanned=").append(s.scanned());
        sb.append(" matched=").append(s.matched());
        sb.append(" forwarded=").append(s.forwarded());
        sb.append(" copied=").append(s.copied());
        sb.append(" failed=").append(s.failed());
        sb.append(" skipped=").append(s.skipped());
        sb.append(" cursor_before=").append(formatCursor(s.cursorBefore()));
        sb.append(" cursor_after=").append(formatCursor(s.cursorAfter()));
        if (s.failureKind() != FailureKind.NONE) {
            sb.append(" failure=").append(s.failureKind().label());
        }
        if (!s.errors().isEmpty()) {
            sb.append(" errors=").append(s.errors().size());
            sb.append(" last_error=\"").append(s.errors().get(s.errors().size() - 1)).append('"');
        }
        return sb.toString();
    }

    public static String formatSummary(RunSummary summary) {
        StringBuilder sb = new StringBuilder();
        sb.append("event=run_summary");
        sb.append(" dry_run=").append(summary.isDryRun());
        if (summary.getStartedAt() != null) {
            sb.append(" started_at=").append(ISO.format(summary.getStartedAt()));
        }
        sb.append(" elapsed_ms=").append(summary.elapsedMs());
        sb.append(" sources=").append(summary.getSources().size());
        sb.append(" failed_sources=").append(summary.failedSources());
        sb.append(" scanned=").append(summary.totalScanned());
        sb.append(" matched=").append(summary.totalMatched());
        sb.append(" forwarded=").append(summary.totalForwarded());
        sb.append(" copied=").append(summary.totalCopied());
        sb.append(" failed=").append(summary.totalFailed());
        sb.append(" skipped=").append(summary.totalSkipped());
        return sb.toString();
    }

    static String formatCursor(Cursor cursor) {
        if (cursor == null || cursor.isEmpty()) {
            return "-";
        }
        String id = cursor.lastMessageId() == null ? "-" : String.valueOf(cursor.lastMessageId());
        return cursor.lastTimestamp() == null ? id : id + "@" + ISO.format(cursor.lastTimestamp());
    }
}
