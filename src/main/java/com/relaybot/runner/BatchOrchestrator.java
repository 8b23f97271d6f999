package com.relaybot.runner;

import com.relaybot.config.ConfigException;
import com.relaybot.config.SourceConfig;
import com.relaybot.core.FailureKind;
import com.relaybot.model.RunSummary;
import com.relaybot.model.SourceKey;
import com.relaybot.model.SourceState;
import com.relaybot.model.SourceStatistics;
import com.relaybot.report.RunReporter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs every configured source on a fixed worker pool and aggregates the results. One source failing
 * never keeps the others from running.
 */
public final class BatchOrchestrator {
    private static final Logger LOG = LogManager.getLogger(BatchOrchestrator.class);

    private final SourceRunner sourceRunner;
    private final RunReporter reporter;
    private final int threads;
    private final boolean dryRun;
    private final Clock clock;

    public BatchOrchestrator(SourceRunner sourceRunner, RunReporter reporter, int threads, boolean dryRun, Clock clock) {
        this.sourceRunner = Objects.requireNonNull(sourceRunner, "sourceRunner");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.threads = Math.max(1, threads);
        this.dryRun = dryRun;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public RunSummary runAll(List<SourceConfig> sources, RunControl control) {
        List<SourceConfig> ordered = sources == null ? List.of() : List.copyOf(sources);
        rejectDuplicates(ordered);
        RunControl effective = control == null ? RunControl.unbounded() : control;

        Instant startedAt = clock.instant();
        reporter.runStarted(ordered.size(), dryRun);
        SourceStatistics[] results = new SourceStatistics[ordered.size()];
        if (!ordered.isEmpty()) {
            execute(ordered, effective, results);
        }

        RunSummary.RunSummaryBuilder summary = RunSummary.builder()
                .startedAt(startedAt)
                .dryRun(dryRun);
        for (int i = 0; i < results.length; i++) {
            SourceStatistics stats = results[i];
            if (stats == null) {
                stats = failed(ordered.get(i), FailureKind.CANCELLED, "no result: " + effective.cancelReason());
                reporter.sourceFinished(stats);
            }
            summary.source(stats);
        }
        RunSummary result = summary.finishedAt(clock.instant()).build();
        reporter.runFinished(result);
        return result;
    }

    private void execute(List<SourceConfig> sources, RunControl control, SourceStatistics[] results) {
        int total = sources.size();
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, total));
        CompletionService<IndexedResult> completion = new ExecutorCompletionService<>(pool);
        Map<Future<IndexedResult>, Integer> submitted = new IdentityHashMap<>();
        for (int i = 0; i < total; i++) {
            submitted.put(completion.submit(new SourceTask(i, sources.get(i), control)), i);
        }

        boolean interrupted = false;
        try {
            int received = 0;
            while (received < total) {
                Future<IndexedResult> future;
                try {
                    future = completion.take();
                } catch (InterruptedException e) {
                    interrupted = true;
                    control.cancel("interrupted");
                    continue;
                }
                received++;
                try {
                    IndexedResult result = future.get();
                    results[result.index] = result.statistics;
                    reporter.sourceFinished(result.statistics);
                } catch (ExecutionException e) {
                    // SourceTask catches runtime exceptions; only Errors land here.
                    int index = submitted.get(future);
                    LOG.error("event=source_task_error {}", sources.get(index).key(), e.getCause());
                    results[index] = failed(sources.get(index), FailureKind.RUNTIME_ERROR, String.valueOf(e.getCause()));
                    reporter.sourceFinished(results[index]);
                } catch (InterruptedException e) {
                    interrupted = true;
                    control.cancel("interrupted");
                }
            }
        } finally {
            pool.shutdown();
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static void rejectDuplicates(List<SourceConfig> sources) {
        Set<SourceKey> seen = new HashSet<>();
        for (SourceConfig source : sources) {
            if (!seen.add(source.key())) {
                throw new ConfigException("duplicate source: " + source.key());
            }
        }
    }

    private static SourceStatistics failed(SourceConfig source, FailureKind kind, String error) {
        SourceStatistics stats = new SourceStatistics(source.key(), source.label());
        stats.markFailure(kind, error);
        stats.enter(SourceState.SOURCE_FAILED);
        return stats;
    }

    private final class SourceTask implements Callable<IndexedResult> {
        private final int index;
        private final SourceConfig source;
        private final RunControl control;

        private SourceTask(int index, SourceConfig source, RunControl control) {
            this.index = index;
            this.source = source;
            this.control = control;
        }

        @Override
        public IndexedResult call() {
            String previousName = Thread.currentThread().getName();
            Thread.currentThread().setName("source-" + source.chatId());
            try {
                return new IndexedResult(index, sourceRunner.run(source, control));
            } catch (RuntimeException e) {
                LOG.error("event=source_error {}", source.key(), e);
                return new IndexedResult(index, failed(source, FailureKind.RUNTIME_ERROR,
                        e.getClass().getSimpleName() + ": " + e.getMessage()));
            } finally {
                Thread.currentThread().setName(previousName);
            }
        }
    }

    private static final class IndexedResult {
        private final int index;
        private final SourceStatistics statistics;

        private IndexedResult(int index, SourceStatistics statistics) {
            this.index = index;
            this.statistics = statistics;
        }
    }
}
