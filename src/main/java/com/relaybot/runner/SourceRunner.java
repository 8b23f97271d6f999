package com.relaybot.runner;

import com.relaybot.client.ChatAccessException;
import com.relaybot.client.ChatClient;
import com.relaybot.client.ChatClientException;
import com.relaybot.config.SourceConfig;
import com.relaybot.core.FailureKind;
import com.relaybot.match.KeywordMatcher;
import com.relaybot.model.ChatMessage;
import com.relaybot.model.Cursor;
import com.relaybot.model.DeliveryOutcome;
import com.relaybot.model.MatchResult;
import com.relaybot.model.SourceKey;
import com.relaybot.model.SourceState;
import com.relaybot.model.SourceStatistics;
import com.relaybot.model.Window;
import com.relaybot.state.CursorStore;
import com.relaybot.state.CursorStoreException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Drives one source through plan, scan, match, deliver and advance.
 *
 * <p>The cursor is written at most once per run, after scanning, with compare-and-write against the
 * value read while planning. It covers every message that was fully processed, matched or not. A
 * failed delivery is passed over under {@link FailurePolicy#SKIP_AND_LOG} and stops the scan under
 * {@link FailurePolicy#RETRY_NEXT_RUN}.
 */
public final class SourceRunner {
    private static final Logger LOG = LogManager.getLogger(SourceRunner.class);

    private final ChatClient client;
    private final CursorStore cursorStore;
    private final WindowPlanner planner;
    private final KeywordMatcher matcher;
    private final DeliveryEngine deliveryEngine;
    private final RelaySettings settings;
    private final Clock clock;

    /**
     * Wires one runner that is shared by all worker threads; it keeps no per-source state.
     */
    public SourceRunner(
            ChatClient client,
            CursorStore cursorStore,
            WindowPlanner planner,
            KeywordMatcher matcher,
            DeliveryEngine deliveryEngine,
            RelaySettings settings,
            Clock clock
    ) {
        this.client = Objects.requireNonNull(client, "client");
        this.cursorStore = Objects.requireNonNull(cursorStore, "cursorStore");
        this.planner = Objects.requireNonNull(planner, "planner");
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.deliveryEngine = Objects.requireNonNull(deliveryEngine, "deliveryEngine");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * Scans one source from its stored cursor, relays the matches and stores the new cursor.
     * Failures end up in the returned statistics; nothing is thrown.
     */
    public SourceStatistics run(SourceConfig source, RunControl control) {
        SourceKey key = source.key();
        SourceStatistics stats = new SourceStatistics(key, source.label());
        if (control.isCancelled()) {
            stats.markFailure(FailureKind.CANCELLED, "not started: " + control.cancelReason());
            stats.enter(SourceState.DONE);
            return stats;
        }

        try {
            transition(stats, SourceState.PLANNING);
            Optional<Cursor> stored = cursorStore.read(key);
            Cursor observed = stored.orElse(Cursor.empty());
            stats.setCursorBefore(observed);
            Window window = planner.plan(stored, clock.instant());
            LOG.debug("event=window_planned {} window={}", key, window);

            transition(stats, SourceState.SCANNING);
            Scan scan = new Scan(source, window, observed, stats, control);
            client.fetchMessages(source.chatId(), source.topicId(), window, scan::visit);
            if (scan.cancelled) {
                stats.markFailure(FailureKind.CANCELLED, "stopped early: " + control.cancelReason());
            }

            transition(stats, SourceState.ADVANCING);
            advance(stats, observed, scan.completed);
            transition(stats, SourceState.DONE);
        } catch (ChatAccessException e) {
            failSource(stats, FailureKind.SOURCE_FATAL, "chat unreachable: " + e.getMessage());
        } catch (ChatClientException e) {
            failSource(stats, FailureKind.SOURCE_FATAL, "fetch failed: " + e.getMessage());
        } catch (CursorStoreException e) {
            failSource(stats, FailureKind.CURSOR_WRITE_FAILED, "cursor store: " + e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("event=source_error {}", key, e);
            failSource(stats, FailureKind.RUNTIME_ERROR, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        return stats;
    }

    private void advance(SourceStatistics stats, Cursor observed, Cursor completed) throws CursorStoreException {
        if (deliveryEngine.dryRun()) {
            LOG.info("event=cursor_not_written {} reason=dry-run would_be={}", stats.key(), completed);
            return;
        }
        if (completed.equals(observed)) {
            return;
        }
        CursorStore.WriteResult result = cursorStore.compareAndWrite(stats.key(), observed, completed);
        if (result == CursorStore.WriteResult.CONFLICT) {
            stats.markFailure(FailureKind.CURSOR_CONFLICT, "cursor changed concurrently; not advanced");
            return;
        }
        stats.setCursorAfter(observed.mergeForward(completed));
    }

    /**
     * No cursor is written for a failed source; messages relayed before the failure are scanned again
     * next run.
     */
    private void failSource(SourceStatistics stats, FailureKind kind, String error) {
        LOG.warn("event=source_failed {} kind={} error={}", stats.key(), kind.label(), error);
        stats.markFailure(kind, error);
        stats.setCursorAfter(stats.cursorBefore());
        stats.enter(SourceState.SOURCE_FAILED);
    }

    private void transition(SourceStatistics stats, SourceState next) {
        LOG.trace("event=source_state {} from={} to={}", stats.key(), stats.state(), next);
        stats.enter(next);
    }

    private void sendHeader(SourceConfig source, ChatMessage firstMatch, SourceStatistics stats) {
        String title = source.label();
        if (title == null && firstMatch.getChatTitle() != null && !firstMatch.getChatTitle().isBlank()) {
            title = firstMatch.getChatTitle().trim();
        }
        if (title == null) {
            title = String.valueOf(source.chatId());
        }
        String header = "Source chat: " + title + (source.topicId() == null ? "" : " / topic " + source.topicId());
        try {
            client.sendText(settings.getDestinationChatId(), header);
        } catch (ChatClientException | RuntimeException e) {
            LOG.warn("event=source_header_error {} error={}", stats.key(), e.getMessage());
            stats.addError("source_header_error=" + e.getMessage());
        }
    }

    private final class Scan {
        private final SourceConfig source;
        private final Window window;
        private final SourceStatistics stats;
        private final RunControl control;
        private Cursor completed;
        private boolean headerSent;
        private boolean cancelled;

        private Scan(SourceConfig source, Window window, Cursor observed, SourceStatistics stats, RunControl control) {
            this.source = source;
            this.window = window;
            this.completed = observed;
            this.stats = stats;
            this.control = control;
        }

        private boolean visit(ChatMessage message) {
            if (control.isCancelled()) {
                cancelled = true;
                return false;
            }
            if (!inScope(message)) {
                return true;
            }
            stats.recordScanned();
            transition(stats, SourceState.MATCHING);
            MatchResult match = matcher.match(message.getText(), source.keywords());
            if (match.matched()) {
                stats.recordMatched();
                transition(stats, SourceState.DELIVERING);
                if (!headerSent && settings.isSourceHeaderEnabled() && !deliveryEngine.dryRun()) {
                    sendHeader(source, message, stats);
                    headerSent = true;
                }
                DeliveryOutcome outcome = deliveryEngine.deliver(message, settings.getDestinationChatId());
                stats.recordOutcome(outcome);
                LOG.debug("event=delivered {} message_id={} keyword={} outcome={}",
                        stats.key(), message.getId(), match.keyword(), outcome);
                if (outcome.status == DeliveryOutcome.Status.FAILED) {
                    LOG.error("event=delivery_failed {} message_id={} error={}", stats.key(), message.getId(), outcome.reason);
                    stats.addError("message_id=" + message.getId() + " error=" + outcome.reason);
                    if (settings.getFailurePolicy() == FailurePolicy.RETRY_NEXT_RUN) {
                        transition(stats, SourceState.SCANNING);
                        return false;
                    }
                }
            }
            completed = completed.advanceTo(message);
            transition(stats, SourceState.SCANNING);
            return true;
        }

        private boolean inScope(ChatMessage message) {
            if (message == null || message.getChatId() != source.chatId()) {
                return false;
            }
            if (source.topicId() != null && !source.topicId().equals(message.getTopicId())) {
                return false;
            }
            return window.admits(message);
        }
    }
}
