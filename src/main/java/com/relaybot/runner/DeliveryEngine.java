package com.relaybot.runner;

import com.relaybot.client.ChatClient;
import com.relaybot.client.ChatClientException;
import com.relaybot.client.ForwardRestrictedException;
import com.relaybot.client.TransientChatException;
import com.relaybot.model.ChatMessage;
import com.relaybot.model.DeliveryOutcome;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;

/**
 * Relays one message into the destination: forward first, copy when forwarding is refused, retry the
 * delivery with backoff on transient failures. Never throws; every failure ends up as
 * {@link DeliveryOutcome.Status#FAILED}.
 */
public final class DeliveryEngine {
    private static final Logger LOG = LogManager.getLogger(DeliveryEngine.class);

    private final ChatClient client;
    private final RetryBackoff backoff;
    private final int maxAttempts;
    private final boolean dryRun;

    /**
     * @param maxAttempts attempts per message, counted across forward and copy
     * @param dryRun      when set, nothing is sent and every message comes back as skipped
     */
    public DeliveryEngine(ChatClient client, RetryBackoff backoff, int maxAttempts, boolean dryRun) {
        this.client = Objects.requireNonNull(client, "client");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.maxAttempts = Math.max(1, maxAttempts);
        this.dryRun = dryRun;
    }

    /**
     * Whether deliveries are only simulated.
     */
    public boolean dryRun() {
        return dryRun;
    }

    /**
     * Forwards {@code message}, falls back to a copy when the source forbids forwarding and retries
     * transient failures with backoff. Never throws; every failure is folded into the outcome.
     */
    public DeliveryOutcome deliver(ChatMessage message, long destinationChatId) {
        if (dryRun) {
            return DeliveryOutcome.skipped("dry-run");
        }
        boolean forwardRefused = false;
        String forwardReason = "";
        String lastTransient = "";
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Attempt transientFailure = null;
            if (!forwardRefused) {
                Attempt forward = forward(message, destinationChatId);
                if (forward.kind == AttemptKind.OK) {
                    return DeliveryOutcome.forwarded(attempt);
                }
                if (forward.kind == AttemptKind.TRANSIENT) {
                    transientFailure = forward;
                } else {
                    forwardRefused = true;
                    forwardReason = forward.reason;
                    if (forward.kind == AttemptKind.RESTRICTED) {
                        LOG.info("event=forward_restricted chat_id={} message_id={} action=copy",
                                message.getChatId(), message.getId());
                    } else {
                        LOG.warn("event=forward_failed chat_id={} message_id={} error={} action=copy",
                                message.getChatId(), message.getId(), forward.reason);
                    }
                }
            }

            if (forwardRefused) {
                if (!message.hasCopyableContent()) {
                    return DeliveryOutcome.failed("forward refused (" + forwardReason + "); no copyable content", attempt);
                }
                Attempt copy = copy(message, destinationChatId);
                if (copy.kind == AttemptKind.OK) {
                    return DeliveryOutcome.copied(attempt);
                }
                if (copy.kind != AttemptKind.TRANSIENT) {
                    return DeliveryOutcome.failed(
                            "copy failed: " + copy.reason + " (forward: " + forwardReason + ")", attempt);
                }
                transientFailure = copy;
            }

            lastTransient = transientFailure.reason;
            if (attempt < maxAttempts) {
                LOG.warn("event=delivery_retry chat_id={} message_id={} attempt={}/{} error={}",
                        message.getChatId(), message.getId(), attempt, maxAttempts, transientFailure.reason);
                try {
                    backoff.pause(attempt, transientFailure.retryAfter);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return DeliveryOutcome.failed("interrupted while waiting to retry: " + lastTransient, attempt);
                }
            }
        }
        return DeliveryOutcome.failed(
                "transient failure after " + maxAttempts + " attempts: " + lastTransient, maxAttempts);
    }

    private Attempt forward(ChatMessage message, long destinationChatId) {
        try {
            client.forward(message, destinationChatId);
            return Attempt.ok();
        } catch (ForwardRestrictedException e) {
            return new Attempt(AttemptKind.RESTRICTED, describe(e), Duration.ZERO);
        } catch (TransientChatException e) {
            return new Attempt(AttemptKind.TRANSIENT, describe(e), e.retryAfter());
        } catch (ChatClientException | RuntimeException e) {
            return new Attempt(AttemptKind.REFUSED, describe(e), Duration.ZERO);
        }
    }

    private Attempt copy(ChatMessage message, long destinationChatId) {
        try {
            client.copy(message, destinationChatId);
            return Attempt.ok();
        } catch (TransientChatException e) {
            return new Attempt(AttemptKind.TRANSIENT, describe(e), e.retryAfter());
        } catch (ChatClientException | RuntimeException e) {
            return new Attempt(AttemptKind.REFUSED, describe(e), Duration.ZERO);
        }
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message.trim();
    }

    private enum AttemptKind {
        OK,
        RESTRICTED,
        REFUSED,
        TRANSIENT
    }

    private static final class Attempt {
        private static final Attempt OK = new Attempt(AttemptKind.OK, "", Duration.ZERO);

        private final AttemptKind kind;
        private final String reason;
        private final Duration retryAfter;

        private Attempt(AttemptKind kind, String reason, Duration retryAfter) {
            this.kind = kind;
            this.reason = reason;
            this.retryAfter = retryAfter;
        }

        private static Attempt ok() {
            return OK;
        }
    }
}
