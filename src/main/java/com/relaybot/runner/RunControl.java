package com.relaybot.runner;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Run-wide cancellation flag with an optional deadline. Runners poll it between messages; a delivery
 * that already started is never interrupted.
 */
public final class RunControl {
    private final Clock clock;
    private final Instant deadline;
    private final AtomicReference<String> cancelReason = new AtomicReference<>();

    private RunControl(Clock clock, Instant deadline) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.deadline = deadline;
    }

    public static RunControl unbounded() {
        return new RunControl(Clock.systemUTC(), null);
    }

    public static RunControl withDeadline(Clock clock, Duration budget) {
        Clock effective = clock == null ? Clock.systemUTC() : clock;
        if (budget == null || budget.isZero() || budget.isNegative()) {
            return new RunControl(effective, null);
        }
        return new RunControl(effective, effective.instant().plus(budget));
    }

    public void cancel(String reason) {
        cancelReason.compareAndSet(null, reason == null || reason.isBlank() ? "cancelled" : reason.trim());
    }

    public boolean isCancelled() {
        if (cancelReason.get() != null) {
            return true;
        }
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            cancel("deadline reached");
            return true;
        }
        return false;
    }

    public String cancelReason() {
        String reason = cancelReason.get();
        return reason == null ? "" : reason;
    }
}
