package com.relaybot.runner;

import com.relaybot.config.Config;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter: {@code min(base * 2^(attempt-1), max)} plus up to a quarter of
 * that. A server-supplied retry-after replaces the computed delay, capped at {@code max}.
 */
public final class RetryBackoff {

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration delay) throws InterruptedException;
    }

    public static final Sleeper THREAD_SLEEPER = delay -> Thread.sleep(Math.max(0L, delay.toMillis()));

    private final long baseMs;
    private final long maxMs;
    private final boolean jitter;
    private final Sleeper sleeper;

    public RetryBackoff(long baseMs, long maxMs, boolean jitter, Sleeper sleeper) {
        this.baseMs = Math.max(1L, baseMs);
        this.maxMs = Math.max(this.baseMs, maxMs);
        this.jitter = jitter;
        this.sleeper = sleeper == null ? THREAD_SLEEPER : sleeper;
    }

    public static RetryBackoff fromConfig(Config config) {
        return new RetryBackoff(
                config.getLong("delivery.backoff.base_ms", 1000L),
                config.getLong("delivery.backoff.max_ms", 30000L),
                true,
                THREAD_SLEEPER
        );
    }

    public Duration delayFor(int attempt, Duration retryAfter) {
        if (retryAfter != null && !retryAfter.isZero() && !retryAfter.isNegative()) {
            return Duration.ofMillis(Math.min(retryAfter.toMillis(), maxMs));
        }
        int exponent = Math.max(0, Math.min(attempt - 1, 30));
        long delay = Math.min(baseMs * (1L << exponent), maxMs);
        if (jitter && delay >= 4L) {
            delay += ThreadLocalRandom.current().nextLong(delay / 4 + 1);
        }
        return Duration.ofMillis(delay);
    }

    public void pause(int attempt, Duration retryAfter) throws InterruptedException {
        sleeper.sleep(delayFor(attempt, retryAfter));
    }
}
