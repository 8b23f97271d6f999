package com.relaybot.runner;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryBackoffTest {

    @Test
    void delayShouldDoubleUpToMaximum() {
        RetryBackoff backoff = new RetryBackoff(100L, 500L, false, delay -> { });

        assertEquals(Duration.ofMillis(100), backoff.delayFor(1, null));
        assertEquals(Duration.ofMillis(200), backoff.delayFor(2, Duration.ZERO));
        assertEquals(Duration.ofMillis(400), backoff.delayFor(3, null));
        assertEquals(Duration.ofMillis(500), backoff.delayFor(4, null));
        assertEquals(Duration.ofMillis(500), backoff.delayFor(40, null));
    }

    @Test
    void serverRetryAfterShouldWinButStayCapped() {
        RetryBackoff backoff = new RetryBackoff(100L, 5000L, true, delay -> { });

        assertEquals(Duration.ofSeconds(3), backoff.delayFor(1, Duration.ofSeconds(3)));
        assertEquals(Duration.ofMillis(5000), backoff.delayFor(1, Duration.ofSeconds(60)));
    }

    @Test
    void jitterShouldAddAtMostAQuarter() {
        RetryBackoff backoff = new RetryBackoff(1000L, 30000L, true, delay -> { });

        for (int i = 0; i < 50; i++) {
            long millis = backoff.delayFor(2, null).toMillis();
            assertTrue(millis >= 2000L && millis <= 2500L, String.valueOf(millis));
        }
    }
}
