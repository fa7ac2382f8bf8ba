package com.skillq.internal;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.OffsetDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryBackoffTest {

    private final RetryBackoff backoff = new RetryBackoff(Duration.ofMinutes(1), Duration.ofMinutes(30));

    @Test
    void delayDoublesPerRetryUntilCapped() {
        assertEquals(Duration.ofMinutes(1), backoff.delayFor(0));
        assertEquals(Duration.ofMinutes(2), backoff.delayFor(1));
        assertEquals(Duration.ofMinutes(4), backoff.delayFor(2));
        assertEquals(Duration.ofMinutes(16), backoff.delayFor(4));
        assertEquals(Duration.ofMinutes(30), backoff.delayFor(5));
        assertEquals(Duration.ofMinutes(30), backoff.delayFor(1_000));
    }

    @Test
    void retryableFailureWithBudgetLeftIsRescheduled() {
        OffsetDateTime now = OffsetDateTime.parse("2024-03-01T10:00:00Z");

        RetryBackoff.RetryDecision decision = backoff.decide(1, 3, true, now);

        assertTrue(decision.retry());
        assertEquals(2, decision.nextRetryCount());
        assertEquals(now.plusMinutes(2), decision.retryAfter());
    }

    @Test
    void exhaustedOrPermanentFailureIsNotRetried() {
        OffsetDateTime now = OffsetDateTime.now();

        RetryBackoff.RetryDecision exhausted = backoff.decide(3, 3, true, now);
        assertFalse(exhausted.retry());
        assertEquals(3, exhausted.nextRetryCount());
        assertNull(exhausted.retryAfter());

        assertFalse(backoff.decide(0, 3, false, now).retry());
        assertFalse(backoff.decide(0, 0, true, now).retry());
    }

    @Test
    void shouldRejectInvalidDelays() {
        assertThrows(IllegalArgumentException.class, () -> new RetryBackoff(Duration.ZERO, Duration.ofMinutes(1)));
        assertThrows(IllegalArgumentException.class,
                () -> new RetryBackoff(Duration.ofMinutes(5), Duration.ofMinutes(1)));
    }
}
