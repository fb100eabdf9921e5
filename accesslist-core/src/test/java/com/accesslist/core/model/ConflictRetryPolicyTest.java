package com.accesslist.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ConflictRetryPolicyTest {

    @Test
    void defaultPolicy_shouldRetryQuickly() {
        ConflictRetryPolicy policy = ConflictRetryPolicy.defaultPolicy();

        assertEquals(3, policy.maxAttempts());
        assertEquals(Duration.ofMillis(10), policy.initialBackoff());
        assertEquals(Duration.ofMillis(200), policy.maxBackoff());
        assertEquals(2.0, policy.backoffMultiplier());
    }

    @Test
    void computeBackoff_shouldIncreaseExponentially() {
        ConflictRetryPolicy policy = new ConflictRetryPolicy(5, Duration.ofMillis(10), Duration.ofSeconds(1), 2.0, 0.0);

        assertEquals(Duration.ofMillis(10), policy.computeBackoff(1));
        assertEquals(Duration.ofMillis(20), policy.computeBackoff(2));
        assertEquals(Duration.ofMillis(40), policy.computeBackoff(3));
    }

    @Test
    void computeBackoff_shouldRespectMaxBackoff() {
        ConflictRetryPolicy policy = new ConflictRetryPolicy(10, Duration.ofMillis(10), Duration.ofMillis(50), 2.0, 0.0);

        // 10 * 2^4 = 160ms, capped at 50ms
        assertEquals(Duration.ofMillis(50), policy.computeBackoff(5));
    }

    @Test
    void computeBackoff_shouldStayWithinJitter() {
        ConflictRetryPolicy policy = new ConflictRetryPolicy(3, Duration.ofMillis(100), Duration.ofMillis(100), 2.0, 0.2);

        for (int i = 0; i < 100; i++) {
            long millis = policy.computeBackoff(1).toMillis();
            assertTrue(millis >= 80 && millis <= 120, "backoff out of range: " + millis);
        }
    }

    @Test
    void computeBackoff_shouldRejectAttemptZero() {
        assertThrows(IllegalArgumentException.class, () -> ConflictRetryPolicy.defaultPolicy().computeBackoff(0));
    }

    @Test
    void hasMoreAttempts_shouldRespectMaxAttempts() {
        ConflictRetryPolicy policy = ConflictRetryPolicy.defaultPolicy();

        assertTrue(policy.hasMoreAttempts(1));
        assertTrue(policy.hasMoreAttempts(2));
        assertFalse(policy.hasMoreAttempts(3));
        assertFalse(policy.hasMoreAttempts(4));
    }

    @Test
    void noRetry_shouldOnlyAllowOneAttempt() {
        ConflictRetryPolicy policy = ConflictRetryPolicy.noRetry();

        assertEquals(1, policy.maxAttempts());
        assertFalse(policy.hasMoreAttempts(1));
    }

    @Test
    void constructor_shouldRejectInvalidSettings() {
        assertThrows(IllegalArgumentException.class,
            () -> new ConflictRetryPolicy(0, Duration.ZERO, Duration.ZERO, 1.0, 0.0));
        assertThrows(IllegalArgumentException.class,
            () -> new ConflictRetryPolicy(3, Duration.ofMillis(100), Duration.ofMillis(10), 2.0, 0.0));
        assertThrows(IllegalArgumentException.class,
            () -> new ConflictRetryPolicy(3, Duration.ZERO, Duration.ZERO, 0.5, 0.0));
        assertThrows(IllegalArgumentException.class,
            () -> new ConflictRetryPolicy(3, Duration.ZERO, Duration.ZERO, 1.0, 1.5));
    }
}
