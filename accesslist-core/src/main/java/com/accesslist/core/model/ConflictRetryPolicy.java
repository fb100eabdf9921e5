package com.accesslist.core.model;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded retry for operations that lose an optimistic concurrency race.
 *
 * Invariants:
 * - maxAttempts >= 1
 * - maxBackoff >= initialBackoff
 * - backoffMultiplier >= 1.0
 * - jitterFactor in [0.0, 1.0]
 */
public record ConflictRetryPolicy(
    int maxAttempts,
    Duration initialBackoff,
    Duration maxBackoff,
    double backoffMultiplier,
    double jitterFactor
) {
    public ConflictRetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be in [0.0, 1.0]");
        }
    }

    /**
     * Default policy: 3 attempts, backoff from 10ms doubling up to 200ms.
     */
    public static ConflictRetryPolicy defaultPolicy() {
        return new ConflictRetryPolicy(3, Duration.ofMillis(10), Duration.ofMillis(200), 2.0, 0.2);
    }

    /**
     * Single attempt, conflicts surface immediately.
     */
    public static ConflictRetryPolicy noRetry() {
        return new ConflictRetryPolicy(1, Duration.ZERO, Duration.ZERO, 1.0, 0.0);
    }

    /**
     * Backoff before the attempt following {@code attemptNumber}.
     *
     * @param attemptNumber 1-indexed number of the attempt that just failed
     */
    public Duration computeBackoff(int attemptNumber) {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("Attempt number must be >= 1");
        }

        double baseBackoffMs = initialBackoff.toMillis() * Math.pow(backoffMultiplier, attemptNumber - 1);
        double cappedBackoffMs = Math.min(baseBackoffMs, maxBackoff.toMillis());

        double jitterRange = cappedBackoffMs * jitterFactor;
        double jitteredBackoffMs = cappedBackoffMs - jitterRange
            + ThreadLocalRandom.current().nextDouble() * 2 * jitterRange;

        return Duration.ofMillis((long) jitteredBackoffMs);
    }

    public boolean hasMoreAttempts(int currentAttempt) {
        return currentAttempt < maxAttempts;
    }
}
