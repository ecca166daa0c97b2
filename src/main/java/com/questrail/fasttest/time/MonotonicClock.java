package com.questrail.fasttest.time;

import java.time.Duration;

/**
 * MonotonicClock
 * =============================================================================
 * Time source used to measure how long a test procedure runs.
 *
 * <h2>Binding invariant</h2>
 * Test durations MUST be computed from a monotonic source. Wall-clock time
 * (e.g. {@code Instant.now()}) can jump under NTP or manual adjustment and
 * would produce negative or inflated durations.
 *
 * <p>
 * Implementations should be backed by {@link System#nanoTime()} in production
 * and by a manually advanced counter in tests.
 * </p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();

    /**
     * Elapsed time between a tick previously returned by {@link #nowNanos()}
     * and now. Never negative.
     */
    default Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(Math.max(0L, nowNanos() - startNanos));
    }
}
