package com.questrail.fasttest.time;

/**
 * Default clock of a test session, reading {@link System#nanoTime()}.
 * <p>
 * Test durations are differences of two readings taken on the runner thread
 * around one procedure call, so only the monotonic guarantee of
 * {@code nanoTime()} matters; its origin is arbitrary.
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
