package com.questrail.fasttest.observability;

import java.time.Duration;
import java.util.Locale;

final class DurationFormat
{
    private DurationFormat() {}

    /**
     * Milliseconds with microsecond precision, e.g. {@code 12.345 ms}.
     */
    static String millis(Duration duration) {
        return String.format(Locale.ROOT, "%.3f ms", duration.toNanos() / 1_000_000.0);
    }
}
