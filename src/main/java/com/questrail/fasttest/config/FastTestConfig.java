package com.questrail.fasttest.config;

import com.questrail.fasttest.time.MonotonicClock;
import com.questrail.fasttest.time.SystemMonotonicClock;

import java.util.Objects;

/**
 * Configuration of a test session.
 *
 * <ul>
 *   <li><b>clock</b> measures test durations</li>
 *   <li><b>logEachTest</b> attaches a logging observer to every scenario</li>
 *   <li><b>logSummary</b> logs the scenario summary after each run</li>
 *   <li><b>verboseSummary</b> lists passed and skipped cases in that summary</li>
 * </ul>
 */
public record FastTestConfig(
    MonotonicClock clock,
    boolean logEachTest,
    boolean logSummary,
    boolean verboseSummary
) {
    public FastTestConfig {
        Objects.requireNonNull(clock, "clock");
    }

    /**
     * System clock, per-test logging off, non-verbose summary logging on.
     */
    public static FastTestConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private boolean logEachTest = false;
        private boolean logSummary = true;
        private boolean verboseSummary = false;

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withTestLogging(boolean enabled) {
            this.logEachTest = enabled;
            return this;
        }

        public Builder withSummaryLogging(boolean enabled) {
            this.logSummary = enabled;
            return this;
        }

        public Builder withVerboseSummary(boolean verbose) {
            this.verboseSummary = verbose;
            return this;
        }

        public FastTestConfig build() {
            return new FastTestConfig(clock, logEachTest, logSummary, verboseSummary);
        }
    }
}
