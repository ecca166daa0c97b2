package com.questrail.fasttest.api;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of a test case, as handed to observers and returned by
 * the result query surface.
 */
public record TestReport(
    String label,
    TestOutcome outcome,
    Duration duration,
    Optional<String> message
) implements TestCaseView {

    public TestReport {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(duration, "duration");
        Objects.requireNonNull(message, "message");
        if (duration.isNegative()) {
            throw new IllegalArgumentException("duration must be non-negative");
        }
    }

    /**
     * Captures the current state of any view.
     */
    public static TestReport of(TestCaseView view) {
        Objects.requireNonNull(view, "view");
        if (view instanceof TestReport report) {
            return report;
        }
        return new TestReport(view.label(), view.outcome(), view.duration(), view.message());
    }
}
