package com.questrail.fasttest.core;

import com.questrail.fasttest.api.TestOutcome;
import com.questrail.fasttest.api.TestProcedure;
import com.questrail.fasttest.time.MonotonicClock;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * A test case registered as skipped.
 * <p>
 * The procedure is retained so that the declaration stays intact, but it is
 * never invoked. Running the case marks it {@link TestOutcome#SKIPPED} with a
 * zero duration; its message is the skip reason, when one was given.
 */
public final class SkippedTestCase implements TestCase
{
    private final String reason;
    private final String label;
    private final TestProcedure procedure;

    private TestOutcome outcome = TestOutcome.NOT_RUN;

    SkippedTestCase(String reason, String label, TestProcedure procedure) {
        this.reason = reason;
        this.label = label != null ? label : "";
        this.procedure = Objects.requireNonNull(procedure, "procedure");
    }

    @Override
    public void run(MonotonicClock clock) {
        if (outcome != TestOutcome.NOT_RUN) {
            throw new IllegalStateException("Test case '" + label + "' has already run");
        }
        outcome = TestOutcome.SKIPPED;
    }

    /**
     * The procedure that would have run. Exposed for tooling that lists
     * skipped declarations; the framework itself never calls it.
     */
    public TestProcedure procedure() {
        return procedure;
    }

    @Override
    public String label() {
        return label;
    }

    @Override
    public TestOutcome outcome() {
        return outcome;
    }

    @Override
    public Duration duration() {
        return Duration.ZERO;
    }

    @Override
    public Optional<String> message() {
        return outcome == TestOutcome.SKIPPED
            ? Optional.ofNullable(reason).filter(r -> !r.isEmpty())
            : Optional.empty();
    }

    @Override
    public String toString() {
        return "SkippedTestCase[" + label + ", " + outcome.displayName() + "]";
    }
}
