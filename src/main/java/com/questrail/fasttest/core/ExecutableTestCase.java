package com.questrail.fasttest.core;

import com.questrail.fasttest.api.TestOutcome;
import com.questrail.fasttest.api.TestProcedure;
import com.questrail.fasttest.assertion.TestFailure;
import com.questrail.fasttest.time.MonotonicClock;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * A test case that runs its procedure.
 * <p>
 * Classification:
 * <ul>
 *   <li>returns normally: {@link TestOutcome#PASSED}</li>
 *   <li>throws {@link TestFailure}: {@link TestOutcome#FAILED}, message is the rendered failure</li>
 *   <li>throws anything else: {@link TestOutcome#ERRORED}, message describes the throwable</li>
 * </ul>
 * The duration covers the procedure call only. A procedure ending in
 * {@link InterruptedException} is errored and the thread's interrupt status
 * is restored.
 */
public final class ExecutableTestCase implements TestCase
{
    private final String label;
    private final TestProcedure procedure;

    private TestOutcome outcome = TestOutcome.NOT_RUN;
    private Duration duration = Duration.ZERO;
    private String message;

    ExecutableTestCase(String label, TestProcedure procedure) {
        this.label = label != null ? label : "";
        this.procedure = Objects.requireNonNull(procedure, "procedure");
    }

    @Override
    public void run(MonotonicClock clock) {
        Objects.requireNonNull(clock, "clock");
        if (outcome != TestOutcome.NOT_RUN) {
            throw new IllegalStateException("Test case '" + label + "' has already run");
        }

        Throwable raised = null;
        long start = clock.nowNanos();
        try {
            procedure.run();
        } catch (Throwable t) {
            raised = t;
        }
        duration = clock.elapsedSince(start);

        if (raised == null) {
            outcome = TestOutcome.PASSED;
        } else if (raised instanceof TestFailure failure) {
            outcome = TestOutcome.FAILED;
            message = failure.getMessage();
        } else {
            outcome = TestOutcome.ERRORED;
            message = ErrorDescriptions.describe(raised);
            if (raised instanceof InterruptedException) {
                // Classified, but the interrupt request belongs to the caller.
                Thread.currentThread().interrupt();
            }
        }
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
        return duration;
    }

    @Override
    public Optional<String> message() {
        return Optional.ofNullable(message).filter(m -> !m.isEmpty());
    }

    @Override
    public String toString() {
        return "ExecutableTestCase[" + label + ", " + outcome.displayName() + "]";
    }
}
