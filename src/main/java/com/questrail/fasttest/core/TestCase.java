package com.questrail.fasttest.core;

import com.questrail.fasttest.api.TestCaseView;
import com.questrail.fasttest.api.TestProcedure;
import com.questrail.fasttest.api.TestReport;
import com.questrail.fasttest.time.MonotonicClock;

/**
 * TestCase
 * -----------------------------------------------------------------------------
 * A named, deferred unit of test logic plus the outcome captured when it runs.
 *
 * <h2>Variants</h2>
 * Whether a case executes is decided when it is registered, not at run time:
 * <ul>
 *   <li>{@link ExecutableTestCase} invokes its procedure inside a failure
 *       boundary and classifies what happens</li>
 *   <li>{@link SkippedTestCase} never invokes its procedure</li>
 * </ul>
 * Both expose the same single operation, {@link #run(MonotonicClock)}.
 *
 * <h2>Single assignment</h2>
 * A case starts in {@code NOT_RUN}. {@link #run(MonotonicClock)} assigns the
 * outcome, duration and message exactly once; a second call raises
 * {@link IllegalStateException}. The scenario runner guarantees at most one
 * call per case.
 *
 * <h2>Failure boundary</h2>
 * {@code run} never throws on account of the procedure: every throwable is
 * classified into a terminal outcome before control returns to the caller.
 */
public sealed interface TestCase extends TestCaseView
        permits ExecutableTestCase, SkippedTestCase
{
    /**
     * Executes this case once and records its outcome.
     *
     * @param clock time source bracketing the procedure call
     * @throws IllegalStateException if the case has already run
     */
    void run(MonotonicClock clock);

    /**
     * Immutable copy of the current state, suitable for observers and reports.
     */
    default TestReport snapshot() {
        return TestReport.of(this);
    }

    static TestCase of(TestProcedure procedure) {
        return new ExecutableTestCase("", procedure);
    }

    static TestCase of(String label, TestProcedure procedure) {
        return new ExecutableTestCase(label, procedure);
    }

    static TestCase skipped(TestProcedure procedure) {
        return new SkippedTestCase(null, "", procedure);
    }

    static TestCase skipped(String label, TestProcedure procedure) {
        return new SkippedTestCase(null, label, procedure);
    }

    static TestCase skipped(String reason, String label, TestProcedure procedure) {
        return new SkippedTestCase(reason, label, procedure);
    }
}
