package com.questrail.fasttest.api;

import java.time.Duration;
import java.util.List;

/**
 * ScenarioResults
 * -----------------------------------------------------------------------------
 * Read-only query surface over the outcome of one scenario run.
 *
 * <h2>Visibility before the run</h2>
 * Until the scenario has completed its run, every count returns zero, every
 * list is empty and the total duration is {@link Duration#ZERO}, regardless of
 * how many test cases are registered. Callers never observe partial aggregates.
 *
 * <h2>Ordering</h2>
 * Every list is in execution order, which is registration order. Nothing is
 * sorted by label or duration.
 *
 * <h2>Partition</h2>
 * Once the run has completed, the four outcome buckets partition the
 * registered cases:
 * <pre>
 *   passedCount() + failedCount() + erroredCount() + skippedCount() == totalCount()
 * </pre>
 */
public interface ScenarioResults
{
    ScenarioId scenario();

    /**
     * Whether the scenario has completed a run.
     */
    boolean hasRun();

    /**
     * Sum of the durations of all executed cases.
     */
    Duration totalDuration();

    /**
     * Cases filed under the given terminal outcome.
     *
     * @throws IllegalArgumentException if {@code outcome} is {@link TestOutcome#NOT_RUN}
     */
    List<TestReport> testsWith(TestOutcome outcome);

    /**
     * Number of cases filed under the given terminal outcome.
     *
     * @throws IllegalArgumentException if {@code outcome} is {@link TestOutcome#NOT_RUN}
     */
    default int countOf(TestOutcome outcome) {
        return testsWith(outcome).size();
    }

    /**
     * All cases filed by the run, in execution order.
     */
    List<TestReport> allTests();

    default int totalCount() {
        return allTests().size();
    }

    default int passedCount() {
        return countOf(TestOutcome.PASSED);
    }

    default int failedCount() {
        return countOf(TestOutcome.FAILED);
    }

    default int erroredCount() {
        return countOf(TestOutcome.ERRORED);
    }

    default int skippedCount() {
        return countOf(TestOutcome.SKIPPED);
    }

    default List<TestReport> passedTests() {
        return testsWith(TestOutcome.PASSED);
    }

    default List<TestReport> failedTests() {
        return testsWith(TestOutcome.FAILED);
    }

    default List<TestReport> erroredTests() {
        return testsWith(TestOutcome.ERRORED);
    }

    default List<TestReport> skippedTests() {
        return testsWith(TestOutcome.SKIPPED);
    }

    /**
     * {@code true} when the scenario has run and nothing failed or errored.
     */
    default boolean isSuccessful() {
        return hasRun() && failedCount() == 0 && erroredCount() == 0;
    }
}
