package com.questrail.fasttest.api;

import java.time.Duration;
import java.util.Optional;

/**
 * TestCaseView
 * -----------------------------------------------------------------------------
 * Read-only view of one test case and its captured outcome.
 *
 * <h2>Message semantics</h2>
 * A test case carries at most one descriptive string. What it means depends
 * on the outcome:
 * <ul>
 *   <li>{@link TestOutcome#FAILED}: the rendered assertion failure</li>
 *   <li>{@link TestOutcome#ERRORED}: the description of what was thrown</li>
 *   <li>{@link TestOutcome#SKIPPED}: the skip reason, if one was supplied</li>
 * </ul>
 * The outcome-specific accessors return empty whenever the outcome does not
 * match, so reporting code never has to interpret the raw message itself.
 *
 * <h2>Observers</h2>
 * Observers receive instances of this type. Implementations handed to
 * observers are immutable snapshots.
 */
public interface TestCaseView
{
    /**
     * Label of the test case. May be empty for anonymous cases; never {@code null}.
     */
    String label();

    TestOutcome outcome();

    /**
     * Wall-clock time spent inside the procedure. {@link Duration#ZERO} before
     * the run and for skipped cases.
     */
    Duration duration();

    /**
     * The raw outcome-dependent message, if any.
     */
    Optional<String> message();

    default Optional<String> failureReason() {
        return outcome() == TestOutcome.FAILED ? message() : Optional.empty();
    }

    default Optional<String> errorMessage() {
        return outcome() == TestOutcome.ERRORED ? message() : Optional.empty();
    }

    default Optional<String> skipReason() {
        return outcome() == TestOutcome.SKIPPED ? message() : Optional.empty();
    }
}
