package com.questrail.fasttest.api;

/**
 * TestOutcome
 * -----------------------------------------------------------------------------
 * {@code TestOutcome} is the terminal classification of a single test case.
 *
 * <h2>Lifecycle</h2>
 * Every test case is created in {@link #NOT_RUN}. Executing it moves it to
 * exactly one of the four terminal outcomes, once:
 * <ul>
 *   <li>{@link #PASSED}   the procedure returned normally</li>
 *   <li>{@link #FAILED}   the procedure raised an assertion failure</li>
 *   <li>{@link #ERRORED}  the procedure raised anything else</li>
 *   <li>{@link #SKIPPED}  the case was declared skipped and never executed</li>
 * </ul>
 *
 * <h2>Failed vs Errored</h2>
 * The distinction between {@link #FAILED} and {@link #ERRORED} is the one
 * semantic classification the framework guarantees. A test that checks a
 * condition and finds it false has <b>failed</b>; a test that could not complete
 * its checks because something unexpected was thrown has <b>errored</b>.
 */
public enum TestOutcome
{
    /**
     * The procedure completed without raising anything.
     */
    PASSED("PASSED"),

    /**
     * An assertion inside the procedure did not hold.
     */
    FAILED("FAILED"),

    /**
     * The procedure raised something other than an assertion failure.
     */
    ERRORED("ERROR"),

    /**
     * The case was registered as skipped; its procedure was never invoked.
     */
    SKIPPED("SKIPPED"),

    /**
     * The scenario holding the case has not been run yet.
     * This is the only non-terminal value.
     */
    NOT_RUN("NOT RUN YET");

    private final String displayName;

    TestOutcome(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Text used by reports and log lines.
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Returns {@code true} for every value except {@link #NOT_RUN}.
     */
    public boolean isTerminal() {
        return this != NOT_RUN;
    }
}
