package com.questrail.fasttest.assertion;

/**
 * Classification carried by every {@link TestFailure}.
 */
public enum FailureKind
{
    /** The reached value was expected to equal (or be) the expected value. */
    EXPECTED_EQUAL,

    /** The reached value was expected to differ from the expected value. */
    EXPECTED_DIFFERENT,

    /** A procedure was expected to throw a given exception type. */
    EXPECTED_EXCEPTION
}
