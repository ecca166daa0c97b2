package com.questrail.fasttest.assertion;

/**
 * Expression over an integral value. Every integral primitive widens into it,
 * so {@code assertThat(2 + 2).isEqualTo(4)} compares numerically.
 */
public final class LongExpression extends AbstractValueExpression<LongExpression, Long>
{
    LongExpression(long actual) {
        super(actual);
    }

    public EmptyExpression isEqualTo(long expected) {
        return check(actual == expected, actual, expected, FailureKind.EXPECTED_EQUAL);
    }

    public EmptyExpression isNotEqualTo(long notExpected) {
        return check(actual != notExpected, actual, notExpected, FailureKind.EXPECTED_DIFFERENT);
    }
}
