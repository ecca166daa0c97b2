package com.questrail.fasttest.assertion;

/**
 * Expression over a boolean condition. A {@code null} {@link Boolean} is
 * neither true nor false.
 */
public final class BooleanExpression extends AbstractValueExpression<BooleanExpression, Boolean>
{
    BooleanExpression(Boolean actual) {
        super(actual);
    }

    public EmptyExpression isTrue() {
        return check(Boolean.TRUE.equals(actual), actual, Boolean.TRUE, FailureKind.EXPECTED_EQUAL);
    }

    public EmptyExpression isFalse() {
        return check(Boolean.FALSE.equals(actual), actual, Boolean.FALSE, FailureKind.EXPECTED_EQUAL);
    }
}
