package com.questrail.fasttest.assertion;

/**
 * DoubleExpression
 * -----------------------------------------------------------------------------
 * Expression over a floating-point value.
 *
 * <p>The single-argument comparisons are exact ({@code ==}, so {@code NaN} never
 * equals itself). The tolerance overloads accept {@code |actual - expected| <= tolerance}
 * as equal. A negative or {@code NaN} tolerance is a programming error and raises
 * {@link IllegalArgumentException}, which classifies the enclosing case as errored
 * rather than failed.</p>
 */
public final class DoubleExpression extends AbstractValueExpression<DoubleExpression, Double>
{
    DoubleExpression(double actual) {
        super(actual);
    }

    public EmptyExpression isEqualTo(double expected) {
        return check(actual == expected, actual, expected, FailureKind.EXPECTED_EQUAL);
    }

    public EmptyExpression isEqualTo(double expected, double tolerance) {
        requireValidTolerance(tolerance);
        return check(Math.abs(expected - actual) <= tolerance, actual, expected, FailureKind.EXPECTED_EQUAL);
    }

    public EmptyExpression isNotEqualTo(double notExpected) {
        return check(actual != notExpected, actual, notExpected, FailureKind.EXPECTED_DIFFERENT);
    }

    public EmptyExpression isNotEqualTo(double notExpected, double tolerance) {
        requireValidTolerance(tolerance);
        return check(Math.abs(notExpected - actual) > tolerance, actual, notExpected, FailureKind.EXPECTED_DIFFERENT);
    }

    private static void requireValidTolerance(double tolerance) {
        if (Double.isNaN(tolerance) || tolerance < 0.0) {
            throw new IllegalArgumentException("tolerance must be non-negative, was " + tolerance);
        }
    }
}
