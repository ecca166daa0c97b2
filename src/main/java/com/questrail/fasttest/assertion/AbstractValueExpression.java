package com.questrail.fasttest.assertion;

import java.util.Objects;

/**
 * AbstractValueExpression
 * -----------------------------------------------------------------------------
 * Checks that apply to a captured value of any type.
 *
 * <h2>Description and location</h2>
 * {@link #as(String)} and {@link #at(LineInfo)} configure the message and the
 * source-location tag of the failure raised by the next check on this
 * expression. Both are optional.
 *
 * <h2>Result of a check</h2>
 * A check that holds returns the neutral {@link EmptyExpression}; a check that
 * does not hold throws {@link TestFailure}. Nothing is logged and no other
 * state is touched.
 *
 * @param <SELF> concrete expression type, returned by the fluent configurers
 * @param <T>    type of the captured value
 */
public abstract class AbstractValueExpression<SELF extends AbstractValueExpression<SELF, T>, T> extends Expression
{
    protected final T actual;

    private String description = "";
    private LineInfo lineInfo;

    AbstractValueExpression(T actual) {
        this.actual = actual;
    }

    @SuppressWarnings("unchecked")
    private SELF self() {
        return (SELF) this;
    }

    /**
     * Message prefixed to the failure raised by this expression.
     */
    public SELF as(String description) {
        this.description = Objects.requireNonNull(description, "description");
        return self();
    }

    /**
     * Source location reported by the failure raised by this expression.
     */
    public SELF at(LineInfo lineInfo) {
        this.lineInfo = Objects.requireNonNull(lineInfo, "lineInfo");
        return self();
    }

    public T actual() {
        return actual;
    }

    /**
     * Value equality, as defined by {@link Objects#equals(Object, Object)}.
     */
    public EmptyExpression isEqualTo(T expected) {
        return check(Objects.equals(actual, expected), actual, expected, FailureKind.EXPECTED_EQUAL);
    }

    public EmptyExpression isNotEqualTo(T notExpected) {
        return check(!Objects.equals(actual, notExpected), actual, notExpected, FailureKind.EXPECTED_DIFFERENT);
    }

    /**
     * Reference identity.
     */
    public EmptyExpression isSameAs(Object expected) {
        return check(actual == expected, actual, expected, FailureKind.EXPECTED_EQUAL);
    }

    public EmptyExpression isNotSameAs(Object notExpected) {
        return check(actual != notExpected, actual, notExpected, FailureKind.EXPECTED_DIFFERENT);
    }

    public EmptyExpression isNull() {
        return check(actual == null, actual, null, FailureKind.EXPECTED_EQUAL);
    }

    public EmptyExpression isNotNull() {
        return check(actual != null, actual, null, FailureKind.EXPECTED_DIFFERENT);
    }

    /**
     * Fails unconditionally, using the configured description and location.
     */
    public EmptyExpression fail() {
        throw TestFailure.forced(description, lineInfo);
    }

    protected final EmptyExpression check(boolean condition, Object reached, Object expected, FailureKind kind) {
        if (!condition) {
            throw TestFailure.comparison(description, lineInfo, kind, reached, expected);
        }
        return EmptyExpression.INSTANCE;
    }
}
