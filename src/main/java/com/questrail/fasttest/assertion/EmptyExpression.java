package com.questrail.fasttest.assertion;

/**
 * The neutral "nothing asserted yet" state returned by every completed check.
 */
public final class EmptyExpression extends Expression
{
    static final EmptyExpression INSTANCE = new EmptyExpression();

    private EmptyExpression() {}

    /**
     * Forces the enclosing test case to fail.
     */
    public EmptyExpression fail(String message) {
        throw TestFailure.forced(message, null);
    }

    @Override
    public String toString() {
        return "EmptyExpression";
    }
}
