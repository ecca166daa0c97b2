package com.questrail.fasttest.assertion;

import com.questrail.fasttest.api.TestProcedure;

/**
 * Expression
 * -----------------------------------------------------------------------------
 * Common base of every assertion expression.
 *
 * <p>It only provides chaining: {@code andThat(...)} declares the next value to
 * check. Each link of a chain is an independent check; a link never sees the
 * value, description or location of the previous one.</p>
 *
 * <pre>
 *   assertThat(sum).isEqualTo(4)
 *       .andThat(name).isEqualTo("abc", true)
 *       .andThatCode(() -> parse("")).expectException(IllegalArgumentException.class);
 * </pre>
 */
public abstract class Expression
{
    Expression() {}

    public BooleanExpression andThat(boolean actual) {
        return Asserter.assertThat(actual);
    }

    public BooleanExpression andThat(Boolean actual) {
        return Asserter.assertThat(actual);
    }

    public ObjectExpression<Character> andThat(char actual) {
        return Asserter.assertThat(actual);
    }

    public LongExpression andThat(long actual) {
        return Asserter.assertThat(actual);
    }

    public DoubleExpression andThat(double actual) {
        return Asserter.assertThat(actual);
    }

    public StringExpression andThat(String actual) {
        return Asserter.assertThat(actual);
    }

    public <T> ObjectExpression<T> andThat(T actual) {
        return Asserter.assertThat(actual);
    }

    public ProcedureExpression andThatCode(TestProcedure procedure) {
        return Asserter.assertThatCode(procedure);
    }
}
