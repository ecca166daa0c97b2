package com.questrail.fasttest.assertion;

import com.questrail.fasttest.api.TestProcedure;

/**
 * Asserter
 * -----------------------------------------------------------------------------
 * Entry point of the assertion engine. Intended for static import inside test
 * procedures.
 *
 * <h2>Typed expressions</h2>
 * The overload picked for the captured value decides which checks are
 * available:
 * <ul>
 *   <li>{@code boolean} and {@link Boolean}: {@link BooleanExpression#isTrue()}, {@link BooleanExpression#isFalse()}</li>
 *   <li>{@code char}: equality on the boxed {@link Character}</li>
 *   <li>integral primitives: numeric {@link LongExpression#isEqualTo(long)}</li>
 *   <li>floating primitives: tolerance comparisons on {@link DoubleExpression}</li>
 *   <li>{@code String}: case-insensitive comparisons on {@link StringExpression}</li>
 *   <li>anything else: equality, identity and null checks on {@link ObjectExpression}</li>
 *   <li>procedures: {@link ProcedureExpression#expectException(Class)}</li>
 * </ul>
 * A bare {@code null} literal matches several overloads; cast it to the
 * intended type.
 */
public final class Asserter
{
    private Asserter() {}

    public static BooleanExpression assertThat(boolean actual) {
        return new BooleanExpression(actual);
    }

    public static BooleanExpression assertThat(Boolean actual) {
        return new BooleanExpression(actual);
    }

    /**
     * Characters keep their character form in failure messages instead of
     * widening to their code point.
     */
    public static ObjectExpression<Character> assertThat(char actual) {
        return new ObjectExpression<>(actual);
    }

    public static LongExpression assertThat(long actual) {
        return new LongExpression(actual);
    }

    public static DoubleExpression assertThat(double actual) {
        return new DoubleExpression(actual);
    }

    public static StringExpression assertThat(String actual) {
        return new StringExpression(actual);
    }

    public static <T> ObjectExpression<T> assertThat(T actual) {
        return new ObjectExpression<>(actual);
    }

    public static ProcedureExpression assertThatCode(TestProcedure procedure) {
        return new ProcedureExpression(procedure);
    }

    /**
     * Forces the enclosing test case to fail.
     */
    public static EmptyExpression fail(String message) {
        throw TestFailure.forced(message, null);
    }

    public static EmptyExpression fail(String message, LineInfo lineInfo) {
        throw TestFailure.forced(message, lineInfo);
    }
}
