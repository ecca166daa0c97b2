package com.questrail.fasttest.assertion;

import com.questrail.fasttest.api.TestProcedure;

import java.util.Objects;

/**
 * Expression over a deferred procedure, used to check what it throws.
 */
public final class ProcedureExpression extends Expression
{
    private final TestProcedure procedure;

    private String description = "";
    private LineInfo lineInfo;

    ProcedureExpression(TestProcedure procedure) {
        this.procedure = Objects.requireNonNull(procedure, "procedure");
    }

    public ProcedureExpression as(String description) {
        this.description = Objects.requireNonNull(description, "description");
        return this;
    }

    public ProcedureExpression at(LineInfo lineInfo) {
        this.lineInfo = Objects.requireNonNull(lineInfo, "lineInfo");
        return this;
    }

    /**
     * Runs the procedure and passes iff it throws an instance of {@code expectedType}
     * (subtypes included, as with a {@code catch} clause). Throwing anything else,
     * or returning normally, fails. An unexpected throwable is kept as the
     * failure's cause. An {@link InterruptedException} restores the thread's
     * interrupt status either way.
     */
    public <E extends Throwable> EmptyExpression expectException(Class<E> expectedType) {
        Objects.requireNonNull(expectedType, "expectedType");
        try {
            procedure.run();
        } catch (Throwable thrown) {
            if (thrown instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            if (expectedType.isInstance(thrown)) {
                return EmptyExpression.INSTANCE;
            }
            throw TestFailure.missingException(description, lineInfo, expectedType, thrown);
        }
        throw TestFailure.missingException(description, lineInfo, expectedType, null);
    }
}
