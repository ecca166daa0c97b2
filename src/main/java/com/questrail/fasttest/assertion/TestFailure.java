package com.questrail.fasttest.assertion;

import java.util.Objects;
import java.util.Optional;

/**
 * TestFailure
 * -----------------------------------------------------------------------------
 * The structured signal raised when an assertion does not hold.
 *
 * <h2>Role</h2>
 * Raising a {@code TestFailure} is the only way the assertion engine reports a
 * failed check. The enclosing test case catches it and classifies the case as
 * {@code FAILED}; anything else escaping a procedure classifies it as
 * {@code ERRORED}.
 *
 * <h2>Rendered message</h2>
 * {@link #getMessage()} returns, one element per line:
 * <ul>
 *   <li>the user message, followed by {@code \t(location)} when a
 *       {@link LineInfo} was attached</li>
 *   <li>{@code [REACHED] ...} and {@code [EXPECTED EQUAL TO] ...} /
 *       {@code [EXPECTED DIFFERENT FROM] ...} when both values are displayable,
 *       generic "values differ" wording otherwise</li>
 *   <li>{@code [EXPECTED EXCEPTION] type} for exception expectations</li>
 * </ul>
 */
public final class TestFailure extends RuntimeException
{
    private final String description;
    private final transient LineInfo lineInfo;
    private final FailureKind kind;
    private final boolean hasValues;
    private final transient Object reached;
    private final transient Object expected;
    private final Class<? extends Throwable> expectedException;

    private TestFailure(String description,
                        LineInfo lineInfo,
                        FailureKind kind,
                        boolean hasValues,
                        Object reached,
                        Object expected,
                        Class<? extends Throwable> expectedException,
                        Throwable cause)
    {
        super(render(description, lineInfo, kind, hasValues, reached, expected, expectedException, cause), cause);
        this.description = description;
        this.lineInfo = lineInfo;
        this.kind = kind;
        this.hasValues = hasValues;
        this.reached = reached;
        this.expected = expected;
        this.expectedException = expectedException;
    }

    /**
     * A comparison between a reached and an expected value did not hold.
     */
    public static TestFailure comparison(String description, LineInfo lineInfo, FailureKind kind,
                                         Object reached, Object expected)
    {
        Objects.requireNonNull(kind, "kind");
        if (kind == FailureKind.EXPECTED_EXCEPTION) {
            throw new IllegalArgumentException("Use missingException() for exception expectations");
        }
        return new TestFailure(nonNull(description), lineInfo, kind, true, reached, expected, null, null);
    }

    /**
     * An unconditional failure with no values to compare.
     */
    public static TestFailure forced(String description, LineInfo lineInfo)
    {
        return new TestFailure(nonNull(description), lineInfo, FailureKind.EXPECTED_EQUAL,
            false, null, null, null, null);
    }

    /**
     * A procedure did not throw the expected exception type.
     *
     * @param thrown what the procedure threw instead, or {@code null} if it
     *               returned normally
     */
    public static TestFailure missingException(String description, LineInfo lineInfo,
                                               Class<? extends Throwable> expectedException,
                                               Throwable thrown)
    {
        Objects.requireNonNull(expectedException, "expectedException");
        return new TestFailure(nonNull(description), lineInfo, FailureKind.EXPECTED_EXCEPTION,
            false, null, null, expectedException, thrown);
    }

    /**
     * The message supplied by the test author; empty when none was given.
     */
    public String description() {
        return description;
    }

    public Optional<LineInfo> lineInfo() {
        return Optional.ofNullable(lineInfo);
    }

    public FailureKind kind() {
        return kind;
    }

    /**
     * Whether this failure carries a reached/expected pair.
     */
    public boolean hasValues() {
        return hasValues;
    }

    public Object reached() {
        return reached;
    }

    public Object expected() {
        return expected;
    }

    public Optional<Class<? extends Throwable>> expectedException() {
        return Optional.ofNullable(expectedException);
    }

    private static String nonNull(String description) {
        return description != null ? description : "";
    }

    private static String render(String description,
                                 LineInfo lineInfo,
                                 FailureKind kind,
                                 boolean hasValues,
                                 Object reached,
                                 Object expected,
                                 Class<? extends Throwable> expectedException,
                                 Throwable thrown)
    {
        StringBuilder sb = new StringBuilder(description);
        if (lineInfo != null) {
            sb.append("\t(").append(lineInfo).append(')');
        }

        if (kind == FailureKind.EXPECTED_EXCEPTION) {
            newLine(sb).append("[EXPECTED EXCEPTION] ").append(expectedException.getName());
            newLine(sb).append("[REACHED] ")
                .append(thrown != null ? thrown.getClass().getName() : "no exception");
            return sb.toString();
        }

        if (!hasValues) {
            return sb.toString();
        }

        if (ValueRenderer.isDisplayable(reached) && ValueRenderer.isDisplayable(expected)) {
            newLine(sb).append("[REACHED] ").append(ValueRenderer.render(reached));
            newLine(sb).append(kind == FailureKind.EXPECTED_EQUAL
                    ? "[EXPECTED EQUAL TO] "
                    : "[EXPECTED DIFFERENT FROM] ")
                .append(ValueRenderer.render(expected));
        } else {
            newLine(sb).append(kind == FailureKind.EXPECTED_EQUAL
                ? "[REACHED] is different from [EXPECTED]. Expected [EQUAL TO]"
                : "[REACHED] is equal to [EXPECTED]. Expected [DIFFERENT FROM]");
        }
        return sb.toString();
    }

    private static StringBuilder newLine(StringBuilder sb) {
        if (sb.length() > 0) {
            sb.append('\n');
        }
        return sb;
    }
}
