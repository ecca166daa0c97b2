package com.questrail.fasttest.assertion;

import java.util.Locale;
import java.util.Objects;

/**
 * Expression over text, adding case-insensitive comparison.
 * <p>
 * When {@code ignoreCase} is set, both sides go through the same
 * {@link Locale#ROOT} lower-casing before comparing. The failure still reports
 * the original, unfolded values.
 */
public final class StringExpression extends AbstractValueExpression<StringExpression, String>
{
    StringExpression(String actual) {
        super(actual);
    }

    public EmptyExpression isEqualTo(String expected, boolean ignoreCase) {
        boolean equal = Objects.equals(fold(actual, ignoreCase), fold(expected, ignoreCase));
        return check(equal, actual, expected, FailureKind.EXPECTED_EQUAL);
    }

    public EmptyExpression isNotEqualTo(String notExpected, boolean ignoreCase) {
        boolean equal = Objects.equals(fold(actual, ignoreCase), fold(notExpected, ignoreCase));
        return check(!equal, actual, notExpected, FailureKind.EXPECTED_DIFFERENT);
    }

    private static String fold(String s, boolean ignoreCase) {
        return ignoreCase && s != null ? s.toLowerCase(Locale.ROOT) : s;
    }
}
