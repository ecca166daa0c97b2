package com.questrail.fasttest.assertion;

import java.util.Arrays;

/**
 * Decides whether an asserted value has a meaningful textual form and
 * produces it.
 *
 * <p>A value is displayable when it is {@code null}, an array, or its text
 * differs from the {@code ClassName@hash} form printed by
 * {@link Object#toString()}. A value whose text is only that identity form,
 * or whose {@code toString()} throws, is not displayable, and failures fall
 * back to generic wording.</p>
 */
final class ValueRenderer
{
    private ValueRenderer() {}

    static boolean isDisplayable(Object value)
    {
        if (value == null || value.getClass().isArray()) {
            return true;
        }
        try {
            return !String.valueOf(value).equals(identityForm(value));
        } catch (RuntimeException e) {
            return false;
        }
    }

    /**
     * What {@link Object#toString()} prints for an instance that does not override it.
     */
    private static String identityForm(Object value) {
        return value.getClass().getName() + "@" + Integer.toHexString(value.hashCode());
    }

    static String render(Object value)
    {
        if (value == null) {
            return "null";
        }
        if (value.getClass().isArray()) {
            String wrapped = Arrays.deepToString(new Object[] { value });
            return wrapped.substring(1, wrapped.length() - 1);
        }
        try {
            return String.valueOf(value);
        } catch (RuntimeException e) {
            return "<unprintable " + value.getClass().getName() + ">";
        }
    }
}
