package com.questrail.fasttest.core;

/**
 * Describes a throwable that escaped a test procedure.
 */
final class ErrorDescriptions
{
    /**
     * Used when a throwable cannot describe itself.
     */
    static final String UNKNOWN_ERROR = "Unknown error";

    private ErrorDescriptions() {}

    /**
     * Returns {@link Throwable#toString()} (type and message), or
     * {@link #UNKNOWN_ERROR} when that is blank or throws.
     */
    static String describe(Throwable raised)
    {
        if (raised == null) {
            return UNKNOWN_ERROR;
        }
        try {
            String description = raised.toString();
            return description == null || description.isBlank() ? UNKNOWN_ERROR : description;
        } catch (RuntimeException e) {
            return UNKNOWN_ERROR;
        }
    }
}
