package com.questrail.fasttest.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ErrorDescriptionsTest
{
    @Test
    void describesTypeAndMessage() {
        assertEquals("java.lang.IllegalArgumentException: bad input",
            ErrorDescriptions.describe(new IllegalArgumentException("bad input")));
        assertEquals("java.lang.NullPointerException",
            ErrorDescriptions.describe(new NullPointerException()));
    }

    @Test
    void fallsBackWhenNothingUsableIsAvailable() {
        Throwable blank = new RuntimeException() {
            @Override
            public String toString() {
                return "  ";
            }
        };

        assertEquals(ErrorDescriptions.UNKNOWN_ERROR, ErrorDescriptions.describe(blank));
        assertEquals(ErrorDescriptions.UNKNOWN_ERROR, ErrorDescriptions.describe(null));
    }
}
