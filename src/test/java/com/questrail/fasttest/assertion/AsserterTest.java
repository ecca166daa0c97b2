package com.questrail.fasttest.assertion;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static com.questrail.fasttest.assertion.Asserter.assertThat;
import static com.questrail.fasttest.assertion.Asserter.assertThatCode;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the assertion engine entry points and typed expressions.
 *
 * A check that holds must return the neutral expression; a check that does
 * not hold must throw {@link TestFailure} and nothing else.
 */
class AsserterTest
{
    record Point(int x, int y) {}

    // ---------- integral ----------

    @Test
    void integralLiteralsCompareNumerically() {
        assertSame(EmptyExpression.INSTANCE, assertThat(2 + 2).isEqualTo(4));

        TestFailure f = assertThrows(TestFailure.class, () -> assertThat(2 + 2).isEqualTo(5));
        assertEquals(FailureKind.EXPECTED_EQUAL, f.kind());
        assertTrue(f.hasValues());
        assertEquals(4L, f.reached());
        assertEquals(5L, f.expected());
    }

    @Test
    void integralNotEqualUsesDifferentClassification() {
        assertThat(3).isNotEqualTo(4);

        TestFailure f = assertThrows(TestFailure.class, () -> assertThat(3).isNotEqualTo(3));
        assertEquals(FailureKind.EXPECTED_DIFFERENT, f.kind());
    }

    // ---------- boolean ----------

    @Test
    void booleanConditions() {
        assertThat(1 < 2).isTrue();
        assertThat(1 > 2).isFalse();

        TestFailure notTrue = assertThrows(TestFailure.class, () -> assertThat(1 > 2).isTrue());
        assertEquals(Boolean.FALSE, notTrue.reached());
        assertEquals(Boolean.TRUE, notTrue.expected());

        assertThrows(TestFailure.class, () -> assertThat(1 < 2).isFalse());
    }

    // ---------- floating point ----------

    @Test
    void exactDoubleComparisonIsStrict() {
        assertThat(0.5 + 0.25).isEqualTo(0.75);
        assertThrows(TestFailure.class, () -> assertThat(0.1 + 0.2).isEqualTo(0.3));
        assertThrows(TestFailure.class, () -> assertThat(Double.NaN).isEqualTo(Double.NaN));
    }

    @Test
    void toleranceBandAcceptsCloseValues() {
        assertThat(0.1 + 0.2).isEqualTo(0.3, 1e-9);
        assertThat(1.0).isEqualTo(1.1, 0.1000001);
        assertThat(1.0).isEqualTo(1.0, 0.0);

        assertThrows(TestFailure.class, () -> assertThat(1.0).isEqualTo(1.2, 0.1));
    }

    @Test
    void toleranceBandForNotEqual() {
        assertThat(1.0).isNotEqualTo(1.5, 0.1);

        TestFailure f = assertThrows(TestFailure.class, () -> assertThat(1.0).isNotEqualTo(1.05, 0.1));
        assertEquals(FailureKind.EXPECTED_DIFFERENT, f.kind());
    }

    @Test
    void negativeToleranceIsAProgrammingError() {
        assertThrows(IllegalArgumentException.class, () -> assertThat(1.0).isEqualTo(1.0, -0.1));
        assertThrows(IllegalArgumentException.class, () -> assertThat(1.0).isNotEqualTo(2.0, -1.0));
        assertThrows(IllegalArgumentException.class, () -> assertThat(1.0).isEqualTo(1.0, Double.NaN));
    }

    // ---------- text ----------

    @Test
    void caseSensitivityIsOptIn() {
        assertThat("abc").isEqualTo("abc");
        assertThat("abc").isEqualTo("ABC", true);

        TestFailure f = assertThrows(TestFailure.class, () -> assertThat("abc").isEqualTo("ABC", false));
        // The failure reports the original values, not the folded ones.
        assertEquals("abc", f.reached());
        assertEquals("ABC", f.expected());
    }

    @Test
    void caseInsensitiveNotEqual() {
        assertThat("abc").isNotEqualTo("ABD", true);
        assertThat("abc").isNotEqualTo("ABC", false);
        assertThrows(TestFailure.class, () -> assertThat("abc").isNotEqualTo("ABC", true));
    }

    @Test
    void nullTextFailsInsteadOfThrowingNpe() {
        assertThrows(TestFailure.class, () -> assertThat((String) null).isEqualTo("a", true));
        assertThat((String) null).isEqualTo(null, true);
    }

    // ---------- objects ----------

    @Test
    void equalityUsesEquals() {
        assertThat(new Point(1, 2)).isEqualTo(new Point(1, 2));
        assertThat(new Point(1, 2)).isNotEqualTo(new Point(2, 1));
        assertThrows(TestFailure.class, () -> assertThat(new Point(1, 2)).isEqualTo(new Point(0, 0)));
    }

    @Test
    void identityIsDistinctFromEquality() {
        Point p = new Point(1, 2);
        Point twin = new Point(1, 2);

        assertThat(p).isSameAs(p);
        assertThat(p).isNotSameAs(twin);

        TestFailure same = assertThrows(TestFailure.class, () -> assertThat(p).isSameAs(twin));
        assertEquals(FailureKind.EXPECTED_EQUAL, same.kind());

        TestFailure notSame = assertThrows(TestFailure.class, () -> assertThat(p).isNotSameAs(p));
        assertEquals(FailureKind.EXPECTED_DIFFERENT, notSame.kind());
    }

    @Test
    void nullChecks() {
        assertThat((Object) null).isNull();
        assertThat(new Object()).isNotNull();

        TestFailure notNull = assertThrows(TestFailure.class, () -> assertThat(new Point(0, 0)).isNull());
        assertEquals(FailureKind.EXPECTED_EQUAL, notNull.kind());

        TestFailure isNull = assertThrows(TestFailure.class, () -> assertThat((Object) null).isNotNull());
        assertEquals(FailureKind.EXPECTED_DIFFERENT, isNull.kind());
    }

    // ---------- exceptions ----------

    @Test
    void expectExceptionPassesWhenTheTypeIsThrown() {
        assertThatCode(() -> { throw new ArithmeticException("div by zero"); })
            .expectException(ArithmeticException.class);

        // Subtypes match, as with a catch clause.
        assertThatCode(() -> { throw new ArithmeticException(); })
            .expectException(RuntimeException.class);
    }

    @Test
    void expectExceptionFailsWhenNothingIsThrown() {
        TestFailure f = assertThrows(TestFailure.class,
            () -> assertThatCode(() -> {}).expectException(IllegalStateException.class));

        assertEquals(FailureKind.EXPECTED_EXCEPTION, f.kind());
        assertEquals(IllegalStateException.class, f.expectedException().orElseThrow());
        assertNull(f.getCause());
    }

    @Test
    void expectExceptionFailsOnAnotherTypeAndKeepsItAsCause() {
        IllegalArgumentException other = new IllegalArgumentException("wrong");

        TestFailure f = assertThrows(TestFailure.class,
            () -> assertThatCode(() -> { throw other; }).expectException(IllegalStateException.class));

        assertEquals(FailureKind.EXPECTED_EXCEPTION, f.kind());
        assertSame(other, f.getCause());
    }

    @Test
    void expectExceptionAcceptsCheckedExceptions() {
        assertThatCode(() -> { throw new IOException("disk"); }).expectException(IOException.class);
    }

    @Test
    void expectedInterruptKeepsTheInterruptRequest() {
        try {
            assertThatCode(() -> {
                Thread.currentThread().interrupt();
                Thread.sleep(10_000);
            }).expectException(InterruptedException.class);

            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    // ---------- boxed and character values ----------

    @Test
    void boxedBooleansGetBooleanChecks() {
        Boolean flag = Boolean.TRUE;

        assertThat(flag).isTrue();
        assertThat(Boolean.FALSE).isFalse();
        assertThrows(TestFailure.class, () -> assertThat(flag).isFalse());
        // null is neither true nor false.
        assertThrows(TestFailure.class, () -> assertThat((Boolean) null).isTrue());
        assertThrows(TestFailure.class, () -> assertThat((Boolean) null).isFalse());
        assertThat(1).isEqualTo(1).andThat(flag).isTrue();
    }

    @Test
    void charactersAreReportedAsCharacters() {
        assertThat('a').isEqualTo('a');

        TestFailure f = assertThrows(TestFailure.class, () -> assertThat('a').isEqualTo('b'));
        assertEquals('a', f.reached());
        assertTrue(f.getMessage().contains("[REACHED] a\n[EXPECTED EQUAL TO] b"), f.getMessage());
    }

    // ---------- forced failure ----------

    @Test
    void failIsUnconditional() {
        TestFailure f = assertThrows(TestFailure.class, () -> Asserter.fail("not implemented"));
        assertEquals("not implemented", f.getMessage());
        assertFalse(f.hasValues());

        assertThrows(TestFailure.class, () -> assertThat(1).as("stop here").fail());
        assertThrows(TestFailure.class, () -> assertThat(true).isTrue().fail("after a passing check"));
    }

    // ---------- description, location, chaining ----------

    @Test
    void descriptionAndLocationAreReported() {
        TestFailure f = assertThrows(TestFailure.class, () -> assertThat(3)
            .as("sum")
            .at(LineInfo.of("MathTest.java", 42))
            .isEqualTo(4));

        assertEquals("sum", f.description());
        assertEquals(LineInfo.of("MathTest.java", 42), f.lineInfo().orElseThrow());
        assertTrue(f.getMessage().startsWith("sum\t(MathTest.java:42)"));
    }

    @Test
    void chainedChecksAreIndependent() {
        assertThat(1 + 1).isEqualTo(2)
            .andThat("abc").isEqualTo("ABC", true)
            .andThat(0.1 + 0.2).isEqualTo(0.3, 1e-9)
            .andThat(List.of(1)).isNotNull()
            .andThatCode(() -> { throw new IOException(); }).expectException(IOException.class);

        // The description of the first link does not leak into the second.
        TestFailure f = assertThrows(TestFailure.class, () -> assertThat(1).as("first").isEqualTo(1)
            .andThat(2).isEqualTo(3));
        assertEquals("", f.description());
        assertTrue(f.lineInfo().isEmpty());
    }

    @Test
    void checksDoNotMutateTheAssertedValue() {
        List<String> values = new ArrayList<>(List.of("a", "b"));

        assertThat(values).isEqualTo(List.of("a", "b"));
        assertThrows(TestFailure.class, () -> assertThat(values).isEqualTo(List.of("b", "a")));

        assertEquals(List.of("a", "b"), values);
    }
}
