package com.questrail.fasttest.observability;

import com.questrail.fasttest.api.TestOutcome;
import com.questrail.fasttest.api.TestReport;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class Slf4jTestObserverTest
{
    @Test
    void logsEveryOutcomeWithoutThrowing() {
        Slf4jTestObserver observer = new Slf4jTestObserver();

        for (TestOutcome outcome : TestOutcome.values()) {
            TestReport report = new TestReport("case", outcome, Duration.ofNanos(1_500_000), Optional.of("details"));
            assertDoesNotThrow(() -> observer.update(report));
        }
    }

    @Test
    void formatsDurationsInMilliseconds() {
        assertEquals("1.500 ms", DurationFormat.millis(Duration.ofNanos(1_500_000)));
        assertEquals("0.000 ms", DurationFormat.millis(Duration.ZERO));
        assertEquals("2000.000 ms", DurationFormat.millis(Duration.ofSeconds(2)));
    }
}
