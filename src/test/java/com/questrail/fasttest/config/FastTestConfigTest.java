package com.questrail.fasttest.config;

import com.questrail.fasttest.time.ManualMonotonicClock;
import com.questrail.fasttest.time.SystemMonotonicClock;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FastTestConfigTest
{
    @Test
    void defaultsLogOnlyTheSummary() {
        FastTestConfig config = FastTestConfig.defaults();

        assertSame(SystemMonotonicClock.INSTANCE, config.clock());
        assertFalse(config.logEachTest());
        assertTrue(config.logSummary());
        assertFalse(config.verboseSummary());
    }

    @Test
    void builderOverridesEveryField() {
        ManualMonotonicClock clock = new ManualMonotonicClock();

        FastTestConfig config = FastTestConfig.builder()
            .withClock(clock)
            .withTestLogging(true)
            .withSummaryLogging(false)
            .withVerboseSummary(true)
            .build();

        assertSame(clock, config.clock());
        assertTrue(config.logEachTest());
        assertFalse(config.logSummary());
        assertTrue(config.verboseSummary());
    }

    @Test
    void clockIsRequired() {
        assertThrows(NullPointerException.class, () -> FastTestConfig.builder().withClock(null).build());
    }
}
