package com.questrail.fasttest.observability;

import com.questrail.fasttest.api.TestCaseView;
import com.questrail.fasttest.api.TestObserver;
import com.questrail.fasttest.api.TestOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Progress observer that logs every finished test case via SLF4J.
 * <p>
 * One INFO line per case; failed and errored cases add a WARN line with the
 * captured message.
 */
public final class Slf4jTestObserver implements TestObserver {
    private static final Logger log = LoggerFactory.getLogger(Slf4jTestObserver.class);

    @Override
    public void update(TestCaseView test) {
        boolean skipped = test.outcome() == TestOutcome.SKIPPED;
        log.info("{} [{}] [{}]: Status: {}",
            skipped ? "SKIPPING TEST" : "RUNNING TEST",
            test.label(),
            DurationFormat.millis(test.duration()),
            test.outcome().displayName());

        test.failureReason().ifPresent(reason ->
            log.warn("Test [{}] failed: {}", test.label(), reason));
        test.errorMessage().ifPresent(error ->
            log.warn("Test [{}] raised an error: {}", test.label(), error));
        test.skipReason().ifPresent(reason ->
            log.info("Test [{}] skipped: {}", test.label(), reason));
    }

    @Override
    public String toString() {
        return "Slf4jTestObserver";
    }
}
