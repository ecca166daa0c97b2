package com.questrail.fasttest.observability;

import com.questrail.fasttest.api.ScenarioResults;
import com.questrail.fasttest.api.TestOutcome;
import com.questrail.fasttest.api.TestReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * ScenarioSummaryReport
 * -----------------------------------------------------------------------------
 * Renders the results of one scenario as a plain-text block.
 *
 * <h2>Layout</h2>
 * <pre>
 * UNIT TEST SUMMARY [Math] [0.120 ms] :
 *     PASSED: 3/5
 *     FAILED: 1/5
 *         [divides] [0.010 ms]
 *         Message: ...
 *     SKIPPED: 1/5
 * </pre>
 * Only non-empty buckets are shown. Failed and errored cases are always
 * listed with their message; passed and skipped cases are listed only in
 * verbose mode, skipped ones with their reason.
 *
 * <p>The report reads {@link ScenarioResults} only. It has no knowledge of how
 * the results were produced.</p>
 */
public final class ScenarioSummaryReport
{
    private static final Logger log = LoggerFactory.getLogger(ScenarioSummaryReport.class);

    private final ScenarioResults results;

    public ScenarioSummaryReport(ScenarioResults results) {
        this.results = Objects.requireNonNull(results, "results");
    }

    public String render(boolean verbose) {
        StringBuilder sb = new StringBuilder();
        sb.append("UNIT TEST SUMMARY [").append(results.scenario()).append("] [")
            .append(DurationFormat.millis(results.totalDuration())).append("] :");

        if (!results.hasRun()) {
            sb.append("\n\t").append(TestOutcome.NOT_RUN.displayName());
            return sb.toString();
        }

        int total = results.totalCount();
        appendBucket(sb, "PASSED", results.passedTests(), total, verbose, false);
        appendBucket(sb, "FAILED", results.failedTests(), total, true, true);
        appendBucket(sb, "SKIPPED", results.skippedTests(), total, verbose, true);
        appendBucket(sb, "ERRORS", results.erroredTests(), total, true, true);
        return sb.toString();
    }

    /**
     * Writes the report to the log: INFO when the scenario succeeded, WARN otherwise.
     */
    public void log(boolean verbose) {
        String report = render(verbose);
        if (results.isSuccessful()) {
            log.info("{}", report);
        } else {
            log.warn("{}", report);
        }
    }

    private static void appendBucket(StringBuilder sb, String title, List<TestReport> tests, int total,
                                     boolean listTests, boolean withMessage) {
        if (tests.isEmpty()) {
            return;
        }
        sb.append("\n\t").append(title).append(": ").append(tests.size()).append('/').append(total);
        if (!listTests) {
            return;
        }
        for (TestReport test : tests) {
            sb.append("\n\t\t[").append(test.label()).append("] [")
                .append(DurationFormat.millis(test.duration())).append(']');
            if (withMessage) {
                test.message().ifPresent(message ->
                    sb.append("\n\t\tMessage: ").append(message.replace("\n", "\n\t\t\t")));
            }
        }
    }
}
