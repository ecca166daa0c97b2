package com.questrail.fasttest.runner;

import com.questrail.fasttest.api.ScenarioId;
import com.questrail.fasttest.api.ScenarioResults;
import com.questrail.fasttest.api.TestObserver;
import com.questrail.fasttest.api.TestOutcome;
import com.questrail.fasttest.api.TestReport;
import com.questrail.fasttest.core.TestCase;
import com.questrail.fasttest.registry.ScenarioRegistry;
import com.questrail.fasttest.time.MonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * ScenarioRunner
 * =============================================================================
 * Executes every test case of one scenario, in registration order, and
 * aggregates the outcomes.
 *
 * <h2>State machine</h2>
 * <pre>
 *   PENDING --run()--> COMPLETED
 * </pre>
 * {@code COMPLETED} is terminal. Asking a completed runner to run again is a
 * logged no-op; the aggregates keep describing the first run.
 *
 * <h2>Per-case sequence</h2>
 * For each case, strictly in this order:
 * <ol>
 *   <li>run the case (the case measures its own duration around the procedure)</li>
 *   <li>add its duration to the scenario total</li>
 *   <li>publish a snapshot to the attached observers</li>
 *   <li>file the case into the bucket of its outcome</li>
 * </ol>
 * A case that already carries a terminal outcome (run directly through
 * {@link TestCase#run(MonotonicClock)}) is not run again; it is filed, timed
 * and published with the outcome it already has.
 * Observer notification therefore never contributes to a test's duration.
 *
 * <h2>Visibility</h2>
 * Before {@code COMPLETED}, every count is zero and every list is empty,
 * whatever the registry holds.
 *
 * <h2>Errors</h2>
 * {@link #run()} never throws because of a test: each case classifies its own
 * failures, and a failing case never stops the remaining ones.
 *
 * <h2>Threading</h2>
 * Single-threaded and not reentrant. Cases run sequentially on the caller's
 * thread; a procedure that never returns blocks the runner.
 */
public final class ScenarioRunner implements ScenarioResults
{
    private static final Logger log = LoggerFactory.getLogger(ScenarioRunner.class);

    private static final List<TestOutcome> BUCKETS = List.of(
        TestOutcome.PASSED, TestOutcome.FAILED, TestOutcome.ERRORED, TestOutcome.SKIPPED);

    public enum RunState
    {
        PENDING,
        COMPLETED
    }

    private final ScenarioId scenario;
    private final ScenarioRegistry registry;
    private final MonotonicClock clock;
    private final ObserverChannel observers;

    private final Map<TestOutcome, List<TestCase>> buckets = new EnumMap<>(TestOutcome.class);
    private final List<TestCase> filed = new ArrayList<>();
    private RunState state = RunState.PENDING;
    private Duration totalDuration = Duration.ZERO;

    public ScenarioRunner(ScenarioId scenario, ScenarioRegistry registry, MonotonicClock clock) {
        this(scenario, registry, clock, new ObserverChannel());
    }

    public ScenarioRunner(ScenarioId scenario, ScenarioRegistry registry, MonotonicClock clock,
                          ObserverChannel observers) {
        this.scenario = Objects.requireNonNull(scenario, "scenario");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.observers = Objects.requireNonNull(observers, "observers");
        for (TestOutcome outcome : BUCKETS) {
            buckets.put(outcome, new ArrayList<>());
        }
    }

    public boolean attach(TestObserver observer) {
        return observers.attach(observer);
    }

    public boolean detach(TestObserver observer) {
        return observers.detach(observer);
    }

    public ObserverChannel observers() {
        return observers;
    }

    public RunState state() {
        return state;
    }

    /**
     * Runs every registered case of the scenario once.
     */
    public void run() {
        if (state == RunState.COMPLETED) {
            log.warn("Scenario '{}' has already run; ignoring repeated run request", scenario);
            return;
        }

        registry.seal(scenario);
        List<TestCase> tests = registry.testsOf(scenario);
        log.debug("Running scenario '{}' ({} tests)", scenario, tests.size());

        Duration total = Duration.ZERO;
        for (TestCase test : tests) {
            if (test.outcome() == TestOutcome.NOT_RUN) {
                test.run(clock);
            } else {
                log.warn("Test '{}' of scenario '{}' was already executed elsewhere; filing its {} outcome",
                    test.label(), scenario, test.outcome().displayName());
            }

            total = total.plus(test.duration());
            observers.publish(test);

            TestOutcome outcome = test.outcome();
            if (!outcome.isTerminal()) {
                log.error("Test '{}' of scenario '{}' reported {} after running; not filed",
                    test.label(), scenario, outcome.displayName());
                continue;
            }
            buckets.get(outcome).add(test);
            filed.add(test);
        }

        totalDuration = total;
        state = RunState.COMPLETED;

        log.info("Scenario '{}' completed in {} ms: {} passed, {} failed, {} errored, {} skipped",
            scenario,
            totalDuration.toMillis(),
            buckets.get(TestOutcome.PASSED).size(),
            buckets.get(TestOutcome.FAILED).size(),
            buckets.get(TestOutcome.ERRORED).size(),
            buckets.get(TestOutcome.SKIPPED).size());
    }

    @Override
    public ScenarioId scenario() {
        return scenario;
    }

    @Override
    public boolean hasRun() {
        return state == RunState.COMPLETED;
    }

    @Override
    public Duration totalDuration() {
        return hasRun() ? totalDuration : Duration.ZERO;
    }

    @Override
    public List<TestReport> testsWith(TestOutcome outcome) {
        Objects.requireNonNull(outcome, "outcome");
        if (!outcome.isTerminal()) {
            throw new IllegalArgumentException("No bucket for " + outcome);
        }
        if (!hasRun()) {
            return List.of();
        }
        return snapshots(buckets.get(outcome));
    }

    @Override
    public List<TestReport> allTests() {
        return hasRun() ? snapshots(filed) : List.of();
    }

    private static List<TestReport> snapshots(List<TestCase> tests) {
        return tests.stream()
            .map(TestCase::snapshot)
            .collect(Collectors.collectingAndThen(Collectors.toList(), Collections::unmodifiableList));
    }
}
