package com.questrail.fasttest.runtime;

import com.questrail.fasttest.api.ScenarioId;
import com.questrail.fasttest.api.ScenarioResults;
import com.questrail.fasttest.api.TestObserver;
import com.questrail.fasttest.config.FastTestConfig;
import com.questrail.fasttest.observability.ScenarioSummaryReport;
import com.questrail.fasttest.observability.Slf4jTestObserver;
import com.questrail.fasttest.registry.ScenarioBuilder;
import com.questrail.fasttest.registry.ScenarioDefinition;
import com.questrail.fasttest.registry.ScenarioRegistry;
import com.questrail.fasttest.runner.ScenarioRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * FastTestSession
 * =============================================================================
 * Composition root of the framework: owns the scenario registry and one runner
 * per scenario, and exposes the registration, execution, query and observer
 * surfaces by scenario name.
 *
 * <h2>Usage</h2>
 * <pre>
 *   FastTestSession session = FastTestSession.create();
 *
 *   session.declareScenario("Math", scenario -> scenario
 *       .test("adds", () -> assertThat(2 + 2).isEqualTo(4)));
 *
 *   session.attachObserver("Math", test -> progress.add(test.label()));
 *   ScenarioResults results = session.runScenario("Math");
 * </pre>
 *
 * <h2>Phases</h2>
 * Declare everything first, then run. A scenario accepts new tests until its
 * run starts. Declaring the same name twice appends to the same scenario.
 *
 * <h2>Threading</h2>
 * Not thread-safe; use from a single thread.
 */
public final class FastTestSession {
    private static final Logger log = LoggerFactory.getLogger(FastTestSession.class);

    private final ScenarioRegistry registry;
    private final FastTestConfig config;
    private final TestObserver testLogger;
    private final Map<ScenarioId, ScenarioRunner> runners = new LinkedHashMap<>();

    private FastTestSession(ScenarioRegistry registry, FastTestConfig config) {
        this.registry = registry;
        this.config = config;
        this.testLogger = new Slf4jTestObserver();
    }

    public static FastTestSession create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public ScenarioRegistry registry() {
        return registry;
    }

    public FastTestConfig config() {
        return config;
    }

    /**
     * Declares (or extends) a scenario by running its definition against a
     * builder bound to the scenario.
     */
    public ScenarioId declareScenario(String name, ScenarioDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        ScenarioBuilder builder = scenario(name);
        definition.describe(builder);
        log.debug("Declared scenario '{}' ({} tests)", builder.scenario(),
            registry.testsOf(builder.scenario()).size());
        return builder.scenario();
    }

    /**
     * Registration surface for incremental appends outside a declaration block.
     */
    public ScenarioBuilder scenario(String name) {
        ScenarioId id = ScenarioId.of(name);
        ScenarioBuilder builder = new ScenarioBuilder(registry, id);
        runnerFor(id);
        return builder;
    }

    /**
     * Runs the named scenario. Unknown names run zero tests.
     *
     * @return the scenario's results, which are also available later through
     *         {@link #results(String)}
     */
    public ScenarioResults runScenario(String name) {
        ScenarioRunner runner = runnerFor(ScenarioId.of(name));
        runner.run();
        if (config.logSummary()) {
            new ScenarioSummaryReport(runner).log(config.verboseSummary());
        }
        return runner;
    }

    /**
     * Read-only results of the named scenario. All zero until it has run.
     */
    public ScenarioResults results(String name) {
        return runnerFor(ScenarioId.of(name));
    }

    /**
     * Renders the summary block of the named scenario.
     */
    public String summary(String name, boolean verbose) {
        return new ScenarioSummaryReport(results(name)).render(verbose);
    }

    /**
     * @return {@code true} if the observer was not already attached to the scenario
     */
    public boolean attachObserver(String name, TestObserver observer) {
        return runnerFor(ScenarioId.of(name)).attach(observer);
    }

    /**
     * @return {@code true} if the observer was attached to the scenario
     */
    public boolean detachObserver(String name, TestObserver observer) {
        return runnerFor(ScenarioId.of(name)).detach(observer);
    }

    /**
     * Declared scenarios, in declaration order.
     */
    public Set<ScenarioId> scenarios() {
        return registry.scenarios();
    }

    private ScenarioRunner runnerFor(ScenarioId id) {
        return runners.computeIfAbsent(id, key -> {
            ScenarioRunner runner = new ScenarioRunner(key, registry, config.clock());
            if (config.logEachTest()) {
                runner.attach(testLogger);
            }
            return runner;
        });
    }

    public static final class Builder {
        private ScenarioRegistry registry;
        private FastTestConfig config = FastTestConfig.defaults();

        /**
         * Uses an existing registry instead of a fresh one.
         */
        public Builder withRegistry(ScenarioRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder withConfig(FastTestConfig config) {
            this.config = config;
            return this;
        }

        public FastTestSession build() {
            Objects.requireNonNull(config, "config");
            return new FastTestSession(registry != null ? registry : new ScenarioRegistry(), config);
        }
    }
}
