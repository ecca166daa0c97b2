package com.questrail.fasttest.registry;

import com.questrail.fasttest.api.ScenarioId;
import com.questrail.fasttest.api.TestProcedure;
import com.questrail.fasttest.core.TestCase;

import java.util.Objects;

/**
 * ScenarioBuilder
 * -----------------------------------------------------------------------------
 * Registration surface for one scenario. Each call appends a new test case to
 * the scenario's registry entry, preserving call order.
 *
 * <pre>
 *   session.declareScenario("Math", scenario -> scenario
 *       .test("adds", () -> assertThat(2 + 2).isEqualTo(4))
 *       .skip("not implemented yet", "divides", () -> assertThat(4 / 2).isEqualTo(2)));
 * </pre>
 */
public final class ScenarioBuilder
{
    private final ScenarioRegistry registry;
    private final ScenarioId scenario;

    public ScenarioBuilder(ScenarioRegistry registry, ScenarioId scenario) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.scenario = Objects.requireNonNull(scenario, "scenario");
        registry.register(scenario);
    }

    public ScenarioId scenario() {
        return scenario;
    }

    /**
     * Appends an anonymous test.
     */
    public ScenarioBuilder test(TestProcedure procedure) {
        return add(TestCase.of(procedure));
    }

    public ScenarioBuilder test(String label, TestProcedure procedure) {
        return add(TestCase.of(label, procedure));
    }

    /**
     * Appends an anonymous test that will be reported as skipped.
     */
    public ScenarioBuilder skip(TestProcedure procedure) {
        return add(TestCase.skipped(procedure));
    }

    public ScenarioBuilder skip(String label, TestProcedure procedure) {
        return add(TestCase.skipped(label, procedure));
    }

    public ScenarioBuilder skip(String reason, String label, TestProcedure procedure) {
        return add(TestCase.skipped(reason, label, procedure));
    }

    /**
     * Appends an already built case.
     */
    public ScenarioBuilder add(TestCase testCase) {
        registry.append(scenario, testCase);
        return this;
    }
}
