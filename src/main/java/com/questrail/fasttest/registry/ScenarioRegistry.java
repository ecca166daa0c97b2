package com.questrail.fasttest.registry;

import com.questrail.fasttest.api.ScenarioId;
import com.questrail.fasttest.core.TestCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * ScenarioRegistry
 * -----------------------------------------------------------------------------
 * Keyed store of the test cases owned by each scenario.
 *
 * <h2>Lifecycle</h2>
 * A registry is an explicit object, created once by the composition root
 * (see {@code FastTestSession}) and handed to whatever declares or runs
 * scenarios. There is no global instance.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>Append-only: there is no removal operation</li>
 *   <li>Within a scenario, insertion order is preserved and is the execution order</li>
 *   <li>A test case is owned by exactly one scenario; appending the same
 *       instance twice is rejected</li>
 *   <li>Looking up a scenario that was never registered yields an empty list,
 *       never an error</li>
 * </ul>
 *
 * <h2>Registration phase</h2>
 * Registration is expected to finish before a scenario runs. Once a runner
 * has {@linkplain #seal(ScenarioId) sealed} a scenario, further appends to it
 * are ignored and logged.
 *
 * <h2>Threading</h2>
 * Not thread-safe. Registration and execution are single-threaded by contract.
 */
public final class ScenarioRegistry
{
    private static final Logger log = LoggerFactory.getLogger(ScenarioRegistry.class);

    private final Map<ScenarioId, List<TestCase>> scenarios = new LinkedHashMap<>();
    private final Set<ScenarioId> sealed = new HashSet<>();
    private final Set<TestCase> owned = Collections.newSetFromMap(new IdentityHashMap<>());

    /**
     * Returns the ordered test cases of a scenario, creating an empty entry
     * if the scenario is not yet known.
     *
     * @return read-only live view of the scenario's cases
     */
    public List<TestCase> register(ScenarioId scenario) {
        Objects.requireNonNull(scenario, "scenario");
        return Collections.unmodifiableList(entry(scenario));
    }

    /**
     * Takes ownership of {@code testCase} and appends it to the scenario.
     *
     * @return {@code true} if appended; {@code false} if the scenario has
     *         already started running
     * @throws IllegalArgumentException if the case is already owned by a scenario
     */
    public boolean append(ScenarioId scenario, TestCase testCase) {
        Objects.requireNonNull(scenario, "scenario");
        Objects.requireNonNull(testCase, "testCase");

        if (sealed.contains(scenario)) {
            log.warn("Ignoring test '{}' appended to scenario '{}' after its run started",
                testCase.label(), scenario);
            return false;
        }
        if (!owned.add(testCase)) {
            throw new IllegalArgumentException("Test case '" + testCase.label() + "' is already registered");
        }
        entry(scenario).add(testCase);
        return true;
    }

    /**
     * Ordered test cases of a scenario; empty if it was never registered.
     * Does not create an entry.
     */
    public List<TestCase> testsOf(ScenarioId scenario) {
        Objects.requireNonNull(scenario, "scenario");
        List<TestCase> tests = scenarios.get(scenario);
        return tests == null ? List.of() : Collections.unmodifiableList(tests);
    }

    public boolean isRegistered(ScenarioId scenario) {
        return scenarios.containsKey(scenario);
    }

    /**
     * Known scenarios, in first-registration order.
     */
    public Set<ScenarioId> scenarios() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(scenarios.keySet()));
    }

    /**
     * Closes registration for a scenario. Called by the runner when the
     * scenario's run starts.
     */
    public void seal(ScenarioId scenario) {
        Objects.requireNonNull(scenario, "scenario");
        sealed.add(scenario);
    }

    public boolean isSealed(ScenarioId scenario) {
        return sealed.contains(scenario);
    }

    private List<TestCase> entry(ScenarioId scenario) {
        return scenarios.computeIfAbsent(scenario, k -> new ArrayList<>());
    }
}
