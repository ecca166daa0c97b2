package com.questrail.fasttest.registry;

/**
 * The body of a scenario declaration: appends the scenario's test cases, in
 * order, through the supplied builder.
 */
@FunctionalInterface
public interface ScenarioDefinition
{
    void describe(ScenarioBuilder scenario);
}
