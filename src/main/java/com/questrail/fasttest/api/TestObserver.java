package com.questrail.fasttest.api;

/**
 * Subscriber notified after each test case of a scenario finishes.
 * <p>
 * Exactly one notification is delivered per finished case, skipped cases
 * included, in execution order. When several observers are attached to the
 * same scenario, the order in which <em>different</em> observers are notified is
 * unspecified.
 * <p>
 * An observer instance may be attached to several scenarios at once.
 */
@FunctionalInterface
public interface TestObserver
{
    /**
     * Called once per finished test case.
     *
     * @param test read-only snapshot of the case that just finished
     */
    void update(TestCaseView test);
}
