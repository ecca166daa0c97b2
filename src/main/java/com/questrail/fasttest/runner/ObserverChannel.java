package com.questrail.fasttest.runner;

import com.questrail.fasttest.api.TestCaseView;
import com.questrail.fasttest.api.TestObserver;
import com.questrail.fasttest.api.TestReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * ObserverChannel
 * -----------------------------------------------------------------------------
 * Publishes each finished test case to the observers attached to a scenario.
 *
 * <h2>Membership</h2>
 * Observers are kept in a set keyed by <b>identity</b>: attaching the same
 * instance twice has no effect, and detaching removes that instance only.
 * Two distinct instances that happen to be {@code equals} are both notified.
 *
 * <h2>Delivery</h2>
 * {@link #publish(TestCaseView)} delivers one immutable snapshot to every
 * attached observer. The order across observers is unspecified. An observer
 * that throws anything, {@link Error}s included, is logged and does not
 * prevent delivery to the others.
 *
 * <h2>Threading</h2>
 * Not thread-safe. Attach and detach between runs, from the thread that runs
 * the scenario.
 */
public final class ObserverChannel
{
    private static final Logger log = LoggerFactory.getLogger(ObserverChannel.class);

    private final Set<TestObserver> observers = Collections.newSetFromMap(new IdentityHashMap<>());

    /**
     * @return {@code true} if the observer was not already attached
     */
    public boolean attach(TestObserver observer) {
        Objects.requireNonNull(observer, "observer");
        return observers.add(observer);
    }

    /**
     * @return {@code true} if the observer was attached
     */
    public boolean detach(TestObserver observer) {
        Objects.requireNonNull(observer, "observer");
        return observers.remove(observer);
    }

    public boolean isAttached(TestObserver observer) {
        return observers.contains(observer);
    }

    public int size() {
        return observers.size();
    }

    /**
     * Notifies every attached observer of one finished test case.
     */
    public void publish(TestCaseView test) {
        Objects.requireNonNull(test, "test");
        if (observers.isEmpty()) {
            return;
        }

        TestReport snapshot = TestReport.of(test);
        // Copy so an observer may detach itself while being notified.
        List<TestObserver> targets = new ArrayList<>(observers);
        for (TestObserver observer : targets) {
            try {
                observer.update(snapshot);
            } catch (Throwable t) {
                log.error("Observer {} failed while handling test '{}'", observer, snapshot.label(), t);
            }
        }
    }
}
