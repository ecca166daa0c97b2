package com.questrail.fasttest.observability;

import com.questrail.fasttest.api.TestCaseView;
import com.questrail.fasttest.api.TestObserver;
import com.questrail.fasttest.api.TestOutcome;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Test observer that records every notification it receives.
 *
 * Used by unit tests to assert:
 * - which cases were published
 * - in what order
 * - with which outcome
 */
public final class RecordingTestObserver implements TestObserver {

    private final List<TestCaseView> received = new ArrayList<>();

    @Override
    public void update(TestCaseView test) {
        received.add(test);
    }

    public List<TestCaseView> received() {
        return Collections.unmodifiableList(received);
    }

    public List<String> labels() {
        return received.stream().map(TestCaseView::label).toList();
    }

    public List<TestOutcome> outcomes() {
        return received.stream().map(TestCaseView::outcome).toList();
    }

    public int size() {
        return received.size();
    }

    public void clear() {
        received.clear();
    }
}
