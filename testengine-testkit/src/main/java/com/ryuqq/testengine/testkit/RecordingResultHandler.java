package com.ryuqq.testengine.testkit;

import com.ryuqq.testengine.core.model.Outcome;
import com.ryuqq.testengine.core.model.TestItem;
import com.ryuqq.testengine.core.result.ResultHandler;

import java.util.ArrayList;
import java.util.List;

/**
 * Result handler that records every lifecycle event it receives, in order.
 *
 * <p>Events are recorded as strings so tests can assert on the exact sequence:</p>
 * <pre>
 * startTestRun
 * startTest:passes (sample.MixedOutcomes)
 * handle:passes (sample.MixedOutcomes):SUCCESS
 * stopTest:passes (sample.MixedOutcomes)
 * stopTestRun
 * </pre>
 *
 * <p>All methods are synchronized so one instance can be shared across threads.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RecordingResultHandler implements ResultHandler {

    public static final String START_TEST_RUN = "startTestRun";
    public static final String STOP_TEST_RUN = "stopTestRun";

    private final List<String> events = new ArrayList<>();
    private final List<Outcome> outcomes = new ArrayList<>();

    @Override
    public synchronized void startTest(TestItem item) {
        events.add("startTest:" + item.id());
    }

    @Override
    public synchronized void stopTest(TestItem item) {
        events.add("stopTest:" + item.id());
    }

    @Override
    public synchronized void startTestRun() {
        events.add(START_TEST_RUN);
    }

    @Override
    public synchronized void stopTestRun() {
        events.add(STOP_TEST_RUN);
    }

    @Override
    public synchronized void handle(Outcome outcome) {
        events.add("handle:" + outcome.testId() + ":" + outcome.status());
        outcomes.add(outcome);
    }

    /**
     * Returns a snapshot of the recorded events.
     *
     * @return events in the order they were received
     */
    public synchronized List<String> events() {
        return List.copyOf(events);
    }

    /**
     * Returns a snapshot of the received outcomes.
     *
     * @return outcomes in the order they were received
     */
    public synchronized List<Outcome> outcomes() {
        return List.copyOf(outcomes);
    }

    /**
     * Counts recorded events starting with the given prefix.
     *
     * @param prefix event prefix (e.g. "startTest:")
     * @return number of matching events
     */
    public synchronized long count(String prefix) {
        return events.stream().filter(event -> event.startsWith(prefix)).count();
    }
}
