package com.ryuqq.testengine.testkit.contract;

import com.ryuqq.testengine.core.executor.SuiteExecutor;
import com.ryuqq.testengine.core.model.ErrorPlaceholder;
import com.ryuqq.testengine.core.model.Group;
import com.ryuqq.testengine.core.model.Outcome;
import com.ryuqq.testengine.core.model.TestStatus;
import com.ryuqq.testengine.core.model.TestSuite;
import com.ryuqq.testengine.core.result.CollectorConfig;
import com.ryuqq.testengine.core.result.ResultCollector;
import com.ryuqq.testengine.testkit.RecordingResultHandler;
import com.ryuqq.testengine.testkit.SampleSuites;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for SuiteExecutor contract tests.
 *
 * <p>Every executor must satisfy these scenarios regardless of how it schedules items:</p>
 * <ul>
 *   <li>Each completion status is classified and bucketed the same way</li>
 *   <li>startTestRun / stopTestRun reach every handler exactly once</li>
 *   <li>An empty suite runs zero items and leaves the run successful</li>
 *   <li>A skip-flagged group reports every item as skipped without running anything</li>
 *   <li>A body failure followed by an afterEach failure yields two outcomes for one item</li>
 *   <li>Captured output is attached to failure text</li>
 *   <li>An ErrorPlaceholder leaf yields exactly one error</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyExecutorContractTest extends AbstractExecutorContractTest {
 *     {@literal @}Override
 *     protected SuiteExecutor executor() {
 *         return new MyExecutor();
 *     }
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractExecutorContractTest {

    protected List<String> trace;
    protected RecordingResultHandler handler;
    protected ResultCollector collector;

    /**
     * Creates the executor under test. Called once per test.
     *
     * @return a fresh executor
     */
    protected abstract SuiteExecutor executor();

    /**
     * Creates the collector each test runs against. Output capture is on.
     *
     * @return a fresh collector
     */
    protected ResultCollector newCollector() {
        return new ResultCollector(new CollectorConfig().withCaptureOutput(true));
    }

    @BeforeEach
    void setUpCollector() {
        trace = SampleSuites.newTrace();
        handler = new RecordingResultHandler();
        collector = newCollector();
        collector.addResultHandler(handler);
    }

    @Test
    void testEachStatus_IsClassifiedAndBucketed() {
        // Given
        TestSuite suite = SampleSuites.mixedOutcomes(trace).suite();

        // When
        ResultCollector returned = executor().run(suite, collector);

        // Then
        assertSame(collector, returned, "run should return the collector it was given");
        assertEquals(6, collector.testsRun());
        assertEquals(1, collector.successCount());
        assertEquals(1, collector.failures().size());
        assertEquals(1, collector.errors().size());
        assertEquals(1, collector.skipped().size());
        assertEquals(1, collector.expectedFailures().size());
        assertEquals(1, collector.unexpectedSuccesses().size());
        assertFalse(collector.wasSuccessful());

        assertEquals("fails", collector.failures().get(0).testId().method());
        assertEquals("errors", collector.errors().get(0).testId().method());
        assertEquals("not supported on this platform", collector.skipped().get(0).message());
        assertTrue(collector.errors().get(0).exception().contains("connection reset"));
    }

    @Test
    void testRunBrackets_ReachEveryHandlerExactlyOnce() {
        // Given
        TestSuite suite = SampleSuites.mixedOutcomes(trace).suite();

        // When
        executor().run(suite, collector);

        // Then
        List<String> events = handler.events();
        assertEquals(RecordingResultHandler.START_TEST_RUN, events.get(0));
        assertEquals(RecordingResultHandler.STOP_TEST_RUN, events.get(events.size() - 1));
        assertEquals(1, handler.count(RecordingResultHandler.START_TEST_RUN));
        assertEquals(1, handler.count(RecordingResultHandler.STOP_TEST_RUN));
        assertEquals(6, handler.count("startTest:"));
        assertEquals(6, handler.count("stopTest:"));
    }

    @Test
    void testEmptySuite_RunsNothingAndStaysSuccessful() {
        // When: running the same empty suite twice
        executor().run(TestSuite.empty(), collector);
        executor().run(TestSuite.of(TestSuite.empty(), TestSuite.empty()), collector);

        // Then
        assertEquals(0, collector.testsRun());
        assertTrue(collector.wasSuccessful());
        assertEquals(0, handler.count("startTest:"));
        assertEquals(2, handler.count(RecordingResultHandler.START_TEST_RUN));
    }

    @Test
    void testSkippedGroup_ReportsEveryItemSkippedWithoutRunningAnything() {
        // Given
        Group group = SampleSuites.skippedGroup(trace);

        // When
        executor().run(group.suite(), collector);

        // Then
        assertTrue(trace.isEmpty(), "No hook or body of a skipped group should run, but got " + trace);
        assertEquals(2, collector.skipped().size());
        for (Outcome outcome : collector.skipped()) {
            assertEquals(SampleSuites.SKIP_REASON, outcome.message());
        }
        assertTrue(collector.wasSuccessful());
    }

    @Test
    void testBodyAndAfterEachFailure_YieldTwoOutcomesForOneItem() {
        // Given
        Group group = SampleSuites.failingAfterEachGroup();

        // When
        executor().run(group.suite(), collector);

        // Then
        assertEquals(1, collector.failures().size());
        assertEquals(1, collector.errors().size());
        assertEquals(collector.failures().get(0).testId(), collector.errors().get(0).testId());
        assertTrue(collector.errors().get(0).exception().contains("cleanup failed"));
    }

    @Test
    void testCapturedOutput_IsAttachedToFailureText() {
        // Given
        Group group = SampleSuites.printingGroup();

        // When
        executor().run(group.suite(), collector);

        // Then
        assertEquals(1, collector.failures().size());
        String exception = collector.failures().get(0).exception();
        assertTrue(exception.contains("Stdout:"), "Failure text should contain the stdout block");
        assertTrue(exception.contains(SampleSuites.PRINTED_STDOUT));
        assertTrue(exception.contains("Stderr:"), "Failure text should contain the stderr block");
        assertTrue(exception.contains(SampleSuites.PRINTED_STDERR));
    }

    @Test
    void testErrorPlaceholder_YieldsExactlyOneError() {
        // Given
        ErrorPlaceholder placeholder = ErrorPlaceholder.of(
            "collect (sample.Broken)", new IllegalStateException("cannot load group")
        );

        // When
        executor().run(TestSuite.of(placeholder), collector);

        // Then
        assertEquals(1, collector.errors().size());
        Outcome outcome = collector.errors().get(0);
        assertEquals(placeholder.id(), outcome.testId());
        assertEquals(TestStatus.ERROR, outcome.status());
        assertTrue(outcome.exception().contains("cannot load group"));
        assertFalse(collector.wasSuccessful());
    }

    @Test
    void testDurations_NeverStopBeforeTheyStart() {
        // When
        executor().run(SampleSuites.mixedOutcomes(trace).suite(), collector);

        // Then
        for (Outcome outcome : handler.outcomes()) {
            assertFalse(outcome.duration().stop().isBefore(outcome.duration().start()),
                "Duration of " + outcome.testId() + " ends before it starts");
        }
    }
}
