package com.ryuqq.testengine.adapter.runner;

import com.ryuqq.testengine.core.model.Group;
import com.ryuqq.testengine.core.model.Namespace;
import com.ryuqq.testengine.core.model.TestBody;
import com.ryuqq.testengine.core.model.TestSuite;
import com.ryuqq.testengine.core.result.CollectorConfig;
import com.ryuqq.testengine.core.result.ResultCollector;
import com.ryuqq.testengine.testkit.RecordingResultHandler;
import com.ryuqq.testengine.testkit.SampleSuites;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SequentialExecutor 유닛 테스트.
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>깊이 우선 전위 순서 실행과 범위 훅 호출 순서</li>
 *   <li>그룹 setUp 실패 시 합성 ERROR 하나, 항목 미실행, tearDown 생략</li>
 *   <li>fail-fast 중단</li>
 *   <li>훅/본문의 Error도 ERROR로 보고하고 실행 계속</li>
 *   <li>빈 하위 스위트만 있으면 훅 미실행</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class SequentialExecutorTest {

    private List<String> trace;
    private RecordingResultHandler handler;
    private ResultCollector collector;
    private SequentialExecutor executor;

    @BeforeEach
    void setUp() {
        trace = SampleSuites.newTrace();
        handler = new RecordingResultHandler();
        collector = new ResultCollector();
        collector.addResultHandler(handler);
        executor = new SequentialExecutor();
    }

    @Test
    void run_NestedSuites_RunsPreOrderWithScopedFixtures() {
        // Given
        TestSuite suite = SampleSuites.tracingNamespaces(trace);

        // When
        executor.run(suite, collector);

        // Then
        assertThat(trace).containsExactly(
            "alpha.setUp",
            "First.setUp", "First.one", "First.two", "First.tearDown",
            "Second.setUp", "Second.three", "Second.tearDown",
            "alpha.tearDown",
            "beta.setUp",
            "Third.setUp", "Third.four", "Third.tearDown",
            "beta.tearDown"
        );
        assertThat(collector.testsRun()).isEqualTo(4);
        assertThat(collector.successCount()).isEqualTo(4);
        assertThat(collector.wasSuccessful()).isTrue();
    }

    @Test
    void run_GroupSetUpFails_ReportsOneErrorAndRunsNothingElse() {
        // Given
        Group group = SampleSuites.failingSetUpGroup(trace);

        // When
        executor.run(group.suite(), collector);

        // Then
        assertThat(trace).containsExactly("FailingSetUp.setUp");
        assertThat(collector.errors()).hasSize(1);
        assertThat(collector.errors().get(0).testId().method()).isEqualTo("groupSetUp (FailingSetUp)");
        assertThat(collector.errors().get(0).exception()).contains(SampleSuites.SETUP_FAILURE);
        assertThat(collector.testsRun()).isZero();
        assertThat(handler.count("startTest:")).isZero();
        assertThat(collector.wasSuccessful()).isFalse();
    }

    @Test
    void run_FailedGroupBetweenHealthyGroups_OtherGroupsStillRun() {
        // Given
        Group before = Group.builder(Namespace.of(SampleSuites.NAMESPACE), "Before")
            .test("runs", context -> trace.add("Before.runs"))
            .build();
        Group after = Group.builder(Namespace.of(SampleSuites.NAMESPACE), "After")
            .test("runs", context -> trace.add("After.runs"))
            .build();
        TestSuite suite = TestSuite.of(before.suite(), SampleSuites.failingSetUpGroup(trace).suite(), after.suite());

        // When
        executor.run(suite, collector);

        // Then
        assertThat(trace).containsExactly("Before.runs", "FailingSetUp.setUp", "After.runs");
        assertThat(collector.successCount()).isEqualTo(2);
        assertThat(collector.errors()).hasSize(1);
    }

    @Test
    void run_FailFast_StopsAfterFirstFailure() {
        // Given
        ResultCollector failFast = new ResultCollector(new CollectorConfig().withFailFast(true));
        Group group = Group.builder(Namespace.of(SampleSuites.NAMESPACE), "FailFast")
            .test("first", context -> {
                trace.add("first");
                throw new AssertionError("stop here");
            })
            .test("second", context -> trace.add("second"))
            .build();

        // When
        executor.run(group.suite(), failFast);

        // Then
        assertThat(group.suite().count()).isEqualTo(2);
        assertThat(trace).containsExactly("first");
        assertThat(failFast.testsRun()).isEqualTo(1);
        assertThat(failFast.shouldStop()).isTrue();
    }

    @Test
    void run_GroupSetUpThrowsLinkageError_ReportsErrorAndContinues() {
        // Given
        Namespace namespace = Namespace.of(SampleSuites.NAMESPACE);
        Group broken = Group.builder(namespace, "StaticInit")
            .setUp(() -> {
                throw new ExceptionInInitializerError("static init failed");
            })
            .test("never", context -> trace.add("StaticInit.never"))
            .build();
        Group healthy = Group.builder(namespace, "Healthy")
            .test("runs", context -> trace.add("Healthy.runs"))
            .build();

        // When
        executor.run(TestSuite.of(broken.suite(), healthy.suite()), collector);

        // Then
        assertThat(trace).containsExactly("Healthy.runs");
        assertThat(collector.errors())
            .extracting(outcome -> outcome.testId().method())
            .containsExactly("groupSetUp (StaticInit)");
        assertThat(collector.successCount()).isEqualTo(1);
        assertThat(handler.events()).last().isEqualTo(RecordingResultHandler.STOP_TEST_RUN);
    }

    @Test
    void run_BodyThrowsLinkageError_ReportsErrorAndRunsNextTest() {
        // Given
        Group group = Group.builder(Namespace.of(SampleSuites.NAMESPACE), "MissingClass")
            .test("first", context -> {
                throw new NoClassDefFoundError("com/acme/MissingDriver");
            })
            .test("second", context -> trace.add("second"))
            .build();

        // When
        executor.run(group.suite(), collector);

        // Then
        assertThat(trace).containsExactly("second");
        assertThat(collector.testsRun()).isEqualTo(2);
        assertThat(collector.errors()).hasSize(1);
        assertThat(collector.errors().get(0).exception()).contains("NoClassDefFoundError");
        assertThat(collector.successCount()).isEqualTo(1);
    }

    @Test
    void run_OnlyEmptySubSuitesUnderHookedScopes_RunsNoHooks() {
        // Given
        Namespace namespace = Namespace.builder("hooked")
            .setUp(() -> trace.add("hooked.setUp"))
            .tearDown(() -> trace.add("hooked.tearDown"))
            .build();
        Group emptyGroup = Group.builder(namespace, "NoTests")
            .setUp(() -> trace.add("NoTests.setUp"))
            .tearDown(() -> trace.add("NoTests.tearDown"))
            .build();
        TestSuite suite = TestSuite.of(TestSuite.empty(), TestSuite.of(emptyGroup.suite(), TestSuite.empty()));

        // When
        executor.run(suite, collector);

        // Then
        assertThat(suite.count()).isZero();
        assertThat(trace).isEmpty();
        assertThat(collector.testsRun()).isZero();
        assertThat(collector.errors()).isEmpty();
        assertThat(handler.events())
            .containsExactly(RecordingResultHandler.START_TEST_RUN, RecordingResultHandler.STOP_TEST_RUN);
    }

    @Test
    void run_StopRequestedBeforeRun_RunsNothingButBracketsRun() {
        // Given
        collector.stop();

        // When
        executor.run(SampleSuites.tracingNamespaces(trace), collector);

        // Then
        assertThat(trace).isEmpty();
        assertThat(handler.events())
            .containsExactly(RecordingResultHandler.START_TEST_RUN, RecordingResultHandler.STOP_TEST_RUN);
    }

    @Test
    void run_SkippedTestMethod_ReportsSkipWithReason() {
        // Given
        Group group = Group.builder(Namespace.of(SampleSuites.NAMESPACE), "PartlySkipped")
            .test("runs", TestBody.NO_OP)
            .skippedTest("later", "needs a license key")
            .build();

        // When
        executor.run(group.suite(), collector);

        // Then
        assertThat(collector.successCount()).isEqualTo(1);
        assertThat(collector.skipped())
            .extracting(outcome -> outcome.message())
            .containsExactly("needs a license key");
    }

    @Test
    void run_NullArguments_ThrowException() {
        // When & Then
        assertThatThrownBy(() -> executor.run(null, collector))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("suite cannot be null");
        assertThatThrownBy(() -> executor.run(TestSuite.empty(), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("collector cannot be null");
    }
}
