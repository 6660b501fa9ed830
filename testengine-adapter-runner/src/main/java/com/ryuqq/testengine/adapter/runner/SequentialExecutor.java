package com.ryuqq.testengine.adapter.runner;

import com.ryuqq.testengine.core.executor.SuiteExecutor;
import com.ryuqq.testengine.core.fixture.FixtureState;
import com.ryuqq.testengine.core.model.SuiteNode;
import com.ryuqq.testengine.core.model.TestItem;
import com.ryuqq.testengine.core.model.TestSuite;
import com.ryuqq.testengine.core.result.ResultCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 순차 스위트 실행자.
 *
 * <p>스위트를 선언 순서대로 깊이 우선 순회하며, 각 자식 노드마다
 * {@link FixtureState#setup(SuiteNode)}으로 그룹/네임스페이스 범위를 맞춘 뒤 실행합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * run(suite, collector)
 *   ↓
 * collector.startRun()
 *   ↓
 * For each child (depth-first):
 *   1. collector.shouldStop() → 남은 형제 노드 중단
 *   2. state.setup(child):
 *      - true  → 하위 스위트면 재귀, 항목이면 item.run(collector)
 *      - false → 실행하지 않음 (skip 그룹이면 SKIPPED 보고)
 *   ↓
 * state.teardown() (정확히 한 번)
 *   ↓
 * collector.stopRun()
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SequentialExecutor implements SuiteExecutor {

    private static final Logger log = LoggerFactory.getLogger(SequentialExecutor.class);

    @Override
    public ResultCollector run(TestSuite suite, ResultCollector collector) {
        if (suite == null) {
            throw new IllegalArgumentException("suite cannot be null");
        }
        if (collector == null) {
            throw new IllegalArgumentException("collector cannot be null");
        }

        collector.startRun();
        try {
            FixtureState state = new FixtureState(collector);
            try {
                runSuite(suite, collector, state);
            } finally {
                state.teardown();
            }
        } finally {
            collector.stopRun();
        }
        return collector;
    }

    private void runSuite(TestSuite suite, ResultCollector collector, FixtureState state) {
        for (SuiteNode child : suite) {
            if (collector.shouldStop()) {
                log.debug("Stop requested; not running remaining nodes of {}", suite);
                break;
            }
            if (state.setup(child)) {
                if (child instanceof TestSuite) {
                    runSuite((TestSuite) child, collector, state);
                } else {
                    log.debug("Running test {}", child);
                    ((TestItem) child).run(collector);
                }
            } else {
                notExecuted((TestItem) child, collector, state);
            }
        }
    }

    private void notExecuted(TestItem item, ResultCollector collector, FixtureState state) {
        if (!item.group().isSkipped() || state.isNamespaceSetupFailed()) {
            log.debug("Fixture setup failed; not running {}", item);
            return;
        }
        collector.startTest(item);
        try {
            collector.addSkip(item, item.group().skipReason());
        } finally {
            collector.stopTest(item);
        }
    }
}
