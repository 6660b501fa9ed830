package com.ryuqq.testengine.adapter.runner.worker;

import com.ryuqq.testengine.adapter.runner.SequentialExecutor;
import com.ryuqq.testengine.core.model.Outcome;
import com.ryuqq.testengine.core.model.TestItem;
import com.ryuqq.testengine.core.model.TestSuite;
import com.ryuqq.testengine.core.result.CollectingResultHandler;
import com.ryuqq.testengine.core.result.CollectorConfig;
import com.ryuqq.testengine.core.result.ResultCollector;

import java.util.List;

/**
 * 항목 하나를 전용 수집기로 실행하는 워커 측 진입점.
 *
 * <p>단일 항목 스위트를 {@link SequentialExecutor}로 실행하므로
 * 항목의 그룹/네임스페이스 훅이 그 항목만 감쌉니다. 출력 캡처는 항상 켜져 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class IsolatedItemRunner {

    private static final CollectorConfig WORKER_CONFIG = new CollectorConfig().withCaptureOutput(true);

    private IsolatedItemRunner() {
    }

    static List<Outcome> run(TestItem item) {
        CollectingResultHandler handler = new CollectingResultHandler();
        ResultCollector collector = new ResultCollector(WORKER_CONFIG);
        collector.addResultHandler(handler);
        new SequentialExecutor().run(TestSuite.of(item), collector);
        return List.copyOf(handler.outcomes());
    }
}
