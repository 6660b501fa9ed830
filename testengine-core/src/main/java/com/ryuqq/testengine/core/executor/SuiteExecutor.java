package com.ryuqq.testengine.core.executor;

import com.ryuqq.testengine.core.model.TestSuite;
import com.ryuqq.testengine.core.result.ResultCollector;

/**
 * 스위트 실행자.
 *
 * <p>스위트의 모든 리프 항목을 실행하고 결과를 collector에 모읍니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>collector의 startRun / stopRun은 정확히 한 번씩 호출됩니다.</li>
 *   <li>collector.shouldStop()이 true가 되면 아직 시작하지 않은 항목은 실행하지 않습니다.</li>
 *   <li>그룹/네임스페이스 훅 실패는 예외로 전파되지 않고 ERROR Outcome으로 보고됩니다.</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface SuiteExecutor {

    /**
     * 스위트 실행.
     *
     * @param suite 실행할 스위트
     * @param collector 결과 수집기
     * @return 전달받은 collector
     * @throws IllegalArgumentException suite 또는 collector가 null인 경우
     */
    ResultCollector run(TestSuite suite, ResultCollector collector);
}
