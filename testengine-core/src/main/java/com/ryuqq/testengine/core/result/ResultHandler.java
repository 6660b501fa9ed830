package com.ryuqq.testengine.core.result;

import com.ryuqq.testengine.core.model.Outcome;
import com.ryuqq.testengine.core.model.TestItem;

/**
 * 테스트 생명주기 이벤트 관찰자 (SPI).
 *
 * <p><strong>호출 순서:</strong></p>
 * <pre>
 * startTestRun
 *   ↓
 * (startTest → handle* → stopTest)*
 *   ↓
 * stopTestRun
 * </pre>
 *
 * <p>병렬 실행에서도 startTestRun/stopTestRun은 부모 프로세스에서 정확히 한 번씩만 호출됩니다.</p>
 *
 * <p><strong>주의:</strong> 구현체는 이 경로에서 예외를 던지면 안 됩니다.
 * 핸들러 예외는 수집기가 복구하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ResultHandler {

    /**
     * 개별 테스트 시작.
     *
     * @param item 시작하는 테스트
     */
    void startTest(TestItem item);

    /**
     * 개별 테스트 종료.
     *
     * @param item 종료된 테스트
     */
    void stopTest(TestItem item);

    /**
     * 실행 전체 시작.
     */
    void startTestRun();

    /**
     * 실행 전체 종료.
     */
    void stopTestRun();

    /**
     * 완료된 결과 처리.
     *
     * @param outcome 결과
     */
    void handle(Outcome outcome);
}
