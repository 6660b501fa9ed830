package com.ryuqq.testengine.adapter.runner.worker;

import com.ryuqq.testengine.core.model.Outcome;
import com.ryuqq.testengine.core.model.TestItem;

import java.util.List;
import java.util.concurrent.Future;

/**
 * 테스트 항목을 격리된 워커에서 실행하는 풀.
 *
 * <p>워커는 항목 하나를 출력 캡처가 켜진 별도 수집기로 실행하고,
 * 그 수집기가 받은 Outcome 묶음을 보고 순서대로 돌려줍니다.</p>
 *
 * <p><strong>종료 순서:</strong></p>
 * <pre>
 * close()      → 새 작업 제출 차단, 남은 작업은 계속 처리
 *   ↓
 * (호출자가 남은 Future를 폴링)
 *   ↓
 * terminate()  → 워커 정지 및 join, 처리되지 않은 작업 취소
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface WorkerPool {

    /**
     * 항목 실행 요청.
     *
     * @param item 실행할 항목
     * @return 해당 항목 실행 중 보고된 Outcome 목록
     * @throws IllegalArgumentException item이 null인 경우
     * @throws IllegalStateException 풀이 이미 닫힌 경우
     */
    Future<List<Outcome>> submit(TestItem item);

    /**
     * 새 작업 제출 차단.
     *
     * <p>이미 제출된 작업은 계속 처리됩니다. 여러 번 호출해도 안전합니다.</p>
     */
    void close();

    /**
     * 워커 정지.
     *
     * <p>워커를 정지시키고 설정된 시간까지 기다립니다.
     * 아직 시작하지 않은 작업의 Future는 취소됩니다. 여러 번 호출해도 안전합니다.</p>
     */
    void terminate();
}
