package com.ryuqq.testengine.core.model;

/**
 * 단일 테스트 실행 결과 (불변 record).
 *
 * <p>Outcome은 {@code ResultCollector}가 결과를 보고받는 시점에만 생성되며,
 * 이후에는 Outcome을 보관하는 ResultHandler가 소유합니다.
 * 병렬 실행 시 워커 프로세스에서 부모 프로세스로 전달되는 유일한 데이터입니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>testId:</strong> 결과를 만든 테스트 항목의 식별자</li>
 *   <li><strong>status:</strong> 완료 상태</li>
 *   <li><strong>exception:</strong> 포맷된 예외 텍스트 (선택, null 가능)</li>
 *   <li><strong>message:</strong> 부가 메시지, 예: 건너뛴 사유 (선택, null 가능)</li>
 *   <li><strong>duration:</strong> 실행 구간</li>
 * </ul>
 *
 * @param testId 테스트 식별자
 * @param status 완료 상태
 * @param exception 포맷된 예외 텍스트 (null 가능)
 * @param message 부가 메시지 (null 가능)
 * @param duration 실행 구간
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Outcome(
    TestId testId,
    TestStatus status,
    String exception,
    String message,
    TestDuration duration
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException testId, status, duration 중 하나라도 null인 경우
     */
    public Outcome {
        if (testId == null) {
            throw new IllegalArgumentException("testId cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (duration == null) {
            throw new IllegalArgumentException("duration cannot be null");
        }
        // exception, message는 null 허용
    }
}
