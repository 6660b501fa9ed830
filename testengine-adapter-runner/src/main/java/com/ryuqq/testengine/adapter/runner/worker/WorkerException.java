package com.ryuqq.testengine.adapter.runner.worker;

/**
 * 워커 경계에서 발생한 실패.
 *
 * <p>워커 프로세스 시작 실패, 비정상 종료, 프로토콜 위반, 결과 대기 중 인터럽트 등
 * 테스트 본문의 예외 캡처 밖에서 일어난 문제를 나타냅니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class WorkerException extends RuntimeException {

    public WorkerException(String message) {
        super(message);
    }

    public WorkerException(String message, Throwable cause) {
        super(message, cause);
    }
}
