package com.ryuqq.testengine.core.model;

/**
 * 테스트 본문이나 beforeEach 훅에서 던져 해당 항목을 건너뛰게 합니다.
 *
 * <p>예외 메시지가 건너뛴 사유로 기록됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SkipTestException extends RuntimeException {

    /**
     * 생성자.
     *
     * @param reason 건너뛴 사유
     */
    public SkipTestException(String reason) {
        super(reason);
    }
}
