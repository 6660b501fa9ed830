package com.ryuqq.testengine.core.model;

/**
 * 단일 테스트 실행의 완료 상태.
 *
 * <p><strong>성공으로 간주되는 상태:</strong> SUCCESS, SKIPPED, EXPECTED_FAILURE</p>
 * <p><strong>실패로 간주되는 상태:</strong> FAILURE, ERROR, UNEXPECTED_SUCCESS</p>
 *
 * <p>실패로 간주되는 상태가 한 번이라도 보고되면 실행 전체의 성공 여부는
 * false로 고정됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum TestStatus {

    /**
     * 정상 완료.
     */
    SUCCESS,

    /**
     * 검증(assertion) 실패.
     */
    FAILURE,

    /**
     * 예상하지 못한 예외.
     */
    ERROR,

    /**
     * 건너뜀.
     */
    SKIPPED,

    /**
     * 실패가 예상된 테스트가 실제로 실패함.
     */
    EXPECTED_FAILURE,

    /**
     * 실패가 예상된 테스트가 성공함.
     */
    UNEXPECTED_SUCCESS;

    /**
     * 실행 전체의 성공 여부에 영향을 주지 않는 상태인지 확인.
     *
     * @return SUCCESS, SKIPPED, EXPECTED_FAILURE인 경우 true
     */
    public boolean isSuccessful() {
        return this == SUCCESS || this == SKIPPED || this == EXPECTED_FAILURE;
    }

    /**
     * fail-fast를 유발하는 상태인지 확인.
     *
     * @return FAILURE, ERROR, UNEXPECTED_SUCCESS인 경우 true
     */
    public boolean isFailing() {
        return !isSuccessful();
    }
}
