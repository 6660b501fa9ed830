package com.ryuqq.testengine.core.result;

/**
 * ResultCollector 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>captureOutput: 테스트 출력 버퍼링 여부 (기본 false)</li>
 *   <li>failFast: 첫 FAILURE/ERROR/UNEXPECTED_SUCCESS 이후 실행 중단 여부 (기본 false)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param captureOutput 출력 버퍼링 여부
 * @param failFast fail-fast 여부
 */
public record CollectorConfig(boolean captureOutput, boolean failFast) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: captureOutput=false, failFast=false</p>
     */
    public CollectorConfig() {
        this(false, false);
    }

    /**
     * captureOutput만 변경한 새 인스턴스 생성.
     */
    public CollectorConfig withCaptureOutput(boolean captureOutput) {
        return new CollectorConfig(captureOutput, failFast);
    }

    /**
     * failFast만 변경한 새 인스턴스 생성.
     */
    public CollectorConfig withFailFast(boolean failFast) {
        return new CollectorConfig(captureOutput, failFast);
    }
}
