package com.ryuqq.testengine.core.model;

/**
 * 테스트 항목 하나의 실행 본문.
 *
 * <p>본문은 {@link TestContext}를 통해 캡처된 출력 스트림에 접근합니다.
 * 프로세스 전역 {@code System.out}을 바꿔치기하지 않으므로 여러 본문이
 * 같은 프로세스 안에서 동시에 실행되어도 출력이 섞이지 않습니다.</p>
 *
 * <p>{@link AssertionError}는 FAILURE, {@link SkipTestException}은 SKIPPED,
 * 그 외 예외는 ERROR로 분류됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TestBody {

    /**
     * 아무것도 하지 않는 본문.
     */
    TestBody NO_OP = context -> { };

    /**
     * 본문 실행.
     *
     * @param context 실행 컨텍스트
     * @throws Exception 본문 실행 중 발생한 예외
     */
    void run(TestContext context) throws Exception;
}
