package com.ryuqq.testengine.core.model;

import com.ryuqq.testengine.core.result.CapturedOutput;

import java.io.PrintStream;

/**
 * 테스트 본문에 전달되는 실행 컨텍스트.
 *
 * @param testId 실행 중인 테스트 식별자
 * @param output 이 테스트에 할당된 출력 싱크
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TestContext(TestId testId, CapturedOutput output) {

    public TestContext {
        if (testId == null) {
            throw new IllegalArgumentException("testId cannot be null");
        }
        if (output == null) {
            throw new IllegalArgumentException("output cannot be null");
        }
    }

    /**
     * 표준 출력 스트림.
     *
     * @return 캡처가 켜져 있으면 버퍼, 아니면 원래 표준 출력
     */
    public PrintStream out() {
        return output.out();
    }

    /**
     * 표준 에러 스트림.
     *
     * @return 캡처가 켜져 있으면 버퍼, 아니면 원래 표준 에러
     */
    public PrintStream err() {
        return output.err();
    }
}
