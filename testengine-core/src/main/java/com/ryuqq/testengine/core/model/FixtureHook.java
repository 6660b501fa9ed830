package com.ryuqq.testengine.core.model;

/**
 * 그룹 또는 네임스페이스 범위의 setUp/tearDown 훅.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface FixtureHook {

    /**
     * 아무것도 하지 않는 훅.
     */
    FixtureHook NO_OP = () -> { };

    /**
     * 훅 실행.
     *
     * @throws Exception 훅 실행 중 발생한 모든 예외
     */
    void run() throws Exception;
}
