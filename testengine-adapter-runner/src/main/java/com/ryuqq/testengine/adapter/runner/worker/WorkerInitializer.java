package com.ryuqq.testengine.adapter.runner.worker;

/**
 * 워커가 첫 항목을 실행하기 전에 한 번 호출되는 초기화 훅.
 *
 * <p>프로세스 워커에서는 클래스 이름으로 전달되므로
 * 구현체는 public 기본 생성자를 가져야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface WorkerInitializer {

    WorkerInitializer NO_OP = () -> { };

    void initialize() throws Exception;
}
