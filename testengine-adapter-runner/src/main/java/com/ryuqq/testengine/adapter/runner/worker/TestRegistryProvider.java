package com.ryuqq.testengine.adapter.runner.worker;

import com.ryuqq.testengine.core.model.TestRegistry;

/**
 * 프로세스 워커가 TestId로 항목을 복원할 때 사용하는 레지스트리 공급자.
 *
 * <p>워커 프로세스는 클래스 이름으로 구현체를 생성하므로
 * 구현체는 public 기본 생성자를 가져야 하며, 부모 프로세스와 같은 레지스트리를 만들어야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface TestRegistryProvider {

    TestRegistry registry();
}
