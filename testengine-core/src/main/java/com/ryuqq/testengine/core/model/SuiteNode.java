package com.ryuqq.testengine.core.model;

/**
 * 스위트 트리의 노드 (리프 항목 또는 하위 스위트).
 *
 * <p>Sealed interface로 정의되어 트리 노드가 {@link TestItem}과 {@link TestSuite}
 * 두 종류뿐임을 컴파일 타임에 보장합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface SuiteNode permits TestItem, TestSuite {

    /**
     * 노드에 포함된 리프 항목 수.
     *
     * @return 리프 항목 수 (하위 스위트 노드 자체는 세지 않음)
     */
    int count();
}
