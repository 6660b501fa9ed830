package com.ryuqq.testengine.core.model;

import com.ryuqq.testengine.core.result.ResultCollector;

/**
 * 실행 가능한 리프 항목.
 *
 * <p>항목은 실행되면 하나 이상의 Outcome을 보고합니다. 보통은 하나이며,
 * 본문 실패 뒤 afterEach 훅까지 실패하면 같은 식별자로 두 개가 보고됩니다.</p>
 *
 * <ul>
 *   <li>{@link RegisteredTest}: 그룹에 등록된 일반 테스트</li>
 *   <li>{@link ErrorPlaceholder}: 테스트 본문 밖에서 발생한 오류를 대신하는 합성 항목</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface TestItem extends SuiteNode permits RegisteredTest, ErrorPlaceholder {

    /**
     * 항목 식별자.
     *
     * @return TestId
     */
    TestId id();

    /**
     * 소속 그룹.
     *
     * @return Group
     */
    Group group();

    /**
     * 소속 네임스페이스.
     *
     * @return Namespace
     */
    default Namespace namespace() {
        return group().namespace();
    }

    /**
     * 항목을 실행하고 결과를 collector에 보고합니다.
     *
     * <p>구현체는 startTest → 결과 보고 → stopTest 순서를 지켜야 합니다.</p>
     *
     * @param collector 결과 수집기
     */
    void run(ResultCollector collector);

    @Override
    default int count() {
        return 1;
    }
}
