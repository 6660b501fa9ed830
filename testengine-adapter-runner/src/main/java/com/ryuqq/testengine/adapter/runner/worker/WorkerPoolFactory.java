package com.ryuqq.testengine.adapter.runner.worker;

import com.ryuqq.testengine.adapter.runner.ParallelConfig;

/**
 * 실행마다 새 {@link WorkerPool}을 만드는 팩토리.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface WorkerPoolFactory {

    /**
     * 풀 생성.
     *
     * @param config 병렬 실행 설정
     * @return 새 WorkerPool
     */
    WorkerPool create(ParallelConfig config);
}
