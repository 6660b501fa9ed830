package com.ryuqq.testengine.adapter.runner;

import com.ryuqq.testengine.core.executor.SuiteExecutor;
import com.ryuqq.testengine.testkit.contract.AbstractExecutorContractTest;

/**
 * SequentialExecutor 계약 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class SequentialExecutorContractTest extends AbstractExecutorContractTest {

    @Override
    protected SuiteExecutor executor() {
        return new SequentialExecutor();
    }
}
