/**
 * Reusable executor contract tests.
 *
 * <p>Extend {@link com.ryuqq.testengine.testkit.contract.AbstractExecutorContractTest} and
 * supply a {@link com.ryuqq.testengine.core.executor.SuiteExecutor} to verify an executor
 * implementation against the shared scenarios.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.testengine.testkit.contract;
