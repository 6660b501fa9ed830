/**
 * Worker pools used by {@link com.ryuqq.testengine.adapter.runner.ParallelExecutor}.
 *
 * <h2>Pools</h2>
 * <ul>
 *   <li>{@link com.ryuqq.testengine.adapter.runner.worker.ThreadWorkerPool} - Worker threads in the current JVM</li>
 *   <li>{@link com.ryuqq.testengine.adapter.runner.worker.ProcessWorkerPool} - One child JVM per worker</li>
 * </ul>
 *
 * <h2>Process boundary</h2>
 * <p>Only {@link com.ryuqq.testengine.core.model.Outcome} records cross it, encoded by
 * {@link com.ryuqq.testengine.adapter.runner.worker.OutcomeCodec}. The child rebuilds items from a
 * {@link com.ryuqq.testengine.adapter.runner.worker.TestRegistryProvider}.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.testengine.adapter.runner.worker;
