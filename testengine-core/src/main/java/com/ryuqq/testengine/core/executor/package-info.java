/**
 * Executor contract.
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.testengine.core.executor.SuiteExecutor} - 스위트 실행자</li>
 * </ul>
 *
 * <p>구현체는 testengine-adapter-runner 모듈에 있습니다 (순차 / 병렬).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.testengine.core.executor;
