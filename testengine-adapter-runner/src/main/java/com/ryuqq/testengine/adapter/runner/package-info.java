/**
 * Runner Adapter Layer - SuiteExecutor 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.testengine.adapter.runner.SequentialExecutor} - 깊이 우선 순차 실행, 그룹/네임스페이스 범위 공유</li>
 *   <li>{@link com.ryuqq.testengine.adapter.runner.ParallelExecutor} - 워커 풀 분산 실행, 부모 collector로 결과 재생</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (SequentialExecutor, ParallelExecutor, worker)
 *   ↓ implements
 * core/executor (SuiteExecutor interface)
 *   ↓ depends on
 * core (model, fixture, result)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.testengine.adapter.runner;
