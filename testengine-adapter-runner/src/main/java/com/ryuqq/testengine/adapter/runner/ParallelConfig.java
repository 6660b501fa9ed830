package com.ryuqq.testengine.adapter.runner;

/**
 * 병렬 실행 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>workers: 워커 수 (기본값: 사용 가능한 프로세서 수)</li>
 *   <li>maxTasksPerWorker: 워커 하나가 처리한 뒤 교체되는 항목 수 (기본 0 = 무제한)</li>
 *   <li>pollTimeoutMs: 결과/작업 폴링 간격 (기본 100ms)</li>
 *   <li>terminateTimeoutMs: 종료 시 워커 하나를 기다리는 최대 시간 (기본 5000ms)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param workers 워커 수 (1 이상)
 * @param maxTasksPerWorker 워커 교체 주기 (0이면 교체하지 않음)
 * @param pollTimeoutMs 폴링 간격 (밀리초, 양수)
 * @param terminateTimeoutMs 종료 대기 시간 (밀리초, 양수)
 */
public record ParallelConfig(int workers, int maxTasksPerWorker, long pollTimeoutMs, long terminateTimeoutMs) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: workers=availableProcessors, maxTasksPerWorker=0, pollTimeoutMs=100ms, terminateTimeoutMs=5000ms</p>
     */
    public ParallelConfig() {
        this(Runtime.getRuntime().availableProcessors(), 0, 100, 5000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ParallelConfig {
        if (workers <= 0) {
            throw new IllegalArgumentException(
                "workers must be positive (current: " + workers + ")"
            );
        }
        if (maxTasksPerWorker < 0) {
            throw new IllegalArgumentException(
                "maxTasksPerWorker cannot be negative (current: " + maxTasksPerWorker + ")"
            );
        }
        if (pollTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "pollTimeoutMs must be positive (current: " + pollTimeoutMs + ")"
            );
        }
        if (terminateTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "terminateTimeoutMs must be positive (current: " + terminateTimeoutMs + ")"
            );
        }
    }

    public ParallelConfig withWorkers(int workers) {
        return new ParallelConfig(workers, this.maxTasksPerWorker, this.pollTimeoutMs, this.terminateTimeoutMs);
    }

    public ParallelConfig withMaxTasksPerWorker(int maxTasksPerWorker) {
        return new ParallelConfig(this.workers, maxTasksPerWorker, this.pollTimeoutMs, this.terminateTimeoutMs);
    }

    public ParallelConfig withPollTimeoutMs(long pollTimeoutMs) {
        return new ParallelConfig(this.workers, this.maxTasksPerWorker, pollTimeoutMs, this.terminateTimeoutMs);
    }

    public ParallelConfig withTerminateTimeoutMs(long terminateTimeoutMs) {
        return new ParallelConfig(this.workers, this.maxTasksPerWorker, this.pollTimeoutMs, terminateTimeoutMs);
    }

    /**
     * 워커 교체 주기 설정 여부.
     *
     * @return maxTasksPerWorker가 0보다 크면 true
     */
    public boolean recyclesWorkers() {
        return maxTasksPerWorker > 0;
    }
}
