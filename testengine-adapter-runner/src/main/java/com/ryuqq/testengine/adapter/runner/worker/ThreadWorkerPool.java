package com.ryuqq.testengine.adapter.runner.worker;

import com.ryuqq.testengine.adapter.runner.ParallelConfig;
import com.ryuqq.testengine.core.model.Outcome;
import com.ryuqq.testengine.core.model.TestItem;

import java.util.List;

/**
 * 같은 JVM 안의 워커 스레드로 항목을 실행하는 풀.
 *
 * <p>출력 캡처가 전역 System.out이 아닌 항목별 싱크이므로 여러 스레드가 동시에
 * 항목을 실행해도 서로의 출력이 섞이지 않습니다.</p>
 *
 * <p>초기화 훅은 각 워커 스레드에서 첫 항목 실행 전에 한 번 호출됩니다.
 * 초기화가 실패한 워커는 받은 항목마다 {@link WorkerException}으로 실패를 돌려줍니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ThreadWorkerPool extends AbstractWorkerPool {

    private final WorkerInitializer initializer;

    public ThreadWorkerPool(ParallelConfig config) {
        this(config, WorkerInitializer.NO_OP);
    }

    /**
     * 생성자.
     *
     * @param config 병렬 실행 설정
     * @param initializer 워커별 초기화 훅
     * @throws IllegalArgumentException config 또는 initializer가 null인 경우
     */
    public ThreadWorkerPool(ParallelConfig config, WorkerInitializer initializer) {
        super(config, "testengine-thread-worker");
        if (initializer == null) {
            throw new IllegalArgumentException("initializer cannot be null");
        }
        this.initializer = initializer;
    }

    @Override
    protected Slot newSlot(int workerNumber) {
        return new ThreadSlot();
    }

    private final class ThreadSlot implements Slot {

        private boolean initialized;
        private Exception initializationFailure;

        @Override
        public List<Outcome> execute(TestItem item) {
            if (!initialized) {
                initialized = true;
                try {
                    initializer.initialize();
                } catch (Exception e) {
                    initializationFailure = e;
                }
            }
            if (initializationFailure != null) {
                throw new WorkerException("Worker initializer failed", initializationFailure);
            }
            return IsolatedItemRunner.run(item);
        }

        @Override
        public void close() {
        }
    }
}
