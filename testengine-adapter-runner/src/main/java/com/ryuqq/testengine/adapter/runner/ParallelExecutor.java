package com.ryuqq.testengine.adapter.runner;

import com.ryuqq.testengine.adapter.runner.worker.ThreadWorkerPool;
import com.ryuqq.testengine.adapter.runner.worker.WorkerException;
import com.ryuqq.testengine.adapter.runner.worker.WorkerPool;
import com.ryuqq.testengine.adapter.runner.worker.WorkerPoolFactory;
import com.ryuqq.testengine.core.executor.SuiteExecutor;
import com.ryuqq.testengine.core.model.ErrorPlaceholder;
import com.ryuqq.testengine.core.model.Outcome;
import com.ryuqq.testengine.core.model.TestItem;
import com.ryuqq.testengine.core.model.TestSuite;
import com.ryuqq.testengine.core.result.ResultCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 병렬 스위트 실행자.
 *
 * <p>스위트를 리프 항목으로 펼쳐 {@link WorkerPool}에 하나씩 제출하고,
 * 워커가 돌려준 Outcome 묶음을 부모 collector에 재생합니다.
 * 모든 항목이 서로 독립적이라고 가정합니다. 워커는 항목마다 그 항목의 그룹/네임스페이스
 * 훅만 실행하므로 범위가 항목 사이에 공유되지 않습니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * collector.startRun()
 *   ↓
 * For each leaf:
 *   1. collector.shouldStop() → 남은 제출 중단 (진행 중 작업은 취소하지 않음)
 *   2. ErrorPlaceholder → 부모에서 바로 실행
 *   3. 그 외 → pool.submit(item)
 *   4. 완료된 Future 결과 재생
 *   ↓
 * pool.close() → 남은 Future 폴링 (pollTimeoutMs) → 재생
 *   ↓
 * pool.terminate()
 *   ↓
 * collector.stopRun()
 * </pre>
 *
 * <p><strong>재생:</strong> Outcome마다
 * {@code startTest(item, outcome 시작 시각) → addOutcome → stopTest}.
 * 워커 경계에서 실패한 항목은 ERROR Outcome 하나로 보고되며 재시도하지 않습니다.</p>
 *
 * <p><strong>워커 종류:</strong> 기본 생성자는 같은 JVM의 스레드 워커({@link ThreadWorkerPool})를 씁니다.
 * 항목마다 별도 OS 프로세스에서 실행하려면 프로세스 풀 팩토리를 넘깁니다.</p>
 * <pre>{@code
 * SuiteExecutor executor = new ParallelExecutor(
 *     new ParallelConfig(),
 *     ProcessWorkerPool.factory(new ProcessWorkerSpec("com.acme.AcmeRegistryProvider")));
 * }</pre>
 *
 * @see com.ryuqq.testengine.adapter.runner.worker.ProcessWorkerPool#factory(com.ryuqq.testengine.adapter.runner.worker.ProcessWorkerSpec)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ParallelExecutor implements SuiteExecutor {

    private static final Logger log = LoggerFactory.getLogger(ParallelExecutor.class);

    private final ParallelConfig config;
    private final WorkerPoolFactory poolFactory;

    public ParallelExecutor() {
        this(new ParallelConfig());
    }

    /**
     * 생성자 (스레드 워커 사용).
     *
     * @param config 병렬 실행 설정
     */
    public ParallelExecutor(ParallelConfig config) {
        this(config, ThreadWorkerPool::new);
    }

    /**
     * 생성자.
     *
     * @param config 병렬 실행 설정
     * @param poolFactory 실행마다 워커 풀을 만드는 팩토리
     * @throws IllegalArgumentException config 또는 poolFactory가 null인 경우
     */
    public ParallelExecutor(ParallelConfig config, WorkerPoolFactory poolFactory) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (poolFactory == null) {
            throw new IllegalArgumentException("poolFactory cannot be null");
        }
        this.config = config;
        this.poolFactory = poolFactory;
    }

    public ParallelConfig config() {
        return config;
    }

    @Override
    public ResultCollector run(TestSuite suite, ResultCollector collector) {
        if (suite == null) {
            throw new IllegalArgumentException("suite cannot be null");
        }
        if (collector == null) {
            throw new IllegalArgumentException("collector cannot be null");
        }

        collector.startRun();
        try {
            execute(suite, collector);
        } finally {
            collector.stopRun();
        }
        return collector;
    }

    private void execute(TestSuite suite, ResultCollector collector) {
        List<TestItem> leaves = suite.leaves();
        if (leaves.isEmpty()) {
            return;
        }

        WorkerPool pool = poolFactory.create(config);
        Map<Future<List<Outcome>>, TestItem> pending = new LinkedHashMap<>();
        try {
            for (TestItem item : leaves) {
                if (collector.shouldStop()) {
                    log.debug("Stop requested; not submitting remaining items");
                    break;
                }
                if (item instanceof ErrorPlaceholder) {
                    item.run(collector);
                } else {
                    pending.put(pool.submit(item), item);
                }
                replayCompleted(pending, collector);
            }
            pool.close();
            awaitPending(pending, collector);
        } finally {
            pool.terminate();
        }
    }

    private void replayCompleted(Map<Future<List<Outcome>>, TestItem> pending, ResultCollector collector) {
        Iterator<Map.Entry<Future<List<Outcome>>, TestItem>> iterator = pending.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<Future<List<Outcome>>, TestItem> entry = iterator.next();
            if (entry.getKey().isDone()) {
                iterator.remove();
                replay(entry.getValue(), entry.getKey(), collector);
            }
        }
    }

    private void awaitPending(Map<Future<List<Outcome>>, TestItem> pending, ResultCollector collector) {
        while (!pending.isEmpty()) {
            Iterator<Map.Entry<Future<List<Outcome>>, TestItem>> iterator = pending.entrySet().iterator();
            while (iterator.hasNext()) {
                Map.Entry<Future<List<Outcome>>, TestItem> entry = iterator.next();
                if (awaitDone(entry.getKey())) {
                    iterator.remove();
                    replay(entry.getValue(), entry.getKey(), collector);
                }
            }
        }
    }

    private boolean awaitDone(Future<List<Outcome>> future) {
        try {
            future.get(config.pollTimeoutMs(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException | CancellationException e) {
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerException("Interrupted while waiting for worker results", e);
        }
    }

    private void replay(TestItem item, Future<List<Outcome>> future, ResultCollector collector) {
        List<Outcome> outcomes;
        try {
            outcomes = future.get();
        } catch (ExecutionException e) {
            reportWorkerFailure(item, e.getCause() == null ? e : e.getCause(), collector);
            return;
        } catch (CancellationException e) {
            reportWorkerFailure(item, e, collector);
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerException("Interrupted while reading worker results for " + item, e);
        }

        for (Outcome outcome : outcomes) {
            TestItem target = replayTarget(item, outcome);
            collector.startTest(target, outcome.duration().start());
            try {
                collector.addOutcome(outcome);
            } finally {
                collector.stopTest(target);
            }
        }
    }

    private void reportWorkerFailure(TestItem item, Throwable cause, ResultCollector collector) {
        log.warn("Worker failed while running {}", item, cause);
        collector.startTest(item);
        try {
            collector.addError(item, cause);
        } finally {
            collector.stopTest(item);
        }
    }

    /**
     * 워커 측 훅 실패는 항목이 아닌 ErrorPlaceholder의 Outcome으로 돌아오므로
     * 같은 식별자의 placeholder로 재생합니다.
     */
    private static TestItem replayTarget(TestItem item, Outcome outcome) {
        if (outcome.testId().equals(item.id())) {
            return item;
        }
        return ErrorPlaceholder.of(
            outcome.testId().method(),
            new WorkerException("Fixture failure reported by worker for " + item)
        );
    }
}
