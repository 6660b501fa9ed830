package com.ryuqq.testengine.adapter.runner.worker;

import com.ryuqq.testengine.adapter.runner.ParallelConfig;
import com.ryuqq.testengine.core.model.Outcome;
import com.ryuqq.testengine.core.model.TestItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 작업 큐와 워커 스레드를 관리하는 {@link WorkerPool} 기본 구현.
 *
 * <p>워커 스레드 하나가 {@link Slot} 하나를 소유합니다. 슬롯은 항목을 실제로 실행하는
 * 자원(스레드 자체, 또는 자식 프로세스)이며, 하위 클래스가 {@link #newSlot(int)}으로 제공합니다.</p>
 *
 * <p><strong>워커 생명주기:</strong></p>
 * <pre>
 * 첫 submit → config.workers()개 워커 시작
 *   ↓
 * 큐에서 작업을 꺼내 slot.execute(item) → Future 완료
 *   ↓
 * maxTasksPerWorker 도달 → 슬롯 정리 후 새 워커로 교체
 *   ↓
 * close() 후 큐가 비면 종료 / terminate() 시 인터럽트 후 join
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractWorkerPool implements WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(AbstractWorkerPool.class);

    private final ParallelConfig config;
    private final String threadNamePrefix;
    private final BlockingQueue<Task> queue = new LinkedBlockingQueue<>();
    private final List<Thread> workers = new ArrayList<>();
    private final AtomicInteger workerSequence = new AtomicInteger();

    private boolean started;
    private volatile boolean closed;
    private volatile boolean terminated;

    /**
     * 생성자.
     *
     * @param config 병렬 실행 설정
     * @param threadNamePrefix 워커 스레드 이름 접두사
     * @throws IllegalArgumentException config가 null이거나 threadNamePrefix가 비어 있는 경우
     */
    protected AbstractWorkerPool(ParallelConfig config, String threadNamePrefix) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
            throw new IllegalArgumentException("threadNamePrefix cannot be null or blank");
        }
        this.config = config;
        this.threadNamePrefix = threadNamePrefix;
    }

    /**
     * 워커 하나가 사용할 실행 슬롯 생성.
     *
     * <p>워커 스레드 안에서 호출됩니다.</p>
     *
     * @param workerNumber 1부터 증가하는 워커 번호
     * @return 새 슬롯
     */
    protected abstract Slot newSlot(int workerNumber);

    protected ParallelConfig config() {
        return config;
    }

    @Override
    public Future<List<Outcome>> submit(TestItem item) {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        if (closed) {
            throw new IllegalStateException("Worker pool is closed");
        }
        startWorkers();
        CompletableFuture<List<Outcome>> future = new CompletableFuture<>();
        queue.add(new Task(item, future));
        return future;
    }

    @Override
    public void close() {
        closed = true;
    }

    @Override
    public void terminate() {
        closed = true;
        terminated = true;

        List<Thread> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(workers);
        }
        for (Thread worker : snapshot) {
            worker.interrupt();
        }
        for (Thread worker : snapshot) {
            try {
                worker.join(config.terminateTimeoutMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new WorkerException("Interrupted while terminating worker " + worker.getName(), e);
            }
            if (worker.isAlive()) {
                log.warn("Worker {} did not stop within {}ms", worker.getName(), config.terminateTimeoutMs());
            }
        }

        Task task;
        while ((task = queue.poll()) != null) {
            task.future().cancel(false);
        }
    }

    /**
     * 현재 살아 있는 워커 수.
     *
     * @return 워커 스레드 수
     */
    public synchronized int activeWorkers() {
        return workers.size();
    }

    private synchronized void startWorkers() {
        if (started) {
            return;
        }
        started = true;
        for (int i = 0; i < config.workers(); i++) {
            startWorker();
        }
    }

    private synchronized void startWorker() {
        int number = workerSequence.incrementAndGet();
        Thread thread = new Thread(() -> runWorker(number), threadNamePrefix + "-" + number);
        thread.setDaemon(true);
        workers.add(thread);
        thread.start();
        log.debug("Started worker {}", thread.getName());
    }

    private synchronized void workerExited(Thread worker, boolean retired) {
        workers.remove(worker);
        if (retired && !terminated && !(closed && queue.isEmpty())) {
            log.debug("Replacing retired worker {}", worker.getName());
            startWorker();
        }
    }

    private void runWorker(int number) {
        Slot slot = newSlot(number);
        int completed = 0;
        boolean retired = false;
        boolean interrupted = false;
        try {
            while (!terminated) {
                Task task = queue.poll(config.pollTimeoutMs(), TimeUnit.MILLISECONDS);
                if (task == null) {
                    if (closed && queue.isEmpty()) {
                        break;
                    }
                    continue;
                }
                execute(slot, task);
                completed++;
                if (config.recyclesWorkers() && completed >= config.maxTasksPerWorker()) {
                    retired = true;
                    break;
                }
            }
        } catch (InterruptedException e) {
            interrupted = true;
        } finally {
            try {
                slot.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close worker slot {}", number, e);
            }
            workerExited(Thread.currentThread(), retired);
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void execute(Slot slot, Task task) {
        if (task.future().isDone()) {
            return;
        }
        try {
            task.future().complete(slot.execute(task.item()));
        } catch (Exception | Error e) {
            log.warn("Worker failed to run {}", task.item(), e);
            task.future().completeExceptionally(e);
        }
    }

    /**
     * 워커 하나가 소유하는 실행 자원.
     */
    protected interface Slot {

        /**
         * 항목 실행.
         *
         * @param item 실행할 항목
         * @return 보고된 Outcome 목록
         * @throws Exception 워커 경계에서 실패한 경우
         */
        List<Outcome> execute(TestItem item) throws Exception;

        /**
         * 슬롯 정리. 워커 종료 시 한 번 호출됩니다.
         */
        void close();
    }

    private record Task(TestItem item, CompletableFuture<List<Outcome>> future) {
    }
}
