package com.ryuqq.testengine.adapter.runner.worker;

import com.ryuqq.testengine.adapter.runner.ParallelConfig;
import com.ryuqq.testengine.core.model.Outcome;
import com.ryuqq.testengine.core.model.TestItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 워커마다 자식 JVM({@link WorkerMain})을 하나씩 띄워 항목을 실행하는 풀.
 *
 * <p><strong>프로토콜:</strong></p>
 * <pre>
 * 부모 → 자식 stdin : TestId 한 줄 (JSON)
 * 자식 → 부모 stdout: Outcome 묶음 한 줄 (JSON)
 * 자식 stderr       : 부모가 소비하여 DEBUG 로그로 남김
 * </pre>
 *
 * <p>자식 프로세스는 첫 항목을 받을 때 시작되고, maxTasksPerWorker에 도달하면
 * 워커와 함께 교체됩니다. 자식이 비정상 종료하면 해당 항목은 {@link WorkerException}으로
 * 실패하고, 다음 항목에서 새 프로세스가 시작됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ProcessWorkerPool extends AbstractWorkerPool {

    private static final Logger log = LoggerFactory.getLogger(ProcessWorkerPool.class);

    private final ProcessWorkerSpec spec;
    private final ProcessFactory processFactory;
    private final OutcomeCodec codec = new OutcomeCodec();

    /**
     * 생성자.
     *
     * @param config 병렬 실행 설정
     * @param spec 워커 프로세스 설정
     * @throws IllegalArgumentException config 또는 spec이 null인 경우
     */
    public ProcessWorkerPool(ParallelConfig config, ProcessWorkerSpec spec) {
        this(config, spec, new DefaultProcessFactory());
    }

    ProcessWorkerPool(ParallelConfig config, ProcessWorkerSpec spec, ProcessFactory processFactory) {
        super(config, "testengine-process-worker");
        if (spec == null) {
            throw new IllegalArgumentException("spec cannot be null");
        }
        if (processFactory == null) {
            throw new IllegalArgumentException("processFactory cannot be null");
        }
        this.spec = spec;
        this.processFactory = processFactory;
    }

    /**
     * spec을 고정한 WorkerPoolFactory.
     *
     * @param spec 워커 프로세스 설정
     * @return 실행마다 새 ProcessWorkerPool을 만드는 팩토리
     */
    public static WorkerPoolFactory factory(ProcessWorkerSpec spec) {
        return config -> new ProcessWorkerPool(config, spec);
    }

    @Override
    protected Slot newSlot(int workerNumber) {
        return new ProcessSlot(workerNumber);
    }

    private final class ProcessSlot implements Slot {

        private final int number;
        private Process process;
        private BufferedWriter requests;
        private BufferedReader responses;
        private Thread errGobbler;

        ProcessSlot(int number) {
            this.number = number;
        }

        @Override
        public List<Outcome> execute(TestItem item) {
            ensureStarted();
            String line;
            try {
                requests.write(codec.encodeId(item.id()));
                requests.newLine();
                requests.flush();
                line = responses.readLine();
            } catch (IOException e) {
                discardProcess();
                throw new WorkerException("I/O failure talking to worker process " + number, e);
            }
            if (line == null) {
                int exitCode = discardProcess();
                throw new WorkerException(
                    "Worker process " + number + " exited unexpectedly (exit code " + exitCode + ") while running " + item
                );
            }
            return codec.decodeBatch(line);
        }

        @Override
        public void close() {
            if (process == null) {
                return;
            }
            try {
                requests.close();
            } catch (IOException e) {
                log.debug("Failed to close stdin of worker process {}: {}", number, e.toString());
            }
            try {
                if (!process.waitFor(config().terminateTimeoutMs(), TimeUnit.MILLISECONDS)) {
                    destroyProcess(process);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                destroyProcess(process);
            }
            joinQuietly(errGobbler);
            process = null;
        }

        private void ensureStarted() {
            if (process != null) {
                return;
            }
            List<String> command = spec.command();
            log.debug("Starting worker process {}: {}", number, command);
            try {
                process = processFactory.start(command);
            } catch (IOException e) {
                throw new WorkerException("Failed to start worker process " + number, e);
            }
            requests = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
            responses = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
            errGobbler = startGobbler(process.getErrorStream(), "testengine-process-worker-" + number + "-err");
        }

        private int discardProcess() {
            Process current = process;
            process = null;
            destroyProcess(current);
            joinQuietly(errGobbler);
            return current.isAlive() ? -1 : current.exitValue();
        }

        private void joinQuietly(Thread thread) {
            if (thread == null) {
                return;
            }
            try {
                thread.join(config().terminateTimeoutMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static Thread startGobbler(InputStream stream, String name) {
        Thread thread = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    log.debug("[{}] {}", name, line);
                }
            } catch (IOException e) {
                log.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private void destroyProcess(Process process) {
        if (!process.isAlive()) {
            return;
        }
        try {
            process.destroy();
            boolean exited = process.waitFor(config().terminateTimeoutMs(), TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(config().terminateTimeoutMs(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    log.warn("Worker process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while destroying worker process");
        }
    }
}
