package com.ryuqq.testengine.adapter.runner.worker;

import com.ryuqq.testengine.adapter.runner.ParallelConfig;
import com.ryuqq.testengine.adapter.runner.ParallelExecutor;
import com.ryuqq.testengine.core.model.Outcome;
import com.ryuqq.testengine.core.model.TestDuration;
import com.ryuqq.testengine.core.model.TestItem;
import com.ryuqq.testengine.core.model.TestRegistry;
import com.ryuqq.testengine.core.model.TestStatus;
import com.ryuqq.testengine.core.result.ResultCollector;
import com.ryuqq.testengine.testkit.SampleSuites;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ProcessWorkerPool 테스트.
 *
 * <p>가짜 {@link ProcessFactory}로 프로토콜과 장애 처리를 검증하고,
 * 마지막 시나리오는 실제 자식 JVM을 띄워 샘플 레지스트리를 실행합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ProcessWorkerPoolTest {

    private static final ParallelConfig CONFIG = new ParallelConfig(1, 0, 20, 2000);
    private static final ProcessWorkerSpec SPEC = new ProcessWorkerSpec(SampleRegistryProvider.class.getName());
    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    private final TestRegistry registry = SampleSuites.registry();
    private final OutcomeCodec codec = new OutcomeCodec();
    private ProcessWorkerPool pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.terminate();
        }
    }

    @Test
    void submit_SendsIdAndDecodesResponse() throws Exception {
        // Given
        TestItem item = registry.groups().get(0).items().get(0);
        Outcome response = new Outcome(item.id(), TestStatus.SUCCESS, null, null, TestDuration.between(START, START));
        FakeProcess process = new FakeProcess(codec.encodeBatch(List.of(response)) + "\n", 0);
        RecordingProcessFactory factory = new RecordingProcessFactory(process);
        pool = new ProcessWorkerPool(CONFIG, SPEC, factory);

        // When
        List<Outcome> outcomes = pool.submit(item).get(5, TimeUnit.SECONDS);

        // Then
        assertThat(outcomes).containsExactly(response);
        assertThat(process.requests()).isEqualTo(codec.encodeId(item.id()) + System.lineSeparator());
        assertThat(factory.commands).containsExactly(SPEC.command());
    }

    @Test
    void submit_ProcessExitsWithoutAnswer_FailsWithExitCode() {
        // Given
        TestItem item = registry.groups().get(0).items().get(0);
        pool = new ProcessWorkerPool(CONFIG, SPEC, new RecordingProcessFactory(new FakeProcess("", 137)));

        // When & Then
        assertThatThrownBy(() -> pool.submit(item).get(5, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(WorkerException.class)
            .hasMessageContaining("exited unexpectedly (exit code 137)");
    }

    @Test
    void submit_AfterCrash_StartsFreshProcess() throws Exception {
        // Given
        List<TestItem> items = registry.groups().get(0).items();
        Outcome response = new Outcome(items.get(1).id(), TestStatus.SUCCESS, null, null,
            TestDuration.between(START, START));
        RecordingProcessFactory factory = new RecordingProcessFactory(
            new FakeProcess("", 1),
            new FakeProcess(codec.encodeBatch(List.of(response)) + "\n", 0)
        );
        pool = new ProcessWorkerPool(CONFIG, SPEC, factory);

        // When
        Throwable crash = catchFailure(pool.submit(items.get(0)));
        List<Outcome> outcomes = pool.submit(items.get(1)).get(5, TimeUnit.SECONDS);

        // Then
        assertThat(crash).isInstanceOf(WorkerException.class);
        assertThat(outcomes).containsExactly(response);
        assertThat(factory.commands).hasSize(2);
    }

    @Test
    void submit_ProcessCannotStart_FailsTask() {
        // Given
        TestItem item = registry.groups().get(0).items().get(0);
        pool = new ProcessWorkerPool(CONFIG, SPEC, command -> {
            throw new IOException("java not found");
        });

        // When & Then
        assertThatThrownBy(() -> pool.submit(item).get(5, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(WorkerException.class)
            .hasMessageContaining("Failed to start worker process 1");
    }

    @Test
    void submit_WorkerReportsError_FailsTask() {
        // Given
        TestItem item = registry.groups().get(0).items().get(0);
        FakeProcess process = new FakeProcess(codec.encodeError("Unknown test: " + item.id()) + "\n", 0);
        pool = new ProcessWorkerPool(CONFIG, SPEC, new RecordingProcessFactory(process));

        // When & Then
        assertThatThrownBy(() -> pool.submit(item).get(5, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasMessageContaining("Worker reported an error: Unknown test");
    }

    @Test
    @Timeout(120)
    void parallelExecutor_WithChildJvms_RunsSampleRegistry() {
        // Given
        ResultCollector collector = new ResultCollector();
        ParallelExecutor executor = new ParallelExecutor(
            new ParallelConfig(2, 0, 50, 10_000),
            ProcessWorkerPool.factory(SPEC)
        );

        // When
        executor.run(registry.suite(), collector);

        // Then
        assertThat(collector.successCount()).isEqualTo(1);
        assertThat(collector.failures())
            .extracting(outcome -> outcome.testId().method())
            .containsExactlyInAnyOrder("fails", "printsAndFails", "failsTwice");
        assertThat(collector.errors())
            .extracting(outcome -> outcome.testId().method())
            .containsExactlyInAnyOrder("errors", "failsTwice");
        assertThat(collector.skipped()).hasSize(3);
        assertThat(collector.expectedFailures()).hasSize(1);
        assertThat(collector.unexpectedSuccesses()).hasSize(1);
        assertThat(collector.failures())
            .filteredOn(outcome -> outcome.testId().method().equals("printsAndFails"))
            .singleElement()
            .satisfies(outcome -> assertThat(outcome.exception()).contains(SampleSuites.PRINTED_STDOUT));
    }

    private static Throwable catchFailure(Future<List<Outcome>> future) throws Exception {
        try {
            future.get(5, TimeUnit.SECONDS);
            throw new AssertionError("Expected the task to fail");
        } catch (ExecutionException e) {
            return e.getCause();
        }
    }

    private static final class RecordingProcessFactory implements ProcessFactory {

        private final Deque<Process> processes;
        private final List<List<String>> commands = new ArrayList<>();

        RecordingProcessFactory(Process... processes) {
            this.processes = new ArrayDeque<>(List.of(processes));
        }

        @Override
        public synchronized Process start(List<String> command) throws IOException {
            commands.add(command);
            Process next = processes.poll();
            if (next == null) {
                throw new IOException("No more fake processes");
            }
            return next;
        }
    }

    /**
     * 미리 정해진 응답을 돌려주고 이미 종료된 것처럼 동작하는 프로세스.
     */
    private static final class FakeProcess extends Process {

        private final ByteArrayOutputStream stdin = new ByteArrayOutputStream();
        private final InputStream stdout;
        private final InputStream stderr = new ByteArrayInputStream(new byte[0]);
        private final int exitCode;

        FakeProcess(String stdout, int exitCode) {
            this.stdout = new ByteArrayInputStream(stdout.getBytes(StandardCharsets.UTF_8));
            this.exitCode = exitCode;
        }

        String requests() {
            return stdin.toString(StandardCharsets.UTF_8);
        }

        @Override
        public OutputStream getOutputStream() {
            return stdin;
        }

        @Override
        public InputStream getInputStream() {
            return stdout;
        }

        @Override
        public InputStream getErrorStream() {
            return stderr;
        }

        @Override
        public int waitFor() {
            return exitCode;
        }

        @Override
        public int exitValue() {
            return exitCode;
        }

        @Override
        public void destroy() {
        }
    }
}
