package com.ryuqq.testengine.adapter.runner.worker;

import com.ryuqq.testengine.core.model.Outcome;
import com.ryuqq.testengine.core.model.TestId;
import com.ryuqq.testengine.core.model.TestItem;
import com.ryuqq.testengine.core.model.TestRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

/**
 * 프로세스 워커 진입점.
 *
 * <p><strong>사용법:</strong></p>
 * <pre>
 * java -cp ... com.ryuqq.testengine.adapter.runner.worker.WorkerMain &lt;registryProviderClass&gt; [initializerClass]
 * </pre>
 *
 * <p>stdin에서 TestId를 한 줄씩 읽어 항목을 실행하고, Outcome 묶음을 stdout에 한 줄로 씁니다.
 * stdin이 닫히면 종료합니다. 프로토콜 외의 stdout 출력은 모두 stderr로 돌립니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkerMain {

    static final int EXIT_USAGE = 2;
    static final int EXIT_STARTUP_FAILURE = 3;

    private WorkerMain() {
    }

    public static void main(String[] args) {
        // 로거 초기화 전에 stdout을 프로토콜 전용으로 분리
        PrintStream protocol = new PrintStream(new FileOutputStream(FileDescriptor.out), true, StandardCharsets.UTF_8);
        System.setOut(System.err);
        Logger log = LoggerFactory.getLogger(WorkerMain.class);

        if (args.length < 1 || args.length > 2) {
            log.error("Usage: WorkerMain <registryProviderClass> [initializerClass]");
            System.exit(EXIT_USAGE);
            return;
        }

        TestRegistry registry;
        try {
            registry = instantiate(args[0], TestRegistryProvider.class).registry();
            if (args.length == 2) {
                instantiate(args[1], WorkerInitializer.class).initialize();
            }
        } catch (Exception e) {
            log.error("Worker startup failed", e);
            System.exit(EXIT_STARTUP_FAILURE);
            return;
        }

        try {
            serve(registry, new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), protocol, new OutcomeCodec());
        } catch (IOException e) {
            log.error("Worker lost its input stream", e);
            System.exit(EXIT_STARTUP_FAILURE);
        }
    }

    /**
     * 요청 처리 루프.
     *
     * @param registry 항목 복원용 레지스트리
     * @param requests TestId 요청 스트림
     * @param responses Outcome 응답 스트림
     * @param codec 메시지 코덱
     * @throws IOException 요청 스트림을 읽을 수 없는 경우
     */
    static void serve(TestRegistry registry, BufferedReader requests, PrintStream responses, OutcomeCodec codec)
            throws IOException {
        String line;
        while ((line = requests.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            responses.println(handle(registry, line, codec));
            responses.flush();
        }
    }

    static String handle(TestRegistry registry, String line, OutcomeCodec codec) {
        TestId id;
        try {
            id = codec.decodeId(line);
        } catch (WorkerException | IllegalArgumentException e) {
            return codec.encodeError(e.getMessage());
        }
        Optional<TestItem> item = registry.find(id);
        if (item.isEmpty()) {
            return codec.encodeError("Unknown test: " + id);
        }
        List<Outcome> outcomes = IsolatedItemRunner.run(item.get());
        return codec.encodeBatch(outcomes);
    }

    private static <T> T instantiate(String className, Class<T> type) throws ReflectiveOperationException {
        Class<?> clazz = Class.forName(className);
        if (!type.isAssignableFrom(clazz)) {
            throw new IllegalArgumentException(className + " does not implement " + type.getName());
        }
        return type.cast(clazz.getDeclaredConstructor().newInstance());
    }
}
