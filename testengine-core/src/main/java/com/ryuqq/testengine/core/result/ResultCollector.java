package com.ryuqq.testengine.core.result;

import com.ryuqq.testengine.core.model.ErrorPlaceholder;
import com.ryuqq.testengine.core.model.Outcome;
import com.ryuqq.testengine.core.model.TestDuration;
import com.ryuqq.testengine.core.model.TestId;
import com.ryuqq.testengine.core.model.TestItem;
import com.ryuqq.testengine.core.model.TestStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 모든 테스트 생명주기 이벤트가 지나가는 단일 깔때기.
 *
 * <p>ResultCollector는 Outcome을 만들고, 테스트 출력 캡처를 관리하고,
 * 등록된 ResultHandler에게 이벤트를 전달하며, 실행 전체의 성공 여부와
 * 중단 여부를 추적합니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>시작 시각 기록 (TestId 기준, 프로세스 경계를 넘어서도 연결 가능)</li>
 *   <li>Outcome 생성 및 상태별 분류</li>
 *   <li>핸들러 디스패치 (사용자 핸들러 → 코어 핸들러 순서)</li>
 *   <li>sticky 성공 플래그, sticky 중단 플래그, fail-fast</li>
 * </ul>
 *
 * <p><strong>생명주기:</strong></p>
 * <pre>
 * startRun
 *   ↓
 * startTest(item)          → 시작 시각 기록, 출력 싱크 할당
 *   ↓
 * addSuccess / addFailure / addError / addSkip / ...
 *   → reportOutcome        → Outcome 생성 (startTest 없으면 IllegalStateException)
 *   → addOutcome           → 분류, 성공 플래그 갱신, 핸들러 디스패치
 *   ↓
 * stopTest(item)           → 출력 버퍼 폐기
 *   ↓
 * stopRun
 * </pre>
 *
 * <p><strong>동시성:</strong> 이 클래스는 thread-safe하지 않습니다.
 * 하나의 수집기는 한 스레드에서만 사용해야 하며, 병렬 실행 시 워커마다
 * 별도의 수집기를 사용하고 부모 수집기로는 한 스레드에서 결과를 재생합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ResultCollector {

    private static final Logger log = LoggerFactory.getLogger(ResultCollector.class);

    private static final Comparator<ResultHandler> BY_CLASS_NAME =
        Comparator.comparing(handler -> handler.getClass().getName());

    private final CollectorConfig config;
    private final Clock clock;
    private final List<ResultHandler> handlers = new ArrayList<>();
    private final Map<TestId, Instant> startTimes = new HashMap<>();
    private final Map<TestStatus, List<Outcome>> outcomes = new EnumMap<>(TestStatus.class);

    private List<ResultHandler> sortedHandlers;
    private CapturedOutput currentOutput;
    private int testsRun;
    private int successCount;
    private boolean successful = true;
    private volatile boolean shouldStop;

    /**
     * 기본 설정으로 생성.
     */
    public ResultCollector() {
        this(new CollectorConfig());
    }

    /**
     * 생성자 (시스템 UTC 시계 사용).
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public ResultCollector(CollectorConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * 생성자 (시계 주입).
     *
     * @param config 설정
     * @param clock 시작/종료 시각에 사용할 시계
     * @throws IllegalArgumentException config 또는 clock이 null인 경우
     */
    public ResultCollector(CollectorConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
        for (TestStatus status : TestStatus.values()) {
            if (status != TestStatus.SUCCESS) {
                outcomes.put(status, new ArrayList<>());
            }
        }
    }

    public CollectorConfig config() {
        return config;
    }

    /**
     * 핸들러 등록.
     *
     * <p>등록 시 정렬 캐시가 무효화됩니다.</p>
     *
     * @param handler 등록할 핸들러
     * @throws IllegalArgumentException handler가 null인 경우
     */
    public void addResultHandler(ResultHandler handler) {
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        handlers.add(handler);
        sortedHandlers = null;
    }

    /**
     * 디스패치 순서대로 정렬된 핸들러.
     *
     * <p>사용자 핸들러가 먼저, {@link CoreResultHandler}가 나중에 오며
     * 각 묶음 안에서는 클래스 이름 순입니다 (같은 클래스는 등록 순서 유지).</p>
     *
     * @return 불변 리스트
     */
    public List<ResultHandler> handlers() {
        if (sortedHandlers == null) {
            List<ResultHandler> user = new ArrayList<>();
            List<ResultHandler> core = new ArrayList<>();
            for (ResultHandler handler : handlers) {
                if (handler instanceof CoreResultHandler) {
                    core.add(handler);
                } else {
                    user.add(handler);
                }
            }
            user.sort(BY_CLASS_NAME);
            core.sort(BY_CLASS_NAME);
            List<ResultHandler> sorted = new ArrayList<>(user.size() + core.size());
            sorted.addAll(user);
            sorted.addAll(core);
            sortedHandlers = Collections.unmodifiableList(sorted);
        }
        return sortedHandlers;
    }

    public void startRun() {
        for (ResultHandler handler : handlers()) {
            handler.startTestRun();
        }
    }

    public void stopRun() {
        for (ResultHandler handler : handlers()) {
            handler.stopTestRun();
        }
    }

    /**
     * 개별 테스트 시작 (현재 시각).
     *
     * @param item 시작하는 테스트
     */
    public void startTest(TestItem item) {
        startTest(item, clock.instant());
    }

    /**
     * 개별 테스트 시작 (시작 시각 지정).
     *
     * <p>병렬 실행에서 워커가 기록한 원래 시작 시각으로 결과를 재생할 때 사용합니다.</p>
     *
     * @param item 시작하는 테스트
     * @param startTime 시작 시각
     * @throws IllegalArgumentException item 또는 startTime이 null인 경우
     */
    public void startTest(TestItem item, Instant startTime) {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        if (startTime == null) {
            throw new IllegalArgumentException("startTime cannot be null");
        }
        startTimes.put(item.id(), startTime);
        currentOutput = config.captureOutput() ? CapturedOutput.buffered() : CapturedOutput.passthrough();
        testsRun++;
        for (ResultHandler handler : handlers()) {
            handler.startTest(item);
        }
    }

    /**
     * 개별 테스트 종료.
     *
     * <p>캡처된 출력은 폐기됩니다. FAILURE/ERROR였다면 이미 예외 텍스트에 병합된 상태입니다.</p>
     *
     * @param item 종료된 테스트
     */
    public void stopTest(TestItem item) {
        for (ResultHandler handler : handlers()) {
            handler.stopTest(item);
        }
        startTimes.remove(item.id());
        if (currentOutput != null) {
            currentOutput.discard();
            currentOutput = null;
        }
    }

    /**
     * 현재 테스트에 할당된 출력 싱크.
     *
     * @return 실행 중인 테스트가 없으면 passthrough 싱크
     */
    public CapturedOutput currentOutput() {
        return currentOutput == null ? CapturedOutput.passthrough() : currentOutput;
    }

    public Outcome addSuccess(TestItem item) {
        return reportOutcome(item, TestStatus.SUCCESS, null, null);
    }

    public Outcome addFailure(TestItem item, Throwable exception) {
        return reportOutcome(item, TestStatus.FAILURE, exception, null);
    }

    public Outcome addError(TestItem item, Throwable exception) {
        return reportOutcome(item, TestStatus.ERROR, exception, null);
    }

    public Outcome addSkip(TestItem item, String reason) {
        return reportOutcome(item, TestStatus.SKIPPED, null, reason);
    }

    public Outcome addExpectedFailure(TestItem item, Throwable exception) {
        return reportOutcome(item, TestStatus.EXPECTED_FAILURE, exception, null);
    }

    public Outcome addUnexpectedSuccess(TestItem item) {
        return reportOutcome(item, TestStatus.UNEXPECTED_SUCCESS, null, null);
    }

    /**
     * 결과 보고.
     *
     * <p>startTest로 기록된 시작 시각이 없으면 생명주기 짝이 깨진 것이므로
     * {@link IllegalStateException}을 던집니다. {@link ErrorPlaceholder}는 예외이며
     * 시작 시각이 없으면 현재 시각을 사용합니다.</p>
     *
     * @param item 결과를 만든 테스트
     * @param status 완료 상태
     * @param exception 원인 예외 (null 가능)
     * @param message 부가 메시지 (null 가능)
     * @return 생성된 Outcome
     * @throws IllegalArgumentException item 또는 status가 null인 경우
     * @throws IllegalStateException 일반 항목이 startTest 없이 보고된 경우
     */
    public Outcome reportOutcome(TestItem item, TestStatus status, Throwable exception, String message) {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }

        Instant stop = clock.instant();
        Instant start = startTimes.get(item.id());
        if (start == null) {
            if (!(item instanceof ErrorPlaceholder)) {
                throw new IllegalStateException(
                    "Outcome reported for " + item.id() + " without a matching startTest"
                );
            }
            start = stop;
        }
        if (stop.isBefore(start)) {
            stop = start;
        }

        Outcome outcome = new Outcome(
            item.id(),
            status,
            formatException(status, exception),
            message,
            TestDuration.between(start, stop)
        );
        addOutcome(outcome);
        return outcome;
    }

    /**
     * 이미 만들어진 Outcome 추가.
     *
     * <p>워커 프로세스 등 다른 수집기가 만든 결과를 모을 때도 사용됩니다.</p>
     *
     * @param outcome 추가할 결과
     * @throws IllegalArgumentException outcome이 null인 경우
     */
    public void addOutcome(Outcome outcome) {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        TestStatus status = outcome.status();

        if (config.failFast() && status.isFailing()) {
            stop();
        }

        if (status == TestStatus.SUCCESS) {
            successCount++;
        } else {
            outcomes.get(status).add(outcome);
        }
        if (successful && !status.isSuccessful()) {
            successful = false;
            log.debug("Run marked unsuccessful by {} ({})", outcome.testId(), status);
        }

        for (ResultHandler handler : handlers()) {
            handler.handle(outcome);
        }
    }

    /**
     * 실행 중단 요청 (sticky).
     */
    public void stop() {
        if (!shouldStop) {
            log.debug("Stop requested");
        }
        shouldStop = true;
    }

    public boolean shouldStop() {
        return shouldStop;
    }

    /**
     * 실행 전체 성공 여부.
     *
     * @return FAILURE, ERROR, UNEXPECTED_SUCCESS가 한 번도 없었으면 true
     */
    public boolean wasSuccessful() {
        return successful;
    }

    public int testsRun() {
        return testsRun;
    }

    public int successCount() {
        return successCount;
    }

    public List<Outcome> failures() {
        return outcomes(TestStatus.FAILURE);
    }

    public List<Outcome> errors() {
        return outcomes(TestStatus.ERROR);
    }

    public List<Outcome> skipped() {
        return outcomes(TestStatus.SKIPPED);
    }

    public List<Outcome> expectedFailures() {
        return outcomes(TestStatus.EXPECTED_FAILURE);
    }

    public List<Outcome> unexpectedSuccesses() {
        return outcomes(TestStatus.UNEXPECTED_SUCCESS);
    }

    /**
     * 상태별로 분류된 결과.
     *
     * @param status SUCCESS를 제외한 상태
     * @return 불변 리스트 (보고 순서)
     * @throws IllegalArgumentException status가 SUCCESS인 경우 (성공은 개수만 셈)
     */
    public List<Outcome> outcomes(TestStatus status) {
        if (status == TestStatus.SUCCESS) {
            throw new IllegalArgumentException("SUCCESS outcomes are counted, not retained");
        }
        return Collections.unmodifiableList(outcomes.get(status));
    }

    private String formatException(TestStatus status, Throwable exception) {
        if (exception == null) {
            return null;
        }
        if (currentOutput != null && (status == TestStatus.FAILURE || status == TestStatus.ERROR)) {
            String formatted = ExceptionFormatter.format(exception, currentOutput.stdout(), currentOutput.stderr());
            currentOutput.discard();
            return formatted;
        }
        return ExceptionFormatter.format(exception);
    }
}
