package com.ryuqq.testengine.core.result;

import com.ryuqq.testengine.core.model.Outcome;
import com.ryuqq.testengine.core.model.TestItem;
import com.ryuqq.testengine.core.model.TestStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 실행 요약을 로깅하는 기본 핸들러.
 *
 * <p>결과를 상태별로 모아 두었다가 stopTestRun 시점에 FAILURE/ERROR 목록과
 * 요약 한 줄을 남깁니다.</p>
 *
 * <p><strong>요약 형식:</strong></p>
 * <pre>
 * Ran 12 tests in 0.314s
 *
 * FAILED (failures=1, errors=2, skipped=1)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SummaryResultHandler implements CoreResultHandler {

    private static final Logger log = LoggerFactory.getLogger(SummaryResultHandler.class);
    private static final String SEPARATOR = "-".repeat(70);

    private final Clock clock;
    private final Map<TestStatus, List<Outcome>> outcomes = new EnumMap<>(TestStatus.class);
    private int testsRun;
    private Instant startedAt;
    private Instant stoppedAt;

    public SummaryResultHandler() {
        this(Clock.systemUTC());
    }

    /**
     * 생성자 (시계 주입).
     *
     * @param clock 실행 시간 측정용 시계
     * @throws IllegalArgumentException clock이 null인 경우
     */
    public SummaryResultHandler(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
        for (TestStatus status : TestStatus.values()) {
            outcomes.put(status, new ArrayList<>());
        }
    }

    @Override
    public void startTest(TestItem item) {
        testsRun++;
    }

    @Override
    public void stopTest(TestItem item) {
    }

    @Override
    public void startTestRun() {
        startedAt = clock.instant();
    }

    @Override
    public void stopTestRun() {
        stoppedAt = clock.instant();
        logErrors("ERROR", outcomes.get(TestStatus.ERROR));
        logErrors("FAIL", outcomes.get(TestStatus.FAILURE));
        log.info("{}\n{}", SEPARATOR, summary());
    }

    @Override
    public void handle(Outcome outcome) {
        outcomes.get(outcome.status()).add(outcome);
    }

    public int testsRun() {
        return testsRun;
    }

    /**
     * 실행 전체 성공 여부.
     *
     * @return FAILURE, ERROR, UNEXPECTED_SUCCESS가 없으면 true
     */
    public boolean wasSuccessful() {
        return count(TestStatus.FAILURE) == 0
            && count(TestStatus.ERROR) == 0
            && count(TestStatus.UNEXPECTED_SUCCESS) == 0;
    }

    public int count(TestStatus status) {
        return outcomes.get(status).size();
    }

    /**
     * 요약 텍스트.
     *
     * @return "Ran N tests in X.XXXs" 줄과 OK / FAILED 줄
     */
    public String summary() {
        double seconds = elapsed().toNanos() / 1_000_000_000.0;
        StringBuilder text = new StringBuilder();
        text.append(String.format(Locale.ROOT, "Ran %d test%s in %.3fs%n%n",
            testsRun, testsRun != 1 ? "s" : "", seconds));

        List<String> infos = new ArrayList<>();
        if (wasSuccessful()) {
            text.append("OK");
        } else {
            text.append("FAILED");
            addInfo(infos, "failures", count(TestStatus.FAILURE));
            addInfo(infos, "errors", count(TestStatus.ERROR));
        }
        addInfo(infos, "skipped", count(TestStatus.SKIPPED));
        addInfo(infos, "expected failures", count(TestStatus.EXPECTED_FAILURE));
        addInfo(infos, "unexpected successes", count(TestStatus.UNEXPECTED_SUCCESS));
        if (!infos.isEmpty()) {
            text.append(" (").append(String.join(", ", infos)).append(')');
        }
        return text.toString();
    }

    private Duration elapsed() {
        if (startedAt == null || stoppedAt == null || stoppedAt.isBefore(startedAt)) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, stoppedAt);
    }

    private static void addInfo(List<String> infos, String label, int count) {
        if (count > 0) {
            infos.add(label + "=" + count);
        }
    }

    private static void logErrors(String kind, List<Outcome> errors) {
        for (Outcome outcome : errors) {
            log.warn("{}: {}\n{}\n{}", kind, outcome.testId(), SEPARATOR, outcome.exception());
        }
    }
}
