package com.ryuqq.testengine.core.result;

import com.ryuqq.testengine.core.model.Outcome;
import com.ryuqq.testengine.core.model.TestItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 가장 느린 테스트와 실행 시간 통계를 로깅하는 기본 핸들러.
 *
 * <p>stopTestRun 시점에 느린 순으로 N개의 테스트와 평균, 표준편차, 중앙값,
 * 80/90/95/99 백분위 실행 시간을 남깁니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TimingResultHandler implements CoreResultHandler {

    private static final Logger log = LoggerFactory.getLogger(TimingResultHandler.class);
    private static final int DEFAULT_NUMBER_TO_SUMMARIZE = 10;

    private final int numberToSummarize;
    private final List<Outcome> outcomes = new ArrayList<>();

    public TimingResultHandler() {
        this(DEFAULT_NUMBER_TO_SUMMARIZE);
    }

    /**
     * 생성자.
     *
     * @param numberToSummarize 보고할 느린 테스트 수 (양수)
     * @throws IllegalArgumentException numberToSummarize가 양수가 아닌 경우
     */
    public TimingResultHandler(int numberToSummarize) {
        if (numberToSummarize <= 0) {
            throw new IllegalArgumentException(
                "numberToSummarize must be positive (current: " + numberToSummarize + ")"
            );
        }
        this.numberToSummarize = numberToSummarize;
    }

    @Override
    public void startTest(TestItem item) {
    }

    @Override
    public void stopTest(TestItem item) {
    }

    @Override
    public void startTestRun() {
    }

    @Override
    public void stopTestRun() {
        log.info("Test timing report\n{}", report());
    }

    @Override
    public void handle(Outcome outcome) {
        outcomes.add(outcome);
    }

    /**
     * 실행 시간 내림차순으로 정렬된 결과.
     *
     * @return 가장 느린 결과가 앞에 오는 리스트
     */
    public List<Outcome> slowest() {
        List<Outcome> sorted = new ArrayList<>(outcomes);
        sorted.sort(Comparator.comparing(Outcome::duration).reversed());
        return sorted.subList(0, Math.min(numberToSummarize, sorted.size()));
    }

    /**
     * 보고서 텍스트.
     *
     * @return 느린 테스트 목록과 통계 표
     */
    public String report() {
        if (outcomes.isEmpty()) {
            return "  (no tests)";
        }
        List<Duration> durations = new ArrayList<>(outcomes.size());
        for (Outcome outcome : outcomes) {
            durations.add(outcome.duration().elapsed());
        }
        durations.sort(Comparator.reverseOrder());

        StringBuilder text = new StringBuilder();
        for (Outcome outcome : slowest()) {
            text.append("  ").append(outcome.duration()).append(' ').append(outcome.testId()).append('\n');
        }
        text.append('\n');

        int count = durations.size();
        text.append("  Mean    ").append(format(mean(durations))).append('\n');
        text.append("  Std Dev ").append(count > 1 ? format(standardDeviation(durations)) : "-").append('\n');
        text.append("  Median  ").append(format(median(durations))).append('\n');
        text.append("  80%     ").append(format(durations.get((int) (count * 0.20)))).append('\n');
        text.append("  90%     ").append(format(durations.get((int) (count * 0.10)))).append('\n');
        text.append("  95%     ").append(format(durations.get((int) (count * 0.05)))).append('\n');
        text.append("  99%     ").append(format(durations.get((int) (count * 0.01))));
        return text.toString();
    }

    static Duration mean(List<Duration> durations) {
        long totalNanos = 0;
        for (Duration duration : durations) {
            totalNanos += duration.toNanos();
        }
        return Duration.ofNanos(totalNanos / durations.size());
    }

    static Duration median(List<Duration> durations) {
        List<Duration> ascending = new ArrayList<>(durations);
        ascending.sort(Comparator.naturalOrder());
        int middle = ascending.size() / 2;
        if (ascending.size() % 2 == 1) {
            return ascending.get(middle);
        }
        return ascending.get(middle - 1).plus(ascending.get(middle)).dividedBy(2);
    }

    static Duration standardDeviation(List<Duration> durations) {
        double meanNanos = mean(durations).toNanos();
        double sumOfSquares = 0;
        for (Duration duration : durations) {
            double delta = duration.toNanos() - meanNanos;
            sumOfSquares += delta * delta;
        }
        return Duration.ofNanos(Math.round(Math.sqrt(sumOfSquares / (durations.size() - 1))));
    }

    private static String format(Duration duration) {
        return String.format("%d:%02d:%02d.%03d",
            duration.toHours(), duration.toMinutesPart(), duration.toSecondsPart(), duration.toMillisPart());
    }
}
