package com.ryuqq.testengine.core.model;

import java.time.Duration;
import java.time.Instant;

/**
 * 테스트 실행 구간 (시작 시각, 종료 시각).
 *
 * <p><strong>불변식:</strong> start &le; stop</p>
 *
 * @param start 시작 시각
 * @param stop 종료 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TestDuration(Instant start, Instant stop) implements Comparable<TestDuration> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException start 또는 stop이 null이거나 stop이 start보다 앞선 경우
     */
    public TestDuration {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        if (stop == null) {
            throw new IllegalArgumentException("stop cannot be null");
        }
        if (stop.isBefore(start)) {
            throw new IllegalArgumentException(
                "stop must not be before start (start: " + start + ", stop: " + stop + ")"
            );
        }
    }

    /**
     * TestDuration 생성.
     *
     * @param start 시작 시각
     * @param stop 종료 시각
     * @return TestDuration 인스턴스
     */
    public static TestDuration between(Instant start, Instant stop) {
        return new TestDuration(start, stop);
    }

    /**
     * 경과 시간.
     *
     * @return stop - start
     */
    public Duration elapsed() {
        return Duration.between(start, stop);
    }

    @Override
    public int compareTo(TestDuration other) {
        return elapsed().compareTo(other.elapsed());
    }

    @Override
    public String toString() {
        Duration elapsed = elapsed();
        return String.format("%d:%02d:%02d.%03d",
            elapsed.toHours(), elapsed.toMinutesPart(), elapsed.toSecondsPart(), elapsed.toMillisPart());
    }
}
