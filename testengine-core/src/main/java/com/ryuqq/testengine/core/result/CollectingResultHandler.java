package com.ryuqq.testengine.core.result;

import com.ryuqq.testengine.core.model.Outcome;
import com.ryuqq.testengine.core.model.TestItem;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 전달받은 Outcome을 보고 순서대로 모아 두는 핸들러.
 *
 * <p>병렬 워커가 자신의 결과 묶음을 부모에게 돌려보낼 때 사용합니다.
 * 실행 시작/종료 시각도 함께 기록합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CollectingResultHandler implements ResultHandler {

    private final Clock clock;
    private final List<Outcome> outcomes = new ArrayList<>();
    private Instant startedAt;
    private Instant stoppedAt;

    public CollectingResultHandler() {
        this(Clock.systemUTC());
    }

    public CollectingResultHandler(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public void startTest(TestItem item) {
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
    }

    @Override
    public void handle(Outcome outcome) {
        outcomes.add(outcome);
    }

    public List<Outcome> outcomes() {
        return Collections.unmodifiableList(outcomes);
    }

    /**
     * 실행 시작 시각.
     *
     * @return startTestRun 이전이면 null
     */
    public Instant startedAt() {
        return startedAt;
    }

    /**
     * 실행 종료 시각.
     *
     * @return stopTestRun 이전이면 null
     */
    public Instant stoppedAt() {
        return stoppedAt;
    }
}
