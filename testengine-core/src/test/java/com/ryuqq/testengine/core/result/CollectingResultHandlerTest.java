package com.ryuqq.testengine.core.result;

import com.ryuqq.testengine.core.model.Outcome;
import com.ryuqq.testengine.core.model.TestDuration;
import com.ryuqq.testengine.core.model.TestId;
import com.ryuqq.testengine.core.model.TestStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CollectingResultHandlerTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void handle_KeepsOutcomesInOrderAndRecordsRunBounds() {
        // Given
        MutableClock clock = new MutableClock(START);
        CollectingResultHandler handler = new CollectingResultHandler(clock);
        Outcome first = outcome("first", TestStatus.SUCCESS);
        Outcome second = outcome("second", TestStatus.SKIPPED);

        // When
        handler.startTestRun();
        handler.handle(first);
        handler.handle(second);
        clock.advance(Duration.ofSeconds(2));
        handler.stopTestRun();

        // Then
        assertThat(handler.outcomes()).containsExactly(first, second);
        assertThat(handler.startedAt()).isEqualTo(START);
        assertThat(handler.stoppedAt()).isEqualTo(START.plusSeconds(2));
    }

    @Test
    void outcomes_IsUnmodifiable() {
        // Given
        CollectingResultHandler handler = new CollectingResultHandler();

        // When & Then
        assertThatThrownBy(() -> handler.outcomes().add(outcome("x", TestStatus.SUCCESS)))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    private static Outcome outcome(String method, TestStatus status) {
        return new Outcome(new TestId("sample.Collecting", method), status, null, null,
            TestDuration.between(START, START));
    }
}
