package com.ryuqq.testengine.core.model;

import com.ryuqq.testengine.core.result.ResultCollector;

import java.util.Objects;

/**
 * 테스트 본문 밖에서 발생한 실패를 대신하는 합성 항목.
 *
 * <p>수집(discovery) 단계의 오류나 그룹/네임스페이스 훅 실패를 하나의 항목처럼
 * 보고하기 위해 사용됩니다. 항상 ERROR Outcome 하나만 만들어내며,
 * startTest 없이 결과를 보고해도 생명주기 위반으로 간주되지 않습니다.</p>
 *
 * <p>훅이 없는 합성 그룹/네임스페이스에 속하므로 FixtureState는 이 항목을
 * 일반 항목과 같은 방식으로 다룹니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ErrorPlaceholder implements TestItem {

    private static final Group PLACEHOLDER_GROUP =
        Group.builder(Namespace.of("<error>"), "ErrorPlaceholder").build();

    private final String description;
    private final Throwable cause;
    private final TestId id;

    private ErrorPlaceholder(String description, Throwable cause) {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("description cannot be null or blank");
        }
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
        this.description = description;
        this.cause = cause;
        this.id = TestId.of(PLACEHOLDER_GROUP.qualifiedName(), description);
    }

    /**
     * ErrorPlaceholder 생성.
     *
     * @param description 오류 설명 (예: {@code groupSetUp (billing.InvoiceTests)})
     * @param cause 원인 예외
     * @return ErrorPlaceholder 인스턴스
     * @throws IllegalArgumentException description이 비어 있거나 cause가 null인 경우
     */
    public static ErrorPlaceholder of(String description, Throwable cause) {
        return new ErrorPlaceholder(description, cause);
    }

    public String description() {
        return description;
    }

    public Throwable cause() {
        return cause;
    }

    @Override
    public TestId id() {
        return id;
    }

    @Override
    public Group group() {
        return PLACEHOLDER_GROUP;
    }

    @Override
    public void run(ResultCollector collector) {
        collector.startTest(this);
        try {
            collector.addError(this, cause);
        } finally {
            collector.stopTest(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ErrorPlaceholder that = (ErrorPlaceholder) o;
        return description.equals(that.description) && cause.equals(that.cause);
    }

    @Override
    public int hashCode() {
        return Objects.hash(description, cause);
    }

    @Override
    public String toString() {
        return description;
    }
}
