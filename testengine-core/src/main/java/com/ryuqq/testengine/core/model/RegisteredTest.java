package com.ryuqq.testengine.core.model;

import com.ryuqq.testengine.core.result.ResultCollector;

/**
 * 그룹에 등록된 테스트 메서드 하나를 실행하는 리프 항목.
 *
 * <p><strong>실행 흐름:</strong></p>
 * <pre>
 * startTest
 *   ↓
 * 그룹/메서드 skip 표시 → SKIPPED
 *   ↓
 * beforeEach 실패 → ERROR (본문, afterEach 실행 안 함)
 *   ↓
 * body:
 *   - SkipTestException → SKIPPED
 *   - AssertionError    → FAILURE (expectedFailure면 EXPECTED_FAILURE)
 *   - 그 외 예외/Error   → ERROR   (expectedFailure면 EXPECTED_FAILURE)
 *   ↓
 * afterEach 실패 → ERROR (본문 결과와 별도로 추가 보고)
 *   ↓
 * 보고된 결과가 없으면 → SUCCESS (expectedFailure면 UNEXPECTED_SUCCESS)
 *   ↓
 * stopTest
 * </pre>
 *
 * <p>캡처된 출력은 첫 번째 FAILURE/ERROR 결과에만 병합됩니다.
 * 본문과 afterEach가 모두 실패하면 afterEach 오류에는 그 이후 출력만 포함됩니다.</p>
 *
 * <p>OutOfMemoryError 등 {@link FatalErrors} 대상 JVM 오류는 결과로 보고하지 않고 전파합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RegisteredTest implements TestItem {

    private final Group group;
    private final TestMethod method;
    private final TestId id;

    RegisteredTest(Group group, TestMethod method) {
        this.group = group;
        this.method = method;
        this.id = TestId.of(group.qualifiedName(), method.name());
    }

    @Override
    public TestId id() {
        return id;
    }

    @Override
    public Group group() {
        return group;
    }

    public TestMethod method() {
        return method;
    }

    @Override
    public void run(ResultCollector collector) {
        collector.startTest(this);
        try {
            execute(collector);
        } finally {
            collector.stopTest(this);
        }
    }

    private void execute(ResultCollector collector) {
        if (group.isSkipped()) {
            collector.addSkip(this, group.skipReason());
            return;
        }
        if (method.isSkipped()) {
            collector.addSkip(this, method.skipReason());
            return;
        }

        TestContext context = new TestContext(id, collector.currentOutput());

        try {
            group.beforeEach().run(context);
        } catch (SkipTestException e) {
            collector.addSkip(this, e.getMessage());
            return;
        } catch (Throwable e) {
            FatalErrors.rethrowIfFatal(e);
            collector.addError(this, e);
            return;
        }

        boolean reported = runBody(collector, context);

        try {
            group.afterEach().run(context);
        } catch (Throwable e) {
            FatalErrors.rethrowIfFatal(e);
            collector.addError(this, e);
            reported = true;
        }

        if (!reported) {
            if (method.expectedFailure()) {
                collector.addUnexpectedSuccess(this);
            } else {
                collector.addSuccess(this);
            }
        }
    }

    /**
     * 본문 실행 및 예외 분류.
     *
     * @return 본문 단계에서 결과가 보고되었으면 true
     */
    private boolean runBody(ResultCollector collector, TestContext context) {
        try {
            method.body().run(context);
            return false;
        } catch (SkipTestException e) {
            collector.addSkip(this, e.getMessage());
        } catch (AssertionError e) {
            if (method.expectedFailure()) {
                collector.addExpectedFailure(this, e);
            } else {
                collector.addFailure(this, e);
            }
        } catch (Throwable e) {
            FatalErrors.rethrowIfFatal(e);
            if (method.expectedFailure()) {
                collector.addExpectedFailure(this, e);
            } else {
                collector.addError(this, e);
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RegisteredTest that = (RegisteredTest) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return id.toString();
    }
}
