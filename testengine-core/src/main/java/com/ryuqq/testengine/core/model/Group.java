package com.ryuqq.testengine.core.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 클래스 단위의 테스트 항목 묶음.
 *
 * <p>그룹은 테스트 메서드를 명시적으로 등록하는 표(registration table)입니다.
 * 리플렉션이나 이름 접두사 스캔 없이 Builder를 통해 (이름, 본문) 쌍을
 * 등록 순서대로 보관합니다.</p>
 *
 * <p><strong>훅 범위:</strong></p>
 * <ul>
 *   <li>setUp / tearDown: 그룹 범위 (그룹 진입/이탈 시 한 번)</li>
 *   <li>beforeEach / afterEach: 항목 범위 (항목마다 한 번)</li>
 * </ul>
 *
 * <p>skip 플래그가 설정된 그룹은 본문과 훅이 전혀 실행되지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Group invoices = Group.builder(billing, "InvoiceTests")
 *     .setUp(() -&gt; fixtures.load())
 *     .test("issue", context -&gt; assertIssued())
 *     .expectedFailure("refund", context -&gt; refund())
 *     .build();
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Group {

    private final Namespace namespace;
    private final String name;
    private final FixtureHook setUp;
    private final FixtureHook tearDown;
    private final TestBody beforeEach;
    private final TestBody afterEach;
    private final String skipReason;
    private final List<TestMethod> methods;
    private final List<TestItem> items;

    private Group(Builder builder) {
        this.namespace = builder.namespace;
        this.name = builder.name;
        this.setUp = builder.setUp;
        this.tearDown = builder.tearDown;
        this.beforeEach = builder.beforeEach;
        this.afterEach = builder.afterEach;
        this.skipReason = builder.skipReason;
        this.methods = List.copyOf(builder.methods);

        List<TestItem> created = new ArrayList<>(methods.size());
        for (TestMethod method : methods) {
            created.add(new RegisteredTest(this, method));
        }
        this.items = List.copyOf(created);
    }

    /**
     * Builder 생성.
     *
     * @param namespace 소속 네임스페이스
     * @param name 그룹 이름
     * @return Builder
     * @throws IllegalArgumentException namespace가 null이거나 name이 비어 있는 경우
     */
    public static Builder builder(Namespace namespace, String name) {
        if (namespace == null) {
            throw new IllegalArgumentException("namespace cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        return new Builder(namespace, name);
    }

    public Namespace namespace() {
        return namespace;
    }

    public String name() {
        return name;
    }

    /**
     * 정규화된 이름.
     *
     * @return namespace.name
     */
    public String qualifiedName() {
        return namespace.name() + "." + name;
    }

    public FixtureHook setUp() {
        return setUp;
    }

    public FixtureHook tearDown() {
        return tearDown;
    }

    public TestBody beforeEach() {
        return beforeEach;
    }

    public TestBody afterEach() {
        return afterEach;
    }

    public boolean isSkipped() {
        return skipReason != null;
    }

    /**
     * 건너뛴 사유.
     *
     * @return 사유 (skip 플래그가 없으면 null)
     */
    public String skipReason() {
        return skipReason;
    }

    public List<TestMethod> methods() {
        return methods;
    }

    /**
     * 등록 순서대로 생성된 테스트 항목.
     *
     * @return 불변 리스트
     */
    public List<TestItem> items() {
        return items;
    }

    /**
     * 그룹의 항목들로 구성된 스위트.
     *
     * @return TestSuite
     */
    public TestSuite suite() {
        return TestSuite.of(items);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Group group = (Group) o;
        return namespace.equals(group.namespace) && name.equals(group.name);
    }

    @Override
    public int hashCode() {
        return 31 * namespace.hashCode() + name.hashCode();
    }

    @Override
    public String toString() {
        return "Group{" + qualifiedName() + '}';
    }

    /**
     * Group Builder.
     */
    public static final class Builder {

        private final Namespace namespace;
        private final String name;
        private final List<TestMethod> methods = new ArrayList<>();
        private final Set<String> names = new HashSet<>();
        private FixtureHook setUp = FixtureHook.NO_OP;
        private FixtureHook tearDown = FixtureHook.NO_OP;
        private TestBody beforeEach = TestBody.NO_OP;
        private TestBody afterEach = TestBody.NO_OP;
        private String skipReason;

        private Builder(Namespace namespace, String name) {
            this.namespace = namespace;
            this.name = name;
        }

        public Builder setUp(FixtureHook setUp) {
            this.setUp = requireHook(setUp, "setUp");
            return this;
        }

        public Builder tearDown(FixtureHook tearDown) {
            this.tearDown = requireHook(tearDown, "tearDown");
            return this;
        }

        public Builder beforeEach(TestBody beforeEach) {
            this.beforeEach = requireHook(beforeEach, "beforeEach");
            return this;
        }

        public Builder afterEach(TestBody afterEach) {
            this.afterEach = requireHook(afterEach, "afterEach");
            return this;
        }

        /**
         * 그룹 전체를 건너뛰도록 표시.
         *
         * @param reason 건너뛴 사유
         * @return Builder
         */
        public Builder skip(String reason) {
            if (reason == null || reason.isBlank()) {
                throw new IllegalArgumentException("reason cannot be null or blank");
            }
            this.skipReason = reason;
            return this;
        }

        public Builder test(String methodName, TestBody body) {
            return register(new TestMethod(methodName, body, false, null));
        }

        public Builder expectedFailure(String methodName, TestBody body) {
            return register(new TestMethod(methodName, body, true, null));
        }

        public Builder skippedTest(String methodName, String reason) {
            return register(new TestMethod(methodName, TestBody.NO_OP, false, reason));
        }

        /**
         * 테스트 메서드 등록.
         *
         * @param method 등록할 메서드
         * @return Builder
         * @throws IllegalArgumentException 같은 이름이 이미 등록된 경우
         */
        public Builder register(TestMethod method) {
            if (method == null) {
                throw new IllegalArgumentException("method cannot be null");
            }
            if (!names.add(method.name())) {
                throw new IllegalArgumentException(
                    "Duplicate test method '" + method.name() + "' in group " + namespace.name() + "." + name
                );
            }
            methods.add(method);
            return this;
        }

        public Group build() {
            return new Group(this);
        }

        private static <T> T requireHook(T hook, String hookName) {
            if (hook == null) {
                throw new IllegalArgumentException(hookName + " cannot be null");
            }
            return hook;
        }
    }
}
