package com.ryuqq.testengine.core.model;

/**
 * 모듈 단위의 그룹 묶음.
 *
 * <p>네임스페이스는 선택적으로 setUp/tearDown 훅을 선언할 수 있으며, 실행 중
 * 해당 네임스페이스에 처음 진입할 때 setUp이, 마지막으로 벗어날 때 tearDown이
 * 정확히 한 번씩 실행됩니다.</p>
 *
 * <p><strong>동일성:</strong> 이름 기준 (같은 이름이면 같은 네임스페이스)</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Namespace billing = Namespace.builder("billing")
 *     .setUp(() -&gt; database.start())
 *     .tearDown(() -&gt; database.stop())
 *     .build();
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Namespace {

    private final String name;
    private final FixtureHook setUp;
    private final FixtureHook tearDown;

    private Namespace(String name, FixtureHook setUp, FixtureHook tearDown) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
        this.setUp = setUp == null ? FixtureHook.NO_OP : setUp;
        this.tearDown = tearDown == null ? FixtureHook.NO_OP : tearDown;
    }

    /**
     * 훅 없는 Namespace 생성.
     *
     * @param name 네임스페이스 이름
     * @return Namespace 인스턴스
     * @throws IllegalArgumentException name이 null이거나 빈 문자열인 경우
     */
    public static Namespace of(String name) {
        return new Namespace(name, null, null);
    }

    /**
     * Builder 생성.
     *
     * @param name 네임스페이스 이름
     * @return Builder
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public FixtureHook setUp() {
        return setUp;
    }

    public FixtureHook tearDown() {
        return tearDown;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Namespace namespace = (Namespace) o;
        return name.equals(namespace.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "Namespace{" + name + '}';
    }

    /**
     * Namespace Builder.
     */
    public static final class Builder {

        private final String name;
        private FixtureHook setUp;
        private FixtureHook tearDown;

        private Builder(String name) {
            this.name = name;
        }

        public Builder setUp(FixtureHook setUp) {
            this.setUp = setUp;
            return this;
        }

        public Builder tearDown(FixtureHook tearDown) {
            this.tearDown = tearDown;
            return this;
        }

        public Namespace build() {
            return new Namespace(name, setUp, tearDown);
        }
    }
}
