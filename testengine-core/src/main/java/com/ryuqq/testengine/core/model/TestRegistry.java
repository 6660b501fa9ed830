package com.ryuqq.testengine.core.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 그룹 → (이름, 본문) 목록의 명시적 등록 표.
 *
 * <p>레지스트리는 등록 순서를 유지하며, 두 가지 용도로 사용됩니다:</p>
 * <ul>
 *   <li>{@link #suite()}: 네임스페이스 → 그룹 → 항목으로 중첩된 스위트 생성</li>
 *   <li>{@link #find(TestId)}: 식별자로 항목 복원 (프로세스 워커가 부모로부터 받은 TestId를 실행할 때)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TestRegistry {

    private final Map<String, Group> groups;

    private TestRegistry(Map<String, Group> groups) {
        this.groups = groups;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 등록된 그룹 (등록 순서).
     *
     * @return 불변 리스트
     */
    public List<Group> groups() {
        return List.copyOf(groups.values());
    }

    /**
     * 식별자로 항목 조회.
     *
     * @param id 테스트 식별자
     * @return 항목 (없으면 empty)
     * @throws IllegalArgumentException id가 null인 경우
     */
    public Optional<TestItem> find(TestId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        Group group = groups.get(id.group());
        if (group == null) {
            return Optional.empty();
        }
        for (TestItem item : group.items()) {
            if (item.id().equals(id)) {
                return Optional.of(item);
            }
        }
        return Optional.empty();
    }

    /**
     * 등록 순서대로 중첩된 스위트 생성.
     *
     * <p>네임스페이스는 처음 등록된 순서, 그룹은 네임스페이스 안에서 등록된 순서를 따릅니다.</p>
     *
     * @return TestSuite (네임스페이스 스위트 → 그룹 스위트 → 항목)
     */
    public TestSuite suite() {
        Map<Namespace, List<SuiteNode>> byNamespace = new LinkedHashMap<>();
        for (Group group : groups.values()) {
            byNamespace.computeIfAbsent(group.namespace(), ns -> new ArrayList<>()).add(group.suite());
        }
        List<SuiteNode> namespaces = new ArrayList<>(byNamespace.size());
        for (List<SuiteNode> groupSuites : byNamespace.values()) {
            namespaces.add(TestSuite.of(groupSuites));
        }
        return TestSuite.of(namespaces);
    }

    /**
     * TestRegistry Builder.
     */
    public static final class Builder {

        private final Map<String, Group> groups = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * 그룹 등록.
         *
         * @param group 등록할 그룹
         * @return Builder
         * @throws IllegalArgumentException group이 null이거나 같은 이름이 이미 등록된 경우
         */
        public Builder register(Group group) {
            if (group == null) {
                throw new IllegalArgumentException("group cannot be null");
            }
            if (groups.putIfAbsent(group.qualifiedName(), group) != null) {
                throw new IllegalArgumentException("Duplicate group: " + group.qualifiedName());
            }
            return this;
        }

        public TestRegistry build() {
            return new TestRegistry(new LinkedHashMap<>(groups));
        }
    }
}
