package com.ryuqq.testengine.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

/**
 * 순서가 있는 불변 테스트 스위트.
 *
 * <p>스위트는 {@link TestItem}과 하위 TestSuite를 선언된 순서대로 담습니다.
 * 생성 시점에 이미 만들어진 노드만 받을 수 있으므로 트리에 순환이 생길 수 없습니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>{@link #count()}는 리프 항목만 셉니다 (빈 하위 스위트는 0)</li>
 *   <li>두 스위트는 자식 노드 시퀀스가 순서대로 같을 때만 같습니다 (재귀적 비교)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TestSuite implements SuiteNode, Iterable<SuiteNode> {

    private static final TestSuite EMPTY = new TestSuite(List.of());

    private final List<SuiteNode> children;

    private TestSuite(List<? extends SuiteNode> children) {
        if (children == null) {
            throw new IllegalArgumentException("children cannot be null");
        }
        for (SuiteNode child : children) {
            if (child == null) {
                throw new IllegalArgumentException("children cannot contain null");
            }
        }
        this.children = List.copyOf(children);
    }

    /**
     * TestSuite 생성.
     *
     * @param children 자식 노드 (선언 순서)
     * @return TestSuite 인스턴스
     * @throws IllegalArgumentException children이 null이거나 null 원소를 포함한 경우
     */
    public static TestSuite of(SuiteNode... children) {
        if (children == null) {
            throw new IllegalArgumentException("children cannot be null");
        }
        return new TestSuite(Arrays.asList(children));
    }

    /**
     * TestSuite 생성.
     *
     * @param children 자식 노드 (선언 순서)
     * @return TestSuite 인스턴스
     * @throws IllegalArgumentException children이 null이거나 null 원소를 포함한 경우
     */
    public static TestSuite of(List<? extends SuiteNode> children) {
        return new TestSuite(children);
    }

    public static TestSuite empty() {
        return EMPTY;
    }

    public List<SuiteNode> children() {
        return children;
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    @Override
    public Iterator<SuiteNode> iterator() {
        return children.iterator();
    }

    @Override
    public int count() {
        int total = 0;
        for (SuiteNode child : children) {
            total += child.count();
        }
        return total;
    }

    /**
     * 트리를 전위 순회하여 리프 항목만 나열.
     *
     * @return 선언 순서의 리프 항목 리스트
     */
    public List<TestItem> leaves() {
        List<TestItem> leaves = new ArrayList<>();
        collectLeaves(this, leaves);
        return leaves;
    }

    private static void collectLeaves(TestSuite suite, List<TestItem> leaves) {
        for (SuiteNode child : suite.children) {
            if (child instanceof TestSuite) {
                collectLeaves((TestSuite) child, leaves);
            } else {
                leaves.add((TestItem) child);
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TestSuite suite = (TestSuite) o;
        return children.equals(suite.children);
    }

    @Override
    public int hashCode() {
        return children.hashCode();
    }

    @Override
    public String toString() {
        return "TestSuite{numberOfTests=" + count() + '}';
    }
}
