package com.ryuqq.testengine.core.model;

/**
 * 테스트 항목의 식별자.
 *
 * <p>식별자는 (그룹, 메서드 이름) 쌍입니다. 인스턴스 동일성이 아닌 값 동일성을 사용하므로
 * 프로세스 경계를 넘어서도 시작 시각과 결과를 서로 연결할 수 있습니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>group: null 또는 빈 문자열 불가 (예: {@code billing.InvoiceTests})</li>
 *   <li>method: null 또는 빈 문자열 불가</li>
 * </ul>
 *
 * @param group 그룹의 정규화된 이름 (namespace.Group)
 * @param method 메서드 이름
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TestId(String group, String method) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException group 또는 method가 null이거나 빈 문자열인 경우
     */
    public TestId {
        if (group == null || group.isBlank()) {
            throw new IllegalArgumentException("group cannot be null or blank");
        }
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method cannot be null or blank");
        }
    }

    /**
     * TestId 생성.
     *
     * @param group 그룹 이름
     * @param method 메서드 이름
     * @return TestId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static TestId of(String group, String method) {
        return new TestId(group, method);
    }

    @Override
    public String toString() {
        return method + " (" + group + ")";
    }
}
