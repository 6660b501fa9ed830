package com.ryuqq.testengine.core.model;

/**
 * 그룹에 등록된 테스트 메서드 (이름, 본문) 쌍.
 *
 * @param name 메서드 이름
 * @param body 실행 본문
 * @param expectedFailure 실패가 예상되는지 여부
 * @param skipReason 건너뛴 사유 (null이면 건너뛰지 않음)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TestMethod(String name, TestBody body, boolean expectedFailure, String skipReason) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name이 null이거나 빈 문자열이거나 body가 null인 경우
     */
    public TestMethod {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
    }

    /**
     * 일반 테스트 메서드 생성.
     *
     * @param name 메서드 이름
     * @param body 실행 본문
     * @return TestMethod 인스턴스
     */
    public static TestMethod of(String name, TestBody body) {
        return new TestMethod(name, body, false, null);
    }

    /**
     * 건너뛰도록 표시되었는지 확인.
     *
     * @return skipReason이 있으면 true
     */
    public boolean isSkipped() {
        return skipReason != null;
    }
}
