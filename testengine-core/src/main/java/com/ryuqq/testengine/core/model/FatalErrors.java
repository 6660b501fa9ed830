package com.ryuqq.testengine.core.model;

/**
 * 테스트 코드가 던진 예외 중 실행을 계속할 수 없는 JVM 오류 판별.
 *
 * <p>{@link VirtualMachineError}는 그대로 전파하되,
 * {@link StackOverflowError}는 스택이 풀린 뒤 회복 가능하므로 ERROR 결과로 보고합니다.
 * 그 외 {@link Error}({@code ExceptionInInitializerError}, {@code NoClassDefFoundError} 등)는
 * 일반 예외와 같이 결과로 기록됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FatalErrors {

    private FatalErrors() {
    }

    /**
     * 치명적인 JVM 오류이면 다시 던짐.
     *
     * @param throwable 검사할 예외
     */
    public static void rethrowIfFatal(Throwable throwable) {
        if (throwable instanceof VirtualMachineError && !(throwable instanceof StackOverflowError)) {
            throw (VirtualMachineError) throwable;
        }
    }
}
