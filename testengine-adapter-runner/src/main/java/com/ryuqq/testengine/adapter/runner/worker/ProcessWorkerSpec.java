package com.ryuqq.testengine.adapter.runner.worker;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 프로세스 워커 실행 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>registryProviderClass: 워커가 항목을 복원할 {@link TestRegistryProvider} 구현 클래스 이름 (필수)</li>
 *   <li>initializerClass: {@link WorkerInitializer} 구현 클래스 이름 (null이면 사용 안 함)</li>
 *   <li>javaExecutable: java 실행 파일 (기본값: 현재 JVM의 java)</li>
 *   <li>classPath: 워커 클래스패스 (기본값: 현재 JVM의 java.class.path)</li>
 *   <li>jvmArgs: 추가 JVM 인자 (기본 없음)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param registryProviderClass TestRegistryProvider 클래스 이름
 * @param initializerClass WorkerInitializer 클래스 이름 (nullable)
 * @param javaExecutable java 실행 파일 경로
 * @param classPath 클래스패스
 * @param jvmArgs 추가 JVM 인자
 */
public record ProcessWorkerSpec(
    String registryProviderClass,
    String initializerClass,
    String javaExecutable,
    String classPath,
    List<String> jvmArgs
) {

    /**
     * 현재 JVM 기준 기본 설정 생성자.
     *
     * @param registryProviderClass TestRegistryProvider 클래스 이름
     */
    public ProcessWorkerSpec(String registryProviderClass) {
        this(
            registryProviderClass,
            null,
            Path.of(System.getProperty("java.home"), "bin", "java").toString(),
            System.getProperty("java.class.path"),
            List.of()
        );
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ProcessWorkerSpec {
        if (registryProviderClass == null || registryProviderClass.isBlank()) {
            throw new IllegalArgumentException("registryProviderClass cannot be null or blank");
        }
        if (initializerClass != null && initializerClass.isBlank()) {
            throw new IllegalArgumentException("initializerClass cannot be blank");
        }
        if (javaExecutable == null || javaExecutable.isBlank()) {
            throw new IllegalArgumentException("javaExecutable cannot be null or blank");
        }
        if (classPath == null || classPath.isBlank()) {
            throw new IllegalArgumentException("classPath cannot be null or blank");
        }
        if (jvmArgs == null) {
            throw new IllegalArgumentException("jvmArgs cannot be null");
        }
        jvmArgs = List.copyOf(jvmArgs);
    }

    public ProcessWorkerSpec withInitializerClass(String initializerClass) {
        return new ProcessWorkerSpec(registryProviderClass, initializerClass, javaExecutable, classPath, jvmArgs);
    }

    public ProcessWorkerSpec withJavaExecutable(String javaExecutable) {
        return new ProcessWorkerSpec(registryProviderClass, initializerClass, javaExecutable, classPath, jvmArgs);
    }

    public ProcessWorkerSpec withClassPath(String classPath) {
        return new ProcessWorkerSpec(registryProviderClass, initializerClass, javaExecutable, classPath, jvmArgs);
    }

    public ProcessWorkerSpec withJvmArgs(List<String> jvmArgs) {
        return new ProcessWorkerSpec(registryProviderClass, initializerClass, javaExecutable, classPath, jvmArgs);
    }

    /**
     * 워커 프로세스 실행 명령.
     *
     * @return java [jvmArgs] -cp classPath WorkerMain provider [initializer]
     */
    public List<String> command() {
        List<String> command = new ArrayList<>();
        command.add(javaExecutable);
        command.addAll(jvmArgs);
        command.add("-cp");
        command.add(classPath);
        command.add(WorkerMain.class.getName());
        command.add(registryProviderClass);
        if (initializerClass != null) {
            command.add(initializerClass);
        }
        return command;
    }
}
