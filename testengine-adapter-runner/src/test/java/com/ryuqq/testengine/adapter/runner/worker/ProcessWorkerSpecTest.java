package com.ryuqq.testengine.adapter.runner.worker;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProcessWorkerSpecTest {

    @Test
    void command_PutsJvmArgsBeforeClassPathAndProviderAfterMainClass() {
        // Given
        ProcessWorkerSpec spec = new ProcessWorkerSpec("com.example.Provider")
            .withJavaExecutable("/opt/jdk/bin/java")
            .withClassPath("a.jar:b.jar")
            .withJvmArgs(List.of("-Xmx256m"))
            .withInitializerClass("com.example.Init");

        // When
        List<String> command = spec.command();

        // Then
        assertThat(command).containsExactly(
            "/opt/jdk/bin/java", "-Xmx256m", "-cp", "a.jar:b.jar",
            WorkerMain.class.getName(), "com.example.Provider", "com.example.Init"
        );
    }

    @Test
    void command_WithoutInitializer_EndsWithProvider() {
        // Given
        ProcessWorkerSpec spec = new ProcessWorkerSpec("com.example.Provider");

        // When
        List<String> command = spec.command();

        // Then
        assertThat(command.get(0)).endsWith("java");
        assertThat(command.get(command.size() - 1)).isEqualTo("com.example.Provider");
        assertThat(command).contains("-cp", System.getProperty("java.class.path"));
    }

    @Test
    void constructor_BlankProvider_ThrowsException() {
        // When & Then
        assertThatThrownBy(() -> new ProcessWorkerSpec(" "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("registryProviderClass cannot be null or blank");
    }
}
