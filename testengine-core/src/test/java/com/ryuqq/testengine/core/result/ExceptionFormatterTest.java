package com.ryuqq.testengine.core.result;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExceptionFormatterTest {

    @Test
    void format_WithoutOutput_IsStackTraceOnly() {
        // When
        String text = ExceptionFormatter.format(new IllegalStateException("connection reset"));

        // Then
        assertThat(text)
            .startsWith("java.lang.IllegalStateException: connection reset")
            .contains("\tat ")
            .doesNotContain("Stdout:")
            .doesNotContain("Stderr:");
    }

    @Test
    void format_WithOutput_AppendsBlocksTerminatedByNewline() {
        // When
        String text = ExceptionFormatter.format(new AssertionError("broken"), "partial", "warn\n");

        // Then
        assertThat(text).endsWith("\nStdout:\npartial\n\nStderr:\nwarn\n");
    }

    @Test
    void format_EmptyOutput_OmitsBlock() {
        // When
        String text = ExceptionFormatter.format(new AssertionError("broken"), "", "warn");

        // Then
        assertThat(text).doesNotContain("Stdout:").endsWith("\nStderr:\nwarn\n");
    }

    @Test
    void format_NullException_ThrowsException() {
        // When & Then
        assertThatThrownBy(() -> ExceptionFormatter.format(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void capturedOutput_Buffered_CollectsAndDiscards() {
        // Given
        CapturedOutput output = CapturedOutput.buffered();
        output.out().println("line one");
        output.err().println("problem");

        // When
        String stdout = output.stdout();
        String stderr = output.stderr();
        output.discard();

        // Then
        assertThat(output.isBuffered()).isTrue();
        assertThat(stdout).isEqualTo("line one" + System.lineSeparator());
        assertThat(stderr).isEqualTo("problem" + System.lineSeparator());
        assertThat(output.stdout()).isEmpty();
    }

    @Test
    void capturedOutput_Passthrough_HasNoBuffer() {
        // When
        CapturedOutput output = CapturedOutput.passthrough();

        // Then
        assertThat(output.isBuffered()).isFalse();
        assertThat(output.out()).isSameAs(System.out);
        assertThat(output.stdout()).isEmpty();
    }
}
