package com.ryuqq.testengine.core.result;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * 예외를 Outcome에 담을 텍스트로 변환.
 *
 * <p>스택 트레이스 뒤에 캡처된 출력을 {@code "\nStdout:\n..."}, {@code "\nStderr:\n..."}
 * 블록으로 덧붙입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ExceptionFormatter {

    static final String STDOUT_LINE = "\nStdout:\n";
    static final String STDERR_LINE = "\nStderr:\n";

    private ExceptionFormatter() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 예외 텍스트 생성 (출력 없음).
     *
     * @param exception 예외
     * @return 스택 트레이스 텍스트
     */
    public static String format(Throwable exception) {
        return format(exception, null, null);
    }

    /**
     * 예외 텍스트 생성.
     *
     * @param exception 예외
     * @param stdout 캡처된 표준 출력 (null 또는 빈 문자열이면 생략)
     * @param stderr 캡처된 표준 에러 (null 또는 빈 문자열이면 생략)
     * @return 스택 트레이스와 출력 블록을 이어 붙인 텍스트
     * @throws IllegalArgumentException exception이 null인 경우
     */
    public static String format(Throwable exception, String stdout, String stderr) {
        if (exception == null) {
            throw new IllegalArgumentException("exception cannot be null");
        }
        StringWriter writer = new StringWriter();
        exception.printStackTrace(new PrintWriter(writer));

        StringBuilder text = new StringBuilder(writer.toString());
        appendBlock(text, STDOUT_LINE, stdout);
        appendBlock(text, STDERR_LINE, stderr);
        return text.toString();
    }

    private static void appendBlock(StringBuilder text, String header, String content) {
        if (content == null || content.isEmpty()) {
            return;
        }
        text.append(header).append(content);
        if (!content.endsWith("\n")) {
            text.append('\n');
        }
    }
}
