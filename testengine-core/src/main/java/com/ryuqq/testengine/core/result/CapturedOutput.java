package com.ryuqq.testengine.core.result;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * 실행 중인 테스트 하나에 할당되는 출력 싱크.
 *
 * <p>전역 {@code System.out}/{@code System.err}를 교체하지 않고, 테스트 본문에
 * 명시적으로 전달되는 스트림 쌍입니다.</p>
 *
 * <ul>
 *   <li>buffered: 메모리 버퍼에 기록, FAILURE/ERROR 시 예외 텍스트에 병합</li>
 *   <li>passthrough: 원래 표준 출력/에러로 그대로 전달</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CapturedOutput {

    private final ByteArrayOutputStream stdoutBuffer;
    private final ByteArrayOutputStream stderrBuffer;
    private final PrintStream out;
    private final PrintStream err;

    private CapturedOutput(ByteArrayOutputStream stdoutBuffer, ByteArrayOutputStream stderrBuffer,
                           PrintStream out, PrintStream err) {
        this.stdoutBuffer = stdoutBuffer;
        this.stderrBuffer = stderrBuffer;
        this.out = out;
        this.err = err;
    }

    /**
     * 메모리 버퍼에 기록하는 싱크 생성.
     *
     * @return CapturedOutput 인스턴스
     */
    public static CapturedOutput buffered() {
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        ByteArrayOutputStream stderr = new ByteArrayOutputStream();
        return new CapturedOutput(
            stdout,
            stderr,
            new PrintStream(stdout, true, StandardCharsets.UTF_8),
            new PrintStream(stderr, true, StandardCharsets.UTF_8)
        );
    }

    /**
     * 현재 표준 출력/에러로 전달하는 싱크 생성.
     *
     * @return CapturedOutput 인스턴스
     */
    public static CapturedOutput passthrough() {
        return new CapturedOutput(null, null, System.out, System.err);
    }

    public PrintStream out() {
        return out;
    }

    public PrintStream err() {
        return err;
    }

    public boolean isBuffered() {
        return stdoutBuffer != null;
    }

    /**
     * 버퍼에 쌓인 표준 출력.
     *
     * @return 버퍼 내용 (passthrough면 빈 문자열)
     */
    public String stdout() {
        return stdoutBuffer == null ? "" : stdoutBuffer.toString(StandardCharsets.UTF_8);
    }

    /**
     * 버퍼에 쌓인 표준 에러.
     *
     * @return 버퍼 내용 (passthrough면 빈 문자열)
     */
    public String stderr() {
        return stderrBuffer == null ? "" : stderrBuffer.toString(StandardCharsets.UTF_8);
    }

    /**
     * 버퍼 내용 폐기.
     */
    public void discard() {
        if (stdoutBuffer != null) {
            out.flush();
            err.flush();
            stdoutBuffer.reset();
            stderrBuffer.reset();
        }
    }
}
