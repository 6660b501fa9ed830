package com.ryuqq.testengine.adapter.runner.worker;

import java.io.IOException;
import java.util.List;

/**
 * {@link ProcessBuilder} 기반 기본 {@link ProcessFactory}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class DefaultProcessFactory implements ProcessFactory {

    @Override
    public Process start(List<String> command) throws IOException {
        ProcessBuilder builder = new ProcessBuilder(command);
        // stdout은 프로토콜 전용, stderr는 별도로 로그로 흘려보냄
        builder.redirectErrorStream(false);
        return builder.start();
    }
}
