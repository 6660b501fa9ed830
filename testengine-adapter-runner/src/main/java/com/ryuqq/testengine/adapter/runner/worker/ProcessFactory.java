package com.ryuqq.testengine.adapter.runner.worker;

import java.io.IOException;
import java.util.List;

/**
 * {@link ProcessBuilder} 추상화.
 *
 * <p>운영 코드는 {@link DefaultProcessFactory}를 사용하고, 테스트는 stdout/stderr와
 * 종료 동작을 제어하는 가짜 {@link Process}를 돌려주는 구현을 넣을 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
interface ProcessFactory {

    /**
     * 프로세스 시작.
     *
     * @param command 실행 파일이 첫 원소인 전체 명령
     * @return 시작된 Process
     * @throws IOException 프로세스를 시작할 수 없는 경우
     */
    Process start(List<String> command) throws IOException;
}
