package com.ryuqq.testengine.core.result;

/**
 * 엔진이 기본 제공하는 핸들러 표시용 인터페이스.
 *
 * <p>ResultCollector는 이 인터페이스를 구현한 핸들러를 사용자 핸들러 뒤에 배치합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CoreResultHandler extends ResultHandler {
}
