package com.ryuqq.railway.core.schedule;

/**
 * 스케줄 가능한 Workflow 입력 표식.
 *
 * <p>Manifest에 JSON으로 저장되었다가 실행 시점에 다시 읽히므로 구현 타입은 JSON 직렬화가 가능해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ManifestProperties {
}
