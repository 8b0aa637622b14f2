package com.ryuqq.railway.core.memory;

/**
 * 값이 없음을 나타내는 표식.
 *
 * <p>모든 TypedMemory는 이 값으로 시작하므로 입력이 필요 없는
 * {@code Step<Unit, X>}도 메모리 조회에 성공합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum Unit {
    INSTANCE
}
