package com.ryuqq.railway.core.statemachine;

/**
 * Workflow 실행(Metadata)의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING
 *    │
 *    ▼ (시작)
 * IN_PROGRESS
 *    │
 *    ├─► COMPLETED (성공)
 *    ├─► FAILED    (실패)
 *    └─► CANCELLED (취소)
 *
 * PENDING ─► FAILED / CANCELLED (시작 전 중단)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum WorkflowState {

    /**
     * 생성됨, 아직 실행 전.
     */
    PENDING,

    /**
     * 실행 중.
     */
    IN_PROGRESS,

    /**
     * 성공.
     */
    COMPLETED,

    /**
     * 실패.
     */
    FAILED,

    /**
     * 취소됨. 재시도 대상이 아님.
     */
    CANCELLED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED, FAILED, CANCELLED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * 아직 끝나지 않은 실행인지 확인.
     *
     * @return PENDING 또는 IN_PROGRESS인 경우 true
     */
    public boolean isActive() {
        return !isTerminal();
    }
}
