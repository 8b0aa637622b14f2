package com.ryuqq.railway.core.model;

/**
 * DeadLetter 처리 상태. 운영자 조작으로만 바뀝니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum DeadLetterStatus {
    AWAITING_INTERVENTION,
    RETRIED,
    ACKNOWLEDGED
}
