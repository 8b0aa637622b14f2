package com.ryuqq.railway.adapter.runner;

/**
 * 실패한 실행의 후속 처리 결과.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum FailureDisposition {

    /** 백오프 후 다시 큐에 넣음 */
    RETRY_SCHEDULED,

    /** 재시도 한도 소진으로 DeadLetter 생성 */
    DEAD_LETTERED,

    /** Manifest와 연결되지 않은 실행이라 후속 처리 없음 */
    IGNORED
}
