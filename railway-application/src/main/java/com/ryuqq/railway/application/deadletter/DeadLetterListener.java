package com.ryuqq.railway.application.deadletter;

import com.ryuqq.railway.core.model.DeadLetter;

/**
 * 새 DeadLetter 알림 수신자 (알림, 온콜 호출 등).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface DeadLetterListener {

    /**
     * 커밋된 DeadLetter 알림. 예외는 로그만 남기고 무시됩니다.
     *
     * @param deadLetter 새로 생성된 DeadLetter
     */
    void onDeadLettered(DeadLetter deadLetter);
}
