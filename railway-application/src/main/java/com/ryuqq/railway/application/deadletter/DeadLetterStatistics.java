package com.ryuqq.railway.application.deadletter;

/**
 * 상태별 DeadLetter 건수.
 *
 * @param awaitingIntervention 처리 대기
 * @param retried 재실행됨
 * @param acknowledged 확인 처리됨
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record DeadLetterStatistics(long awaitingIntervention, long retried, long acknowledged) {

    public long total() {
        return awaitingIntervention + retried + acknowledged;
    }
}
