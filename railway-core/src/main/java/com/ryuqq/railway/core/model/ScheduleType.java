package com.ryuqq.railway.core.model;

/**
 * Manifest 실행 주기 유형.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ScheduleType {

    /** 수동 실행(trigger)만 가능. */
    NONE,

    /** cron 표현식의 다음 발생 시각. */
    CRON,

    /** 마지막 성공 시각 + 간격. */
    INTERVAL,

    /** 부모 Manifest가 성공한 뒤 실행. */
    DEPENDENT
}
