package com.ryuqq.railway.core.schedule;

import com.ryuqq.railway.core.model.ScheduleType;

import java.time.Duration;

/**
 * Manifest 실행 주기 정의 (불변 record).
 *
 * <p>INTERVAL이면 interval만, CRON이면 cronExpression만 채워집니다.</p>
 *
 * @param type 주기 유형
 * @param interval 실행 간격 (INTERVAL 전용)
 * @param cronExpression cron 표현식 (CRON 전용)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Schedule(ScheduleType type, Duration interval, String cronExpression) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 유형과 필드 조합이 맞지 않는 경우
     */
    public Schedule {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (type == ScheduleType.INTERVAL) {
            if (interval == null || interval.isNegative() || interval.isZero()) {
                throw new IllegalArgumentException("interval must be positive (current: " + interval + ")");
            }
            if (cronExpression != null) {
                throw new IllegalArgumentException("INTERVAL schedule cannot have a cron expression");
            }
        } else if (type == ScheduleType.CRON) {
            if (cronExpression == null || cronExpression.isBlank()) {
                throw new IllegalArgumentException("cronExpression cannot be null or blank");
            }
            if (interval != null) {
                throw new IllegalArgumentException("CRON schedule cannot have an interval");
            }
        } else if (interval != null || cronExpression != null) {
            throw new IllegalArgumentException(type + " schedule cannot have an interval or cron expression");
        }
    }

    public static Schedule fromInterval(Duration interval) {
        return new Schedule(ScheduleType.INTERVAL, interval, null);
    }

    public static Schedule fromCron(String cronExpression) {
        return new Schedule(ScheduleType.CRON, null, cronExpression);
    }

    /**
     * trigger로만 실행되는 주기.
     */
    public static Schedule manual() {
        return new Schedule(ScheduleType.NONE, null, null);
    }

    /**
     * 부모 Manifest 성공 후 실행되는 주기.
     */
    public static Schedule dependent() {
        return new Schedule(ScheduleType.DEPENDENT, null, null);
    }
}
