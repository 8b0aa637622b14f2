package com.ryuqq.railway.core.schedule;

import java.time.DayOfWeek;

/**
 * cron 기반 {@link Schedule} 헬퍼. 5필드(분 시 일 월 요일) 표현식을 만듭니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Cron {

    private Cron() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static Schedule minutely() {
        return Schedule.fromCron("* * * * *");
    }

    public static Schedule hourly(int minute) {
        checkRange("minute", minute, 0, 59);
        return Schedule.fromCron(minute + " * * * *");
    }

    public static Schedule daily(int hour, int minute) {
        checkRange("hour", hour, 0, 23);
        checkRange("minute", minute, 0, 59);
        return Schedule.fromCron(minute + " " + hour + " * * *");
    }

    /**
     * 매주 지정 요일. cron 요일 번호는 일요일이 0입니다.
     */
    public static Schedule weekly(DayOfWeek day, int hour, int minute) {
        if (day == null) {
            throw new IllegalArgumentException("day cannot be null");
        }
        checkRange("hour", hour, 0, 23);
        checkRange("minute", minute, 0, 59);
        return Schedule.fromCron(minute + " " + hour + " * * " + (day.getValue() % 7));
    }

    public static Schedule monthly(int dayOfMonth, int hour, int minute) {
        checkRange("dayOfMonth", dayOfMonth, 1, 31);
        checkRange("hour", hour, 0, 23);
        checkRange("minute", minute, 0, 59);
        return Schedule.fromCron(minute + " " + hour + " " + dayOfMonth + " * *");
    }

    public static Schedule expression(String expression) {
        return Schedule.fromCron(expression);
    }

    private static void checkRange(String field, int value, int min, int max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(
                field + " must be between " + min + " and " + max + " (current: " + value + ")");
        }
    }
}
