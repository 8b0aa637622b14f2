package com.ryuqq.railway.core.schedule;

import com.ryuqq.railway.core.model.ScheduleType;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Schedule, Every, Cron 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ScheduleTest {

    @Test
    void every_CreatesIntervalSchedule() {
        // When
        Schedule schedule = Every.minutes(15);

        // Then
        assertEquals(ScheduleType.INTERVAL, schedule.type());
        assertEquals(Duration.ofMinutes(15), schedule.interval());
        assertNull(schedule.cronExpression());
    }

    @Test
    void every_ZeroOrNegative_ThrowsIllegalArgumentException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> Every.seconds(0));
        assertThrows(IllegalArgumentException.class, () -> Every.hours(-1));
    }

    @Test
    void cron_Helpers_BuildFiveFieldExpressions() {
        // When & Then
        assertEquals("* * * * *", Cron.minutely().cronExpression());
        assertEquals("15 * * * *", Cron.hourly(15).cronExpression());
        assertEquals("30 2 * * *", Cron.daily(2, 30).cronExpression());
        assertEquals("0 9 * * 1", Cron.weekly(DayOfWeek.MONDAY, 9, 0).cronExpression());
        assertEquals("0 9 * * 0", Cron.weekly(DayOfWeek.SUNDAY, 9, 0).cronExpression());
        assertEquals("0 0 1 * *", Cron.monthly(1, 0, 0).cronExpression());
    }

    @Test
    void cron_OutOfRange_ThrowsIllegalArgumentException() {
        // When
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class, () -> Cron.daily(24, 0));

        // Then
        assertTrue(exception.getMessage().contains("hour must be between 0 and 23"));
    }

    @Test
    void new_CronWithInterval_ThrowsIllegalArgumentException() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> new Schedule(ScheduleType.CRON, Duration.ofMinutes(1), "* * * * *"));
        assertThrows(IllegalArgumentException.class,
            () -> new Schedule(ScheduleType.NONE, null, "* * * * *"));
        assertThrows(IllegalArgumentException.class, () -> Cron.expression(" "));
    }

    @Test
    void manualAndDependent_HaveNoTiming() {
        // When & Then
        assertEquals(ScheduleType.NONE, Schedule.manual().type());
        assertEquals(ScheduleType.DEPENDENT, Schedule.dependent().type());
        assertNull(Schedule.dependent().interval());
    }
}
