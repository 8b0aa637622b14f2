package com.ryuqq.railway.core.schedule;

import java.time.Duration;

/**
 * 간격 기반 {@link Schedule} 헬퍼.
 *
 * <pre>
 * scheduler.schedule(SyncWorkflow.class, "sync-users", input, Every.minutes(5), ManifestOptions.defaults());
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Every {

    private Every() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static Schedule seconds(long seconds) {
        return Schedule.fromInterval(Duration.ofSeconds(seconds));
    }

    public static Schedule minutes(long minutes) {
        return Schedule.fromInterval(Duration.ofMinutes(minutes));
    }

    public static Schedule hours(long hours) {
        return Schedule.fromInterval(Duration.ofHours(hours));
    }

    public static Schedule days(long days) {
        return Schedule.fromInterval(Duration.ofDays(days));
    }
}
