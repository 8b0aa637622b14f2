package com.ryuqq.railway.application.effect.alerting;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Workflow별 알림 재전송 억제 기간. 실행마다 새로 만들어지는 Provider들이 공유합니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class AlertCooldown {

    private final Duration period;
    private final Map<String, Instant> suppressedUntil = new ConcurrentHashMap<>();

    AlertCooldown(Duration period) {
        if (period == null || period.isNegative()) {
            throw new IllegalArgumentException("cooldown period cannot be null or negative (current: " + period + ")");
        }
        this.period = period;
    }

    boolean isEnabled() {
        return !period.isZero();
    }

    boolean isActive(String workflowName, Instant now) {
        Instant until = suppressedUntil.get(workflowName);
        return until != null && now.isBefore(until);
    }

    void start(String workflowName, Instant now) {
        if (isEnabled()) {
            suppressedUntil.put(workflowName, now.plus(period));
        }
    }
}
