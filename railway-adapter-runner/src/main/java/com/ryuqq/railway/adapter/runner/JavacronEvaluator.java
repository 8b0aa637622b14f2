package com.ryuqq.railway.adapter.runner;

import com.asahaf.javacron.InvalidExpressionException;
import com.asahaf.javacron.Schedule;
import com.ryuqq.railway.core.spi.CronEvaluator;

import java.time.Instant;
import java.util.Date;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * javacron 기반 {@link CronEvaluator}.
 *
 * <p>파싱된 표현식은 캐시합니다. 시간대 해석은 javacron 기본값(JVM 기본 시간대)을 따릅니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class JavacronEvaluator implements CronEvaluator {

    private final Map<String, Schedule> cache = new ConcurrentHashMap<>();

    @Override
    public void validate(String expression) {
        parse(expression);
    }

    @Override
    public Instant nextOccurrence(String expression, Instant after) {
        if (after == null) {
            throw new IllegalArgumentException("after cannot be null");
        }
        return parse(expression).next(Date.from(after)).toInstant();
    }

    private Schedule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("cron expression cannot be null or blank");
        }
        Schedule cached = cache.get(expression);
        if (cached != null) {
            return cached;
        }
        try {
            Schedule schedule = Schedule.create(expression);
            cache.put(expression, schedule);
            return schedule;
        } catch (InvalidExpressionException e) {
            throw new IllegalArgumentException("Invalid cron expression: " + expression, e);
        }
    }
}
