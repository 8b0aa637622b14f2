package com.ryuqq.railway.core.spi;

import java.time.Instant;

/**
 * Cron expression collaborator.
 *
 * <p>The scheduler treats cron parsing as a black box producing the next fire time.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CronEvaluator {

    /**
     * Validates an expression.
     *
     * @param expression cron expression
     * @throws IllegalArgumentException if the expression is not valid
     */
    void validate(String expression);

    /**
     * Next fire time strictly after the given instant.
     *
     * @param expression cron expression
     * @param after reference instant
     * @return next occurrence
     * @throws IllegalArgumentException if the expression is not valid
     */
    Instant nextOccurrence(String expression, Instant after);
}
