package com.ryuqq.railway.application.effect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

/**
 * Step 시작/종료를 SLF4J로 남기는 Provider.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StepLoggingEffectProvider implements StepEffectProvider {

    private static final Logger log = LoggerFactory.getLogger(StepLoggingEffectProvider.class);

    private final Level level;

    public StepLoggingEffectProvider(Level level) {
        if (level == null) {
            throw new IllegalArgumentException("level cannot be null");
        }
        this.level = level;
    }

    @Override
    public void beforeStep(StepExecution execution) {
        log.atLevel(level).log("Step {} of {} (metadata={}) started",
            execution.stepName(), execution.workflowName(), execution.metadataId());
    }

    @Override
    public void afterStep(StepExecution execution) {
        if (execution.isSucceeded()) {
            log.atLevel(level).log("Step {} of {} (metadata={}) completed in {}ms",
                execution.stepName(), execution.workflowName(), execution.metadataId(),
                execution.elapsed().toMillis());
            return;
        }
        log.atLevel(level).log("Step {} of {} (metadata={}) failed in {}ms: {}",
            execution.stepName(), execution.workflowName(), execution.metadataId(),
            execution.elapsed().toMillis(),
            execution.failure().map(Exception::getMessage).orElse(null));
    }

    @Override
    public void close() {
    }
}
