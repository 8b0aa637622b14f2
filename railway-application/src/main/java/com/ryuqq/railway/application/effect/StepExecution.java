package com.ryuqq.railway.application.effect;

import com.ryuqq.railway.core.result.Failure;
import com.ryuqq.railway.core.result.Result;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Step 한 번의 실행 정보.
 *
 * <p>beforeStep 시점에는 endedAt과 result가 null입니다.</p>
 *
 * @param workflowName Workflow 이름
 * @param metadataId 실행 기록 id (저장 전이면 null)
 * @param stepName Step 이름
 * @param startedAt Step 시작 시각
 * @param endedAt Step 종료 시각
 * @param result Step 결과
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StepExecution(
    String workflowName,
    Long metadataId,
    String stepName,
    Instant startedAt,
    Instant endedAt,
    Result<?> result
) {

    public StepExecution {
        if (workflowName == null || workflowName.isBlank()) {
            throw new IllegalArgumentException("workflowName cannot be null or blank");
        }
        if (stepName == null || stepName.isBlank()) {
            throw new IllegalArgumentException("stepName cannot be null or blank");
        }
        if (startedAt == null) {
            throw new IllegalArgumentException("startedAt cannot be null");
        }
        if ((endedAt == null) != (result == null)) {
            throw new IllegalArgumentException("endedAt and result must be set together");
        }
    }

    public static StepExecution started(String workflowName, Long metadataId, String stepName, Instant startedAt) {
        return new StepExecution(workflowName, metadataId, stepName, startedAt, null, null);
    }

    public StepExecution finished(Instant endedAt, Result<?> result) {
        return new StepExecution(workflowName, metadataId, stepName, startedAt, endedAt, result);
    }

    public boolean isFinished() {
        return result != null;
    }

    public boolean isSucceeded() {
        return result != null && result.isSuccess();
    }

    public Optional<Exception> failure() {
        if (result instanceof Failure<?> failure) {
            return Optional.of(failure.exception());
        }
        return Optional.empty();
    }

    public Duration elapsed() {
        return endedAt == null ? Duration.ZERO : Duration.between(startedAt, endedAt);
    }
}
