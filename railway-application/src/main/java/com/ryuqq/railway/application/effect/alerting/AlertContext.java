package com.ryuqq.railway.application.effect.alerting;

import com.ryuqq.railway.core.model.Metadata;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * {@link AlertSender}에 전달되는 알림 내용.
 *
 * @param workflowName Workflow 이름
 * @param trigger 알림을 일으킨 실패 기록
 * @param failureCount 기간 안의 실패 수 (trigger 포함)
 * @param timeWindow 실패를 센 기간 (단건 알림이면 0)
 * @param totalExecutions 기간 안에 종료된 실행 수 (trigger 포함)
 * @param firstFailureTime 기간 안의 첫 실패 시작 시각
 * @param lastSuccessTime 기간 안의 마지막 성공 종료 시각 (없으면 null)
 * @param exceptionFrequency 예외 타입별 실패 수
 * @param failedStepFrequency Step별 실패 수
 * @param failedInputs 실패한 실행의 직렬화된 입력
 * @param configuration 적용된 알림 조건
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record AlertContext(
    String workflowName,
    Metadata trigger,
    int failureCount,
    Duration timeWindow,
    int totalExecutions,
    Instant firstFailureTime,
    Instant lastSuccessTime,
    Map<String, Long> exceptionFrequency,
    Map<String, Long> failedStepFrequency,
    List<String> failedInputs,
    AlertConfiguration configuration
) {

    public AlertContext {
        if (workflowName == null || workflowName.isBlank()) {
            throw new IllegalArgumentException("workflowName cannot be null or blank");
        }
        if (trigger == null) {
            throw new IllegalArgumentException("trigger cannot be null");
        }
        if (failureCount <= 0) {
            throw new IllegalArgumentException("failureCount must be positive (current: " + failureCount + ")");
        }
        if (timeWindow == null) {
            throw new IllegalArgumentException("timeWindow cannot be null");
        }
        if (configuration == null) {
            throw new IllegalArgumentException("configuration cannot be null");
        }
        exceptionFrequency = Map.copyOf(exceptionFrequency);
        failedStepFrequency = Map.copyOf(failedStepFrequency);
        failedInputs = List.copyOf(failedInputs);
    }
}
