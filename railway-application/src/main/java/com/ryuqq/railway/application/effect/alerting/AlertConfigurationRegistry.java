package com.ryuqq.railway.application.effect.alerting;

import com.ryuqq.railway.core.workflow.Workflow;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Workflow 이름별 알림 조건. 등록되지 않은 Workflow의 실패는 알림 대상이 아닙니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AlertConfigurationRegistry {

    private final Map<String, AlertConfiguration> configurations = new ConcurrentHashMap<>();

    public AlertConfigurationRegistry register(Class<? extends Workflow<?, ?>> workflowType,
                                              AlertConfiguration configuration) {
        if (workflowType == null) {
            throw new IllegalArgumentException("workflowType cannot be null");
        }
        return register(workflowType.getName(), configuration);
    }

    public AlertConfigurationRegistry register(String workflowName, AlertConfiguration configuration) {
        if (workflowName == null || workflowName.isBlank()) {
            throw new IllegalArgumentException("workflowName cannot be null or blank");
        }
        if (configuration == null) {
            throw new IllegalArgumentException("configuration cannot be null");
        }
        configurations.put(workflowName, configuration);
        return this;
    }

    public Optional<AlertConfiguration> find(String workflowName) {
        return Optional.ofNullable(configurations.get(workflowName));
    }
}
