package com.ryuqq.railway.application.registry;

import com.ryuqq.railway.application.effect.EffectRunner;
import com.ryuqq.railway.application.effect.EffectWorkflow;

/**
 * Workflow 등록 정보.
 *
 * @param inputType 입력 타입
 * @param workflowType Workflow 타입
 * @param factory 인스턴스 생성 함수
 * @param <I> 입력 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WorkflowRegistration<I>(
    Class<I> inputType,
    Class<? extends EffectWorkflow<I, ?>> workflowType,
    WorkflowFactory<? extends EffectWorkflow<I, ?>> factory
) {

    public WorkflowRegistration {
        if (inputType == null) {
            throw new IllegalArgumentException("inputType cannot be null");
        }
        if (workflowType == null) {
            throw new IllegalArgumentException("workflowType cannot be null");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
    }

    public String workflowName() {
        return workflowType.getName();
    }

    /**
     * 새 인스턴스 생성.
     *
     * @param effectRunner 실행용 EffectRunner
     * @return Workflow
     * @throws IllegalStateException 팩토리가 null 또는 다른 타입을 반환한 경우
     */
    public EffectWorkflow<I, ?> create(EffectRunner effectRunner) {
        EffectWorkflow<I, ?> workflow = factory.create(effectRunner);
        if (workflow == null || !workflowType.isInstance(workflow)) {
            throw new IllegalStateException("Factory for " + workflowName() + " returned "
                + (workflow == null ? "null" : workflow.getClass().getName()));
        }
        return workflow;
    }
}
