package com.ryuqq.railway.application.registry;

import com.ryuqq.railway.application.effect.EffectWorkflow;
import com.ryuqq.railway.core.type.TypeArguments;
import com.ryuqq.railway.core.type.TypeKeys;
import com.ryuqq.railway.core.workflow.Workflow;
import com.ryuqq.railway.core.workflow.WorkflowException;

import java.lang.reflect.Type;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 입력 타입 ↔ Workflow 매핑.
 *
 * <p>입력 타입 하나에 Workflow 하나만 등록할 수 있습니다. Manifest 예약과 WorkflowBus 디스패치는
 * 모두 이 레지스트리로 대상 Workflow를 찾습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkflowRegistry {

    private final Map<Class<?>, WorkflowRegistration<?>> byInputType = new ConcurrentHashMap<>();
    private final Map<String, WorkflowRegistration<?>> byWorkflowName = new ConcurrentHashMap<>();

    /**
     * Workflow 등록.
     *
     * @param inputType 입력 타입
     * @param workflowType Workflow 타입
     * @param factory 인스턴스 생성 함수
     * @param <I> 입력 타입
     * @param <W> Workflow 타입
     * @return this
     * @throws IllegalArgumentException Workflow 선언 입력 타입과 다른 경우
     * @throws IllegalStateException 입력 타입 또는 Workflow가 이미 등록된 경우
     */
    public synchronized <I, W extends EffectWorkflow<I, ?>> WorkflowRegistry register(
            Class<I> inputType, Class<W> workflowType, WorkflowFactory<W> factory) {
        WorkflowRegistration<I> registration = new WorkflowRegistration<>(inputType, workflowType, factory);
        Type declaredInput = TypeArguments.resolve(workflowType, Workflow.class)
            .map(arguments -> arguments[0])
            .orElseThrow(() -> new IllegalArgumentException("Cannot resolve input type of " + workflowType.getName()));
        if (TypeKeys.rawClass(declaredInput) != inputType) {
            throw new IllegalArgumentException("Workflow " + workflowType.getName() + " declares input type "
                + TypeKeys.displayName(declaredInput) + ", not " + inputType.getName());
        }
        if (byInputType.containsKey(inputType)) {
            throw new IllegalStateException("A workflow is already registered for input type " + inputType.getName());
        }
        if (byWorkflowName.containsKey(registration.workflowName())) {
            throw new IllegalStateException("Workflow already registered: " + registration.workflowName());
        }
        byInputType.put(inputType, registration);
        byWorkflowName.put(registration.workflowName(), registration);
        return this;
    }

    /**
     * 입력 타입으로 조회. 정확히 일치하는 등록이 없으면 상위 타입으로 등록된 것을 찾습니다.
     *
     * @param inputType 입력 런타임 타입
     * @return 등록 정보
     */
    public Optional<WorkflowRegistration<?>> findByInputType(Class<?> inputType) {
        WorkflowRegistration<?> exact = byInputType.get(inputType);
        if (exact != null) {
            return Optional.of(exact);
        }
        return byInputType.values().stream()
            .filter(registration -> registration.inputType().isAssignableFrom(inputType))
            .findFirst();
    }

    public Optional<WorkflowRegistration<?>> findByWorkflowName(String workflowName) {
        return Optional.ofNullable(byWorkflowName.get(workflowName));
    }

    /**
     * 예약 전 검증.
     *
     * @param workflowType 예약 대상 Workflow
     * @param inputType 입력 타입
     * @return 등록 정보
     * @throws WorkflowException 등록되어 있지 않거나 입력 타입이 맞지 않는 경우
     */
    public WorkflowRegistration<?> validate(Class<?> workflowType, Class<?> inputType) {
        WorkflowRegistration<?> registration = byWorkflowName.get(workflowType.getName());
        if (registration == null || !registration.inputType().isAssignableFrom(inputType)) {
            throw new WorkflowException("Workflow " + workflowType.getName() + " with input type "
                + inputType.getName() + " is not registered. Register it with WorkflowRegistry.register() "
                + "before scheduling.");
        }
        return registration;
    }

    public Collection<WorkflowRegistration<?>> registrations() {
        return List.copyOf(byWorkflowName.values());
    }
}
