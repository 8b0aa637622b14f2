package com.ryuqq.railway.application.registry;

import com.ryuqq.railway.application.effect.EffectRunner;
import com.ryuqq.railway.application.effect.EffectWorkflow;
import com.ryuqq.railway.core.model.Metadata;
import com.ryuqq.railway.core.result.Result;
import com.ryuqq.railway.core.workflow.CancellationToken;
import com.ryuqq.railway.core.workflow.WorkflowException;

import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * 입력 타입으로 Workflow를 찾아 실행하는 버스.
 *
 * <p>실행마다 새 Workflow와 새 {@link EffectRunner}를 만듭니다. Workflow 안에서 다른 Workflow를
 * 실행할 때 parentId를 넘기면 실행 기록이 부모-자식으로 연결됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkflowBus {

    private final WorkflowRegistry registry;
    private final Supplier<EffectRunner> effectRunners;

    public WorkflowBus(WorkflowRegistry registry, Supplier<EffectRunner> effectRunners) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (effectRunners == null) {
            throw new IllegalArgumentException("effectRunners cannot be null");
        }
        this.registry = registry;
        this.effectRunners = effectRunners;
    }

    public Result<?> run(Object input) {
        return run(input, null, CancellationToken.none());
    }

    /**
     * 입력 타입에 등록된 Workflow 실행.
     *
     * @param input 입력 값
     * @param parentId 부모 Metadata id (없으면 null)
     * @param token 취소 토큰
     * @return Workflow 결과
     * @throws WorkflowException 입력 타입에 등록된 Workflow가 없는 경우
     */
    public Result<?> run(Object input, Long parentId, CancellationToken token) {
        if (input == null) {
            throw new IllegalArgumentException("input cannot be null");
        }
        WorkflowRegistration<?> registration = registry.findByInputType(input.getClass())
            .orElseThrow(() -> new WorkflowException("No workflow registered for input type "
                + input.getClass().getName()));
        return runEither(registration, input, workflow -> workflow.setParentId(parentId), token);
    }

    /**
     * 디스패처가 만든 PENDING Metadata로 실행.
     *
     * @param pending PENDING Metadata (name = Workflow 이름)
     * @param input 역직렬화된 입력
     * @param token 취소 토큰
     * @return Workflow 결과
     * @throws WorkflowException Metadata의 Workflow가 등록되어 있지 않은 경우
     */
    public Result<?> runScheduled(Metadata pending, Object input, CancellationToken token) {
        WorkflowRegistration<?> registration = registry.findByWorkflowName(pending.getName())
            .orElseThrow(() -> new WorkflowException("Workflow " + pending.getName() + " is not registered"));
        return runEither(registration, input, workflow -> workflow.useMetadata(pending), token);
    }

    private <I> Result<?> runEither(WorkflowRegistration<I> registration, Object input,
                                    Consumer<EffectWorkflow<I, ?>> prepare, CancellationToken token) {
        I typedInput = registration.inputType().cast(input);
        EffectWorkflow<I, ?> workflow = registration.create(effectRunners.get());
        prepare.accept(workflow);
        return workflow.runEither(typedInput, token);
    }
}
