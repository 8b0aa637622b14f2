package com.ryuqq.railway.application.effect;

import com.ryuqq.railway.core.model.Metadata;
import com.ryuqq.railway.core.result.Failure;
import com.ryuqq.railway.core.result.Result;
import com.ryuqq.railway.core.result.Success;
import com.ryuqq.railway.core.statemachine.WorkflowState;
import com.ryuqq.railway.core.workflow.CancellationToken;
import com.ryuqq.railway.core.workflow.Workflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.CancellationException;

/**
 * 실행 기록을 남기는 Workflow.
 *
 * <p>실행 한 건마다 {@link Metadata}를 만들거나(디스패처가 만든 PENDING 행이 있으면 그것을 이어받아)
 * 세 시점에 {@link EffectRunner}로 부수 효과를 전달합니다.</p>
 *
 * <p><strong>실행 순서:</strong></p>
 * <ol>
 *   <li>초기화: Metadata 준비 → IN_PROGRESS → track → saveChanges</li>
 *   <li>Step 시작: currentlyRunningStep 기록 → beforeStep → update → saveChanges</li>
 *   <li>Step 종료: afterStep → currentlyRunningStep 해제 → update → saveChanges</li>
 *   <li>종료: COMPLETED / FAILED(onError 포함) / CANCELLED → update → saveChanges</li>
 *   <li>EffectRunner close (항상). 다음 실행은 새 Provider로 시작합니다.</li>
 * </ol>
 *
 * <p>Effect 실패는 Workflow 결과를 바꾸지 않습니다. Provider 예외는 {@link EffectRunner}가 격리하고,
 * 종료 기록 자체가 실패해도 Workflow 결과는 그대로 반환됩니다.</p>
 *
 * @param <I> 입력 타입
 * @param <O> 반환 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class EffectWorkflow<I, O> extends Workflow<I, O> {

    private static final Logger log = LoggerFactory.getLogger(EffectWorkflow.class);

    private final EffectRunner effectRunner;
    private final Clock clock;
    private Metadata adoptedMetadata;
    private Metadata metadata;
    private StepExecution runningStep;

    protected EffectWorkflow(EffectRunner effectRunner) {
        this(effectRunner, Clock.systemUTC());
    }

    protected EffectWorkflow(EffectRunner effectRunner, Clock clock) {
        if (effectRunner == null) {
            throw new IllegalArgumentException("effectRunner cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.effectRunner = effectRunner;
        this.clock = clock;
    }

    /**
     * 디스패처가 미리 만든 PENDING Metadata를 이어받도록 지정.
     *
     * @param pending PENDING 상태의 저장된 Metadata
     * @return this
     * @throws IllegalArgumentException null이거나 id가 없는 경우
     * @throws IllegalStateException PENDING이 아닌 경우
     */
    public final EffectWorkflow<I, O> useMetadata(Metadata pending) {
        if (pending == null || pending.getId() == null) {
            throw new IllegalArgumentException("pending metadata must be persisted");
        }
        if (pending.getWorkflowState() != WorkflowState.PENDING) {
            throw new IllegalStateException("Metadata " + pending.getId() + " is not Pending");
        }
        this.adoptedMetadata = pending;
        return this;
    }

    /**
     * 마지막 실행의 Metadata.
     *
     * @return Metadata (실행 전이면 null)
     */
    public final Metadata getMetadata() {
        return metadata;
    }

    @Override
    protected final Result<O> execute(I input, CancellationToken token) {
        CancellationToken effectiveToken = token == null ? CancellationToken.none() : token;
        runningStep = null;
        try {
            metadata = initialize(input, effectiveToken);
            Result<O> result = super.execute(input, effectiveToken);
            record(metadata, result, effectiveToken);
            return result;
        } finally {
            effectRunner.close();
        }
    }

    @Override
    protected void beforeStep(String stepName) {
        Instant now = clock.instant();
        metadata.markStepStarted(stepName, now);
        runningStep = StepExecution.started(getWorkflowName(), metadata.getId(), stepName, now);
        effectRunner.beforeStep(runningStep);
        effectRunner.update(metadata);
        effectRunner.saveChanges(cancellationToken());
    }

    @Override
    protected void afterStep(String stepName, Result<?> result) {
        Instant now = clock.instant();
        StepExecution started = runningStep != null && runningStep.stepName().equals(stepName)
            ? runningStep
            : StepExecution.started(getWorkflowName(), metadata.getId(), stepName, now);
        runningStep = null;
        effectRunner.afterStep(started.finished(now, result));
        metadata.markStepFinished();
        effectRunner.update(metadata);
        effectRunner.saveChanges(cancellationToken());
    }

    private Metadata initialize(I input, CancellationToken token) {
        Metadata current;
        if (adoptedMetadata != null) {
            current = adoptedMetadata;
            adoptedMetadata = null;
        } else {
            current = Metadata.create(getWorkflowName(), getExternalId(), clock.instant());
            current.setParentId(getParentId());
        }
        current.setExecutor(getClass().getPackageName());
        current.setInputObject(input);
        current.markInProgress();
        effectRunner.track(current);
        effectRunner.saveChanges(token);
        return current;
    }

    private void record(Metadata current, Result<O> result, CancellationToken token) {
        try {
            finish(current, result, token);
        } catch (RuntimeException e) {
            log.error("Result of workflow {} (metadata={}) could not be recorded",
                getWorkflowName(), current.getId(), e);
        }
    }

    private void finish(Metadata current, Result<O> result, CancellationToken token) {
        if (result instanceof Success<O> success) {
            current.setOutputObject(success.value());
            current.complete(clock.instant());
        } else {
            Exception exception = ((Failure<O>) result).exception();
            String step = getFailureStep().orElse(null);
            if (exception instanceof CancellationException) {
                current.cancel(clock.instant(), step, exception);
            } else {
                current.fail(clock.instant(), step, exception);
                effectRunner.onError(current, exception, token);
            }
        }
        effectRunner.update(current);
        effectRunner.saveChanges(token);
    }
}
