package com.ryuqq.railway.application.registry;

import com.ryuqq.railway.application.effect.EffectRunner;
import com.ryuqq.railway.application.effect.EffectWorkflow;

/**
 * 실행마다 새 Workflow 인스턴스를 만드는 함수.
 *
 * @param <W> Workflow 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface WorkflowFactory<W extends EffectWorkflow<?, ?>> {

    W create(EffectRunner effectRunner);
}
