package com.ryuqq.railway.application.effect;

/**
 * {@link StepEffectProvider} 생성 함수. {@link EffectRunner}가 Provider를 만들 때마다 한 번 호출됩니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StepEffectProviderFactory {

    StepEffectProvider create();
}
