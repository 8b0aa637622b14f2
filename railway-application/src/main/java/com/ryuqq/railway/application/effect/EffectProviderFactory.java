package com.ryuqq.railway.application.effect;

/**
 * {@link EffectProvider} 생성 함수.
 *
 * <p>{@link EffectRunner}마다 한 번 호출됩니다. {@link EffectProviderRegistry}에서 비활성화된
 * 팩토리 타입은 호출되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EffectProviderFactory {

    EffectProvider create();
}
