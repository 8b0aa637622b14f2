package com.ryuqq.railway.application.effect;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Provider 팩토리 타입별 활성화 스위치 ({@link EffectProviderFactory}, {@link StepEffectProviderFactory}).
 *
 * <p>기본값은 모두 활성화입니다. 실행 중에 바꾸면 이후 생성되는 {@link EffectRunner}부터 적용됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class EffectProviderRegistry {

    private final Set<Class<?>> disabled = ConcurrentHashMap.newKeySet();

    public EffectProviderRegistry disable(Class<?> factoryType) {
        if (factoryType == null) {
            throw new IllegalArgumentException("factoryType cannot be null");
        }
        disabled.add(factoryType);
        return this;
    }

    public EffectProviderRegistry enable(Class<?> factoryType) {
        if (factoryType == null) {
            throw new IllegalArgumentException("factoryType cannot be null");
        }
        disabled.remove(factoryType);
        return this;
    }

    public boolean isEnabled(Class<?> factoryType) {
        return !disabled.contains(factoryType);
    }
}
