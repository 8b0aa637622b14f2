package com.ryuqq.railway.application.effect;

import org.slf4j.event.Level;

/**
 * {@link StepLoggingEffectProvider} 팩토리. 로그 레벨을 설정으로 가집니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StepLoggingEffectProviderFactory implements StepEffectProviderFactory {

    private final Level level;

    public StepLoggingEffectProviderFactory() {
        this(Level.DEBUG);
    }

    public StepLoggingEffectProviderFactory(Level level) {
        if (level == null) {
            throw new IllegalArgumentException("level cannot be null");
        }
        this.level = level;
    }

    public Level level() {
        return level;
    }

    @Override
    public StepEffectProvider create() {
        return new StepLoggingEffectProvider(level);
    }
}
