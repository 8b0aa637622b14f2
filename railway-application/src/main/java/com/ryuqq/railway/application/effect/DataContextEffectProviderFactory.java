package com.ryuqq.railway.application.effect;

import com.ryuqq.railway.core.spi.DataContextFactory;

/**
 * 실행마다 새 DataContext를 여는 {@link DataContextEffectProvider} 팩토리.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DataContextEffectProviderFactory implements EffectProviderFactory {

    private final DataContextFactory dataContextFactory;

    public DataContextEffectProviderFactory(DataContextFactory dataContextFactory) {
        if (dataContextFactory == null) {
            throw new IllegalArgumentException("dataContextFactory cannot be null");
        }
        this.dataContextFactory = dataContextFactory;
    }

    @Override
    public EffectProvider create() {
        return new DataContextEffectProvider(dataContextFactory.create());
    }
}
