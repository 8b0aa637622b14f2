package com.ryuqq.railway.application.effect;

import com.ryuqq.railway.application.json.JsonMapper;

/**
 * {@link ParameterEffectProvider} 팩토리.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ParameterEffectProviderFactory implements EffectProviderFactory {

    private final JsonMapper jsonMapper;

    public ParameterEffectProviderFactory(JsonMapper jsonMapper) {
        if (jsonMapper == null) {
            throw new IllegalArgumentException("jsonMapper cannot be null");
        }
        this.jsonMapper = jsonMapper;
    }

    @Override
    public EffectProvider create() {
        return new ParameterEffectProvider(jsonMapper);
    }
}
