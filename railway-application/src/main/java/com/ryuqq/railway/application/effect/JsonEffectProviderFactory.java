package com.ryuqq.railway.application.effect;

import com.ryuqq.railway.application.json.JsonMapper;

/**
 * {@link JsonEffectProvider} 팩토리.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class JsonEffectProviderFactory implements EffectProviderFactory {

    private final JsonMapper jsonMapper;

    public JsonEffectProviderFactory(JsonMapper jsonMapper) {
        if (jsonMapper == null) {
            throw new IllegalArgumentException("jsonMapper cannot be null");
        }
        this.jsonMapper = jsonMapper;
    }

    @Override
    public EffectProvider create() {
        return new JsonEffectProvider(jsonMapper);
    }
}
