package com.ryuqq.railway.application.effect;

import com.ryuqq.railway.application.json.JsonMapper;
import com.ryuqq.railway.core.model.Entity;
import com.ryuqq.railway.core.model.Metadata;
import com.ryuqq.railway.core.workflow.CancellationToken;

/**
 * Metadata의 실행 중 입력/출력 객체를 JSON 문자열로 기록하는 Provider.
 *
 * <p>영속화 Provider보다 먼저 등록하지 않아도 됩니다. 영속화는 saveChanges 시점의 값을 쓰기 때문입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ParameterEffectProvider implements EffectProvider {

    private final JsonMapper jsonMapper;

    public ParameterEffectProvider(JsonMapper jsonMapper) {
        if (jsonMapper == null) {
            throw new IllegalArgumentException("jsonMapper cannot be null");
        }
        this.jsonMapper = jsonMapper;
    }

    @Override
    public void track(Entity<?> model) {
        serialize(model);
    }

    @Override
    public void update(Entity<?> model) {
        serialize(model);
    }

    @Override
    public void saveChanges(CancellationToken token) {
    }

    @Override
    public void close() {
    }

    private void serialize(Entity<?> model) {
        if (!(model instanceof Metadata metadata)) {
            return;
        }
        if (metadata.getInputObject() != null) {
            metadata.setInput(jsonMapper.write(metadata.getInputObject()));
        }
        if (metadata.getOutputObject() != null) {
            metadata.setOutput(jsonMapper.write(metadata.getOutputObject()));
        }
    }
}
