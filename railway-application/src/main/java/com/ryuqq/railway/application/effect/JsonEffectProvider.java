package com.ryuqq.railway.application.effect;

import com.ryuqq.railway.application.json.JsonMapper;
import com.ryuqq.railway.core.model.Entity;
import com.ryuqq.railway.core.model.Metadata;
import com.ryuqq.railway.core.workflow.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * 모델 변경 내역을 JSON으로 로그에 남기는 Provider.
 *
 * <p>DEBUG 레벨이 꺼져 있으면 직렬화하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class JsonEffectProvider implements EffectProvider {

    private static final Logger log = LoggerFactory.getLogger(JsonEffectProvider.class);

    private final JsonMapper jsonMapper;
    private final Set<Entity<?>> dirty = Collections.newSetFromMap(new IdentityHashMap<>());

    public JsonEffectProvider(JsonMapper jsonMapper) {
        if (jsonMapper == null) {
            throw new IllegalArgumentException("jsonMapper cannot be null");
        }
        this.jsonMapper = jsonMapper;
    }

    @Override
    public void track(Entity<?> model) {
        dirty.add(model);
    }

    @Override
    public void update(Entity<?> model) {
        dirty.add(model);
    }

    @Override
    public void saveChanges(CancellationToken token) {
        if (log.isDebugEnabled()) {
            for (Entity<?> model : new ArrayList<>(dirty)) {
                log.debug("{} changed: {}", model.getClass().getSimpleName(), jsonMapper.write(model));
            }
        }
        dirty.clear();
    }

    @Override
    public void onError(Metadata metadata, Exception exception, CancellationToken token) {
        log.debug("Workflow {} (externalId={}) failed at step {}",
            metadata.getName(), metadata.getExternalId(), metadata.getFailureStep());
    }

    @Override
    public void close() {
        dirty.clear();
    }

    List<Entity<?>> pendingModels() {
        return List.copyOf(dirty);
    }
}
