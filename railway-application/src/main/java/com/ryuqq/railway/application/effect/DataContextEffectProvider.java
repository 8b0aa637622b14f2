package com.ryuqq.railway.application.effect;

import com.ryuqq.railway.core.model.DeadLetter;
import com.ryuqq.railway.core.model.Entity;
import com.ryuqq.railway.core.model.LogEntry;
import com.ryuqq.railway.core.model.Manifest;
import com.ryuqq.railway.core.model.Metadata;
import com.ryuqq.railway.core.model.WorkQueueEntry;
import com.ryuqq.railway.core.spi.DataContext;
import com.ryuqq.railway.core.workflow.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * DataContext 기반 영속화 Provider.
 *
 * <p>track된 모델은 즉시 행으로 추가(id 할당)되고, 이후 saveChanges마다 추적 중인 모든 모델의
 * 현재 값이 다시 기록됩니다. 실패 시 ERROR 레벨 {@link LogEntry}를 함께 남깁니다.</p>
 *
 * <p>이미 저장된 {@link Metadata}는 저장소의 행이 종료 상태가 아닐 때만 덮어씁니다. 다른 프로세스(예: 멈춘 작업
 * 회수)가 먼저 종료 상태로 만든 행은 늦게 끝난 실행이 되돌리지 못합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DataContextEffectProvider implements EffectProvider {

    private static final Logger log = LoggerFactory.getLogger(DataContextEffectProvider.class);

    private final DataContext context;
    private final Set<Entity<?>> tracked = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<Entity<?>> added = Collections.newSetFromMap(new IdentityHashMap<>());

    public DataContextEffectProvider(DataContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        this.context = context;
    }

    @Override
    public void track(Entity<?> model) {
        if (model.getId() == null) {
            add(model);
            added.add(model);
        }
        tracked.add(model);
    }

    @Override
    public void update(Entity<?> model) {
        if (!tracked.contains(model)) {
            track(model);
        }
    }

    @Override
    public void saveChanges(CancellationToken token) {
        for (Entity<?> model : tracked) {
            if (model instanceof Metadata metadata && !added.contains(metadata)) {
                writeIfNotTerminal(metadata);
            } else {
                write(model);
            }
        }
        context.saveChanges();
        added.clear();
    }

    @Override
    public void onError(Metadata metadata, Exception exception, CancellationToken token) {
        if (metadata.getId() == null) {
            return;
        }
        LogEntry entry = LogEntry.of(metadata.getId(), "ERROR", metadata.getName(),
            "Workflow failed at step " + metadata.getFailureStep() + ": " + exception.getMessage());
        entry.setException(exception.getClass().getName());
        entry.setStackTrace(metadata.getStackTrace());
        context.logs().add(entry);
    }

    @Override
    public void close() {
        tracked.clear();
        added.clear();
        context.close();
    }

    private void add(Entity<?> model) {
        if (model instanceof Metadata metadata) {
            context.metadata().add(metadata);
        } else if (model instanceof Manifest manifest) {
            context.manifests().add(manifest);
        } else if (model instanceof WorkQueueEntry entry) {
            context.workQueue().add(entry);
        } else if (model instanceof DeadLetter deadLetter) {
            context.deadLetters().add(deadLetter);
        } else if (model instanceof LogEntry logEntry) {
            context.logs().add(logEntry);
        } else {
            throw new IllegalArgumentException("Unsupported model type: " + model.getClass().getName());
        }
    }

    private void write(Entity<?> model) {
        if (model instanceof Metadata metadata) {
            context.metadata().update(metadata);
        } else if (model instanceof Manifest manifest) {
            context.manifests().update(manifest);
        } else if (model instanceof WorkQueueEntry entry) {
            context.workQueue().update(entry);
        } else if (model instanceof DeadLetter deadLetter) {
            context.deadLetters().update(deadLetter);
        } else if (model instanceof LogEntry logEntry) {
            context.logs().update(logEntry);
        } else {
            throw new IllegalArgumentException("Unsupported model type: " + model.getClass().getName());
        }
    }

    private void writeIfNotTerminal(Metadata metadata) {
        boolean written = context.metadata().updateIf(metadata.getId(),
            row -> !row.getWorkflowState().isTerminal(),
            row -> row.overwrite(metadata));
        if (!written) {
            log.warn("Metadata {} was not written as {}: the stored row is missing or already terminal",
                metadata.getId(), metadata.getWorkflowState());
        }
    }
}
