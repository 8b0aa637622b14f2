package com.ryuqq.railway.adapter.runner;

import com.ryuqq.railway.application.json.JsonMapper;
import com.ryuqq.railway.application.registry.WorkflowBus;
import com.ryuqq.railway.application.registry.WorkflowRegistration;
import com.ryuqq.railway.application.registry.WorkflowRegistry;
import com.ryuqq.railway.core.model.Metadata;
import com.ryuqq.railway.core.result.Failure;
import com.ryuqq.railway.core.result.Result;
import com.ryuqq.railway.core.spi.DataContext;
import com.ryuqq.railway.core.spi.DataContextFactory;
import com.ryuqq.railway.core.statemachine.WorkflowState;
import com.ryuqq.railway.core.workflow.CancellationToken;
import com.ryuqq.railway.core.workflow.WorkflowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.CancellationException;

/**
 * BackgroundTaskServer가 호출하는 실행기.
 *
 * <p>PENDING Metadata 하나를 받아 등록된 Workflow로 실행하고 결과를 Manifest에 반영합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * execute(metadataId)
 *   ↓
 * Metadata 조회 (PENDING 확인) → Workflow 조회 → 입력 역직렬화
 *   ↓
 * WorkflowBus.runScheduled(metadata, input, token)
 *   ↓
 * 성공: Manifest.lastSuccessfulRun = now, retryCount = 0
 * 실패: ExecutionFailureHandler (재시도 / DeadLetter)
 * 취소: 후속 처리 없음
 * </pre>
 *
 * <p>Workflow를 찾을 수 없거나 입력을 읽을 수 없으면 Workflow를 실행하지 않고 Metadata를 FAILED로 기록한 뒤
 * 같은 실패 처리 경로로 보냅니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ManifestExecutor {

    private static final Logger log = LoggerFactory.getLogger(ManifestExecutor.class);

    private final DataContextFactory dataContextFactory;
    private final WorkflowRegistry registry;
    private final WorkflowBus workflowBus;
    private final JsonMapper jsonMapper;
    private final ExecutionFailureHandler failureHandler;
    private final Clock clock;

    public ManifestExecutor(DataContextFactory dataContextFactory, WorkflowRegistry registry,
                            WorkflowBus workflowBus, JsonMapper jsonMapper,
                            ExecutionFailureHandler failureHandler, Clock clock) {
        if (dataContextFactory == null) {
            throw new IllegalArgumentException("dataContextFactory cannot be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (workflowBus == null) {
            throw new IllegalArgumentException("workflowBus cannot be null");
        }
        if (jsonMapper == null) {
            throw new IllegalArgumentException("jsonMapper cannot be null");
        }
        if (failureHandler == null) {
            throw new IllegalArgumentException("failureHandler cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.dataContextFactory = dataContextFactory;
        this.registry = registry;
        this.workflowBus = workflowBus;
        this.jsonMapper = jsonMapper;
        this.failureHandler = failureHandler;
        this.clock = clock;
    }

    public void execute(long metadataId) {
        execute(metadataId, new CancellationToken());
    }

    /**
     * PENDING Metadata 실행.
     *
     * @param metadataId Metadata id
     * @param token 취소 토큰
     * @throws WorkflowException Metadata가 없는 경우
     * @throws IllegalStateException Metadata가 PENDING이 아닌 경우
     */
    public void execute(long metadataId, CancellationToken token) {
        Metadata metadata;
        try (DataContext context = dataContextFactory.create()) {
            metadata = context.metadata().findById(metadataId)
                .orElseThrow(() -> new WorkflowException("No metadata found with id " + metadataId));
        }
        if (metadata.getWorkflowState() != WorkflowState.PENDING) {
            throw new IllegalStateException("Metadata " + metadataId + " is not Pending (current: "
                + metadata.getWorkflowState() + ")");
        }

        WorkflowRegistration<?> registration = registry.findByWorkflowName(metadata.getName()).orElse(null);
        if (registration == null) {
            failWithoutRunning(metadata, WorkflowException.class.getName(),
                "Workflow " + metadata.getName() + " is not registered");
            return;
        }

        Object input;
        try {
            input = jsonMapper.read(metadata.getInput(), registration.inputType());
        } catch (IllegalStateException | IllegalArgumentException e) {
            failWithoutRunning(metadata, e.getClass().getName(),
                "Could not read input of " + metadata.getName() + ": " + e.getMessage());
            return;
        }

        Result<?> result;
        try {
            result = workflowBus.runScheduled(metadata, input, token);
        } catch (CancellationException e) {
            log.info("Metadata {} ({}) was cancelled", metadataId, metadata.getName());
            return;
        }

        if (result instanceof Failure<?> failure) {
            log.warn("Metadata {} ({}) failed: {}", metadataId, metadata.getName(),
                failure.exception().getMessage());
            failureHandler.handle(metadata, reasonOf(failure.exception()));
        } else {
            recordSuccess(metadata);
        }
    }

    private void recordSuccess(Metadata metadata) {
        Long manifestId = metadata.getManifestId();
        if (manifestId == null) {
            return;
        }
        try (DataContext context = dataContextFactory.create()) {
            context.manifests().updateIf(manifestId, row -> true, row -> {
                row.setLastSuccessfulRun(clock.instant());
                row.setRetryCount(0);
            });
        }
        log.debug("Manifest {} completed successfully (metadata={})", manifestId, metadata.getId());
    }

    private void failWithoutRunning(Metadata metadata, String exceptionType, String reason) {
        log.error("Metadata {} cannot run: {}", metadata.getId(), reason);
        try (DataContext context = dataContextFactory.create()) {
            metadata.failWithReason(clock.instant(), exceptionType, reason);
            context.metadata().update(metadata);
            context.saveChanges();
        }
        failureHandler.handle(metadata, reason);
    }

    private static String reasonOf(Exception exception) {
        String message = exception.getMessage();
        return exception.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }
}
