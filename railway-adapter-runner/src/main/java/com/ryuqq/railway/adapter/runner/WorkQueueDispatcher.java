package com.ryuqq.railway.adapter.runner;

import com.ryuqq.railway.application.runtime.Runtime;
import com.ryuqq.railway.application.scheduler.SchedulerConfig;
import com.ryuqq.railway.core.model.Metadata;
import com.ryuqq.railway.core.model.WorkQueueEntry;
import com.ryuqq.railway.core.statemachine.WorkflowState;
import com.ryuqq.railway.core.spi.BackgroundTaskServer;
import com.ryuqq.railway.core.spi.DataContext;
import com.ryuqq.railway.core.spi.DataContextFactory;
import com.ryuqq.railway.core.spi.DataContextTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * WorkQueue 항목을 실행으로 바꾸는 디스패처.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * pump() 호출
 *   ↓
 * 점유 가능한 QUEUED 항목 조회 (priority 내림차순, 생성 순)
 *   ↓
 * For each 항목:
 *   1. claimedAt 조건부 갱신으로 점유
 *   2. 한 트랜잭션에서 PENDING Metadata 생성 + 항목 DISPATCHED
 *   3. Manifest 점유 해제
 *   4. BackgroundTaskServer에 실행 요청
 * </pre>
 *
 * <p>한 항목의 실패는 로그만 남기고 다음 항목을 계속 처리합니다. 점유 후 실패한 항목은
 * visibility timeout이 지나면 다시 점유됩니다.</p>
 *
 * <p>실행 요청(4단계)이 실패하면 PENDING Metadata를 FAILED로 바꾸고 {@link ExecutionFailureHandler}에
 * 넘깁니다. 재시도 또는 Dead Letter로 이어지므로 Manifest가 실행 중 상태로 남지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkQueueDispatcher implements Runtime {

    private static final Logger log = LoggerFactory.getLogger(WorkQueueDispatcher.class);

    private final DataContextFactory dataContextFactory;
    private final BackgroundTaskServer taskServer;
    private final ExecutionFailureHandler failureHandler;
    private final SchedulerConfig config;
    private final Clock clock;

    public WorkQueueDispatcher(DataContextFactory dataContextFactory, BackgroundTaskServer taskServer,
                               ExecutionFailureHandler failureHandler, SchedulerConfig config, Clock clock) {
        if (dataContextFactory == null) {
            throw new IllegalArgumentException("dataContextFactory cannot be null");
        }
        if (taskServer == null) {
            throw new IllegalArgumentException("taskServer cannot be null");
        }
        if (failureHandler == null) {
            throw new IllegalArgumentException("failureHandler cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.dataContextFactory = dataContextFactory;
        this.taskServer = taskServer;
        this.failureHandler = failureHandler;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public int pump() {
        Instant now = clock.instant();
        Instant staleBefore = now.minusMillis(config.visibilityTimeoutMs());

        List<WorkQueueEntry> entries;
        try (DataContext context = dataContextFactory.create()) {
            entries = context.workQueue().findAll(
                entry -> entry.isClaimable(now, staleBefore),
                Comparator.comparingInt(WorkQueueEntry::getPriority).reversed()
                    .thenComparing(WorkQueueEntry::getId),
                config.maxJobsPerCycle());
        }

        int dispatched = 0;
        for (WorkQueueEntry entry : entries) {
            if (tryDispatch(entry, now, staleBefore)) {
                dispatched++;
            }
        }

        if (!entries.isEmpty()) {
            log.info("Work queue dispatch completed: {} dispatched out of {} queued", dispatched, entries.size());
        }
        return dispatched;
    }

    /**
     * 개별 항목 디스패치 시도.
     *
     * @param candidate 조회 시점의 항목
     * @param now 현재 시각
     * @param staleBefore 점유 만료 기준
     * @return 디스패치 성공 여부
     */
    private boolean tryDispatch(WorkQueueEntry candidate, Instant now, Instant staleBefore) {
        Metadata metadata;
        try {
            metadata = dispatch(candidate.getId(), now, staleBefore);
        } catch (Exception e) {
            log.error("Failed to dispatch work queue entry {}", candidate.getId(), e);
            return false;
        }
        if (metadata == null) {
            return false;
        }
        try {
            String jobId = taskServer.enqueue(metadata.getId());
            log.debug("Work queue entry {} dispatched as metadata {} (job={})",
                candidate.getId(), metadata.getId(), jobId);
            return true;
        } catch (Exception e) {
            log.error("Failed to enqueue metadata {} of work queue entry {}", metadata.getId(), candidate.getId(), e);
            failUnstarted(metadata, e);
            return false;
        }
    }

    /**
     * 실행 요청에 실패한 PENDING Metadata를 FAILED로 바꾸고 후속 처리에 넘김.
     *
     * @param metadata 디스패치된 PENDING Metadata
     * @param cause 실행 요청 실패 원인
     */
    private void failUnstarted(Metadata metadata, Exception cause) {
        Instant failedAt = clock.instant();
        String exceptionType = cause.getClass().getName();
        String reason = "Background task server rejected metadata " + metadata.getId() + ": " + cause.getMessage();
        try {
            boolean failed;
            try (DataContext context = dataContextFactory.create()) {
                failed = context.metadata().updateIf(metadata.getId(),
                    row -> row.getWorkflowState() == WorkflowState.PENDING,
                    row -> row.failWithReason(failedAt, exceptionType, reason));
            }
            if (!failed) {
                log.warn("Metadata {} already left Pending, enqueue failure not recorded", metadata.getId());
                return;
            }
            metadata.failWithReason(failedAt, exceptionType, reason);
            FailureDisposition disposition = failureHandler.handle(metadata, reason);
            log.info("Metadata {} failed before start: {}", metadata.getId(), disposition);
        } catch (Exception e) {
            log.error("Failed to record enqueue failure of metadata {}", metadata.getId(), e);
        }
    }

    private Metadata dispatch(long entryId, Instant now, Instant staleBefore) {
        try (DataContext context = dataContextFactory.create()) {
            boolean claimed = context.workQueue().updateIf(entryId,
                row -> row.isClaimable(now, staleBefore),
                row -> row.setClaimedAt(now));
            if (!claimed) {
                log.debug("Work queue entry {} was claimed by another dispatcher", entryId);
                return null;
            }

            Metadata metadata;
            try (DataContextTransaction transaction = context.beginTransaction()) {
                WorkQueueEntry entry = context.workQueue().findById(entryId)
                    .orElseThrow(() -> new IllegalStateException("Work queue entry " + entryId + " disappeared"));
                metadata = Metadata.create(entry.getWorkflowName(), null, now);
                metadata.setManifestId(entry.getManifestId());
                metadata.setInput(entry.getInput());
                context.metadata().add(metadata);
                entry.markDispatched(metadata.getId(), now);
                context.workQueue().update(entry);
                context.saveChanges();
                transaction.commit();
            }

            Long manifestId = metadata.getManifestId();
            if (manifestId != null) {
                context.manifests().updateIf(manifestId, row -> true, row -> row.setClaimedAt(null));
            }
            return metadata;
        }
    }
}
