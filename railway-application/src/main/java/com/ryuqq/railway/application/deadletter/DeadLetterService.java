package com.ryuqq.railway.application.deadletter;

import com.ryuqq.railway.core.model.DeadLetter;
import com.ryuqq.railway.core.model.DeadLetterStatus;
import com.ryuqq.railway.core.model.Manifest;
import com.ryuqq.railway.core.model.Metadata;
import com.ryuqq.railway.core.spi.BackgroundTaskServer;
import com.ryuqq.railway.core.spi.DataContext;
import com.ryuqq.railway.core.spi.DataContextFactory;
import com.ryuqq.railway.core.spi.DataContextTransaction;
import com.ryuqq.railway.core.statemachine.WorkflowState;
import com.ryuqq.railway.core.workflow.WorkflowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * DeadLetter 생성과 운영자 처리.
 *
 * <p>DeadLetter는 재시도 한도를 소진한 작업의 영구 기록입니다. 디스패처는 생성만 하고,
 * 해소(retry / acknowledge)는 운영자 호출로만 일어납니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>DeadLetter 생성 (Manifest당 대기 중인 DeadLetter는 최대 1건)</li>
 *   <li>retry: Manifest의 현재 입력으로 새 PENDING Metadata를 만들고 실행 요청</li>
 *   <li>acknowledge: 재실행 없이 종결</li>
 *   <li>purge: 해소된 지 오래된 행 삭제</li>
 *   <li>상태별 통계</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DeadLetterService {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterService.class);

    private final DataContextFactory dataContextFactory;
    private final BackgroundTaskServer taskServer;
    private final Clock clock;
    private final List<DeadLetterListener> listeners;

    public DeadLetterService(DataContextFactory dataContextFactory, BackgroundTaskServer taskServer, Clock clock) {
        this(dataContextFactory, taskServer, clock, List.of());
    }

    public DeadLetterService(DataContextFactory dataContextFactory, BackgroundTaskServer taskServer,
                             Clock clock, List<DeadLetterListener> listeners) {
        if (dataContextFactory == null) {
            throw new IllegalArgumentException("dataContextFactory cannot be null");
        }
        if (taskServer == null) {
            throw new IllegalArgumentException("taskServer cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (listeners == null) {
            throw new IllegalArgumentException("listeners cannot be null");
        }
        this.dataContextFactory = dataContextFactory;
        this.taskServer = taskServer;
        this.clock = clock;
        this.listeners = List.copyOf(listeners);
    }

    /**
     * 재시도 한도 소진 여부.
     *
     * @param manifest 대상 Manifest
     * @return retryCount가 maxRetries 이상이면 true
     */
    public boolean shouldDeadLetter(Manifest manifest) {
        return manifest.getRetryCount() >= manifest.getMaxRetries();
    }

    /**
     * DeadLetter 생성. 같은 Manifest에 처리 대기 중인 DeadLetter가 있으면 그것을 반환합니다.
     *
     * @param manifestId 대상 Manifest id
     * @param reason 사유 (마지막 실패 메시지)
     * @return 생성되었거나 이미 있던 DeadLetter
     * @throws WorkflowException Manifest가 없는 경우
     */
    public DeadLetter deadLetter(long manifestId, String reason) {
        DeadLetter created;
        try (DataContext context = dataContextFactory.create();
             DataContextTransaction transaction = context.beginTransaction()) {
            DeadLetter existing = context.deadLetters().findFirst(row -> row.getManifestId() == manifestId
                && row.getStatus() == DeadLetterStatus.AWAITING_INTERVENTION).orElse(null);
            if (existing != null) {
                log.warn("Manifest {} already has a dead letter awaiting intervention (id={})",
                    manifestId, existing.getId());
                return existing;
            }
            Manifest manifest = context.manifests().findById(manifestId)
                .orElseThrow(() -> new WorkflowException("No manifest found with id " + manifestId));
            created = context.deadLetters().add(DeadLetter.create(manifestId,
                reason == null || reason.isBlank() ? "Unknown failure" : reason,
                manifest.getRetryCount(), clock.instant()));
            context.saveChanges();
            transaction.commit();
        }
        log.warn("Manifest {} dead-lettered after {} retries (deadLetterId={})",
            manifestId, created.getRetryCount(), created.getId());
        notifyListeners(created);
        return created;
    }

    /**
     * 처리 대기 DeadLetter를 새 실행으로 재시도.
     *
     * <p>Manifest의 retryCount는 초기화하지 않습니다. 재실행도 실패하면 바로 다시 DeadLetter가 됩니다.</p>
     *
     * <p>실행 요청이 실패하면 만든 Metadata를 FAILED로, DeadLetter를 처리 대기 상태로 되돌린 뒤
     * 예외를 다시 던집니다.</p>
     *
     * @param deadLetterId DeadLetter id
     * @return 재실행용으로 만든 PENDING Metadata
     * @throws WorkflowException DeadLetter 또는 Manifest가 없는 경우
     * @throws IllegalStateException 이미 해소된 경우
     */
    public Metadata retry(long deadLetterId) {
        Metadata metadata;
        try (DataContext context = dataContextFactory.create();
             DataContextTransaction transaction = context.beginTransaction()) {
            DeadLetter deadLetter = require(context, deadLetterId);
            if (deadLetter.getStatus() != DeadLetterStatus.AWAITING_INTERVENTION) {
                throw new IllegalStateException("DeadLetter " + deadLetterId + " is already resolved (status: "
                    + deadLetter.getStatus() + ")");
            }
            Manifest manifest = context.manifests().findById(deadLetter.getManifestId())
                .orElseThrow(() -> new WorkflowException("No manifest found with id " + deadLetter.getManifestId()));
            metadata = Metadata.create(manifest.getName(), null, clock.instant());
            metadata.setManifestId(manifest.getId());
            metadata.setInput(manifest.getProperties());
            context.metadata().add(metadata);
            deadLetter.markRetried(metadata.getId(), clock.instant());
            context.deadLetters().update(deadLetter);
            context.saveChanges();
            transaction.commit();
        }
        String jobId;
        try {
            jobId = taskServer.enqueue(metadata.getId());
        } catch (RuntimeException e) {
            log.error("DeadLetter {} retry could not be enqueued (metadata={})", deadLetterId, metadata.getId(), e);
            try {
                revertRetry(deadLetterId, metadata, e);
            } catch (RuntimeException revertFailure) {
                e.addSuppressed(revertFailure);
            }
            throw e;
        }
        log.info("DeadLetter {} retried as metadata {} (job={})", deadLetterId, metadata.getId(), jobId);
        return metadata;
    }

    /**
     * 재실행 없이 종결.
     *
     * @param deadLetterId DeadLetter id
     * @param note 처리 메모
     * @return 갱신된 DeadLetter
     * @throws IllegalStateException 이미 해소된 경우
     */
    public DeadLetter acknowledge(long deadLetterId, String note) {
        try (DataContext context = dataContextFactory.create()) {
            DeadLetter deadLetter = require(context, deadLetterId);
            deadLetter.acknowledge(note, clock.instant());
            context.deadLetters().update(deadLetter);
            context.saveChanges();
            log.info("DeadLetter {} acknowledged", deadLetterId);
            return deadLetter;
        }
    }

    /**
     * 상태별 조회 (오래된 순).
     *
     * @param status 상태
     * @return DeadLetter 목록
     */
    public List<DeadLetter> find(DeadLetterStatus status) {
        try (DataContext context = dataContextFactory.create()) {
            return context.deadLetters().findAll(row -> row.getStatus() == status).stream()
                .sorted(Comparator.comparing(DeadLetter::getDeadLetteredAt))
                .toList();
        }
    }

    /**
     * 해소된(RETRIED, ACKNOWLEDGED) DeadLetter 중 cutoff 이전에 해소된 것 삭제.
     *
     * @param resolvedBefore 기준 시각
     * @return 삭제 건수
     */
    public int purge(Instant resolvedBefore) {
        try (DataContext context = dataContextFactory.create()) {
            int removed = context.deadLetters().removeAll(row -> row.getStatus() != DeadLetterStatus.AWAITING_INTERVENTION
                && row.getResolvedAt() != null
                && row.getResolvedAt().isBefore(resolvedBefore));
            context.saveChanges();
            log.info("Purged {} resolved dead letters", removed);
            return removed;
        }
    }

    public DeadLetterStatistics statistics() {
        try (DataContext context = dataContextFactory.create()) {
            Map<DeadLetterStatus, Long> counts = context.deadLetters().findAll().stream()
                .collect(Collectors.groupingBy(DeadLetter::getStatus, Collectors.counting()));
            Function<DeadLetterStatus, Long> count = status -> counts.getOrDefault(status, 0L);
            return new DeadLetterStatistics(
                count.apply(DeadLetterStatus.AWAITING_INTERVENTION),
                count.apply(DeadLetterStatus.RETRIED),
                count.apply(DeadLetterStatus.ACKNOWLEDGED)
            );
        }
    }

    private void revertRetry(long deadLetterId, Metadata metadata, RuntimeException cause) {
        Instant now = clock.instant();
        String reason = "Retry could not be enqueued: " + cause.getMessage();
        try (DataContext context = dataContextFactory.create()) {
            context.metadata().updateIf(metadata.getId(),
                row -> row.getWorkflowState() == WorkflowState.PENDING,
                row -> row.failWithReason(now, cause.getClass().getName(), reason));
            context.deadLetters().updateIf(deadLetterId,
                row -> row.getStatus() == DeadLetterStatus.RETRIED
                    && metadata.getId().equals(row.getRetryMetadataId()),
                row -> row.reopen(reason));
        }
        metadata.failWithReason(now, cause.getClass().getName(), reason);
    }

    private void notifyListeners(DeadLetter deadLetter) {
        for (DeadLetterListener listener : listeners) {
            try {
                listener.onDeadLettered(deadLetter.copy());
            } catch (Exception e) {
                log.error("DeadLetter listener {} failed for deadLetter {}",
                    listener.getClass().getName(), deadLetter.getId(), e);
            }
        }
    }

    private static DeadLetter require(DataContext context, long deadLetterId) {
        return context.deadLetters().findById(deadLetterId)
            .orElseThrow(() -> new WorkflowException("No dead letter found with id " + deadLetterId));
    }
}
