package com.ryuqq.railway.adapter.runner;

import com.ryuqq.railway.application.deadletter.DeadLetterService;
import com.ryuqq.railway.core.model.Manifest;
import com.ryuqq.railway.core.model.Metadata;
import com.ryuqq.railway.core.model.WorkQueueEntry;
import com.ryuqq.railway.core.spi.DataContext;
import com.ryuqq.railway.core.spi.DataContextFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * 실패한 Manifest 실행의 재시도 / DeadLetter 분기.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * retryCount &lt; maxRetries
 *   → retryCount + 1, 백오프 지연 후 실행 가능한 WorkQueue 항목 생성
 * retryCount ≥ maxRetries
 *   → DeadLetter 생성 (RetryCount = 소진된 재시도 횟수)
 * </pre>
 *
 * <p>취소된 실행은 이 핸들러로 오지 않습니다. 취소는 재시도하지도 DeadLetter로 보내지도 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ExecutionFailureHandler {

    private static final Logger log = LoggerFactory.getLogger(ExecutionFailureHandler.class);

    private final DataContextFactory dataContextFactory;
    private final DeadLetterService deadLetterService;
    private final BackoffCalculator backoffCalculator;
    private final Clock clock;

    public ExecutionFailureHandler(DataContextFactory dataContextFactory, DeadLetterService deadLetterService,
                                   BackoffCalculator backoffCalculator, Clock clock) {
        if (dataContextFactory == null) {
            throw new IllegalArgumentException("dataContextFactory cannot be null");
        }
        if (deadLetterService == null) {
            throw new IllegalArgumentException("deadLetterService cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.dataContextFactory = dataContextFactory;
        this.deadLetterService = deadLetterService;
        this.backoffCalculator = backoffCalculator;
        this.clock = clock;
    }

    /**
     * 실패 후속 처리.
     *
     * @param failed 실패로 끝난 실행 기록
     * @param reason 실패 사유
     * @return 처리 결과
     */
    public FailureDisposition handle(Metadata failed, String reason) {
        Long manifestId = failed.getManifestId();
        if (manifestId == null) {
            log.debug("Metadata {} is not linked to a manifest, nothing to retry", failed.getId());
            return FailureDisposition.IGNORED;
        }

        Optional<Manifest> found;
        try (DataContext context = dataContextFactory.create()) {
            found = context.manifests().findById(manifestId);
        }
        if (found.isEmpty()) {
            log.warn("Manifest {} of failed metadata {} no longer exists", manifestId, failed.getId());
            return FailureDisposition.IGNORED;
        }
        Manifest manifest = found.get();

        if (deadLetterService.shouldDeadLetter(manifest)) {
            deadLetterService.deadLetter(manifestId, reason);
            return FailureDisposition.DEAD_LETTERED;
        }

        int retryCount = manifest.getRetryCount() + 1;
        Duration delay = backoffCalculator.calculate(retryCount);
        Instant now = clock.instant();
        try (DataContext context = dataContextFactory.create()) {
            context.manifests().updateIf(manifestId, row -> true, row -> row.setRetryCount(retryCount));
            context.workQueue().add(WorkQueueEntry.fromManifest(manifest, now, now.plus(delay)));
            context.saveChanges();
        }
        log.info("Manifest {} failed, retry {}/{} scheduled in {}ms",
            manifest.getExternalId(), retryCount, manifest.getMaxRetries(), delay.toMillis());
        return FailureDisposition.RETRY_SCHEDULED;
    }
}
