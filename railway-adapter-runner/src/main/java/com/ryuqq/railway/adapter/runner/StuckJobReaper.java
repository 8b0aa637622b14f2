package com.ryuqq.railway.adapter.runner;

import com.ryuqq.railway.application.runtime.Runtime;
import com.ryuqq.railway.core.model.Manifest;
import com.ryuqq.railway.core.model.Metadata;
import com.ryuqq.railway.core.spi.DataContext;
import com.ryuqq.railway.core.spi.DataContextFactory;
import com.ryuqq.railway.core.statemachine.WorkflowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 멈춘 실행 정리 컴포넌트.
 *
 * <p>IN_PROGRESS 상태로 제한 시간을 넘긴 Metadata를 FAILED로 바꾸고 실패 처리 경로
 * (재시도 / DeadLetter)로 넘깁니다.</p>
 *
 * <p><strong>정리 시나리오:</strong></p>
 * <pre>
 * 1. 워커가 Workflow 실행 중 프로세스 종료 / 무한 대기
 * 2. Metadata는 IN_PROGRESS로 남고 Manifest는 계속 차단됨
 * 3. Reaper가 주기적으로 스캔
 * 4. startTime + timeout 초과 항목 발견 (timeout: Manifest 설정, 없으면 timeoutThresholdMs)
 * 5. IN_PROGRESS 조건부 갱신으로 FAILED 처리 → ExecutionFailureHandler
 * </pre>
 *
 * <p><strong>멱등성:</strong></p>
 * <ul>
 *   <li>조건부 갱신이므로 여러 Reaper 인스턴스가 같은 항목을 두 번 처리하지 않음</li>
 *   <li>한 항목의 실패는 로그 후 다음 항목 계속 처리</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StuckJobReaper implements Runtime {

    private static final Logger log = LoggerFactory.getLogger(StuckJobReaper.class);

    private final DataContextFactory dataContextFactory;
    private final ExecutionFailureHandler failureHandler;
    private final ReaperConfig config;
    private final Clock clock;

    public StuckJobReaper(DataContextFactory dataContextFactory, ExecutionFailureHandler failureHandler,
                          ReaperConfig config, Clock clock) {
        if (dataContextFactory == null) {
            throw new IllegalArgumentException("dataContextFactory cannot be null");
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
        this.failureHandler = failureHandler;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public int pump() {
        return scan();
    }

    /**
     * 제한 시간을 넘긴 IN_PROGRESS 실행 스캔 및 정리.
     *
     * @return 정리한 항목 수
     */
    public int scan() {
        log.debug("Reaper scan started");
        Instant now = clock.instant();

        List<Metadata> stuck;
        try (DataContext context = dataContextFactory.create()) {
            Map<Long, Manifest> manifests = context.manifests().findAll().stream()
                .collect(Collectors.toMap(Manifest::getId, Function.identity()));
            stuck = context.metadata().findAll(
                metadata -> metadata.getWorkflowState() == WorkflowState.IN_PROGRESS
                    && metadata.getStartTime().plus(timeoutOf(metadata, manifests)).isBefore(now),
                Comparator.comparing(Metadata::getStartTime),
                config.batchSize());
        }

        int reaped = 0;
        for (Metadata metadata : stuck) {
            if (tryReap(metadata, now)) {
                reaped++;
            }
        }

        if (!stuck.isEmpty()) {
            log.info("Reaper scan completed: {} reaped out of {} stuck", reaped, stuck.size());
        }
        return reaped;
    }

    /**
     * 개별 항목 정리 시도. 예외 발생 시에도 다른 항목 정리를 방해하지 않습니다.
     */
    private boolean tryReap(Metadata candidate, Instant now) {
        try {
            String reason = "Workflow " + candidate.getName() + " exceeded its timeout (started at "
                + candidate.getStartTime() + ")";
            Metadata reaped;
            try (DataContext context = dataContextFactory.create()) {
                boolean updated = context.metadata().updateIf(candidate.getId(),
                    row -> row.getWorkflowState() == WorkflowState.IN_PROGRESS,
                    row -> row.failWithReason(now, TimeoutException.class.getName(), reason));
                if (!updated) {
                    return false;
                }
                reaped = context.metadata().findById(candidate.getId()).orElseThrow();
            }
            log.warn("Reaper marked metadata {} ({}) as FAILED", reaped.getId(), reaped.getName());
            failureHandler.handle(reaped, reason);
            return true;
        } catch (Exception e) {
            log.error("Failed to reap metadata {} in Reaper scan", candidate.getId(), e);
            return false;
        }
    }

    private Duration timeoutOf(Metadata metadata, Map<Long, Manifest> manifests) {
        Manifest manifest = metadata.getManifestId() == null ? null : manifests.get(metadata.getManifestId());
        if (manifest != null && manifest.getTimeoutSeconds() != null) {
            return Duration.ofSeconds(manifest.getTimeoutSeconds());
        }
        return Duration.ofMillis(config.timeoutThresholdMs());
    }
}
