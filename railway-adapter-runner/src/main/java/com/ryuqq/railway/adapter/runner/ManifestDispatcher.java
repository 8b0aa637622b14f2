package com.ryuqq.railway.adapter.runner;

import com.ryuqq.railway.application.runtime.Runtime;
import com.ryuqq.railway.application.scheduler.SchedulerConfig;
import com.ryuqq.railway.core.model.DeadLetterStatus;
import com.ryuqq.railway.core.model.Manifest;
import com.ryuqq.railway.core.model.WorkQueueEntry;
import com.ryuqq.railway.core.model.WorkQueueStatus;
import com.ryuqq.railway.core.spi.DataContext;
import com.ryuqq.railway.core.spi.DataContextFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 실행 시점이 된 Manifest를 WorkQueue에 넣는 디스패처.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * pump() 호출
 *   ↓
 * 활성 Manifest 중 차단되지 않고 실행 시점이 된 것 선택 (priority 내림차순)
 *   ↓
 * For each Manifest (maxJobsPerCycle, 그룹 상한까지):
 *   1. claimedAt 조건부 갱신으로 점유 (다른 디스패처와 중복 방지)
 *   2. WorkQueue 항목 생성
 * </pre>
 *
 * <p><strong>차단 조건:</strong></p>
 * <ul>
 *   <li>QUEUED 상태 WorkQueue 항목이 있음 (재시도 대기 포함)</li>
 *   <li>PENDING/IN_PROGRESS Metadata가 있음</li>
 *   <li>AWAITING_INTERVENTION DeadLetter가 있음</li>
 *   <li>visibility timeout 안의 점유가 있음</li>
 * </ul>
 *
 * <p>점유는 {@link WorkQueueDispatcher}가 항목을 디스패치할 때 해제합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ManifestDispatcher implements Runtime {

    private static final Logger log = LoggerFactory.getLogger(ManifestDispatcher.class);

    private final DataContextFactory dataContextFactory;
    private final DueManifestEvaluator dueEvaluator;
    private final SchedulerConfig config;
    private final Clock clock;

    public ManifestDispatcher(DataContextFactory dataContextFactory, DueManifestEvaluator dueEvaluator,
                              SchedulerConfig config, Clock clock) {
        if (dataContextFactory == null) {
            throw new IllegalArgumentException("dataContextFactory cannot be null");
        }
        if (dueEvaluator == null) {
            throw new IllegalArgumentException("dueEvaluator cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.dataContextFactory = dataContextFactory;
        this.dueEvaluator = dueEvaluator;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public int pump() {
        Instant now = clock.instant();
        Instant staleBefore = now.minusMillis(config.visibilityTimeoutMs());

        List<Manifest> candidates;
        Map<String, Integer> activePerGroup;
        try (DataContext context = dataContextFactory.create()) {
            List<Manifest> manifests = context.manifests().findAll();
            Map<Long, Manifest> byId = manifests.stream()
                .collect(Collectors.toMap(Manifest::getId, Function.identity()));
            Set<Long> active = activeManifestIds(context);
            Set<Long> blocked = new HashSet<>(active);
            context.deadLetters().findAll(row -> row.getStatus() == DeadLetterStatus.AWAITING_INTERVENTION)
                .forEach(row -> blocked.add(row.getManifestId()));
            activePerGroup = countActivePerGroup(byId, active);
            candidates = manifests.stream()
                .filter(Manifest::isEnabled)
                .filter(manifest -> !blocked.contains(manifest.getId()))
                .filter(manifest -> !isClaimed(manifest, staleBefore))
                .filter(manifest -> isDue(manifest, byId, now))
                .sorted(Comparator.comparingInt(Manifest::getPriority).reversed()
                    .thenComparing(Manifest::getId))
                .toList();
        }

        int enqueued = 0;
        for (Manifest manifest : candidates) {
            if (enqueued >= config.maxJobsPerCycle()) {
                break;
            }
            if (isGroupFull(manifest, activePerGroup)) {
                log.debug("Group {} is at capacity, skipping manifest {}", manifest.getGroupId(),
                    manifest.getExternalId());
                continue;
            }
            if (tryEnqueue(manifest, now, staleBefore)) {
                enqueued++;
                if (manifest.getGroupId() != null) {
                    activePerGroup.merge(manifest.getGroupId(), 1, Integer::sum);
                }
            }
        }

        if (enqueued > 0) {
            log.info("Manifest dispatch completed: {} enqueued out of {} due", enqueued, candidates.size());
        }
        return enqueued;
    }

    private boolean tryEnqueue(Manifest manifest, Instant now, Instant staleBefore) {
        try (DataContext context = dataContextFactory.create()) {
            boolean claimed = context.manifests().updateIf(manifest.getId(),
                row -> row.isEnabled() && !isClaimed(row, staleBefore),
                row -> row.setClaimedAt(now));
            if (!claimed) {
                log.debug("Manifest {} was claimed by another dispatcher", manifest.getExternalId());
                return false;
            }
            WorkQueueEntry entry = context.workQueue().add(WorkQueueEntry.fromManifest(manifest, now, now));
            context.saveChanges();
            log.debug("Manifest {} queued as work queue entry {}", manifest.getExternalId(), entry.getId());
            return true;
        } catch (Exception e) {
            log.error("Failed to enqueue manifest {}", manifest.getExternalId(), e);
            return false;
        }
    }

    private boolean isDue(Manifest manifest, Map<Long, Manifest> byId, Instant now) {
        try {
            return dueEvaluator.isDue(manifest, byId, now);
        } catch (Exception e) {
            log.error("Failed to evaluate schedule of manifest {}", manifest.getExternalId(), e);
            return false;
        }
    }

    private boolean isGroupFull(Manifest manifest, Map<String, Integer> activePerGroup) {
        return config.maxActiveJobsPerGroup() > 0
            && manifest.getGroupId() != null
            && activePerGroup.getOrDefault(manifest.getGroupId(), 0) >= config.maxActiveJobsPerGroup();
    }

    private static boolean isClaimed(Manifest manifest, Instant staleBefore) {
        return manifest.getClaimedAt() != null && !manifest.getClaimedAt().isBefore(staleBefore);
    }

    /**
     * 큐에 있거나 실행 중인 Manifest id.
     */
    private static Set<Long> activeManifestIds(DataContext context) {
        Set<Long> active = new HashSet<>();
        context.workQueue().findAll(entry -> entry.getStatus() == WorkQueueStatus.QUEUED
                && entry.getManifestId() != null)
            .forEach(entry -> active.add(entry.getManifestId()));
        context.metadata().findAll(metadata -> metadata.getManifestId() != null
                && metadata.getWorkflowState().isActive())
            .forEach(metadata -> active.add(metadata.getManifestId()));
        return active;
    }

    private static Map<String, Integer> countActivePerGroup(Map<Long, Manifest> byId, Set<Long> active) {
        Map<String, Integer> counts = new HashMap<>();
        for (Long manifestId : active) {
            Manifest manifest = byId.get(manifestId);
            if (manifest != null && manifest.getGroupId() != null) {
                counts.merge(manifest.getGroupId(), 1, Integer::sum);
            }
        }
        return counts;
    }
}
