package com.ryuqq.railway.adapter.runner;

import com.ryuqq.railway.core.model.Manifest;
import com.ryuqq.railway.core.spi.CronEvaluator;

import java.time.Instant;
import java.util.Map;

/**
 * Manifest 실행 시점 판정.
 *
 * <ul>
 *   <li>INTERVAL: 성공 이력이 없거나 lastSuccessfulRun + interval ≤ now</li>
 *   <li>CRON: lastSuccessfulRun(없으면 createdAt) 이후 다음 발생 시각 ≤ now</li>
 *   <li>DEPENDENT: 부모의 lastSuccessfulRun이 자신의 lastSuccessfulRun보다 나중</li>
 *   <li>NONE: trigger로만 실행</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DueManifestEvaluator {

    private final CronEvaluator cronEvaluator;

    public DueManifestEvaluator(CronEvaluator cronEvaluator) {
        if (cronEvaluator == null) {
            throw new IllegalArgumentException("cronEvaluator cannot be null");
        }
        this.cronEvaluator = cronEvaluator;
    }

    /**
     * 실행 시점 도달 여부.
     *
     * @param manifest 판정 대상
     * @param manifestsById 부모 조회용 전체 Manifest
     * @param now 현재 시각
     * @return 실행할 차례면 true
     */
    public boolean isDue(Manifest manifest, Map<Long, Manifest> manifestsById, Instant now) {
        Instant last = manifest.getLastSuccessfulRun();
        return switch (manifest.getScheduleType()) {
            case NONE -> false;
            case INTERVAL -> last == null
                || !last.plusSeconds(manifest.getIntervalSeconds()).isAfter(now);
            case CRON -> {
                Instant base = last != null ? last : manifest.getCreatedAt();
                yield base == null
                    || !cronEvaluator.nextOccurrence(manifest.getCronExpression(), base).isAfter(now);
            }
            case DEPENDENT -> {
                Manifest parent = manifestsById.get(manifest.getDependsOnManifestId());
                Instant parentRun = parent == null ? null : parent.getLastSuccessfulRun();
                yield parentRun != null && (last == null || parentRun.isAfter(last));
            }
        };
    }
}
