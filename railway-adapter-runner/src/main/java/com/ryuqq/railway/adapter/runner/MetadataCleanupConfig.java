package com.ryuqq.railway.adapter.runner;

import java.util.Set;

/**
 * MetadataCleaner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>cleanupIntervalMs: 정리 주기 (기본 60000ms = 1분)</li>
 *   <li>retentionMs: 종료 후 보존 기간 (기본 3600000ms = 1시간)</li>
 *   <li>batchSize: 한 번에 삭제할 최대 Metadata 수 (기본 500)</li>
 *   <li>workflowNames: 정리 대상 Workflow 이름 (비어 있으면 전체)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param cleanupIntervalMs 정리 주기 (밀리초, 양수)
 * @param retentionMs 보존 기간 (밀리초, 양수)
 * @param batchSize 배치 크기 (1 이상)
 * @param workflowNames 정리 대상 Workflow 이름
 */
public record MetadataCleanupConfig(
    long cleanupIntervalMs,
    long retentionMs,
    int batchSize,
    Set<String> workflowNames
) {

    public MetadataCleanupConfig() {
        this(60000, 3600000, 500, Set.of());
    }

    public MetadataCleanupConfig {
        if (cleanupIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "cleanupIntervalMs must be positive (current: " + cleanupIntervalMs + ")"
            );
        }
        if (retentionMs <= 0) {
            throw new IllegalArgumentException(
                "retentionMs must be positive (current: " + retentionMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
        if (workflowNames == null) {
            throw new IllegalArgumentException("workflowNames cannot be null");
        }
        workflowNames = Set.copyOf(workflowNames);
    }

    public MetadataCleanupConfig withRetentionMs(long retentionMs) {
        return new MetadataCleanupConfig(cleanupIntervalMs, retentionMs, batchSize, workflowNames);
    }

    public MetadataCleanupConfig withWorkflowNames(Set<String> workflowNames) {
        return new MetadataCleanupConfig(cleanupIntervalMs, retentionMs, batchSize, workflowNames);
    }

    public boolean includes(String workflowName) {
        return workflowNames.isEmpty() || workflowNames.contains(workflowName);
    }
}
