package com.ryuqq.railway.core.schedule;

import java.time.Duration;

/**
 * Manifest 옵션 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>enabled: 디스패치 대상 여부 (기본 true)</li>
 *   <li>maxRetries: 재시도 한도 (null이면 스케줄러 기본값)</li>
 *   <li>timeout: 실행 제한 시간 (null이면 스케줄러 기본값)</li>
 *   <li>groupId: 동시 실행 제한 그룹 (null 허용)</li>
 *   <li>priority: 높을수록 먼저 큐에 들어감 (기본 0)</li>
 * </ul>
 *
 * @param enabled 활성화 여부
 * @param maxRetries 재시도 한도 (0 이상, null 허용)
 * @param timeout 실행 제한 시간 (양수, null 허용)
 * @param groupId 그룹 id
 * @param priority 우선순위
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ManifestOptions(
    boolean enabled,
    Integer maxRetries,
    Duration timeout,
    String groupId,
    int priority
) {

    public ManifestOptions {
        if (maxRetries != null && maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0 (current: " + maxRetries + ")");
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
    }

    public static ManifestOptions defaults() {
        return new ManifestOptions(true, null, null, null, 0);
    }

    public ManifestOptions withEnabled(boolean enabled) {
        return new ManifestOptions(enabled, maxRetries, timeout, groupId, priority);
    }

    public ManifestOptions withMaxRetries(Integer maxRetries) {
        return new ManifestOptions(enabled, maxRetries, timeout, groupId, priority);
    }

    public ManifestOptions withTimeout(Duration timeout) {
        return new ManifestOptions(enabled, maxRetries, timeout, groupId, priority);
    }

    public ManifestOptions withGroupId(String groupId) {
        return new ManifestOptions(enabled, maxRetries, timeout, groupId, priority);
    }

    public ManifestOptions withPriority(int priority) {
        return new ManifestOptions(enabled, maxRetries, timeout, groupId, priority);
    }
}
