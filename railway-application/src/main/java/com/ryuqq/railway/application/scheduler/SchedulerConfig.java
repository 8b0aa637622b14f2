package com.ryuqq.railway.application.scheduler;

/**
 * 스케줄러/디스패처 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>pollingIntervalMs: 디스패처 폴링 주기 (기본 60000ms = 1분)</li>
 *   <li>maxJobsPerCycle: 한 주기에 큐에 넣을 최대 Manifest 수 (기본 100)</li>
 *   <li>defaultMaxRetries: 옵션에 없을 때 재시도 한도 (기본 3)</li>
 *   <li>visibilityTimeoutMs: 점유 만료 시간 (기본 300000ms = 5분)</li>
 *   <li>retryBaseDelayMs: 재시도 백오프 기본 지연 (기본 300000ms = 5분)</li>
 *   <li>retryMaxDelayMs: 재시도 백오프 상한 (기본 3600000ms = 1시간)</li>
 *   <li>maxActiveJobsPerGroup: 그룹별 동시 활성 작업 상한 (0이면 제한 없음)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param pollingIntervalMs 폴링 주기 (밀리초, 양수)
 * @param maxJobsPerCycle 주기당 최대 작업 수 (1 이상)
 * @param defaultMaxRetries 기본 재시도 한도 (0 이상)
 * @param visibilityTimeoutMs 점유 만료 시간 (밀리초, 양수)
 * @param retryBaseDelayMs 백오프 기본 지연 (밀리초, 0 이상)
 * @param retryMaxDelayMs 백오프 상한 (밀리초, retryBaseDelayMs 이상)
 * @param maxActiveJobsPerGroup 그룹별 동시 활성 작업 상한 (0 이상)
 */
public record SchedulerConfig(
    long pollingIntervalMs,
    int maxJobsPerCycle,
    int defaultMaxRetries,
    long visibilityTimeoutMs,
    long retryBaseDelayMs,
    long retryMaxDelayMs,
    int maxActiveJobsPerGroup
) {

    /**
     * 기본 설정 생성자.
     */
    public SchedulerConfig() {
        this(60000, 100, 3, 300000, 300000, 3600000, 0);
    }

    public SchedulerConfig {
        if (pollingIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "pollingIntervalMs must be positive (current: " + pollingIntervalMs + ")"
            );
        }
        if (maxJobsPerCycle <= 0) {
            throw new IllegalArgumentException(
                "maxJobsPerCycle must be positive (current: " + maxJobsPerCycle + ")"
            );
        }
        if (defaultMaxRetries < 0) {
            throw new IllegalArgumentException(
                "defaultMaxRetries must be >= 0 (current: " + defaultMaxRetries + ")"
            );
        }
        if (visibilityTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "visibilityTimeoutMs must be positive (current: " + visibilityTimeoutMs + ")"
            );
        }
        if (retryBaseDelayMs < 0) {
            throw new IllegalArgumentException(
                "retryBaseDelayMs must be >= 0 (current: " + retryBaseDelayMs + ")"
            );
        }
        if (retryMaxDelayMs < retryBaseDelayMs) {
            throw new IllegalArgumentException(
                "retryMaxDelayMs must be >= retryBaseDelayMs (current: " + retryMaxDelayMs + ")"
            );
        }
        if (maxActiveJobsPerGroup < 0) {
            throw new IllegalArgumentException(
                "maxActiveJobsPerGroup must be >= 0 (current: " + maxActiveJobsPerGroup + ")"
            );
        }
    }

    public SchedulerConfig withPollingIntervalMs(long pollingIntervalMs) {
        return new SchedulerConfig(pollingIntervalMs, maxJobsPerCycle, defaultMaxRetries, visibilityTimeoutMs,
            retryBaseDelayMs, retryMaxDelayMs, maxActiveJobsPerGroup);
    }

    public SchedulerConfig withMaxJobsPerCycle(int maxJobsPerCycle) {
        return new SchedulerConfig(pollingIntervalMs, maxJobsPerCycle, defaultMaxRetries, visibilityTimeoutMs,
            retryBaseDelayMs, retryMaxDelayMs, maxActiveJobsPerGroup);
    }

    public SchedulerConfig withDefaultMaxRetries(int defaultMaxRetries) {
        return new SchedulerConfig(pollingIntervalMs, maxJobsPerCycle, defaultMaxRetries, visibilityTimeoutMs,
            retryBaseDelayMs, retryMaxDelayMs, maxActiveJobsPerGroup);
    }

    public SchedulerConfig withVisibilityTimeoutMs(long visibilityTimeoutMs) {
        return new SchedulerConfig(pollingIntervalMs, maxJobsPerCycle, defaultMaxRetries, visibilityTimeoutMs,
            retryBaseDelayMs, retryMaxDelayMs, maxActiveJobsPerGroup);
    }

    /**
     * 재시도 백오프 범위만 변경한 새 인스턴스 생성.
     */
    public SchedulerConfig withRetryDelays(long retryBaseDelayMs, long retryMaxDelayMs) {
        return new SchedulerConfig(pollingIntervalMs, maxJobsPerCycle, defaultMaxRetries, visibilityTimeoutMs,
            retryBaseDelayMs, retryMaxDelayMs, maxActiveJobsPerGroup);
    }

    public SchedulerConfig withMaxActiveJobsPerGroup(int maxActiveJobsPerGroup) {
        return new SchedulerConfig(pollingIntervalMs, maxJobsPerCycle, defaultMaxRetries, visibilityTimeoutMs,
            retryBaseDelayMs, retryMaxDelayMs, maxActiveJobsPerGroup);
    }
}
