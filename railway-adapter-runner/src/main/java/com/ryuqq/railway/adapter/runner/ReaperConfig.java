package com.ryuqq.railway.adapter.runner;

/**
 * StuckJobReaper 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scanIntervalMs: 스캔 주기 (기본 300000ms = 5분)</li>
 *   <li>timeoutThresholdMs: Manifest에 timeout이 없을 때 적용할 실행 제한 (기본 3600000ms = 1시간)</li>
 *   <li>batchSize: 한 번에 처리할 항목 수 (기본 50)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param scanIntervalMs 스캔 주기 (밀리초, 양수여야 함)
 * @param timeoutThresholdMs 기본 실행 제한 (밀리초, 양수여야 함)
 * @param batchSize 배치 크기 (1 이상이어야 함)
 */
public record ReaperConfig(
    long scanIntervalMs,
    long timeoutThresholdMs,
    int batchSize
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: scanIntervalMs=300000ms (5분), timeoutThresholdMs=3600000ms (1시간), batchSize=50</p>
     */
    public ReaperConfig() {
        this(300000, 3600000, 50);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ReaperConfig {
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "scanIntervalMs must be positive (current: " + scanIntervalMs + ")"
            );
        }
        if (timeoutThresholdMs <= 0) {
            throw new IllegalArgumentException(
                "timeoutThresholdMs must be positive (current: " + timeoutThresholdMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
    }

    public ReaperConfig withScanIntervalMs(long scanIntervalMs) {
        return new ReaperConfig(scanIntervalMs, timeoutThresholdMs, batchSize);
    }

    public ReaperConfig withTimeoutThresholdMs(long timeoutThresholdMs) {
        return new ReaperConfig(scanIntervalMs, timeoutThresholdMs, batchSize);
    }

    public ReaperConfig withBatchSize(int batchSize) {
        return new ReaperConfig(scanIntervalMs, timeoutThresholdMs, batchSize);
    }
}
