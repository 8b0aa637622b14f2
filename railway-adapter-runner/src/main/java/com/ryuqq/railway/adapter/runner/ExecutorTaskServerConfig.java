package com.ryuqq.railway.adapter.runner;

/**
 * ExecutorTaskServer 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>concurrency: 동시 실행 스레드 수 (기본 5)</li>
 *   <li>shutdownTimeoutMs: 종료 시 진행 중 작업 대기 시간 (기본 60000ms)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param concurrency 동시 실행 스레드 수 (1 이상)
 * @param shutdownTimeoutMs 종료 대기 시간 (밀리초, 양수)
 */
public record ExecutorTaskServerConfig(
    int concurrency,
    long shutdownTimeoutMs
) {

    public ExecutorTaskServerConfig() {
        this(5, 60000);
    }

    public ExecutorTaskServerConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    public ExecutorTaskServerConfig withConcurrency(int concurrency) {
        return new ExecutorTaskServerConfig(concurrency, shutdownTimeoutMs);
    }
}
