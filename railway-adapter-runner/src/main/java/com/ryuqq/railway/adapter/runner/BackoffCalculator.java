package com.ryuqq.railway.adapter.runner;

import com.ryuqq.railway.application.scheduler.SchedulerConfig;

import java.time.Duration;
import java.util.function.DoubleSupplier;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>실패한 Manifest 실행을 다시 큐에 넣을 때 availableAt 지연을 계산합니다.
 * Jitter로 같은 시각에 실패한 작업들이 한꺼번에 다시 실행되지 않게 합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(baseDelay * 2^(retryCount-1) + jitter, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (기본 설정: baseDelay=5분, maxDelay=1시간):</strong></p>
 * <ul>
 *   <li>retryCount=1: 5분 + jitter</li>
 *   <li>retryCount=2: 10분 + jitter</li>
 *   <li>retryCount=3: 20분 + jitter</li>
 *   <li>retryCount=5: 80분 → 1시간으로 제한</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class BackoffCalculator {

    private static final double DEFAULT_JITTER_FACTOR = 0.1;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final DoubleSupplier random;

    /**
     * 스케줄러 설정의 재시도 지연 범위로 생성.
     *
     * @param config 스케줄러 설정
     * @return 계산기
     */
    public static BackoffCalculator from(SchedulerConfig config) {
        return new BackoffCalculator(config.retryBaseDelayMs(), config.retryMaxDelayMs(), DEFAULT_JITTER_FACTOR,
            Math::random);
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초, 0 이상)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @param random [0, 1) 난수 공급자
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor, DoubleSupplier random) {
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be >= 0 (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    /**
     * 재시도 지연 계산.
     *
     * @param retryCount 이번 재시도가 몇 번째인지 (1부터 시작)
     * @return 다시 실행 가능해질 때까지의 지연
     * @throws IllegalArgumentException retryCount가 양수가 아닌 경우
     */
    public Duration calculate(int retryCount) {
        if (retryCount <= 0) {
            throw new IllegalArgumentException(
                "retryCount must be positive (current: " + retryCount + ")"
            );
        }
        // 2^62 이상은 shift overflow
        int exponent = Math.min(retryCount - 1, 62);
        long multiplier = 1L << exponent;
        long exponential = baseDelayMs > maxDelayMs / multiplier ? maxDelayMs : baseDelayMs * multiplier;
        long jitter = (long) (exponential * jitterFactor * random.getAsDouble());
        return Duration.ofMillis(Math.min(exponential + jitter, maxDelayMs));
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }
}
