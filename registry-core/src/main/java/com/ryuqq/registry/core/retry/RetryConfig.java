package com.ryuqq.registry.core.retry;

/**
 * HTTP 재시도 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: 최대 시도 횟수, 첫 시도 포함 (기본 5)</li>
 *   <li>baseDelayMs: 기본 지연 (기본 1000ms)</li>
 *   <li>maxDelayMs: 최대 지연 (기본 30000ms)</li>
 *   <li>jitterFactor: 대칭 jitter 비율 (기본 0.1 → ±10%)</li>
 *   <li>multiplier: 지수 배수 (기본 2.0)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param maxAttempts 최대 시도 횟수 (1 이상)
 * @param baseDelayMs 기본 지연 (양수)
 * @param maxDelayMs 최대 지연 (baseDelayMs 이상)
 * @param jitterFactor jitter 비율 (0.0 ~ 1.0)
 * @param multiplier 지수 배수 (1.0 이상)
 */
public record RetryConfig(
    int maxAttempts,
    long baseDelayMs,
    long maxDelayMs,
    double jitterFactor,
    double multiplier
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxAttempts=5, baseDelayMs=1000, maxDelayMs=30000, jitterFactor=0.1, multiplier=2.0</p>
     */
    public RetryConfig() {
        this(5, 1000, 30000, 0.1, 2.0);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryConfig {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive (current: " + maxAttempts + ")");
        }
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be positive (current: " + baseDelayMs + ")");
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
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0 (current: " + multiplier + ")");
        }
    }

    public RetryConfig withMaxAttempts(int maxAttempts) {
        return new RetryConfig(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor, multiplier);
    }

    public RetryConfig withBaseDelayMs(long baseDelayMs) {
        return new RetryConfig(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor, multiplier);
    }

    public RetryConfig withMaxDelayMs(long maxDelayMs) {
        return new RetryConfig(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor, multiplier);
    }

    public RetryConfig withJitterFactor(double jitterFactor) {
        return new RetryConfig(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor, multiplier);
    }
}
