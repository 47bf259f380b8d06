package com.ryuqq.registry.core.protection;

/**
 * Rate Limiter 설정.
 *
 * <p>"분당 N건"으로 설정하며, 버킷 크기(capacity)는 기본적으로 분당 한도와 같습니다.
 * 리필 속도는 {@code requestsPerMinute / 60} 토큰/초 입니다.</p>
 *
 * @param requestsPerMinute 분당 허용 요청 수 (기본 180)
 * @param capacity 버킷 크기, 한 번에 요청할 수 있는 최대 토큰 수
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RateLimiterConfig(int requestsPerMinute, int capacity) {

    public static final int DEFAULT_REQUESTS_PER_MINUTE = 180;

    /**
     * 기본 설정 생성자 (분당 180건, capacity 180).
     */
    public RateLimiterConfig() {
        this(DEFAULT_REQUESTS_PER_MINUTE);
    }

    /**
     * capacity = requestsPerMinute 로 생성.
     *
     * @param requestsPerMinute 분당 허용 요청 수
     */
    public RateLimiterConfig(int requestsPerMinute) {
        this(requestsPerMinute, requestsPerMinute);
    }

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if requestsPerMinute or capacity is not positive
     */
    public RateLimiterConfig {
        if (requestsPerMinute <= 0) {
            throw new IllegalArgumentException(
                "requestsPerMinute must be positive (current: " + requestsPerMinute + ")"
            );
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive (current: " + capacity + ")");
        }
    }

    /**
     * @return 초당 리필 토큰 수
     */
    public double permitsPerSecond() {
        return requestsPerMinute / 60.0;
    }
}
