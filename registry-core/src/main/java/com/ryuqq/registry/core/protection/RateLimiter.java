package com.ryuqq.registry.core.protection;

/**
 * Rate Limiter SPI.
 *
 * <p>호출자와 무관하게 레지스트리 전체에 대한 분당 요청 한도를 강제합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * RateLimiter limiter = new TokenBucketRateLimiter(new RateLimiterConfig(180));
 *
 * limiter.waitForTokens(1);   // 토큰 확보까지 블로킹
 * registry.call();
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface RateLimiter {

    /**
     * 토큰 획득 시도 (비블로킹).
     *
     * <p>토큰이 충분하면 즉시 소비하고 true, 부족하면 아무것도 소비하지 않고 false를 반환합니다.</p>
     *
     * @param permits 필요한 토큰 수 (1 이상)
     * @return true: 획득 성공, false: 토큰 부족
     */
    boolean tryAcquire(int permits);

    /**
     * 토큰을 획득할 때까지 대기.
     *
     * <p>capacity보다 많은 토큰은 절대 획득할 수 없으므로 즉시 거부합니다.</p>
     *
     * @param permits 필요한 토큰 수 (1 이상, capacity 이하)
     * @throws IllegalArgumentException permits가 범위를 벗어난 경우
     * @throws RuntimeException 대기 중 인터럽트 발생 시
     */
    void waitForTokens(int permits);

    /**
     * 현재 사용 가능한 토큰 수 (리필 반영).
     *
     * @return 0 이상 capacity 이하
     */
    double availableTokens();

    /**
     * Rate Limiter 설정 정보 조회.
     *
     * @return 설정
     */
    RateLimiterConfig getConfig();
}
