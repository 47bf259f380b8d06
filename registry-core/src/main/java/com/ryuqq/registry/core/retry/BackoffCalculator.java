package com.ryuqq.registry.core.retry;

import com.ryuqq.registry.core.error.ErrorKind;
import com.ryuqq.registry.core.error.RegistryException;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 실패 유형별 Exponential Backoff with Jitter 계산기.
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * base    = baseDelay * categoryFactor
 * delay   = min(base * multiplier^(attempt-1), maxDelay)
 * jitter  = delay * jitterFactor * (2 * random - 1)      // 대칭 ±jitterFactor
 * result  = clamp(delay + jitter, minDelay, maxDelay)
 * </pre>
 *
 * <p><strong>유형별 기본 지연 배수:</strong></p>
 * <ul>
 *   <li>TIMEOUT: ×2</li>
 *   <li>NETWORK: ×1.5</li>
 *   <li>SERVER_OVERLOAD (503): ×3</li>
 *   <li>SERVER 502/504: ×2</li>
 *   <li>그 외: ×1</li>
 * </ul>
 *
 * <p>서버가 {@code Retry-After}를 준 경우 계산 없이 그 값을 그대로 사용합니다.</p>
 *
 * <p><strong>예시 (baseDelay=1000ms, multiplier=2, jitter 제외):</strong></p>
 * <ul>
 *   <li>attempt=1, SERVER: 1000ms</li>
 *   <li>attempt=2, TIMEOUT: 4000ms (2000 * 2^1)</li>
 *   <li>attempt=3, SERVER_OVERLOAD: 12000ms (3000 * 2^2)</li>
 *   <li>attempt=6, SERVER: 30000ms (maxDelay에서 cap)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    /**
     * 계산된 지연의 하한 (밀리초).
     */
    public static final long MIN_DELAY_MS = 100;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final double multiplier;
    private final DoubleSupplier random;

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: baseDelay=1000ms, maxDelay=30000ms, jitterFactor=0.1, multiplier=2.0</p>
     */
    public BackoffCalculator() {
        this(new RetryConfig());
    }

    /**
     * RetryConfig로 생성.
     *
     * @param config 재시도 설정
     */
    public BackoffCalculator(RetryConfig config) {
        this(config, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 난수 공급자 주입 (테스트용).
     *
     * @param config 재시도 설정
     * @param random [0, 1) 범위 난수 공급자
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public BackoffCalculator(RetryConfig config, DoubleSupplier random) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.baseDelayMs = config.baseDelayMs();
        this.maxDelayMs = config.maxDelayMs();
        this.jitterFactor = config.jitterFactor();
        this.multiplier = config.multiplier();
        this.random = random;
    }

    /**
     * 유형 구분 없이 재시도 지연 시간 계산.
     *
     * @param attemptCount 방금 실패한 시도 번호 (1부터 시작)
     * @return 재시도 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException attemptCount가 양수가 아닌 경우
     */
    public long calculate(int attemptCount) {
        return calculate(attemptCount, null);
    }

    /**
     * 실패 유형을 반영한 재시도 지연 시간 계산.
     *
     * @param attemptCount 방금 실패한 시도 번호 (1부터 시작)
     * @param failure 실패 정보 (null 허용)
     * @return 재시도 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException attemptCount가 양수가 아닌 경우
     */
    public long calculate(int attemptCount, RegistryException failure) {
        if (attemptCount <= 0) {
            throw new IllegalArgumentException(
                "attemptCount must be positive (current: " + attemptCount + ")"
            );
        }

        // 1. 서버 힌트 우선
        if (failure != null && failure.retryAfterMs() != null) {
            return failure.retryAfterMs();
        }

        // 2. 유형별 기본 지연 → 지수 증가 (maxDelay에서 cap)
        double base = baseDelayMs * categoryFactor(failure);
        double exponential = Math.min(base * Math.pow(multiplier, attemptCount - 1), maxDelayMs);

        // 3. 대칭 jitter
        double jitter = exponential * jitterFactor * (2.0 * random.getAsDouble() - 1.0);

        // 4. [MIN_DELAY_MS, maxDelayMs] 범위로 제한
        long delay = Math.round(exponential + jitter);
        return Math.max(Math.min(delay, maxDelayMs), Math.min(MIN_DELAY_MS, maxDelayMs));
    }

    /**
     * 실패 유형별 기본 지연 배수.
     *
     * @param failure 실패 정보 (null이면 1.0)
     * @return 배수
     */
    static double categoryFactor(RegistryException failure) {
        if (failure == null) {
            return 1.0;
        }
        ErrorKind kind = failure.kind();
        switch (kind) {
            case TIMEOUT:
                return 2.0;
            case NETWORK:
                return 1.5;
            case SERVER_OVERLOAD:
                return 3.0;
            case SERVER:
                Integer status = failure.statusCode();
                return status != null && (status == 502 || status == 504) ? 2.0 : 1.0;
            default:
                return 1.0;
        }
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
