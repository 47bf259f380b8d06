package com.ryuqq.registry.core.protection;

import com.ryuqq.registry.core.spi.Sleeper;

import java.time.Clock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token Bucket Rate Limiter.
 *
 * <p>가득 찬 버킷으로 시작하며, 백그라운드 스레드 없이 접근할 때마다
 * 경과 시간만큼 지연 리필합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * tokens = min(capacity, tokens + elapsedSeconds * permitsPerSecond)
 * tryAcquire(n): tokens ≥ n 이면 tokens -= n
 * waitForTokens(n): tryAcquire 실패 시 min(ceil(n / permitsPerSecond * 1000), 1000)ms 대기 후 재시도
 * </pre>
 *
 * <p><strong>동시성:</strong> 토큰 수는 하나의 ReentrantLock 안에서만 변경됩니다.
 * 대기(sleep)는 락 밖에서 수행합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TokenBucketRateLimiter implements RateLimiter {

    private static final long MAX_WAIT_SLICE_MS = 1000;

    private final RateLimiterConfig config;
    private final Clock clock;
    private final Sleeper sleeper;
    private final ReentrantLock lock = new ReentrantLock();

    private double tokens;
    private long lastRefillMillis;

    /**
     * 생성자 (시스템 시계, Thread.sleep).
     *
     * @param config 설정
     */
    public TokenBucketRateLimiter(RateLimiterConfig config) {
        this(config, Clock.systemUTC(), Sleeper.system());
    }

    /**
     * 생성자 (시계, Sleeper 주입).
     *
     * @param config 설정
     * @param clock 시계
     * @param sleeper 대기 구현
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public TokenBucketRateLimiter(RateLimiterConfig config, Clock clock, Sleeper sleeper) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.config = config;
        this.clock = clock;
        this.sleeper = sleeper;
        this.tokens = config.capacity();
        this.lastRefillMillis = clock.millis();
    }

    @Override
    public boolean tryAcquire(int permits) {
        validatePermits(permits);
        lock.lock();
        try {
            refill();
            if (tokens >= permits) {
                tokens -= permits;
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void waitForTokens(int permits) {
        validatePermits(permits);
        if (permits > config.capacity()) {
            throw new IllegalArgumentException(
                "permits exceeds bucket capacity and can never be granted (permits: " + permits
                    + ", capacity: " + config.capacity() + ")"
            );
        }
        long waitMs = Math.min(
            (long) Math.ceil(permits / config.permitsPerSecond() * 1000.0),
            MAX_WAIT_SLICE_MS
        );
        while (!tryAcquire(permits)) {
            sleeper.sleep(waitMs);
        }
    }

    @Override
    public double availableTokens() {
        lock.lock();
        try {
            refill();
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public RateLimiterConfig getConfig() {
        return config;
    }

    // lock을 보유한 상태에서만 호출
    private void refill() {
        long now = clock.millis();
        long elapsed = now - lastRefillMillis;
        if (elapsed <= 0) {
            return;
        }
        tokens = Math.min(config.capacity(), tokens + elapsed / 1000.0 * config.permitsPerSecond());
        lastRefillMillis = now;
    }

    private void validatePermits(int permits) {
        if (permits <= 0) {
            throw new IllegalArgumentException("permits must be positive (current: " + permits + ")");
        }
    }
}
