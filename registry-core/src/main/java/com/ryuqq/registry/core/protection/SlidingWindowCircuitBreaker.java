package com.ryuqq.registry.core.protection;

import com.ryuqq.registry.core.model.CallOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 시간 기반 슬라이딩 윈도우 Circuit Breaker.
 *
 * <p>최근 {@code window} 동안의 호출 결과(CallOutcome)를 시간순 deque에 보관하고,
 * 기록할 때마다 윈도우 밖의 항목을 앞에서부터 제거합니다. deque가 시간순이므로
 * 제거 비용은 만료된 항목 수에 비례합니다.</p>
 *
 * <p><strong>트립 조건:</strong></p>
 * <pre>
 * total ≥ minimumRequests AND failures * 100 / total ≥ threshold
 * </pre>
 *
 * <p><strong>HALF_OPEN:</strong> 쿨다운 후 첫 호출 하나만 시험 호출로 허용하고, 허용한 스레드를 기억합니다.
 * 회로를 닫거나 다시 여는 것은 그 스레드가 기록한 결과뿐입니다. CLOSED일 때 허용되어
 * HALF_OPEN 중에 끝난 호출의 결과는 무시됩니다.</p>
 *
 * <p><strong>동시성:</strong> 윈도우와 상태는 하나의 ReentrantLock으로만 변경됩니다.
 * 배치 오케스트레이터의 여러 워커가 동시에 호출해도 안전합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SlidingWindowCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(SlidingWindowCircuitBreaker.class);

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<CallOutcome> window = new ArrayDeque<>();

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int failuresInWindow;
    private Instant openedAt;
    private Thread trialThread;

    /**
     * 생성자 (시스템 UTC 시계).
     *
     * @param name 논리적 호출 그룹 이름
     * @param config 설정
     */
    public SlidingWindowCircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, Clock.systemUTC());
    }

    /**
     * 생성자 (시계 주입).
     *
     * @param name 논리적 호출 그룹 이름
     * @param config 설정
     * @param clock 시계 (테스트에서 시간 제어용)
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SlidingWindowCircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.name = name;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public boolean tryAcquire() {
        lock.lock();
        try {
            switch (state) {
                case CLOSED:
                    return true;
                case OPEN:
                    Instant now = clock.instant();
                    if (now.isBefore(openedAt.plus(config.openCooldown()))) {
                        return false;
                    }
                    transitionTo(CircuitBreakerState.HALF_OPEN);
                    trialThread = Thread.currentThread();
                    return true;
                case HALF_OPEN:
                default:
                    if (trialThread != null) {
                        return false;
                    }
                    trialThread = Thread.currentThread();
                    return true;
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordSuccess() {
        lock.lock();
        try {
            Instant now = clock.instant();
            if (state == CircuitBreakerState.HALF_OPEN) {
                if (!isTrialThread()) {
                    log.debug("Circuit '{}' ignoring success of a call admitted before half-open", name);
                    return;
                }
                trialThread = null;
                clearWindow();
                transitionTo(CircuitBreakerState.CLOSED);
                return;
            }
            append(new CallOutcome(now, true));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordFailure(Throwable throwable) {
        lock.lock();
        try {
            Instant now = clock.instant();
            if (state == CircuitBreakerState.HALF_OPEN) {
                if (!isTrialThread()) {
                    log.debug("Circuit '{}' ignoring failure of a call admitted before half-open", name);
                    return;
                }
                trialThread = null;
                open(now);
                log.warn("Circuit '{}' trial call failed, reopening: {}", name,
                    throwable != null ? throwable.getMessage() : null);
                return;
            }
            append(new CallOutcome(now, false));
            if (state == CircuitBreakerState.CLOSED && shouldTrip()) {
                log.warn("Circuit '{}' opening: {}/{} failures ({}%) within {}",
                    name, failuresInWindow, window.size(), String.format("%.1f", errorRate()), config.window());
                open(now);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CircuitBreakerState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CircuitBreakerStats getStats() {
        lock.lock();
        try {
            prune(clock.instant());
            return new CircuitBreakerStats(name, state, errorRate(), window.size(), failuresInWindow, openedAt);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void reset() {
        lock.lock();
        try {
            clearWindow();
            trialThread = null;
            openedAt = null;
            transitionTo(CircuitBreakerState.CLOSED);
        } finally {
            lock.unlock();
        }
    }

    // lock을 보유한 상태에서만 호출
    private boolean isTrialThread() {
        return trialThread == Thread.currentThread();
    }

    private void append(CallOutcome outcome) {
        window.addLast(outcome);
        if (!outcome.success()) {
            failuresInWindow++;
        }
        prune(outcome.timestamp());
    }

    private void prune(Instant now) {
        Instant cutoff = now.minus(config.window());
        while (!window.isEmpty() && window.peekFirst().timestamp().isBefore(cutoff)) {
            CallOutcome expired = window.pollFirst();
            if (!expired.success()) {
                failuresInWindow--;
            }
        }
    }

    private boolean shouldTrip() {
        return window.size() >= config.minimumRequests()
            && errorRate() >= config.failureRateThresholdPercent();
    }

    private double errorRate() {
        return window.isEmpty() ? 0.0 : failuresInWindow * 100.0 / window.size();
    }

    private void open(Instant now) {
        openedAt = now;
        transitionTo(CircuitBreakerState.OPEN);
    }

    private void clearWindow() {
        window.clear();
        failuresInWindow = 0;
    }

    private void transitionTo(CircuitBreakerState next) {
        if (state != next) {
            log.info("Circuit '{}' {} → {}", name, state, next);
            state = next;
        }
    }
}
