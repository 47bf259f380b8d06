package com.ryuqq.registry.core.protection;

import java.time.Duration;

/**
 * Circuit Breaker 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>failureRateThresholdPercent: OPEN 전이 에러율 (기본 10%, 경계 포함)</li>
 *   <li>window: 에러율 계산 슬라이딩 윈도우 (기본 5분, 호출 수가 아닌 경과 시간 기준)</li>
 *   <li>openCooldown: OPEN 유지 시간 (기본 10분)</li>
 *   <li>minimumRequests: OPEN 판단에 필요한 최소 표본 수 (기본 10)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param failureRateThresholdPercent 에러율 임계값 (0 초과 100 이하)
 * @param window 슬라이딩 윈도우 길이 (양수)
 * @param openCooldown OPEN 상태 유지 시간 (양수)
 * @param minimumRequests 최소 표본 수 (1 이상)
 */
public record CircuitBreakerConfig(
    double failureRateThresholdPercent,
    Duration window,
    Duration openCooldown,
    int minimumRequests
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: threshold=10%, window=5분, cooldown=10분, minimumRequests=10</p>
     */
    public CircuitBreakerConfig() {
        this(10.0, Duration.ofMinutes(5), Duration.ofMinutes(10), 10);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CircuitBreakerConfig {
        if (failureRateThresholdPercent <= 0.0 || failureRateThresholdPercent > 100.0) {
            throw new IllegalArgumentException(
                "failureRateThresholdPercent must be in (0, 100] (current: " + failureRateThresholdPercent + ")"
            );
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive (current: " + window + ")");
        }
        if (openCooldown == null || openCooldown.isZero() || openCooldown.isNegative()) {
            throw new IllegalArgumentException("openCooldown must be positive (current: " + openCooldown + ")");
        }
        if (minimumRequests <= 0) {
            throw new IllegalArgumentException(
                "minimumRequests must be positive (current: " + minimumRequests + ")"
            );
        }
    }

    public CircuitBreakerConfig withFailureRateThresholdPercent(double failureRateThresholdPercent) {
        return new CircuitBreakerConfig(failureRateThresholdPercent, window, openCooldown, minimumRequests);
    }

    public CircuitBreakerConfig withWindow(Duration window) {
        return new CircuitBreakerConfig(failureRateThresholdPercent, window, openCooldown, minimumRequests);
    }

    public CircuitBreakerConfig withOpenCooldown(Duration openCooldown) {
        return new CircuitBreakerConfig(failureRateThresholdPercent, window, openCooldown, minimumRequests);
    }

    public CircuitBreakerConfig withMinimumRequests(int minimumRequests) {
        return new CircuitBreakerConfig(failureRateThresholdPercent, window, openCooldown, minimumRequests);
    }
}
