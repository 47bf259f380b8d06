package com.ryuqq.registry.adapter.runner;

import com.ryuqq.registry.core.config.ConfigValues;

import java.util.Map;

/**
 * PollingOrchestrator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>intervalMs: 폴링 간격 (기본 5000ms)</li>
 *   <li>maxAttempts: 최대 폴링 횟수 (기본 60)</li>
 *   <li>timeoutMs: 최대 대기 시간 (기본 300000ms = 5분)</li>
 * </ul>
 *
 * <p>maxAttempts와 timeoutMs 중 먼저 도달하는 쪽이 타임아웃을 결정합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param intervalMs 폴링 간격 (밀리초, 양수여야 함)
 * @param maxAttempts 최대 폴링 횟수 (1 이상이어야 함)
 * @param timeoutMs 최대 대기 시간 (밀리초, 양수여야 함)
 */
public record PollingConfig(
    long intervalMs,
    int maxAttempts,
    long timeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: intervalMs=5000, maxAttempts=60, timeoutMs=300000</p>
     */
    public PollingConfig() {
        this(5000, 60, 300_000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public PollingConfig {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be positive (current: " + intervalMs + ")");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive (current: " + maxAttempts + ")");
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive (current: " + timeoutMs + ")");
        }
    }

    /**
     * 환경 변수 스타일 키(POLL_INTERVAL_MS, POLL_MAX_ATTEMPTS, POLL_TIMEOUT_MS)에서 설정 생성.
     *
     * @param env 설정 맵
     * @return 누락된 키는 기본값으로 채운 설정
     */
    public static PollingConfig fromMap(Map<String, String> env) {
        PollingConfig defaults = new PollingConfig();
        return new PollingConfig(
            ConfigValues.longValue(env, "POLL_INTERVAL_MS", defaults.intervalMs()),
            ConfigValues.intValue(env, "POLL_MAX_ATTEMPTS", defaults.maxAttempts()),
            ConfigValues.longValue(env, "POLL_TIMEOUT_MS", defaults.timeoutMs())
        );
    }

    /**
     * intervalMs만 변경한 새 인스턴스 생성.
     */
    public PollingConfig withIntervalMs(long intervalMs) {
        return new PollingConfig(intervalMs, maxAttempts, timeoutMs);
    }

    /**
     * maxAttempts만 변경한 새 인스턴스 생성.
     */
    public PollingConfig withMaxAttempts(int maxAttempts) {
        return new PollingConfig(intervalMs, maxAttempts, timeoutMs);
    }

    /**
     * timeoutMs만 변경한 새 인스턴스 생성.
     */
    public PollingConfig withTimeoutMs(long timeoutMs) {
        return new PollingConfig(intervalMs, maxAttempts, timeoutMs);
    }
}
