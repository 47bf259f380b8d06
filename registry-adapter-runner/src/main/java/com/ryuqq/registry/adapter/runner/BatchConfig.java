package com.ryuqq.registry.adapter.runner;

import com.ryuqq.registry.core.config.ConfigValues;

import java.time.Duration;
import java.util.Map;

/**
 * BatchOrchestrator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>batchSize: 배치 크기 (기본 50)</li>
 *   <li>concurrency: 동시 처리 스레드 수 (기본 5)</li>
 *   <li>interBatchDelayMs: 배치 사이 대기 시간 (기본 2000ms)</li>
 *   <li>lookback: 업데이트 조회 기준 시간 (기본 24시간)</li>
 *   <li>entityMaxRetries: 엔티티 단위 재시도 횟수 (기본 2)</li>
 *   <li>entityRetryDelayMs: 엔티티 재시도 간격 (기본 3000ms)</li>
 *   <li>maxErrors: 요약에 보관할 최대 오류 수 (기본 100)</li>
 * </ul>
 *
 * <p><strong>재시도 중첩 주의:</strong></p>
 * <p>엔티티 단위 재시도와 Gateway의 HTTP 재시도는 독립적으로 동작하며 곱으로 누적됩니다.
 * Gateway 호출 하나가 한 엔티티에 대해 보낼 수 있는 최대 HTTP 시도 수는
 * {@code (entityMaxRetries + 1) * REGISTRY_MAX_RETRIES} 입니다
 * (기본값: 3 * 5 = 15). {@link #worstCaseHttpAttempts(int)} 참조.</p>
 *
 * <p><strong>성능 튜닝 가이드:</strong></p>
 * <ul>
 *   <li>rate limit 여유: concurrency 증가 (5 → 10)</li>
 *   <li>registry 부하 완화: interBatchDelayMs 증가, batchSize 감소</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param batchSize 배치 크기 (1 이상이어야 함)
 * @param concurrency 동시 처리 스레드 수 (1 이상이어야 함)
 * @param interBatchDelayMs 배치 사이 대기 시간 (밀리초, 0 이상)
 * @param lookback 업데이트 조회 기준 시간 (양수여야 함)
 * @param entityMaxRetries 엔티티 단위 재시도 횟수 (0 이상)
 * @param entityRetryDelayMs 엔티티 재시도 간격 (밀리초, 0 이상)
 * @param maxErrors 요약에 보관할 최대 오류 수 (0 이상)
 */
public record BatchConfig(
    int batchSize,
    int concurrency,
    long interBatchDelayMs,
    Duration lookback,
    int entityMaxRetries,
    long entityRetryDelayMs,
    int maxErrors
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: batchSize=50, concurrency=5, interBatchDelayMs=2000, lookback=24h,
     * entityMaxRetries=2, entityRetryDelayMs=3000, maxErrors=100</p>
     */
    public BatchConfig() {
        this(50, 5, 2000, Duration.ofHours(24), 2, 3000, 100);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BatchConfig {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive (current: " + batchSize + ")");
        }
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive (current: " + concurrency + ")");
        }
        if (interBatchDelayMs < 0) {
            throw new IllegalArgumentException(
                "interBatchDelayMs cannot be negative (current: " + interBatchDelayMs + ")");
        }
        if (lookback == null || lookback.isZero() || lookback.isNegative()) {
            throw new IllegalArgumentException("lookback must be positive (current: " + lookback + ")");
        }
        if (entityMaxRetries < 0) {
            throw new IllegalArgumentException(
                "entityMaxRetries cannot be negative (current: " + entityMaxRetries + ")");
        }
        if (entityRetryDelayMs < 0) {
            throw new IllegalArgumentException(
                "entityRetryDelayMs cannot be negative (current: " + entityRetryDelayMs + ")");
        }
        if (maxErrors < 0) {
            throw new IllegalArgumentException("maxErrors cannot be negative (current: " + maxErrors + ")");
        }
    }

    /**
     * 환경 변수 스타일 키에서 설정 생성.
     *
     * <p>키: BATCH_SIZE, BATCH_CONCURRENCY, BATCH_DELAY_MS, BATCH_LOOKBACK_HOURS,
     * ENTITY_MAX_RETRIES, ENTITY_RETRY_DELAY_MS</p>
     *
     * @param env 설정 맵
     * @return 누락된 키는 기본값으로 채운 설정
     */
    public static BatchConfig fromMap(Map<String, String> env) {
        BatchConfig defaults = new BatchConfig();
        return new BatchConfig(
            ConfigValues.intValue(env, "BATCH_SIZE", defaults.batchSize()),
            ConfigValues.intValue(env, "BATCH_CONCURRENCY", defaults.concurrency()),
            ConfigValues.longValue(env, "BATCH_DELAY_MS", defaults.interBatchDelayMs()),
            Duration.ofHours(ConfigValues.longValue(env, "BATCH_LOOKBACK_HOURS", defaults.lookback().toHours())),
            ConfigValues.intValue(env, "ENTITY_MAX_RETRIES", defaults.entityMaxRetries()),
            ConfigValues.longValue(env, "ENTITY_RETRY_DELAY_MS", defaults.entityRetryDelayMs()),
            defaults.maxErrors()
        );
    }

    /**
     * 엔티티 하나의 Gateway 호출 하나가 보낼 수 있는 최대 HTTP 시도 수.
     *
     * @param httpMaxAttempts Gateway RetryPolicy의 maxAttempts
     * @return {@code (entityMaxRetries + 1) * httpMaxAttempts}
     */
    public int worstCaseHttpAttempts(int httpMaxAttempts) {
        return (entityMaxRetries + 1) * httpMaxAttempts;
    }

    /**
     * batchSize만 변경한 새 인스턴스 생성.
     */
    public BatchConfig withBatchSize(int batchSize) {
        return new BatchConfig(batchSize, concurrency, interBatchDelayMs, lookback, entityMaxRetries,
            entityRetryDelayMs, maxErrors);
    }

    /**
     * concurrency만 변경한 새 인스턴스 생성.
     */
    public BatchConfig withConcurrency(int concurrency) {
        return new BatchConfig(batchSize, concurrency, interBatchDelayMs, lookback, entityMaxRetries,
            entityRetryDelayMs, maxErrors);
    }

    /**
     * interBatchDelayMs만 변경한 새 인스턴스 생성.
     */
    public BatchConfig withInterBatchDelayMs(long interBatchDelayMs) {
        return new BatchConfig(batchSize, concurrency, interBatchDelayMs, lookback, entityMaxRetries,
            entityRetryDelayMs, maxErrors);
    }

    /**
     * lookback만 변경한 새 인스턴스 생성.
     */
    public BatchConfig withLookback(Duration lookback) {
        return new BatchConfig(batchSize, concurrency, interBatchDelayMs, lookback, entityMaxRetries,
            entityRetryDelayMs, maxErrors);
    }

    /**
     * entityMaxRetries만 변경한 새 인스턴스 생성.
     */
    public BatchConfig withEntityMaxRetries(int entityMaxRetries) {
        return new BatchConfig(batchSize, concurrency, interBatchDelayMs, lookback, entityMaxRetries,
            entityRetryDelayMs, maxErrors);
    }

    /**
     * entityRetryDelayMs만 변경한 새 인스턴스 생성.
     */
    public BatchConfig withEntityRetryDelayMs(long entityRetryDelayMs) {
        return new BatchConfig(batchSize, concurrency, interBatchDelayMs, lookback, entityMaxRetries,
            entityRetryDelayMs, maxErrors);
    }

    /**
     * maxErrors만 변경한 새 인스턴스 생성.
     */
    public BatchConfig withMaxErrors(int maxErrors) {
        return new BatchConfig(batchSize, concurrency, interBatchDelayMs, lookback, entityMaxRetries,
            entityRetryDelayMs, maxErrors);
    }
}
