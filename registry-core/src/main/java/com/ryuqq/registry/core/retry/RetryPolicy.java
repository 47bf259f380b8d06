package com.ryuqq.registry.core.retry;

import com.ryuqq.registry.core.error.RegistryException;
import com.ryuqq.registry.core.spi.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP 수준 재시도 정책.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * attempt = 1
 * loop:
 *   call(attempt)
 *     ├─ 성공 → 반환
 *     └─ 실패 → FailureClassifier로 분류
 *          ├─ retryable=false → 즉시 전파 (1회 시도)
 *          ├─ attempt == maxAttempts → 마지막 오류 전파
 *          └─ backoff 계산 (Retry-After 우선) → sleep → attempt++
 * </pre>
 *
 * <p>이 정책은 "호출이 실패했기 때문에" 재시도합니다. 작업이 아직 진행 중이라서
 * 다시 조회하는 폴링 루프와는 별개입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final RetryConfig config;
    private final BackoffCalculator backoffCalculator;
    private final Sleeper sleeper;

    /**
     * 생성자 (기본 BackoffCalculator, Thread.sleep).
     *
     * @param config 재시도 설정
     */
    public RetryPolicy(RetryConfig config) {
        this(config, new BackoffCalculator(config), Sleeper.system());
    }

    /**
     * 생성자 (의존성 주입).
     *
     * @param config 재시도 설정
     * @param backoffCalculator 백오프 계산기
     * @param sleeper 대기 구현
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RetryPolicy(RetryConfig config, BackoffCalculator backoffCalculator, Sleeper sleeper) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.config = config;
        this.backoffCalculator = backoffCalculator;
        this.sleeper = sleeper;
    }

    /**
     * 재시도 정책에 따라 연산 실행.
     *
     * @param operationName 로그용 연산 이름
     * @param call 시도 단위 연산
     * @param <T> 결과 타입
     * @return 연산 결과
     * @throws RegistryException 재시도 불가 오류 또는 시도 횟수 소진 시 마지막 오류
     */
    public <T> T run(String operationName, RetryableCall<T> call) {
        if (call == null) {
            throw new IllegalArgumentException("call cannot be null");
        }
        int attempt = 1;
        while (true) {
            try {
                return call.call(attempt);
            } catch (RuntimeException e) {
                RegistryException failure = FailureClassifier.fromThrowable(e);

                if (!failure.isRetryable()) {
                    throw failure;
                }
                if (attempt >= config.maxAttempts()) {
                    log.warn("{} giving up after {} attempts: {}", operationName, attempt, failure.getMessage());
                    throw failure;
                }

                long delay = backoffCalculator.calculate(attempt, failure);
                log.warn("{} attempt {}/{} failed ({}), retrying in {}ms",
                    operationName, attempt, config.maxAttempts(), failure.kind(), delay);
                sleeper.sleep(delay);
                attempt++;
            }
        }
    }

    public RetryConfig getConfig() {
        return config;
    }
}
