package com.ryuqq.registry.core.protection;

import com.ryuqq.registry.core.error.CircuitOpenException;

import java.util.function.Supplier;

/**
 * Circuit Breaker SPI.
 *
 * <p>레지스트리 호출의 실패율을 추적하고, 임계값 초과 시 호출 없이 빠르게 실패(Fail-Fast)하여
 * 불안정한 레지스트리에 부하가 더 쌓이는 것을 방지합니다.</p>
 *
 * <p>Circuit Breaker 자체는 재시도하지 않습니다. 재시도 가능한 연산을 감싸는 게이트입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreaker cb = new SlidingWindowCircuitBreaker("tracking-service", new CircuitBreakerConfig());
 *
 * TrackedUpdates updates = cb.execute(() -> retryPolicy.run("fetchTrackedUpdates", attempt -> call(attempt)));
 * // OPEN 상태이면 operation 호출 없이 CircuitOpenException
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * Circuit Breaker를 통해 연산 실행.
     *
     * <p>{@link #tryAcquire()}가 거부하면 operation을 호출하지 않고
     * {@link CircuitOpenException}을 던집니다. 그 외에는 결과를 기록하고
     * 예외는 그대로 전파합니다.</p>
     *
     * @param operation 보호할 연산
     * @param <T> 결과 타입
     * @return operation 결과
     * @throws CircuitOpenException OPEN 상태이고 cooldown이 지나지 않은 경우
     */
    default <T> T execute(Supplier<T> operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (!tryAcquire()) {
            throw new CircuitOpenException(getName());
        }
        T result;
        try {
            result = operation.get();
        } catch (RuntimeException | Error e) {
            recordFailure(e);
            throw e;
        }
        recordSuccess();
        return result;
    }

    /**
     * Circuit Breaker 통과 허용 여부 확인.
     *
     * <ul>
     *   <li>CLOSED: 항상 true</li>
     *   <li>OPEN: cooldown 경과 시 HALF_OPEN으로 전이하고 프로브 1건 허용, 아니면 false</li>
     *   <li>HALF_OPEN: 프로브가 진행 중이면 false</li>
     * </ul>
     *
     * @return true: 통과 허용, false: 차단
     */
    boolean tryAcquire();

    /**
     * 실행 성공 기록. HALF_OPEN이면 CLOSED로 전이합니다.
     */
    void recordSuccess();

    /**
     * 실행 실패 기록. HALF_OPEN이면 OPEN으로, CLOSED이면 에러율 재계산 후 필요 시 OPEN으로 전이합니다.
     *
     * @param throwable 발생한 예외
     */
    void recordFailure(Throwable throwable);

    /**
     * 현재 상태 조회.
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * 관측용 통계 조회.
     *
     * @return 상태, 에러율, 표본 수
     */
    CircuitBreakerStats getStats();

    /**
     * 논리적 호출 그룹 이름.
     *
     * @return 이름 (예: requests-service)
     */
    String getName();

    /**
     * CLOSED 상태로 강제 리셋 (윈도우 초기화).
     *
     * <p>수동 복구 또는 테스트 목적으로 사용됩니다.</p>
     */
    void reset();
}
