package com.ryuqq.registry.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상, 초기 상태)
 *   │
 *   ▼ (윈도우 내 호출 수 ≥ minRequests 이고 에러율 ≥ threshold)
 * OPEN (차단)
 *   │
 *   ▼ (cooldown 경과 후 다음 호출)
 * HALF_OPEN (프로브 1건 통과)
 *   │
 *   ├─► 성공 → CLOSED (윈도우 초기화)
 *   └─► 실패 → OPEN (cooldown 재시작)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태. 모든 호출을 통과시키고 결과를 윈도우에 기록합니다.
     */
    CLOSED,

    /**
     * 차단 상태. cooldown이 지나기 전까지 호출 없이 즉시 실패합니다.
     */
    OPEN,

    /**
     * 반개방 상태. 프로브 호출 1건의 결과로 CLOSED 또는 OPEN을 결정합니다.
     */
    HALF_OPEN
}
