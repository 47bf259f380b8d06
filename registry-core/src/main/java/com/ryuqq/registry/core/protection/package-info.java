/**
 * Admission control 패키지.
 *
 * <p>레지스트리 호출 전 통과 여부를 결정하는 두 가지 보호 장치를 제공합니다.</p>
 *
 * <h2>적용 순서</h2>
 * <pre>
 * 1. RateLimiter.waitForTokens(1)  → 분당 한도 (토큰 버킷)
 * 2. CircuitBreaker.execute(...)   → OPEN 상태 시 즉시 실패
 * 3. RetryPolicy.run(...)          → 일시적 오류 재시도 (retry 패키지)
 * 4. HTTP 호출
 * </pre>
 *
 * <h2>공유 상태</h2>
 * <ul>
 *   <li>토큰 버킷의 토큰 수와 Circuit Breaker의 슬라이딩 윈도우만이 여러 워커가 동시에 변경하는 상태입니다.</li>
 *   <li>두 구현 모두 단일 ReentrantLock으로 보호합니다.</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @see com.ryuqq.registry.core.protection.RateLimiter
 * @see com.ryuqq.registry.core.protection.CircuitBreaker
 */
package com.ryuqq.registry.core.protection;
