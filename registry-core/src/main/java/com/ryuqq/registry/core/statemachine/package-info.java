/**
 * RegistryJob 상태 머신.
 *
 * <p>폴링 응답에 의해 구동되는 상태 전이 규칙을 한 곳에서 검증합니다.
 * 상태 변경은 {@link com.ryuqq.registry.core.model.RegistryJob#advance}를 통해서만 일어납니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.registry.core.statemachine;
