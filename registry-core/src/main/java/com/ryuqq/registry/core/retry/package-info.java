/**
 * 재시도 및 백오프 패키지.
 *
 * <p>실패 분류({@link com.ryuqq.registry.core.retry.FailureClassifier})는 HTTP 경계에서 한 번만 이루어지고,
 * 그 결과({@link com.ryuqq.registry.core.error.RegistryException})가 재시도 여부와
 * 백오프 계산({@link com.ryuqq.registry.core.retry.BackoffCalculator})을 결정합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.registry.core.retry;
