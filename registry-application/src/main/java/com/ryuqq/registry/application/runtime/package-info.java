/**
 * Daily check 인터페이스.
 *
 * <p><strong>구현체:</strong></p>
 * <p>구현체는 adapter-runner 모듈의 {@code BatchOrchestrator}에서 제공되며,
 * 주기 실행은 {@code DailyCheckScheduler}가 담당합니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.registry.application.runtime;
