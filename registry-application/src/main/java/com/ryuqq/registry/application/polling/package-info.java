/**
 * Job polling port.
 *
 * <p>구현체는 adapter-runner 모듈의 {@code PollingOrchestrator}에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.registry.application.polling;
