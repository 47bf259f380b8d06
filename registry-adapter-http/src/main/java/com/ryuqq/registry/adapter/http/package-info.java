/**
 * HTTP adapter for the registry.
 *
 * <p>{@link com.ryuqq.registry.adapter.http.HttpRegistryGateway} composes the token bucket,
 * the per-service circuit breakers and the retry policy around a
 * {@link com.ryuqq.registry.adapter.http.RegistryTransport}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.registry.adapter.http;
