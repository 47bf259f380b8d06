/**
 * Registry gateway port.
 *
 * <p>The HTTP implementation lives in {@code registry-adapter-http}
 * ({@code HttpRegistryGateway}).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.registry.application.gateway;
