package com.ryuqq.registry.adapter.http;

/**
 * Logical registry services.
 *
 * <p>Each service has its own base URL. Requests and attachments share the
 * {@code requests-service} circuit breaker; tracking has its own.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum RegistryService {

    REQUESTS("requests-service"),
    TRACKING("tracking-service"),
    ATTACHMENTS("requests-service");

    private final String circuitName;

    RegistryService(String circuitName) {
        this.circuitName = circuitName;
    }

    public String circuitName() {
        return circuitName;
    }
}
