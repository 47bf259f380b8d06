package com.ryuqq.registry.adapter.http;

import java.net.URI;

/**
 * One HTTP attempt against the registry.
 *
 * @param method HTTP method ({@code GET}, {@code POST}, {@code DELETE})
 * @param uri absolute request URI
 * @param jsonBody request body, {@code null} for bodiless methods
 * @param attempt attempt number, sent as {@code X-Request-Attempt}
 * @param maxBodyBytes upper bound on the response body; larger bodies are rejected
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RegistryRequest(String method, URI uri, String jsonBody, int attempt, long maxBodyBytes) {

    public static final long UNBOUNDED = Long.MAX_VALUE;

    public RegistryRequest {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method cannot be null or blank");
        }
        if (uri == null) {
            throw new IllegalArgumentException("uri cannot be null");
        }
        if (attempt <= 0) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
        if (maxBodyBytes <= 0) {
            throw new IllegalArgumentException("maxBodyBytes must be positive (current: " + maxBodyBytes + ")");
        }
    }

    public static RegistryRequest get(URI uri, int attempt) {
        return new RegistryRequest("GET", uri, null, attempt, UNBOUNDED);
    }

    public static RegistryRequest post(URI uri, String jsonBody, int attempt) {
        return new RegistryRequest("POST", uri, jsonBody, attempt, UNBOUNDED);
    }

    public static RegistryRequest delete(URI uri, int attempt) {
        return new RegistryRequest("DELETE", uri, null, attempt, UNBOUNDED);
    }

    public RegistryRequest withMaxBodyBytes(long maxBodyBytes) {
        return new RegistryRequest(method, uri, jsonBody, attempt, maxBodyBytes);
    }
}
