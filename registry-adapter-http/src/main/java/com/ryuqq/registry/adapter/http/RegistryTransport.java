package com.ryuqq.registry.adapter.http;

import com.ryuqq.registry.core.error.RegistryException;

/**
 * Sends one HTTP attempt to the registry.
 *
 * <p>Implementations translate transport failures into {@link RegistryException}
 * ({@code TIMEOUT}, {@code NETWORK}) and reject oversized bodies with
 * {@code ATTACHMENT_TOO_LARGE}. Non-2xx responses are returned, not thrown.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface RegistryTransport {

    /**
     * @param request the attempt
     * @return the response with its body fully read
     * @throws RegistryException on transport failure or oversized body
     */
    RegistryResponse execute(RegistryRequest request);
}
