package com.ryuqq.registry.core.error;

/**
 * Raised by a circuit breaker instead of attempting the call.
 *
 * <p>Signals that the registry is currently considered unhealthy. Never retried by
 * the retry policy; callers treat it like any other failure.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CircuitOpenException extends RegistryException {

    private final String circuitName;

    public CircuitOpenException(String circuitName) {
        super(ErrorKind.CIRCUIT_OPEN, "Circuit breaker '" + circuitName + "' is OPEN", false, null, null, null);
        this.circuitName = circuitName;
    }

    public String circuitName() {
        return circuitName;
    }
}
