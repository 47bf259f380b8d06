package com.ryuqq.registry.core.spi;

/**
 * Blocking pause, injectable so that backoff and batch pacing can be tested without waiting.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Blocks the current thread.
     *
     * @param millis pause in milliseconds, non-positive values return immediately
     * @throws RuntimeException if the thread is interrupted (interrupt flag restored)
     */
    void sleep(long millis);

    /**
     * {@link Thread#sleep(long)} based sleeper.
     */
    static Sleeper system() {
        return millis -> {
            if (millis <= 0) {
                return;
            }
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RuntimeException("Sleep interrupted", e);
            }
        };
    }
}
