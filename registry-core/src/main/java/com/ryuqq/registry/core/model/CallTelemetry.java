package com.ryuqq.registry.core.model;

import com.ryuqq.registry.core.error.ErrorKind;

import java.time.Instant;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Telemetry record of one terminal gateway call.
 *
 * @param timestamp when the call finished
 * @param operation gateway operation name (e.g. {@code submitSearch})
 * @param entityKey registry key the call was about, may be {@code null}
 * @param tribunal tribunal code extracted from the entity key, may be {@code null}
 * @param success whether the call succeeded
 * @param responseTimeMs wall-clock time including retries
 * @param attempts number of HTTP attempts made
 * @param rateLimitHit whether any attempt got a 429
 * @param itemsCount items returned (movements, trackings)
 * @param documentsCount attachments reported or downloaded
 * @param errorKind failure classification, {@code null} on success
 * @param errorMessage failure message, {@code null} on success
 * @param estimatedCost estimated billing cost of the call
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CallTelemetry(
    Instant timestamp,
    String operation,
    String entityKey,
    String tribunal,
    boolean success,
    long responseTimeMs,
    int attempts,
    boolean rateLimitHit,
    int itemsCount,
    int documentsCount,
    ErrorKind errorKind,
    String errorMessage,
    double estimatedCost
) {

    public static final double COST_PER_SEARCH = 0.69;
    public static final double COST_PER_ATTACHMENT = 0.25;

    // CNJ: NNNNNNN-DD.AAAA.J.TR.OOOO, the tribunal is the first 1-2 digit segment
    private static final Pattern TRIBUNAL_PATTERN = Pattern.compile("\\.(\\d{1,2})\\.");

    public CallTelemetry {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("operation cannot be null or blank");
        }
    }

    /**
     * Extracts the tribunal segment of a CNJ number.
     *
     * @param entityKey CNJ number, may be {@code null}
     * @return the tribunal code or {@code null} when the key does not look like a CNJ
     */
    public static String tribunalOf(String entityKey) {
        if (entityKey == null) {
            return null;
        }
        Matcher matcher = TRIBUNAL_PATTERN.matcher(entityKey);
        return matcher.find() ? matcher.group(1) : null;
    }

    /**
     * Estimated cost of a call: a base search fee plus a fee per attachment.
     */
    public static double estimateCost(int searches, int attachments) {
        return searches * COST_PER_SEARCH + attachments * COST_PER_ATTACHMENT;
    }
}
