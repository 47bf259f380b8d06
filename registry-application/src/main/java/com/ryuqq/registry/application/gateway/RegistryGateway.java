package com.ryuqq.registry.application.gateway;

import com.ryuqq.registry.core.error.RegistryException;
import com.ryuqq.registry.core.model.RegistryJob;
import com.ryuqq.registry.core.model.TrackedUpdates;
import com.ryuqq.registry.core.model.TrackingRegistration;

import java.time.Instant;
import java.util.List;

/**
 * High-level operations against the registry.
 *
 * <p>Every operation is composed as:</p>
 * <pre>
 * rateLimiter.waitForTokens(1)
 *   → circuitBreaker.execute(
 *       () → retryPolicy.run(attempt → http call))
 * </pre>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Admission control (global token bucket, per-service circuit breaker)</li>
 *   <li>HTTP-level retry of transient failures</li>
 *   <li>Reading each response body exactly once</li>
 *   <li>Fire-and-forget telemetry of every terminal outcome</li>
 *   <li>Call statistics ({@link #getStats()})</li>
 * </ul>
 *
 * <p>Implementations are thread-safe and meant to be constructed once per process
 * and passed to the orchestrators that need them.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface RegistryGateway {

    /**
     * Submits an asynchronous search for one entity.
     *
     * @param entityKey registry key (CNJ number)
     * @param withAttachments whether the job should collect attachments (billed extra)
     * @return the submitted job in status {@code PENDING}
     * @throws RegistryException on failure after retries
     */
    RegistryJob submitSearch(String entityKey, boolean withAttachments);

    /**
     * Fetches items a tracking subscription received since a timestamp.
     *
     * @param trackingId tracking subscription id
     * @param since lower bound (inclusive) on item creation time
     * @return the new items, possibly none
     * @throws RegistryException on failure after retries
     */
    TrackedUpdates fetchTrackedUpdates(String trackingId, Instant since);

    /**
     * Polls a job once. The polling loop lives in {@code JobPoller}.
     *
     * @param jobId registry request id
     * @return a snapshot of the job
     * @throws RegistryException on failure of the poll call itself
     */
    RegistryJob pollJob(String jobId);

    /**
     * Downloads one attachment.
     *
     * @param entityKey registry key the attachment belongs to
     * @param instance court instance
     * @param attachmentId registry-issued attachment id
     * @return attachment bytes
     * @throws RegistryException with kind {@code ATTACHMENT_TOO_LARGE} if the declared size exceeds the bound
     */
    byte[] downloadAttachment(String entityKey, int instance, String attachmentId);

    /**
     * Registers a tracking subscription for an entity.
     *
     * @param entityKey registry key
     * @param recurrence recurrence expression, e.g. {@code 1 day}
     * @param callbackUrl callback the registry invokes on new items, may be {@code null}
     * @param withAttachments whether tracked responses include attachments
     * @return the registration
     */
    TrackingRegistration createTracking(String entityKey, String recurrence, String callbackUrl,
                                        boolean withAttachments);

    /**
     * Lists the tracking subscriptions of the account.
     *
     * @return registrations, possibly empty
     */
    List<TrackingRegistration> listTrackings();

    /**
     * Removes a tracking subscription.
     *
     * @param trackingId tracking subscription id
     */
    void removeTracking(String trackingId);

    /**
     * Current call statistics.
     *
     * @return a consistent snapshot
     */
    GatewayStats getStats();
}
