package com.ryuqq.registry.testkit.contract;

import com.ryuqq.registry.application.gateway.GatewayStats;
import com.ryuqq.registry.application.gateway.RegistryGateway;
import com.ryuqq.registry.core.error.ErrorKind;
import com.ryuqq.registry.core.error.RegistryException;
import com.ryuqq.registry.core.model.AttachmentRef;
import com.ryuqq.registry.core.model.JobStatus;
import com.ryuqq.registry.core.model.RegistryJob;
import com.ryuqq.registry.core.model.TrackedItem;
import com.ryuqq.registry.core.model.TrackedUpdates;
import com.ryuqq.registry.core.model.TrackingRegistration;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link RegistryGateway} whose answers are scripted per tracking id, entity key and attachment id.
 *
 * <p><strong>Scripting:</strong></p>
 * <ul>
 *   <li>{@link #givenUpdates}: items returned by every {@code fetchTrackedUpdates} of a tracking id
 *       (no items when unscripted)</li>
 *   <li>{@link #failUpdates}: the next N fetches of a tracking id throw before the scripted answer</li>
 *   <li>{@link #givenSearch}: number of polls a search stays PROCESSING and the attachments it completes with
 *       (unscripted searches complete on the first poll without attachments)</li>
 *   <li>{@link #givenAttachment}: bytes served by {@code downloadAttachment}</li>
 *   <li>{@link #withFetchLatency}: real pause inside each fetch so overlapping calls can be observed</li>
 * </ul>
 *
 * <p>Every call is counted, and the highest number of fetches in flight at once is recorded.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ScriptedRegistryGateway implements RegistryGateway {

    private final Clock clock;

    private final ConcurrentHashMap<String, List<TrackedItem>> updates = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ScriptedFailure> updateFailures = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, SearchScript> searches = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, JobState> jobs = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, byte[]> attachments = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, TrackingRegistration> trackings = new ConcurrentHashMap<>();

    private final ConcurrentHashMap<String, AtomicInteger> fetchCounts = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Instant> lastSince = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicInteger> searchCounts = new ConcurrentHashMap<>();
    private final AtomicInteger downloads = new AtomicInteger();
    private final AtomicInteger inFlightFetches = new AtomicInteger();
    private final AtomicInteger maxInFlightFetches = new AtomicInteger();
    private final AtomicInteger sequence = new AtomicInteger();
    private final AtomicLong totalCalls = new AtomicLong();
    private final AtomicLong failedCalls = new AtomicLong();

    private volatile Duration fetchLatency = Duration.ZERO;
    private volatile String lastError;

    public ScriptedRegistryGateway() {
        this(Clock.systemUTC());
    }

    /**
     * @param clock clock used for submission timestamps
     */
    public ScriptedRegistryGateway(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    // ========================================
    // Scripting
    // ========================================

    public ScriptedRegistryGateway givenUpdates(String trackingId, List<TrackedItem> items) {
        requireText(trackingId, "trackingId");
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
        updates.put(trackingId, List.copyOf(items));
        return this;
    }

    /**
     * Makes the next {@code times} fetches of {@code trackingId} throw {@code failure}.
     * Use {@link Integer#MAX_VALUE} for a tracking id that never recovers.
     */
    public ScriptedRegistryGateway failUpdates(String trackingId, RuntimeException failure, int times) {
        requireText(trackingId, "trackingId");
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        if (times <= 0) {
            throw new IllegalArgumentException("times must be positive (current: " + times + ")");
        }
        updateFailures.put(trackingId, new ScriptedFailure(failure, times));
        return this;
    }

    public ScriptedRegistryGateway givenSearch(String entityKey, int pollsUntilComplete, List<AttachmentRef> refs) {
        requireText(entityKey, "entityKey");
        if (refs == null) {
            throw new IllegalArgumentException("refs cannot be null");
        }
        if (pollsUntilComplete < 0) {
            throw new IllegalArgumentException(
                "pollsUntilComplete must not be negative (current: " + pollsUntilComplete + ")");
        }
        searches.put(entityKey, new SearchScript(pollsUntilComplete, List.copyOf(refs), null));
        return this;
    }

    /**
     * Scripts a search that ends in {@link JobStatus#FAILED} on its first poll.
     */
    public ScriptedRegistryGateway givenFailedSearch(String entityKey, String error) {
        requireText(entityKey, "entityKey");
        searches.put(entityKey, new SearchScript(0, List.of(), error));
        return this;
    }

    public ScriptedRegistryGateway givenAttachment(String attachmentId, byte[] content) {
        requireText(attachmentId, "attachmentId");
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        attachments.put(attachmentId, content.clone());
        return this;
    }

    public ScriptedRegistryGateway withFetchLatency(Duration latency) {
        if (latency == null || latency.isNegative()) {
            throw new IllegalArgumentException("latency must not be negative (current: " + latency + ")");
        }
        this.fetchLatency = latency;
        return this;
    }

    // ========================================
    // RegistryGateway
    // ========================================

    @Override
    public RegistryJob submitSearch(String entityKey, boolean withAttachments) {
        totalCalls.incrementAndGet();
        requireText(entityKey, "entityKey");
        searchCounts.computeIfAbsent(entityKey, k -> new AtomicInteger()).incrementAndGet();

        SearchScript script = searches.getOrDefault(entityKey, SearchScript.IMMEDIATE);
        String jobId = "job-" + sequence.incrementAndGet();
        jobs.put(jobId, new JobState(script));
        return RegistryJob.pending(jobId, entityKey, clock.instant());
    }

    @Override
    public TrackedUpdates fetchTrackedUpdates(String trackingId, Instant since) {
        totalCalls.incrementAndGet();
        requireText(trackingId, "trackingId");
        fetchCounts.computeIfAbsent(trackingId, k -> new AtomicInteger()).incrementAndGet();
        if (since != null) {
            lastSince.put(trackingId, since);
        }

        int inFlight = inFlightFetches.incrementAndGet();
        maxInFlightFetches.accumulateAndGet(inFlight, Math::max);
        try {
            pause(fetchLatency);
            ScriptedFailure failure = updateFailures.get(trackingId);
            if (failure != null && failure.consume()) {
                throw recordFailure("fetchTrackedUpdates", failure.error);
            }
            List<TrackedItem> items = updates.get(trackingId);
            return items == null ? TrackedUpdates.none(trackingId) : new TrackedUpdates(trackingId, items);
        } finally {
            inFlightFetches.decrementAndGet();
        }
    }

    @Override
    public RegistryJob pollJob(String jobId) {
        totalCalls.incrementAndGet();
        JobState state = jobs.get(jobId);
        if (state == null) {
            throw recordFailure("pollJob", new RegistryException(ErrorKind.NOT_FOUND, "Unknown job " + jobId));
        }
        return state.poll(jobId);
    }

    @Override
    public byte[] downloadAttachment(String entityKey, int instance, String attachmentId) {
        totalCalls.incrementAndGet();
        byte[] content = attachments.get(attachmentId);
        if (content == null) {
            throw recordFailure("downloadAttachment",
                new RegistryException(ErrorKind.NOT_FOUND, "Attachment " + attachmentId + " not found"));
        }
        downloads.incrementAndGet();
        return content.clone();
    }

    @Override
    public TrackingRegistration createTracking(String entityKey, String recurrence, String callbackUrl,
                                               boolean withAttachments) {
        totalCalls.incrementAndGet();
        requireText(entityKey, "entityKey");
        String trackingId = "trk-" + sequence.incrementAndGet();
        TrackingRegistration registration = new TrackingRegistration(
            trackingId, entityKey,
            recurrence == null ? TrackingRegistration.DEFAULT_RECURRENCE : recurrence, callbackUrl, "active");
        trackings.put(trackingId, registration);
        return registration;
    }

    @Override
    public List<TrackingRegistration> listTrackings() {
        totalCalls.incrementAndGet();
        return new ArrayList<>(trackings.values());
    }

    @Override
    public void removeTracking(String trackingId) {
        totalCalls.incrementAndGet();
        if (trackings.remove(trackingId) == null) {
            throw recordFailure("removeTracking",
                new RegistryException(ErrorKind.NOT_FOUND, "Tracking " + trackingId + " not found"));
        }
    }

    @Override
    public GatewayStats getStats() {
        long total = totalCalls.get();
        long failed = failedCalls.get();
        return new GatewayStats(total, total - failed, failed, 0, 0.0, lastError, Map.of());
    }

    // ========================================
    // Inspection
    // ========================================

    public int fetchCount(String trackingId) {
        AtomicInteger count = fetchCounts.get(trackingId);
        return count == null ? 0 : count.get();
    }

    public int totalFetches() {
        return fetchCounts.values().stream().mapToInt(AtomicInteger::get).sum();
    }

    /**
     * @return the {@code since} of the last fetch of {@code trackingId}, or {@code null}
     */
    public Instant lastSince(String trackingId) {
        return lastSince.get(trackingId);
    }

    public int searchCount(String entityKey) {
        AtomicInteger count = searchCounts.get(entityKey);
        return count == null ? 0 : count.get();
    }

    public int totalSearches() {
        return searchCounts.values().stream().mapToInt(AtomicInteger::get).sum();
    }

    public int downloadCount() {
        return downloads.get();
    }

    public int maxConcurrentFetches() {
        return maxInFlightFetches.get();
    }

    private RuntimeException recordFailure(String operation, RuntimeException error) {
        failedCalls.incrementAndGet();
        lastError = operation + ": " + error.getMessage();
        return error;
    }

    private static void pause(Duration latency) {
        if (latency.isZero()) {
            return;
        }
        try {
            Thread.sleep(latency.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during scripted latency", e);
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }

    private static final class ScriptedFailure {
        private final RuntimeException error;
        private final AtomicInteger remaining;

        private ScriptedFailure(RuntimeException error, int times) {
            this.error = error;
            this.remaining = new AtomicInteger(times);
        }

        boolean consume() {
            return remaining.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0;
        }
    }

    private static final class SearchScript {
        static final SearchScript IMMEDIATE = new SearchScript(0, List.of(), null);

        private final int pollsUntilComplete;
        private final List<AttachmentRef> refs;
        private final String error;

        private SearchScript(int pollsUntilComplete, List<AttachmentRef> refs, String error) {
            this.pollsUntilComplete = pollsUntilComplete;
            this.refs = refs;
            this.error = error;
        }
    }

    private static final class JobState {
        private final SearchScript script;
        private final AtomicInteger polls = new AtomicInteger();

        private JobState(SearchScript script) {
            this.script = script;
        }

        RegistryJob poll(String jobId) {
            int poll = polls.incrementAndGet();
            if (script.error != null) {
                return RegistryJob.snapshot(jobId, JobStatus.FAILED, 1, List.of(), script.error);
            }
            if (poll <= script.pollsUntilComplete) {
                return RegistryJob.snapshot(jobId, JobStatus.PROCESSING, 1, List.of(), null);
            }
            return RegistryJob.snapshot(jobId, JobStatus.COMPLETED, 1, script.refs, null);
        }
    }
}
