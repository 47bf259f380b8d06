package com.ryuqq.registry.core.model;

import com.ryuqq.registry.core.statemachine.JobStatusTransition;

import java.time.Instant;
import java.util.List;

/**
 * One asynchronous unit of work at the registry.
 *
 * <p>Created by the gateway on submission with status {@link JobStatus#PENDING}.
 * Poll responses arrive as snapshots (no entity key, no submission time) and are
 * folded into the tracked job with {@link #advance(RegistryJob)}, which enforces
 * the {@link JobStatusTransition} rules.</p>
 *
 * @param jobId registry request id
 * @param entityKey registry key the search was submitted for, {@code null} on snapshots
 * @param submittedAt submission time, {@code null} on snapshots
 * @param status current status
 * @param instance court instance reported by the completed job (defaults to 1)
 * @param attachments attachments reported by the completed job
 * @param error failure description reported by the registry, if any
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RegistryJob(
    String jobId,
    String entityKey,
    Instant submittedAt,
    JobStatus status,
    int instance,
    List<AttachmentRef> attachments,
    String error
) {

    public RegistryJob {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (instance <= 0) {
            instance = 1;
        }
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    /**
     * Creates a freshly submitted job.
     */
    public static RegistryJob pending(String jobId, String entityKey, Instant submittedAt) {
        return new RegistryJob(jobId, entityKey, submittedAt, JobStatus.PENDING, 1, List.of(), null);
    }

    /**
     * Creates a poll snapshot.
     */
    public static RegistryJob snapshot(String jobId, JobStatus status, int instance,
                                       List<AttachmentRef> attachments, String error) {
        return new RegistryJob(jobId, null, null, status, instance, attachments, error);
    }

    /**
     * Folds a poll snapshot into this job.
     *
     * @param polled snapshot returned by a single poll
     * @return the job in its new status
     * @throws IllegalArgumentException if the snapshot belongs to another job
     * @throws IllegalStateException if the transition is not allowed
     */
    public RegistryJob advance(RegistryJob polled) {
        if (polled == null) {
            throw new IllegalArgumentException("polled cannot be null");
        }
        if (!jobId.equals(polled.jobId())) {
            throw new IllegalArgumentException(
                "Snapshot belongs to another job (expected: " + jobId + ", actual: " + polled.jobId() + ")"
            );
        }
        JobStatus next = JobStatusTransition.transition(status, polled.status());
        return new RegistryJob(jobId, entityKey, submittedAt, next,
            polled.instance(), polled.attachments(), polled.error());
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
