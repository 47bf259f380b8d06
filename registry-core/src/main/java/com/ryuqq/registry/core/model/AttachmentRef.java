package com.ryuqq.registry.core.model;

/**
 * Reference to a downloadable attachment of a completed registry job.
 *
 * <p>The attachment endpoint is keyed by the registry-issued {@code attachmentId},
 * not by the entity key.</p>
 *
 * @param attachmentId registry-issued attachment id
 * @param name file name as reported by the registry
 * @param extension file extension, defaults to {@code pdf}
 * @param declaredSizeBytes size reported in the job payload, {@code null} if absent
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record AttachmentRef(
    String attachmentId,
    String name,
    String extension,
    Long declaredSizeBytes
) {

    public AttachmentRef {
        if (attachmentId == null || attachmentId.isBlank()) {
            throw new IllegalArgumentException("attachmentId cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            name = "attachment-" + attachmentId;
        }
        if (extension == null || extension.isBlank()) {
            extension = "pdf";
        }
    }
}
