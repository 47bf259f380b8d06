package com.ryuqq.registry.adapter.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.registry.core.error.ErrorKind;
import com.ryuqq.registry.core.error.RegistryException;
import com.ryuqq.registry.core.model.AttachmentRef;
import com.ryuqq.registry.core.model.JobStatus;
import com.ryuqq.registry.core.model.RegistryJob;
import com.ryuqq.registry.core.model.TrackedItem;
import com.ryuqq.registry.core.model.TrackedUpdates;
import com.ryuqq.registry.core.model.TrackingRegistration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry JSON payloads.
 *
 * <p>Request bodies are built as trees; response bodies are read leniently with
 * {@link JsonNode#path(String)} so absent fields fall back to defaults.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RegistryPayloadMapper {

    private static final Logger log = LoggerFactory.getLogger(RegistryPayloadMapper.class);

    static final String SEARCH_TYPE = "lawsuit_cnj";
    static final int PAGE_SIZE = 100;

    // first present field wins
    private static final List<String> TEXT_FIELDS = List.of(
        "text", "description", "descricao", "movimento", "texto", "content", "conteudo");

    private final ObjectMapper mapper;

    public RegistryPayloadMapper() {
        this(new ObjectMapper());
    }

    public RegistryPayloadMapper(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
    }

    // ========================================
    // Request bodies
    // ========================================

    public String searchRequest(String entityKey, boolean withAttachments) {
        ObjectNode root = mapper.createObjectNode();
        root.putObject("search")
            .put("search_type", SEARCH_TYPE)
            .put("search_key", entityKey);
        root.putObject("options")
            .put("with_attachments", withAttachments)
            .put("page_size", PAGE_SIZE)
            .put("page", 1);
        return write(root);
    }

    public String trackingRequest(String entityKey, String recurrence, String callbackUrl, boolean withAttachments) {
        ObjectNode root = mapper.createObjectNode();
        root.put("process_cnj", entityKey);
        root.put("recurrence", recurrence);
        if (callbackUrl != null) {
            root.put("callback_url", callbackUrl);
        }
        root.putObject("options").put("with_attachments", withAttachments);
        return write(root);
    }

    // ========================================
    // Response bodies
    // ========================================

    /**
     * Parses a response body.
     *
     * @throws RegistryException {@code PARSE} if the body is empty or not JSON
     */
    public JsonNode parse(byte[] body, String operation) {
        JsonNode node;
        try {
            node = mapper.readTree(body);
        } catch (IOException e) {
            log.error("Failed to parse {} response ({} bytes)", operation, body.length);
            throw new RegistryException(ErrorKind.PARSE, "Malformed " + operation + " response: " + e.getMessage(), e);
        }
        if (node == null || node.isMissingNode()) {
            log.error("Empty {} response", operation);
            throw new RegistryException(ErrorKind.PARSE, "Empty " + operation + " response");
        }
        return node;
    }

    /**
     * {@code request_id} of a submitted search.
     */
    public String readJobId(JsonNode root) {
        String jobId = root.path("request_id").asText("");
        if (jobId.isBlank()) {
            throw new RegistryException(ErrorKind.PARSE, "Search response has no request_id");
        }
        return jobId;
    }

    /**
     * Poll snapshot of a job.
     *
     * <p>Attachments may sit at the top level, under {@code data}, or under each
     * {@code data.pages[]} entry; all are collected, deduplicated by id.</p>
     */
    public RegistryJob readJob(String jobId, JsonNode root) {
        JobStatus status = JobStatus.fromWire(root.path("status").asText(null));
        JsonNode data = root.path("data");
        int instance = data.path("instance").asInt(1);

        Map<String, AttachmentRef> attachments = new LinkedHashMap<>();
        collectAttachments(root.path("attachments"), attachments);
        collectAttachments(data.path("attachments"), attachments);
        for (JsonNode page : data.path("pages")) {
            collectAttachments(page.path("attachments"), attachments);
        }

        String error = textOrNull(root.path("error"));
        if (error == null) {
            error = textOrNull(root.path("error").path("message"));
        }
        String resolvedId = root.path("request_id").asText(jobId);
        return RegistryJob.snapshot(resolvedId.isBlank() ? jobId : resolvedId,
            status, instance, new ArrayList<>(attachments.values()), error);
    }

    /**
     * Movements recorded for a tracking since a point in time.
     */
    public TrackedUpdates readTrackedUpdates(String trackingId, JsonNode root) {
        JsonNode pageData = root.path("page_data");
        if (!pageData.isArray() || pageData.isEmpty()) {
            return TrackedUpdates.none(trackingId);
        }
        List<TrackedItem> items = new ArrayList<>(pageData.size());
        for (JsonNode item : pageData) {
            String itemId = textOrNull(item.path("response_id"));
            if (itemId == null) {
                itemId = textOrNull(item.path("id"));
            }
            String text = extractText(item);
            if (text == null) {
                text = extractText(item.path("response_data"));
            }
            items.add(new TrackedItem(itemId, text, item.toString()));
        }
        return new TrackedUpdates(trackingId, items);
    }

    public TrackingRegistration readTracking(JsonNode node) {
        String trackingId = textOrNull(node.path("tracking_id"));
        if (trackingId == null) {
            trackingId = textOrNull(node.path("id"));
        }
        if (trackingId == null) {
            throw new RegistryException(ErrorKind.PARSE, "Tracking response has no tracking_id");
        }
        String entityKey = textOrNull(node.path("process_cnj"));
        if (entityKey == null) {
            entityKey = textOrNull(node.path("search").path("search_key"));
        }
        return new TrackingRegistration(
            trackingId,
            entityKey,
            node.path("recurrence").asText(TrackingRegistration.DEFAULT_RECURRENCE),
            textOrNull(node.path("callback_url")),
            node.path("status").asText("active")
        );
    }

    /**
     * Tracking list; accepts a bare array or a {@code page_data} envelope.
     */
    public List<TrackingRegistration> readTrackings(JsonNode root) {
        JsonNode entries = root.isArray() ? root : root.path("page_data");
        List<TrackingRegistration> trackings = new ArrayList<>();
        for (JsonNode entry : entries) {
            trackings.add(readTracking(entry));
        }
        return trackings;
    }

    private static void collectAttachments(JsonNode array, Map<String, AttachmentRef> into) {
        if (!array.isArray()) {
            return;
        }
        for (JsonNode node : array) {
            String id = textOrNull(node.path("attachment_id"));
            if (id == null) {
                id = textOrNull(node.path("id"));
            }
            if (id == null) {
                log.debug("Skipping attachment without id: {}", node);
                continue;
            }
            String name = firstText(node, List.of("attachment_name", "name", "filename"));
            JsonNode size = node.path("size");
            into.putIfAbsent(id, new AttachmentRef(
                id,
                name,
                textOrNull(node.path("extension")),
                size.isNumber() ? size.asLong() : null
            ));
        }
    }

    private static String extractText(JsonNode node) {
        return firstText(node, TEXT_FIELDS);
    }

    private static String firstText(JsonNode node, List<String> fields) {
        for (String field : fields) {
            String value = textOrNull(node.path(field));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String text = node.asText();
        return text.isBlank() ? null : text;
    }

    private String write(JsonNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new RegistryException(ErrorKind.UNEXPECTED, "Failed to serialize request body", e);
        }
    }
}
