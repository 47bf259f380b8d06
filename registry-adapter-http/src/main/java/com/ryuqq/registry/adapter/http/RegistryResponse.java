package com.ryuqq.registry.adapter.http;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A fully read registry response.
 *
 * <p>The transport reads the body stream exactly once into {@code body}; everything
 * downstream works on these bytes.</p>
 *
 * @param statusCode HTTP status
 * @param headers response headers
 * @param body response body, never {@code null}
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RegistryResponse(int statusCode, Map<String, List<String>> headers, byte[] body) {

    private static final int EXCERPT_LENGTH = 200;

    public RegistryResponse {
        headers = headers == null ? Map.of() : headers;
        body = body == null ? new byte[0] : body;
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * First value of a header, matched case-insensitively.
     */
    public Optional<String> header(String name) {
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(name)
                && entry.getValue() != null && !entry.getValue().isEmpty()) {
                return Optional.ofNullable(entry.getValue().get(0));
            }
        }
        return Optional.empty();
    }

    /**
     * Leading part of the body as text, for error messages.
     */
    public String excerpt() {
        String text = new String(body, StandardCharsets.UTF_8).strip();
        return text.length() <= EXCERPT_LENGTH ? text : text.substring(0, EXCERPT_LENGTH) + "...";
    }
}
