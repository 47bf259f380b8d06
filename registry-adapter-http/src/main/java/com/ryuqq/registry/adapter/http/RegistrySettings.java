package com.ryuqq.registry.adapter.http;

import com.ryuqq.registry.core.config.ConfigValues;
import com.ryuqq.registry.core.protection.CircuitBreakerConfig;
import com.ryuqq.registry.core.protection.RateLimiterConfig;
import com.ryuqq.registry.core.retry.RetryConfig;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * HTTP gateway settings.
 *
 * <p><strong>환경 변수:</strong></p>
 * <ul>
 *   <li>REGISTRY_API_KEY (필수)</li>
 *   <li>REGISTRY_REQUESTS_URL, REGISTRY_TRACKING_URL, REGISTRY_ATTACHMENTS_URL</li>
 *   <li>REGISTRY_RATE_LIMIT_PER_MINUTE (기본 180)</li>
 *   <li>REGISTRY_MAX_RETRIES (기본 5)</li>
 *   <li>REGISTRY_REQUEST_TIMEOUT_MS (기본 30000)</li>
 *   <li>REGISTRY_CB_THRESHOLD_PERCENT, REGISTRY_CB_WINDOW_MS, REGISTRY_CB_COOLDOWN_MS, REGISTRY_CB_MIN_REQUESTS</li>
 *   <li>REGISTRY_MAX_ATTACHMENT_BYTES (기본 50MB)</li>
 * </ul>
 *
 * <p>{@link #toString()}는 API 키를 마스킹합니다.</p>
 *
 * @param apiKey registry API key, sent as the {@code api-key} header
 * @param requestsUrl base URL of the requests service
 * @param trackingUrl base URL of the tracking service
 * @param attachmentsUrl base URL of the attachment download service
 * @param userAgent {@code User-Agent} header value
 * @param requestTimeout per-attempt timeout
 * @param rateLimiter token bucket settings
 * @param retry HTTP-level retry settings
 * @param circuitBreaker settings shared by both service breakers
 * @param maxAttachmentBytes largest accepted attachment body
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RegistrySettings(
    String apiKey,
    URI requestsUrl,
    URI trackingUrl,
    URI attachmentsUrl,
    String userAgent,
    Duration requestTimeout,
    RateLimiterConfig rateLimiter,
    RetryConfig retry,
    CircuitBreakerConfig circuitBreaker,
    long maxAttachmentBytes
) {

    public static final String DEFAULT_REQUESTS_URL = "https://requests.prod.judit.io";
    public static final String DEFAULT_TRACKING_URL = "https://tracking.prod.judit.io";
    public static final String DEFAULT_ATTACHMENTS_URL = "https://lawsuits.production.judit.io";
    public static final String DEFAULT_USER_AGENT = "registry-gateway/1.0";
    public static final long DEFAULT_REQUEST_TIMEOUT_MS = 30_000;
    public static final long DEFAULT_MAX_ATTACHMENT_BYTES = 50L * 1024 * 1024;

    public RegistrySettings {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("apiKey cannot be null or blank");
        }
        if (requestsUrl == null || trackingUrl == null || attachmentsUrl == null) {
            throw new IllegalArgumentException("service URLs cannot be null");
        }
        if (userAgent == null || userAgent.isBlank()) {
            userAgent = DEFAULT_USER_AGENT;
        }
        if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive (current: " + requestTimeout + ")");
        }
        if (rateLimiter == null || retry == null || circuitBreaker == null) {
            throw new IllegalArgumentException("protection configs cannot be null");
        }
        if (maxAttachmentBytes <= 0) {
            throw new IllegalArgumentException(
                "maxAttachmentBytes must be positive (current: " + maxAttachmentBytes + ")");
        }
    }

    /**
     * Default settings for the given API key.
     */
    public static RegistrySettings withApiKey(String apiKey) {
        return new RegistrySettings(
            apiKey,
            URI.create(DEFAULT_REQUESTS_URL),
            URI.create(DEFAULT_TRACKING_URL),
            URI.create(DEFAULT_ATTACHMENTS_URL),
            DEFAULT_USER_AGENT,
            Duration.ofMillis(DEFAULT_REQUEST_TIMEOUT_MS),
            new RateLimiterConfig(),
            new RetryConfig(),
            new CircuitBreakerConfig(),
            DEFAULT_MAX_ATTACHMENT_BYTES
        );
    }

    public static RegistrySettings fromEnvironment() {
        return fromMap(System.getenv());
    }

    /**
     * Reads settings from environment-style keys.
     *
     * @throws IllegalArgumentException if the API key is missing or a value is malformed
     */
    public static RegistrySettings fromMap(Map<String, String> env) {
        if (env == null) {
            throw new IllegalArgumentException("env cannot be null");
        }
        String apiKey = env.get("REGISTRY_API_KEY");
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("REGISTRY_API_KEY is required");
        }

        RetryConfig defaultRetry = new RetryConfig();
        RetryConfig retry = defaultRetry
            .withMaxAttempts(ConfigValues.intValue(env, "REGISTRY_MAX_RETRIES", defaultRetry.maxAttempts()));
        CircuitBreakerConfig defaultBreaker = new CircuitBreakerConfig();
        CircuitBreakerConfig circuitBreaker = defaultBreaker
            .withFailureRateThresholdPercent(ConfigValues.doubleValue(env, "REGISTRY_CB_THRESHOLD_PERCENT",
                defaultBreaker.failureRateThresholdPercent()))
            .withWindow(Duration.ofMillis(ConfigValues.longValue(env, "REGISTRY_CB_WINDOW_MS",
                defaultBreaker.window().toMillis())))
            .withOpenCooldown(Duration.ofMillis(ConfigValues.longValue(env, "REGISTRY_CB_COOLDOWN_MS",
                defaultBreaker.openCooldown().toMillis())))
            .withMinimumRequests(ConfigValues.intValue(env, "REGISTRY_CB_MIN_REQUESTS", defaultBreaker.minimumRequests()));

        return new RegistrySettings(
            apiKey,
            URI.create(env.getOrDefault("REGISTRY_REQUESTS_URL", DEFAULT_REQUESTS_URL)),
            URI.create(env.getOrDefault("REGISTRY_TRACKING_URL", DEFAULT_TRACKING_URL)),
            URI.create(env.getOrDefault("REGISTRY_ATTACHMENTS_URL", DEFAULT_ATTACHMENTS_URL)),
            env.getOrDefault("REGISTRY_USER_AGENT", DEFAULT_USER_AGENT),
            Duration.ofMillis(ConfigValues.longValue(env, "REGISTRY_REQUEST_TIMEOUT_MS", DEFAULT_REQUEST_TIMEOUT_MS)),
            new RateLimiterConfig(ConfigValues.intValue(env, "REGISTRY_RATE_LIMIT_PER_MINUTE",
                RateLimiterConfig.DEFAULT_REQUESTS_PER_MINUTE)),
            retry,
            circuitBreaker,
            ConfigValues.longValue(env, "REGISTRY_MAX_ATTACHMENT_BYTES", DEFAULT_MAX_ATTACHMENT_BYTES)
        );
    }

    public URI baseUrl(RegistryService service) {
        switch (service) {
            case REQUESTS:
                return requestsUrl;
            case TRACKING:
                return trackingUrl;
            case ATTACHMENTS:
                return attachmentsUrl;
            default:
                throw new IllegalArgumentException("Unknown service: " + service);
        }
    }

    @Override
    public String toString() {
        return "RegistrySettings{"
            + "apiKey=" + mask(apiKey)
            + ", requestsUrl=" + requestsUrl
            + ", trackingUrl=" + trackingUrl
            + ", attachmentsUrl=" + attachmentsUrl
            + ", requestTimeout=" + requestTimeout
            + ", rateLimiter=" + rateLimiter
            + ", retry=" + retry
            + ", circuitBreaker=" + circuitBreaker
            + ", maxAttachmentBytes=" + maxAttachmentBytes
            + '}';
    }

    private static String mask(String value) {
        return value.length() <= 4 ? "****" : "****" + value.substring(value.length() - 4);
    }
}
