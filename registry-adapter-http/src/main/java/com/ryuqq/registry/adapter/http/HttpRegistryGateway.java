package com.ryuqq.registry.adapter.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.registry.application.gateway.GatewayStats;
import com.ryuqq.registry.application.gateway.RegistryGateway;
import com.ryuqq.registry.core.error.ErrorKind;
import com.ryuqq.registry.core.error.RegistryException;
import com.ryuqq.registry.core.model.CallTelemetry;
import com.ryuqq.registry.core.model.RegistryJob;
import com.ryuqq.registry.core.model.TrackedUpdates;
import com.ryuqq.registry.core.model.TrackingRegistration;
import com.ryuqq.registry.core.protection.CircuitBreaker;
import com.ryuqq.registry.core.protection.CircuitBreakerStats;
import com.ryuqq.registry.core.protection.RateLimiter;
import com.ryuqq.registry.core.protection.SlidingWindowCircuitBreaker;
import com.ryuqq.registry.core.protection.TokenBucketRateLimiter;
import com.ryuqq.registry.core.retry.FailureClassifier;
import com.ryuqq.registry.core.retry.RetryPolicy;
import com.ryuqq.registry.core.spi.TelemetrySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.IntFunction;

/**
 * HTTP {@link RegistryGateway}.
 *
 * <p><strong>호출 흐름:</strong></p>
 * <pre>
 * 1. rateLimiter.waitForTokens(1)         (호출당 토큰 1개, 재시도는 토큰을 추가로 쓰지 않음)
 * 2. circuitBreaker.execute(...)          (서비스별 브레이커, OPEN이면 즉시 CircuitOpenException)
 * 3. retryPolicy.run(attempt → transport) (일시적 오류만 backoff 후 재시도)
 * 4. 응답 본문 파싱 (본문은 transport에서 한 번만 읽힘)
 * 5. 텔레메트리 비동기 기록 (실패해도 호출 결과에 영향 없음)
 * </pre>
 *
 * <p><strong>Thread-safety:</strong></p>
 * <ul>
 *   <li>카운터는 Atomic 타입</li>
 *   <li>평균 응답 시간은 statsLock 아래에서 증분 계산</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class HttpRegistryGateway implements RegistryGateway, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpRegistryGateway.class);

    static final int TELEMETRY_QUEUE_CAPACITY = 10_000;

    private final RegistrySettings settings;
    private final RegistryTransport transport;
    private final RegistryPayloadMapper payloads;
    private final RateLimiter rateLimiter;
    private final Map<String, CircuitBreaker> breakers;
    private final RetryPolicy retryPolicy;
    private final TelemetrySink telemetrySink;
    private final ExecutorService telemetryExecutor;
    private final Clock clock;

    private final AtomicLong totalCalls = new AtomicLong();
    private final AtomicLong failedCalls = new AtomicLong();
    private final AtomicLong rateLimitHits = new AtomicLong();
    private final Object statsLock = new Object();
    private long successfulCalls;
    private double averageResponseTimeMs;
    private volatile String lastError;

    /**
     * 생성자.
     *
     * @param settings gateway settings
     * @param transport HTTP transport
     * @param rateLimiter shared token bucket
     * @param requestsBreaker breaker of the requests service (also guards attachment downloads)
     * @param trackingBreaker breaker of the tracking service
     * @param retryPolicy HTTP-level retry policy
     * @param telemetrySink telemetry destination
     * @param telemetryExecutor executor telemetry is handed to; shut down by {@link #close()}
     * @param clock clock for telemetry timestamps
     */
    public HttpRegistryGateway(RegistrySettings settings,
                               RegistryTransport transport,
                               RateLimiter rateLimiter,
                               CircuitBreaker requestsBreaker,
                               CircuitBreaker trackingBreaker,
                               RetryPolicy retryPolicy,
                               TelemetrySink telemetrySink,
                               ExecutorService telemetryExecutor,
                               Clock clock) {
        if (settings == null) {
            throw new IllegalArgumentException("settings cannot be null");
        }
        if (transport == null) {
            throw new IllegalArgumentException("transport cannot be null");
        }
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter cannot be null");
        }
        if (requestsBreaker == null || trackingBreaker == null) {
            throw new IllegalArgumentException("circuit breakers cannot be null");
        }
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
        if (telemetrySink == null) {
            throw new IllegalArgumentException("telemetrySink cannot be null");
        }
        if (telemetryExecutor == null) {
            throw new IllegalArgumentException("telemetryExecutor cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.settings = settings;
        this.transport = transport;
        this.payloads = new RegistryPayloadMapper();
        this.rateLimiter = rateLimiter;
        Map<String, CircuitBreaker> byName = new LinkedHashMap<>();
        byName.put(RegistryService.REQUESTS.circuitName(), requestsBreaker);
        byName.put(RegistryService.TRACKING.circuitName(), trackingBreaker);
        this.breakers = byName;
        this.retryPolicy = retryPolicy;
        this.telemetrySink = telemetrySink;
        this.telemetryExecutor = telemetryExecutor;
        this.clock = clock;
    }

    /**
     * Wires a gateway with the JDK transport and default protection components.
     */
    public static HttpRegistryGateway create(RegistrySettings settings, TelemetrySink telemetrySink) {
        ExecutorService telemetryExecutor = telemetryExecutor(TELEMETRY_QUEUE_CAPACITY);
        log.info("Creating registry gateway: {}", settings);
        return new HttpRegistryGateway(
            settings,
            new JdkHttpRegistryTransport(settings),
            new TokenBucketRateLimiter(settings.rateLimiter()),
            new SlidingWindowCircuitBreaker(RegistryService.REQUESTS.circuitName(), settings.circuitBreaker()),
            new SlidingWindowCircuitBreaker(RegistryService.TRACKING.circuitName(), settings.circuitBreaker()),
            new RetryPolicy(settings.retry()),
            telemetrySink,
            telemetryExecutor,
            Clock.systemUTC()
        );
    }

    /**
     * 텔레메트리 전용 단일 스레드 executor.
     *
     * <p>큐가 가득 차면 {@link RejectedExecutionException}으로 거부되고, 해당 레코드는 경고 로그와 함께 버려집니다.</p>
     *
     * @param queueCapacity 대기 가능한 레코드 수
     * @return bounded executor
     */
    static ExecutorService telemetryExecutor(int queueCapacity) {
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be positive (current: " + queueCapacity + ")");
        }
        return new ThreadPoolExecutor(
            1, 1,
            0L, TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(queueCapacity),
            runnable -> {
                Thread thread = new Thread(runnable, "registry-telemetry");
                thread.setDaemon(true);
                return thread;
            },
            new ThreadPoolExecutor.AbortPolicy()
        );
    }

    // ========================================
    // Operations
    // ========================================

    @Override
    public RegistryJob submitSearch(String entityKey, boolean withAttachments) {
        requireText(entityKey, "entityKey");
        String body = payloads.searchRequest(entityKey, withAttachments);
        URI uri = uri(RegistryService.REQUESTS, "/requests");
        String jobId = call("submitSearch", RegistryService.REQUESTS, entityKey,
            attempt -> RegistryRequest.post(uri, body, attempt),
            response -> payloads.readJobId(payloads.parse(response.body(), "submitSearch")),
            id -> new Usage(0, 0, 1, 0));
        log.debug("Submitted search {} for {} (withAttachments={})", jobId, entityKey, withAttachments);
        return RegistryJob.pending(jobId, entityKey, clock.instant());
    }

    @Override
    public TrackedUpdates fetchTrackedUpdates(String trackingId, Instant since) {
        requireText(trackingId, "trackingId");
        if (since == null) {
            throw new IllegalArgumentException("since cannot be null");
        }
        URI uri = uri(RegistryService.TRACKING, "/tracking/" + encode(trackingId)
            + "/responses?created_at_gte=" + encode(DateTimeFormatter.ISO_INSTANT.format(since)));
        return call("fetchTrackedUpdates", RegistryService.TRACKING, trackingId,
            attempt -> RegistryRequest.get(uri, attempt),
            response -> payloads.readTrackedUpdates(trackingId,
                payloads.parse(response.body(), "fetchTrackedUpdates")),
            updates -> new Usage(updates.count(), 0, 0, 0));
    }

    @Override
    public RegistryJob pollJob(String jobId) {
        requireText(jobId, "jobId");
        URI uri = uri(RegistryService.REQUESTS,
            "/responses?request_id=" + encode(jobId) + "&page_size=" + RegistryPayloadMapper.PAGE_SIZE);
        return call("pollJob", RegistryService.REQUESTS, jobId,
            attempt -> RegistryRequest.get(uri, attempt),
            response -> payloads.readJob(jobId, payloads.parse(response.body(), "pollJob")),
            job -> new Usage(0, job.attachments().size(), 0, 0));
    }

    @Override
    public byte[] downloadAttachment(String entityKey, int instance, String attachmentId) {
        requireText(entityKey, "entityKey");
        requireText(attachmentId, "attachmentId");
        if (instance <= 0) {
            throw new IllegalArgumentException("instance must be positive (current: " + instance + ")");
        }
        URI uri = uri(RegistryService.ATTACHMENTS, "/lawsuits/" + encode(entityKey) + "/" + instance
            + "/attachments/" + encode(attachmentId));
        long maxBytes = settings.maxAttachmentBytes();
        return call("downloadAttachment", RegistryService.ATTACHMENTS, entityKey,
            attempt -> RegistryRequest.get(uri, attempt).withMaxBodyBytes(maxBytes),
            RegistryResponse::body,
            bytes -> new Usage(0, 1, 0, 1));
    }

    @Override
    public TrackingRegistration createTracking(String entityKey, String recurrence, String callbackUrl,
                                               boolean withAttachments) {
        requireText(entityKey, "entityKey");
        String effectiveRecurrence = recurrence == null || recurrence.isBlank()
            ? TrackingRegistration.DEFAULT_RECURRENCE
            : recurrence;
        String body = payloads.trackingRequest(entityKey, effectiveRecurrence, callbackUrl, withAttachments);
        URI uri = uri(RegistryService.TRACKING, "/tracking");
        TrackingRegistration registration = call("createTracking", RegistryService.TRACKING, entityKey,
            attempt -> RegistryRequest.post(uri, body, attempt),
            response -> payloads.readTracking(payloads.parse(response.body(), "createTracking")),
            created -> new Usage(1, 0, 0, 0));
        log.info("Created tracking {} for {}", registration.trackingId(), entityKey);
        return registration;
    }

    @Override
    public List<TrackingRegistration> listTrackings() {
        URI uri = uri(RegistryService.TRACKING, "/tracking");
        return call("listTrackings", RegistryService.TRACKING, null,
            attempt -> RegistryRequest.get(uri, attempt),
            response -> payloads.readTrackings(payloads.parse(response.body(), "listTrackings")),
            trackings -> new Usage(trackings.size(), 0, 0, 0));
    }

    @Override
    public void removeTracking(String trackingId) {
        requireText(trackingId, "trackingId");
        URI uri = uri(RegistryService.TRACKING, "/tracking/" + encode(trackingId));
        call("removeTracking", RegistryService.TRACKING, trackingId,
            attempt -> RegistryRequest.delete(uri, attempt),
            response -> Boolean.TRUE,
            removed -> new Usage(0, 0, 0, 0));
        log.info("Removed tracking {}", trackingId);
    }

    @Override
    public GatewayStats getStats() {
        Map<String, CircuitBreakerStats> circuits = new LinkedHashMap<>();
        for (Map.Entry<String, CircuitBreaker> entry : breakers.entrySet()) {
            circuits.put(entry.getKey(), entry.getValue().getStats());
        }
        synchronized (statsLock) {
            return new GatewayStats(
                totalCalls.get(),
                successfulCalls,
                failedCalls.get(),
                rateLimitHits.get(),
                averageResponseTimeMs,
                lastError,
                circuits
            );
        }
    }

    /**
     * Stops the telemetry executor, draining queued records for up to 5 seconds.
     */
    @Override
    public void close() {
        telemetryExecutor.shutdown();
        try {
            if (!telemetryExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Telemetry executor did not drain in time, dropping pending records");
                telemetryExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            telemetryExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ========================================
    // Call pipeline
    // ========================================

    private <T> T call(String operation,
                       RegistryService service,
                       String entityKey,
                       IntFunction<RegistryRequest> requestFactory,
                       Function<RegistryResponse, T> handler,
                       Function<T, Usage> usage) {
        totalCalls.incrementAndGet();
        long startNanos = System.nanoTime();
        AtomicInteger attempts = new AtomicInteger();
        AtomicBoolean rateLimited = new AtomicBoolean();
        CircuitBreaker breaker = breakers.get(service.circuitName());

        try {
            rateLimiter.waitForTokens(1);
            T result = breaker.execute(() -> retryPolicy.run(operation, attempt -> {
                attempts.set(attempt);
                RegistryResponse response = transport.execute(requestFactory.apply(attempt));
                if (!response.isSuccessful()) {
                    throw rejected(operation, response, rateLimited);
                }
                return handler.apply(response);
            }));

            long elapsedMs = elapsedMs(startNanos);
            recordSuccess(elapsedMs);
            Usage used = usage.apply(result);
            dispatch(new CallTelemetry(clock.instant(), operation, entityKey, CallTelemetry.tribunalOf(entityKey),
                true, elapsedMs, attempts.get(), rateLimited.get(), used.items(), used.documents(),
                null, null, CallTelemetry.estimateCost(used.searches(), used.attachments())));
            return result;
        } catch (RuntimeException e) {
            RegistryException failure = FailureClassifier.fromThrowable(e);
            long elapsedMs = elapsedMs(startNanos);
            failedCalls.incrementAndGet();
            lastError = operation + ": " + failure.getMessage();
            if (failure.kind() == ErrorKind.CIRCUIT_OPEN) {
                log.debug("{} rejected, circuit {} is open", operation, service.circuitName());
            } else {
                log.warn("{} failed after {} attempt(s) in {}ms: {}",
                    operation, attempts.get(), elapsedMs, failure.getMessage());
            }
            dispatch(new CallTelemetry(clock.instant(), operation, entityKey, CallTelemetry.tribunalOf(entityKey),
                false, elapsedMs, attempts.get(), rateLimited.get(), 0, 0,
                failure.kind(), failure.getMessage(), 0.0));
            throw failure;
        }
    }

    private RegistryException rejected(String operation, RegistryResponse response, AtomicBoolean rateLimited) {
        Long retryAfterMs = FailureClassifier.parseRetryAfter(response.header("Retry-After").orElse(null));
        RegistryException failure = FailureClassifier.fromStatus(response.statusCode(), response.excerpt(), retryAfterMs);
        if (failure.kind() == ErrorKind.RATE_LIMITED) {
            rateLimitHits.incrementAndGet();
            rateLimited.set(true);
            log.warn("{} hit the registry rate limit (retryAfterMs={})", operation, retryAfterMs);
        }
        return failure;
    }

    private void recordSuccess(long elapsedMs) {
        synchronized (statsLock) {
            successfulCalls++;
            averageResponseTimeMs += (elapsedMs - averageResponseTimeMs) / successfulCalls;
        }
    }

    private void dispatch(CallTelemetry telemetry) {
        try {
            telemetryExecutor.execute(() -> {
                try {
                    telemetrySink.record(telemetry);
                } catch (RuntimeException e) {
                    log.warn("Failed to record telemetry for {}: {}", telemetry.operation(), e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Telemetry queue full or closed, dropping record for {}", telemetry.operation());
        }
    }

    private URI uri(RegistryService service, String pathAndQuery) {
        String base = settings.baseUrl(service).toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + pathAndQuery);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }

    private record Usage(int items, int documents, int searches, int attachments) {
    }
}
