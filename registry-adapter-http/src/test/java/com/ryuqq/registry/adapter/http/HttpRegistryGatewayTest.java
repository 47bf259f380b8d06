package com.ryuqq.registry.adapter.http;

import com.ryuqq.registry.application.gateway.GatewayStats;
import com.ryuqq.registry.core.error.CircuitOpenException;
import com.ryuqq.registry.core.error.ErrorKind;
import com.ryuqq.registry.core.error.RegistryException;
import com.ryuqq.registry.core.model.CallTelemetry;
import com.ryuqq.registry.core.model.JobStatus;
import com.ryuqq.registry.core.model.RegistryJob;
import com.ryuqq.registry.core.model.TrackedUpdates;
import com.ryuqq.registry.core.protection.CircuitBreakerConfig;
import com.ryuqq.registry.core.protection.CircuitBreakerState;
import com.ryuqq.registry.core.protection.RateLimiterConfig;
import com.ryuqq.registry.core.protection.SlidingWindowCircuitBreaker;
import com.ryuqq.registry.core.protection.TokenBucketRateLimiter;
import com.ryuqq.registry.core.retry.BackoffCalculator;
import com.ryuqq.registry.core.retry.RetryConfig;
import com.ryuqq.registry.core.retry.RetryPolicy;
import com.ryuqq.registry.core.spi.TelemetrySink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * HttpRegistryGateway 유닛 테스트.
 *
 * <p>Transport는 Mockito mock, 나머지 보호 컴포넌트는 실제 구현을 사용합니다.</p>
 */
@ExtendWith(MockitoExtension.class)
class HttpRegistryGatewayTest {

    private static final String CNJ = "0001234-56.2024.8.26.0100";
    private static final Instant NOW = Instant.parse("2026-03-01T02:00:00Z");

    @Mock
    private RegistryTransport transport;

    private List<CallTelemetry> telemetry;
    private List<Long> sleeps;
    private SlidingWindowCircuitBreaker requestsBreaker;
    private SlidingWindowCircuitBreaker trackingBreaker;
    private HttpRegistryGateway gateway;

    @BeforeEach
    void setUp() {
        telemetry = Collections.synchronizedList(new ArrayList<>());
        sleeps = new ArrayList<>();
        gateway = gateway(telemetry::add, new CircuitBreakerConfig());
    }

    private HttpRegistryGateway gateway(TelemetrySink sink, CircuitBreakerConfig breakerConfig) {
        return gateway(sink, breakerConfig, Executors.newSingleThreadExecutor());
    }

    private HttpRegistryGateway gateway(TelemetrySink sink, CircuitBreakerConfig breakerConfig,
                                        ExecutorService telemetryExecutor) {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        RegistrySettings settings = new RegistrySettings(
            "test-key",
            URI.create("https://requests.test"),
            URI.create("https://tracking.test/"),
            URI.create("https://attachments.test"),
            "test-agent",
            Duration.ofSeconds(5),
            new RateLimiterConfig(),
            new RetryConfig(),
            breakerConfig,
            1024
        );
        RetryConfig retryConfig = new RetryConfig();
        requestsBreaker = new SlidingWindowCircuitBreaker("requests-service", breakerConfig, clock);
        trackingBreaker = new SlidingWindowCircuitBreaker("tracking-service", breakerConfig, clock);
        return new HttpRegistryGateway(
            settings,
            transport,
            new TokenBucketRateLimiter(settings.rateLimiter()),
            requestsBreaker,
            trackingBreaker,
            new RetryPolicy(retryConfig, new BackoffCalculator(retryConfig, () -> 0.5), sleeps::add),
            sink,
            telemetryExecutor,
            clock
        );
    }

    private static RegistryResponse json(int status, String body) {
        return new RegistryResponse(status, Map.of(), body.getBytes(StandardCharsets.UTF_8));
    }

    // ========================================
    // submitSearch
    // ========================================

    @Test
    void submitSearch_PostsSearchBody_AndReturnsPendingJob() {
        // given
        when(transport.execute(any())).thenReturn(json(200, "{\"request_id\":\"req-1\"}"));

        // when
        RegistryJob job = gateway.submitSearch(CNJ, false);

        // then
        assertThat(job.jobId()).isEqualTo("req-1");
        assertThat(job.entityKey()).isEqualTo(CNJ);
        assertThat(job.status()).isEqualTo(JobStatus.PENDING);
        assertThat(job.submittedAt()).isEqualTo(NOW);

        ArgumentCaptor<RegistryRequest> captor = ArgumentCaptor.forClass(RegistryRequest.class);
        verify(transport).execute(captor.capture());
        RegistryRequest request = captor.getValue();
        assertThat(request.method()).isEqualTo("POST");
        assertThat(request.uri()).isEqualTo(URI.create("https://requests.test/requests"));
        assertThat(request.attempt()).isEqualTo(1);
        assertThat(request.jsonBody())
            .contains("\"search_type\":\"lawsuit_cnj\"")
            .contains("\"search_key\":\"" + CNJ + "\"")
            .contains("\"with_attachments\":false");
    }

    @Test
    void 일시적_오류는_재시도_후_성공하고_시도_번호를_증가시킨다() {
        // given
        when(transport.execute(any()))
            .thenReturn(json(503, "overloaded"))
            .thenReturn(json(200, "{\"request_id\":\"req-2\"}"));

        // when
        RegistryJob job = gateway.submitSearch(CNJ, true);

        // then
        assertThat(job.jobId()).isEqualTo("req-2");
        ArgumentCaptor<RegistryRequest> captor = ArgumentCaptor.forClass(RegistryRequest.class);
        verify(transport, times(2)).execute(captor.capture());
        assertThat(captor.getAllValues()).extracting(RegistryRequest::attempt).containsExactly(1, 2);
        // 503 → SERVER_OVERLOAD, 3x base delay
        assertThat(sleeps).containsExactly(3000L);
    }

    @Test
    void 응답이_429면_Retry_After를_존중하고_rateLimitHits를_센다() {
        // given
        when(transport.execute(any()))
            .thenReturn(new RegistryResponse(429, Map.of("retry-after", List.of("7")), new byte[0]))
            .thenReturn(json(200, "{\"request_id\":\"req-3\"}"));

        // when
        gateway.submitSearch(CNJ, false);

        // then
        assertThat(sleeps).containsExactly(7000L);
        assertThat(gateway.getStats().rateLimitHits()).isEqualTo(1);
    }

    @Test
    void 클라이언트_오류는_재시도하지_않는다() {
        // given
        when(transport.execute(any())).thenReturn(json(400, "{\"message\":\"invalid cnj\"}"));

        // when / then
        assertThatThrownBy(() -> gateway.submitSearch("bad", false))
            .isInstanceOf(RegistryException.class)
            .satisfies(e -> {
                RegistryException failure = (RegistryException) e;
                assertThat(failure.kind()).isEqualTo(ErrorKind.CLIENT);
                assertThat(failure.statusCode()).isEqualTo(400);
                assertThat(failure.getMessage()).contains("invalid cnj");
            });

        verify(transport, times(1)).execute(any());
        assertThat(sleeps).isEmpty();
        GatewayStats stats = gateway.getStats();
        assertThat(stats.failedCalls()).isEqualTo(1);
        assertThat(stats.lastError()).startsWith("submitSearch");
    }

    @Test
    void 응답에_request_id가_없으면_PARSE_오류() {
        // given
        when(transport.execute(any())).thenReturn(json(200, "{\"status\":\"ok\"}"));

        // when / then
        assertThatThrownBy(() -> gateway.submitSearch(CNJ, false))
            .isInstanceOf(RegistryException.class)
            .extracting(e -> ((RegistryException) e).kind())
            .isEqualTo(ErrorKind.PARSE);
    }

    // ========================================
    // Circuit breaker admission
    // ========================================

    @Test
    void 브레이커가_열리면_transport를_호출하지_않고_즉시_거부() {
        // given: 2회 표본, 50% 이상 실패 시 OPEN
        gateway = gateway(telemetry::add, new CircuitBreakerConfig()
            .withMinimumRequests(2)
            .withFailureRateThresholdPercent(50.0));
        when(transport.execute(any())).thenReturn(json(404, "not found"));

        assertThatThrownBy(() -> gateway.pollJob("req-1")).isInstanceOf(RegistryException.class);
        assertThatThrownBy(() -> gateway.pollJob("req-2")).isInstanceOf(RegistryException.class);
        assertThat(requestsBreaker.getState()).isEqualTo(CircuitBreakerState.OPEN);

        // when / then
        assertThatThrownBy(() -> gateway.pollJob("req-3"))
            .isInstanceOf(CircuitOpenException.class)
            .extracting(e -> ((CircuitOpenException) e).circuitName())
            .isEqualTo("requests-service");
        verify(transport, times(2)).execute(any());
        assertThat(gateway.getStats().circuits().get("requests-service").state())
            .isEqualTo(CircuitBreakerState.OPEN);
    }

    @Test
    void 서비스별_브레이커는_서로_독립적이다() {
        // given
        gateway = gateway(telemetry::add, new CircuitBreakerConfig()
            .withMinimumRequests(1)
            .withFailureRateThresholdPercent(50.0));
        when(transport.execute(any()))
            .thenReturn(json(404, "not found"))
            .thenReturn(json(200, "{\"page_data\":[{\"response_id\":\"m1\",\"text\":\"Juntada de petição\"}]}"));
        assertThatThrownBy(() -> gateway.pollJob("req-1")).isInstanceOf(RegistryException.class);

        // when
        TrackedUpdates updates = gateway.fetchTrackedUpdates("trk-1", NOW.minus(Duration.ofHours(24)));

        // then
        assertThat(requestsBreaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(trackingBreaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(updates.count()).isEqualTo(1);
    }

    // ========================================
    // Other operations
    // ========================================

    @Test
    void fetchTrackedUpdates_UsesTrackingBaseUrlAndIsoSince() {
        // given
        when(transport.execute(any())).thenReturn(json(200, "{\"page_data\":[]}"));

        // when
        TrackedUpdates updates = gateway.fetchTrackedUpdates("trk-9", Instant.parse("2026-02-28T02:00:00Z"));

        // then
        assertThat(updates.hasNewData()).isFalse();
        ArgumentCaptor<RegistryRequest> captor = ArgumentCaptor.forClass(RegistryRequest.class);
        verify(transport).execute(captor.capture());
        assertThat(captor.getValue().uri().toString())
            .isEqualTo("https://tracking.test/tracking/trk-9/responses?created_at_gte=2026-02-28T02%3A00%3A00Z");
    }

    @Test
    void pollJob_ReturnsSnapshotWithAttachments() {
        // given
        when(transport.execute(any())).thenReturn(json(200,
            "{\"request_id\":\"req-1\",\"status\":\"completed\",\"data\":{\"instance\":2,"
                + "\"attachments\":[{\"attachment_id\":\"a1\",\"attachment_name\":\"Sentença\"}]}}"));

        // when
        RegistryJob job = gateway.pollJob("req-1");

        // then
        assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.instance()).isEqualTo(2);
        assertThat(job.attachments()).singleElement()
            .satisfies(a -> assertThat(a.name()).isEqualTo("Sentença"));
    }

    @Test
    void downloadAttachment_BoundsBodyByMaxAttachmentBytes() {
        // given
        byte[] pdf = {1, 2, 3};
        when(transport.execute(any())).thenReturn(new RegistryResponse(200, Map.of(), pdf));

        // when
        byte[] bytes = gateway.downloadAttachment(CNJ, 1, "a1");

        // then
        assertThat(bytes).containsExactly(1, 2, 3);
        ArgumentCaptor<RegistryRequest> captor = ArgumentCaptor.forClass(RegistryRequest.class);
        verify(transport).execute(captor.capture());
        assertThat(captor.getValue().maxBodyBytes()).isEqualTo(1024);
        assertThat(captor.getValue().uri().toString())
            .isEqualTo("https://attachments.test/lawsuits/" + CNJ + "/1/attachments/a1");
    }

    @Test
    void 너무_큰_첨부파일은_재시도하지_않는다() {
        // given
        when(transport.execute(any()))
            .thenThrow(new RegistryException(ErrorKind.ATTACHMENT_TOO_LARGE, "too large"));

        // when / then
        assertThatThrownBy(() -> gateway.downloadAttachment(CNJ, 1, "a1"))
            .isInstanceOf(RegistryException.class)
            .extracting(e -> ((RegistryException) e).kind())
            .isEqualTo(ErrorKind.ATTACHMENT_TOO_LARGE);
        verify(transport, times(1)).execute(any());
    }

    @Test
    void removeTracking_SendsDelete() {
        // given
        when(transport.execute(any())).thenReturn(json(204, ""));

        // when
        gateway.removeTracking("trk-1");

        // then
        ArgumentCaptor<RegistryRequest> captor = ArgumentCaptor.forClass(RegistryRequest.class);
        verify(transport).execute(captor.capture());
        assertThat(captor.getValue().method()).isEqualTo("DELETE");
        assertThat(captor.getValue().uri().toString()).isEqualTo("https://tracking.test/tracking/trk-1");
    }

    // ========================================
    // Telemetry / stats
    // ========================================

    @Test
    void 모든_종료_결과에_텔레메트리를_기록한다() {
        // given
        when(transport.execute(any()))
            .thenReturn(json(500, "boom"))
            .thenReturn(json(200, "{\"request_id\":\"req-1\"}"))
            .thenReturn(json(401, "denied"));

        // when
        gateway.submitSearch(CNJ, false);
        assertThatThrownBy(() -> gateway.submitSearch(CNJ, false)).isInstanceOf(RegistryException.class);
        gateway.close();

        // then
        assertThat(telemetry).hasSize(2);
        CallTelemetry success = telemetry.get(0);
        assertThat(success.success()).isTrue();
        assertThat(success.attempts()).isEqualTo(2);
        assertThat(success.tribunal()).isEqualTo("8");
        assertThat(success.estimatedCost()).isEqualTo(CallTelemetry.COST_PER_SEARCH);

        CallTelemetry failure = telemetry.get(1);
        assertThat(failure.success()).isFalse();
        assertThat(failure.errorKind()).isEqualTo(ErrorKind.AUTH);
        assertThat(failure.attempts()).isEqualTo(1);
    }

    @Test
    void fetchTrackedUpdates와_pollJob_텔레메트리에도_식별자가_기록된다() {
        // given
        when(transport.execute(any()))
            .thenReturn(json(200, "{\"page_data\":[]}"))
            .thenReturn(json(200, "{\"request_id\":\"job-1\",\"status\":\"processing\"}"))
            .thenReturn(json(204, ""));

        // when
        gateway.fetchTrackedUpdates("trk-1", NOW.minus(Duration.ofHours(24)));
        gateway.pollJob("job-1");
        gateway.removeTracking("trk-1");
        gateway.close();

        // then
        assertThat(telemetry).hasSize(3);
        assertThat(telemetry).allSatisfy(record -> assertThat(record.entityKey()).isNotNull());
        assertThat(telemetry).extracting(CallTelemetry::operation, CallTelemetry::entityKey)
            .containsExactly(
                tuple("fetchTrackedUpdates", "trk-1"),
                tuple("pollJob", "job-1"),
                tuple("removeTracking", "trk-1"));
    }

    @Test
    void 실패한_pollJob_텔레메트리에도_jobId가_남는다() {
        // given
        when(transport.execute(any())).thenReturn(json(404, "not found"));

        // when
        assertThatThrownBy(() -> gateway.pollJob("job-404")).isInstanceOf(RegistryException.class);
        gateway.close();

        // then
        assertThat(telemetry).singleElement().satisfies(record -> {
            assertThat(record.success()).isFalse();
            assertThat(record.entityKey()).isEqualTo("job-404");
        });
    }

    @Test
    void 텔레메트리_큐가_가득_차면_레코드를_버리고_호출은_성공한다() throws Exception {
        // given: worker는 첫 레코드에서 멈추고, 큐에는 1건만 대기 가능
        CountDownLatch firstRecordStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        TelemetrySink blocking = record -> {
            telemetry.add(record);
            firstRecordStarted.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
        gateway = gateway(blocking, new CircuitBreakerConfig(), HttpRegistryGateway.telemetryExecutor(1));
        when(transport.execute(any())).thenReturn(json(200, "{\"request_id\":\"req-1\"}"));

        // when
        gateway.submitSearch(CNJ, false);
        assertThat(firstRecordStarted.await(5, TimeUnit.SECONDS)).isTrue();
        gateway.submitSearch(CNJ, false);
        RegistryJob dropped = gateway.submitSearch(CNJ, false);
        release.countDown();
        gateway.close();

        // then
        assertThat(dropped.jobId()).isEqualTo("req-1");
        assertThat(gateway.getStats().successfulCalls()).isEqualTo(3);
        assertThat(telemetry).hasSize(2);
    }

    @Test
    void telemetryExecutor_큐_용량은_양수여야_한다() {
        assertThatThrownBy(() -> HttpRegistryGateway.telemetryExecutor(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("queueCapacity");
    }

    @Test
    void 텔레메트리_실패는_호출_결과에_영향을_주지_않는다() {
        // given
        TelemetrySink failing = record -> {
            throw new IllegalStateException("sink down");
        };
        gateway = gateway(failing, new CircuitBreakerConfig());
        when(transport.execute(any())).thenReturn(json(200, "{\"request_id\":\"req-1\"}"));

        // when
        RegistryJob job = gateway.submitSearch(CNJ, false);
        gateway.close();

        // then
        assertThat(job.jobId()).isEqualTo("req-1");
        assertThat(gateway.getStats().successfulCalls()).isEqualTo(1);
    }

    @Test
    void getStats_CountsCallsAndExposesBothCircuits() {
        // given
        when(transport.execute(any()))
            .thenReturn(json(200, "{\"request_id\":\"req-1\"}"))
            .thenReturn(json(403, "forbidden"));

        // when
        gateway.submitSearch(CNJ, false);
        assertThatThrownBy(() -> gateway.submitSearch(CNJ, false)).isInstanceOf(RegistryException.class);
        GatewayStats stats = gateway.getStats();

        // then
        assertThat(stats.totalCalls()).isEqualTo(2);
        assertThat(stats.successfulCalls()).isEqualTo(1);
        assertThat(stats.failedCalls()).isEqualTo(1);
        assertThat(stats.averageResponseTimeMs()).isGreaterThanOrEqualTo(0.0);
        assertThat(stats.circuits()).containsOnlyKeys("requests-service", "tracking-service");
    }

    @Test
    void 입력값_검증() {
        assertThatThrownBy(() -> gateway.submitSearch(" ", false))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> gateway.fetchTrackedUpdates("trk", null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> gateway.downloadAttachment(CNJ, 0, "a1"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
