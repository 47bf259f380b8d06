package com.ryuqq.registry.adapter.runner;

import com.ryuqq.registry.application.escalation.AttachmentFetcher;
import com.ryuqq.registry.application.gateway.RegistryGateway;
import com.ryuqq.registry.core.error.CircuitOpenException;
import com.ryuqq.registry.core.error.ErrorKind;
import com.ryuqq.registry.core.error.RegistryException;
import com.ryuqq.registry.core.model.BatchSummary;
import com.ryuqq.registry.core.model.EntityError;
import com.ryuqq.registry.core.model.MonitoredEntity;
import com.ryuqq.registry.core.model.TrackedItem;
import com.ryuqq.registry.core.model.TrackedUpdates;
import com.ryuqq.registry.core.spi.NotificationSink;
import com.ryuqq.registry.core.spi.PopulationSource;
import com.ryuqq.registry.core.spi.ResultSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * BatchOrchestrator 유닛 테스트.
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>배치 분할과 배치 간 대기</li>
 *   <li>엔티티 단위 재시도와 장애 격리</li>
 *   <li>키워드 기반 escalation</li>
 *   <li>재진입 방지와 취소</li>
 *   <li>알림 발행</li>
 * </ul>
 */
@ExtendWith(MockitoExtension.class)
class BatchOrchestratorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T02:00:00Z");

    @Mock
    private RegistryGateway gateway;

    @Mock
    private PopulationSource populationSource;

    @Mock
    private ResultSink resultSink;

    @Mock
    private NotificationSink notificationSink;

    @Mock
    private AttachmentFetcher attachmentFetcher;

    private List<Long> sleeps;
    private BatchOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        sleeps = Collections.synchronizedList(new ArrayList<>());
        orchestrator = orchestrator(new BatchConfig());
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        orchestrator.shutdown();
    }

    private BatchOrchestrator orchestrator(BatchConfig config) {
        return new BatchOrchestrator(gateway, populationSource, resultSink, notificationSink,
            new KeywordEscalationPolicy(), attachmentFetcher, config, new FakeClock(NOW), sleeps::add);
    }

    private static List<MonitoredEntity> entities(int count) {
        List<MonitoredEntity> entities = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            entities.add(MonitoredEntity.of("e-" + i, "cnj-" + i, "trk-" + i));
        }
        return entities;
    }

    private static TrackedUpdates updates(String trackingId, String... texts) {
        List<TrackedItem> items = new ArrayList<>();
        for (String text : texts) {
            items.add(new TrackedItem(null, text, "{}"));
        }
        return new TrackedUpdates(trackingId, items);
    }

    // ========================================
    // Run level
    // ========================================

    @Test
    void 대상이_없으면_0_요약을_반환하고_알림() {
        // given
        when(populationSource.listActive()).thenReturn(List.of());

        // when
        BatchSummary summary = orchestrator.runDailyCheck();

        // then
        assertThat(summary.total()).isZero();
        assertThat(summary.failed()).isZero();
        verifyNoInteractions(gateway);
        verify(notificationSink).publishSummary(summary);
        verify(notificationSink, never()).publishFailure(any());
    }

    @Test
    void 대상_조회_실패는_실행_실패로_알림() {
        // given
        IllegalStateException outage = new IllegalStateException("database unreachable");
        when(populationSource.listActive()).thenThrow(outage);

        // when / then
        assertThatThrownBy(() -> orchestrator.runDailyCheck())
            .isInstanceOf(BatchRunException.class)
            .hasCause(outage)
            .satisfies(e -> assertThat(((BatchRunException) e).summary().total()).isZero());
        verify(notificationSink).publishFailure(any(BatchRunException.class));
        verify(notificationSink, never()).publishSummary(any());
        assertThat(orchestrator.isRunning()).isFalse();
    }

    @Test
    void lookback_기준_시각으로_업데이트를_조회() {
        // given
        when(populationSource.listActive()).thenReturn(entities(1));
        when(gateway.fetchTrackedUpdates(anyString(), any())).thenReturn(TrackedUpdates.none("trk-0"));

        // when
        orchestrator.runDailyCheck();

        // then
        verify(gateway).fetchTrackedUpdates("trk-0", NOW.minus(Duration.ofHours(24)));
    }

    @Test
    void 배치_사이에만_대기한다() {
        // given: 12개, 배치 5 → 5, 5, 2
        orchestrator = orchestrator(new BatchConfig().withBatchSize(5).withConcurrency(2));
        when(populationSource.listActive()).thenReturn(entities(12));
        when(gateway.fetchTrackedUpdates(anyString(), any())).thenReturn(TrackedUpdates.none("trk"));

        // when
        BatchSummary summary = orchestrator.runDailyCheck();

        // then
        assertThat(summary.total()).isEqualTo(12);
        assertThat(summary.successful()).isEqualTo(12);
        assertThat(sleeps).containsExactly(2000L, 2000L);
    }

    // ========================================
    // Entity level
    // ========================================

    @Test
    void 새_데이터는_저장하고_키워드가_없으면_escalation하지_않는다() {
        // given
        when(populationSource.listActive()).thenReturn(entities(1));
        TrackedUpdates found = updates("trk-0", "Conclusos ao juiz", "Remessa à contadoria");
        when(gateway.fetchTrackedUpdates(eq("trk-0"), any())).thenReturn(found);

        // when
        BatchSummary summary = orchestrator.runDailyCheck();

        // then
        assertThat(summary.withNewData()).isEqualTo(1);
        assertThat(summary.withEscalation()).isZero();
        verify(resultSink).persistUpdate("e-0", found.items());
        verifyNoInteractions(attachmentFetcher);
    }

    @Test
    void 키워드가_있으면_첨부파일을_한_번_수집() {
        // given
        List<MonitoredEntity> population = entities(1);
        when(populationSource.listActive()).thenReturn(population);
        when(gateway.fetchTrackedUpdates(eq("trk-0"), any()))
            .thenReturn(updates("trk-0", "Juntada de petição", "Sentença publicada"));
        when(attachmentFetcher.fetch(population.get(0))).thenReturn(2);

        // when
        BatchSummary summary = orchestrator.runDailyCheck();

        // then
        assertThat(summary.withEscalation()).isEqualTo(1);
        assertThat(summary.escalationRate()).isEqualTo(100.0);
        verify(attachmentFetcher, times(1)).fetch(population.get(0));
    }

    @Test
    void 엔티티_실패는_재시도_후_성공할_수_있다() {
        // given
        when(populationSource.listActive()).thenReturn(entities(1));
        when(gateway.fetchTrackedUpdates(eq("trk-0"), any()))
            .thenThrow(new RegistryException(ErrorKind.SERVER, "bad gateway"))
            .thenReturn(TrackedUpdates.none("trk-0"));

        // when
        BatchSummary summary = orchestrator.runDailyCheck();

        // then
        assertThat(summary.successful()).isEqualTo(1);
        assertThat(sleeps).containsExactly(3000L);
    }

    @Test
    void 재시도를_모두_소진하면_실패로_기록하고_나머지는_계속() {
        // given
        when(populationSource.listActive()).thenReturn(entities(3));
        when(gateway.fetchTrackedUpdates(anyString(), any())).thenAnswer(invocation -> {
            String trackingId = invocation.getArgument(0);
            if (trackingId.equals("trk-1")) {
                throw new CircuitOpenException("tracking-service");
            }
            return TrackedUpdates.none(trackingId);
        });

        // when
        BatchSummary summary = orchestrator.runDailyCheck();

        // then
        assertThat(summary.total()).isEqualTo(3);
        assertThat(summary.successful()).isEqualTo(2);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.errors()).extracting(EntityError::entityKey).containsExactly("cnj-1");
        assertThat(summary.errors().get(0).message()).contains("CIRCUIT_OPEN");
        // 1 + entityMaxRetries(2)
        verify(gateway, times(3)).fetchTrackedUpdates(eq("trk-1"), any());
        assertThat(sleeps).containsExactly(3000L, 3000L);
        verify(notificationSink).publishSummary(summary);
    }

    @Test
    void 예상치_못한_예외도_엔티티_실패로_변환() {
        // given
        orchestrator = orchestrator(new BatchConfig().withEntityMaxRetries(0));
        when(populationSource.listActive()).thenReturn(entities(2));
        when(gateway.fetchTrackedUpdates(anyString(), any())).thenAnswer(invocation -> {
            if ("trk-0".equals(invocation.getArgument(0))) {
                throw new NullPointerException();
            }
            return TrackedUpdates.none("trk-1");
        });

        // when
        BatchSummary summary = orchestrator.runDailyCheck();

        // then
        assertThat(summary.successful() + summary.failed()).isEqualTo(summary.total());
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.errors().get(0).message()).isEqualTo("NullPointerException");
    }

    @Test
    void 저장_실패도_엔티티_재시도_대상() {
        // given
        orchestrator = orchestrator(new BatchConfig().withEntityMaxRetries(1).withEntityRetryDelayMs(10));
        when(populationSource.listActive()).thenReturn(entities(1));
        TrackedUpdates found = updates("trk-0", "Conclusos");
        when(gateway.fetchTrackedUpdates(eq("trk-0"), any())).thenReturn(found);
        doThrow(new IllegalStateException("disk full"))
            .doNothing()
            .when(resultSink).persistUpdate("e-0", found.items());

        // when
        BatchSummary summary = orchestrator.runDailyCheck();

        // then
        assertThat(summary.successful()).isEqualTo(1);
        verify(resultSink, times(2)).persistUpdate("e-0", found.items());
        assertThat(sleeps).containsExactly(10L);
    }

    @Test
    void 요약_알림_실패는_결과에_영향을_주지_않는다() {
        // given
        when(populationSource.listActive()).thenReturn(entities(1));
        when(gateway.fetchTrackedUpdates(anyString(), any())).thenReturn(TrackedUpdates.none("trk-0"));
        doThrow(new IllegalStateException("slack down"))
            .when(notificationSink).publishSummary(any());

        // when
        BatchSummary summary = orchestrator.runDailyCheck();

        // then
        assertThat(summary.successful()).isEqualTo(1);
    }

    // ========================================
    // Concurrency
    // ========================================

    @Test
    void 동시_실행_수는_concurrency를_넘지_않는다() {
        // given
        orchestrator = orchestrator(new BatchConfig().withConcurrency(3).withBatchSize(20));
        when(populationSource.listActive()).thenReturn(entities(20));
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        when(gateway.fetchTrackedUpdates(anyString(), any())).thenAnswer(invocation -> {
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            Thread.sleep(10);
            inFlight.decrementAndGet();
            return TrackedUpdates.none(invocation.getArgument(0));
        });

        // when
        BatchSummary summary = orchestrator.runDailyCheck();

        // then
        assertThat(summary.successful()).isEqualTo(20);
        assertThat(maxInFlight.get()).isLessThanOrEqualTo(3);
    }

    @Test
    void 실행_중에는_재진입할_수_없다() throws Exception {
        // given
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(populationSource.listActive()).thenReturn(entities(1));
        when(gateway.fetchTrackedUpdates(anyString(), any())).thenAnswer(invocation -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return TrackedUpdates.none("trk-0");
        });
        CompletableFuture<BatchSummary> first = CompletableFuture.supplyAsync(() -> orchestrator.runDailyCheck());
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        // when / then
        assertThat(orchestrator.isRunning()).isTrue();
        assertThatThrownBy(() -> orchestrator.runDailyCheck()).isInstanceOf(IllegalStateException.class);

        release.countDown();
        assertThat(first.get(5, TimeUnit.SECONDS).total()).isEqualTo(1);
        assertThat(orchestrator.isRunning()).isFalse();
    }

    @Test
    void 취소하면_다음_배치부터_디스패치하지_않는다() {
        // given: 배치 2개씩, 6개
        orchestrator = orchestrator(new BatchConfig().withBatchSize(2).withConcurrency(2));
        when(populationSource.listActive()).thenReturn(entities(6));
        when(gateway.fetchTrackedUpdates(anyString(), any())).thenAnswer(invocation -> {
            orchestrator.cancel();
            return TrackedUpdates.none(invocation.getArgument(0));
        });

        // when
        BatchSummary summary = orchestrator.runDailyCheck();

        // then
        assertThat(summary.total()).isEqualTo(2);
        assertThat(summary.failed()).isZero();
        assertThat(sleeps).isEmpty();
        ArgumentCaptor<BatchSummary> published = ArgumentCaptor.forClass(BatchSummary.class);
        verify(notificationSink).publishSummary(published.capture());
        assertThat(published.getValue().total()).isEqualTo(2);
    }
}
