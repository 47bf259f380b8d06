package com.ryuqq.registry.adapter.runner;

import com.ryuqq.registry.application.escalation.AttachmentFetcher;
import com.ryuqq.registry.application.escalation.EscalationDecision;
import com.ryuqq.registry.application.escalation.EscalationPolicy;
import com.ryuqq.registry.application.gateway.RegistryGateway;
import com.ryuqq.registry.application.runtime.DailyCheck;
import com.ryuqq.registry.core.error.RegistryException;
import com.ryuqq.registry.core.model.BatchSummary;
import com.ryuqq.registry.core.model.CheckResult;
import com.ryuqq.registry.core.model.MonitoredEntity;
import com.ryuqq.registry.core.model.TrackedUpdates;
import com.ryuqq.registry.core.spi.NotificationSink;
import com.ryuqq.registry.core.spi.PopulationSource;
import com.ryuqq.registry.core.spi.ResultSink;
import com.ryuqq.registry.core.spi.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Batch Orchestrator 구현체.
 *
 * <p>모니터링 대상 전체를 배치로 나누어 제한된 동시성으로 업데이트를 확인하고,
 * 엔티티별 결과를 {@link BatchSummary}로 집계합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * runDailyCheck() 호출
 *   ↓
 * 1. populationSource.listActive()   (실패 시 publishFailure + BatchRunException)
 * 2. 비어 있으면 0 요약 반환
 * 3. since = now - lookback
 * 4. batchSize 단위로 분할
 * 5. For each batch:
 *    - (첫 배치 제외) interBatchDelayMs 대기
 *    - concurrency 단위 chunk를 병렬 실행 → 전부 join
 *    - 실패/예외는 CheckResult(success=false)로 변환
 *    - 진행 상황 로그
 * 6. 요약 생성 → publishSummary
 * </pre>
 *
 * <p><strong>엔티티 처리 (checkSingleEntity):</strong></p>
 * <pre>
 * fetchTrackedUpdates(trackingId, since)
 *   ├─ 새 데이터 없음 → success, hasNewData=false
 *   └─ 새 데이터 있음 → persistUpdate
 *                     → escalationPolicy.evaluate
 *                        └─ 키워드 일치 시에만 attachmentFetcher.fetch
 * </pre>
 *
 * <p><strong>장애 격리:</strong></p>
 * <ul>
 *   <li>엔티티 실패는 entityMaxRetries 만큼 재시도 후 결과로 기록</li>
 *   <li>어떤 엔티티의 예외도 배치나 실행 전체를 중단시키지 않음</li>
 *   <li>입력된 모든 엔티티는 정확히 하나의 CheckResult를 가짐</li>
 * </ul>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>runDailyCheck는 재진입 불가 (실행 중이면 IllegalStateException)</li>
 *   <li>cancel()은 다음 배치부터 디스패치를 중단하고 진행 중 작업은 끝까지 실행</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class BatchOrchestrator implements DailyCheck {

    private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);

    private final RegistryGateway gateway;
    private final PopulationSource populationSource;
    private final ResultSink resultSink;
    private final NotificationSink notificationSink;
    private final EscalationPolicy escalationPolicy;
    private final AttachmentFetcher attachmentFetcher;
    private final BatchConfig config;
    private final Clock clock;
    private final Sleeper sleeper;
    private final ExecutorService workerExecutor;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile boolean cancelled;

    /**
     * 생성자 (시스템 시계와 Thread.sleep 사용).
     */
    public BatchOrchestrator(RegistryGateway gateway,
                             PopulationSource populationSource,
                             ResultSink resultSink,
                             NotificationSink notificationSink,
                             EscalationPolicy escalationPolicy,
                             AttachmentFetcher attachmentFetcher,
                             BatchConfig config) {
        this(gateway, populationSource, resultSink, notificationSink, escalationPolicy, attachmentFetcher,
            config, Clock.systemUTC(), Sleeper.system());
    }

    /**
     * 생성자 (시계와 Sleeper 주입).
     *
     * @param gateway Registry Gateway
     * @param populationSource 모니터링 대상 조회
     * @param resultSink 업데이트 저장
     * @param notificationSink 실행 결과 알림
     * @param escalationPolicy 첨부파일 수집 여부 판단
     * @param attachmentFetcher 첨부파일 수집
     * @param config 설정
     * @param clock lookback과 실행 시간 계산용 시계
     * @param sleeper 배치 간 대기와 엔티티 재시도 대기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public BatchOrchestrator(RegistryGateway gateway,
                             PopulationSource populationSource,
                             ResultSink resultSink,
                             NotificationSink notificationSink,
                             EscalationPolicy escalationPolicy,
                             AttachmentFetcher attachmentFetcher,
                             BatchConfig config,
                             Clock clock,
                             Sleeper sleeper) {
        if (gateway == null) {
            throw new IllegalArgumentException("gateway cannot be null");
        }
        if (populationSource == null) {
            throw new IllegalArgumentException("populationSource cannot be null");
        }
        if (resultSink == null) {
            throw new IllegalArgumentException("resultSink cannot be null");
        }
        if (notificationSink == null) {
            throw new IllegalArgumentException("notificationSink cannot be null");
        }
        if (escalationPolicy == null) {
            throw new IllegalArgumentException("escalationPolicy cannot be null");
        }
        if (attachmentFetcher == null) {
            throw new IllegalArgumentException("attachmentFetcher cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.gateway = gateway;
        this.populationSource = populationSource;
        this.resultSink = resultSink;
        this.notificationSink = notificationSink;
        this.escalationPolicy = escalationPolicy;
        this.attachmentFetcher = attachmentFetcher;
        this.config = config;
        this.clock = clock;
        this.sleeper = sleeper;
        this.workerExecutor = Executors.newFixedThreadPool(config.concurrency());
    }

    @Override
    public BatchSummary runDailyCheck() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Daily check is already running");
        }
        cancelled = false;
        long startedAt = clock.millis();
        try {
            BatchSummary summary = execute(startedAt);
            publishSummary(summary);
            return summary;
        } catch (BatchRunException e) {
            publishFailure(e);
            throw e;
        } catch (RuntimeException e) {
            log.error("Daily check aborted: {}", e.getMessage(), e);
            publishFailure(e);
            throw new BatchRunException("Daily check aborted: " + e.getMessage(), e,
                BatchSummary.empty(clock.millis() - startedAt));
        } finally {
            running.set(false);
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void cancel() {
        if (running.get()) {
            log.warn("Cancellation requested, no further batches will be dispatched");
        }
        cancelled = true;
    }

    /**
     * Runner 종료 (리소스 정리).
     *
     * <p>ExecutorService를 graceful shutdown하여 진행 중인 작업이
     * 완료되도록 대기합니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(60, TimeUnit.SECONDS)) {
            workerExecutor.shutdownNow();
        }
    }

    public BatchConfig getConfig() {
        return config;
    }

    private BatchSummary execute(long startedAt) {
        List<MonitoredEntity> population = loadPopulation(startedAt);
        if (population.isEmpty()) {
            log.info("No active entities to check");
            return BatchSummary.empty(clock.millis() - startedAt);
        }

        Instant since = clock.instant().minus(config.lookback());
        List<List<MonitoredEntity>> batches = partition(population, config.batchSize());
        log.info("Starting daily check: {} entities in {} batch(es), concurrency {}, updates since {}",
            population.size(), batches.size(), config.concurrency(), since);

        BatchSummary.Accumulator accumulator = BatchSummary.accumulator(config.maxErrors());
        for (int i = 0; i < batches.size(); i++) {
            if (cancelled) {
                log.warn("Daily check cancelled, skipping {} remaining batch(es)", batches.size() - i);
                break;
            }
            if (i > 0 && config.interBatchDelayMs() > 0) {
                sleeper.sleep(config.interBatchDelayMs());
            }

            List<CheckResult> results = processBatch(batches.get(i), since);
            accumulator.addAll(results);

            long elapsedMs = Math.max(1, clock.millis() - startedAt);
            log.info("Batch {}/{} processed: {} ok, {} failed (total {}/{}, {} entities/min)",
                i + 1, batches.size(),
                results.stream().filter(CheckResult::success).count(),
                results.stream().filter(r -> !r.success()).count(),
                accumulator.total(), population.size(),
                String.format(Locale.ROOT, "%.1f", accumulator.total() * 60_000.0 / elapsedMs));
        }

        BatchSummary summary = accumulator.build(clock.millis() - startedAt);
        log.info("Daily check finished in {}ms: {} total, {} ok, {} failed, {} with new data, {} escalated "
                + "(success rate {}%, escalation rate {}%)",
            summary.durationMs(), summary.total(), summary.successful(), summary.failed(),
            summary.withNewData(), summary.withEscalation(),
            String.format(Locale.ROOT, "%.1f", summary.successRate()),
            String.format(Locale.ROOT, "%.1f", summary.escalationRate()));
        return summary;
    }

    private List<MonitoredEntity> loadPopulation(long startedAt) {
        List<MonitoredEntity> population;
        try {
            population = populationSource.listActive();
        } catch (RuntimeException e) {
            log.error("Failed to load monitored entities: {}", e.getMessage(), e);
            throw new BatchRunException("Failed to load monitored entities: " + e.getMessage(), e,
                BatchSummary.empty(clock.millis() - startedAt));
        }
        return population == null ? List.of() : population;
    }

    /**
     * 배치 하나를 concurrency 단위 chunk로 나누어 실행.
     *
     * <p>각 chunk는 모든 작업이 끝날 때까지 기다린 뒤 다음 chunk로 넘어갑니다.</p>
     */
    private List<CheckResult> processBatch(List<MonitoredEntity> batch, Instant since) {
        List<CheckResult> results = new ArrayList<>(batch.size());
        for (List<MonitoredEntity> chunk : partition(batch, config.concurrency())) {
            List<CompletableFuture<CheckResult>> futures = new ArrayList<>(chunk.size());
            for (MonitoredEntity entity : chunk) {
                futures.add(dispatch(entity, since));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            for (CompletableFuture<CheckResult> future : futures) {
                results.add(future.join());
            }
        }
        return results;
    }

    private CompletableFuture<CheckResult> dispatch(MonitoredEntity entity, Instant since) {
        try {
            return CompletableFuture
                .supplyAsync(() -> checkWithRetry(entity, since), workerExecutor)
                .exceptionally(e -> failed(entity, unwrap(e), 1));
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(failed(entity, e, 0));
        }
    }

    /**
     * 엔티티 단위 재시도.
     *
     * <p>Gateway의 HTTP 재시도와 별개로 저장/escalation 단계까지 포함해 다시 실행합니다.</p>
     */
    private CheckResult checkWithRetry(MonitoredEntity entity, Instant since) {
        int maxAttempts = config.entityMaxRetries() + 1;
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return checkSingleEntity(entity, since);
            } catch (Exception e) {
                if (attempt >= maxAttempts) {
                    return failed(entity, e, attempt);
                }
                log.warn("Check of {} failed (attempt {}/{}), retrying in {}ms: {}",
                    entity.externalKey(), attempt, maxAttempts, config.entityRetryDelayMs(), describe(e));
                sleeper.sleep(config.entityRetryDelayMs());
            }
        }
    }

    private CheckResult checkSingleEntity(MonitoredEntity entity, Instant since) {
        TrackedUpdates updates = gateway.fetchTrackedUpdates(entity.trackingId(), since);
        if (!updates.hasNewData()) {
            return CheckResult.noNewData(entity);
        }

        resultSink.persistUpdate(entity.id(), updates.items());

        EscalationDecision decision = escalationPolicy.evaluate(updates.items());
        if (decision.required()) {
            log.info("Escalating {}: {} item(s) matched {}",
                entity.externalKey(), decision.matchedItems(), decision.matchedKeywords());
            attachmentFetcher.fetch(entity);
        }
        return CheckResult.updated(entity, updates.count(), decision.required());
    }

    private static CheckResult failed(MonitoredEntity entity, Throwable error, int attempts) {
        String message = describe(error);
        log.error("Check of {} failed permanently after {} attempt(s): {}", entity.externalKey(), attempts, message);
        return CheckResult.failure(entity, message);
    }

    private void publishSummary(BatchSummary summary) {
        try {
            notificationSink.publishSummary(summary);
        } catch (RuntimeException e) {
            log.warn("Failed to publish daily check summary: {}", e.getMessage());
        }
    }

    private void publishFailure(Throwable error) {
        try {
            notificationSink.publishFailure(error);
        } catch (RuntimeException e) {
            log.warn("Failed to publish daily check failure: {}", e.getMessage());
        }
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private static String describe(Throwable error) {
        if (error instanceof RegistryException registryException) {
            return registryException.kind() + ": " + registryException.getMessage();
        }
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private static <T> List<List<T>> partition(List<T> items, int size) {
        List<List<T>> parts = new ArrayList<>((items.size() + size - 1) / size);
        for (int from = 0; from < items.size(); from += size) {
            parts.add(items.subList(from, Math.min(from + size, items.size())));
        }
        return parts;
    }
}
