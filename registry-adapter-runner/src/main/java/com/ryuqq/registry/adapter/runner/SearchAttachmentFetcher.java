package com.ryuqq.registry.adapter.runner;

import com.ryuqq.registry.application.escalation.AttachmentFetcher;
import com.ryuqq.registry.application.gateway.RegistryGateway;
import com.ryuqq.registry.application.polling.JobPoller;
import com.ryuqq.registry.core.model.AttachmentRef;
import com.ryuqq.registry.core.model.MonitoredEntity;
import com.ryuqq.registry.core.model.RegistryJob;
import com.ryuqq.registry.core.spi.ResultSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * 첨부파일 수집 (escalation 단계).
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. gateway.submitSearch(key, withAttachments=true)
 * 2. poller.awaitCompletion(job)        → 완료된 job의 첨부파일 목록
 * 3. 첨부파일별 downloadAttachment       (최대 maxConcurrentDownloads 동시 실행)
 * 4. resultSink.persistAttachment
 * </pre>
 *
 * <p><strong>실패 처리:</strong></p>
 * <ul>
 *   <li>검색 제출/폴링 실패는 호출자에게 전파 (엔티티 단위 재시도 대상)</li>
 *   <li>개별 다운로드 실패는 로그만 남기고 건너뜀</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SearchAttachmentFetcher implements AttachmentFetcher {

    private static final Logger log = LoggerFactory.getLogger(SearchAttachmentFetcher.class);

    public static final int DEFAULT_MAX_CONCURRENT_DOWNLOADS = 5;

    private final RegistryGateway gateway;
    private final JobPoller poller;
    private final ResultSink resultSink;
    private final ExecutorService downloadExecutor;

    public SearchAttachmentFetcher(RegistryGateway gateway, JobPoller poller, ResultSink resultSink) {
        this(gateway, poller, resultSink, DEFAULT_MAX_CONCURRENT_DOWNLOADS);
    }

    /**
     * 생성자.
     *
     * @param gateway Registry Gateway
     * @param poller job 완료 대기
     * @param resultSink 첨부파일 저장
     * @param maxConcurrentDownloads 동시 다운로드 수 (1 이상)
     * @throws IllegalArgumentException 의존성이 null이거나 maxConcurrentDownloads가 0 이하인 경우
     */
    public SearchAttachmentFetcher(RegistryGateway gateway, JobPoller poller, ResultSink resultSink,
                                   int maxConcurrentDownloads) {
        if (gateway == null) {
            throw new IllegalArgumentException("gateway cannot be null");
        }
        if (poller == null) {
            throw new IllegalArgumentException("poller cannot be null");
        }
        if (resultSink == null) {
            throw new IllegalArgumentException("resultSink cannot be null");
        }
        if (maxConcurrentDownloads <= 0) {
            throw new IllegalArgumentException(
                "maxConcurrentDownloads must be positive (current: " + maxConcurrentDownloads + ")");
        }
        this.gateway = gateway;
        this.poller = poller;
        this.resultSink = resultSink;
        this.downloadExecutor = Executors.newFixedThreadPool(maxConcurrentDownloads);
    }

    @Override
    public int fetch(MonitoredEntity entity) {
        if (entity == null) {
            throw new IllegalArgumentException("entity cannot be null");
        }
        RegistryJob submitted = gateway.submitSearch(entity.externalKey(), true);
        RegistryJob completed = poller.awaitCompletion(submitted);
        List<AttachmentRef> attachments = completed.attachments();
        if (attachments.isEmpty()) {
            log.info("Search {} for {} returned no attachments", completed.jobId(), entity.externalKey());
            return 0;
        }

        List<CompletableFuture<Boolean>> downloads = new ArrayList<>(attachments.size());
        for (AttachmentRef attachment : attachments) {
            downloads.add(dispatch(entity, completed.instance(), attachment));
        }
        CompletableFuture.allOf(downloads.toArray(new CompletableFuture[0])).join();

        int stored = 0;
        for (CompletableFuture<Boolean> download : downloads) {
            if (download.join()) {
                stored++;
            }
        }
        log.info("Stored {}/{} attachment(s) for {}", stored, attachments.size(), entity.externalKey());
        return stored;
    }

    /**
     * 다운로드 executor 종료.
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        downloadExecutor.shutdown();
        if (!downloadExecutor.awaitTermination(60, TimeUnit.SECONDS)) {
            downloadExecutor.shutdownNow();
        }
    }

    private CompletableFuture<Boolean> dispatch(MonitoredEntity entity, int instance, AttachmentRef attachment) {
        try {
            return CompletableFuture
                .supplyAsync(() -> download(entity, instance, attachment), downloadExecutor)
                .exceptionally(e -> skipped(entity, attachment, e));
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(skipped(entity, attachment, e));
        }
    }

    private boolean download(MonitoredEntity entity, int instance, AttachmentRef attachment) {
        byte[] content = gateway.downloadAttachment(entity.externalKey(), instance, attachment.attachmentId());
        resultSink.persistAttachment(entity.id(), attachment, content);
        log.debug("Stored attachment {} ({} bytes) for {}",
            attachment.attachmentId(), content.length, entity.externalKey());
        return true;
    }

    private static boolean skipped(MonitoredEntity entity, AttachmentRef attachment, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
            ? error.getCause()
            : error;
        log.warn("Skipping attachment {} of {}: {}",
            attachment.attachmentId(), entity.externalKey(), cause.getMessage());
        return false;
    }
}
