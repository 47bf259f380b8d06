package com.ryuqq.registry.adapter.runner;

import com.ryuqq.registry.application.gateway.RegistryGateway;
import com.ryuqq.registry.application.polling.JobPoller;
import com.ryuqq.registry.core.error.ErrorKind;
import com.ryuqq.registry.core.error.RegistryException;
import com.ryuqq.registry.core.model.JobStatus;
import com.ryuqq.registry.core.model.RegistryJob;
import com.ryuqq.registry.core.spi.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Polling Orchestrator 구현체.
 *
 * <p>Registry의 비동기 "제출 후 폴링" 프로토콜을 제한된 시간 안에 끝나는
 * 동기 호출로 변환합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * awaitCompletion(job) 호출
 *   ↓
 * 1. gateway.pollJob(jobId) → 스냅샷
 * 2. job.advance(snapshot)  → 상태 전이 검증
 * 3. 분기:
 *    - COMPLETED → 즉시 반환
 *    - FAILED    → JOB_FAILED 예외 (재시도 없음)
 *    - 그 외     → maxAttempts / timeout 확인 후 interval 만큼 sleep, 1로 돌아감
 * </pre>
 *
 * <p><strong>HTTP 재시도와의 차이:</strong></p>
 * <ul>
 *   <li>poll 호출 자체의 실패는 Gateway의 RetryPolicy가 처리</li>
 *   <li>이 루프는 호출이 실패해서가 아니라 job이 아직 진행 중이라서 반복</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PollingOrchestrator implements JobPoller {

    private static final Logger log = LoggerFactory.getLogger(PollingOrchestrator.class);

    private final RegistryGateway gateway;
    private final PollingConfig config;
    private final Clock clock;
    private final Sleeper sleeper;

    /**
     * 생성자 (시스템 시계와 Thread.sleep 사용).
     *
     * @param gateway Registry Gateway
     * @param config 설정
     */
    public PollingOrchestrator(RegistryGateway gateway, PollingConfig config) {
        this(gateway, config, Clock.systemUTC(), Sleeper.system());
    }

    /**
     * 생성자 (시계와 Sleeper 주입).
     *
     * @param gateway Registry Gateway
     * @param config 설정
     * @param clock 타임아웃 계산용 시계
     * @param sleeper 폴링 간격 대기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public PollingOrchestrator(RegistryGateway gateway, PollingConfig config, Clock clock, Sleeper sleeper) {
        if (gateway == null) {
            throw new IllegalArgumentException("gateway cannot be null");
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
        this.config = config;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    @Override
    public RegistryJob awaitCompletion(RegistryJob job) {
        if (job == null) {
            throw new IllegalArgumentException("job cannot be null");
        }
        if (job.isTerminal()) {
            return settle(job, 0, Duration.ZERO);
        }

        Instant startedAt = clock.instant();
        Instant deadline = startedAt.plusMillis(config.timeoutMs());
        RegistryJob current = job;
        int attempts = 0;

        while (true) {
            attempts++;
            current = current.advance(gateway.pollJob(current.jobId()));
            if (current.isTerminal()) {
                return settle(current, attempts, Duration.between(startedAt, clock.instant()));
            }

            if (attempts >= config.maxAttempts()) {
                throw timeout(current, "not finished after " + attempts + " polls");
            }
            long remainingMs = Duration.between(clock.instant(), deadline).toMillis();
            if (remainingMs <= 0) {
                throw timeout(current, "not finished within " + config.timeoutMs() + "ms");
            }

            log.debug("Job {} is {} (poll {}/{}), next poll in {}ms",
                current.jobId(), current.status(), attempts, config.maxAttempts(),
                Math.min(config.intervalMs(), remainingMs));
            sleeper.sleep(Math.min(config.intervalMs(), remainingMs));
        }
    }

    public PollingConfig getConfig() {
        return config;
    }

    private RegistryJob settle(RegistryJob job, int attempts, Duration elapsed) {
        if (job.status() == JobStatus.COMPLETED) {
            log.info("Job {} completed after {} poll(s) in {}ms ({} attachment(s))",
                job.jobId(), attempts, elapsed.toMillis(), job.attachments().size());
            return job;
        }
        log.warn("Job {} failed at the registry: {}", job.jobId(), job.error());
        throw new RegistryException(ErrorKind.JOB_FAILED,
            "Job " + job.jobId() + " failed: " + (job.error() == null ? "no reason given" : job.error()));
    }

    private RegistryException timeout(RegistryJob job, String reason) {
        log.warn("Job {} timed out in status {}: {}", job.jobId(), job.status(), reason);
        return new RegistryException(ErrorKind.JOB_TIMEOUT, "Job " + job.jobId() + " " + reason);
    }
}
