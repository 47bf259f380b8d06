package com.ryuqq.registry.adapter.runner;

import com.ryuqq.registry.application.runtime.DailyCheck;
import com.ryuqq.registry.core.model.BatchSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 일일 점검 스케줄러.
 *
 * <p>매일 지정된 시각(기본 02:00)에 {@link DailyCheck#runDailyCheck()}를 실행합니다.
 * 다음 실행은 매 실행 후 다시 계산하므로 일광 절약 시간 변경에도 시각이 유지됩니다.</p>
 *
 * <p><strong>Skip-if-busy:</strong></p>
 * <ul>
 *   <li>이전 실행이 아직 진행 중이면 이번 실행은 건너뜀</li>
 *   <li>실행 실패는 로그만 남기고 다음 일정은 유지 (알림은 DailyCheck가 발행)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DailyCheckScheduler {

    private static final Logger log = LoggerFactory.getLogger(DailyCheckScheduler.class);

    public static final LocalTime DEFAULT_RUN_AT = LocalTime.of(2, 0);

    private final DailyCheck dailyCheck;
    private final LocalTime runAt;
    private final ZoneId zone;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private volatile boolean started;

    public DailyCheckScheduler(DailyCheck dailyCheck) {
        this(dailyCheck, DEFAULT_RUN_AT, ZoneId.systemDefault(), Clock.systemDefaultZone());
    }

    /**
     * 생성자.
     *
     * @param dailyCheck 실행 대상
     * @param runAt 매일 실행 시각
     * @param zone runAt 기준 시간대
     * @param clock 다음 실행 시각 계산용 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DailyCheckScheduler(DailyCheck dailyCheck, LocalTime runAt, ZoneId zone, Clock clock) {
        if (dailyCheck == null) {
            throw new IllegalArgumentException("dailyCheck cannot be null");
        }
        if (runAt == null) {
            throw new IllegalArgumentException("runAt cannot be null");
        }
        if (zone == null) {
            throw new IllegalArgumentException("zone cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.dailyCheck = dailyCheck;
        this.runAt = runAt;
        this.zone = zone;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "registry-daily-check");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * 첫 실행을 예약합니다. 두 번째 호출은 무시됩니다.
     */
    public synchronized void start() {
        if (started) {
            return;
        }
        started = true;
        scheduleNext();
    }

    /**
     * 예약된 실행을 취소하고 진행 중인 실행이 끝날 때까지 기다립니다.
     *
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public void stop() throws InterruptedException {
        scheduler.shutdown();
        if (!scheduler.awaitTermination(60, TimeUnit.SECONDS)) {
            dailyCheck.cancel();
            scheduler.shutdownNow();
        }
    }

    /**
     * 한 번 실행합니다.
     *
     * @return 실행 결과, 이전 실행이 진행 중이거나 실행이 실패하면 empty
     */
    public Optional<BatchSummary> trigger() {
        if (dailyCheck.isRunning()) {
            log.warn("Previous daily check still running, skipping this run");
            return Optional.empty();
        }
        try {
            return Optional.of(dailyCheck.runDailyCheck());
        } catch (IllegalStateException e) {
            log.warn("Daily check started elsewhere, skipping this run: {}", e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.error("Scheduled daily check failed: {}", e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * now 이후 첫 runAt 까지의 시간.
     */
    Duration delayUntilNextRun() {
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone));
        ZonedDateTime next = now.with(runAt);
        if (!next.isAfter(now)) {
            next = next.plusDays(1).with(runAt);
        }
        return Duration.between(now, next);
    }

    private void scheduleNext() {
        Duration delay = delayUntilNextRun();
        log.info("Next daily check in {} (at {} {})", delay, runAt, zone);
        scheduler.schedule(this::runAndReschedule, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void runAndReschedule() {
        try {
            trigger();
        } finally {
            if (!scheduler.isShutdown()) {
                scheduleNext();
            }
        }
    }
}
