package com.ryuqq.registry.core.protection;

import com.ryuqq.registry.core.error.CircuitOpenException;
import com.ryuqq.registry.core.error.ErrorKind;
import com.ryuqq.registry.core.error.RegistryException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SlidingWindowCircuitBreaker 유닛 테스트.
 *
 * <ul>
 *   <li>트립 조건 (최소 표본 수, 경계 포함 에러율)</li>
 *   <li>cooldown 이후 HALF_OPEN 시험 호출 및 복구/재개방</li>
 *   <li>시험 호출이 아닌 결과는 HALF_OPEN 전이에 영향 없음</li>
 *   <li>윈도우 만료</li>
 * </ul>
 */
class SlidingWindowCircuitBreakerTest {

    private FakeClock clock;
    private SlidingWindowCircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = FakeClock.atEpoch();
        breaker = new SlidingWindowCircuitBreaker("tracking-service", new CircuitBreakerConfig(), clock);
    }

    // ============================================================
    // 1. 트립 조건
    // ============================================================

    @Test
    void 성공2_실패9_이면_OPEN() {
        // given / when
        record(2, 9);

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
    }

    @Test
    void 성공9_실패1_은_경계값_10퍼센트로_OPEN() {
        // given / when
        record(9, 1);

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
    }

    @Test
    void 성공8_실패1_은_최소표본_미달로_CLOSED_유지() {
        // given / when
        record(8, 1);

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.getStats().sampleCount()).isEqualTo(9);
    }

    @Test
    void 성공10_실패1_은_임계값_미만으로_CLOSED_유지() {
        // given / when
        record(10, 1);

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.getStats().errorRatePercent()).isLessThan(10.0);
    }

    @Test
    void 윈도우_밖의_실패는_에러율에서_제외됨() {
        // given: 실패 5건 후 윈도우(5분) 경과
        record(0, 5);
        clock.advance(Duration.ofMinutes(6));

        // when: 새 성공 10건
        record(10, 0);

        // then
        CircuitBreakerStats stats = breaker.getStats();
        assertThat(stats.sampleCount()).isEqualTo(10);
        assertThat(stats.failureCount()).isZero();
        assertThat(stats.state()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    // ============================================================
    // 2. OPEN 상태에서 fast-fail
    // ============================================================

    @Test
    void OPEN_상태면_operation_호출_없이_CircuitOpenException() {
        // given
        record(0, 10);
        AtomicInteger invocations = new AtomicInteger();

        // when / then
        assertThatThrownBy(() -> breaker.execute(invocations::incrementAndGet))
            .isInstanceOf(CircuitOpenException.class)
            .extracting(e -> ((RegistryException) e).kind())
            .isEqualTo(ErrorKind.CIRCUIT_OPEN);
        assertThat(invocations.get()).isZero();
    }

    // ============================================================
    // 3. HALF_OPEN 복구
    // ============================================================

    @Test
    void cooldown_경과_후_성공하면_CLOSED로_복귀하고_윈도우_초기화() {
        // given
        record(0, 10);
        clock.advance(Duration.ofMinutes(10));

        // when
        String result = breaker.execute(() -> "ok");

        // then
        assertThat(result).isEqualTo("ok");
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.getStats().failureCount()).isZero();
        assertThat(breaker.getStats().sampleCount()).isZero();
    }

    @Test
    void cooldown_경과_후_실패하면_OPEN으로_복귀하고_cooldown_재시작() {
        // given
        record(0, 10);
        clock.advance(Duration.ofMinutes(10));

        // when
        assertThatThrownBy(() -> breaker.execute(() -> {
            throw new RegistryException(ErrorKind.SERVER, "still down");
        })).isInstanceOf(RegistryException.class).isNotInstanceOf(CircuitOpenException.class);

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
        clock.advance(Duration.ofMinutes(9));
        assertThat(breaker.tryAcquire()).isFalse();
        clock.advance(Duration.ofMinutes(1));
        assertThat(breaker.tryAcquire()).isTrue();
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.HALF_OPEN);
    }

    @Test
    void cooldown_이전에는_차단_유지() {
        // given
        record(0, 10);

        // when
        clock.advance(Duration.ofMinutes(9).plusSeconds(59));

        // then
        assertThat(breaker.tryAcquire()).isFalse();
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
    }

    @Test
    void HALF_OPEN_에서는_시험_호출_1건만_통과() {
        // given
        record(0, 10);
        clock.advance(Duration.ofMinutes(10));

        // when
        boolean trial = breaker.tryAcquire();
        boolean second = breaker.tryAcquire();

        // then
        assertThat(trial).isTrue();
        assertThat(second).isFalse();
    }

    @Test
    void HALF_OPEN_중_끝난_이전_호출의_성공은_회로를_닫지_않는다() throws Exception {
        // given: 시험 호출은 현재 스레드가 획득
        record(0, 10);
        clock.advance(Duration.ofMinutes(10));
        assertThat(breaker.tryAcquire()).isTrue();
        ExecutorService other = Executors.newSingleThreadExecutor();

        try {
            // when: CLOSED일 때 허용된 다른 스레드의 호출이 지금 끝남
            other.submit(breaker::recordSuccess).get(5, TimeUnit.SECONDS);

            // then
            assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.HALF_OPEN);
            assertThat(breaker.tryAcquire()).isFalse();

            // when: 시험 호출이 성공
            breaker.recordSuccess();

            // then
            assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        } finally {
            other.shutdownNow();
        }
    }

    @Test
    void HALF_OPEN_중_끝난_이전_호출의_실패는_회로를_다시_열지_않는다() throws Exception {
        // given
        record(0, 10);
        clock.advance(Duration.ofMinutes(10));
        assertThat(breaker.tryAcquire()).isTrue();
        ExecutorService other = Executors.newSingleThreadExecutor();

        try {
            // when
            other.submit(() -> breaker.recordFailure(new RegistryException(ErrorKind.TIMEOUT, "late")))
                .get(5, TimeUnit.SECONDS);

            // then
            assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.HALF_OPEN);
            breaker.recordFailure(new RegistryException(ErrorKind.SERVER, "still down"));
            assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
        } finally {
            other.shutdownNow();
        }
    }

    @Test
    void reset_은_CLOSED로_강제_전이() {
        // given
        record(0, 10);

        // when
        breaker.reset();

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.tryAcquire()).isTrue();
    }

    // ============================================================
    // 4. 동시성
    // ============================================================

    @Test
    void 동시_기록에서도_표본_수가_정확함() throws Exception {
        // given
        SlidingWindowCircuitBreaker lenient = new SlidingWindowCircuitBreaker("requests-service",
            new CircuitBreakerConfig().withFailureRateThresholdPercent(100.0), clock);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(400);

        // when
        for (int i = 0; i < 400; i++) {
            pool.submit(() -> {
                lenient.recordSuccess();
                done.countDown();
            });
        }

        // then
        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        pool.shutdown();
        assertThat(lenient.getStats().sampleCount()).isEqualTo(400);
    }

    private void record(int successes, int failures) {
        for (int i = 0; i < successes; i++) {
            breaker.recordSuccess();
        }
        for (int i = 0; i < failures; i++) {
            breaker.recordFailure(new RegistryException(ErrorKind.SERVER, "boom"));
        }
    }
}
