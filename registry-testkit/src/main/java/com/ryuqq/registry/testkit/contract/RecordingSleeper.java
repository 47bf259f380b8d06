package com.ryuqq.registry.testkit.contract;

import com.ryuqq.registry.core.spi.Sleeper;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link Sleeper} that records requested pauses instead of blocking.
 *
 * <p>When bound to a {@link MutableClock}, every pause advances the clock by the same
 * amount, so loops that wait for time to pass (token refill, polling deadline) still
 * terminate. Non-positive pauses are ignored, matching {@link Sleeper#system()}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RecordingSleeper implements Sleeper {

    private final MutableClock clock;
    private final CopyOnWriteArrayList<Long> sleeps = new CopyOnWriteArrayList<>();

    /**
     * Recorder that does not move time.
     */
    public RecordingSleeper() {
        this(null);
    }

    /**
     * Recorder that advances {@code clock} on every pause.
     *
     * @param clock clock to advance, may be {@code null}
     */
    public RecordingSleeper(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        sleeps.add(millis);
        if (clock != null) {
            clock.advanceMillis(millis);
        }
    }

    /**
     * @return recorded pauses in call order
     */
    public List<Long> sleeps() {
        return List.copyOf(sleeps);
    }

    public int count() {
        return sleeps.size();
    }

    public long totalMillis() {
        return sleeps.stream().mapToLong(Long::longValue).sum();
    }

    /**
     * Number of recorded pauses of exactly {@code millis}.
     */
    public long countOf(long millis) {
        return sleeps.stream().filter(s -> s == millis).count();
    }

    public void clear() {
        sleeps.clear();
    }
}
