package com.ryuqq.registry.testkit.contract;

import com.ryuqq.registry.adapter.runner.BatchConfig;
import com.ryuqq.registry.adapter.runner.BatchOrchestrator;
import com.ryuqq.registry.adapter.runner.BatchRunException;
import com.ryuqq.registry.core.error.CircuitOpenException;
import com.ryuqq.registry.core.error.ErrorKind;
import com.ryuqq.registry.core.error.RegistryException;
import com.ryuqq.registry.core.model.BatchSummary;
import com.ryuqq.registry.core.model.EntityError;
import com.ryuqq.registry.core.model.MonitoredEntity;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for the daily check run.
 *
 * <p>Validates that a run always accounts for every entity, isolates per-entity failures
 * and shapes its load the way it is configured to.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Batch completeness with a mix of successes, registry errors and thrown exceptions</li>
 *   <li>120 entities / batch size 50 / concurrency 5: three batches, two inter-batch delays</li>
 *   <li>Worker concurrency never exceeds the configured cap</li>
 *   <li>Empty population and population failure</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class BatchRunContractTest extends AbstractContractTest {

    @Test
    void testScenario_120Entities_ThreeBatches_TwoInterBatchDelays() {
        // Given
        registerEntities(120);
        BatchOrchestrator orchestrator = newBatchOrchestrator(new BatchConfig());

        // When
        BatchSummary summary = orchestrator.runDailyCheck();

        // Then
        assertSummaryConsistent(summary, 120);
        assertEquals(120, summary.successful());
        assertEquals(0, summary.failed());
        assertEquals(2, sleeper.count(), "Only gaps between batches are awaited");
        assertEquals(2, sleeper.countOf(2000));
        assertEquals(120, gateway.totalFetches(), "Every entity is checked exactly once");
        assertEquals(List.of(summary), notifications.summaries());
    }

    @Test
    void testCompleteness_MixedOutcomes_EveryEntityAccounted() {
        // Given
        List<MonitoredEntity> entities = registerEntities(30);
        Set<String> failingKeys = new HashSet<>();
        for (int i = 0; i < entities.size(); i++) {
            MonitoredEntity entity = entities.get(i);
            if (i % 7 == 0) {
                gateway.failUpdates(entity.trackingId(), new CircuitOpenException("tracking-service"), Integer.MAX_VALUE);
                failingKeys.add(entity.externalKey());
            } else if (i % 5 == 0) {
                gateway.failUpdates(entity.trackingId(), new NullPointerException(), Integer.MAX_VALUE);
                failingKeys.add(entity.externalKey());
            } else if (i % 3 == 0) {
                gateway.givenUpdates(entity.trackingId(), List.of(item("Conclusos para despacho")));
            }
        }
        BatchOrchestrator orchestrator = newBatchOrchestrator(
            new BatchConfig().withBatchSize(8).withConcurrency(3).withEntityRetryDelayMs(10));

        // When
        BatchSummary summary = orchestrator.runDailyCheck();

        // Then
        assertSummaryConsistent(summary, 30);
        assertEquals(failingKeys.size(), summary.failed());
        Set<String> reported = summary.errors().stream().map(EntityError::entityKey).collect(Collectors.toSet());
        assertEquals(failingKeys, reported, "Error list contains exactly the failed entities");
        assertTrue(summary.errors().stream()
            .anyMatch(e -> e.message().startsWith(ErrorKind.CIRCUIT_OPEN.name())));
        assertTrue(summary.errors().stream()
            .anyMatch(e -> e.message().equals("NullPointerException")));
    }

    @Test
    void testEntityRetry_TransientFailure_RecoversWithinRetryBudget() {
        // Given
        MonitoredEntity entity = registerEntities(1).get(0);
        gateway.failUpdates(entity.trackingId(), new RegistryException(ErrorKind.SERVER, "HTTP 500"), 2);
        BatchOrchestrator orchestrator = newBatchOrchestrator(new BatchConfig());

        // When
        BatchSummary summary = orchestrator.runDailyCheck();

        // Then
        assertEquals(1, summary.successful());
        assertEquals(3, gateway.fetchCount(entity.trackingId()), "1 attempt + 2 entity retries");
        assertEquals(List.of(3000L, 3000L), sleeper.sleeps());
    }

    @Test
    void testConcurrency_NeverExceedsConfiguredCap() {
        // Given
        registerEntities(24);
        gateway.withFetchLatency(Duration.ofMillis(20));
        BatchOrchestrator orchestrator = newBatchOrchestrator(
            new BatchConfig().withBatchSize(12).withConcurrency(4).withInterBatchDelayMs(0));

        // When
        BatchSummary summary = orchestrator.runDailyCheck();

        // Then
        assertEquals(24, summary.successful());
        assertTrue(gateway.maxConcurrentFetches() <= 4,
            "Max concurrent fetches was " + gateway.maxConcurrentFetches());
    }

    @Test
    void testLookback_SinceIsNowMinusLookbackWindow() {
        // Given
        MonitoredEntity entity = registerEntities(1).get(0);
        BatchOrchestrator orchestrator = newBatchOrchestrator(new BatchConfig().withLookback(Duration.ofHours(6)));

        // When
        orchestrator.runDailyCheck();

        // Then
        assertEquals(MutableClock.DEFAULT_START.minus(Duration.ofHours(6)), gateway.lastSince(entity.trackingId()));
    }

    @Test
    void testEmptyPopulation_ReturnsZeroedSummary() {
        // Given
        BatchOrchestrator orchestrator = newBatchOrchestrator(new BatchConfig());

        // When
        BatchSummary summary = orchestrator.runDailyCheck();

        // Then
        assertSummaryConsistent(summary, 0);
        assertEquals(0, gateway.totalFetches());
        assertEquals(1, notifications.summaries().size());
        assertTrue(notifications.failures().isEmpty());
    }

    @Test
    void testPopulationFailure_PublishesFailureNotSummary() {
        // Given
        registerEntities(3);
        population.failWith(new IllegalStateException("database unreachable"));
        BatchOrchestrator orchestrator = newBatchOrchestrator(new BatchConfig());

        // When
        BatchRunException failure = assertThrows(BatchRunException.class, orchestrator::runDailyCheck);

        // Then
        assertEquals(0, failure.summary().total());
        assertTrue(notifications.summaries().isEmpty());
        assertEquals(1, notifications.failures().size());
        assertEquals(0, gateway.totalFetches());
        assertFalse(orchestrator.isRunning());
    }
}
