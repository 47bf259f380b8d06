package com.ryuqq.registry.core.statemachine;

import com.ryuqq.registry.core.model.JobStatus;
import org.junit.jupiter.api.Test;

import static com.ryuqq.registry.core.model.JobStatus.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * JobStatusTransition 테스트.
 *
 * <ul>
 *   <li>PENDING → PROCESSING → COMPLETED / FAILED 정상 전이</li>
 *   <li>PENDING → COMPLETED 직접 전이 허용</li>
 *   <li>PROCESSING → PENDING 허용 (둘 다 진행 중)</li>
 *   <li>종료 상태에서의 전이 시 IllegalStateException</li>
 * </ul>
 */
class JobStatusTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void validate_PendingToProcessing_Succeeds() {
        assertDoesNotThrow(() -> JobStatusTransition.validate(PENDING, PROCESSING));
    }

    @Test
    void validate_PendingToCompleted_Succeeds() {
        assertDoesNotThrow(() -> JobStatusTransition.validate(PENDING, COMPLETED));
    }

    @Test
    void validate_ProcessingToProcessing_Succeeds() {
        assertDoesNotThrow(() -> JobStatusTransition.validate(PROCESSING, PROCESSING));
    }

    @Test
    void transition_NormalFlowToFailed_Succeeds() {
        // Given
        JobStatus status = PENDING;

        // When
        status = JobStatusTransition.transition(status, PROCESSING);
        status = JobStatusTransition.transition(status, FAILED);

        // Then
        assertEquals(FAILED, status);
        assertTrue(status.isTerminal());
    }

    // ========== 금지된 전이 테스트 ==========

    @Test
    void validate_CompletedToProcessing_ThrowsException() {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> JobStatusTransition.validate(COMPLETED, PROCESSING)
        );
        assertTrue(exception.getMessage().contains("terminal state"));
    }

    @Test
    void validate_FailedToCompleted_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> JobStatusTransition.validate(FAILED, COMPLETED));
    }

    @Test
    void validate_ProcessingToPending_IsAllowed() {
        assertDoesNotThrow(() -> JobStatusTransition.validate(PROCESSING, PENDING));
        assertEquals(PENDING, JobStatusTransition.transition(PROCESSING, PENDING));
    }

    @Test
    void validate_CompletedToPending_ThrowsException() {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> JobStatusTransition.validate(COMPLETED, PENDING)
        );
        assertTrue(exception.getMessage().contains("terminal"));
    }

    @Test
    void validate_NullState_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> JobStatusTransition.validate(null, PENDING));
    }

    // ========== 와이어 포맷 ==========

    @Test
    void fromWire_MapsKnownAndUnknownValues() {
        assertEquals(PENDING, JobStatus.fromWire("pending"));
        assertEquals(PROCESSING, JobStatus.fromWire("processing"));
        assertEquals(COMPLETED, JobStatus.fromWire("COMPLETED"));
        assertEquals(FAILED, JobStatus.fromWire(" failed "));
        assertEquals(PROCESSING, JobStatus.fromWire("queued"));
        assertEquals(PROCESSING, JobStatus.fromWire(null));
    }
}
