package com.ryuqq.registry.core.statemachine;

import com.ryuqq.registry.core.model.JobStatus;

/**
 * RegistryJob 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → PENDING | PROCESSING | COMPLETED | FAILED</li>
 *   <li>PROCESSING → PENDING | PROCESSING | COMPLETED | FAILED</li>
 * </ul>
 *
 * <p>PENDING과 PROCESSING은 하나의 "진행 중" 상태로 취급합니다. 레지스트리는 두 상태를
 * 오갈 수 있고 중간 상태를 건너뛸 수도 있습니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(COMPLETED, FAILED)에서는 어떤 상태로도 전이 불가</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class JobStatusTransition {

    private JobStatusTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(JobStatus from, JobStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static JobStatus transition(JobStatus current, JobStatus next) {
        validate(current, next);
        return next;
    }
}
