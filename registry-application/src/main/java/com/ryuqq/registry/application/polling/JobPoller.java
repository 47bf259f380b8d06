package com.ryuqq.registry.application.polling;

import com.ryuqq.registry.core.error.RegistryException;
import com.ryuqq.registry.core.model.RegistryJob;

/**
 * 비동기 "제출 후 폴링" 프로토콜을 시간 제한이 있는 동기 호출로 변환.
 *
 * <p><strong>상태 머신:</strong></p>
 * <pre>
 * PENDING / PROCESSING
 *   │ (poll)
 *   ├─► COMPLETED → 즉시 반환
 *   ├─► FAILED → JOB_FAILED 즉시 전파 (재시도 없음)
 *   └─► 진행 중 → interval 대기 후 재폴링
 *                  (maxAttempts 또는 timeout 도달 시 JOB_TIMEOUT)
 * </pre>
 *
 * <p>이 루프는 작업이 아직 진행 중이기 때문에 다시 조회합니다. 개별 poll 호출의 실패는
 * 게이트웨이의 HTTP 재시도가 처리합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface JobPoller {

    /**
     * 작업이 종료될 때까지 폴링.
     *
     * @param job 제출된 작업
     * @return COMPLETED 상태의 작업
     * @throws RegistryException JOB_FAILED, JOB_TIMEOUT 또는 poll 호출 자체의 최종 실패
     */
    RegistryJob awaitCompletion(RegistryJob job);
}
