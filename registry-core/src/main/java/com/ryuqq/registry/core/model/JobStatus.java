package com.ryuqq.registry.core.model;

import java.util.Locale;

/**
 * 레지스트리 비동기 작업(RegistryJob)의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING ◄──► PROCESSING ──► COMPLETED
 *    │              │
 *    │              └──────► FAILED
 *    ├───────────────────────► COMPLETED
 *    └───────────────────────► FAILED
 *
 * 금지된 전이:
 * - COMPLETED → *
 * - FAILED → *
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum JobStatus {

    /**
     * 제출됨 (레지스트리 큐 대기).
     */
    PENDING,

    /**
     * 레지스트리에서 처리 중.
     */
    PROCESSING,

    /**
     * 완료 (결과 조회 가능).
     */
    COMPLETED,

    /**
     * 작업 자체가 실패함.
     */
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * 와이어 포맷 문자열을 상태로 변환.
     *
     * <p>알 수 없는 값은 PROCESSING으로 취급합니다 (폴링 계속).</p>
     *
     * @param value 응답의 status 필드 (예: "completed")
     * @return 대응되는 JobStatus
     */
    public static JobStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            return PROCESSING;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "pending":
                return PENDING;
            case "completed":
                return COMPLETED;
            case "failed":
                return FAILED;
            default:
                return PROCESSING;
        }
    }
}
