/**
 * Runner adapter: polling, batch orchestration and scheduling.
 *
 * <p><strong>주요 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.registry.adapter.runner.PollingOrchestrator}: 비동기 job을 제한된 시간 안의 동기 호출로 변환</li>
 *   <li>{@link com.ryuqq.registry.adapter.runner.BatchOrchestrator}: 일일 점검 실행 (배치, 제한된 동시성, 결과 집계)</li>
 *   <li>{@link com.ryuqq.registry.adapter.runner.KeywordEscalationPolicy}: 첨부파일 수집 여부 판단</li>
 *   <li>{@link com.ryuqq.registry.adapter.runner.SearchAttachmentFetcher}: 첨부파일 수집</li>
 *   <li>{@link com.ryuqq.registry.adapter.runner.DailyCheckScheduler}: 매일 정해진 시각에 실행</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.registry.adapter.runner;
