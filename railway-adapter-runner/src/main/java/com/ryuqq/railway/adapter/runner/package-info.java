/**
 * Runner Adapter Layer - 스케줄링 및 실행 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.railway.adapter.runner.ManifestDispatcher} - due Manifest를 WorkQueue에 적재</li>
 *   <li>{@link com.ryuqq.railway.adapter.runner.WorkQueueDispatcher} - WorkQueue 항목을 Metadata로 만들어 task server에 제출</li>
 *   <li>{@link com.ryuqq.railway.adapter.runner.ManifestExecutor} - PENDING Metadata 실행</li>
 *   <li>{@link com.ryuqq.railway.adapter.runner.ExecutionFailureHandler} - 재시도 / DeadLetter 분기</li>
 *   <li>{@link com.ryuqq.railway.adapter.runner.StuckJobReaper} - 제한 시간 초과 실행 정리</li>
 *   <li>{@link com.ryuqq.railway.adapter.runner.MetadataCleaner} - 오래된 실행 기록 삭제</li>
 *   <li>{@link com.ryuqq.railway.adapter.runner.ExecutorTaskServer} - 스레드 풀 task server</li>
 * </ul>
 *
 * <h2>처리 흐름</h2>
 * <pre>
 * ManifestDispatcher.pump()   Manifest → WorkQueueEntry (QUEUED)
 *   ↓
 * WorkQueueDispatcher.pump()  WorkQueueEntry → Metadata (PENDING) → enqueue
 *   ↓
 * ManifestExecutor.execute()  Metadata → Workflow 실행 → COMPLETED / FAILED
 *   ↓ (FAILED)
 * ExecutionFailureHandler     retryCount &lt; maxRetries ? WorkQueueEntry(backoff) : DeadLetter
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.railway.adapter.runner;
