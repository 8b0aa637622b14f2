package com.ryuqq.railway.core.model;

/**
 * WorkQueue 항목 상태.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum WorkQueueStatus {
    QUEUED,
    DISPATCHED
}
