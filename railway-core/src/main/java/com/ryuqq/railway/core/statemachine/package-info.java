/**
 * Workflow execution state machine.
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * PENDING → IN_PROGRESS (start)
 * PENDING → FAILED | CANCELLED (aborted before start)
 * IN_PROGRESS → COMPLETED | FAILED | CANCELLED
 *
 * Forbidden:
 * - any transition out of COMPLETED, FAILED or CANCELLED
 * - backward transitions (e.g., IN_PROGRESS → PENDING)
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.railway.core.statemachine;
