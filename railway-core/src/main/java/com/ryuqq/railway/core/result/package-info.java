/**
 * Two-track result type used by every step and workflow.
 *
 * <p>{@link com.ryuqq.railway.core.result.Result} is a sealed interface with exactly two variants:
 * {@link com.ryuqq.railway.core.result.Success} and {@link com.ryuqq.railway.core.result.Failure}.
 * The execution engine inspects the tag with {@code instanceof} and never raises across a step boundary.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.railway.core.result;
