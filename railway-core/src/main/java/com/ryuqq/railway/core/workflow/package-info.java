/**
 * Workflow execution engine.
 *
 * <p>{@link com.ryuqq.railway.core.workflow.Workflow} owns one typed memory, a terminal-failure slot and a
 * short-circuit slot per execution. Subclasses wire steps with {@code activate}, {@code chain},
 * {@code iChain}, {@code shortCircuit}, {@code extract} and finish with {@code resolve}.</p>
 *
 * <h2>Propagation styles</h2>
 * <ul>
 *   <li>{@code run} returns the value or throws the captured exception</li>
 *   <li>{@code runEither} returns a {@link com.ryuqq.railway.core.result.Result}; only cancellation is thrown</li>
 * </ul>
 *
 * <p>Cancellation is checked before every step through
 * {@link com.ryuqq.railway.core.workflow.CancellationToken} and surfaces as
 * {@link java.util.concurrent.CancellationException}.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.railway.core.workflow;
