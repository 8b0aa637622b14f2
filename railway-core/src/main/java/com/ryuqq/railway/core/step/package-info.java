/**
 * Steps and the railway adapter every step runs through.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.railway.core.step.Step} - synchronous unit of work</li>
 *   <li>{@link com.ryuqq.railway.core.step.AsyncStep} - future-returning step awaited by the engine</li>
 *   <li>{@link com.ryuqq.railway.core.step.RailwayStep} - converts thrown failures into a failure track</li>
 *   <li>{@link com.ryuqq.railway.core.step.StepSignature} - declared input/output types, cached per class</li>
 *   <li>{@link com.ryuqq.railway.core.step.StepRegistry} - explicit factories with a cached single-constructor fallback</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.railway.core.step;
