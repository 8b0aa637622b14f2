/**
 * Type-keyed scratch memory threaded between chained steps.
 *
 * <p>{@link com.ryuqq.railway.core.memory.TypedMemory} maps a {@link java.lang.reflect.Type} to exactly one value.
 * It is seeded with {@link com.ryuqq.railway.core.memory.Unit} so zero-argument steps resolve, and values are
 * also stored under every interface their class declares so interface-typed steps can find them.</p>
 *
 * <h2>Lookup order used by workflows</h2>
 * <ol>
 *   <li>Direct key (or raw class of a parameterized type)</li>
 *   <li>Tuple re-assembly from element types</li>
 *   <li>{@link com.ryuqq.railway.core.memory.ServiceProvider} and registered services</li>
 *   <li>{@code org.slf4j.Logger} built for the workflow class</li>
 * </ol>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.railway.core.memory;
