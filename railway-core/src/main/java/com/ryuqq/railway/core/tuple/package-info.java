/**
 * Fixed-arity value tuples (2 to 7 elements).
 *
 * <p>Tuples let a step take or return several values at once. Typed memory never stores a tuple
 * under its own type; writes are decomposed into one entry per element and reads are re-assembled
 * from the element types of the requested {@link java.lang.reflect.ParameterizedType}.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.railway.core.tuple;
