/**
 * Reflection helpers for memory keys and generic type arguments.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.railway.core.type;
