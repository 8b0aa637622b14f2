/**
 * Polling runtime contract implemented by the dispatchers.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.railway.application.runtime;
