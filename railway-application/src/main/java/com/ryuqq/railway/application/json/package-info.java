/**
 * JSON serialization shared by the effect providers and the scheduler.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.railway.application.json;
