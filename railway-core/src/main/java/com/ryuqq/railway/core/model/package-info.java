/**
 * Persisted records: workflow executions, job definitions, queue entries, dead letters and logs.
 *
 * <h2>Tables</h2>
 * <ul>
 *   <li>{@link com.ryuqq.railway.core.model.Metadata} - one row per workflow execution</li>
 *   <li>{@link com.ryuqq.railway.core.model.Manifest} - one row per schedulable job definition, upserted by external id</li>
 *   <li>{@link com.ryuqq.railway.core.model.WorkQueueEntry} - transient bridge between "due" and "running"</li>
 *   <li>{@link com.ryuqq.railway.core.model.DeadLetter} - jobs that exhausted their retry budget</li>
 *   <li>{@link com.ryuqq.railway.core.model.LogEntry} - log rows linked to an execution</li>
 * </ul>
 *
 * <p>Links between rows (parent execution, owning manifest, parent manifest) are plain numeric foreign keys.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.railway.core.model;
