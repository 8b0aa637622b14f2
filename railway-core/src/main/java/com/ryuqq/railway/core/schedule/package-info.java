/**
 * Schedule definitions used when upserting manifests.
 *
 * <p>{@link com.ryuqq.railway.core.schedule.Schedule} is built with {@link com.ryuqq.railway.core.schedule.Every}
 * (intervals), {@link com.ryuqq.railway.core.schedule.Cron} (five-field cron expressions),
 * {@code Schedule.manual()} or {@code Schedule.dependent()}.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.railway.core.schedule;
