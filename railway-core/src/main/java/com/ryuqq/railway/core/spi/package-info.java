/**
 * Service Provider Interfaces implemented by adapters.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.railway.core.spi.DataContext} - unit of work with typed tables and transactions</li>
 *   <li>{@link com.ryuqq.railway.core.spi.Table} - staged CRUD plus atomic conditional update for claiming</li>
 *   <li>{@link com.ryuqq.railway.core.spi.BackgroundTaskServer} - runs pending executions</li>
 *   <li>{@link com.ryuqq.railway.core.spi.CronEvaluator} - next fire time of a cron expression</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.railway.core.spi;
