/**
 * In-memory DataContext adapter.
 *
 * <p>Reference implementation of {@link com.ryuqq.railway.core.spi.DataContext} used by unit and contract tests.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.railway.adapter.inmemory.store.InMemoryDatabase}: committed rows shared across contexts</li>
 *   <li>{@link com.ryuqq.railway.adapter.inmemory.store.InMemoryDataContext}: per-caller unit of work</li>
 *   <li>{@link com.ryuqq.railway.adapter.inmemory.store.InMemoryDataContextFactory}: context factory</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.railway.adapter.inmemory.store;
