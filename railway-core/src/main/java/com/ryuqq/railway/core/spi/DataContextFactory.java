package com.ryuqq.railway.core.spi;

/**
 * Creates a fresh {@link DataContext} per unit of work.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface DataContextFactory {

    DataContext create();
}
