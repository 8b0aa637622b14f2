package com.ryuqq.railway.core.spi;

/**
 * Transaction handle of a {@link DataContext}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface DataContextTransaction extends AutoCloseable {

    /**
     * Makes every change flushed inside this transaction visible atomically.
     *
     * @throws IllegalStateException if already committed or rolled back
     */
    void commit();

    /**
     * Discards every change flushed or staged inside this transaction.
     */
    void rollback();

    /**
     * Rolls back unless {@link #commit()} was called.
     */
    @Override
    void close();
}
