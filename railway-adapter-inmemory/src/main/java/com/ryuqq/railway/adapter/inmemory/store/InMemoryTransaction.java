package com.ryuqq.railway.adapter.inmemory.store;

import com.ryuqq.railway.core.spi.DataContextTransaction;

/**
 * Transaction of an {@link InMemoryDataContext}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class InMemoryTransaction implements DataContextTransaction {

    private final InMemoryDataContext context;
    private boolean completed;

    InMemoryTransaction(InMemoryDataContext context) {
        this.context = context;
    }

    @Override
    public void commit() {
        if (completed) {
            throw new IllegalStateException("Transaction already completed");
        }
        context.commitFlushed();
        completed = true;
        context.endTransaction(this);
    }

    @Override
    public void rollback() {
        if (completed) {
            return;
        }
        context.rollbackFlushed();
        completed = true;
        context.endTransaction(this);
    }

    @Override
    public void close() {
        rollback();
    }
}
