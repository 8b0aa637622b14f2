package com.ryuqq.railway.adapter.inmemory.store;

import com.ryuqq.railway.core.spi.DataContext;
import com.ryuqq.railway.core.spi.DataContextFactory;

/**
 * Creates contexts over one shared {@link InMemoryDatabase}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InMemoryDataContextFactory implements DataContextFactory {

    private final InMemoryDatabase database;

    public InMemoryDataContextFactory() {
        this(new InMemoryDatabase());
    }

    public InMemoryDataContextFactory(InMemoryDatabase database) {
        if (database == null) {
            throw new IllegalArgumentException("database cannot be null");
        }
        this.database = database;
    }

    @Override
    public DataContext create() {
        return new InMemoryDataContext(database);
    }

    public InMemoryDatabase database() {
        return database;
    }
}
