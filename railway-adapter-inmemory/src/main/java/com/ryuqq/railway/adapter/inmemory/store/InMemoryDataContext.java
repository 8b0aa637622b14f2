package com.ryuqq.railway.adapter.inmemory.store;

import com.ryuqq.railway.core.model.DeadLetter;
import com.ryuqq.railway.core.model.LogEntry;
import com.ryuqq.railway.core.model.Manifest;
import com.ryuqq.railway.core.model.Metadata;
import com.ryuqq.railway.core.model.WorkQueueEntry;
import com.ryuqq.railway.core.spi.DataContext;
import com.ryuqq.railway.core.spi.DataContextTransaction;
import com.ryuqq.railway.core.spi.Table;

import java.util.ArrayList;
import java.util.List;

/**
 * In-memory implementation of {@link DataContext} for testing and reference purposes.
 *
 * <p>Not thread-safe: one context belongs to one caller, like a database session. Concurrency is handled
 * by the shared {@link InMemoryDatabase}.</p>
 *
 * <p><strong>Write path:</strong></p>
 * <ol>
 *   <li>{@code add/update/remove} stage changes in the table's unsaved layer</li>
 *   <li>{@link #saveChanges()} moves them to the flushed layer, and commits right away when no transaction is open</li>
 *   <li>{@link InMemoryTransaction#commit()} applies every flushed change of every table in one atomic step</li>
 * </ol>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InMemoryDataContext implements DataContext {

    private final InMemoryDatabase database;
    private final InMemoryTable<Metadata> metadata;
    private final InMemoryTable<Manifest> manifests;
    private final InMemoryTable<WorkQueueEntry> workQueue;
    private final InMemoryTable<DeadLetter> deadLetters;
    private final InMemoryTable<LogEntry> logs;
    private final List<InMemoryTable<?>> tables;

    private InMemoryTransaction transaction;
    private boolean closed;

    public InMemoryDataContext(InMemoryDatabase database) {
        if (database == null) {
            throw new IllegalArgumentException("database cannot be null");
        }
        this.database = database;
        this.metadata = new InMemoryTable<>(Metadata.class, database);
        this.manifests = new InMemoryTable<>(Manifest.class, database);
        this.workQueue = new InMemoryTable<>(WorkQueueEntry.class, database);
        this.deadLetters = new InMemoryTable<>(DeadLetter.class, database);
        this.logs = new InMemoryTable<>(LogEntry.class, database);
        this.tables = List.of(metadata, manifests, workQueue, deadLetters, logs);
    }

    @Override
    public Table<Metadata> metadata() {
        return metadata;
    }

    @Override
    public Table<Manifest> manifests() {
        return manifests;
    }

    @Override
    public Table<WorkQueueEntry> workQueue() {
        return workQueue;
    }

    @Override
    public Table<DeadLetter> deadLetters() {
        return deadLetters;
    }

    @Override
    public Table<LogEntry> logs() {
        return logs;
    }

    @Override
    public DataContextTransaction beginTransaction() {
        ensureOpen();
        if (transaction != null) {
            throw new IllegalStateException("A transaction is already open on this context");
        }
        transaction = new InMemoryTransaction(this);
        return transaction;
    }

    @Override
    public int saveChanges() {
        ensureOpen();
        int count = 0;
        for (InMemoryTable<?> table : tables) {
            count += table.flush();
        }
        if (transaction == null) {
            commitFlushed();
        }
        return count;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        if (transaction != null) {
            transaction.rollback();
        }
        tables.forEach(InMemoryTable::discardUnsaved);
        tables.forEach(InMemoryTable::discardFlushed);
        closed = true;
    }

    void commitFlushed() {
        List<RowChange> changes = new ArrayList<>();
        for (InMemoryTable<?> table : tables) {
            changes.addAll(table.drainFlushed());
        }
        database.apply(changes);
    }

    void rollbackFlushed() {
        tables.forEach(InMemoryTable::discardFlushed);
        tables.forEach(InMemoryTable::discardUnsaved);
    }

    void endTransaction(InMemoryTransaction finished) {
        if (transaction == finished) {
            transaction = null;
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("DataContext is closed");
        }
    }
}
