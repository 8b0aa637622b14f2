package com.ryuqq.railway.adapter.inmemory.store;

import com.ryuqq.railway.core.model.Entity;
import com.ryuqq.railway.core.spi.Table;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Table view of one {@link InMemoryDataContext}.
 *
 * <p>Reads layer three sources, latest first: unsaved changes, changes flushed into the open transaction,
 * committed rows. Every row handed in or out is a copy, so callers never share instances with the store.</p>
 *
 * @param <T> row type
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class InMemoryTable<T extends Entity<T>> implements Table<T> {

    private final Class<T> type;
    private final InMemoryDatabase database;
    private final ChangeSet<T> unsaved = new ChangeSet<>();
    private final ChangeSet<T> flushed = new ChangeSet<>();

    InMemoryTable(Class<T> type, InMemoryDatabase database) {
        this.type = type;
        this.database = database;
    }

    @Override
    public T add(T entity) {
        if (entity == null) {
            throw new IllegalArgumentException("entity cannot be null");
        }
        if (entity.getId() != null) {
            throw new IllegalArgumentException(type.getSimpleName() + " already has id " + entity.getId());
        }
        long id = database.nextId(type);
        entity.setId(id);
        unsaved.put(id, entity.copy());
        return entity;
    }

    @Override
    public void update(T entity) {
        if (entity == null || entity.getId() == null) {
            throw new IllegalArgumentException("entity and its id cannot be null");
        }
        if (findById(entity.getId()).isEmpty()) {
            throw new IllegalStateException("No " + type.getSimpleName() + " row with id " + entity.getId());
        }
        unsaved.put(entity.getId(), entity.copy());
    }

    @Override
    public void remove(long id) {
        unsaved.delete(id);
    }

    @Override
    public Optional<T> findById(long id) {
        for (ChangeSet<T> layer : List.of(unsaved, flushed)) {
            if (layer.isDeleted(id)) {
                return Optional.empty();
            }
            T row = layer.written(id);
            if (row != null) {
                return Optional.of(row.copy());
            }
        }
        return database.find(type, id);
    }

    @Override
    public List<T> findAll(Predicate<? super T> filter) {
        TreeMap<Long, T> view = new TreeMap<>();
        for (T row : database.findAll(type)) {
            view.put(row.getId(), row);
        }
        flushed.overlay(view);
        unsaved.overlay(view);
        List<T> result = new ArrayList<>();
        for (T row : view.values()) {
            T copy = row.copy();
            if (filter.test(copy)) {
                result.add(copy);
            }
        }
        return result;
    }

    @Override
    public boolean updateIf(long id, Predicate<? super T> condition, Consumer<? super T> mutation) {
        return database.compareAndUpdate(type, id, condition, mutation);
    }

    int flush() {
        int count = unsaved.size();
        unsaved.mergeInto(flushed);
        unsaved.clear();
        return count;
    }

    List<RowChange> drainFlushed() {
        List<RowChange> changes = flushed.toRowChanges(type);
        flushed.clear();
        return changes;
    }

    void discardFlushed() {
        flushed.clear();
    }

    void discardUnsaved() {
        unsaved.clear();
    }
}
