package com.ryuqq.railway.adapter.inmemory.store;

import com.ryuqq.railway.core.model.Entity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Committed rows shared by every {@link InMemoryDataContext} created from the same factory.
 *
 * <p>Each table is a {@link ConcurrentSkipListMap} keyed by id, so scans come back in id order.
 * Ids are drawn from a per-table {@link AtomicLong} when a row is staged, so rolled-back inserts leave gaps
 * the way database sequences do.</p>
 *
 * <p><strong>Atomicity:</strong></p>
 * <ul>
 *   <li>{@link #apply(Collection)} writes a multi-table change set under one lock</li>
 *   <li>{@link #compareAndUpdate} evaluates the condition and writes under the same lock</li>
 *   <li>Reads take the lock too, so a reader never sees half of a commit</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>No isolation levels beyond read-committed</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InMemoryDatabase {

    private final Map<Class<?>, ConcurrentSkipListMap<Long, Entity<?>>> tables = new ConcurrentHashMap<>();
    private final Map<Class<?>, AtomicLong> sequences = new ConcurrentHashMap<>();
    private final Object lock = new Object();

    long nextId(Class<?> type) {
        return sequences.computeIfAbsent(type, key -> new AtomicLong()).incrementAndGet();
    }

    <T extends Entity<T>> Optional<T> find(Class<T> type, long id) {
        synchronized (lock) {
            Entity<?> row = table(type).get(id);
            return row == null ? Optional.empty() : Optional.of(type.cast(row).copy());
        }
    }

    <T extends Entity<T>> List<T> findAll(Class<T> type) {
        synchronized (lock) {
            List<T> rows = new ArrayList<>();
            for (Entity<?> row : table(type).values()) {
                rows.add(type.cast(row).copy());
            }
            return rows;
        }
    }

    /**
     * Applies a committed change set atomically.
     *
     * @param changes puts and deletes, in order
     */
    void apply(Collection<RowChange> changes) {
        synchronized (lock) {
            for (RowChange change : changes) {
                ConcurrentSkipListMap<Long, Entity<?>> table = table(change.type());
                if (change.row() == null) {
                    table.remove(change.id());
                } else {
                    table.put(change.id(), change.row());
                }
            }
        }
    }

    <T extends Entity<T>> boolean compareAndUpdate(Class<T> type, long id, Predicate<? super T> condition,
                                                   Consumer<? super T> mutation) {
        synchronized (lock) {
            ConcurrentSkipListMap<Long, Entity<?>> table = table(type);
            Entity<?> current = table.get(id);
            if (current == null) {
                return false;
            }
            T row = type.cast(current).copy();
            if (!condition.test(row)) {
                return false;
            }
            mutation.accept(row);
            row.setId(id);
            table.put(id, row);
            return true;
        }
    }

    /**
     * Number of committed rows.
     *
     * @param type row type
     * @return row count
     */
    public int count(Class<?> type) {
        synchronized (lock) {
            return table(type).size();
        }
    }

    /**
     * Removes every row and resets the id sequences. Intended for tests.
     */
    public void clear() {
        synchronized (lock) {
            tables.clear();
            sequences.clear();
        }
    }

    private ConcurrentSkipListMap<Long, Entity<?>> table(Class<?> type) {
        return tables.computeIfAbsent(type, key -> new ConcurrentSkipListMap<>());
    }
}
