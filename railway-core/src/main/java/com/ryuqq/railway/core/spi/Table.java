package com.ryuqq.railway.core.spi;

import com.ryuqq.railway.core.model.Entity;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Typed table accessor of a {@link DataContext}.
 *
 * <p>{@link #add}, {@link #update} and {@link #remove} are staged in the owning context's unit of work and become
 * visible to other contexts only after {@link DataContext#saveChanges()} (and {@code commit()} when a transaction
 * is open). Reads see committed rows overlaid with this context's own staged changes.</p>
 *
 * <p>{@link #updateIf} is the exception: it is a single atomic conditional update against committed rows,
 * the equivalent of {@code UPDATE ... SET ... WHERE id = ? AND <condition>} executed in auto-commit mode.
 * Dispatchers use it to claim work so two instances never take the same row.</p>
 *
 * @param <T> row type
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Table<T extends Entity<T>> {

    /**
     * Stages an insert and assigns the id immediately.
     *
     * @param entity new row (id must be null)
     * @return the same instance with its id set
     * @throws IllegalArgumentException if entity is null or already has an id
     */
    T add(T entity);

    /**
     * Stages a full-row update.
     *
     * @param entity row with id
     * @throws IllegalStateException if no row with that id exists
     */
    void update(T entity);

    /**
     * Stages a delete. Deleting a missing row is a no-op.
     *
     * @param id row id
     */
    void remove(long id);

    /**
     * Finds a row by id.
     *
     * @param id row id
     * @return a detached copy
     */
    Optional<T> findById(long id);

    /**
     * Finds rows matching the filter, in id order.
     *
     * @param filter row filter
     * @return detached copies
     */
    List<T> findAll(Predicate<? super T> filter);

    default List<T> findAll() {
        return findAll(row -> true);
    }

    default Optional<T> findFirst(Predicate<? super T> filter) {
        return findAll(filter).stream().findFirst();
    }

    default List<T> findAll(Predicate<? super T> filter, Comparator<? super T> order, int limit) {
        return findAll(filter).stream().sorted(order).limit(limit).toList();
    }

    default int removeAll(Predicate<? super T> filter) {
        List<T> rows = findAll(filter);
        rows.forEach(row -> remove(row.getId()));
        return rows.size();
    }

    /**
     * Atomically applies the mutation if the committed row matches the condition.
     *
     * @param id row id
     * @param condition evaluated against the committed row
     * @param mutation applied to a copy that replaces the committed row
     * @return true if the row existed, matched and was updated
     */
    boolean updateIf(long id, Predicate<? super T> condition, Consumer<? super T> mutation);
}
