package com.ryuqq.railway.adapter.inmemory.store;

import com.ryuqq.railway.core.model.Entity;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pending writes of one table at one layer (unsaved, or flushed into an open transaction).
 */
final class ChangeSet<T extends Entity<T>> {

    private final Map<Long, T> writes = new LinkedHashMap<>();
    private final Set<Long> deletes = new HashSet<>();

    void put(long id, T row) {
        deletes.remove(id);
        writes.put(id, row);
    }

    void delete(long id) {
        writes.remove(id);
        deletes.add(id);
    }

    boolean isDeleted(long id) {
        return deletes.contains(id);
    }

    T written(long id) {
        return writes.get(id);
    }

    /**
     * Layers the rows of this set over the given id-ordered view.
     */
    void overlay(Map<Long, T> view) {
        deletes.forEach(view::remove);
        view.putAll(writes);
    }

    void mergeInto(ChangeSet<T> target) {
        deletes.forEach(target::delete);
        writes.forEach(target::put);
    }

    int size() {
        return writes.size() + deletes.size();
    }

    List<RowChange> toRowChanges(Class<T> type) {
        List<RowChange> changes = new ArrayList<>(size());
        deletes.forEach(id -> changes.add(new RowChange(type, id, null)));
        writes.forEach((id, row) -> changes.add(new RowChange(type, id, row)));
        return changes;
    }

    void clear() {
        writes.clear();
        deletes.clear();
    }
}
