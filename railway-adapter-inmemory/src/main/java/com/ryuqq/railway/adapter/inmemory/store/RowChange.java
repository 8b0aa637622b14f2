package com.ryuqq.railway.adapter.inmemory.store;

import com.ryuqq.railway.core.model.Entity;

/**
 * One row write in a change set. A null row is a delete.
 *
 * @param type row type
 * @param id row id
 * @param row new row value, or null to delete
 */
record RowChange(Class<?> type, long id, Entity<?> row) {
}
