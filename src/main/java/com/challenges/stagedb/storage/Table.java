package com.challenges.stagedb.storage;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;

import java.util.Map;
import java.util.function.Predicate;

/**
 * Rows of one table. Every mutation builds the candidate row list first, checks the
 * schema constraints on it and only then replaces the stored rows.
 */
public class Table {
    private final TableSchema schema;
    private MutableList<Row> rows = Lists.mutable.empty();

    public Table(TableSchema schema) {
        this.schema = schema;
    }

    public TableSchema schema() {
        return schema;
    }

    public String name() {
        return schema.name();
    }

    public ImmutableList<Row> rows() {
        return rows.toImmutable();
    }

    public int size() {
        return rows.size();
    }

    public void insertAll(ListIterable<Row> newRows) {
        MutableList<Row> candidate = Lists.mutable.ofAll(rows);
        candidate.addAllIterable(newRows);
        checkConstraints(candidate);
        rows = candidate;
    }

    public int updateRows(Map<String, ?> changes, Predicate<Row> filter) {
        for (String column : changes.keySet()) {
            if (!schema.hasColumn(column)) {
                throw StoreException.forColumnNotFound(column, name());
            }
        }
        MutableList<Row> candidate = Lists.mutable.empty();
        int updated = 0;
        for (Row row : rows) {
            if (filter == null || filter.test(row)) {
                candidate.add(row.withAll(changes));
                updated++;
            } else {
                candidate.add(row);
            }
        }
        checkConstraints(candidate);
        rows = candidate;
        return updated;
    }

    public int deleteRows(Predicate<Row> filter) {
        int before = rows.size();
        if (filter == null) {
            rows = Lists.mutable.empty();
            return before;
        }
        rows = rows.reject(filter::test);
        return before - rows.size();
    }

    private void checkConstraints(ListIterable<Row> candidate) {
        for (ColumnDefinition column : schema.columns()) {
            if (column.notNull() && candidate.anySatisfy(row -> row.get(column.name()) == null)) {
                throw new StoreException("Column '" + column.name() + "' in table '" + name() + "' cannot be NULL");
            }
        }
        schema.primaryKey().ifPresent(key -> {
            MutableSet<Object> seen = Sets.mutable.empty();
            for (Row row : candidate) {
                Object value = row.get(key.name());
                if (!seen.add(value)) {
                    throw new StoreException("Duplicate value '" + value + "' for PRIMARY KEY '" + key.name()
                            + "' in table '" + name() + "'");
                }
            }
        });
    }
}
