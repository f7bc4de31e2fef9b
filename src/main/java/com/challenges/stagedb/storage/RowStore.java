package com.challenges.stagedb.storage;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * The table container the engine executes against. Implementations own the table
 * lifetime; the engine only calls into it.
 */
public interface RowStore {

    boolean hasTable(String name);

    Optional<Table> getTable(String name);

    /**
     * @throws StoreException if a table with the same name exists
     */
    void createTable(TableSchema schema);

    /**
     * @throws StoreException if the table does not exist
     */
    void dropTable(String name);

    /**
     * Inserts all rows or none of them.
     *
     * @throws StoreException if the table is missing or a constraint would be broken
     */
    void insertRows(String table, ListIterable<Row> rows);

    default void insertRow(String table, Row row) {
        insertRows(table, Lists.immutable.with(row));
    }

    /**
     * Applies {@code changes} to every row accepted by {@code filter} (all rows when null).
     *
     * @return number of rows changed
     */
    int updateRows(String table, Map<String, ?> changes, Predicate<Row> filter);

    /**
     * Removes every row accepted by {@code filter} (all rows when null).
     *
     * @return number of rows removed
     */
    int deleteRows(String table, Predicate<Row> filter);

    ImmutableList<String> tableNames();

    void clear();
}
