package com.challenges.stagedb.storage;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Tables by name; {@link #tableNames()} lists them in creation order.
 */
public class InMemoryRowStore implements RowStore {
    private final MutableMap<String, Table> tables = Maps.mutable.empty();
    private final MutableList<String> creationOrder = Lists.mutable.empty();

    @Override
    public boolean hasTable(String name) {
        return tables.containsKey(name);
    }

    @Override
    public Optional<Table> getTable(String name) {
        return Optional.ofNullable(tables.get(name));
    }

    @Override
    public void createTable(TableSchema schema) {
        if (hasTable(schema.name())) {
            throw StoreException.forTableExists(schema.name());
        }
        tables.put(schema.name(), new Table(schema));
        creationOrder.add(schema.name());
    }

    @Override
    public void dropTable(String name) {
        if (tables.remove(name) == null) {
            throw StoreException.forTableNotFound(name);
        }
        creationOrder.remove(name);
    }

    @Override
    public void insertRows(String table, ListIterable<Row> rows) {
        require(table).insertAll(rows);
    }

    @Override
    public int updateRows(String table, Map<String, ?> changes, Predicate<Row> filter) {
        return require(table).updateRows(changes, filter);
    }

    @Override
    public int deleteRows(String table, Predicate<Row> filter) {
        return require(table).deleteRows(filter);
    }

    @Override
    public ImmutableList<String> tableNames() {
        return creationOrder.toImmutable();
    }

    @Override
    public void clear() {
        tables.clear();
        creationOrder.clear();
    }

    private Table require(String name) {
        Table table = tables.get(name);
        if (table == null) {
            throw StoreException.forTableNotFound(name);
        }
        return table;
    }
}
