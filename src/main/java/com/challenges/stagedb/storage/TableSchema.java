package com.challenges.stagedb.storage;

import org.eclipse.collections.api.list.ImmutableList;

import java.util.Objects;
import java.util.Optional;

/**
 * Name and ordered column definitions of a table.
 */
public record TableSchema(String name, ImmutableList<ColumnDefinition> columns) {

    public TableSchema {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(columns, "columns");
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("Table '" + name + "' must have at least one column");
        }
        if (columns.collect(ColumnDefinition::name).distinct().size() != columns.size()) {
            throw new IllegalArgumentException("Table '" + name + "' declares a column twice");
        }
        if (columns.count(ColumnDefinition::primaryKey) > 1) {
            throw new IllegalArgumentException("Table can have only one PRIMARY KEY");
        }
    }

    public boolean hasColumn(String column) {
        return columns.anySatisfy(c -> c.name().equals(column));
    }

    public Optional<ColumnDefinition> column(String column) {
        return Optional.ofNullable(columns.detect(c -> c.name().equals(column)));
    }

    public ImmutableList<String> columnNames() {
        return columns.collect(ColumnDefinition::name);
    }

    public int columnCount() {
        return columns.size();
    }

    public Optional<ColumnDefinition> primaryKey() {
        return Optional.ofNullable(columns.detect(ColumnDefinition::primaryKey));
    }

    @Override
    public String toString() {
        return name + " (" + columns.makeString(", ") + ")";
    }
}
