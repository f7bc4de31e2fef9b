package com.challenges.stagedb.storage;

import java.util.Objects;

/**
 * One column of a table schema. A primary key column is always NOT NULL.
 */
public record ColumnDefinition(String name, ColumnType type, boolean primaryKey, boolean notNull, Object defaultValue) {

    public ColumnDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (primaryKey) {
            notNull = true;
        }
    }

    public static ColumnDefinition of(String name, ColumnType type) {
        return new ColumnDefinition(name, type, false, false, null);
    }

    public ColumnDefinition withPrimaryKey() {
        return new ColumnDefinition(name, type, true, true, defaultValue);
    }

    public ColumnDefinition withNotNull() {
        return new ColumnDefinition(name, type, primaryKey, true, defaultValue);
    }

    public ColumnDefinition withDefault(Object value) {
        return new ColumnDefinition(name, type, primaryKey, notNull, value);
    }

    public ColumnDefinition withType(ColumnType newType) {
        return new ColumnDefinition(name, newType, primaryKey, notNull, defaultValue);
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append(' ').append(type);
        if (primaryKey) {
            sb.append(" PRIMARY KEY");
        } else if (notNull) {
            sb.append(" NOT NULL");
        }
        if (defaultValue != null) {
            sb.append(" DEFAULT ").append(defaultValue);
        }
        return sb.toString();
    }
}
