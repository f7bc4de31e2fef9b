package com.challenges.stagedb.storage;

import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.map.MapIterable;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

import java.util.Map;

/**
 * An immutable column to value mapping. Values are {@code null}, {@link Long},
 * {@link Double} or {@link String}.
 */
public final class Row {
    private final MutableMap<String, Object> values;

    private Row(MutableMap<String, Object> values) {
        this.values = values;
    }

    public static Row of(Map<String, ?> values) {
        return new Row(Maps.mutable.ofMap(values));
    }

    public static Row empty() {
        return new Row(Maps.mutable.empty());
    }

    public Object get(String column) {
        return values.get(column);
    }

    public boolean has(String column) {
        return values.containsKey(column);
    }

    public Row with(String column, Object value) {
        MutableMap<String, Object> copy = Maps.mutable.ofMap(values);
        copy.put(column, value);
        return new Row(copy);
    }

    public Row withAll(Map<String, ?> changes) {
        MutableMap<String, Object> copy = Maps.mutable.ofMap(values);
        copy.putAll(changes);
        return new Row(copy);
    }

    /**
     * Rebuilds the row with only the given columns; absent columns map to null.
     */
    public Row project(ListIterable<String> columns) {
        MutableMap<String, Object> projected = Maps.mutable.empty();
        columns.forEach(column -> projected.put(column, values.get(column)));
        return new Row(projected);
    }

    public MapIterable<String, Object> values() {
        return values.asUnmodifiable();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Row other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Row" + values;
    }
}
