package com.challenges.stagedb.storage;

import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryRowStoreTest {
    private RowStore store;

    @BeforeEach
    public void setUp() {
        store = new InMemoryRowStore();
        store.createTable(new TableSchema("users", Lists.immutable.with(
            ColumnDefinition.of("id", ColumnType.INTEGER).withPrimaryKey(),
            ColumnDefinition.of("name", ColumnType.TEXT).withNotNull(),
            ColumnDefinition.of("city", ColumnType.TEXT))));
    }

    private static Row user(long id, String name, String city) {
        MutableMap<String, Object> values = Maps.mutable.empty();
        values.put("id", id);
        values.put("name", name);
        values.put("city", city);
        return Row.of(values);
    }

    private int size() {
        return store.getTable("users").orElseThrow().size();
    }

    @Test
    public void testCreateAndDrop() {
        assertTrue(store.hasTable("users"));
        StoreException exists = assertThrows(StoreException.class,
            () -> store.createTable(new TableSchema("users", Lists.immutable.with(ColumnDefinition.of("a", ColumnType.TEXT)))));
        assertEquals("Table 'users' already exists", exists.getMessage());

        store.dropTable("users");
        assertFalse(store.hasTable("users"));
        StoreException missing = assertThrows(StoreException.class, () -> store.dropTable("users"));
        assertEquals("Table 'users' does not exist", missing.getMessage());
    }

    @Test
    public void testTableNamesKeepCreationOrder() {
        for (String name : new String[] {"zeta", "alpha", "mid"}) {
            store.createTable(new TableSchema(name, Lists.immutable.with(ColumnDefinition.of("a", ColumnType.TEXT))));
        }
        assertEquals(Lists.immutable.with("users", "zeta", "alpha", "mid"), store.tableNames());

        store.dropTable("zeta");
        assertEquals(Lists.immutable.with("users", "alpha", "mid"), store.tableNames());

        store.clear();
        assertTrue(store.tableNames().isEmpty());
    }

    @Test
    public void testBatchInsertIsAllOrNothing() {
        store.insertRow("users", user(1, "Alice", "NYC"));

        StoreException e = assertThrows(StoreException.class, () -> store.insertRows("users",
            Lists.immutable.with(user(2, "Bob", "LA"), user(1, "Dup", "SF"))));

        assertEquals("Duplicate value '1' for PRIMARY KEY 'id' in table 'users'", e.getMessage());
        assertEquals(1, size());
    }

    @Test
    public void testNotNullIsEnforced() {
        StoreException e = assertThrows(StoreException.class, () -> store.insertRow("users", user(1, null, "NYC")));
        assertEquals("Column 'name' in table 'users' cannot be NULL", e.getMessage());
        assertEquals(0, size());
    }

    @Test
    public void testUpdateAndDelete() {
        store.insertRows("users", Lists.immutable.with(user(1, "Alice", "NYC"), user(2, "Bob", "LA"), user(3, "Cid", "NYC")));

        assertEquals(2, store.updateRows("users", Map.of("city", "SF"), row -> "NYC".equals(row.get("city"))));
        assertEquals(Lists.immutable.with("SF", "LA", "SF"),
            store.getTable("users").orElseThrow().rows().collect(row -> row.get("city")));

        assertEquals(1, store.deleteRows("users", row -> "LA".equals(row.get("city"))));
        assertEquals(2, store.deleteRows("users", null));
        assertEquals(0, size());
    }

    @Test
    public void testUpdateThatBreaksPrimaryKeyChangesNothing() {
        store.insertRows("users", Lists.immutable.with(user(1, "Alice", "NYC"), user(2, "Bob", "LA")));

        assertThrows(StoreException.class, () -> store.updateRows("users", Map.of("id", 7L), null));
        assertEquals(Lists.immutable.with(1L, 2L),
            store.getTable("users").orElseThrow().rows().collect(row -> row.get("id")));
    }

    @Test
    public void testUpdateOfUnknownColumnIsRejected() {
        StoreException e = assertThrows(StoreException.class,
            () -> store.updateRows("users", Map.of("age", 3L), null));
        assertEquals("Column 'age' does not exist in table 'users'", e.getMessage());
    }

    @Test
    public void testSchemaRejectsTwoPrimaryKeys() {
        assertThrows(IllegalArgumentException.class, () -> new TableSchema("t", Lists.immutable.with(
            ColumnDefinition.of("a", ColumnType.INTEGER).withPrimaryKey(),
            ColumnDefinition.of("b", ColumnType.INTEGER).withPrimaryKey())));
    }
}
