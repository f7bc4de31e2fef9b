package com.challenges.stagedb.persistence;

import com.challenges.stagedb.storage.ColumnDefinition;
import com.challenges.stagedb.storage.ColumnType;
import com.challenges.stagedb.storage.InMemoryRowStore;
import com.challenges.stagedb.storage.Row;
import com.challenges.stagedb.storage.RowStore;
import com.challenges.stagedb.storage.Table;
import com.challenges.stagedb.storage.TableSchema;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class JsonStorageEngineTest {
    private final JsonStorageEngine engine = new JsonStorageEngine();

    @TempDir
    Path tempDir;

    private static RowStore sampleStore() {
        RowStore store = new InMemoryRowStore();
        store.createTable(new TableSchema("users", Lists.immutable.with(
            ColumnDefinition.of("id", ColumnType.INTEGER).withPrimaryKey(),
            ColumnDefinition.of("name", ColumnType.TEXT).withNotNull(),
            ColumnDefinition.of("score", ColumnType.REAL).withDefault(1.5),
            ColumnDefinition.of("city", ColumnType.TEXT).withDefault("NYC"))));
        MutableMap<String, Object> first = Maps.mutable.empty();
        first.put("id", 1L);
        first.put("name", "Alice");
        first.put("score", 2.0);
        first.put("city", null);
        MutableMap<String, Object> second = Maps.mutable.empty();
        second.put("id", 2L);
        second.put("name", "42");
        second.put("score", -0.25);
        second.put("city", "LA");
        store.insertRows("users", Lists.immutable.with(Row.of(first), Row.of(second)));
        store.createTable(new TableSchema("empty", Lists.immutable.with(ColumnDefinition.of("x", ColumnType.BLOB))));
        return store;
    }

    @Test
    public void testRoundTripKeepsSchemaAndValues() throws IOException {
        RowStore original = sampleStore();
        Path file = tempDir.resolve("db.json");

        engine.save(original, file);
        RowStore loaded = engine.load(file);

        assertEquals(Lists.immutable.with("users", "empty"), loaded.tableNames());
        Table users = loaded.getTable("users").orElseThrow();
        Table expected = original.getTable("users").orElseThrow();
        assertEquals(expected.schema(), users.schema());
        assertEquals(expected.rows(), users.rows());

        Row first = users.rows().getFirst();
        assertEquals(Long.class, first.get("id").getClass());
        assertEquals(Double.class, first.get("score").getClass());
        assertNull(first.get("city"));
        assertEquals("42", users.rows().get(1).get("name"));
        assertEquals(0, loaded.getTable("empty").orElseThrow().size());
    }

    @Test
    public void testDocumentLayout() throws IOException {
        Path file = tempDir.resolve("nested/dir/db.json");
        engine.save(sampleStore(), file);

        String json = Files.readString(file);
        assertTrue(json.contains("\"version\" : 1"));
        assertTrue(json.contains("\"created\""));
        assertTrue(json.contains("\"primaryKey\" : true"));
    }

    @Test
    public void testLoadIntoReplacesExistingTables() throws IOException {
        Path file = tempDir.resolve("db.json");
        engine.save(sampleStore(), file);

        RowStore target = new InMemoryRowStore();
        target.createTable(new TableSchema("stale", Lists.immutable.with(ColumnDefinition.of("a", ColumnType.TEXT))));

        assertEquals(2, engine.loadInto(target, file));
        assertFalse(target.hasTable("stale"));
        assertEquals(2, target.getTable("users").orElseThrow().size());
    }

    @Test
    public void testWrongVersionIsRejectedAndTargetUntouched() throws IOException {
        Path file = tempDir.resolve("future.json");
        Files.writeString(file, "{\"version\": 2, \"database\": {\"tables\": {}}}");

        RowStore target = sampleStore();
        IOException e = assertThrows(IOException.class, () -> engine.loadInto(target, file));
        assertTrue(e.getMessage().contains("version"));
        assertTrue(target.hasTable("users"));
    }

    @Test
    public void testMissingAndMalformedFiles() throws IOException {
        assertThrows(IOException.class, () -> engine.load(tempDir.resolve("absent.json")));

        Path broken = tempDir.resolve("broken.json");
        Files.writeString(broken, "{\"version\": 1, \"database\": ");
        assertThrows(IOException.class, () -> engine.load(broken));
    }
}
