package com.challenges.stagedb.persistence;

import com.challenges.stagedb.storage.ColumnDefinition;
import com.challenges.stagedb.storage.ColumnType;
import com.challenges.stagedb.storage.InMemoryRowStore;
import com.challenges.stagedb.storage.Row;
import com.challenges.stagedb.storage.RowStore;
import com.challenges.stagedb.storage.Table;
import com.challenges.stagedb.storage.TableSchema;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Saves and loads a whole row store as one JSON document:
 *
 * <pre>
 * {"version": 1, "created": "...",
 *  "database": {"tables": {"users": {
 *      "schema": {"name": "users", "columns": {"id": {"type": "INTEGER", "primaryKey": true, ...}}},
 *      "rows": [{"id": 1, ...}]}}}}
 * </pre>
 *
 * Column order, flags, defaults and value types (null, integer, real, text) survive a
 * round trip.
 */
public class JsonStorageEngine {
    public static final int FORMAT_VERSION = 1;

    private static final Logger log = LoggerFactory.getLogger(JsonStorageEngine.class);

    private final JsonFactory factory = new JsonFactory();

    public void save(RowStore store, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = Files.newOutputStream(path);
             JsonGenerator generator = factory.createGenerator(out)) {
            generator.useDefaultPrettyPrinter();
            generator.writeStartObject();
            generator.writeNumberField("version", FORMAT_VERSION);
            generator.writeStringField("created", Instant.now().toString());
            generator.writeObjectFieldStart("database");
            generator.writeObjectFieldStart("tables");
            for (String name : store.tableNames()) {
                Table table = store.getTable(name).orElseThrow();
                generator.writeObjectFieldStart(name);
                writeSchema(generator, table.schema());
                generator.writeArrayFieldStart("rows");
                for (Row row : table.rows()) {
                    generator.writeStartObject();
                    for (String column : table.schema().columnNames()) {
                        generator.writeFieldName(column);
                        writeValue(generator, row.get(column));
                    }
                    generator.writeEndObject();
                }
                generator.writeEndArray();
                generator.writeEndObject();
            }
            generator.writeEndObject();
            generator.writeEndObject();
            generator.writeEndObject();
        }
        log.debug("Saved {} table(s) to {}", store.tableNames().size(), path);
    }

    /**
     * Reads a saved document into a fresh store.
     *
     * @throws IOException if the file cannot be read, is not valid JSON or has another version
     */
    public RowStore load(Path path) throws IOException {
        RowStore store = new InMemoryRowStore();
        try (InputStream in = Files.newInputStream(path);
             JsonParser parser = factory.createParser(in)) {
            expect(parser.nextToken(), JsonToken.START_OBJECT);
            Integer version = null;
            while (parser.nextToken() != JsonToken.END_OBJECT) {
                String field = parser.currentName();
                parser.nextToken();
                switch (field) {
                    case "version" -> version = parser.getIntValue();
                    case "database" -> readDatabase(parser, store);
                    default -> parser.skipChildren();
                }
            }
            if (version == null || version != FORMAT_VERSION) {
                throw new IOException("Unsupported database format version: " + version);
            }
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid database file: " + e.getMessage(), e);
        }
        log.debug("Loaded {} table(s) from {}", store.tableNames().size(), path);
        return store;
    }

    /**
     * Replaces the contents of {@code target} with the saved tables. {@code target} is
     * untouched when reading fails.
     *
     * @return number of tables loaded
     */
    public int loadInto(RowStore target, Path path) throws IOException {
        RowStore loaded = load(path);
        target.clear();
        for (String name : loaded.tableNames()) {
            Table table = loaded.getTable(name).orElseThrow();
            target.createTable(table.schema());
            target.insertRows(name, table.rows());
        }
        return loaded.tableNames().size();
    }

    private void writeSchema(JsonGenerator generator, TableSchema schema) throws IOException {
        generator.writeObjectFieldStart("schema");
        generator.writeStringField("name", schema.name());
        generator.writeObjectFieldStart("columns");
        for (ColumnDefinition column : schema.columns()) {
            generator.writeObjectFieldStart(column.name());
            generator.writeStringField("type", column.type().name());
            generator.writeBooleanField("primaryKey", column.primaryKey());
            generator.writeBooleanField("notNull", column.notNull());
            generator.writeFieldName("default");
            writeValue(generator, column.defaultValue());
            generator.writeEndObject();
        }
        generator.writeEndObject();
        generator.writeEndObject();
    }

    private void writeValue(JsonGenerator generator, Object value) throws IOException {
        if (value == null) {
            generator.writeNull();
        } else if (value instanceof Long l) {
            generator.writeNumber(l);
        } else if (value instanceof Double d) {
            generator.writeNumber(d);
        } else {
            generator.writeString(value.toString());
        }
    }

    private void readDatabase(JsonParser parser, RowStore store) throws IOException {
        expect(parser.currentToken(), JsonToken.START_OBJECT);
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String field = parser.currentName();
            parser.nextToken();
            if ("tables".equals(field)) {
                expect(parser.currentToken(), JsonToken.START_OBJECT);
                while (parser.nextToken() != JsonToken.END_OBJECT) {
                    parser.nextToken();
                    readTable(parser, store);
                }
            } else {
                parser.skipChildren();
            }
        }
    }

    private void readTable(JsonParser parser, RowStore store) throws IOException {
        expect(parser.currentToken(), JsonToken.START_OBJECT);
        TableSchema schema = null;
        MutableList<Row> rows = Lists.mutable.empty();
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String field = parser.currentName();
            JsonToken token = parser.nextToken();
            switch (field) {
                case "schema" -> schema = readSchema(parser);
                case "rows" -> {
                    expect(token, JsonToken.START_ARRAY);
                    while (parser.nextToken() != JsonToken.END_ARRAY) {
                        rows.add(Row.of(readObjectValues(parser)));
                    }
                }
                default -> parser.skipChildren();
            }
        }
        if (schema == null) {
            throw new IOException("Table entry without a schema");
        }
        store.createTable(schema);
        store.insertRows(schema.name(), fillMissing(schema, rows));
    }

    private TableSchema readSchema(JsonParser parser) throws IOException {
        expect(parser.currentToken(), JsonToken.START_OBJECT);
        String name = null;
        MutableList<ColumnDefinition> columns = Lists.mutable.empty();
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String field = parser.currentName();
            parser.nextToken();
            switch (field) {
                case "name" -> name = parser.getText();
                case "columns" -> {
                    expect(parser.currentToken(), JsonToken.START_OBJECT);
                    while (parser.nextToken() != JsonToken.END_OBJECT) {
                        String column = parser.currentName();
                        parser.nextToken();
                        columns.add(readColumn(column, parser));
                    }
                }
                default -> parser.skipChildren();
            }
        }
        if (name == null) {
            throw new IOException("Schema without a table name");
        }
        return new TableSchema(name, columns.toImmutable());
    }

    private ColumnDefinition readColumn(String name, JsonParser parser) throws IOException {
        expect(parser.currentToken(), JsonToken.START_OBJECT);
        ColumnType type = ColumnType.TEXT;
        boolean primaryKey = false;
        boolean notNull = false;
        Object defaultValue = null;
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String field = parser.currentName();
            parser.nextToken();
            switch (field) {
                case "type" -> {
                    String keyword = parser.getText();
                    type = ColumnType.fromKeyword(keyword)
                        .orElseThrow(() -> new IOException("Unknown column type: " + keyword));
                }
                case "primaryKey" -> primaryKey = parser.getBooleanValue();
                case "notNull" -> notNull = parser.getBooleanValue();
                case "default" -> defaultValue = readValue(parser);
                default -> parser.skipChildren();
            }
        }
        return new ColumnDefinition(name, type, primaryKey, notNull, defaultValue);
    }

    private MutableMap<String, Object> readObjectValues(JsonParser parser) throws IOException {
        expect(parser.currentToken(), JsonToken.START_OBJECT);
        MutableMap<String, Object> values = Maps.mutable.empty();
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String field = parser.currentName();
            parser.nextToken();
            values.put(field, readValue(parser));
        }
        return values;
    }

    private Object readValue(JsonParser parser) throws IOException {
        JsonToken token = parser.currentToken();
        return switch (token) {
            case VALUE_NULL -> null;
            case VALUE_NUMBER_INT -> parser.getLongValue();
            case VALUE_NUMBER_FLOAT -> parser.getDoubleValue();
            case VALUE_STRING -> parser.getText();
            default -> throw new IOException("Unexpected JSON token for a value: " + token);
        };
    }

    /**
     * Rows saved by hand may omit columns; they read back as null.
     */
    private static MutableList<Row> fillMissing(TableSchema schema, MutableList<Row> rows) {
        return rows.collect(row -> {
            MutableMap<String, Object> complete = Maps.mutable.empty();
            schema.columnNames().forEach(column -> complete.put(column, row.get(column)));
            return Row.of(complete);
        });
    }

    private static void expect(JsonToken actual, JsonToken expected) throws IOException {
        if (actual != expected) {
            throw new IOException("Expected " + expected + " but found " + actual);
        }
    }
}
