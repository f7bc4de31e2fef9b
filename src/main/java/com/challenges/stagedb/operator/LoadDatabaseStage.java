package com.challenges.stagedb.operator;

import com.challenges.stagedb.persistence.JsonStorageEngine;
import com.challenges.stagedb.pipeline.Payload;
import com.challenges.stagedb.statement.StatementSpec;
import com.challenges.stagedb.storage.RowStore;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Replaces every table in the store with the saved ones.
 */
public class LoadDatabaseStage extends SpecExecuteStage<StatementSpec.LoadDatabase> {
    private final JsonStorageEngine storage;

    public LoadDatabaseStage(RowStore store, JsonStorageEngine storage) {
        super(store, StatementSpec.LoadDatabase.class);
        this.storage = storage;
    }

    @Override
    protected Payload.Terminal execute(StatementSpec.LoadDatabase spec) {
        int tables;
        try {
            tables = storage.loadInto(store, Path.of(spec.path()));
        } catch (IOException | InvalidPathException e) {
            return Payload.Terminal.error("Failed to load database from '" + spec.path() + "': " + e.getMessage());
        }
        return Payload.Terminal.success("Database loaded from '" + spec.path() + "' (" + tables + " tables)");
    }
}
