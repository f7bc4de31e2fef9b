package com.challenges.stagedb.operator;

import com.challenges.stagedb.persistence.JsonStorageEngine;
import com.challenges.stagedb.pipeline.Payload;
import com.challenges.stagedb.statement.StatementSpec;
import com.challenges.stagedb.storage.RowStore;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

public class SaveDatabaseStage extends SpecExecuteStage<StatementSpec.SaveDatabase> {
    private final JsonStorageEngine storage;

    public SaveDatabaseStage(RowStore store, JsonStorageEngine storage) {
        super(store, StatementSpec.SaveDatabase.class);
        this.storage = storage;
    }

    @Override
    protected Payload.Terminal execute(StatementSpec.SaveDatabase spec) {
        try {
            storage.save(store, Path.of(spec.path()));
        } catch (IOException | InvalidPathException e) {
            return Payload.Terminal.error("Failed to save database to '" + spec.path() + "': " + e.getMessage());
        }
        return Payload.Terminal.success(
            "Database saved to '" + spec.path() + "' (" + store.tableNames().size() + " tables)");
    }
}
