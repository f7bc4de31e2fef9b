package com.challenges.stagedb.operator;

import com.challenges.stagedb.pipeline.Payload;
import com.challenges.stagedb.statement.StatementSpec;
import com.challenges.stagedb.storage.RowStore;

public class CreateTableExecuteStage extends SpecExecuteStage<StatementSpec.CreateTable> {

    public CreateTableExecuteStage(RowStore store) {
        super(store, StatementSpec.CreateTable.class);
    }

    @Override
    protected Payload.Terminal execute(StatementSpec.CreateTable spec) {
        String name = spec.schema().name();
        if (spec.ifNotExists() && store.hasTable(name)) {
            return Payload.Terminal.success("Table '" + name + "' already exists (skipped)");
        }
        store.createTable(spec.schema());
        return Payload.Terminal.success("Table '" + name + "' created");
    }
}
