package com.challenges.stagedb.operator;

import com.challenges.stagedb.pipeline.Payload;
import com.challenges.stagedb.statement.StatementSpec;
import com.challenges.stagedb.storage.RowStore;

public class DropTableExecuteStage extends SpecExecuteStage<StatementSpec.DropTable> {

    public DropTableExecuteStage(RowStore store) {
        super(store, StatementSpec.DropTable.class);
    }

    @Override
    protected Payload.Terminal execute(StatementSpec.DropTable spec) {
        if (spec.ifExists() && !store.hasTable(spec.table())) {
            return Payload.Terminal.success("Table '" + spec.table() + "' does not exist (skipped)");
        }
        store.dropTable(spec.table());
        return Payload.Terminal.success("Table '" + spec.table() + "' dropped");
    }
}
