package com.challenges.stagedb.operator;

import com.challenges.stagedb.pipeline.Payload;
import com.challenges.stagedb.predicate.PredicateEvaluator;
import com.challenges.stagedb.statement.StatementSpec;
import com.challenges.stagedb.storage.RowStore;
import com.challenges.stagedb.storage.TableSchema;

public class UpdateExecuteStage extends SpecExecuteStage<StatementSpec.Update> {
    private final PredicateEvaluator evaluator;

    public UpdateExecuteStage(RowStore store, PredicateEvaluator evaluator) {
        super(store, StatementSpec.Update.class);
        this.evaluator = evaluator;
    }

    @Override
    protected Payload.Terminal execute(StatementSpec.Update spec) {
        TableSchema schema = requireTable(spec.table()).schema();
        requireColumns(schema, spec.assignments().collect(StatementSpec.Assignment::column));
        requireColumns(schema, spec.where());
        int updated = store.updateRows(spec.table(), spec.changes(),
            spec.where() == null ? null : row -> evaluator.evaluate(spec.where(), row));
        return Payload.Terminal.success(updated + " row(s) updated");
    }
}
