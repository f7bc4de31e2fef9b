package com.challenges.stagedb.operator;

import com.challenges.stagedb.pipeline.Payload;
import com.challenges.stagedb.predicate.PredicateEvaluator;
import com.challenges.stagedb.statement.StatementSpec;
import com.challenges.stagedb.storage.RowStore;

public class DeleteExecuteStage extends SpecExecuteStage<StatementSpec.Delete> {
    private final PredicateEvaluator evaluator;

    public DeleteExecuteStage(RowStore store, PredicateEvaluator evaluator) {
        super(store, StatementSpec.Delete.class);
        this.evaluator = evaluator;
    }

    @Override
    protected Payload.Terminal execute(StatementSpec.Delete spec) {
        requireColumns(requireTable(spec.table()).schema(), spec.where());
        int deleted = store.deleteRows(spec.table(),
            spec.where() == null ? null : row -> evaluator.evaluate(spec.where(), row));
        return Payload.Terminal.success(deleted + " row(s) deleted");
    }
}
