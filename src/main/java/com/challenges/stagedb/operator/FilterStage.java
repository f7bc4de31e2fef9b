package com.challenges.stagedb.operator;

import com.challenges.stagedb.predicate.PredicateEvaluator;
import com.challenges.stagedb.statement.StatementSpec;
import com.challenges.stagedb.storage.Row;
import org.eclipse.collections.api.list.ImmutableList;

/**
 * Keeps the rows the WHERE clause accepts.
 */
public class FilterStage extends RowSetOperatorStage {
    private final PredicateEvaluator evaluator;

    public FilterStage(PredicateEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    @Override
    protected Phase phase() {
        return Phase.FILTERED;
    }

    @Override
    protected boolean requiredBy(StatementSpec.Select select) {
        return select.where() != null;
    }

    @Override
    protected ImmutableList<Row> apply(RowSet rowSet) {
        return rowSet.rows().select(row -> evaluator.evaluate(rowSet.select().where(), row));
    }
}
