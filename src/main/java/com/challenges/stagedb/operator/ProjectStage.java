package com.challenges.stagedb.operator;

import com.challenges.stagedb.statement.StatementSpec;
import com.challenges.stagedb.storage.Row;
import org.eclipse.collections.api.list.ImmutableList;

/**
 * Rebuilds each row with only the requested columns, in request order.
 */
public class ProjectStage extends RowSetOperatorStage {

    @Override
    protected Phase phase() {
        return Phase.PROJECTED;
    }

    @Override
    protected boolean requiredBy(StatementSpec.Select select) {
        return !select.selectAll();
    }

    @Override
    protected ImmutableList<Row> apply(RowSet rowSet) {
        return rowSet.rows().collect(row -> row.project(rowSet.columns()));
    }
}
