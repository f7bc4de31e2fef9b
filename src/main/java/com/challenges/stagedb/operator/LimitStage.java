package com.challenges.stagedb.operator;

import com.challenges.stagedb.statement.StatementSpec;
import com.challenges.stagedb.storage.Row;
import org.eclipse.collections.api.list.ImmutableList;

/**
 * Applies OFFSET (default 0) and then LIMIT.
 */
public class LimitStage extends RowSetOperatorStage {

    @Override
    protected Phase phase() {
        return Phase.LIMITED;
    }

    @Override
    protected boolean requiredBy(StatementSpec.Select select) {
        return select.hasLimitOrOffset();
    }

    @Override
    protected ImmutableList<Row> apply(RowSet rowSet) {
        StatementSpec.Select select = rowSet.select();
        int offset = select.offset() == null ? 0 : select.offset();
        ImmutableList<Row> rows = rowSet.rows().drop(offset);
        return select.limit() == null ? rows : rows.take(select.limit());
    }
}
