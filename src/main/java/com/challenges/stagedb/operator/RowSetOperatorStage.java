package com.challenges.stagedb.operator;

import com.challenges.stagedb.pipeline.Stage;
import com.challenges.stagedb.pipeline.StageContext;
import com.challenges.stagedb.pipeline.WorkUnit;
import com.challenges.stagedb.statement.StatementSpec;
import com.challenges.stagedb.storage.Row;
import org.eclipse.collections.api.list.ImmutableList;

/**
 * Base for relational operators. An operator takes a row set when its select asks for the
 * operation and the row set has not yet reached the operator's phase; it emits a new row
 * set tagged with that phase.
 */
public abstract class RowSetOperatorStage implements Stage {

    protected abstract Phase phase();

    protected abstract boolean requiredBy(StatementSpec.Select select);

    protected abstract ImmutableList<Row> apply(RowSet rowSet);

    @Override
    public boolean appliesTo(WorkUnit unit) {
        return unit.payload() instanceof RowSet rowSet
            && rowSet.phase().compareTo(phase()) < 0
            && requiredBy(rowSet.select());
    }

    @Override
    public void transform(WorkUnit unit, StageContext context) {
        RowSet rowSet = unit.payloadAs(RowSet.class);
        context.emit(rowSet.advance(phase(), apply(rowSet)));
    }
}
