package com.challenges.stagedb.operator;

import com.challenges.stagedb.output.ResultFormatter;
import com.challenges.stagedb.pipeline.Payload;
import com.challenges.stagedb.pipeline.Stage;
import com.challenges.stagedb.pipeline.StageContext;
import com.challenges.stagedb.pipeline.WorkUnit;

/**
 * Renders a row set no operator wants any more. Registered after every operator, so it
 * only sees row sets that have been through the whole chain.
 */
public class ResultFormatStage implements Stage {
    private final ResultFormatter formatter;

    public ResultFormatStage(ResultFormatter formatter) {
        this.formatter = formatter;
    }

    @Override
    public boolean appliesTo(WorkUnit unit) {
        return unit.payload() instanceof RowSet;
    }

    @Override
    public void transform(WorkUnit unit, StageContext context) {
        RowSet rowSet = unit.payloadAs(RowSet.class);
        context.emit(Payload.Terminal.success(formatter.format(rowSet.columns(), rowSet.rows())));
    }
}
