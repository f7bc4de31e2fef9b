package com.challenges.stagedb.operator;

import com.challenges.stagedb.pipeline.Payload;
import com.challenges.stagedb.pipeline.Stage;
import com.challenges.stagedb.pipeline.StageContext;
import com.challenges.stagedb.pipeline.WorkUnit;

/**
 * Hands terminal payloads to the run as its result.
 */
public class ResultCaptureStage implements Stage {

    @Override
    public boolean appliesTo(WorkUnit unit) {
        return unit.payload() instanceof Payload.Terminal;
    }

    @Override
    public void transform(WorkUnit unit, StageContext context) {
        context.capture(unit.payloadAs(Payload.Terminal.class));
    }
}
