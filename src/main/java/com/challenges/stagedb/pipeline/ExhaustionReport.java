package com.challenges.stagedb.pipeline;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Turns a unit no stage accepted into the run's error result. Development mode lists the
 * stages that declined and transformed it; production mode hides the pipeline.
 */
public final class ExhaustionReport {
    public static final String PRODUCTION_MESSAGE = "Invalid SQL syntax";

    private ExhaustionReport() {
    }

    public static Payload.Terminal of(WorkUnit unit, boolean production) {
        if (production) {
            return Payload.Terminal.error(PRODUCTION_MESSAGE);
        }
        Trace trace = unit.trace();
        MutableList<String> lines = Lists.mutable.empty();
        lines.add("No stage could process the input");
        lines.add("=== PROCESSING ERROR ===");
        lines.add("Input: " + unit.payload().describe());
        lines.add("Run ID: " + unit.origin());
        lines.add("Stages attempted: " + trace.totalStages());
        lines.add("Declined by:");
        trace.declinedBy().forEach(stage -> lines.add("  - " + stage));
        if (trace.transformedBy().notEmpty()) {
            lines.add("Transformed by:");
            trace.transformedBy().forEach(stage -> lines.add("  - " + stage));
        }
        lines.add("Suggestion: check the statement syntax");
        lines.add("========================");
        return Payload.Terminal.error(lines.makeString("\n"));
    }
}
