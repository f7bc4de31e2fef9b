package com.challenges.stagedb.pipeline;

/**
 * A matcher plus transformer registered into a {@link Dispatcher}.
 */
public interface Stage {

    /**
     * Stable identity used in decline and transform logs.
     */
    default String id() {
        return getClass().getSimpleName();
    }

    boolean appliesTo(WorkUnit unit);

    /**
     * Consumes the unit. New units go back into the run through {@code context}.
     */
    void transform(WorkUnit unit, StageContext context);
}
