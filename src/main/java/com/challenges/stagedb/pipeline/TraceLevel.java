package com.challenges.stagedb.pipeline;

/**
 * How much transformation history a unit records. Declines are recorded at every level.
 */
public enum TraceLevel {
    /** No transform log. */
    NONE,
    /** Ids of the stages that transformed the unit's ancestors. */
    MINIMAL,
    /** Stage ids plus before/after snapshots. */
    DETAILED
}
