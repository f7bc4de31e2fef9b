package com.challenges.stagedb.pipeline;

/**
 * What a stage may do to the run it is part of.
 */
public interface StageContext {

    String runId();

    /**
     * Queues a new unit derived from the one being transformed.
     */
    void emit(Payload payload);

    /**
     * Records the run's result. A later capture replaces an earlier one.
     */
    void capture(Payload.Terminal terminal);
}
