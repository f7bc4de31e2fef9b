package com.challenges.stagedb.pipeline;

/**
 * A run needed more dequeues than its budget allows. Signals a pipeline whose stages
 * keep re-emitting each other's output; no part of the run's outcome can be trusted.
 */
public class PipelineOverflowException extends RuntimeException {
    private final int maxIterations;

    public PipelineOverflowException(int maxIterations) {
        super("Pipeline exceeded maximum iterations (" + maxIterations + "). Possible infinite loop detected.");
        this.maxIterations = maxIterations;
    }

    public int maxIterations() {
        return maxIterations;
    }
}
