package com.challenges.stagedb;

import com.challenges.stagedb.output.ResultFormatter;
import com.challenges.stagedb.pipeline.Dispatcher;
import com.challenges.stagedb.pipeline.TraceLevel;

import java.util.Objects;

/**
 * Engine settings.
 *
 * @param maxIterations    dequeues allowed per statement before the run is declared a loop
 * @param traceLevel       how much history work units keep
 * @param productionErrors hide pipeline details when no stage accepts a statement
 * @param style            row set rendering
 */
public record EngineConfig(int maxIterations,
                           TraceLevel traceLevel,
                           boolean productionErrors,
                           ResultFormatter.Style style) {

    public EngineConfig {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be positive: " + maxIterations);
        }
        Objects.requireNonNull(traceLevel, "traceLevel");
        Objects.requireNonNull(style, "style");
    }

    public static EngineConfig defaults() {
        return new EngineConfig(Dispatcher.DEFAULT_MAX_ITERATIONS, TraceLevel.MINIMAL, false, ResultFormatter.Style.TAB);
    }

    public EngineConfig withMaxIterations(int value) {
        return new EngineConfig(value, traceLevel, productionErrors, style);
    }

    public EngineConfig withTraceLevel(TraceLevel value) {
        return new EngineConfig(maxIterations, value, productionErrors, style);
    }

    public EngineConfig withProductionErrors(boolean value) {
        return new EngineConfig(maxIterations, traceLevel, value, style);
    }

    public EngineConfig withStyle(ResultFormatter.Style value) {
        return new EngineConfig(maxIterations, traceLevel, productionErrors, value);
    }
}
