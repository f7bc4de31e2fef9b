package com.challenges.stagedb.pipeline;

import java.util.Objects;

/**
 * One piece of in-flight data: an immutable payload, the id of the run that created it,
 * and its trace.
 */
public record WorkUnit(Payload payload, String origin, Trace trace) {

    public WorkUnit {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(trace, "trace");
    }

    public static WorkUnit of(Payload payload, String origin) {
        return new WorkUnit(payload, origin, Trace.empty());
    }

    public WorkUnit declinedBy(String stage) {
        return new WorkUnit(payload, origin, trace.withDecline(stage));
    }

    public WorkUnit withTotalStages(int stages) {
        return new WorkUnit(payload, origin, trace.withTotalStages(stages));
    }

    public boolean exhausted() {
        return trace.exhausted();
    }

    /**
     * Convenience for stages that only handle one payload type.
     */
    public <T extends Payload> T payloadAs(Class<T> type) {
        return type.cast(payload);
    }
}
