package com.challenges.stagedb.pipeline;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Bookkeeping carried next to a payload. Never changed in place: every update returns a
 * new trace.
 *
 * @param declinedBy    stages that declined the unit, in visiting order, without duplicates
 * @param transformedBy stages that transformed the unit's ancestors, oldest first
 * @param history       before/after snapshots, recorded at {@link TraceLevel#DETAILED}
 * @param totalStages   pipeline length, set each time the unit is dequeued
 */
public record Trace(ImmutableList<String> declinedBy,
                    ImmutableList<String> transformedBy,
                    ImmutableList<Step> history,
                    int totalStages) {

    public record Step(String stage, String before, String after) {
    }

    public static Trace empty() {
        return new Trace(Lists.immutable.empty(), Lists.immutable.empty(), Lists.immutable.empty(), 0);
    }

    public Trace withDecline(String stage) {
        if (declinedBy.contains(stage)) {
            return this;
        }
        return new Trace(declinedBy.newWith(stage), transformedBy, history, totalStages);
    }

    public Trace withTotalStages(int stages) {
        return new Trace(declinedBy, transformedBy, history, stages);
    }

    /**
     * Trace of a unit emitted by {@code stage} while transforming the owner of this trace.
     * Declines do not carry over.
     */
    public Trace derive(String stage, String before, String after, TraceLevel level) {
        ImmutableList<String> transformed = level == TraceLevel.NONE ? transformedBy : transformedBy.newWith(stage);
        ImmutableList<Step> steps = level == TraceLevel.DETAILED ? history.newWith(new Step(stage, before, after)) : history;
        return new Trace(Lists.immutable.empty(), transformed, steps, 0);
    }

    public boolean exhausted() {
        return declinedBy.size() == totalStages;
    }
}
